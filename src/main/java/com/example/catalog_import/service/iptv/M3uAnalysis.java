package com.example.catalog_import.service.iptv;

import com.example.catalog_import.service.importer.PlaylistItem;

import java.util.List;
import java.util.Map;

/** Parsed playlist stored behind an {@code m3u_…} handle. */
public record M3uAnalysis(List<PlaylistItem> entries, Map<String, Integer> summary, String sourceUrl) {
    public M3uAnalysis {
        entries = List.copyOf(entries);
        summary = Map.copyOf(summary);
    }
}
