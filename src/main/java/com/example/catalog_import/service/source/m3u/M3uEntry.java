package com.example.catalog_import.service.source.m3u;

import com.example.catalog_import.util.M3uContentType;

import java.util.List;

/**
 * One playlist entry ({@code #EXTINF} line plus URL) with its classification.
 */
public record M3uEntry(
        int index,
        String name,
        String url,
        String logo,
        String groupTitle,
        List<String> genres,
        String country,
        String language,
        String tvgId,
        String tvgName,
        M3uContentType detectedType,
        String parsedTitle,
        Integer parsedYear,
        Integer season,
        Integer episode
) {
}
