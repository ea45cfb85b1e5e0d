package com.example.catalog_import.service.source.torrent;

import com.example.catalog_import.dto.AnalyzedItem;
import com.example.catalog_import.util.ReleaseNameParser;
import com.example.catalog_import.util.SourceKind;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

final class TorrentItems {

    private TorrentItems() {
    }

    static AnalyzedItem fromMetainfo(SourceKind kind, TorrentMetainfo meta, MagnetLink magnet) {
        String displayName = magnet != null && magnet.displayName() != null ? magnet.displayName() : meta.name();
        ReleaseNameParser.Parsed parsed = ReleaseNameParser.parse(displayName);

        Set<String> trackers = new LinkedHashSet<>(meta.trackers());
        if (magnet != null) {
            trackers.addAll(magnet.trackers());
        }
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("trackers", List.copyOf(trackers));
        attributes.put("private", meta.privateTorrent());
        attributes.put("magnet_link", new MagnetLink(meta.infoHash(), displayName, List.copyOf(trackers), null).toUri());
        if (meta.comment() != null) {
            attributes.put("comment", meta.comment());
        }
        return new AnalyzedItem(kind, meta.infoHash(), displayName, parsed.title(), parsed.year(), parsed.release(),
                meta.totalSize(), meta.files(), List.of(), attributes);
    }

    /** Magnet whose metadata could not be fetched: the file list stays unknown. */
    static AnalyzedItem unresolved(MagnetLink magnet) {
        String displayName = magnet.displayName() != null ? magnet.displayName() : magnet.infoHash();
        ReleaseNameParser.Parsed parsed = ReleaseNameParser.parse(magnet.displayName());
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("trackers", magnet.trackers());
        attributes.put("magnet_link", magnet.toUri());
        attributes.put("metadata_resolved", false);
        return new AnalyzedItem(SourceKind.MAGNET, magnet.infoHash(), displayName, parsed.title(), parsed.year(),
                parsed.release(), magnet.exactLength(), null, List.of(), attributes);
    }
}
