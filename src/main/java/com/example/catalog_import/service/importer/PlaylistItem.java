package com.example.catalog_import.service.importer;

import com.example.catalog_import.util.M3uContentType;
import com.example.catalog_import.util.SourceKind;

import java.util.List;

/**
 * One playlist or panel entry ready for import. {@code mediaId} is an external id chosen by the client and
 * wins over matching.
 */
public record PlaylistItem(
        SourceKind sourceKind,
        int index,
        String name,
        String url,
        String logo,
        String group,
        List<String> genres,
        M3uContentType type,
        String title,
        Integer year,
        Integer season,
        Integer episode,
        String mediaId
) {
    public PlaylistItem {
        genres = genres == null ? List.of() : List.copyOf(genres);
        type = type == null ? M3uContentType.UNKNOWN : type;
    }

    public PlaylistItem withOverride(M3uContentType type, String mediaId) {
        return new PlaylistItem(sourceKind, index, name, url, logo, group, genres,
                type == null ? this.type : type, title, year, season, episode,
                mediaId == null ? this.mediaId : mediaId);
    }
}
