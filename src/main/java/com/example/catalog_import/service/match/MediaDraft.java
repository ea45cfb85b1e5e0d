package com.example.catalog_import.service.match;

import com.example.catalog_import.util.MetaType;

import java.util.List;

/**
 * Media metadata as returned by a provider (or built from user input) before it is catalogued.
 */
public record MediaDraft(
        String externalId,
        MetaType type,
        String title,
        Integer year,
        String posterUrl,
        String description,
        List<String> genres,
        Double popularity,
        Double rating,
        boolean userCreated
) {
    public MediaDraft {
        genres = genres == null ? List.of() : List.copyOf(genres);
    }

    public static MediaDraft basic(String externalId, MetaType type, String title, Integer year, String posterUrl,
                                   boolean userCreated) {
        return new MediaDraft(externalId, type, title, year, posterUrl, null, List.of(), null, null, userCreated);
    }
}
