package com.example.catalog_import.service.importer;

import com.example.catalog_import.dto.Match;
import com.example.catalog_import.util.MatchConfidence;
import com.example.catalog_import.util.MetaType;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Read view of a catalogued media record.
 */
public record CatalogMedia(
        UUID id,
        String externalId,
        MetaType type,
        String title,
        Integer year,
        String posterUrl,
        Double popularity,
        Double rating,
        List<String> genres,
        String description,
        Instant createdAt
) {
    public Match toMatch(MatchConfidence confidence) {
        return new Match(externalId, title, year, posterUrl, type, confidence, popularity, createdAt, id, rating,
                genres, description);
    }
}
