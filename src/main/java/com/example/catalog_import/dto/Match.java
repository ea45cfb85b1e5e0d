package com.example.catalog_import.dto;

import com.example.catalog_import.util.MatchConfidence;
import com.example.catalog_import.util.MetaType;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * A ranked candidate media identity for an analyzed item.
 *
 * @param mediaId      catalog id when the candidate is already catalogued, otherwise {@code null}
 * @param cataloguedAt when the catalog record was created, used as the last tie-breaker
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Match(
        String externalId,
        String title,
        Integer year,
        String posterUrl,
        MetaType type,
        MatchConfidence confidence,
        Double popularity,
        Instant cataloguedAt,
        UUID mediaId,
        Double rating,
        List<String> genres,
        String description
) {
    public Match withConfidence(MatchConfidence confidence) {
        return new Match(externalId, title, year, posterUrl, type, confidence, popularity, cataloguedAt, mediaId,
                rating, genres, description);
    }

    /** Fills gaps in this candidate with provider data for the same external id. */
    public Match enrich(Match other) {
        if (other == null) {
            return this;
        }
        return new Match(
                externalId,
                title != null ? title : other.title,
                year != null ? year : other.year,
                posterUrl != null ? posterUrl : other.posterUrl,
                type != null ? type : other.type,
                confidence,
                popularity != null ? popularity : other.popularity,
                cataloguedAt != null ? cataloguedAt : other.cataloguedAt,
                mediaId != null ? mediaId : other.mediaId,
                rating != null ? rating : other.rating,
                genres != null && !genres.isEmpty() ? genres : other.genres,
                description != null ? description : other.description
        );
    }
}
