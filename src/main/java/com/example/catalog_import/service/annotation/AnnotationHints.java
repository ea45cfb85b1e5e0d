package com.example.catalog_import.service.annotation;

import java.util.List;

/**
 * Client instructions for assigning season/episode numbers.
 *
 * @param bulkSeason        one season for every included file
 * @param seasons           season list in range syntax, e.g. {@code "1-3,5"}
 * @param episodesPerSeason used by {@link DistributionMode#MANUAL}
 * @param files             per-file overrides; these always win
 */
public record AnnotationHints(
        Integer bulkSeason,
        String seasons,
        DistributionMode mode,
        Integer episodesPerSeason,
        List<FileAnnotation> files
) {
    public AnnotationHints {
        mode = mode == null ? DistributionMode.AUTO : mode;
        files = files == null ? List.of() : List.copyOf(files);
    }

    public static AnnotationHints none() {
        return new AnnotationHints(null, null, DistributionMode.AUTO, null, List.of());
    }

    public static AnnotationHints ofFiles(List<FileAnnotation> files) {
        return new AnnotationHints(null, null, DistributionMode.AUTO, null, files);
    }

    public boolean isEmpty() {
        return bulkSeason == null && (seasons == null || seasons.isBlank()) && files.isEmpty();
    }
}
