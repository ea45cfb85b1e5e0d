package com.example.catalog_import.service.annotation;

/**
 * Per-file override sent back by the client. Null fields leave the current value alone.
 */
public record FileAnnotation(
        int index,
        Integer season,
        Integer episode,
        Integer episodeEnd,
        Boolean included,
        String metaId
) {
}
