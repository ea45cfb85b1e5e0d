package com.example.catalog_import.service.source.xtream;

/**
 * A live channel, VOD title or series as listed by the panel. For series {@code id} is the series id
 * and {@code icon} the cover.
 */
public record XtreamStream(
        XtreamContentKind kind,
        String id,
        String name,
        String categoryId,
        String icon,
        String containerExtension
) {
}
