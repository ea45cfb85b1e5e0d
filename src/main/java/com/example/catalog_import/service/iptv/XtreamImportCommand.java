package com.example.catalog_import.service.iptv;

import java.util.List;

/**
 * Import of an analyzed panel. Category id lists restrict each tree; empty lists import everything in it.
 */
public record XtreamImportCommand(
        String redisKey,
        String sourceName,
        boolean saveSource,
        boolean isPublic,
        boolean importLive,
        boolean importVod,
        boolean importSeries,
        List<String> liveCategoryIds,
        List<String> vodCategoryIds,
        List<String> seriesCategoryIds
) {
    public XtreamSelection selection() {
        return new XtreamSelection(importLive, importVod, importSeries, liveCategoryIds, vodCategoryIds,
                seriesCategoryIds);
    }
}
