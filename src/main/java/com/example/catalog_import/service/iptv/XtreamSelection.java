package com.example.catalog_import.service.iptv;

import java.util.List;

/** Which trees and categories of a panel to import; an empty category list means all. */
public record XtreamSelection(
        boolean importLive,
        boolean importVod,
        boolean importSeries,
        List<String> liveCategoryIds,
        List<String> vodCategoryIds,
        List<String> seriesCategoryIds
) {
    public XtreamSelection {
        liveCategoryIds = liveCategoryIds == null ? List.of() : List.copyOf(liveCategoryIds);
        vodCategoryIds = vodCategoryIds == null ? List.of() : List.copyOf(vodCategoryIds);
        seriesCategoryIds = seriesCategoryIds == null ? List.of() : List.copyOf(seriesCategoryIds);
    }
}
