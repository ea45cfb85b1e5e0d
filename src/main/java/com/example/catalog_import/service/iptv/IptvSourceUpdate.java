package com.example.catalog_import.service.iptv;

import java.util.List;

/** Partial update of a saved source; {@code null} fields are left unchanged. */
public record IptvSourceUpdate(
        String name,
        Boolean isPublic,
        Boolean active,
        Boolean importLive,
        Boolean importVod,
        Boolean importSeries,
        List<String> liveCategoryIds,
        List<String> vodCategoryIds,
        List<String> seriesCategoryIds
) {
}
