package com.example.catalog_import.dto.web;

import com.example.catalog_import.model.IptvSource;
import com.example.catalog_import.util.IptvSourceType;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/** Saved source without its password. */
public record IptvSourceResponse(
        UUID id,
        String name,
        IptvSourceType sourceType,
        String m3uUrl,
        String server,
        String username,
        boolean isPublic,
        boolean active,
        boolean importLive,
        boolean importVod,
        boolean importSeries,
        List<String> liveCategoryIds,
        List<String> vodCategoryIds,
        List<String> seriesCategoryIds,
        Instant lastSyncedAt,
        Map<String, Integer> lastSyncStats,
        Instant createdAt
) {
    public static IptvSourceResponse of(IptvSource s) {
        return new IptvSourceResponse(s.getId(), s.getName(), s.getSourceType(), s.getM3uUrl(), s.getServer(),
                s.getUsername(), s.isPublic(), s.isActive(), s.isImportLive(), s.isImportVod(), s.isImportSeries(),
                s.getLiveCategoryIds(), s.getVodCategoryIds(), s.getSeriesCategoryIds(), s.getLastSyncedAt(),
                s.getLastSyncStats(), s.getCreatedAt());
    }
}
