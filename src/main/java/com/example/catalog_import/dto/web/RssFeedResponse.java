package com.example.catalog_import.dto.web;

import com.example.catalog_import.model.UserRssFeed;
import com.example.catalog_import.util.MetaType;

import java.time.Instant;
import java.util.UUID;

public record RssFeedResponse(
        UUID id,
        String name,
        String url,
        String includePattern,
        String excludePattern,
        Long minSizeBytes,
        Long maxSizeBytes,
        MetaType defaultMetaType,
        boolean autoImport,
        boolean active,
        Instant lastProcessedAt,
        Instant createdAt
) {
    public static RssFeedResponse of(UserRssFeed f) {
        return new RssFeedResponse(f.getId(), f.getName(), f.getUrl(), f.getIncludePattern(), f.getExcludePattern(),
                f.getMinSizeBytes(), f.getMaxSizeBytes(), f.getDefaultMetaType(), f.isAutoImport(), f.isActive(),
                f.getLastProcessedAt(), f.getCreatedAt());
    }
}
