package com.example.catalog_import.service.rss;

import com.example.catalog_import.util.MetaType;

public record RssFeedRequest(
        String name,
        String url,
        String includePattern,
        String excludePattern,
        Long minSizeBytes,
        Long maxSizeBytes,
        MetaType defaultMetaType,
        Boolean autoImport,
        Boolean active
) {
}
