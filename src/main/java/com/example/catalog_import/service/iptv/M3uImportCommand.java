package com.example.catalog_import.service.iptv;

import java.util.List;

public record M3uImportCommand(
        String redisKey,
        String m3uUrl,
        List<M3uOverride> overrides,
        boolean saveSource,
        String sourceName,
        boolean isPublic
) {
    public M3uImportCommand {
        overrides = overrides == null ? List.of() : List.copyOf(overrides);
    }
}
