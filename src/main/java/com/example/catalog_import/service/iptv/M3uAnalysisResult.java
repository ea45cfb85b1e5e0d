package com.example.catalog_import.service.iptv;

import java.util.List;
import java.util.Map;

/**
 * Playlist preview. {@code redisKey} is the handle the import call refers to; {@code channels} holds the first
 * entries only, {@code totalCount} all of them.
 */
public record M3uAnalysisResult(
        String status,
        String redisKey,
        int totalCount,
        List<M3uChannelPreview> channels,
        Map<String, Integer> summary
) {
}
