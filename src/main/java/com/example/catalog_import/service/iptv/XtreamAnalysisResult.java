package com.example.catalog_import.service.iptv;

import com.example.catalog_import.service.source.xtream.XtreamAccount;
import com.example.catalog_import.service.source.xtream.XtreamCategory;

import java.util.List;
import java.util.Map;

public record XtreamAnalysisResult(
        String status,
        String redisKey,
        XtreamAccount account,
        Map<String, Integer> summary,
        List<XtreamCategory> liveCategories,
        List<XtreamCategory> vodCategories,
        List<XtreamCategory> seriesCategories
) {
}
