package com.example.catalog_import.service.source.xtream;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Everything an analysis fetched from a panel. Cached under an {@code xtream_…} handle so the import call only
 * needs category ids.
 */
public record XtreamCatalog(
        XtreamCredentials credentials,
        XtreamAccount account,
        Map<XtreamContentKind, List<XtreamCategory>> categories,
        Map<XtreamContentKind, List<XtreamStream>> streams
) {
    public XtreamCatalog {
        categories = Map.copyOf(categories);
        streams = Map.copyOf(streams);
    }

    public List<XtreamStream> streams(XtreamContentKind kind) {
        return streams.getOrDefault(kind, List.of());
    }

    public List<XtreamCategory> categories(XtreamContentKind kind) {
        return categories.getOrDefault(kind, List.of());
    }

    /** Streams of one kind restricted to the given categories; {@code null} or empty means all of them. */
    public List<XtreamStream> select(XtreamContentKind kind, List<String> categoryIds) {
        List<XtreamStream> all = streams(kind);
        if (categoryIds == null || categoryIds.isEmpty()) {
            return all;
        }
        Set<String> wanted = Set.copyOf(categoryIds);
        return all.stream().filter(s -> wanted.contains(s.categoryId())).toList();
    }

    public Map<String, Integer> summary() {
        return Map.of(
                "live", streams(XtreamContentKind.LIVE).size(),
                "vod", streams(XtreamContentKind.VOD).size(),
                "series", streams(XtreamContentKind.SERIES).size());
    }

    static Map<String, Integer> countByCategory(List<XtreamStream> streams) {
        return streams.stream().collect(Collectors.groupingBy(s -> s.categoryId() == null ? "" : s.categoryId(),
                Collectors.summingInt(s -> 1)));
    }
}
