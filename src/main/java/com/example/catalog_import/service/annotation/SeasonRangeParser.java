package com.example.catalog_import.service.annotation;

import com.example.catalog_import.service.source.AnalysisException;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Parses season lists such as {@code "1-3,5"} into {@code [1, 2, 3, 5]}. Order is kept, duplicates dropped.
 */
public final class SeasonRangeParser {
    private static final int MAX_SEASON = 100;

    private SeasonRangeParser() {
    }

    public static List<Integer> parse(String spec) {
        if (spec == null || spec.isBlank()) {
            return List.of();
        }
        Set<Integer> seasons = new LinkedHashSet<>();
        for (String part : spec.split(",")) {
            String token = part.trim();
            if (token.isEmpty()) {
                continue;
            }
            int dash = token.indexOf('-');
            if (dash > 0) {
                int from = parseSeason(token.substring(0, dash), spec);
                int to = parseSeason(token.substring(dash + 1), spec);
                if (to < from) {
                    throw AnalysisException.malformed("Season range is descending: " + token);
                }
                for (int s = from; s <= to; s++) {
                    seasons.add(s);
                }
            } else {
                seasons.add(parseSeason(token, spec));
            }
        }
        if (seasons.isEmpty()) {
            throw AnalysisException.malformed("No seasons in '" + spec + "'");
        }
        return new ArrayList<>(seasons);
    }

    private static int parseSeason(String raw, String spec) {
        try {
            int season = Integer.parseInt(raw.trim());
            if (season < 0 || season > MAX_SEASON) {
                throw AnalysisException.malformed("Season out of range in '" + spec + "'");
            }
            return season;
        } catch (NumberFormatException ex) {
            throw AnalysisException.malformed("Invalid season list '" + spec + "'");
        }
    }
}
