package com.example.catalog_import.service.match;

import com.example.catalog_import.dto.Match;
import com.example.catalog_import.service.importer.CatalogMedia;
import com.example.catalog_import.service.importer.CatalogStore;
import com.example.catalog_import.util.MatchConfidence;
import com.example.catalog_import.util.MetaType;
import com.example.catalog_import.util.TitleSimilarity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Ranks candidate media for a parsed title. Catalog hits come first in discovery order (exact title and year,
 * exact title with a nearby or unknown year, fuzzy title); provider results are merged in by external id.
 * Never selects a candidate on its own.
 */
@Service
public class CatalogMatcher {
    private static final Logger LOGGER = LoggerFactory.getLogger(CatalogMatcher.class);
    private static final Duration PROVIDER_CACHE_TTL = Duration.ofMinutes(10);
    private static final double FUZZY_THRESHOLD = 0.5;
    private static final int FUZZY_SEARCH_LIMIT = 20;

    static final Comparator<Match> RANKING = Comparator
            .comparingInt((Match m) -> m.confidence().rank())
            .thenComparing(Match::popularity, Comparator.nullsLast(Comparator.reverseOrder()))
            .thenComparing(Match::cataloguedAt, Comparator.nullsLast(Comparator.reverseOrder()));

    private final CatalogStore catalogStore;
    private final List<MetadataSearchProvider> providers;
    private final Clock clock;
    private final Map<String, CacheEntry> providerCache = new ConcurrentHashMap<>();

    public CatalogMatcher(CatalogStore catalogStore, List<MetadataSearchProvider> providers, Clock clock) {
        this.catalogStore = catalogStore;
        this.providers = providers;
        this.clock = clock;
    }

    public List<Match> match(String title, Integer year, MetaType type) {
        String normalized = TitleSimilarity.normalize(title);
        if (normalized.isEmpty()) {
            return List.of();
        }
        MetaType effectiveType = type == null ? MetaType.MOVIE : type;
        Map<String, Match> merged = new LinkedHashMap<>();

        for (CatalogMedia media : catalogStore.findMediaCandidates(normalized, effectiveType)) {
            MatchConfidence confidence = classify(normalized, year, media.title(), media.year());
            if (confidence != null) {
                merge(merged, media.toMatch(confidence));
            }
        }
        String fragment = longestToken(normalized);
        for (CatalogMedia media : catalogStore.searchMediaByTitle(fragment, effectiveType, FUZZY_SEARCH_LIMIT)) {
            MatchConfidence confidence = classify(normalized, year, media.title(), media.year());
            if (confidence != null) {
                merge(merged, media.toMatch(confidence));
            }
        }
        if (effectiveType != MetaType.TV) {
            for (Match candidate : providerResults(title, year, effectiveType)) {
                MatchConfidence confidence = classify(normalized, year, candidate.title(), candidate.year());
                if (confidence != null) {
                    merge(merged, candidate.withConfidence(confidence));
                }
            }
        }

        List<Match> ranked = new ArrayList<>(merged.values());
        ranked.sort(RANKING);
        return ranked;
    }

    /** The candidate that may be accepted without asking: the only EXACT match, if there is exactly one. */
    public static Match autoSelect(List<Match> ranked) {
        List<Match> exact = ranked.stream().filter(m -> m.confidence() == MatchConfidence.EXACT).toList();
        return exact.size() == 1 ? exact.get(0) : null;
    }

    static MatchConfidence classify(String normalizedQuery, Integer queryYear, String candidateTitle,
                                    Integer candidateYear) {
        String candidate = TitleSimilarity.normalize(candidateTitle);
        if (candidate.isEmpty()) {
            return null;
        }
        if (candidate.equals(normalizedQuery)) {
            if (queryYear != null && Objects.equals(queryYear, candidateYear)) {
                return MatchConfidence.EXACT;
            }
            if (queryYear == null || candidateYear == null || Math.abs(queryYear - candidateYear) <= 1) {
                return MatchConfidence.YEAR_NEAR;
            }
            return MatchConfidence.FUZZY;
        }
        return TitleSimilarity.similarity(normalizedQuery, candidate) >= FUZZY_THRESHOLD ? MatchConfidence.FUZZY : null;
    }

    private static void merge(Map<String, Match> merged, Match incoming) {
        merged.merge(incoming.externalId(), incoming, (existing, fresh) -> {
            Match best = existing.confidence().rank() <= fresh.confidence().rank() ? existing : fresh;
            return best.enrich(best == existing ? fresh : existing);
        });
    }

    private List<Match> providerResults(String title, Integer year, MetaType type) {
        String key = type.id() + "|" + TitleSimilarity.normalize(title) + "|" + year;
        Instant now = clock.instant();
        CacheEntry cached = providerCache.get(key);
        if (cached != null && !cached.isExpired(now)) {
            return cached.matches();
        }
        List<Match> results = new ArrayList<>();
        boolean complete = true;
        for (MetadataSearchProvider provider : providers) {
            try {
                results.addAll(provider.search(title, year, type));
            } catch (MetadataAccessException ex) {
                complete = false;
                LOGGER.warn("Metadata provider {} failed title={} year={}: {}",
                        provider.getClass().getSimpleName(), title, year, ex.getMessage());
            }
        }
        if (!complete) {
            return results;
        }
        providerCache.values().removeIf(entry -> entry.isExpired(now));
        providerCache.put(key, new CacheEntry(List.copyOf(results), now.plus(PROVIDER_CACHE_TTL)));
        return results;
    }

    @Scheduled(fixedDelayString = "${importer.analysis-cache-sweep-ms:300000}")
    public void evictExpired() {
        Instant now = clock.instant();
        int before = providerCache.size();
        providerCache.values().removeIf(entry -> entry.isExpired(now));
        int evicted = before - providerCache.size();
        if (evicted > 0) {
            LOGGER.debug("Provider cache evicted={} remaining={}", evicted, providerCache.size());
        }
    }

    int cachedQueries() {
        return providerCache.size();
    }

    private static String longestToken(String normalized) {
        return Arrays.stream(normalized.split(" "))
                .max(Comparator.comparingInt(String::length))
                .orElse(normalized);
    }

    private record CacheEntry(List<Match> matches, Instant expiresAt) {
        boolean isExpired(Instant now) {
            return !now.isBefore(expiresAt);
        }
    }
}
