package com.example.catalog_import.service.importer;

import com.example.catalog_import.config.ImportProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Short-lived server-side store for analysis results. Clients get an opaque handle
 * ({@code analysis_…}, {@code m3u_…}, {@code xtream_…}) instead of carrying the payload around.
 */
@Component
public class AnalysisCache {
    private static final Logger LOGGER = LoggerFactory.getLogger(AnalysisCache.class);

    public static final String ANALYSIS = "analysis";
    public static final String M3U = "m3u";
    public static final String XTREAM = "xtream";

    private final Map<String, CacheEntry> entries = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Duration ttl;

    public AnalysisCache(ImportProperties properties, Clock clock) {
        this.clock = clock;
        this.ttl = properties.getAnalysisCacheTtl();
    }

    public String put(String prefix, Object value) {
        String handle = prefix + "_" + UUID.randomUUID().toString().replace("-", "").substring(0, 12);
        entries.put(handle, new CacheEntry(value, clock.instant().plus(ttl)));
        return handle;
    }

    /** Replaces the value behind an existing handle and restarts its expiry. */
    public void update(String handle, Object value) {
        entries.put(handle, new CacheEntry(value, clock.instant().plus(ttl)));
    }

    public <T> Optional<T> get(String handle, Class<T> type) {
        if (handle == null || handle.isBlank()) {
            return Optional.empty();
        }
        CacheEntry entry = entries.get(handle);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.isExpired(clock.instant())) {
            entries.remove(handle, entry);
            return Optional.empty();
        }
        return type.isInstance(entry.value()) ? Optional.of(type.cast(entry.value())) : Optional.empty();
    }

    public void remove(String handle) {
        if (handle != null) {
            entries.remove(handle);
        }
    }

    @Scheduled(fixedDelayString = "${importer.analysis-cache-sweep-ms:300000}")
    public void evictExpired() {
        Instant now = clock.instant();
        int before = entries.size();
        entries.values().removeIf(entry -> entry.isExpired(now));
        int evicted = before - entries.size();
        if (evicted > 0) {
            LOGGER.debug("Analysis cache evicted={} remaining={}", evicted, entries.size());
        }
    }

    int size() {
        return entries.size();
    }

    private record CacheEntry(Object value, Instant expiresAt) {
        boolean isExpired(Instant now) {
            return !now.isBefore(expiresAt);
        }
    }
}
