package com.example.catalog_import.service.iptv;

import com.example.catalog_import.config.ImportProperties;
import com.example.catalog_import.dto.ImportOutcome;
import com.example.catalog_import.dto.ImportResultItem;
import com.example.catalog_import.dto.Match;
import com.example.catalog_import.model.IptvSource;
import com.example.catalog_import.service.importer.AnalysisCache;
import com.example.catalog_import.service.importer.PlaylistEntryImporter;
import com.example.catalog_import.service.importer.PlaylistItem;
import com.example.catalog_import.service.job.ImportJobService;
import com.example.catalog_import.service.job.JobProgress;
import com.example.catalog_import.service.match.CatalogMatcher;
import com.example.catalog_import.service.source.AnalysisException;
import com.example.catalog_import.service.source.m3u.M3uEntry;
import com.example.catalog_import.service.source.m3u.M3uParser;
import com.example.catalog_import.service.source.web.SourceFetcher;
import com.example.catalog_import.util.ImportErrorType;
import com.example.catalog_import.util.ImportJobType;
import com.example.catalog_import.util.M3uContentType;
import com.example.catalog_import.util.MetaType;
import com.example.catalog_import.util.SourceKind;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Analyze-then-import flow for M3U playlists. Large playlists are handed to an {@code m3u} background job.
 */
@Service
public class M3uImportService {
    private static final Logger LOGGER = LoggerFactory.getLogger(M3uImportService.class);
    public static final List<String> STAT_KEYS = List.of("tv", "movie", "series", "skipped", "failed");
    static final String PAYLOAD_ENTRIES = "entries";

    private final SourceFetcher fetcher;
    private final AnalysisCache cache;
    private final CatalogMatcher matcher;
    private final PlaylistEntryImporter entryImporter;
    private final ImportJobService jobService;
    private final IptvSourceService sourceService;
    private final ImportProperties properties;
    private final ObjectMapper objectMapper;

    public M3uImportService(SourceFetcher fetcher,
                            AnalysisCache cache,
                            CatalogMatcher matcher,
                            PlaylistEntryImporter entryImporter,
                            ImportJobService jobService,
                            IptvSourceService sourceService,
                            ImportProperties properties,
                            ObjectMapper objectMapper) {
        this.fetcher = fetcher;
        this.cache = cache;
        this.matcher = matcher;
        this.entryImporter = entryImporter;
        this.jobService = jobService;
        this.sourceService = sourceService;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    /**
     * Parses a playlist given by URL or raw content, caches the entries and returns a preview of the first
     * entries with their best catalog match.
     */
    public M3uAnalysisResult analyze(String m3uUrl, String content) {
        String body = content;
        if (body == null || body.isBlank()) {
            if (m3uUrl == null || m3uUrl.isBlank()) {
                throw AnalysisException.malformed("Either m3u_url or m3u_file is required");
            }
            body = fetcher.fetchString(m3uUrl);
        }
        List<M3uEntry> entries = M3uParser.parse(body);
        List<PlaylistItem> items = toItems(entries);
        Map<String, Integer> summary = summarize(items);
        String handle = cache.put(AnalysisCache.M3U, new M3uAnalysis(items, summary, blankToNull(m3uUrl)));

        List<M3uChannelPreview> previews = new ArrayList<>();
        int limit = Math.min(properties.getPreviewLimit(), entries.size());
        for (int i = 0; i < limit; i++) {
            previews.add(preview(entries.get(i)));
        }
        LOGGER.info("M3U ANALYZE handle={} total={} summary={}", handle, items.size(), summary);
        return new M3uAnalysisResult("success", handle, items.size(), previews, summary);
    }

    /**
     * Imports a previously analyzed playlist (or fetches {@code m3u_url} again), applying per-entry overrides.
     */
    public ImportOutcome importPlaylist(M3uImportCommand command, String owner) {
        List<PlaylistItem> items;
        String sourceUrl;
        try {
            if (command.redisKey() != null && !command.redisKey().isBlank()) {
                Optional<M3uAnalysis> cached = cache.get(command.redisKey(), M3uAnalysis.class);
                if (cached.isEmpty()) {
                    return ImportOutcome.error(ImportErrorType.ANALYSIS_EXPIRED,
                            "Playlist analysis expired or unknown; analyze it again");
                }
                items = cached.get().entries();
                sourceUrl = cached.get().sourceUrl() != null ? cached.get().sourceUrl() : blankToNull(command.m3uUrl());
            } else if (command.m3uUrl() != null && !command.m3uUrl().isBlank()) {
                items = toItems(M3uParser.parse(fetcher.fetchString(command.m3uUrl())));
                sourceUrl = command.m3uUrl().trim();
            } else {
                return ImportOutcome.error(ImportErrorType.MALFORMED_INPUT, "Either redis_key or m3u_url is required");
            }
        } catch (AnalysisException ex) {
            return ImportOutcome.error(ex.getType(), ex.getMessage());
        }
        items = applyOverrides(items, command.overrides());

        IptvSource saved = null;
        if (command.saveSource() && sourceUrl != null) {
            sourceService.ensureEnabled();
            saved = sourceService.saveM3uSource(owner, command.sourceName(), sourceUrl, command.isPublic());
        }
        UUID sourceId = saved != null ? saved.getId() : null;

        if (items.size() > properties.getBackgroundThreshold()) {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put(PAYLOAD_ENTRIES, objectMapper.convertValue(items, List.class));
            if (sourceId != null) {
                payload.put("source_id", sourceId.toString());
            }
            UUID jobId = jobService.enqueue(ImportJobType.M3U, items.size(), payload, sourceId);
            if (command.redisKey() != null) {
                cache.remove(command.redisKey());
            }
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("job_id", jobId);
            details.put("total_items", items.size());
            details.put("background", true);
            return ImportOutcome.processing(jobId,
                    "Importing " + items.size() + " playlist entries in the background", details);
        }

        JobProgress progress = JobProgress.detached(items.size(), STAT_KEYS);
        importEntries(items, sourceId, progress);
        sourceService.recordSync(sourceId, progress.stats());
        if (command.redisKey() != null) {
            cache.remove(command.redisKey());
        }
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("stats", progress.stats());
        details.put("source_saved", saved != null);
        if (sourceId != null) {
            details.put("source_id", sourceId);
        }
        return ImportOutcome.completed("Imported " + progress.processed() + " playlist entries", details);
    }

    /** Imports every entry; a failing entry is counted as {@code failed} and the rest continue. */
    public void importEntries(List<PlaylistItem> items, UUID sourceId, JobProgress progress) {
        for (PlaylistItem item : items) {
            try {
                ImportResultItem result = entryImporter.importEntry(item, sourceId);
                progress.record(PlaylistEntryImporter.statKey(item, result));
            } catch (RuntimeException ex) {
                LOGGER.warn("M3U entry {} failed: {}", item.index(), ex.getMessage());
                progress.record("failed");
            }
        }
    }

    List<PlaylistItem> readPayload(Map<String, Object> payload) {
        Object raw = payload.get(PAYLOAD_ENTRIES);
        if (raw == null) {
            return List.of();
        }
        return objectMapper.convertValue(raw, new TypeReference<List<PlaylistItem>>() {});
    }

    public static List<PlaylistItem> toItems(List<M3uEntry> entries) {
        List<PlaylistItem> items = new ArrayList<>(entries.size());
        for (M3uEntry e : entries) {
            items.add(new PlaylistItem(SourceKind.M3U, e.index(), e.name(), e.url(), e.logo(), e.groupTitle(),
                    e.genres(), e.detectedType(), e.parsedTitle(), e.parsedYear(), e.season(), e.episode(), null));
        }
        return items;
    }

    static List<PlaylistItem> applyOverrides(List<PlaylistItem> items, List<M3uOverride> overrides) {
        if (overrides.isEmpty()) {
            return items;
        }
        Map<Integer, M3uOverride> byIndex = new LinkedHashMap<>();
        overrides.forEach(o -> byIndex.put(o.index(), o));
        List<PlaylistItem> result = new ArrayList<>(items.size());
        for (PlaylistItem item : items) {
            M3uOverride override = byIndex.get(item.index());
            result.add(override == null ? item : item.withOverride(override.type(), blankToNull(override.mediaId())));
        }
        return result;
    }

    static Map<String, Integer> summarize(List<PlaylistItem> items) {
        Map<String, Integer> summary = new LinkedHashMap<>();
        for (M3uContentType type : M3uContentType.values()) {
            summary.put(type.id(), 0);
        }
        items.forEach(item -> summary.merge(item.type().id(), 1, Integer::sum));
        return summary;
    }

    private M3uChannelPreview preview(M3uEntry entry) {
        Match matched = null;
        MetaType metaType = entry.detectedType().toMetaType();
        if (metaType == MetaType.MOVIE || metaType == MetaType.SERIES) {
            String title = entry.parsedTitle() != null ? entry.parsedTitle() : entry.name();
            try {
                List<Match> candidates = matcher.match(title, entry.parsedYear(), metaType);
                matched = candidates.isEmpty() ? null : candidates.get(0);
            } catch (RuntimeException ex) {
                LOGGER.warn("Preview match failed for '{}': {}", title, ex.getMessage());
            }
        }
        return new M3uChannelPreview(entry.index(), entry.name(), entry.url(), entry.logo(), entry.genres(),
                entry.country(), entry.detectedType(), matched, entry.season(), entry.episode(),
                entry.parsedTitle(), entry.parsedYear());
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
