package com.example.catalog_import.service.iptv;

import com.example.catalog_import.config.ImportProperties;
import com.example.catalog_import.dto.ImportOutcome;
import com.example.catalog_import.dto.ImportResultItem;
import com.example.catalog_import.model.IptvSource;
import com.example.catalog_import.service.importer.AnalysisCache;
import com.example.catalog_import.service.importer.PlaylistEntryImporter;
import com.example.catalog_import.service.importer.PlaylistItem;
import com.example.catalog_import.service.job.ImportJobService;
import com.example.catalog_import.service.job.JobProgress;
import com.example.catalog_import.service.source.AnalysisException;
import com.example.catalog_import.service.source.xtream.XtreamCatalog;
import com.example.catalog_import.service.source.xtream.XtreamClient;
import com.example.catalog_import.service.source.xtream.XtreamContentKind;
import com.example.catalog_import.service.source.xtream.XtreamCredentials;
import com.example.catalog_import.service.source.xtream.XtreamEpisode;
import com.example.catalog_import.service.source.xtream.XtreamStream;
import com.example.catalog_import.util.ImportErrorType;
import com.example.catalog_import.util.ImportJobType;
import com.example.catalog_import.util.M3uContentType;
import com.example.catalog_import.util.SourceKind;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Analyze-then-import flow for Xtream Codes panels. Live streams become channels, VOD entries movies and
 * every series episode its own stream.
 */
@Service
public class XtreamImportService {
    private static final Logger LOGGER = LoggerFactory.getLogger(XtreamImportService.class);
    public static final List<String> STAT_KEYS = List.of("tv", "movie", "series", "skipped", "failed");
    private static final Pattern TITLE_YEAR = Pattern.compile("^(.*?)\\s*\\((\\d{4})\\)");

    private final XtreamClient client;
    private final AnalysisCache cache;
    private final PlaylistEntryImporter entryImporter;
    private final ImportJobService jobService;
    private final IptvSourceService sourceService;
    private final ImportProperties properties;
    private final ObjectMapper objectMapper;

    public XtreamImportService(XtreamClient client,
                               AnalysisCache cache,
                               PlaylistEntryImporter entryImporter,
                               ImportJobService jobService,
                               IptvSourceService sourceService,
                               ImportProperties properties,
                               ObjectMapper objectMapper) {
        this.client = client;
        this.cache = cache;
        this.entryImporter = entryImporter;
        this.jobService = jobService;
        this.sourceService = sourceService;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    public XtreamAnalysisResult analyze(XtreamCredentials credentials) {
        XtreamCatalog catalog = client.fetchCatalog(credentials);
        String handle = cache.put(AnalysisCache.XTREAM, catalog);
        LOGGER.info("XTREAM ANALYZE handle={} server={} summary={}", handle, credentials.baseUrl(), catalog.summary());
        return new XtreamAnalysisResult("success", handle, catalog.account(), catalog.summary(),
                catalog.categories(XtreamContentKind.LIVE),
                catalog.categories(XtreamContentKind.VOD),
                catalog.categories(XtreamContentKind.SERIES));
    }

    public ImportOutcome importPanel(XtreamImportCommand command, String owner) {
        if (command.redisKey() == null || command.redisKey().isBlank()) {
            return ImportOutcome.error(ImportErrorType.MALFORMED_INPUT, "redis_key is required");
        }
        Optional<XtreamCatalog> cached = cache.get(command.redisKey(), XtreamCatalog.class);
        if (cached.isEmpty()) {
            return ImportOutcome.error(ImportErrorType.ANALYSIS_EXPIRED,
                    "Panel analysis expired or unknown; analyze it again");
        }
        XtreamCatalog catalog = cached.get();
        XtreamSelection selection = command.selection();
        if (!selection.importLive() && !selection.importVod() && !selection.importSeries()) {
            return ImportOutcome.error(ImportErrorType.MALFORMED_INPUT, "Nothing selected for import");
        }

        IptvSource saved = null;
        if (command.saveSource()) {
            sourceService.ensureEnabled();
            saved = sourceService.saveXtreamSource(owner, command.sourceName(), catalog.credentials(),
                    command.isPublic(), selection);
        }
        UUID sourceId = saved != null ? saved.getId() : null;

        int total = selectedCount(catalog, selection);
        cache.remove(command.redisKey());
        if (total > properties.getBackgroundThreshold()) {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("credentials", objectMapper.convertValue(catalog.credentials(), Map.class));
            payload.put("selection", objectMapper.convertValue(selection, Map.class));
            if (sourceId != null) {
                payload.put("source_id", sourceId.toString());
            }
            UUID jobId = jobService.enqueue(ImportJobType.XTREAM, total, payload, sourceId);
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("job_id", jobId);
            details.put("total_items", total);
            details.put("background", true);
            return ImportOutcome.processing(jobId, "Importing " + total + " panel entries in the background", details);
        }

        JobProgress progress = JobProgress.detached(total, STAT_KEYS);
        importCatalog(catalog, selection, sourceId, progress);
        sourceService.recordSync(sourceId, progress.stats());
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("stats", progress.stats());
        details.put("source_saved", saved != null);
        if (sourceId != null) {
            details.put("source_id", sourceId);
        }
        return ImportOutcome.completed("Imported " + progress.processed() + " panel entries", details);
    }

    /**
     * Imports the selected part of a catalog. Series count as one item until their episode list is known,
     * then the total grows by the extra episodes.
     */
    public void importCatalog(XtreamCatalog catalog, XtreamSelection selection, UUID sourceId, JobProgress progress) {
        XtreamCredentials credentials = catalog.credentials();
        int index = 0;
        if (selection.importLive()) {
            for (XtreamStream stream : catalog.select(XtreamContentKind.LIVE, selection.liveCategoryIds())) {
                PlaylistItem item = new PlaylistItem(SourceKind.XTREAM, index++, stream.name(),
                        XtreamClient.buildStreamUrl(credentials, XtreamContentKind.LIVE, stream.id(), null),
                        stream.icon(), stream.categoryId(), List.of(), M3uContentType.TV, stream.name(), null,
                        null, null, null);
                importOne(item, sourceId, progress);
            }
        }
        if (selection.importVod()) {
            for (XtreamStream stream : catalog.select(XtreamContentKind.VOD, selection.vodCategoryIds())) {
                String title = stream.name();
                Integer year = null;
                Matcher m = TITLE_YEAR.matcher(stream.name() == null ? "" : stream.name());
                if (m.find()) {
                    title = m.group(1).trim();
                    year = Integer.parseInt(m.group(2));
                }
                PlaylistItem item = new PlaylistItem(SourceKind.XTREAM, index++, stream.name(),
                        XtreamClient.buildStreamUrl(credentials, XtreamContentKind.VOD, stream.id(),
                                stream.containerExtension()),
                        stream.icon(), stream.categoryId(), List.of(), M3uContentType.MOVIE, title, year,
                        null, null, null);
                importOne(item, sourceId, progress);
            }
        }
        if (selection.importSeries()) {
            for (XtreamStream series : catalog.select(XtreamContentKind.SERIES, selection.seriesCategoryIds())) {
                List<XtreamEpisode> episodes;
                try {
                    episodes = client.seriesEpisodes(credentials, series.id());
                } catch (AnalysisException ex) {
                    LOGGER.warn("Xtream series {} episodes unavailable: {}", series.id(), ex.getMessage());
                    progress.record("failed");
                    continue;
                }
                if (episodes.isEmpty()) {
                    progress.record("skipped");
                    continue;
                }
                progress.addTotal(episodes.size() - 1);
                for (XtreamEpisode episode : episodes) {
                    String name = "%s S%02dE%02d".formatted(series.name(), episode.season(), episode.episode());
                    PlaylistItem item = new PlaylistItem(SourceKind.XTREAM, index++, name,
                            XtreamClient.buildStreamUrl(credentials, XtreamContentKind.SERIES, episode.id(),
                                    episode.containerExtension()),
                            series.icon(), series.categoryId(), List.of(), M3uContentType.SERIES, series.name(),
                            null, episode.season(), episode.episode(), null);
                    importOne(item, sourceId, progress);
                }
            }
        }
        LOGGER.info("XTREAM IMPORT server={} processed={} stats={}", credentials.baseUrl(), progress.processed(),
                progress.stats());
    }

    static int selectedCount(XtreamCatalog catalog, XtreamSelection selection) {
        int total = 0;
        if (selection.importLive()) {
            total += catalog.select(XtreamContentKind.LIVE, selection.liveCategoryIds()).size();
        }
        if (selection.importVod()) {
            total += catalog.select(XtreamContentKind.VOD, selection.vodCategoryIds()).size();
        }
        if (selection.importSeries()) {
            total += catalog.select(XtreamContentKind.SERIES, selection.seriesCategoryIds()).size();
        }
        return total;
    }

    private void importOne(PlaylistItem item, UUID sourceId, JobProgress progress) {
        try {
            ImportResultItem result = entryImporter.importEntry(item, sourceId);
            progress.record(PlaylistEntryImporter.statKey(item, result));
        } catch (RuntimeException ex) {
            LOGGER.warn("Xtream entry '{}' failed: {}", item.name(), ex.getMessage());
            progress.record("failed");
        }
    }
}
