package com.example.catalog_import.service.iptv;

import com.example.catalog_import.config.ImportProperties;
import com.example.catalog_import.dto.ImportError;
import com.example.catalog_import.dto.ImportOutcome;
import com.example.catalog_import.service.importer.AnalysisCache;
import com.example.catalog_import.service.importer.CatalogWrite;
import com.example.catalog_import.service.importer.InMemoryCatalogStore;
import com.example.catalog_import.service.importer.PlaylistEntryImporter;
import com.example.catalog_import.service.importer.StreamImporter;
import com.example.catalog_import.service.job.ImportJobService;
import com.example.catalog_import.service.job.ImportJobView;
import com.example.catalog_import.service.job.InMemoryImportJobStore;
import com.example.catalog_import.service.job.JobProgress;
import com.example.catalog_import.service.match.CatalogMatcher;
import com.example.catalog_import.service.source.AnalysisException;
import com.example.catalog_import.service.source.SourceFiles;
import com.example.catalog_import.service.source.xtream.XtreamAccount;
import com.example.catalog_import.service.source.xtream.XtreamCatalog;
import com.example.catalog_import.service.source.xtream.XtreamCategory;
import com.example.catalog_import.service.source.xtream.XtreamClient;
import com.example.catalog_import.service.source.xtream.XtreamContentKind;
import com.example.catalog_import.service.source.xtream.XtreamCredentials;
import com.example.catalog_import.service.source.xtream.XtreamEpisode;
import com.example.catalog_import.service.source.xtream.XtreamStream;
import com.example.catalog_import.util.ImportErrorType;
import com.example.catalog_import.util.ImportJobType;
import com.example.catalog_import.util.ImportStatus;
import com.example.catalog_import.util.MetaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class XtreamImportServiceTest {
    private static final XtreamCredentials CREDENTIALS =
            new XtreamCredentials("http://panel.example:8080/player_api.php", "user", "pass");

    @Mock
    private XtreamClient client;

    @Mock
    private IptvSourceService sourceService;

    private ImportProperties properties;
    private InMemoryCatalogStore store;
    private InMemoryImportJobStore jobStore;
    private AnalysisCache cache;
    private XtreamImportService service;

    @BeforeEach
    void setUp() {
        properties = new ImportProperties();
        Clock clock = Clock.fixed(Instant.parse("2025-04-01T08:00:00Z"), ZoneOffset.UTC);
        store = new InMemoryCatalogStore();
        jobStore = new InMemoryImportJobStore();
        cache = new AnalysisCache(properties, clock);
        CatalogMatcher matcher = new CatalogMatcher(store, List.of(), clock);
        PlaylistEntryImporter entryImporter = new PlaylistEntryImporter(new StreamImporter(store, List.of()), matcher);
        service = new XtreamImportService(client, cache, entryImporter, new ImportJobService(jobStore),
                sourceService, properties, new ObjectMapper());
    }

    private static XtreamCatalog catalog() {
        List<XtreamStream> live = List.of(
                new XtreamStream(XtreamContentKind.LIVE, "11", "BBC One", "1", null, null),
                new XtreamStream(XtreamContentKind.LIVE, "12", "CNN", "2", null, null));
        List<XtreamStream> vod = List.of(
                new XtreamStream(XtreamContentKind.VOD, "101", "Heat (1995)", "10", null, "mp4"),
                new XtreamStream(XtreamContentKind.VOD, "102", "Untitled Cut", "11", null, null));
        List<XtreamStream> series = List.of(
                new XtreamStream(XtreamContentKind.SERIES, "501", "The Office", "20", "http://img.example/office.jpg", null));
        return new XtreamCatalog(CREDENTIALS,
                new XtreamAccount("Active", "1767225600", 2, 0, false),
                Map.of(XtreamContentKind.LIVE, List.of(new XtreamCategory("1", "UK", 1), new XtreamCategory("2", "US", 1)),
                        XtreamContentKind.VOD, List.of(new XtreamCategory("10", "Action", 1), new XtreamCategory("11", "Misc", 1)),
                        XtreamContentKind.SERIES, List.of(new XtreamCategory("20", "Comedy", 1))),
                Map.of(XtreamContentKind.LIVE, live, XtreamContentKind.VOD, vod, XtreamContentKind.SERIES, series));
    }

    private static XtreamImportCommand command(String handle, boolean live, boolean vod, boolean series,
                                               List<String> liveCats) {
        return new XtreamImportCommand(handle, null, false, false, live, vod, series, liveCats, null, null);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Integer> stats(ImportOutcome outcome) {
        return (Map<String, Integer>) outcome.details().get("stats");
    }

    private CatalogWrite writeForUrl(String url) {
        return store.writeForIdentity(SourceFiles.urlIdentity(url)).orElseThrow();
    }

    @Test
    void analyzeCachesCatalogAndReturnsCategories() {
        when(client.fetchCatalog(CREDENTIALS)).thenReturn(catalog());

        XtreamAnalysisResult result = service.analyze(CREDENTIALS);

        assertThat(result.status()).isEqualTo("success");
        assertThat(result.summary()).containsEntry("live", 2).containsEntry("vod", 2).containsEntry("series", 1);
        assertThat(result.liveCategories()).extracting(XtreamCategory::name).containsExactly("UK", "US");
        assertThat(cache.get(result.redisKey(), XtreamCatalog.class)).isPresent();
    }

    @Test
    void importsLiveAndVodWithParsedTitleYear() {
        String handle = cache.put(AnalysisCache.XTREAM, catalog());

        ImportOutcome outcome = service.importPanel(command(handle, true, true, false, null), "alice");

        assertThat(outcome.status()).isEqualTo(ImportStatus.SUCCESS);
        assertThat(stats(outcome)).containsEntry("tv", 2).containsEntry("movie", 2).containsEntry("failed", 0);
        CatalogWrite heat = writeForUrl("http://panel.example:8080/movie/user/pass/101.mp4");
        assertThat(heat.primary().type()).isEqualTo(MetaType.MOVIE);
        assertThat(heat.primary().externalId()).isEqualTo("user:movie:heat-1995");
        assertThat(writeForUrl("http://panel.example:8080/movie/user/pass/102.mkv").primary().externalId())
                .isEqualTo("user:movie:untitled-cut");
        assertThat(writeForUrl("http://panel.example:8080/live/user/pass/11.ts").primary().externalId())
                .isEqualTo("tv:bbc-one");
        assertThat(cache.get(handle, XtreamCatalog.class)).isEmpty();
        verify(sourceService).recordSync(isNull(), any());
        verifyNoInteractions(client);
    }

    @Test
    void categoryFilterRestrictsLiveStreams() {
        String handle = cache.put(AnalysisCache.XTREAM, catalog());

        ImportOutcome outcome = service.importPanel(command(handle, true, false, false, List.of("2")), "alice");

        assertThat(stats(outcome)).containsEntry("tv", 1);
        assertThat(store.streamCount()).isEqualTo(1);
        assertThat(writeForUrl("http://panel.example:8080/live/user/pass/12.ts").primary().externalId())
                .isEqualTo("tv:cnn");
    }

    @Test
    void seriesExpandIntoOneStreamPerEpisode() {
        when(client.seriesEpisodes(CREDENTIALS, "501")).thenReturn(List.of(
                new XtreamEpisode("9001", 1, 1, "Pilot", "mkv"),
                new XtreamEpisode("9002", 1, 2, "Diversity Day", "mkv"),
                new XtreamEpisode("9010", 2, 1, null, "mp4")));
        JobProgress progress = JobProgress.detached(1, XtreamImportService.STAT_KEYS);

        service.importCatalog(catalog(), new XtreamSelection(false, false, true, null, null, null), null, progress);

        assertThat(progress.total()).isEqualTo(3);
        assertThat(progress.processed()).isEqualTo(3);
        assertThat(progress.count("series")).isEqualTo(3);
        CatalogWrite second = writeForUrl("http://panel.example:8080/series/user/pass/9002.mkv");
        assertThat(second.item().displayName()).isEqualTo("The Office S01E02");
        assertThat(second.primary().externalId()).isEqualTo("user:series:the-office");
        assertThat(second.files()).singleElement().satisfies(f -> {
            assertThat(f.season()).isEqualTo(1);
            assertThat(f.episode()).isEqualTo(2);
        });
        assertThat(writeForUrl("http://panel.example:8080/series/user/pass/9010.mp4").files().get(0).season())
                .isEqualTo(2);
    }

    @Test
    void unavailableOrEmptySeriesAreCounted() {
        XtreamCatalog catalog = new XtreamCatalog(CREDENTIALS, null, Map.of(),
                Map.of(XtreamContentKind.SERIES, List.of(
                        new XtreamStream(XtreamContentKind.SERIES, "1", "Broken", "20", null, null),
                        new XtreamStream(XtreamContentKind.SERIES, "2", "Empty", "20", null, null))));
        when(client.seriesEpisodes(CREDENTIALS, "1")).thenThrow(AnalysisException.unreachable("HTTP 500", null));
        when(client.seriesEpisodes(CREDENTIALS, "2")).thenReturn(List.of());
        JobProgress progress = JobProgress.detached(2, XtreamImportService.STAT_KEYS);

        service.importCatalog(catalog, new XtreamSelection(false, false, true, null, null, null), null, progress);

        assertThat(progress.count("failed")).isEqualTo(1);
        assertThat(progress.count("skipped")).isEqualTo(1);
        assertThat(progress.processed()).isEqualTo(2);
        assertThat(store.streamCount()).isZero();
    }

    @Test
    void largeSelectionRunsInBackgroundJob() {
        properties.setBackgroundThreshold(3);
        String handle = cache.put(AnalysisCache.XTREAM, catalog());

        ImportOutcome outcome = service.importPanel(command(handle, true, true, true, null), "alice");

        assertThat(outcome.status()).isEqualTo(ImportStatus.PROCESSING);
        assertThat(outcome.details()).containsEntry("total_items", 5).containsEntry("background", true);
        ImportJobView job = jobStore.get(outcome.jobId()).orElseThrow();
        assertThat(job.type()).isEqualTo(ImportJobType.XTREAM);
        assertThat(job.payload()).containsKeys("credentials", "selection");
        assertThat(store.streamCount()).isZero();
        verifyNoInteractions(client);
    }

    @Test
    void rejectsMissingExpiredOrEmptySelection() {
        String handle = cache.put(AnalysisCache.XTREAM, catalog());

        ImportOutcome missing = service.importPanel(command(null, true, false, false, null), "alice");
        ImportOutcome expired = service.importPanel(command("xtream_gone", true, false, false, null), "alice");
        ImportOutcome nothing = service.importPanel(command(handle, false, false, false, null), "alice");

        assertThat(missing.errors()).extracting(ImportError::type).containsExactly(ImportErrorType.MALFORMED_INPUT);
        assertThat(expired.errors()).extracting(ImportError::type).containsExactly(ImportErrorType.ANALYSIS_EXPIRED);
        assertThat(nothing.errors()).extracting(ImportError::type).containsExactly(ImportErrorType.MALFORMED_INPUT);
        assertThat(cache.get(handle, XtreamCatalog.class)).isPresent();
        verifyNoInteractions(sourceService);
    }
}
