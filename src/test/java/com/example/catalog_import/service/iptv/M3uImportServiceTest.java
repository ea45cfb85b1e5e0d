package com.example.catalog_import.service.iptv;

import com.example.catalog_import.config.ImportProperties;
import com.example.catalog_import.dto.ImportError;
import com.example.catalog_import.dto.ImportOutcome;
import com.example.catalog_import.model.IptvSource;
import com.example.catalog_import.service.importer.AnalysisCache;
import com.example.catalog_import.service.importer.CatalogWrite;
import com.example.catalog_import.service.importer.InMemoryCatalogStore;
import com.example.catalog_import.service.importer.PlaylistEntryImporter;
import com.example.catalog_import.service.importer.PlaylistItem;
import com.example.catalog_import.service.importer.StreamImporter;
import com.example.catalog_import.service.job.ImportJobService;
import com.example.catalog_import.service.job.ImportJobView;
import com.example.catalog_import.service.job.InMemoryImportJobStore;
import com.example.catalog_import.service.job.JobProgress;
import com.example.catalog_import.service.match.CatalogMatcher;
import com.example.catalog_import.service.source.SourceFiles;
import com.example.catalog_import.service.source.web.SourceFetcher;
import com.example.catalog_import.util.ImportErrorType;
import com.example.catalog_import.util.ImportJobType;
import com.example.catalog_import.util.ImportStatus;
import com.example.catalog_import.util.M3uContentType;
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
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class M3uImportServiceTest {
    private static final String PLAYLIST_URL = "http://provider.example/get.php?type=m3u";

    @Mock
    private SourceFetcher fetcher;

    @Mock
    private IptvSourceService sourceService;

    private ImportProperties properties;
    private InMemoryCatalogStore store;
    private InMemoryImportJobStore jobStore;
    private AnalysisCache cache;
    private M3uImportService service;

    @BeforeEach
    void setUp() {
        properties = new ImportProperties();
        Clock clock = Clock.fixed(Instant.parse("2025-04-01T08:00:00Z"), ZoneOffset.UTC);
        store = new InMemoryCatalogStore();
        jobStore = new InMemoryImportJobStore();
        cache = new AnalysisCache(properties, clock);
        CatalogMatcher matcher = new CatalogMatcher(store, List.of(), clock);
        PlaylistEntryImporter entryImporter = new PlaylistEntryImporter(new StreamImporter(store, List.of()), matcher);
        service = new M3uImportService(fetcher, cache, matcher, entryImporter, new ImportJobService(jobStore),
                sourceService, properties, new ObjectMapper());
    }

    private static String newsPlaylist(int channels) {
        StringBuilder sb = new StringBuilder("#EXTM3U\n");
        for (int i = 0; i < channels; i++) {
            sb.append("#EXTINF:-1 tvg-id=\"ch").append(i).append("\" group-title=\"News\",Channel ").append(i).append('\n')
                    .append("http://stream.example/live/").append(i).append(".ts\n");
        }
        return sb.toString();
    }

    private CatalogWrite writeForEntry(int index) {
        return store.writeForIdentity(SourceFiles.urlIdentity("http://stream.example/live/" + index + ".ts")).orElseThrow();
    }

    @Test
    void analyzesPlaylistFromUrl() {
        when(fetcher.fetchString(PLAYLIST_URL)).thenReturn(newsPlaylist(50));

        M3uAnalysisResult result = service.analyze(PLAYLIST_URL, null);

        assertThat(result.status()).isEqualTo("success");
        assertThat(result.redisKey()).startsWith("m3u_");
        assertThat(result.totalCount()).isEqualTo(50);
        assertThat(result.channels()).hasSize(50);
        assertThat(result.summary()).containsEntry("tv", 50).containsEntry("movie", 0);
        assertThat(result.channels().get(0).matchedMedia()).isNull();
    }

    @Test
    void previewIsLimitedButCountsEverything() {
        properties.setPreviewLimit(5);

        M3uAnalysisResult result = service.analyze(null, newsPlaylist(12));

        assertThat(result.channels()).hasSize(5);
        assertThat(result.totalCount()).isEqualTo(12);
        verifyNoInteractions(fetcher);
    }

    @Test
    void importAppliesOverridesAndCountsPerType() {
        when(fetcher.fetchString(PLAYLIST_URL)).thenReturn(newsPlaylist(50));
        String handle = service.analyze(PLAYLIST_URL, null).redisKey();

        ImportOutcome outcome = service.importPlaylist(new M3uImportCommand(handle, null,
                List.of(new M3uOverride(3, M3uContentType.MOVIE, "tt1")), false, null, false), "alice");

        assertThat(outcome.status()).isEqualTo(ImportStatus.SUCCESS);
        @SuppressWarnings("unchecked")
        Map<String, Integer> stats = (Map<String, Integer>) outcome.details().get("stats");
        assertThat(stats).containsEntry("tv", 49).containsEntry("movie", 1).containsEntry("failed", 0);
        assertThat(outcome.details()).containsEntry("source_saved", false);
        assertThat(store.streamCount()).isEqualTo(50);
        assertThat(writeForEntry(3).primary().externalId()).isEqualTo("tt1");
        assertThat(writeForEntry(3).primary().type()).isEqualTo(MetaType.MOVIE);
        assertThat(writeForEntry(4).primary().externalId()).isEqualTo("tv:channel-4");
        assertThat(cache.get(handle, M3uAnalysis.class)).isEmpty();
        verify(sourceService).recordSync(isNull(), any());
    }

    @Test
    void reimportingSamePlaylistSkipsExistingStreams() {
        when(fetcher.fetchString(PLAYLIST_URL)).thenReturn(newsPlaylist(3));
        service.importPlaylist(new M3uImportCommand(null, PLAYLIST_URL, null, false, null, false), "alice");

        ImportOutcome again = service.importPlaylist(new M3uImportCommand(null, PLAYLIST_URL, null, false, null, false), "alice");

        @SuppressWarnings("unchecked")
        Map<String, Integer> stats = (Map<String, Integer>) again.details().get("stats");
        assertThat(stats).containsEntry("skipped", 3).containsEntry("tv", 0);
        assertThat(store.streamCount()).isEqualTo(3);
    }

    @Test
    void savesSourceWhenRequested() {
        when(fetcher.fetchString(PLAYLIST_URL)).thenReturn(newsPlaylist(2));
        IptvSource saved = new IptvSource();
        saved.setId(UUID.randomUUID());
        when(sourceService.saveM3uSource("alice", "My list", PLAYLIST_URL, true)).thenReturn(saved);
        String handle = service.analyze(PLAYLIST_URL, null).redisKey();

        ImportOutcome outcome = service.importPlaylist(new M3uImportCommand(handle, null, null, true, "My list", true), "alice");

        assertThat(outcome.details()).containsEntry("source_saved", true).containsEntry("source_id", saved.getId());
        verify(sourceService).ensureEnabled();
        verify(sourceService).recordSync(eq(saved.getId()), any());
    }

    @Test
    void largePlaylistsRunInBackgroundJob() {
        properties.setBackgroundThreshold(10);
        when(fetcher.fetchString(PLAYLIST_URL)).thenReturn(newsPlaylist(25));
        String handle = service.analyze(PLAYLIST_URL, null).redisKey();

        ImportOutcome outcome = service.importPlaylist(new M3uImportCommand(handle, null, null, false, null, false), "alice");

        assertThat(outcome.status()).isEqualTo(ImportStatus.PROCESSING);
        assertThat(outcome.details()).containsEntry("total_items", 25).containsEntry("background", true);
        ImportJobView job = jobStore.get(outcome.jobId()).orElseThrow();
        assertThat(job.type()).isEqualTo(ImportJobType.M3U);
        assertThat(job.total()).isEqualTo(25);
        assertThat(store.streamCount()).isZero();

        List<PlaylistItem> restored = service.readPayload(job.payload());
        assertThat(restored).hasSize(25);
        assertThat(restored.get(7).url()).isEqualTo("http://stream.example/live/7.ts");
        assertThat(restored.get(7).type()).isEqualTo(M3uContentType.TV);

        JobProgress progress = JobProgress.detached(job.total(), M3uImportService.STAT_KEYS);
        service.importEntries(restored, null, progress);
        assertThat(progress.count("tv")).isEqualTo(25);
        assertThat(store.streamCount()).isEqualTo(25);
    }

    @Test
    void missingOrExpiredAnalysisIsReported() {
        ImportOutcome expired = service.importPlaylist(new M3uImportCommand("m3u_gone", null, null, false, null, false), "alice");
        ImportOutcome nothing = service.importPlaylist(new M3uImportCommand(null, null, null, false, null, false), "alice");

        assertThat(expired.errors()).extracting(ImportError::type).containsExactly(ImportErrorType.ANALYSIS_EXPIRED);
        assertThat(nothing.errors()).extracting(ImportError::type).containsExactly(ImportErrorType.MALFORMED_INPUT);
    }

    @Test
    void unclassifiedEntriesAreSkipped() {
        String playlist = "#EXTM3U\n#EXTINF:-1,Mystery\nhttp://stream.example/play\n";

        ImportOutcome outcome = service.importPlaylist(new M3uImportCommand(
                service.analyze(null, playlist).redisKey(), null, null, false, null, false), "alice");

        @SuppressWarnings("unchecked")
        Map<String, Integer> stats = (Map<String, Integer>) outcome.details().get("stats");
        assertThat(stats).containsEntry("skipped", 1);
        assertThat(store.streamCount()).isZero();
    }
}
