package com.example.catalog_import.service.importer;

import com.example.catalog_import.config.ImportProperties;
import com.example.catalog_import.dto.AnalyzedItem;
import com.example.catalog_import.dto.FileEntry;
import com.example.catalog_import.dto.ImportError;
import com.example.catalog_import.dto.ImportOutcome;
import com.example.catalog_import.service.annotation.FileAnnotation;
import com.example.catalog_import.service.annotation.FileAnnotator;
import com.example.catalog_import.service.match.CatalogMatcher;
import com.example.catalog_import.service.source.AnalysisException;
import com.example.catalog_import.service.source.ImportSource;
import com.example.catalog_import.service.source.SourceAdapter;
import com.example.catalog_import.service.source.SourceAdapterRegistry;
import com.example.catalog_import.service.source.SourceFiles;
import com.example.catalog_import.service.source.nzb.NzbSourceAdapter;
import com.example.catalog_import.service.validation.ImportValidator;
import com.example.catalog_import.util.ImportErrorType;
import com.example.catalog_import.util.ImportStatus;
import com.example.catalog_import.util.MetaType;
import com.example.catalog_import.util.SourceKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ImportPipelineTest {
    private static final long GB = 1024L * 1024 * 1024;

    private static final String NATURE_NZB = """
            <?xml version="1.0" encoding="UTF-8"?>
            <nzb xmlns="http://www.newzbin.com/DTD/2003/nzb">
              <head><meta type="name">Nature.Show.2019.1080p.WEB-DL.x264-GRP</meta></head>
              <file poster="poster@example.com" date="1600000000" subject="[1/1] - &quot;nature_show_finale.mkv&quot; yEnc (1/2)">
                <groups><group>alt.binaries.tv</group></groups>
                <segments>
                  <segment bytes="400000000" number="1">a@b</segment>
                  <segment bytes="400000000" number="2">c@d</segment>
                </segments>
              </file>
            </nzb>
            """;

    private InMemoryCatalogStore store;
    private AnalysisCache cache;
    private FakeTorrentUrlAdapter torrents;
    private ImportPipeline pipeline;

    @BeforeEach
    void setUp() {
        ImportProperties properties = new ImportProperties();
        Clock clock = Clock.fixed(Instant.parse("2025-02-01T12:00:00Z"), ZoneOffset.UTC);
        store = new InMemoryCatalogStore();
        cache = new AnalysisCache(properties, clock);
        torrents = new FakeTorrentUrlAdapter();
        SourceAdapterRegistry registry = new SourceAdapterRegistry(List.of(torrents, new NzbSourceAdapter()));
        pipeline = new ImportPipeline(registry, cache, new FileAnnotator(), new ImportValidator(properties),
                new CatalogMatcher(store, List.of(), clock), store, new StreamImporter(store, List.of()));
    }

    private static AnalyzedItem inception() {
        String name = "Inception.2010.1080p.BluRay.x264-GRP";
        return new AnalyzedItem(SourceKind.TORRENT, "abc123", name, "Inception", 2010, null, 2 * GB,
                List.of(SourceFiles.entry(0, name + ".mkv", 2 * GB)), null, null);
    }

    private static ImportRequest request(ImportSource source, MetaType type) {
        return new ImportRequest(source, type, null, false, false, null, null, null, false, null, null);
    }

    @Test
    void importsMovieLinkedToUniqueExactMatch() {
        CatalogMedia seeded = store.seedMedia("tt1375666", MetaType.MOVIE, "Inception", 2010, 80.0);
        torrents.register("http://tracker.example/inception.torrent", inception());

        ImportOutcome outcome = pipeline.importContent(
                request(new ImportSource.TorrentUrl("http://tracker.example/inception.torrent"), MetaType.MOVIE));

        assertThat(outcome.status()).isEqualTo(ImportStatus.SUCCESS);
        assertThat(outcome.contentIdentity()).isEqualTo("abc123");
        assertThat(outcome.mediaId()).isEqualTo(seeded.id());
        assertThat(store.streamCount()).isEqualTo(1);
        assertThat(store.linkedMedia(outcome.streamId())).containsExactly("tt1375666");
    }

    @Test
    void secondImportOfSameContentIsDuplicate() {
        store.seedMedia("tt1375666", MetaType.MOVIE, "Inception", 2010, 80.0);
        torrents.register("http://tracker.example/inception.torrent", inception());
        ImportRequest request = request(new ImportSource.TorrentUrl("http://tracker.example/inception.torrent"), MetaType.MOVIE);

        ImportOutcome first = pipeline.importContent(request);
        ImportOutcome second = pipeline.importContent(request);

        assertThat(second.status()).isEqualTo(ImportStatus.ERROR);
        assertThat(second.errors()).extracting(ImportError::type).containsExactly(ImportErrorType.DUPLICATE_CONTENT);
        assertThat(second.streamId()).isEqualTo(first.streamId());
        assertThat(store.streamCount()).isEqualTo(1);
    }

    @Test
    void seriesWithoutEpisodeNumbersRoundTripsThroughAnnotation() {
        store.seedMedia("tmdb:100", MetaType.SERIES, "Nature Show", 2019, 12.0);

        ImportOutcome first = pipeline.importContent(
                request(new ImportSource.NzbFile(NATURE_NZB, "nature.nzb"), MetaType.SERIES));

        assertThat(first.status()).isEqualTo(ImportStatus.NEEDS_ANNOTATION);
        assertThat(first.files()).extracting(FileEntry::filename).containsExactly("nature_show_finale.mkv");
        assertThat(first.analysisHandle()).startsWith("analysis_");
        assertThat(store.streamCount()).isZero();

        ImportRequest annotated = new ImportRequest(new ImportSource.AnalysisHandle(first.analysisHandle()),
                MetaType.SERIES, null, false, false, null,
                List.of(new FileAnnotation(0, 1, 1, null, null, null)), null, false, null, null);
        ImportOutcome second = pipeline.importContent(annotated);

        assertThat(second.status()).isEqualTo(ImportStatus.SUCCESS);
        assertThat(store.linkedMedia(second.streamId())).containsExactly("tmdb:100");
        FileEntry linked = store.writeFor(second.streamId()).files().get(0);
        assertThat(linked.season()).isEqualTo(1);
        assertThat(linked.episode()).isEqualTo(1);
        assertThat(cache.get(first.analysisHandle(), CachedAnalysis.class)).isEmpty();
    }

    @Test
    void forcedImportRequiresTheIssuedToken() {
        store.seedMedia("tmdb:200", MetaType.MOVIE, "Inception", 2005, 1.0);
        torrents.register("http://tracker.example/inception.torrent", inception());

        ImportRequest withMeta = new ImportRequest(new ImportSource.TorrentUrl("http://tracker.example/inception.torrent"),
                MetaType.MOVIE, "tmdb:200", false, false, null, null, null, false, null, null);
        ImportOutcome failed = pipeline.importContent(withMeta);

        assertThat(failed.status()).isEqualTo(ImportStatus.VALIDATION_FAILED);
        assertThat(failed.errors()).extracting(ImportError::type).containsExactly(ImportErrorType.YEAR_MISMATCH);
        assertThat(failed.validationToken()).isNotBlank();

        ImportSource cached = new ImportSource.AnalysisHandle(failed.analysisHandle());
        ImportOutcome wrongToken = pipeline.importContent(new ImportRequest(cached, MetaType.MOVIE, "tmdb:200", false,
                true, "forged", null, null, false, null, null));
        assertThat(wrongToken.status()).isEqualTo(ImportStatus.VALIDATION_FAILED);

        ImportOutcome forced = pipeline.importContent(new ImportRequest(cached, MetaType.MOVIE, "tmdb:200", false,
                true, failed.validationToken(), null, null, false, null, null));
        assertThat(forced.status()).isEqualTo(ImportStatus.SUCCESS);
        assertThat(store.linkedMedia(forced.streamId())).containsExactly("tmdb:200");
    }

    @Test
    void forcedRetryKeepsTheAutoSelectedMatch() {
        store.seedMedia("tt1375666", MetaType.MOVIE, "Inception", 2010, 80.0);
        String name = "Inception.2010.1080p.BluRay.x264-GRP";
        AnalyzedItem twoParts = new AnalyzedItem(SourceKind.TORRENT, "cd1cd2", name, "Inception", 2010, null, 4 * GB,
                List.of(SourceFiles.entry(0, name + "/inception.cd1.mkv", 2 * GB),
                        SourceFiles.entry(1, name + "/inception.cd2.mkv", 2 * GB)), null, null);
        torrents.register("http://tracker.example/inception-2cd.torrent", twoParts);
        ImportSource source = new ImportSource.TorrentUrl("http://tracker.example/inception-2cd.torrent");

        ImportOutcome failed = pipeline.importContent(request(source, MetaType.MOVIE));

        assertThat(failed.status()).isEqualTo(ImportStatus.VALIDATION_FAILED);
        assertThat(failed.errors()).extracting(ImportError::type)
                .containsExactly(ImportErrorType.MULTIPLE_VIDEO_FILES);
        assertThat(failed.candidateMatches()).extracting(m -> m.externalId()).containsExactly("tt1375666");

        ImportOutcome forced = pipeline.importContent(new ImportRequest(source, MetaType.MOVIE, null, false, true,
                failed.validationToken(), null, null, false, null, null));

        assertThat(forced.status()).isEqualTo(ImportStatus.SUCCESS);
        assertThat(store.linkedMedia(forced.streamId())).containsExactly("tt1375666");
        assertThat(store.writeFor(forced.streamId()).files()).hasSize(2);
    }

    @Test
    void excludedFilesAreLeftOutOfTheCommittedSeries() {
        store.seedMedia("tmdb:100", MetaType.SERIES, "Nature Show", 2019, 12.0);
        String name = "Nature.Show.2019.1080p.WEB-DL.x264-GRP";
        AnalyzedItem season = new AnalyzedItem(SourceKind.TORRENT, "nat333", name, "Nature Show", 2019, null, 6 * GB,
                List.of(SourceFiles.entry(0, name + "/nature_show_opening.mkv", 2 * GB),
                        SourceFiles.entry(1, name + "/nature_show_middle.mkv", 2 * GB),
                        SourceFiles.entry(2, name + "/nature_show_outtakes.mkv", 2 * GB)), null, null);
        torrents.register("http://tracker.example/nature.torrent", season);

        ImportOutcome first = pipeline.importContent(
                request(new ImportSource.TorrentUrl("http://tracker.example/nature.torrent"), MetaType.SERIES));

        assertThat(first.status()).isEqualTo(ImportStatus.NEEDS_ANNOTATION);
        assertThat(first.files()).hasSize(season.files().size());

        ImportOutcome second = pipeline.importContent(new ImportRequest(
                new ImportSource.AnalysisHandle(first.analysisHandle()), MetaType.SERIES, null, false, false, null,
                List.of(new FileAnnotation(0, 1, 1, null, null, null),
                        new FileAnnotation(1, 1, 2, null, null, null),
                        new FileAnnotation(2, null, null, null, false, null)),
                null, false, null, null));

        assertThat(second.status()).isEqualTo(ImportStatus.SUCCESS);
        List<FileEntry> linked = store.writeFor(second.streamId()).files();
        assertThat(linked).hasSize(2);
        assertThat(linked).extracting(FileEntry::episode).containsExactly(1, 2);
        assertThat(linked).extracting(FileEntry::filename).noneMatch(f -> f.endsWith("outtakes.mkv"));
    }

    @Test
    void unmatchedContentAsksThenCreatesUserMedia() {
        AnalyzedItem home = new AnalyzedItem(SourceKind.TORRENT, "def456", "Family.Trip.2001.mkv", "Family Trip", 2001,
                null, 2 * GB, List.of(SourceFiles.entry(0, "Family.Trip.2001.mkv", 2 * GB)), null, null);
        torrents.register("http://tracker.example/home.torrent", home);
        ImportSource source = new ImportSource.TorrentUrl("http://tracker.example/home.torrent");

        ImportOutcome warning = pipeline.importContent(request(source, MetaType.MOVIE));
        assertThat(warning.status()).isEqualTo(ImportStatus.WARNING);
        assertThat(warning.candidateMatches()).isEmpty();

        ImportOutcome created = pipeline.importContent(new ImportRequest(
                new ImportSource.AnalysisHandle(warning.analysisHandle()), MetaType.MOVIE, null, true, false, null,
                null, null, false, null, null));
        assertThat(created.status()).isEqualTo(ImportStatus.SUCCESS);
        assertThat(store.findMediaByExternalId("user:movie:family-trip-2001")).isPresent();
    }

    @Test
    void adapterFailuresBecomeErrorOutcomes() {
        ImportOutcome unreachable = pipeline.importContent(
                request(new ImportSource.TorrentUrl("http://tracker.example/missing.torrent"), MetaType.MOVIE));
        ImportOutcome unsupported = pipeline.importContent(
                request(new ImportSource.YouTube("https://youtube.com/watch?v=abc"), MetaType.MOVIE));
        ImportOutcome expired = pipeline.importContent(
                request(new ImportSource.AnalysisHandle("analysis_gone"), MetaType.MOVIE));

        assertThat(unreachable.errors()).extracting(ImportError::type).containsExactly(ImportErrorType.UNREACHABLE_SOURCE);
        assertThat(unsupported.errors()).extracting(ImportError::type).containsExactly(ImportErrorType.UNSUPPORTED_FORMAT);
        assertThat(expired.errors()).extracting(ImportError::type).containsExactly(ImportErrorType.ANALYSIS_EXPIRED);
        assertThat(store.streamCount()).isZero();
    }

    @Test
    void analyzeRanksCandidatesAndReportsExistingContent() {
        store.seedMedia("tt1375666", MetaType.MOVIE, "Inception", 2010, 80.0);
        torrents.register("http://tracker.example/inception.torrent", inception());
        ImportSource source = new ImportSource.TorrentUrl("http://tracker.example/inception.torrent");

        AnalysisResult before = pipeline.analyze(source, MetaType.MOVIE);
        assertThat(before.alreadyImported()).isFalse();
        assertThat(before.item().candidateMatches()).extracting(m -> m.externalId()).containsExactly("tt1375666");

        pipeline.importContent(request(new ImportSource.AnalysisHandle(before.analysisHandle()), MetaType.MOVIE));

        AnalysisResult after = pipeline.analyze(source, MetaType.MOVIE);
        assertThat(after.alreadyImported()).isTrue();
    }

    @Test
    void batchImportAcceptsBestCandidate() {
        store.seedMedia("tmdb:300", MetaType.MOVIE, "Inception", 2011, 1.0);
        torrents.register("http://tracker.example/inception.torrent", inception());

        ImportOutcome outcome = pipeline.importContent(ImportRequest.batch(
                new ImportSource.TorrentUrl("http://tracker.example/inception.torrent"), MetaType.MOVIE));

        assertThat(outcome.status()).isEqualTo(ImportStatus.SUCCESS);
        assertThat(store.linkedMedia(outcome.streamId())).containsExactly("tmdb:300");
    }

    static final class FakeTorrentUrlAdapter implements SourceAdapter<ImportSource.TorrentUrl> {
        private final Map<String, AnalyzedItem> items = new HashMap<>();

        void register(String url, AnalyzedItem item) {
            items.put(url, item);
        }

        @Override
        public Class<ImportSource.TorrentUrl> sourceType() {
            return ImportSource.TorrentUrl.class;
        }

        @Override
        public AnalyzedItem analyze(ImportSource.TorrentUrl source, MetaType metaType) {
            AnalyzedItem item = items.get(source.url());
            if (item == null) {
                throw AnalysisException.unreachable("404 for " + source.url(), null);
            }
            return item;
        }
    }
}
