package com.example.catalog_import.service.rss;

import com.example.catalog_import.dto.ImportOutcome;
import com.example.catalog_import.service.batch.BatchOutcomes;
import com.example.catalog_import.service.importer.ImportPipeline;
import com.example.catalog_import.service.importer.ImportRequest;
import com.example.catalog_import.service.job.ImportJobView;
import com.example.catalog_import.service.job.JobProgress;
import com.example.catalog_import.service.source.ImportSource;
import com.example.catalog_import.util.ImportErrorType;
import com.example.catalog_import.util.ImportJobStatus;
import com.example.catalog_import.util.ImportJobType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RssImportJobHandlerTest {

    @Mock
    private ImportPipeline pipeline;

    @InjectMocks
    private RssImportJobHandler handler;

    @Test
    void routesLinksBySourceKind() {
        assertThat(RssImportJobHandler.sourceFor(" magnet:?xt=urn:btih:abc "))
                .isEqualTo(new ImportSource.Magnet("magnet:?xt=urn:btih:abc"));
        assertThat(RssImportJobHandler.sourceFor("https://indexer.example/get/42.NZB?apikey=k"))
                .isInstanceOf(ImportSource.NzbUrl.class);
        assertThat(RssImportJobHandler.sourceFor("https://tracker.example/dl/42?file=a.nzb.torrent"))
                .isInstanceOf(ImportSource.TorrentUrl.class);
    }

    @Test
    void importsEachItemAndCountsOutcomes() {
        when(pipeline.importContent(any()))
                .thenReturn(ImportOutcome.completed("ok", Map.of()))
                .thenReturn(ImportOutcome.error(ImportErrorType.DUPLICATE_CONTENT, "exists"))
                .thenThrow(new IllegalStateException("boom"));
        List<Map<String, Object>> items = List.of(
                Map.of("link", "magnet:?xt=urn:btih:" + "b".repeat(40), "meta_type", "series"),
                Map.of("link", "https://tracker.example/a.torrent", "meta_type", "movie"),
                Map.of("link", "https://indexer.example/b.nzb", "meta_type", "movie"),
                Map.of("title", "no link"));
        ImportJobView job = new ImportJobView(UUID.randomUUID(), ImportJobType.RSS, ImportJobStatus.PROCESSING,
                0, 4, Map.of(), Map.of("items", items), null, null, null, null);
        JobProgress progress = JobProgress.detached(4, handler.statKeys());

        handler.run(job, progress);

        assertThat(progress.processed()).isEqualTo(4);
        assertThat(progress.count(BatchOutcomes.FAILED)).isEqualTo(2);
        ArgumentCaptor<ImportRequest> requests = ArgumentCaptor.forClass(ImportRequest.class);
        verify(pipeline, times(3)).importContent(requests.capture());
        assertThat(requests.getAllValues().get(0).source()).isInstanceOf(ImportSource.Magnet.class);
        assertThat(requests.getAllValues().get(2).source()).isInstanceOf(ImportSource.NzbUrl.class);
    }
}
