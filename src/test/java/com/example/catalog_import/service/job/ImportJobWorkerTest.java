package com.example.catalog_import.service.job;

import com.example.catalog_import.config.ImportProperties;
import com.example.catalog_import.config.WorkerExecutorProperties;
import com.example.catalog_import.util.ImportJobStatus;
import com.example.catalog_import.util.ImportJobType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class ImportJobWorkerTest {

    private InMemoryImportJobStore store;
    private ImportJobService jobService;
    private ImportJobWorker worker;

    @BeforeEach
    void setUp() {
        store = new InMemoryImportJobStore();
        jobService = new ImportJobService(store);
        ImportProperties importProperties = new ImportProperties();
        importProperties.setProgressFlushInterval(2);
        worker = new ImportJobWorker(store, List.of(new ScriptedHandler()), Runnable::run,
                new WorkerExecutorProperties(), importProperties);
    }

    private UUID enqueue(int total, List<String> script) {
        return jobService.enqueue(ImportJobType.NZB_URLS, total, Map.of("script", script), null);
    }

    @Test
    void completedJobStatsSumToProgress() {
        UUID id = enqueue(4, List.of("imported", "skipped", "imported", "failed"));

        worker.poll();

        ImportJobView job = store.get(id).orElseThrow();
        assertThat(job.status()).isEqualTo(ImportJobStatus.COMPLETED);
        assertThat(job.progress()).isEqualTo(4);
        assertThat(job.total()).isEqualTo(4);
        assertThat(job.stats()).containsEntry("imported", 2).containsEntry("skipped", 1).containsEntry("failed", 1);
        assertThat(job.stats().values().stream().mapToInt(Integer::intValue).sum()).isEqualTo(job.progress());
        assertThat(store.progressUpdates()).containsExactly(2, 4);
    }

    @Test
    void totalGrowsWhenMoreItemsTurnUp() {
        UUID id = enqueue(1, List.of("imported", "imported", "imported"));

        worker.poll();

        ImportJobView job = store.get(id).orElseThrow();
        assertThat(job.progress()).isEqualTo(3);
        assertThat(job.total()).isEqualTo(3);
    }

    @Test
    void handlerExceptionFailsJobKeepingPartialStats() {
        UUID id = enqueue(3, List.of("imported", "boom", "imported"));

        worker.poll();

        ImportJobView job = store.get(id).orElseThrow();
        assertThat(job.status()).isEqualTo(ImportJobStatus.FAILED);
        assertThat(job.error()).isEqualTo("script failed at item 2");
        assertThat(job.stats()).containsEntry("imported", 1);
    }

    @Test
    void jobWithoutHandlerFails() {
        UUID id = jobService.enqueue(ImportJobType.RSS, 1, Map.of(), null);

        worker.poll();

        ImportJobView job = store.get(id).orElseThrow();
        assertThat(job.status()).isEqualTo(ImportJobStatus.FAILED);
        assertThat(job.error()).contains("rss");
    }

    @Test
    void cancelledJobIsNeverRun() {
        UUID id = enqueue(1, List.of("imported"));

        assertThat(jobService.cancel(id.toString())).get()
                .extracting(ImportJobView::status).isEqualTo(ImportJobStatus.FAILED);
        worker.poll();

        ImportJobView job = store.get(id).orElseThrow();
        assertThat(job.error()).isEqualTo(ImportJobService.CANCELLED);
        assertThat(job.progress()).isZero();
    }

    @Test
    void finishedJobsCannotBeCancelled() {
        UUID id = enqueue(1, List.of("imported"));
        worker.poll();

        assertThat(jobService.cancel(id.toString())).get()
                .extracting(ImportJobView::status).isEqualTo(ImportJobStatus.COMPLETED);
    }

    @Test
    void unknownIdsReportNotFound() {
        assertThat(jobService.status("not-a-uuid")).isEqualTo(ImportJobStatus.NOT_FOUND);
        assertThat(jobService.status(UUID.randomUUID().toString())).isEqualTo(ImportJobStatus.NOT_FOUND);
        assertThat(jobService.cancel(null)).isEmpty();
    }

    private static final class ScriptedHandler implements ImportJobHandler {
        @Override
        public ImportJobType type() {
            return ImportJobType.NZB_URLS;
        }

        @Override
        public List<String> statKeys() {
            return List.of("imported", "skipped", "failed");
        }

        @Override
        @SuppressWarnings("unchecked")
        public void run(ImportJobView job, JobProgress progress) {
            List<String> script = (List<String>) job.payload().get("script");
            for (int i = 0; i < script.size(); i++) {
                if (script.get(i).equals("boom")) {
                    throw new IllegalStateException("script failed at item " + (i + 1));
                }
                progress.record(script.get(i));
            }
        }
    }
}
