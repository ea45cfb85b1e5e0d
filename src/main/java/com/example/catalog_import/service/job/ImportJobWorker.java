package com.example.catalog_import.service.job;

import com.example.catalog_import.config.ImportProperties;
import com.example.catalog_import.config.WorkerExecutorProperties;
import com.example.catalog_import.util.ImportJobType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.Semaphore;
import java.util.stream.Collectors;

/**
 * Polls for queued import jobs and runs them on the worker pool, limited per kind by a semaphore.
 * Items inside one job are processed in submission order.
 */
@Service
public class ImportJobWorker {
    private static final Logger LOGGER = LoggerFactory.getLogger(ImportJobWorker.class);

    private final ImportJobStore jobStore;
    private final Map<ImportJobType, ImportJobHandler> handlers = new EnumMap<>(ImportJobType.class);
    private final Executor workerExecutor;
    private final WorkerExecutorProperties workerProperties;
    private final int flushInterval;
    private final Semaphore playlistSemaphore;
    private final Semaphore nzbSemaphore;
    private final Semaphore rssSemaphore;

    public ImportJobWorker(ImportJobStore jobStore,
                           List<ImportJobHandler> handlers,
                           @Qualifier("workerTaskExecutor") Executor workerExecutor,
                           WorkerExecutorProperties workerProperties,
                           ImportProperties importProperties) {
        this.jobStore = jobStore;
        this.workerExecutor = workerExecutor;
        this.workerProperties = workerProperties;
        this.flushInterval = importProperties.getProgressFlushInterval();
        for (ImportJobHandler handler : handlers) {
            this.handlers.put(handler.type(), handler);
        }
        this.playlistSemaphore = new Semaphore(Math.max(1, workerProperties.getPlaylist().getMaxConcurrency()));
        this.nzbSemaphore = new Semaphore(Math.max(1, workerProperties.getNzb().getMaxConcurrency()));
        this.rssSemaphore = new Semaphore(Math.max(1, workerProperties.getRss().getMaxConcurrency()));
    }

    @Scheduled(fixedDelayString = "${worker.poll-delay-ms:3000}")
    public void poll() {
        List<ImportJobView> jobs = jobStore.claimQueued(workerProperties.getPollBatchSize());
        if (jobs.isEmpty()) {
            LOGGER.debug("Import worker poll tick, no jobs claimed");
            return;
        }
        LOGGER.info("Import worker claimed jobs count={} ids={}", jobs.size(),
                jobs.stream().map(ImportJobView::id).collect(Collectors.toList()));
        jobs.forEach(job -> workerExecutor.execute(() -> runWithSemaphore(job)));
    }

    void runWithSemaphore(ImportJobView job) {
        Semaphore semaphore = semaphoreFor(job.type());
        boolean acquired = false;
        try {
            semaphore.acquire();
            acquired = true;
            run(job);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            jobStore.fail(job.id(), "interrupted", job.stats());
        } finally {
            if (acquired) {
                semaphore.release();
            }
        }
    }

    void run(ImportJobView job) {
        ImportJobHandler handler = handlers.get(job.type());
        if (handler == null) {
            LOGGER.warn("Unhandled import job type={} id={}", job.type(), job.id());
            jobStore.fail(job.id(), "No handler for job type " + job.type().id(), job.stats());
            return;
        }
        JobProgress progress = new JobProgress(job.id(), jobStore, job.total(), handler.statKeys(), flushInterval);
        long t0 = System.nanoTime();
        LOGGER.info("JOB START jobId={} type={} total={} source={}", job.id(), job.type(), job.total(), job.sourceId());
        try {
            handler.run(job, progress);
            jobStore.complete(job.id(), progress.processed(), progress.stats());
            LOGGER.info("JOB DONE jobId={} type={} processed={} stats={} in={}ms", job.id(), job.type(),
                    progress.processed(), progress.stats(), (System.nanoTime() - t0) / 1_000_000);
        } catch (RuntimeException e) {
            LOGGER.error("JOB FAILED jobId={} type={} processed={} in={}ms: {}", job.id(), job.type(),
                    progress.processed(), (System.nanoTime() - t0) / 1_000_000, e.toString(), e);
            jobStore.fail(job.id(), e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage(),
                    progress.stats());
        }
    }

    private Semaphore semaphoreFor(ImportJobType type) {
        return switch (type) {
            case M3U, XTREAM, IPTV_SYNC -> playlistSemaphore;
            case NZB_URLS -> nzbSemaphore;
            case RSS -> rssSemaphore;
        };
    }
}
