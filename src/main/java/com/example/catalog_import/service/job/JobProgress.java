package com.example.catalog_import.service.job;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Per-job counters. Every processed item lands in exactly one stat key, so the stats always sum to
 * {@link #processed()}. The total only grows. When bound to a job, progress is flushed every
 * {@code flushInterval} items.
 */
public class JobProgress {
    private final UUID jobId;
    private final ImportJobStore store;
    private final int flushInterval;
    private final Map<String, Integer> stats = new LinkedHashMap<>();
    private int processed;
    private int total;

    JobProgress(UUID jobId, ImportJobStore store, int total, Collection<String> statKeys, int flushInterval) {
        this.jobId = jobId;
        this.store = store;
        this.total = Math.max(0, total);
        this.flushInterval = Math.max(1, flushInterval);
        statKeys.forEach(key -> stats.put(key, 0));
    }

    /** Counters for a synchronous import that has no job record. */
    public static JobProgress detached(int total, Collection<String> statKeys) {
        return new JobProgress(null, null, total, statKeys, Integer.MAX_VALUE);
    }

    public synchronized void record(String statKey) {
        stats.merge(statKey, 1, Integer::sum);
        processed++;
        if (processed > total) {
            total = processed;
        }
        if (store != null && processed % flushInterval == 0) {
            flush();
        }
    }

    public synchronized void addTotal(int delta) {
        if (delta > 0) {
            total += delta;
        }
    }

    public synchronized void flush() {
        if (store != null) {
            store.updateProgress(jobId, processed, total, Map.copyOf(stats));
        }
    }

    public synchronized int processed() {
        return processed;
    }

    public synchronized int total() {
        return total;
    }

    public synchronized Map<String, Integer> stats() {
        return new LinkedHashMap<>(stats);
    }

    public synchronized int count(String statKey) {
        return stats.getOrDefault(statKey, 0);
    }
}
