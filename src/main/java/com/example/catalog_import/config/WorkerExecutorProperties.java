package com.example.catalog_import.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configures import job polling and concurrency limits.
 */
@ConfigurationProperties(prefix = "worker")
public class WorkerExecutorProperties {

    private int pollBatchSize = 4;
    private int executorThreads = 4;
    private int executorQueueCapacity = 50;

    /** Concurrent jobs per kind; playlist and panel imports are network heavy. */
    private Concurrency playlist = new Concurrency(2);
    private Concurrency nzb = new Concurrency(2);
    private Concurrency rss = new Concurrency(1);

    public int getPollBatchSize() {
        return pollBatchSize;
    }

    public void setPollBatchSize(int pollBatchSize) {
        this.pollBatchSize = pollBatchSize;
    }

    public int getExecutorThreads() {
        return executorThreads;
    }

    public void setExecutorThreads(int executorThreads) {
        this.executorThreads = executorThreads;
    }

    public int getExecutorQueueCapacity() {
        return executorQueueCapacity;
    }

    public void setExecutorQueueCapacity(int executorQueueCapacity) {
        this.executorQueueCapacity = executorQueueCapacity;
    }

    public Concurrency getPlaylist() {
        return playlist;
    }

    public void setPlaylist(Concurrency playlist) {
        this.playlist = playlist;
    }

    public Concurrency getNzb() {
        return nzb;
    }

    public void setNzb(Concurrency nzb) {
        this.nzb = nzb;
    }

    public Concurrency getRss() {
        return rss;
    }

    public void setRss(Concurrency rss) {
        this.rss = rss;
    }

    /**
     * Returns the maximum configured concurrency across all job kinds to help size executors.
     *
     * @return maximum configured concurrency.
     */
    public int maxConfiguredConcurrency() {
        return Math.max(playlist.getMaxConcurrency(), Math.max(nzb.getMaxConcurrency(), rss.getMaxConcurrency()));
    }

    public static class Concurrency {
        private int maxConcurrency = 1;

        public Concurrency() {
        }

        public Concurrency(int maxConcurrency) {
            this.maxConcurrency = maxConcurrency;
        }

        public int getMaxConcurrency() {
            return maxConcurrency;
        }

        public void setMaxConcurrency(int maxConcurrency) {
            this.maxConcurrency = maxConcurrency;
        }
    }
}
