package com.example.catalog_import.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Limits, timeouts and policy switches for the import pipeline.
 */
@ConfigurationProperties(prefix = "importer")
public class ImportProperties {

    /** Batches with more entries than this run as a background job. */
    private int backgroundThreshold = 100;
    private Duration analysisCacheTtl = Duration.ofHours(1);
    private int previewLimit = 50;
    private long maxTorrentBytes = 5L * 1024 * 1024;
    private Duration sourceTimeout = Duration.ofSeconds(15);
    private Duration probeTimeout = Duration.ofSeconds(5);
    private Duration magnetResolveTimeout = Duration.ofSeconds(10);
    /** Torrent cache URL with a {@code {hash}} placeholder; blank disables magnet metadata resolution. */
    private String magnetMetadataUrl = "";
    private int progressFlushInterval = 10;
    private boolean publicSharingEnabled = true;

    private Validation validation = new Validation();
    private Iptv iptv = new Iptv();

    public int getBackgroundThreshold() {
        return backgroundThreshold;
    }

    public void setBackgroundThreshold(int backgroundThreshold) {
        this.backgroundThreshold = backgroundThreshold;
    }

    public Duration getAnalysisCacheTtl() {
        return analysisCacheTtl;
    }

    public void setAnalysisCacheTtl(Duration analysisCacheTtl) {
        this.analysisCacheTtl = analysisCacheTtl;
    }

    public int getPreviewLimit() {
        return previewLimit;
    }

    public void setPreviewLimit(int previewLimit) {
        this.previewLimit = previewLimit;
    }

    public long getMaxTorrentBytes() {
        return maxTorrentBytes;
    }

    public void setMaxTorrentBytes(long maxTorrentBytes) {
        this.maxTorrentBytes = maxTorrentBytes;
    }

    public Duration getSourceTimeout() {
        return sourceTimeout;
    }

    public void setSourceTimeout(Duration sourceTimeout) {
        this.sourceTimeout = sourceTimeout;
    }

    public Duration getProbeTimeout() {
        return probeTimeout;
    }

    public void setProbeTimeout(Duration probeTimeout) {
        this.probeTimeout = probeTimeout;
    }

    public Duration getMagnetResolveTimeout() {
        return magnetResolveTimeout;
    }

    public void setMagnetResolveTimeout(Duration magnetResolveTimeout) {
        this.magnetResolveTimeout = magnetResolveTimeout;
    }

    public String getMagnetMetadataUrl() {
        return magnetMetadataUrl;
    }

    public void setMagnetMetadataUrl(String magnetMetadataUrl) {
        this.magnetMetadataUrl = magnetMetadataUrl;
    }

    public int getProgressFlushInterval() {
        return progressFlushInterval;
    }

    public void setProgressFlushInterval(int progressFlushInterval) {
        this.progressFlushInterval = progressFlushInterval;
    }

    public boolean isPublicSharingEnabled() {
        return publicSharingEnabled;
    }

    public void setPublicSharingEnabled(boolean publicSharingEnabled) {
        this.publicSharingEnabled = publicSharingEnabled;
    }

    public Validation getValidation() {
        return validation;
    }

    public void setValidation(Validation validation) {
        this.validation = validation;
    }

    public Iptv getIptv() {
        return iptv;
    }

    public void setIptv(Iptv iptv) {
        this.iptv = iptv;
    }

    public static class Validation {
        private double titleSimilarityThreshold = 0.6;
        private int maxYearDifference = 1;
        private long minVideoFileBytes = 50L * 1024 * 1024;
        private int maxMovieVideoFiles = 1;
        private List<String> blockedKeywords = new ArrayList<>();

        public double getTitleSimilarityThreshold() {
            return titleSimilarityThreshold;
        }

        public void setTitleSimilarityThreshold(double titleSimilarityThreshold) {
            this.titleSimilarityThreshold = titleSimilarityThreshold;
        }

        public int getMaxYearDifference() {
            return maxYearDifference;
        }

        public void setMaxYearDifference(int maxYearDifference) {
            this.maxYearDifference = maxYearDifference;
        }

        public long getMinVideoFileBytes() {
            return minVideoFileBytes;
        }

        public void setMinVideoFileBytes(long minVideoFileBytes) {
            this.minVideoFileBytes = minVideoFileBytes;
        }

        public int getMaxMovieVideoFiles() {
            return maxMovieVideoFiles;
        }

        public void setMaxMovieVideoFiles(int maxMovieVideoFiles) {
            this.maxMovieVideoFiles = maxMovieVideoFiles;
        }

        public List<String> getBlockedKeywords() {
            return blockedKeywords;
        }

        public void setBlockedKeywords(List<String> blockedKeywords) {
            this.blockedKeywords = blockedKeywords;
        }
    }

    public static class Iptv {
        private boolean enabled = true;
        private boolean scheduledSyncEnabled = false;
        private String syncCron = "0 0 */6 * * *";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public boolean isScheduledSyncEnabled() {
            return scheduledSyncEnabled;
        }

        public void setScheduledSyncEnabled(boolean scheduledSyncEnabled) {
            this.scheduledSyncEnabled = scheduledSyncEnabled;
        }

        public String getSyncCron() {
            return syncCron;
        }

        public void setSyncCron(String syncCron) {
            this.syncCron = syncCron;
        }
    }
}
