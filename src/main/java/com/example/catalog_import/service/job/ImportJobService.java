package com.example.catalog_import.service.job;

import com.example.catalog_import.util.ImportJobStatus;
import com.example.catalog_import.util.ImportJobType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Enqueue, poll and cancel background imports. Unknown or malformed ids report {@code not_found} instead of
 * failing.
 */
@Service
public class ImportJobService {
    private static final Logger LOGGER = LoggerFactory.getLogger(ImportJobService.class);
    public static final String CANCELLED = "cancelled";

    private final ImportJobStore jobStore;

    public ImportJobService(ImportJobStore jobStore) {
        this.jobStore = jobStore;
    }

    public UUID enqueue(ImportJobType type, int total, Map<String, Object> payload, UUID sourceId) {
        UUID id = jobStore.create(type, total, payload, sourceId);
        LOGGER.info("JOB ENQUEUED jobId={} type={} total={} source={}", id, type, total, sourceId);
        return id;
    }

    public Optional<ImportJobView> find(String rawId) {
        UUID id = parse(rawId);
        return id == null ? Optional.empty() : jobStore.get(id);
    }

    public ImportJobStatus status(String rawId) {
        return find(rawId).map(ImportJobView::status).orElse(ImportJobStatus.NOT_FOUND);
    }

    /**
     * Cancels a queued job. Returns the job as it stands afterwards; a job already processing or finished is
     * left alone.
     */
    public Optional<ImportJobView> cancel(String rawId) {
        UUID id = parse(rawId);
        if (id == null) {
            return Optional.empty();
        }
        if (jobStore.cancelQueued(id, CANCELLED)) {
            LOGGER.info("JOB CANCELLED jobId={}", id);
        }
        return jobStore.get(id);
    }

    private static UUID parse(String rawId) {
        if (rawId == null || rawId.isBlank()) {
            return null;
        }
        try {
            return UUID.fromString(rawId.trim());
        } catch (IllegalArgumentException ex) {
            return null;
        }
    }
}
