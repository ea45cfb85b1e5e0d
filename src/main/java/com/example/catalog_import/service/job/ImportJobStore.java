package com.example.catalog_import.service.job;

import com.example.catalog_import.util.ImportJobType;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Durable job records. Implementations keep {@code progress} and {@code total} monotonic and only move a job
 * forward: queued, processing, then completed or failed.
 */
public interface ImportJobStore {

    UUID create(ImportJobType type, int total, Map<String, Object> payload, UUID sourceId);

    /** Moves up to {@code limit} queued jobs to processing, oldest first. */
    List<ImportJobView> claimQueued(int limit);

    void updateProgress(UUID id, int progress, int total, Map<String, Integer> stats);

    /** Marks a processing job completed; progress and total both end at {@code max(total, progress, processed)}. */
    void complete(UUID id, int processed, Map<String, Integer> stats);

    void fail(UUID id, String error, Map<String, Integer> stats);

    /** Fails a job that has not started yet. Returns {@code false} when it was no longer queued. */
    boolean cancelQueued(UUID id, String reason);

    Optional<ImportJobView> get(UUID id);
}
