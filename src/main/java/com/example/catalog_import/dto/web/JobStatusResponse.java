package com.example.catalog_import.dto.web;

import com.example.catalog_import.service.job.ImportJobView;
import com.example.catalog_import.util.ImportJobType;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Poll response. An unknown job id answers {@code status=not_found} with every other field absent.
 */
public record JobStatusResponse(
        String status,
        UUID jobId,
        ImportJobType type,
        Integer progress,
        Integer total,
        Map<String, Integer> stats,
        String error,
        UUID sourceId,
        Instant createdAt,
        Instant updatedAt
) {
    public static JobStatusResponse of(ImportJobView job) {
        return new JobStatusResponse(job.status().id(), job.id(), job.type(), job.progress(), job.total(),
                job.stats(), job.error(), job.sourceId(), job.createdAt(), job.updatedAt());
    }

    public static JobStatusResponse notFound() {
        return new JobStatusResponse("not_found", null, null, null, null, null, null, null, null, null);
    }
}
