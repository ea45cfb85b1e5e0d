package com.example.catalog_import.service.job;

import com.example.catalog_import.util.ImportJobStatus;
import com.example.catalog_import.util.ImportJobType;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

public record ImportJobView(
        UUID id,
        ImportJobType type,
        ImportJobStatus status,
        int progress,
        int total,
        Map<String, Integer> stats,
        Map<String, Object> payload,
        String error,
        UUID sourceId,
        Instant createdAt,
        Instant updatedAt
) {
    public ImportJobView {
        stats = stats == null ? Map.of() : Map.copyOf(stats);
        payload = payload == null ? Map.of() : payload;
    }
}
