package com.example.catalog_import.service.batch;

import com.example.catalog_import.dto.ImportError;
import com.example.catalog_import.dto.ImportOutcome;
import com.example.catalog_import.util.ImportErrorType;
import com.example.catalog_import.util.ImportStatus;

import java.util.List;

/** Stat keys shared by the NZB and RSS batch jobs. */
public final class BatchOutcomes {
    public static final String IMPORTED = "imported";
    public static final String SKIPPED = "skipped";
    public static final String FAILED = "failed";
    public static final List<String> STAT_KEYS = List.of(IMPORTED, SKIPPED, FAILED);

    private BatchOutcomes() {
    }

    public static String statKey(ImportOutcome outcome) {
        if (outcome.status() == ImportStatus.SUCCESS) {
            return IMPORTED;
        }
        if (outcome.errors() != null && outcome.errors().stream()
                .map(ImportError::type)
                .anyMatch(type -> type == ImportErrorType.DUPLICATE_CONTENT)) {
            return SKIPPED;
        }
        return FAILED;
    }
}
