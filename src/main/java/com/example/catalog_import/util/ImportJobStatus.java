package com.example.catalog_import.util;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ImportJobStatus {
    QUEUED,
    PROCESSING,
    COMPLETED,
    FAILED,
    /** Returned for unknown or expired job ids, never stored. */
    NOT_FOUND;

    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
