package com.example.catalog_import.util;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Status of a single import attempt as reported to the client.
 */
public enum ImportStatus {
    SUCCESS,
    NEEDS_ANNOTATION,
    VALIDATION_FAILED,
    WARNING,
    PROCESSING,
    ERROR;

    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }
}
