package com.example.catalog_import.util;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Structured error codes carried in {@code errors[]} of an import outcome.
 */
public enum ImportErrorType {
    MALFORMED_INPUT(false),
    UNSUPPORTED_FORMAT(false),
    UNREACHABLE_SOURCE(false),
    ANALYSIS_EXPIRED(false),
    DUPLICATE_CONTENT(false),
    BLOCKED_CONTENT(false),
    TITLE_MISMATCH(true),
    YEAR_MISMATCH(true),
    MULTIPLE_VIDEO_FILES(true),
    SUSPICIOUS_FILE_SIZE(true),
    MISSING_EPISODE_INFO(false),
    MEDIA_NOT_FOUND(false),
    COMMIT_FAILED(false);

    private final boolean overridable;

    ImportErrorType(boolean overridable) {
        this.overridable = overridable;
    }

    /** Whether {@code force_import} may bypass this error. */
    public boolean isOverridable() {
        return overridable;
    }

    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }
}
