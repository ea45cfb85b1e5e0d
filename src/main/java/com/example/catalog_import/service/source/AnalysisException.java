package com.example.catalog_import.service.source;

import com.example.catalog_import.util.ImportErrorType;

/**
 * Typed adapter failure. The pipeline turns it into an {@code error} outcome.
 */
public class AnalysisException extends RuntimeException {
    private final ImportErrorType type;

    public AnalysisException(ImportErrorType type, String message) {
        super(message);
        this.type = type;
    }

    public AnalysisException(ImportErrorType type, String message, Throwable cause) {
        super(message, cause);
        this.type = type;
    }

    public ImportErrorType getType() {
        return type;
    }

    public static AnalysisException malformed(String message) {
        return new AnalysisException(ImportErrorType.MALFORMED_INPUT, message);
    }

    public static AnalysisException unsupported(String message) {
        return new AnalysisException(ImportErrorType.UNSUPPORTED_FORMAT, message);
    }

    public static AnalysisException unreachable(String message, Throwable cause) {
        return new AnalysisException(ImportErrorType.UNREACHABLE_SOURCE, message, cause);
    }
}
