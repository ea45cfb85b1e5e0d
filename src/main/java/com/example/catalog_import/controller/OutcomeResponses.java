package com.example.catalog_import.controller;

import com.example.catalog_import.dto.ImportError;
import com.example.catalog_import.dto.ImportOutcome;
import com.example.catalog_import.util.ImportErrorType;
import com.example.catalog_import.util.ImportStatus;
import com.example.catalog_import.util.MetaType;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.server.ResponseStatusException;

/**
 * HTTP status for import outcomes. Branches the client must act on (annotation, validation, candidate choice)
 * are regular 200 answers; only {@code error} outcomes map to 4xx/5xx.
 */
final class OutcomeResponses {

    private OutcomeResponses() {
    }

    static ResponseEntity<ImportOutcome> of(ImportOutcome outcome) {
        return ResponseEntity.status(statusOf(outcome)).body(outcome);
    }

    static HttpStatus statusOf(ImportOutcome outcome) {
        if (outcome.status() == ImportStatus.PROCESSING) {
            return HttpStatus.ACCEPTED;
        }
        if (outcome.status() != ImportStatus.ERROR) {
            return HttpStatus.OK;
        }
        ImportErrorType type = outcome.errors() == null || outcome.errors().isEmpty()
                ? ImportErrorType.MALFORMED_INPUT
                : outcome.errors().stream().map(ImportError::type).findFirst().orElse(ImportErrorType.MALFORMED_INPUT);
        return statusOf(type);
    }

    static HttpStatus statusOf(ImportErrorType type) {
        return switch (type) {
            case DUPLICATE_CONTENT -> HttpStatus.CONFLICT;
            case ANALYSIS_EXPIRED -> HttpStatus.GONE;
            case UNREACHABLE_SOURCE -> HttpStatus.BAD_GATEWAY;
            case MEDIA_NOT_FOUND -> HttpStatus.NOT_FOUND;
            case COMMIT_FAILED -> HttpStatus.INTERNAL_SERVER_ERROR;
            case BLOCKED_CONTENT -> HttpStatus.FORBIDDEN;
            default -> HttpStatus.BAD_REQUEST;
        };
    }

    static MetaType metaType(String raw) {
        try {
            return MetaType.fromId(raw);
        } catch (IllegalArgumentException ex) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "UNKNOWN_META_TYPE");
        }
    }
}
