package com.example.catalog_import.dto;

import com.example.catalog_import.util.ImportErrorType;
import com.example.catalog_import.util.ImportStatus;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Result of one import attempt.
 *
 * <p>{@code NEEDS_ANNOTATION} always carries a non-empty {@code files} list and
 * {@code VALIDATION_FAILED} always carries non-empty {@code errors} plus the token that a
 * {@code force_import} retry has to echo.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ImportOutcome(
        ImportStatus status,
        String message,
        List<ImportError> errors,
        List<FileEntry> files,
        String validationToken,
        String analysisHandle,
        String contentIdentity,
        UUID streamId,
        UUID mediaId,
        UUID jobId,
        List<Match> candidateMatches,
        Map<String, Object> details
) {
    public static ImportOutcome success(String contentIdentity, UUID streamId, UUID mediaId, String message) {
        return new ImportOutcome(ImportStatus.SUCCESS, message, null, null, null, null, contentIdentity, streamId,
                mediaId, null, null, null);
    }

    public static ImportOutcome error(ImportErrorType type, String message) {
        return new ImportOutcome(ImportStatus.ERROR, message, List.of(new ImportError(type, message)), null, null,
                null, null, null, null, null, null, null);
    }

    public static ImportOutcome duplicate(String contentIdentity, UUID existingStreamId) {
        String message = "Content " + contentIdentity + " already exists";
        return new ImportOutcome(ImportStatus.ERROR, message,
                List.of(new ImportError(ImportErrorType.DUPLICATE_CONTENT, message)), null, null, null,
                contentIdentity, existingStreamId, null, null, null, null);
    }

    public static ImportOutcome needsAnnotation(String contentIdentity, List<FileEntry> files, String handle) {
        if (files == null || files.isEmpty()) {
            throw new IllegalArgumentException("needs_annotation requires a non-empty file list");
        }
        return new ImportOutcome(ImportStatus.NEEDS_ANNOTATION,
                "Season and episode numbers are required for every included file", null, List.copyOf(files), null,
                handle, contentIdentity, null, null, null, null, null);
    }

    public static ImportOutcome validationFailed(String contentIdentity, List<ImportError> errors, String token) {
        if (errors == null || errors.isEmpty()) {
            throw new IllegalArgumentException("validation_failed requires at least one error");
        }
        return new ImportOutcome(ImportStatus.VALIDATION_FAILED, "Validation failed; retry with force_import to accept",
                List.copyOf(errors), null, token, null, contentIdentity, null, null, null, null, null);
    }

    public static ImportOutcome warning(String contentIdentity, String message, List<Match> candidates) {
        return new ImportOutcome(ImportStatus.WARNING, message, null, null, null, null, contentIdentity, null, null,
                null, candidates == null ? List.of() : List.copyOf(candidates), null);
    }

    public static ImportOutcome processing(UUID jobId, String message, Map<String, Object> details) {
        return new ImportOutcome(ImportStatus.PROCESSING, message, null, null, null, null, null, null, null, jobId,
                null, details);
    }

    public static ImportOutcome completed(String message, Map<String, Object> details) {
        return new ImportOutcome(ImportStatus.SUCCESS, message, null, null, null, null, null, null, null, null, null,
                details);
    }

    public ImportOutcome withAnalysisHandle(String handle) {
        return new ImportOutcome(status, message, errors, files, validationToken, handle, contentIdentity, streamId,
                mediaId, jobId, candidateMatches, details);
    }

    public ImportOutcome withCandidateMatches(List<Match> matches) {
        return new ImportOutcome(status, message, errors, files, validationToken, analysisHandle, contentIdentity,
                streamId, mediaId, jobId, matches == null ? null : List.copyOf(matches), details);
    }
}
