package com.example.catalog_import.dto;

import com.example.catalog_import.util.ResultItemStatus;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.UUID;

/**
 * Per-item outcome of a catalog commit.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ImportResultItem(
        String contentIdentity,
        ResultItemStatus status,
        String message,
        UUID streamId,
        UUID mediaId
) {
    public static ImportResultItem success(String contentIdentity, UUID streamId, UUID mediaId) {
        return new ImportResultItem(contentIdentity, ResultItemStatus.SUCCESS, "imported", streamId, mediaId);
    }

    public static ImportResultItem skipped(String contentIdentity, String message, UUID streamId) {
        return new ImportResultItem(contentIdentity, ResultItemStatus.SKIPPED, message, streamId, null);
    }

    public static ImportResultItem failed(String contentIdentity, String message) {
        return new ImportResultItem(contentIdentity, ResultItemStatus.FAILED, message, null, null);
    }
}
