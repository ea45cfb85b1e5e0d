package com.example.catalog_import.service.validation;

import com.example.catalog_import.util.MetaType;

import java.util.UUID;

/**
 * Facts the validator needs but must not look up itself.
 *
 * @param existingStreamId stream already holding the item's content identity, or {@code null}
 * @param validationToken  token echoed from a previous {@code validation_failed} outcome
 */
public record ValidationContext(
        MetaType metaType,
        boolean forceImport,
        String validationToken,
        UUID existingStreamId,
        String analysisHandle
) {
    public boolean contentExists() {
        return existingStreamId != null;
    }
}
