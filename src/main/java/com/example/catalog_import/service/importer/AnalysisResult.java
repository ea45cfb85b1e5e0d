package com.example.catalog_import.service.importer;

import com.example.catalog_import.dto.AnalyzedItem;

import java.util.UUID;

/**
 * Analyze-only response: the item with ranked candidates, the handle to import it later, and whether the
 * content is already catalogued.
 */
public record AnalysisResult(AnalyzedItem item, String analysisHandle, UUID existingStreamId) {
    public boolean alreadyImported() {
        return existingStreamId != null;
    }
}
