package com.example.catalog_import.dto.web;

import com.example.catalog_import.dto.AnalyzedItem;
import com.example.catalog_import.service.importer.AnalysisResult;

import java.util.UUID;

public record AnalyzeResponse(
        String status,
        String analysisHandle,
        boolean alreadyImported,
        UUID existingStreamId,
        AnalyzedItem item
) {
    public static AnalyzeResponse of(AnalysisResult result) {
        return new AnalyzeResponse("success", result.analysisHandle(), result.alreadyImported(),
                result.existingStreamId(), result.item());
    }
}
