package com.example.catalog_import.dto.web;

import com.example.catalog_import.service.annotation.AnnotationHints;
import com.example.catalog_import.service.annotation.FileAnnotation;
import jakarta.validation.constraints.NotBlank;

import java.util.List;

public record AnnotateRequest(
        @NotBlank String analysisHandle,
        AnnotationHints annotation,
        List<FileAnnotation> fileData
) {
    public AnnotationHints hints() {
        AnnotationHints base = annotation == null ? AnnotationHints.none() : annotation;
        if (fileData == null || fileData.isEmpty()) {
            return base;
        }
        return new AnnotationHints(base.bulkSeason(), base.seasons(), base.mode(), base.episodesPerSeason(), fileData);
    }
}
