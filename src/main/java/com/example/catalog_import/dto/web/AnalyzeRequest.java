package com.example.catalog_import.dto.web;

import com.example.catalog_import.service.source.ImportSource;
import com.example.catalog_import.util.MetaType;
import jakarta.validation.constraints.NotNull;

public record AnalyzeRequest(
        @NotNull ImportSource source,
        MetaType metaType
) {
}
