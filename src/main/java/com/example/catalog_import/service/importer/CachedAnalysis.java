package com.example.catalog_import.service.importer;

import com.example.catalog_import.dto.AnalyzedItem;
import com.example.catalog_import.util.MetaType;

/** Analysis stored behind an {@code analysis_…} handle. */
public record CachedAnalysis(AnalyzedItem item, MetaType metaType) {
}
