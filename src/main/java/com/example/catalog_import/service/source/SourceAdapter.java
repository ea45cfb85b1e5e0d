package com.example.catalog_import.service.source;

import com.example.catalog_import.dto.AnalyzedItem;
import com.example.catalog_import.util.MetaType;

/**
 * Turns one kind of raw input into an {@link AnalyzedItem}.
 *
 * @param <S> the input variant this adapter accepts
 */
public interface SourceAdapter<S extends ImportSource> {

    Class<S> sourceType();

    /**
     * @throws AnalysisException when the input is malformed, unsupported or its origin cannot be reached
     */
    AnalyzedItem analyze(S source, MetaType metaType);
}
