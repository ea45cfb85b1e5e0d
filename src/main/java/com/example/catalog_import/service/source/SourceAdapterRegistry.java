package com.example.catalog_import.service.source;

import com.example.catalog_import.dto.AnalyzedItem;
import com.example.catalog_import.util.MetaType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Component
public class SourceAdapterRegistry {
    private static final Logger LOGGER = LoggerFactory.getLogger(SourceAdapterRegistry.class);

    private final Map<Class<?>, SourceAdapter<?>> adapters = new HashMap<>();

    public SourceAdapterRegistry(List<SourceAdapter<?>> adapters) {
        for (SourceAdapter<?> adapter : adapters) {
            SourceAdapter<?> previous = this.adapters.put(adapter.sourceType(), adapter);
            if (previous != null) {
                throw new IllegalStateException("Duplicate adapter for " + adapter.sourceType().getSimpleName());
            }
        }
        LOGGER.info("Source adapters registered count={}", this.adapters.size());
    }

    public AnalyzedItem analyze(ImportSource source, MetaType metaType) {
        if (source == null) {
            throw AnalysisException.malformed("Source is required");
        }
        return analyzeWith(adapterFor(source), source, metaType);
    }

    @SuppressWarnings("unchecked")
    private <S extends ImportSource> AnalyzedItem analyzeWith(SourceAdapter<S> adapter, ImportSource source, MetaType metaType) {
        return adapter.analyze((S) source, metaType);
    }

    private SourceAdapter<?> adapterFor(ImportSource source) {
        SourceAdapter<?> adapter = adapters.get(source.getClass());
        if (adapter == null) {
            throw AnalysisException.unsupported("No adapter for source " + source.getClass().getSimpleName());
        }
        return adapter;
    }
}
