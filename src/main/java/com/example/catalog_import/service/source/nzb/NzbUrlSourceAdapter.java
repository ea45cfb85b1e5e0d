package com.example.catalog_import.service.source.nzb;

import com.example.catalog_import.dto.AnalyzedItem;
import com.example.catalog_import.service.source.ImportSource;
import com.example.catalog_import.service.source.SourceAdapter;
import com.example.catalog_import.service.source.web.SourceFetcher;
import com.example.catalog_import.util.MetaType;
import org.springframework.stereotype.Component;

@Component
public class NzbUrlSourceAdapter implements SourceAdapter<ImportSource.NzbUrl> {
    private final SourceFetcher fetcher;
    private final NzbSourceAdapter nzbAdapter;

    public NzbUrlSourceAdapter(SourceFetcher fetcher, NzbSourceAdapter nzbAdapter) {
        this.fetcher = fetcher;
        this.nzbAdapter = nzbAdapter;
    }

    @Override
    public Class<ImportSource.NzbUrl> sourceType() {
        return ImportSource.NzbUrl.class;
    }

    @Override
    public AnalyzedItem analyze(ImportSource.NzbUrl source, MetaType metaType) {
        String content = fetcher.fetchString(source.url());
        return nzbAdapter.analyzeContent(content, source.url().trim());
    }
}
