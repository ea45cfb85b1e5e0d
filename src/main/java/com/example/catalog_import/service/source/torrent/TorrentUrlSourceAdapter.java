package com.example.catalog_import.service.source.torrent;

import com.example.catalog_import.config.ImportProperties;
import com.example.catalog_import.dto.AnalyzedItem;
import com.example.catalog_import.service.source.AnalysisException;
import com.example.catalog_import.service.source.ImportSource;
import com.example.catalog_import.service.source.SourceAdapter;
import com.example.catalog_import.service.source.web.SourceFetcher;
import com.example.catalog_import.util.MetaType;
import org.springframework.stereotype.Component;

/**
 * Downloads a {@code .torrent} from a URL (typically an RSS enclosure) and analyzes it like an upload.
 */
@Component
public class TorrentUrlSourceAdapter implements SourceAdapter<ImportSource.TorrentUrl> {
    private final SourceFetcher fetcher;
    private final ImportProperties properties;

    public TorrentUrlSourceAdapter(SourceFetcher fetcher, ImportProperties properties) {
        this.fetcher = fetcher;
        this.properties = properties;
    }

    @Override
    public Class<ImportSource.TorrentUrl> sourceType() {
        return ImportSource.TorrentUrl.class;
    }

    @Override
    public AnalyzedItem analyze(ImportSource.TorrentUrl source, MetaType metaType) {
        if (source.url() == null || source.url().isBlank()) {
            throw AnalysisException.malformed("Torrent URL is required");
        }
        byte[] content = fetcher.fetchBytes(source.url());
        return TorrentFileSourceAdapter.analyzeBytes(content, properties.getMaxTorrentBytes());
    }
}
