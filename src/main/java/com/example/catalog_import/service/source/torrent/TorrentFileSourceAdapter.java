package com.example.catalog_import.service.source.torrent;

import com.example.catalog_import.config.ImportProperties;
import com.example.catalog_import.dto.AnalyzedItem;
import com.example.catalog_import.service.source.AnalysisException;
import com.example.catalog_import.service.source.ImportSource;
import com.example.catalog_import.service.source.SourceAdapter;
import com.example.catalog_import.util.MetaType;
import com.example.catalog_import.util.SourceKind;
import org.springframework.stereotype.Component;

@Component
public class TorrentFileSourceAdapter implements SourceAdapter<ImportSource.TorrentFile> {
    private final ImportProperties properties;

    public TorrentFileSourceAdapter(ImportProperties properties) {
        this.properties = properties;
    }

    @Override
    public Class<ImportSource.TorrentFile> sourceType() {
        return ImportSource.TorrentFile.class;
    }

    @Override
    public AnalyzedItem analyze(ImportSource.TorrentFile source, MetaType metaType) {
        return analyzeBytes(source.content(), properties.getMaxTorrentBytes());
    }

    static AnalyzedItem analyzeBytes(byte[] content, long maxBytes) {
        if (content == null || content.length == 0) {
            throw AnalysisException.malformed("Torrent file is empty");
        }
        if (content.length > maxBytes) {
            throw AnalysisException.malformed("Torrent file exceeds " + maxBytes + " bytes");
        }
        try {
            return TorrentItems.fromMetainfo(SourceKind.TORRENT, TorrentMetainfoParser.parse(content), null);
        } catch (BencodeException ex) {
            throw AnalysisException.malformed("Invalid torrent file: " + ex.getMessage());
        }
    }
}
