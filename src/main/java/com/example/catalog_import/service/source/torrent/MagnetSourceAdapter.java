package com.example.catalog_import.service.source.torrent;

import com.example.catalog_import.dto.AnalyzedItem;
import com.example.catalog_import.service.source.ImportSource;
import com.example.catalog_import.service.source.SourceAdapter;
import com.example.catalog_import.util.MetaType;
import com.example.catalog_import.util.SourceKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Component
public class MagnetSourceAdapter implements SourceAdapter<ImportSource.Magnet> {
    private static final Logger LOGGER = LoggerFactory.getLogger(MagnetSourceAdapter.class);

    private final TorrentMetadataResolver resolver;

    public MagnetSourceAdapter(TorrentMetadataResolver resolver) {
        this.resolver = resolver;
    }

    @Override
    public Class<ImportSource.Magnet> sourceType() {
        return ImportSource.Magnet.class;
    }

    @Override
    public AnalyzedItem analyze(ImportSource.Magnet source, MetaType metaType) {
        MagnetLink magnet = MagnetLink.parse(source.magnetLink());
        Optional<TorrentMetainfo> meta = resolver.resolve(magnet.infoHash());
        if (meta.isEmpty()) {
            LOGGER.info("Magnet metadata unresolved hash={}; files unknown", magnet.infoHash());
            return TorrentItems.unresolved(magnet);
        }
        return TorrentItems.fromMetainfo(SourceKind.MAGNET, meta.get(), magnet);
    }
}
