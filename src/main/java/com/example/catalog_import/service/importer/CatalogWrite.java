package com.example.catalog_import.service.importer;

import com.example.catalog_import.dto.AnalyzedItem;
import com.example.catalog_import.dto.FileEntry;
import com.example.catalog_import.service.match.MediaDraft;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Everything one import writes: the stream, its files and the media they link to.
 *
 * @param primary   media the stream belongs to; created when its external id is not catalogued yet
 * @param secondary media for files carrying their own {@code meta_id}, keyed by that id
 * @param files     files to link; empty for single-stream sources, which get one virtual file
 */
public record CatalogWrite(
        AnalyzedItem item,
        MediaDraft primary,
        Map<String, MediaDraft> secondary,
        List<FileEntry> files,
        UUID iptvSourceId,
        String sourceUrl
) {
    public CatalogWrite {
        secondary = secondary == null ? Map.of() : Map.copyOf(secondary);
        files = files == null ? List.of() : List.copyOf(files);
    }
}
