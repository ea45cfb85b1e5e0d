package com.example.catalog_import.service.importer;

import com.example.catalog_import.service.annotation.AnnotationHints;
import com.example.catalog_import.service.annotation.FileAnnotation;
import com.example.catalog_import.service.source.ImportSource;
import com.example.catalog_import.util.MetaType;

import java.util.List;

/**
 * One interactive import.
 *
 * @param metaId          external id of the media to link to; skips matching
 * @param createNew       link to a new user-created media record instead of a match
 * @param validationToken token from the previous {@code validation_failed} outcome, required with {@code forceImport}
 * @param fileData        per-file season/episode/include overrides
 * @param acceptBestMatch take the top candidate (or create one) instead of asking; used by batch jobs
 * @param title           title for a user-created record, defaults to the parsed title
 */
public record ImportRequest(
        ImportSource source,
        MetaType metaType,
        String metaId,
        boolean createNew,
        boolean forceImport,
        String validationToken,
        List<FileAnnotation> fileData,
        AnnotationHints annotation,
        boolean acceptBestMatch,
        String title,
        Integer year
) {
    public static ImportRequest batch(ImportSource source, MetaType metaType) {
        return new ImportRequest(source, metaType, null, false, false, null, null, null, true, null, null);
    }

    public AnnotationHints effectiveHints() {
        AnnotationHints base = annotation == null ? AnnotationHints.none() : annotation;
        if (fileData == null || fileData.isEmpty()) {
            return base;
        }
        return new AnnotationHints(base.bulkSeason(), base.seasons(), base.mode(), base.episodesPerSeason(), fileData);
    }
}
