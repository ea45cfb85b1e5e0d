package com.example.catalog_import.service.importer;

import com.example.catalog_import.dto.AnalyzedItem;
import com.example.catalog_import.util.MetaType;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Catalog access used by the import pipeline. The unique constraint on a stream's content identity is the
 * authoritative duplicate check; {@link #persist} fails with a
 * {@link org.springframework.dao.DataIntegrityViolationException} when it is violated.
 */
public interface CatalogStore {

    Optional<StreamRef> findStreamByContentIdentity(String contentIdentity);

    default boolean existsByContentIdentity(String contentIdentity) {
        return findStreamByContentIdentity(contentIdentity).isPresent();
    }

    Optional<CatalogMedia> findMediaByExternalId(String externalId);

    /** Media whose normalized title equals {@code normalizedTitle}. */
    List<CatalogMedia> findMediaCandidates(String normalizedTitle, MetaType type);

    /** Media whose normalized title contains {@code fragment}, most popular first. */
    List<CatalogMedia> searchMediaByTitle(String fragment, MetaType type, int limit);

    /** Writes stream, files and links in one transaction. */
    CommitResult persist(CatalogWrite write);

    /** Updates an existing stream with what a repeated analysis learned (trackers, size). */
    void refreshStream(UUID streamId, AnalyzedItem item);
}
