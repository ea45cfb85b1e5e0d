package com.example.catalog_import.service.importer;

import com.example.catalog_import.dto.AnalyzedItem;
import com.example.catalog_import.dto.FileEntry;
import com.example.catalog_import.service.match.MediaDraft;
import com.example.catalog_import.util.MetaType;
import com.example.catalog_import.util.TitleSimilarity;
import org.springframework.dao.DataIntegrityViolationException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Catalog kept in maps. Enforces the unique content identity the same way the database does.
 */
public class InMemoryCatalogStore implements CatalogStore {
    private final Map<String, CatalogMedia> mediaByExternalId = new ConcurrentHashMap<>();
    private final Map<String, StreamRef> streamsByIdentity = new ConcurrentHashMap<>();
    private final Map<UUID, Set<String>> linksByStream = new ConcurrentHashMap<>();
    private final Map<UUID, CatalogWrite> writesByStream = new ConcurrentHashMap<>();
    private int refreshCount;

    public CatalogMedia seedMedia(String externalId, MetaType type, String title, Integer year, Double popularity) {
        CatalogMedia media = new CatalogMedia(UUID.randomUUID(), externalId, type, title, year, null, popularity,
                null, List.of(), null, Instant.parse("2024-01-01T00:00:00Z"));
        mediaByExternalId.put(externalId, media);
        return media;
    }

    @Override
    public Optional<StreamRef> findStreamByContentIdentity(String contentIdentity) {
        return Optional.ofNullable(streamsByIdentity.get(contentIdentity));
    }

    @Override
    public Optional<CatalogMedia> findMediaByExternalId(String externalId) {
        return Optional.ofNullable(mediaByExternalId.get(externalId));
    }

    @Override
    public List<CatalogMedia> findMediaCandidates(String normalizedTitle, MetaType type) {
        return mediaByExternalId.values().stream()
                .filter(m -> m.type() == type)
                .filter(m -> TitleSimilarity.normalize(m.title()).equals(normalizedTitle))
                .toList();
    }

    @Override
    public List<CatalogMedia> searchMediaByTitle(String fragment, MetaType type, int limit) {
        return mediaByExternalId.values().stream()
                .filter(m -> m.type() == type)
                .filter(m -> TitleSimilarity.normalize(m.title()).contains(fragment))
                .sorted(Comparator.comparing(CatalogMedia::popularity, Comparator.nullsLast(Comparator.reverseOrder())))
                .limit(limit)
                .toList();
    }

    @Override
    public synchronized CommitResult persist(CatalogWrite write) {
        String identity = write.item().contentIdentity();
        if (streamsByIdentity.containsKey(identity)) {
            throw new DataIntegrityViolationException("duplicate key value violates unique constraint");
        }
        CatalogMedia primary = resolve(write.primary());
        UUID streamId = UUID.randomUUID();
        Set<String> linked = new LinkedHashSet<>();
        linked.add(primary.externalId());
        for (FileEntry file : write.files()) {
            if (file.metaId() != null && write.secondary().containsKey(file.metaId())) {
                linked.add(resolve(write.secondary().get(file.metaId())).externalId());
            }
        }
        streamsByIdentity.put(identity, new StreamRef(streamId, primary.id()));
        linksByStream.put(streamId, linked);
        writesByStream.put(streamId, write);
        return new CommitResult(streamId, primary.id(), Math.max(1, write.files().size()));
    }

    @Override
    public synchronized void refreshStream(UUID streamId, AnalyzedItem item) {
        refreshCount++;
    }

    public int streamCount() {
        return streamsByIdentity.size();
    }

    public int mediaCount() {
        return mediaByExternalId.size();
    }

    public Set<String> linkedMedia(UUID streamId) {
        return linksByStream.getOrDefault(streamId, Set.of());
    }

    public CatalogWrite writeFor(UUID streamId) {
        return writesByStream.get(streamId);
    }

    public Optional<CatalogWrite> writeForIdentity(String identity) {
        return findStreamByContentIdentity(identity).map(ref -> writesByStream.get(ref.streamId()));
    }

    public List<CatalogWrite> writes() {
        return new ArrayList<>(writesByStream.values());
    }

    public synchronized int refreshCount() {
        return refreshCount;
    }

    private CatalogMedia resolve(MediaDraft draft) {
        return mediaByExternalId.computeIfAbsent(draft.externalId(), id -> new CatalogMedia(UUID.randomUUID(), id,
                draft.type(), draft.title(), draft.year(), draft.posterUrl(), draft.popularity(), draft.rating(),
                draft.genres(), draft.description(), Instant.now()));
    }
}
