package com.example.catalog_import.service.importer;

import com.example.catalog_import.dto.ImportResultItem;
import com.example.catalog_import.service.match.MediaDraft;
import com.example.catalog_import.service.match.MetadataAccessException;
import com.example.catalog_import.service.match.MetadataSearchProvider;
import com.example.catalog_import.util.MetaType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.text.Normalizer;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Commits one analyzed item to the catalog. At most one stream exists per content identity: an existing
 * identity is skipped, and a unique-constraint violation from a concurrent writer is re-checked and
 * reported as skipped too.
 */
@Service
public class StreamImporter {
    private static final Logger LOGGER = LoggerFactory.getLogger(StreamImporter.class);
    private static final int MAX_ATTEMPTS = 2;

    private final CatalogStore catalogStore;
    private final List<MetadataSearchProvider> providers;

    public StreamImporter(CatalogStore catalogStore, List<MetadataSearchProvider> providers) {
        this.catalogStore = catalogStore;
        this.providers = providers;
    }

    public ImportResultItem commit(CatalogWrite write) {
        String identity = write.item().contentIdentity();
        Optional<StreamRef> existing = catalogStore.findStreamByContentIdentity(identity);
        if (existing.isPresent()) {
            catalogStore.refreshStream(existing.get().streamId(), write.item());
            return ImportResultItem.skipped(identity, "already imported", existing.get().streamId());
        }

        for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
            try {
                CommitResult result = catalogStore.persist(write);
                return ImportResultItem.success(identity, result.streamId(), result.mediaId());
            } catch (DataIntegrityViolationException ex) {
                Optional<StreamRef> winner = catalogStore.findStreamByContentIdentity(identity);
                if (winner.isPresent()) {
                    LOGGER.info("IMPORT RACE identity={} stream={} resolved=skip", identity, winner.get().streamId());
                    return ImportResultItem.skipped(identity, "already imported", winner.get().streamId());
                }
                LOGGER.warn("IMPORT CONSTRAINT identity={} attempt={}: {}", identity, attempt,
                        ex.getMostSpecificCause().getMessage());
                if (attempt == MAX_ATTEMPTS) {
                    return ImportResultItem.failed(identity, "Catalog constraint violated: "
                            + ex.getMostSpecificCause().getMessage());
                }
            } catch (DataAccessException ex) {
                LOGGER.warn("IMPORT FAILED identity={}: {}", identity, ex.getMessage());
                return ImportResultItem.failed(identity, "Catalog write failed: " + ex.getMostSpecificCause().getMessage());
            }
        }
        return ImportResultItem.failed(identity, "Catalog write failed");
    }

    /**
     * Media for an external id: the catalog record if present, else provider metadata, else a bare record
     * built from what the source told us.
     */
    public MediaDraft resolveDraft(String externalId, MetaType type, String fallbackTitle, Integer fallbackYear,
                                  String posterUrl) {
        Optional<CatalogMedia> catalogued = catalogStore.findMediaByExternalId(externalId);
        if (catalogued.isPresent()) {
            CatalogMedia m = catalogued.get();
            return new MediaDraft(m.externalId(), m.type(), m.title(), m.year(), m.posterUrl(), m.description(),
                    m.genres(), m.popularity(), m.rating(), false);
        }
        for (MetadataSearchProvider provider : providers) {
            try {
                Optional<MediaDraft> fetched = provider.fetch(externalId, type);
                if (fetched.isPresent()) {
                    return fetched.get();
                }
            } catch (MetadataAccessException ex) {
                LOGGER.warn("Metadata fetch failed externalId={}: {}", externalId, ex.getMessage());
            }
        }
        return MediaDraft.basic(externalId, type, fallbackTitle == null ? externalId : fallbackTitle, fallbackYear,
                posterUrl, false);
    }

    /**
     * User-created media keyed by type, title and year, so that episodes of one uncatalogued series share a
     * record.
     */
    public static MediaDraft userMedia(MetaType type, String title, Integer year, String posterUrl) {
        String key = slug(title) + (year == null ? "" : "-" + year);
        return MediaDraft.basic("user:" + type.id() + ":" + key, type, title, year, posterUrl, true);
    }

    /** Live channels are keyed by their slugged name, so a channel seen in two playlists shares one record. */
    public static MediaDraft channelMedia(String name, String logo) {
        return MediaDraft.basic("tv:" + slug(name), MetaType.TV, name, null, logo, false);
    }

    static String slug(String value) {
        String folded = Normalizer.normalize(value == null ? "" : value, Normalizer.Form.NFD)
                .replaceAll("\\p{M}+", "")
                .toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9]+", "-")
                .replaceAll("(^-+|-+$)", "");
        return folded.isEmpty() ? "channel" : folded;
    }
}
