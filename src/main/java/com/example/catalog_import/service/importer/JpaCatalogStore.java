package com.example.catalog_import.service.importer;

import com.example.catalog_import.dto.AnalyzedItem;
import com.example.catalog_import.dto.FileEntry;
import com.example.catalog_import.dto.ReleaseInfo;
import com.example.catalog_import.model.FileMediaLink;
import com.example.catalog_import.model.Media;
import com.example.catalog_import.model.MediaStream;
import com.example.catalog_import.model.StreamFile;
import com.example.catalog_import.model.StreamMediaLink;
import com.example.catalog_import.repository.FileMediaLinkRepository;
import com.example.catalog_import.repository.MediaRepository;
import com.example.catalog_import.repository.MediaStreamRepository;
import com.example.catalog_import.repository.StreamFileRepository;
import com.example.catalog_import.repository.StreamMediaLinkRepository;
import com.example.catalog_import.service.match.MediaDraft;
import com.example.catalog_import.util.MetaType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

@Service
public class JpaCatalogStore implements CatalogStore {
    private static final Logger LOGGER = LoggerFactory.getLogger(JpaCatalogStore.class);

    private final MediaRepository mediaRepo;
    private final MediaStreamRepository streamRepo;
    private final StreamFileRepository fileRepo;
    private final FileMediaLinkRepository fileLinkRepo;
    private final StreamMediaLinkRepository streamLinkRepo;
    private final Clock clock;

    public JpaCatalogStore(MediaRepository mediaRepo,
                           MediaStreamRepository streamRepo,
                           StreamFileRepository fileRepo,
                           FileMediaLinkRepository fileLinkRepo,
                           StreamMediaLinkRepository streamLinkRepo,
                           Clock clock) {
        this.mediaRepo = mediaRepo;
        this.streamRepo = streamRepo;
        this.fileRepo = fileRepo;
        this.fileLinkRepo = fileLinkRepo;
        this.streamLinkRepo = streamLinkRepo;
        this.clock = clock;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<StreamRef> findStreamByContentIdentity(String contentIdentity) {
        return streamRepo.findByContentIdentity(contentIdentity)
                .map(stream -> new StreamRef(stream.getId(), streamLinkRepo.findFirstByStreamAndPrimaryTrue(stream)
                        .map(link -> link.getMedia().getId())
                        .orElse(null)));
    }

    @Override
    @Transactional(readOnly = true)
    public boolean existsByContentIdentity(String contentIdentity) {
        return streamRepo.existsByContentIdentity(contentIdentity);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<CatalogMedia> findMediaByExternalId(String externalId) {
        return mediaRepo.findByExternalId(externalId).map(JpaCatalogStore::toView);
    }

    @Override
    @Transactional(readOnly = true)
    public List<CatalogMedia> findMediaCandidates(String normalizedTitle, MetaType type) {
        return mediaRepo.findByTypeAndTitleNormalized(type, normalizedTitle).stream()
                .map(JpaCatalogStore::toView)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<CatalogMedia> searchMediaByTitle(String fragment, MetaType type, int limit) {
        if (fragment == null || fragment.isBlank()) {
            return List.of();
        }
        return mediaRepo.searchByTitleFragment(type, fragment, PageRequest.of(0, Math.max(1, limit))).stream()
                .map(JpaCatalogStore::toView)
                .toList();
    }

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public CommitResult persist(CatalogWrite write) {
        AnalyzedItem item = write.item();
        Media primary = resolveMedia(write.primary());

        MediaStream stream = new MediaStream(item.contentIdentity(), item.sourceKind(), streamName(item));
        ReleaseInfo release = item.release();
        stream.setResolution(release.resolution());
        stream.setQuality(release.quality());
        stream.setCodec(release.codec());
        stream.setAudio(release.audio());
        stream.setHdr(release.hdr());
        stream.setLanguages(release.languages());
        stream.setReleaseGroup(release.releaseGroup());
        stream.setTotalSize(item.totalSize());
        stream.setSourceUrl(write.sourceUrl() != null ? write.sourceUrl() : item.attribute("url"));
        stream.setAttributes(new HashMap<>(item.attributes()));
        stream.setIptvSourceId(write.iptvSourceId());
        // unique content_identity: a concurrent import of the same content fails here
        streamRepo.saveAndFlush(stream);

        Map<String, Media> secondary = new LinkedHashMap<>();
        write.secondary().forEach((metaId, draft) -> secondary.put(metaId, resolveMedia(draft)));

        int linked = 0;
        Set<Media> linkedMedia = new LinkedHashSet<>();
        linkedMedia.add(primary);
        if (write.files().isEmpty()) {
            StreamFile file = fileRepo.save(new StreamFile(stream, 0, streamName(item),
                    item.totalSize() == null ? 0L : item.totalSize(), true));
            fileLinkRepo.save(new FileMediaLink(file, primary, null, null, null));
            linked = 1;
        } else {
            for (FileEntry entry : write.files()) {
                StreamFile file = fileRepo.save(new StreamFile(stream, entry.index(), entry.filename(), entry.size(),
                        false));
                Media target = entry.metaId() != null && secondary.containsKey(entry.metaId())
                        ? secondary.get(entry.metaId())
                        : primary;
                linkedMedia.add(target);
                fileLinkRepo.save(new FileMediaLink(file, target, entry.season(), entry.episode(), entry.episodeEnd()));
                linked++;
            }
        }

        Instant now = clock.instant();
        for (Media media : linkedMedia) {
            streamLinkRepo.save(new StreamMediaLink(stream, media, media == primary));
            mediaRepo.incrementStreamCount(media.getId(), now);
        }
        LOGGER.info("CATALOG WRITE identity={} stream={} media={} files={} linkedMedia={}",
                item.contentIdentity(), stream.getId(), primary.getId(), linked, linkedMedia.size());
        return new CommitResult(stream.getId(), primary.getId(), linked);
    }

    @Override
    @Transactional
    public void refreshStream(UUID streamId, AnalyzedItem item) {
        streamRepo.findById(streamId).ifPresent(stream -> {
            if (stream.getTotalSize() == null && item.totalSize() != null) {
                stream.setTotalSize(item.totalSize());
            }
            Map<String, Object> attributes = new HashMap<>(stream.getAttributes() == null ? Map.of() : stream.getAttributes());
            item.attributes().forEach(attributes::putIfAbsent);
            stream.setAttributes(attributes);
            streamRepo.save(stream);
        });
    }

    private Media resolveMedia(MediaDraft draft) {
        return mediaRepo.findByExternalId(draft.externalId()).orElseGet(() -> {
            Media media = new Media(draft.externalId(), draft.type(), draft.title(), draft.year());
            media.setPosterUrl(draft.posterUrl());
            media.setDescription(draft.description());
            media.setGenres(draft.genres());
            media.setPopularity(draft.popularity());
            media.setRating(draft.rating());
            media.setUserCreated(draft.userCreated());
            return mediaRepo.saveAndFlush(media);
        });
    }

    private static String streamName(AnalyzedItem item) {
        if (item.displayName() != null && !item.displayName().isBlank()) {
            return item.displayName();
        }
        return item.parsedTitle() != null ? item.parsedTitle() : item.contentIdentity();
    }

    static CatalogMedia toView(Media media) {
        return new CatalogMedia(media.getId(), media.getExternalId(), media.getType(), media.getTitle(),
                media.getYear(), media.getPosterUrl(), media.getPopularity(), media.getRating(),
                media.getGenres() == null ? List.of() : media.getGenres(), media.getDescription(),
                media.getCreatedAt());
    }
}
