package com.example.catalog_import.service.iptv;

import com.example.catalog_import.config.ImportProperties;
import com.example.catalog_import.model.IptvSource;
import com.example.catalog_import.repository.IptvSourceRepository;
import com.example.catalog_import.service.job.ImportJobService;
import com.example.catalog_import.service.source.xtream.XtreamCredentials;
import com.example.catalog_import.util.ImportJobType;
import com.example.catalog_import.util.IptvSourceType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

import java.net.URI;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Saved M3U playlists and Xtream panels that can be re-synced on demand or on a schedule.
 */
@Service
public class IptvSourceService {
    private static final Logger LOGGER = LoggerFactory.getLogger(IptvSourceService.class);

    private final IptvSourceRepository sourceRepo;
    private final ImportJobService jobService;
    private final ImportProperties properties;
    private final Clock clock;

    public IptvSourceService(IptvSourceRepository sourceRepo, ImportJobService jobService,
                             ImportProperties properties, Clock clock) {
        this.sourceRepo = sourceRepo;
        this.jobService = jobService;
        this.properties = properties;
        this.clock = clock;
    }

    public void ensureEnabled() {
        if (!properties.getIptv().isEnabled()) {
            throw new ResponseStatusException(HttpStatus.FORBIDDEN, "IPTV_IMPORT_DISABLED");
        }
    }

    /** Sharing a source publicly is only possible while the server allows it. */
    public boolean effectivePublic(boolean requested) {
        return requested && properties.isPublicSharingEnabled();
    }

    @Transactional
    public IptvSource saveM3uSource(String owner, String name, String m3uUrl, boolean isPublic) {
        IptvSource source = new IptvSource();
        source.setOwnerSubject(owner);
        source.setSourceType(IptvSourceType.M3U);
        source.setName(name == null || name.isBlank() ? "M3U - " + hostOf(m3uUrl) : name.trim());
        source.setM3uUrl(m3uUrl);
        source.setPublic(effectivePublic(isPublic));
        source.setActive(true);
        IptvSource saved = sourceRepo.save(source);
        LOGGER.info("IPTV source saved id={} type=m3u owner={}", saved.getId(), owner);
        return saved;
    }

    @Transactional
    public IptvSource saveXtreamSource(String owner, String name, XtreamCredentials credentials, boolean isPublic,
                                       XtreamSelection selection) {
        IptvSource source = new IptvSource();
        source.setOwnerSubject(owner);
        source.setSourceType(IptvSourceType.XTREAM);
        source.setName(name == null || name.isBlank() ? "Xtream - " + hostOf(credentials.baseUrl()) : name.trim());
        source.setServer(credentials.baseUrl());
        source.setUsername(credentials.username());
        source.setPassword(credentials.password());
        source.setPublic(effectivePublic(isPublic));
        source.setActive(true);
        source.setImportLive(selection.importLive());
        source.setImportVod(selection.importVod());
        source.setImportSeries(selection.importSeries());
        source.setLiveCategoryIds(copy(selection.liveCategoryIds()));
        source.setVodCategoryIds(copy(selection.vodCategoryIds()));
        source.setSeriesCategoryIds(copy(selection.seriesCategoryIds()));
        IptvSource saved = sourceRepo.save(source);
        LOGGER.info("IPTV source saved id={} type=xtream owner={}", saved.getId(), owner);
        return saved;
    }

    @Transactional(readOnly = true)
    public List<IptvSource> list(String owner) {
        return sourceRepo.findByOwnerSubjectOrderByCreatedAtDesc(owner);
    }

    @Transactional(readOnly = true)
    public IptvSource get(UUID id, String owner) {
        IptvSource source = sourceRepo.findById(id)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "IPTV_SOURCE_NOT_FOUND"));
        if (owner != null && !owner.equals(source.getOwnerSubject())) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "IPTV_SOURCE_NOT_FOUND");
        }
        return source;
    }

    @Transactional(readOnly = true)
    public IptvSource get(UUID id) {
        return get(id, null);
    }

    @Transactional
    public IptvSource update(UUID id, String owner, IptvSourceUpdate update) {
        IptvSource source = get(id, owner);
        if (update.name() != null && !update.name().isBlank()) {
            source.setName(update.name().trim());
        }
        if (update.isPublic() != null) {
            source.setPublic(effectivePublic(update.isPublic()));
        }
        if (update.active() != null) {
            source.setActive(update.active());
        }
        if (update.importLive() != null) {
            source.setImportLive(update.importLive());
        }
        if (update.importVod() != null) {
            source.setImportVod(update.importVod());
        }
        if (update.importSeries() != null) {
            source.setImportSeries(update.importSeries());
        }
        if (update.liveCategoryIds() != null) {
            source.setLiveCategoryIds(copy(update.liveCategoryIds()));
        }
        if (update.vodCategoryIds() != null) {
            source.setVodCategoryIds(copy(update.vodCategoryIds()));
        }
        if (update.seriesCategoryIds() != null) {
            source.setSeriesCategoryIds(copy(update.seriesCategoryIds()));
        }
        return sourceRepo.save(source);
    }

    @Transactional
    public void delete(UUID id, String owner) {
        IptvSource source = get(id, owner);
        sourceRepo.delete(source);
        LOGGER.info("IPTV source deleted id={} owner={}", id, owner);
    }

    /** Queues a re-sync; the job carries the source id and records its stats on the source when done. */
    public UUID sync(UUID id, String owner) {
        IptvSource source = get(id, owner);
        if (!source.isActive()) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, "IPTV_SOURCE_INACTIVE");
        }
        return jobService.enqueue(ImportJobType.IPTV_SYNC, 0, Map.of("source_id", source.getId().toString()),
                source.getId());
    }

    @Transactional
    public void recordSync(UUID id, Map<String, Integer> stats) {
        if (id == null) {
            return;
        }
        sourceRepo.findById(id).ifPresent(source -> {
            source.setLastSyncedAt(clock.instant());
            source.setLastSyncStats(stats);
            sourceRepo.save(source);
        });
    }

    @Scheduled(cron = "${importer.iptv.sync-cron:0 0 */6 * * *}")
    public void scheduledSync() {
        if (!properties.getIptv().isEnabled() || !properties.getIptv().isScheduledSyncEnabled()) {
            return;
        }
        List<IptvSource> sources = sourceRepo.findByActiveTrue();
        for (IptvSource source : sources) {
            jobService.enqueue(ImportJobType.IPTV_SYNC, 0, Map.of("source_id", source.getId().toString()),
                    source.getId());
        }
        LOGGER.info("Scheduled IPTV sync queued sources={}", sources.size());
    }

    private static List<String> copy(List<String> ids) {
        return ids == null ? new ArrayList<>() : new ArrayList<>(ids);
    }

    static String hostOf(String url) {
        try {
            String host = URI.create(url.trim()).getHost();
            return host == null ? "playlist" : host;
        } catch (IllegalArgumentException | NullPointerException ex) {
            return "playlist";
        }
    }
}
