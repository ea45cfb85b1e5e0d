package com.example.catalog_import.service.rss;

import com.example.catalog_import.dto.ImportOutcome;
import com.example.catalog_import.model.UserRssFeed;
import com.example.catalog_import.repository.UserRssFeedRepository;
import com.example.catalog_import.service.job.ImportJobService;
import com.example.catalog_import.util.ImportErrorType;
import com.example.catalog_import.util.ImportJobType;
import com.example.catalog_import.util.MetaType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * User RSS feeds and the candidate items an external scraper posts for them. Items passing the feed filters
 * are imported in one {@code rss} job when the feed auto-imports, otherwise only returned.
 */
@Service
public class RssFeedService {
    private static final Logger LOGGER = LoggerFactory.getLogger(RssFeedService.class);

    private final UserRssFeedRepository feedRepo;
    private final ImportJobService jobService;
    private final Clock clock;

    public RssFeedService(UserRssFeedRepository feedRepo, ImportJobService jobService, Clock clock) {
        this.feedRepo = feedRepo;
        this.jobService = jobService;
        this.clock = clock;
    }

    @Transactional
    public UserRssFeed create(String owner, RssFeedRequest request) {
        if (request.url() == null || request.url().isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "URL_REQUIRED");
        }
        UserRssFeed feed = new UserRssFeed();
        feed.setOwnerSubject(owner);
        feed.setName(request.name() == null || request.name().isBlank() ? request.url().trim() : request.name().trim());
        feed.setUrl(request.url().trim());
        apply(feed, request);
        UserRssFeed saved = feedRepo.save(feed);
        LOGGER.info("RSS feed created id={} owner={}", saved.getId(), owner);
        return saved;
    }

    @Transactional(readOnly = true)
    public List<UserRssFeed> list(String owner) {
        return feedRepo.findByOwnerSubjectOrderByCreatedAtDesc(owner);
    }

    @Transactional(readOnly = true)
    public UserRssFeed get(UUID id, String owner) {
        UserRssFeed feed = feedRepo.findById(id)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "RSS_FEED_NOT_FOUND"));
        if (owner != null && !owner.equals(feed.getOwnerSubject())) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "RSS_FEED_NOT_FOUND");
        }
        return feed;
    }

    @Transactional
    public UserRssFeed update(UUID id, String owner, RssFeedRequest request) {
        UserRssFeed feed = get(id, owner);
        if (request.name() != null && !request.name().isBlank()) {
            feed.setName(request.name().trim());
        }
        if (request.url() != null && !request.url().isBlank()) {
            feed.setUrl(request.url().trim());
        }
        apply(feed, request);
        return feedRepo.save(feed);
    }

    @Transactional
    public void delete(UUID id, String owner) {
        feedRepo.delete(get(id, owner));
        LOGGER.info("RSS feed deleted id={} owner={}", id, owner);
    }

    /**
     * Filters posted items. With auto-import on, accepted items are queued as one job and the outcome is
     * {@code processing}; otherwise the accepted items are returned in the details.
     */
    @Transactional
    public ImportOutcome processItems(UUID feedId, String owner, List<RssItem> items) {
        UserRssFeed feed = get(feedId, owner);
        if (!feed.isActive()) {
            return ImportOutcome.error(ImportErrorType.UNSUPPORTED_FORMAT, "Feed " + feedId + " is inactive");
        }
        RssFilter filter = RssFilter.of(feed);
        List<Map<String, Object>> accepted = new ArrayList<>();
        for (RssItem item : items == null ? List.<RssItem>of() : items) {
            if (!filter.accepts(item)) {
                continue;
            }
            MetaType type = item.metaType() != null ? item.metaType() : feed.getDefaultMetaType();
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("title", item.title());
            entry.put("link", item.link().trim());
            entry.put("meta_type", (type == null ? MetaType.MOVIE : type).id());
            accepted.add(entry);
        }
        feed.setLastProcessedAt(clock.instant());
        feedRepo.save(feed);
        int received = items == null ? 0 : items.size();
        LOGGER.info("RSS ITEMS feed={} received={} accepted={} autoImport={}", feedId, received, accepted.size(),
                feed.isAutoImport());

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("received", received);
        details.put("accepted", accepted.size());
        if (!feed.isAutoImport() || accepted.isEmpty()) {
            details.put("items", accepted);
            return ImportOutcome.completed("Accepted " + accepted.size() + " of " + received + " items", details);
        }
        UUID jobId = jobService.enqueue(ImportJobType.RSS, accepted.size(),
                Map.of("feed_id", feedId.toString(), "items", accepted), null);
        details.put("job_id", jobId);
        details.put("background", true);
        return ImportOutcome.processing(jobId, "Importing " + accepted.size() + " feed items in the background",
                details);
    }

    private static void apply(UserRssFeed feed, RssFeedRequest request) {
        if (request.includePattern() != null) {
            RssFilter.compile(request.includePattern());
            feed.setIncludePattern(request.includePattern().isBlank() ? null : request.includePattern());
        }
        if (request.excludePattern() != null) {
            RssFilter.compile(request.excludePattern());
            feed.setExcludePattern(request.excludePattern().isBlank() ? null : request.excludePattern());
        }
        if (request.minSizeBytes() != null) {
            feed.setMinSizeBytes(request.minSizeBytes() <= 0 ? null : request.minSizeBytes());
        }
        if (request.maxSizeBytes() != null) {
            feed.setMaxSizeBytes(request.maxSizeBytes() <= 0 ? null : request.maxSizeBytes());
        }
        if (request.defaultMetaType() != null) {
            feed.setDefaultMetaType(request.defaultMetaType());
        }
        if (request.autoImport() != null) {
            feed.setAutoImport(request.autoImport());
        }
        if (request.active() != null) {
            feed.setActive(request.active());
        }
    }
}
