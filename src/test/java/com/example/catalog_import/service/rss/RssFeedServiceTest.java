package com.example.catalog_import.service.rss;

import com.example.catalog_import.dto.ImportError;
import com.example.catalog_import.dto.ImportOutcome;
import com.example.catalog_import.model.UserRssFeed;
import com.example.catalog_import.repository.UserRssFeedRepository;
import com.example.catalog_import.service.job.ImportJobService;
import com.example.catalog_import.service.job.ImportJobView;
import com.example.catalog_import.service.job.InMemoryImportJobStore;
import com.example.catalog_import.util.ImportErrorType;
import com.example.catalog_import.util.ImportJobType;
import com.example.catalog_import.util.ImportStatus;
import com.example.catalog_import.util.MetaType;
import org.assertj.core.api.InstanceOfAssertFactories;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RssFeedServiceTest {
    private static final Instant NOW = Instant.parse("2025-04-01T08:00:00Z");

    @Mock
    private UserRssFeedRepository feedRepo;

    private InMemoryImportJobStore jobStore;
    private RssFeedService service;

    @BeforeEach
    void setUp() {
        jobStore = new InMemoryImportJobStore();
        service = new RssFeedService(feedRepo, new ImportJobService(jobStore), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private UserRssFeed storedFeed(boolean autoImport) {
        UserRssFeed feed = new UserRssFeed();
        feed.setId(UUID.randomUUID());
        feed.setOwnerSubject("alice");
        feed.setUrl("https://feeds.example/movies.xml");
        feed.setIncludePattern("2160p");
        feed.setAutoImport(autoImport);
        feed.setDefaultMetaType(MetaType.MOVIE);
        when(feedRepo.findById(feed.getId())).thenReturn(Optional.of(feed));
        return feed;
    }

    private static List<RssItem> items() {
        return List.of(
                new RssItem("Dune.2021.2160p.WEB", "magnet:?xt=urn:btih:" + "c".repeat(40), null, null),
                new RssItem("Dune.2021.1080p.WEB", "https://t.example/1.torrent", null, null),
                new RssItem("Show.S01E01.2160p", "https://i.example/2.nzb", null, MetaType.SERIES));
    }

    @Test
    void createDefaultsNameToUrlAndRejectsBadPattern() {
        when(feedRepo.save(any(UserRssFeed.class))).thenAnswer(inv -> inv.getArgument(0));

        UserRssFeed feed = service.create("alice", new RssFeedRequest(null, " https://feeds.example/a.xml ",
                "2160p", null, 0L, null, MetaType.SERIES, false, null));

        assertThat(feed.getName()).isEqualTo("https://feeds.example/a.xml");
        assertThat(feed.getMinSizeBytes()).isNull();
        assertThat(feed.getDefaultMetaType()).isEqualTo(MetaType.SERIES);
        assertThat(feed.isAutoImport()).isFalse();
        assertThat(feed.isActive()).isTrue();

        RssFeedRequest bad = new RssFeedRequest("x", "https://feeds.example/b.xml", "([", null, null, null, null, null, null);
        assertThatThrownBy(() -> service.create("alice", bad))
                .isInstanceOfSatisfying(ResponseStatusException.class,
                        ex -> assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST));
    }

    @Test
    void otherOwnersFeedIsNotFound() {
        UserRssFeed feed = storedFeed(true);

        assertThatThrownBy(() -> service.get(feed.getId(), "bob"))
                .isInstanceOfSatisfying(ResponseStatusException.class,
                        ex -> assertThat(ex.getReason()).isEqualTo("RSS_FEED_NOT_FOUND"));
        assertThat(service.get(feed.getId(), null)).isSameAs(feed);
    }

    @Test
    void autoImportQueuesAcceptedItems() {
        UserRssFeed feed = storedFeed(true);

        ImportOutcome outcome = service.processItems(feed.getId(), "alice", items());

        assertThat(outcome.status()).isEqualTo(ImportStatus.PROCESSING);
        assertThat(outcome.details()).containsEntry("received", 3).containsEntry("accepted", 2);
        ImportJobView job = jobStore.get(outcome.jobId()).orElseThrow();
        assertThat(job.type()).isEqualTo(ImportJobType.RSS);
        assertThat(job.total()).isEqualTo(2);
        assertThat(job.payload().get("items")).asInstanceOf(InstanceOfAssertFactories.LIST)
                .<Object>extracting(item -> ((Map<?, ?>) item).get("meta_type"))
                .containsExactly("movie", "series");
        assertThat(feed.getLastProcessedAt()).isEqualTo(NOW);
        verify(feedRepo).save(feed);
    }

    @Test
    void withoutAutoImportAcceptedItemsAreReturned() {
        UserRssFeed feed = storedFeed(false);

        ImportOutcome outcome = service.processItems(feed.getId(), "alice", items());

        assertThat(outcome.status()).isEqualTo(ImportStatus.SUCCESS);
        assertThat(outcome.jobId()).isNull();
        assertThat(outcome.details().get("items")).asInstanceOf(InstanceOfAssertFactories.LIST).hasSize(2);
    }

    @Test
    void inactiveFeedIsRejected() {
        UserRssFeed feed = storedFeed(true);
        feed.setActive(false);

        ImportOutcome outcome = service.processItems(feed.getId(), "alice", items());

        assertThat(outcome.errors()).extracting(ImportError::type).containsExactly(ImportErrorType.UNSUPPORTED_FORMAT);
        verify(feedRepo, never()).save(any());
    }
}
