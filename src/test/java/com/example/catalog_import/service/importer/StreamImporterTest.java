package com.example.catalog_import.service.importer;

import com.example.catalog_import.dto.AnalyzedItem;
import com.example.catalog_import.dto.ImportResultItem;
import com.example.catalog_import.service.match.MediaDraft;
import com.example.catalog_import.service.match.MetadataAccessException;
import com.example.catalog_import.service.match.MetadataSearchProvider;
import com.example.catalog_import.util.MetaType;
import com.example.catalog_import.util.ResultItemStatus;
import com.example.catalog_import.util.SourceKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.QueryTimeoutException;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class StreamImporterTest {

    @Mock
    private CatalogStore catalogStore;

    @Mock
    private MetadataSearchProvider provider;

    private StreamImporter importer;

    @BeforeEach
    void setUp() {
        importer = new StreamImporter(catalogStore, List.of(provider));
    }

    private static CatalogWrite write(String identity) {
        AnalyzedItem item = new AnalyzedItem(SourceKind.MAGNET, identity, "Movie.2001", "Movie", 2001, null, null,
                null, null, null);
        return new CatalogWrite(item, MediaDraft.basic("tmdb:1", MetaType.MOVIE, "Movie", 2001, null, false),
                null, null, null, null);
    }

    @Test
    void existingIdentityIsSkippedAndRefreshed() {
        UUID streamId = UUID.randomUUID();
        CatalogWrite write = write("aaa");
        when(catalogStore.findStreamByContentIdentity("aaa")).thenReturn(Optional.of(new StreamRef(streamId, UUID.randomUUID())));

        ImportResultItem result = importer.commit(write);

        assertThat(result.status()).isEqualTo(ResultItemStatus.SKIPPED);
        assertThat(result.streamId()).isEqualTo(streamId);
        verify(catalogStore).refreshStream(streamId, write.item());
        verify(catalogStore, never()).persist(any());
    }

    @Test
    void concurrentWriterWinsRace() {
        UUID winner = UUID.randomUUID();
        when(catalogStore.findStreamByContentIdentity("bbb"))
                .thenReturn(Optional.empty())
                .thenReturn(Optional.of(new StreamRef(winner, UUID.randomUUID())));
        when(catalogStore.persist(any())).thenThrow(new DataIntegrityViolationException("uq_stream_identity"));

        ImportResultItem result = importer.commit(write("bbb"));

        assertThat(result.status()).isEqualTo(ResultItemStatus.SKIPPED);
        assertThat(result.streamId()).isEqualTo(winner);
    }

    @Test
    void otherConstraintViolationsFailAfterRetry() {
        when(catalogStore.findStreamByContentIdentity("ccc")).thenReturn(Optional.empty());
        when(catalogStore.persist(any())).thenThrow(new DataIntegrityViolationException("fk_media"));

        ImportResultItem result = importer.commit(write("ccc"));

        assertThat(result.status()).isEqualTo(ResultItemStatus.FAILED);
        assertThat(result.message()).contains("fk_media");
        verify(catalogStore, times(2)).persist(any());
    }

    @Test
    void dataAccessFailureIsReported() {
        when(catalogStore.findStreamByContentIdentity("ddd")).thenReturn(Optional.empty());
        when(catalogStore.persist(any())).thenThrow(new QueryTimeoutException("statement timeout"));

        ImportResultItem result = importer.commit(write("ddd"));

        assertThat(result.status()).isEqualTo(ResultItemStatus.FAILED);
        assertThat(result.message()).contains("statement timeout");
    }

    @Test
    void successReturnsStreamAndMedia() {
        CommitResult committed = new CommitResult(UUID.randomUUID(), UUID.randomUUID(), 1);
        when(catalogStore.findStreamByContentIdentity("eee")).thenReturn(Optional.empty());
        when(catalogStore.persist(any())).thenReturn(committed);

        ImportResultItem result = importer.commit(write("eee"));

        assertThat(result.status()).isEqualTo(ResultItemStatus.SUCCESS);
        assertThat(result.streamId()).isEqualTo(committed.streamId());
        assertThat(result.mediaId()).isEqualTo(committed.mediaId());
    }

    @Test
    void resolveDraftFallsBackFromCatalogToProviderToBareRecord() {
        when(catalogStore.findMediaByExternalId(any())).thenReturn(Optional.empty());
        when(provider.fetch("tmdb:5", MetaType.MOVIE)).thenReturn(Optional.of(
                MediaDraft.basic("tmdb:5", MetaType.MOVIE, "Fetched", 1999, "p.jpg", false)));
        when(provider.fetch("tmdb:6", MetaType.MOVIE)).thenThrow(new MetadataAccessException("down", null));

        assertThat(importer.resolveDraft("tmdb:5", MetaType.MOVIE, "Fallback", 2000, null).title()).isEqualTo("Fetched");

        MediaDraft bare = importer.resolveDraft("tmdb:6", MetaType.MOVIE, "Fallback", 2000, "logo.png");
        assertThat(bare.title()).isEqualTo("Fallback");
        assertThat(bare.year()).isEqualTo(2000);
        assertThat(bare.userCreated()).isFalse();
    }

    @Test
    void derivedMediaIdsAreDeterministic() {
        assertThat(StreamImporter.userMedia(MetaType.SERIES, "Amélie's Show!", 2019, null).externalId())
                .isEqualTo("user:series:amelie-s-show-2019");
        assertThat(StreamImporter.userMedia(MetaType.MOVIE, "Home Video", null, null).userCreated()).isTrue();
        assertThat(StreamImporter.channelMedia("CNN Intl HD", null).externalId()).isEqualTo("tv:cnn-intl-hd");
        assertThat(StreamImporter.slug("***")).isEqualTo("channel");
    }
}
