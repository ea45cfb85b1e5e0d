package com.example.catalog_import.service.source.torrent;

import com.example.catalog_import.dto.AnalyzedItem;
import com.example.catalog_import.service.source.AnalysisException;
import com.example.catalog_import.service.source.ImportSource;
import com.example.catalog_import.util.ImportErrorType;
import com.example.catalog_import.util.SourceKind;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MagnetLinkTest {
    private static final String HASH = "c12fe1c06bba254a9dc9f519b335aa7c1367a88a";

    @Test
    void parsesHexHashNameAndTrackers() {
        MagnetLink link = MagnetLink.parse("magnet:?xt=urn:btih:" + HASH.toUpperCase()
                + "&dn=Inception.2010.1080p.BluRay.x264-GRP&tr=udp%3A%2F%2Ftracker.example.org%3A1337&xl=123");

        assertThat(link.infoHash()).isEqualTo(HASH);
        assertThat(link.displayName()).isEqualTo("Inception.2010.1080p.BluRay.x264-GRP");
        assertThat(link.trackers()).containsExactly("udp://tracker.example.org:1337");
        assertThat(link.exactLength()).isEqualTo(123L);
    }

    @Test
    void decodesBase32Hash() {
        MagnetLink link = MagnetLink.parse("magnet:?xt=urn:btih:YEX6DQDLXISUVHOJ6UM3GNNKPQJWPKEK");

        assertThat(link.infoHash()).isEqualTo(HASH);
    }

    @Test
    void rejectsLinksWithoutBtih() {
        assertThatThrownBy(() -> MagnetLink.parse("magnet:?dn=foo"))
                .isInstanceOf(AnalysisException.class)
                .extracting(ex -> ((AnalysisException) ex).getType())
                .isEqualTo(ImportErrorType.MALFORMED_INPUT);
        assertThatThrownBy(() -> MagnetLink.parse("magnet:?xt=urn:btmh:1220abcd"))
                .extracting(ex -> ((AnalysisException) ex).getType())
                .isEqualTo(ImportErrorType.UNSUPPORTED_FORMAT);
        assertThatThrownBy(() -> MagnetLink.parse("http://example.com"))
                .isInstanceOf(AnalysisException.class);
        assertThatThrownBy(() -> MagnetLink.parse("magnet:?xt=urn:btih:1234"))
                .hasMessageContaining("Invalid info hash");
    }

    @Test
    void unresolvedMagnetKeepsFileListUnknown() {
        MagnetSourceAdapter adapter = new MagnetSourceAdapter(hash -> Optional.empty());

        AnalyzedItem item = adapter.analyze(new ImportSource.Magnet("magnet:?xt=urn:btih:" + HASH + "&dn=The.Show.S01.720p"), null);

        assertThat(item.sourceKind()).isEqualTo(SourceKind.MAGNET);
        assertThat(item.contentIdentity()).isEqualTo(HASH);
        assertThat(item.filesKnown()).isFalse();
        assertThat(item.parsedTitle()).isEqualTo("The Show");
    }

    @Test
    void resolvedMagnetMergesTrackers() {
        TorrentMetainfo meta = new TorrentMetainfo(HASH, "Movie.2001.mkv",
                List.of(com.example.catalog_import.service.source.SourceFiles.entry(0, "Movie.2001.mkv", 10L)),
                10L, List.of("udp://a"), false, null, null);
        MagnetSourceAdapter adapter = new MagnetSourceAdapter(hash -> Optional.of(meta));

        AnalyzedItem item = adapter.analyze(new ImportSource.Magnet("magnet:?xt=urn:btih:" + HASH + "&tr=udp://b"), null);

        assertThat(item.filesKnown()).isTrue();
        assertThat(item.files()).hasSize(1);
        assertThat(item.displayName()).isEqualTo("Movie.2001.mkv");
        assertThat((List<Object>) item.attributes().get("trackers")).containsExactly("udp://a", "udp://b");
    }
}
