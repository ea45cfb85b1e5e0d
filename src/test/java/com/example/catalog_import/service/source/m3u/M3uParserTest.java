package com.example.catalog_import.service.source.m3u;

import com.example.catalog_import.service.source.AnalysisException;
import com.example.catalog_import.util.ImportErrorType;
import com.example.catalog_import.util.M3uContentType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class M3uParserTest {

    private static final String PLAYLIST = """
            #EXTM3U x-tvg-url="http://epg.example/guide.xml"
            #EXTINF:-1 tvg-id="cnn.us" tvg-name="CNN" tvg-logo="http://logo.example/cnn.png" tvg-country="US" group-title="News",CNN International
            http://stream.example/live/user/pass/1.ts
            #EXTINF:-1 group-title="Movies",The Matrix (1999)
            http://stream.example/movie/user/pass/55.mp4

            #EXTINF:-1 group-title="Series",Breaking Bad S01E02
            http://stream.example/series/user/pass/9.mkv
            #EXTINF:-1,Channel, with a comma
            #EXTGRP:Sports;Live
            http://stream.example/other/7
            """;

    @Test
    void parsesEntriesInOrderWithAttributes() {
        List<M3uEntry> entries = M3uParser.parse(PLAYLIST);

        assertThat(entries).hasSize(4);
        assertThat(entries).extracting(M3uEntry::index).containsExactly(0, 1, 2, 3);

        M3uEntry cnn = entries.get(0);
        assertThat(cnn.name()).isEqualTo("CNN International");
        assertThat(cnn.tvgId()).isEqualTo("cnn.us");
        assertThat(cnn.tvgName()).isEqualTo("CNN");
        assertThat(cnn.logo()).isEqualTo("http://logo.example/cnn.png");
        assertThat(cnn.country()).isEqualTo("US");
        assertThat(cnn.groupTitle()).isEqualTo("News");
        assertThat(cnn.detectedType()).isEqualTo(M3uContentType.TV);
    }

    @Test
    void classifiesMoviesAndEpisodes() {
        List<M3uEntry> entries = M3uParser.parse(PLAYLIST);

        M3uEntry movie = entries.get(1);
        assertThat(movie.detectedType()).isEqualTo(M3uContentType.MOVIE);
        assertThat(movie.parsedTitle()).isEqualTo("The Matrix");
        assertThat(movie.parsedYear()).isEqualTo(1999);

        M3uEntry episode = entries.get(2);
        assertThat(episode.detectedType()).isEqualTo(M3uContentType.SERIES);
        assertThat(episode.parsedTitle()).isEqualTo("Breaking Bad");
        assertThat(episode.season()).isEqualTo(1);
        assertThat(episode.episode()).isEqualTo(2);
    }

    @Test
    void keepsCommasInDisplayNameAndReadsExtGrp() {
        M3uEntry entry = M3uParser.parse(PLAYLIST).get(3);

        assertThat(entry.name()).isEqualTo("Channel, with a comma");
        assertThat(entry.groupTitle()).isEqualTo("Sports;Live");
        assertThat(entry.genres()).containsExactly("Sports", "Live");
        assertThat(entry.detectedType()).isEqualTo(M3uContentType.TV);
    }

    @Test
    void plainUrlListsAreAccepted() {
        List<M3uEntry> entries = M3uParser.parse("http://a.example/one.m3u8\r\nhttp://a.example/two.mp4?token=1\r\n");

        assertThat(entries).extracting(M3uEntry::name).containsExactly("one.m3u8", "two.mp4");
        assertThat(entries).extracting(M3uEntry::detectedType).containsExactly(M3uContentType.TV, M3uContentType.MOVIE);
    }

    @Test
    void rejectsEmptyPlaylists() {
        assertThatThrownBy(() -> M3uParser.parse("#EXTM3U\n#EXTINF:-1,Dangling\n"))
                .isInstanceOf(AnalysisException.class)
                .extracting(ex -> ((AnalysisException) ex).getType())
                .isEqualTo(ImportErrorType.MALFORMED_INPUT);
        assertThatThrownBy(() -> M3uParser.parse("   "))
                .isInstanceOf(AnalysisException.class);
        assertThatThrownBy(() -> M3uParser.parse("# just a comment"))
                .extracting(ex -> ((AnalysisException) ex).getType())
                .isEqualTo(ImportErrorType.UNSUPPORTED_FORMAT);
    }
}
