package com.example.catalog_import.service.source.m3u;

import com.example.catalog_import.util.M3uContentType;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class M3uContentClassifierTest {

    @Test
    void groupKeywordsMatchWholeWords() {
        assertThat(M3uContentClassifier.fromGroup("Kids Shows")).isEqualTo(M3uContentType.SERIES);
        assertThat(M3uContentClassifier.fromGroup("FILMS | HD")).isEqualTo(M3uContentType.MOVIE);
        assertThat(M3uContentClassifier.fromGroup("UK: Sports")).isEqualTo(M3uContentType.TV);
        assertThat(M3uContentClassifier.fromGroup("Newsletter")).isEqualTo(M3uContentType.UNKNOWN);
        assertThat(M3uContentClassifier.fromGroup(null)).isEqualTo(M3uContentType.UNKNOWN);
    }

    @Test
    void urlPathAndExtensionAreFallbacks() {
        assertThat(M3uContentClassifier.fromUrl("http://x.example/series/u/p/1.mkv")).isEqualTo(M3uContentType.SERIES);
        assertThat(M3uContentClassifier.fromUrl("http://x.example/movie/u/p/1.ts")).isEqualTo(M3uContentType.MOVIE);
        assertThat(M3uContentClassifier.fromUrl("http://x.example/stream.m3u8")).isEqualTo(M3uContentType.TV);
        assertThat(M3uContentClassifier.fromUrl("http://x.example/video.mkv")).isEqualTo(M3uContentType.MOVIE);
        assertThat(M3uContentClassifier.fromUrl("http://x.example/play")).isEqualTo(M3uContentType.UNKNOWN);
    }

    @Test
    void titleSignalsWinOverGroup() {
        M3uContentClassifier.Classification episode = M3uContentClassifier.classify("The Office 2x05", "Movies", null);
        assertThat(episode.type()).isEqualTo(M3uContentType.SERIES);
        assertThat(episode.season()).isEqualTo(2);
        assertThat(episode.episode()).isEqualTo(5);
        assertThat(episode.title()).isEqualTo("The Office");

        M3uContentClassifier.Classification movie = M3uContentClassifier.classify("Heat (1995)", "Live TV", null);
        assertThat(movie.type()).isEqualTo(M3uContentType.MOVIE);
        assertThat(movie.year()).isEqualTo(1995);
    }

    @Test
    void seriesFromUrlDefaultsToFirstEpisode() {
        M3uContentClassifier.Classification c = M3uContentClassifier.classify("Something", null, "http://x.example/series/1");

        assertThat(c.type()).isEqualTo(M3uContentType.SERIES);
        assertThat(c.season()).isEqualTo(1);
        assertThat(c.episode()).isEqualTo(1);
    }
}
