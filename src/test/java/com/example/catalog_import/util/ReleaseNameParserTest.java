package com.example.catalog_import.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ReleaseNameParserTest {

    @Test
    void parsesSceneEpisodeName() {
        ReleaseNameParser.Parsed parsed = ReleaseNameParser.parse("The.Show.S01E02.1080p.WEB-DL.DDP5.1.H.264-GROUP.mkv");

        assertThat(parsed.title()).isEqualTo("The Show");
        assertThat(parsed.season()).isEqualTo(1);
        assertThat(parsed.episode()).isEqualTo(2);
        assertThat(parsed.year()).isNull();
        assertThat(parsed.release().resolution()).isEqualTo("1080p");
        assertThat(parsed.release().quality()).isEqualTo("WEB-DL");
        assertThat(parsed.release().codec()).isEqualTo("H.264");
        assertThat(parsed.release().audio()).contains("DD+");
        assertThat(parsed.release().releaseGroup()).isEqualTo("GROUP");
    }

    @Test
    void parsesMovieWithYear() {
        ReleaseNameParser.Parsed parsed = ReleaseNameParser.parse("Inception.2010.2160p.BluRay.REMUX.HEVC.DTS-HD.MA.5.1-FGT");

        assertThat(parsed.title()).isEqualTo("Inception");
        assertThat(parsed.year()).isEqualTo(2010);
        assertThat(parsed.hasEpisode()).isFalse();
        assertThat(parsed.release().resolution()).isEqualTo("2160p");
        assertThat(parsed.release().codec()).isEqualTo("HEVC");
    }

    @Test
    void recognisesMultiEpisodeAndAlternativeMarkers() {
        ReleaseNameParser.Parsed multi = ReleaseNameParser.parse("Show.S02E05E06.720p.HDTV.x264");
        assertThat(multi.season()).isEqualTo(2);
        assertThat(multi.episode()).isEqualTo(5);
        assertThat(multi.episodeEnd()).isEqualTo(6);

        ReleaseNameParser.Parsed cross = ReleaseNameParser.parse("Show 3x07 Title");
        assertThat(cross.season()).isEqualTo(3);
        assertThat(cross.episode()).isEqualTo(7);
        assertThat(cross.title()).isEqualTo("Show");
    }

    @Test
    void yearOnlyCountsAfterTheTitleStart() {
        ReleaseNameParser.Parsed parsed = ReleaseNameParser.parse("2012.2009.1080p.BluRay.x264");

        assertThat(parsed.title()).isEqualTo("2012");
        assertThat(parsed.year()).isEqualTo(2009);
    }

    @Test
    void blankNameGivesEmptyResult() {
        ReleaseNameParser.Parsed parsed = ReleaseNameParser.parse("  ");

        assertThat(parsed.title()).isNull();
        assertThat(parsed.release()).isEqualTo(com.example.catalog_import.dto.ReleaseInfo.empty());
    }

    @Test
    void detectsVideoFilesByExtension() {
        assertThat(ReleaseNameParser.isVideoFile("Movie.MKV")).isTrue();
        assertThat(ReleaseNameParser.isVideoFile("movie.nfo")).isFalse();
        assertThat(ReleaseNameParser.isVideoFile(null)).isFalse();
    }
}
