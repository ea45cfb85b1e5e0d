package com.example.catalog_import.service.annotation;

import com.example.catalog_import.dto.FileEntry;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class FileAnnotatorTest {
    private final FileAnnotator annotator = new FileAnnotator();

    private static List<FileEntry> clips(int count) {
        List<FileEntry> files = new ArrayList<>();
        // reverse order so sorting is observable
        for (int i = count; i >= 1; i--) {
            files.add(FileEntry.of(files.size(), "clip_" + i + ".mkv", 100L));
        }
        return files;
    }

    private static FileEntry byName(List<FileEntry> files, String name) {
        return files.stream().filter(f -> f.filename().equals(name)).findFirst().orElseThrow();
    }

    @Test
    void distributesFilesEvenlyOverSeasonRange() {
        List<FileEntry> files = clips(10);

        List<FileEntry> result = annotator.annotate(files, new AnnotationHints(null, "1-2", null, null, null));

        assertThat(result).extracting(FileEntry::filename).containsExactlyElementsOf(
                files.stream().map(FileEntry::filename).toList());
        for (int i = 1; i <= 5; i++) {
            FileEntry file = byName(result, "clip_" + i + ".mkv");
            assertThat(file.season()).isEqualTo(1);
            assertThat(file.episode()).isEqualTo(i);
        }
        for (int i = 6; i <= 10; i++) {
            FileEntry file = byName(result, "clip_" + i + ".mkv");
            assertThat(file.season()).isEqualTo(2);
            assertThat(file.episode()).isEqualTo(i - 5);
        }
    }

    @Test
    void manualModeOverflowsIntoLastSeason() {
        List<FileEntry> result = annotator.annotate(clips(7),
                new AnnotationHints(null, "1-2", DistributionMode.MANUAL, 3, null));

        assertThat(byName(result, "clip_3.mkv").season()).isEqualTo(1);
        assertThat(byName(result, "clip_3.mkv").episode()).isEqualTo(3);
        assertThat(byName(result, "clip_4.mkv").season()).isEqualTo(2);
        assertThat(byName(result, "clip_4.mkv").episode()).isEqualTo(1);
        assertThat(byName(result, "clip_7.mkv").season()).isEqualTo(2);
        assertThat(byName(result, "clip_7.mkv").episode()).isEqualTo(4);
    }

    @Test
    void bulkSeasonKeepsParsedEpisodes() {
        List<FileEntry> files = List.of(
                FileEntry.of(0, "Show.E07.mkv", 10L).withAssignment(null, 7, null),
                FileEntry.of(1, "extra_a.mkv", 10L),
                FileEntry.of(2, "extra_b.mkv", 10L));

        List<FileEntry> result = annotator.annotate(files, new AnnotationHints(3, null, null, null, null));

        assertThat(result).extracting(FileEntry::season).containsOnly(3);
        assertThat(result.get(0).episode()).isEqualTo(7);
        assertThat(result.get(1).episode()).isEqualTo(1);
        assertThat(result.get(2).episode()).isEqualTo(2);
    }

    @Test
    void perFileOverridesWinAndExcludedFilesStay() {
        List<FileEntry> files = clips(3);
        List<FileAnnotation> overrides = List.of(
                new FileAnnotation(0, null, null, null, false, null),
                new FileAnnotation(1, 4, 9, 10, null, "tmdb:77"));

        List<FileEntry> result = annotator.annotate(files, new AnnotationHints(1, null, null, null, overrides));

        assertThat(result).hasSize(3);
        assertThat(result.get(0).included()).isFalse();
        assertThat(result.get(1).season()).isEqualTo(4);
        assertThat(result.get(1).episode()).isEqualTo(9);
        assertThat(result.get(1).episodeEnd()).isEqualTo(10);
        assertThat(result.get(1).metaId()).isEqualTo("tmdb:77");
        // clip_1 is first among the two included files
        assertThat(result.get(2).filename()).isEqualTo("clip_1.mkv");
        assertThat(result.get(2).episode()).isEqualTo(1);
    }

    @Test
    void filenameHeuristicsFillMissingNumbers() {
        List<FileEntry> files = List.of(FileEntry.of(0, "season 2/Show.S02E03E04.mkv", 10L));

        List<FileEntry> result = annotator.annotate(files, AnnotationHints.none());

        assertThat(result.get(0).season()).isEqualTo(2);
        assertThat(result.get(0).episode()).isEqualTo(3);
        assertThat(result.get(0).episodeEnd()).isEqualTo(4);
    }

    @Test
    void unknownFileListStaysUnknown() {
        assertThat(annotator.annotate(null, AnnotationHints.none())).isNull();
    }
}
