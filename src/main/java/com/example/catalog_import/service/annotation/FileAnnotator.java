package com.example.catalog_import.service.annotation;

import com.example.catalog_import.dto.FileEntry;
import com.example.catalog_import.service.source.SourceFiles;
import com.example.catalog_import.util.NaturalOrderComparator;
import com.example.catalog_import.util.ReleaseNameParser;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Assigns season/episode numbers to files. Steps, each seeing the result of the previous one:
 * include/exclude overrides, bulk season or multi-season distribution over the included files in natural
 * filename order, per-file overrides, then filename heuristics for whatever is still missing.
 *
 * <p>Excluded files stay in the result; the original order is kept.
 */
@Component
public class FileAnnotator {

    public List<FileEntry> annotate(List<FileEntry> files, AnnotationHints hints) {
        if (files == null) {
            return null;
        }
        AnnotationHints effective = hints == null ? AnnotationHints.none() : hints;
        Map<Integer, FileAnnotation> overrides = new HashMap<>();
        for (FileAnnotation override : effective.files()) {
            overrides.put(override.index(), override);
        }

        Map<Integer, FileEntry> byIndex = new LinkedHashMap<>();
        for (FileEntry file : files) {
            FileAnnotation override = overrides.get(file.index());
            byIndex.put(file.index(), override != null && override.included() != null
                    ? file.withIncluded(override.included())
                    : file);
        }

        List<FileEntry> ordered = byIndex.values().stream()
                .filter(FileEntry::included)
                .sorted(Comparator.comparing(FileEntry::filename, NaturalOrderComparator.INSTANCE))
                .toList();

        if (effective.bulkSeason() != null) {
            for (int i = 0; i < ordered.size(); i++) {
                FileEntry file = ordered.get(i);
                Integer episode = file.episode() != null ? file.episode() : i + 1;
                byIndex.put(file.index(), file.withAssignment(effective.bulkSeason(), episode, file.episodeEnd()));
            }
        } else if (effective.seasons() != null && !effective.seasons().isBlank()) {
            List<Integer> seasons = SeasonRangeParser.parse(effective.seasons());
            distribute(ordered, seasons, effective, byIndex);
        }

        for (FileAnnotation override : effective.files()) {
            FileEntry file = byIndex.get(override.index());
            if (file == null) {
                continue;
            }
            FileEntry updated = file.withAssignment(
                    override.season() != null ? override.season() : file.season(),
                    override.episode() != null ? override.episode() : file.episode(),
                    override.episodeEnd() != null ? override.episodeEnd() : file.episodeEnd());
            if (override.metaId() != null && !override.metaId().isBlank()) {
                updated = updated.withMetaId(override.metaId());
            }
            byIndex.put(override.index(), updated);
        }

        List<FileEntry> result = new ArrayList<>(files.size());
        for (FileEntry file : byIndex.values()) {
            result.add(fillFromFilename(file));
        }
        return result;
    }

    private void distribute(List<FileEntry> ordered, List<Integer> seasons, AnnotationHints hints,
                            Map<Integer, FileEntry> byIndex) {
        int n = ordered.size();
        if (n == 0) {
            return;
        }
        int perSeason;
        if (hints.mode() == DistributionMode.MANUAL && hints.episodesPerSeason() != null
                && hints.episodesPerSeason() > 0) {
            perSeason = hints.episodesPerSeason();
        } else {
            perSeason = (n + seasons.size() - 1) / seasons.size();
        }
        int last = seasons.size() - 1;
        for (int i = 0; i < n; i++) {
            int slot = Math.min(i / perSeason, last);
            int episode = i - slot * perSeason + 1;
            FileEntry file = ordered.get(i);
            byIndex.put(file.index(), file.withAssignment(seasons.get(slot), episode, null));
        }
    }

    private FileEntry fillFromFilename(FileEntry file) {
        if (file.season() != null && file.episode() != null) {
            return file;
        }
        ReleaseNameParser.Parsed parsed = ReleaseNameParser.parse(SourceFiles.baseName(file.filename()));
        Integer season = file.season() != null ? file.season() : parsed.season();
        Integer episode = file.episode() != null ? file.episode() : parsed.episode();
        Integer episodeEnd = file.episodeEnd() != null ? file.episodeEnd()
                : (file.episode() == null ? parsed.episodeEnd() : null);
        return file.withAssignment(season, episode, episodeEnd);
    }
}
