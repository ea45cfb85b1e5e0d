package com.example.catalog_import.dto;

import com.example.catalog_import.util.SourceKind;

import java.util.List;
import java.util.Map;

/**
 * Normalized result of analyzing one source input. Never persisted directly.
 *
 * <p>{@code files == null} means the file list is not known yet (e.g. an unresolved magnet);
 * an empty list means the source has zero files.
 */
public record AnalyzedItem(
        SourceKind sourceKind,
        String contentIdentity,
        String displayName,
        String parsedTitle,
        Integer parsedYear,
        ReleaseInfo release,
        Long totalSize,
        List<FileEntry> files,
        List<Match> candidateMatches,
        Map<String, Object> attributes
) {
    public AnalyzedItem {
        release = release == null ? ReleaseInfo.empty() : release;
        files = files == null ? null : List.copyOf(files);
        candidateMatches = candidateMatches == null ? List.of() : List.copyOf(candidateMatches);
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }

    public boolean filesKnown() {
        return files != null;
    }

    public List<FileEntry> includedFiles() {
        if (files == null) {
            return List.of();
        }
        return files.stream().filter(FileEntry::included).toList();
    }

    public AnalyzedItem withFiles(List<FileEntry> files) {
        return new AnalyzedItem(sourceKind, contentIdentity, displayName, parsedTitle, parsedYear, release, totalSize,
                files, candidateMatches, attributes);
    }

    public AnalyzedItem withCandidateMatches(List<Match> matches) {
        return new AnalyzedItem(sourceKind, contentIdentity, displayName, parsedTitle, parsedYear, release, totalSize,
                files, matches, attributes);
    }

    public String attribute(String key) {
        Object value = attributes.get(key);
        return value == null ? null : value.toString();
    }
}
