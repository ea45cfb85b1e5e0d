package com.example.catalog_import.service.validation;

import com.example.catalog_import.config.ImportProperties;
import com.example.catalog_import.dto.AnalyzedItem;
import com.example.catalog_import.dto.FileEntry;
import com.example.catalog_import.dto.ImportError;
import com.example.catalog_import.dto.ImportOutcome;
import com.example.catalog_import.dto.Match;
import com.example.catalog_import.service.source.SourceFiles;
import com.example.catalog_import.util.ImportErrorType;
import com.example.catalog_import.util.MetaType;
import com.example.catalog_import.util.ReleaseNameParser;
import com.example.catalog_import.util.SourceKind;
import com.example.catalog_import.util.TitleSimilarity;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Content and metadata policy. Every method is a pure function of its arguments and the configured policy.
 *
 * <p>Hard failures (duplicate, blocked content) end the import. Missing episode numbers on a series branch to
 * annotation. Soft failures can be accepted with {@code force_import} plus the token that fingerprints them.
 */
@Component
public class ImportValidator {
    private static final Set<SourceKind> FILE_BASED = EnumSet.of(SourceKind.TORRENT, SourceKind.MAGNET, SourceKind.NZB);

    private final ImportProperties.Validation policy;

    public ImportValidator(ImportProperties properties) {
        this.policy = properties.getValidation();
    }

    /**
     * Checks that do not depend on the selected media: duplicate identity, blocked keywords, then missing
     * season/episode numbers for series.
     */
    public Optional<ImportOutcome> screen(AnalyzedItem item, ValidationContext context) {
        if (context.contentExists()) {
            return Optional.of(ImportOutcome.duplicate(item.contentIdentity(), context.existingStreamId()));
        }
        String blocked = blockedKeyword(item);
        if (blocked != null) {
            ImportOutcome outcome = ImportOutcome.error(ImportErrorType.BLOCKED_CONTENT,
                    "Content contains blocked keyword '" + blocked + "'");
            return Optional.of(outcome);
        }
        if (needsAnnotation(item, context.metaType())) {
            return Optional.of(ImportOutcome.needsAnnotation(item.contentIdentity(), item.files(),
                    context.analysisHandle()));
        }
        return Optional.empty();
    }

    /**
     * Soft checks against the selected media. A forced import passes only when its token matches the errors
     * recomputed for this exact payload. A failure echoes the selected media as its only candidate.
     */
    public Optional<ImportOutcome> validate(AnalyzedItem item, Match selected, ValidationContext context) {
        List<ImportError> errors = softErrors(item, selected, context.metaType());
        if (errors.isEmpty()) {
            return Optional.empty();
        }
        String token = fingerprint(item, selected, context.metaType(), errors);
        if (context.forceImport() && token.equals(context.validationToken())) {
            return Optional.empty();
        }
        ImportOutcome failed = ImportOutcome.validationFailed(item.contentIdentity(), errors, token)
                .withAnalysisHandle(context.analysisHandle());
        return Optional.of(selected == null ? failed : failed.withCandidateMatches(List.of(selected)));
    }

    List<ImportError> softErrors(AnalyzedItem item, Match selected, MetaType metaType) {
        List<ImportError> errors = new ArrayList<>();
        if (selected != null && metaType != MetaType.TV && item.parsedTitle() != null && selected.title() != null) {
            double similarity = TitleSimilarity.similarity(item.parsedTitle(), selected.title());
            if (similarity < policy.getTitleSimilarityThreshold()) {
                errors.add(new ImportError(ImportErrorType.TITLE_MISMATCH,
                        "Parsed title '%s' does not look like '%s'".formatted(item.parsedTitle(), selected.title())));
            }
        }
        if (selected != null && item.parsedYear() != null && selected.year() != null
                && Math.abs(item.parsedYear() - selected.year()) > policy.getMaxYearDifference()) {
            errors.add(new ImportError(ImportErrorType.YEAR_MISMATCH,
                    "Parsed year %d differs from %d".formatted(item.parsedYear(), selected.year())));
        }
        List<FileEntry> videos = item.includedFiles().stream()
                .filter(f -> ReleaseNameParser.isVideoFile(f.filename()))
                .toList();
        if (metaType == MetaType.MOVIE && videos.size() > policy.getMaxMovieVideoFiles()) {
            errors.add(new ImportError(ImportErrorType.MULTIPLE_VIDEO_FILES,
                    "Movie contains %d video files".formatted(videos.size())));
        }
        if (FILE_BASED.contains(item.sourceKind())) {
            List<String> small = videos.stream()
                    .filter(f -> f.size() > 0 && f.size() < policy.getMinVideoFileBytes())
                    .map(f -> SourceFiles.baseName(f.filename()))
                    .toList();
            if (!small.isEmpty()) {
                errors.add(new ImportError(ImportErrorType.SUSPICIOUS_FILE_SIZE,
                        "Video files smaller than %d MB: %s".formatted(policy.getMinVideoFileBytes() / (1024 * 1024),
                                String.join(", ", small))));
            }
        }
        return errors;
    }

    /** SHA-256 over identity, meta type, selected media and the sorted errors. */
    public static String fingerprint(AnalyzedItem item, Match selected, MetaType metaType, List<ImportError> errors) {
        String joined = errors.stream()
                .sorted(Comparator.comparing((ImportError e) -> e.type().id()).thenComparing(ImportError::message))
                .map(e -> e.type().id() + ":" + e.message())
                .collect(Collectors.joining("\n"));
        String material = String.join("|",
                String.valueOf(item.contentIdentity()),
                metaType == null ? "" : metaType.id(),
                selected == null ? "" : String.valueOf(selected.externalId()),
                joined);
        return SourceFiles.sha256Hex(material.getBytes(StandardCharsets.UTF_8));
    }

    static boolean needsAnnotation(AnalyzedItem item, MetaType metaType) {
        if (metaType != MetaType.SERIES || !item.filesKnown() || item.files().isEmpty()) {
            return false;
        }
        List<FileEntry> included = item.includedFiles();
        return included.isEmpty() || included.stream().anyMatch(f -> !f.hasEpisodeInfo());
    }

    private String blockedKeyword(AnalyzedItem item) {
        List<String> keywords = policy.getBlockedKeywords();
        if (keywords == null || keywords.isEmpty()) {
            return null;
        }
        StringBuilder haystack = new StringBuilder();
        haystack.append(item.displayName()).append('\n').append(item.parsedTitle());
        if (item.files() != null) {
            item.files().forEach(f -> haystack.append('\n').append(f.filename()));
        }
        String text = haystack.toString().toLowerCase(Locale.ROOT);
        return keywords.stream()
                .filter(k -> k != null && !k.isBlank())
                .filter(k -> text.contains(k.toLowerCase(Locale.ROOT)))
                .findFirst()
                .orElse(null);
    }
}
