package com.example.catalog_import.service.importer;

import com.example.catalog_import.dto.AnalyzedItem;
import com.example.catalog_import.dto.FileEntry;
import com.example.catalog_import.dto.ImportOutcome;
import com.example.catalog_import.dto.ImportResultItem;
import com.example.catalog_import.dto.Match;
import com.example.catalog_import.service.annotation.AnnotationHints;
import com.example.catalog_import.service.annotation.FileAnnotator;
import com.example.catalog_import.service.match.CatalogMatcher;
import com.example.catalog_import.service.match.MediaDraft;
import com.example.catalog_import.service.source.AnalysisException;
import com.example.catalog_import.service.source.ImportSource;
import com.example.catalog_import.service.source.SourceAdapterRegistry;
import com.example.catalog_import.service.source.SourceFiles;
import com.example.catalog_import.service.validation.ImportValidator;
import com.example.catalog_import.service.validation.ValidationContext;
import com.example.catalog_import.util.ImportErrorType;
import com.example.catalog_import.util.MetaType;
import com.example.catalog_import.util.ReleaseNameParser;
import com.example.catalog_import.util.ResultItemStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Single-item import: analyze (or load a cached analysis), annotate, screen, match, select media,
 * validate, commit. Every failure becomes an {@link ImportOutcome}; nothing escapes as an exception.
 */
@Service
public class ImportPipeline {
    private static final Logger LOGGER = LoggerFactory.getLogger(ImportPipeline.class);

    private final SourceAdapterRegistry adapters;
    private final AnalysisCache analysisCache;
    private final FileAnnotator annotator;
    private final ImportValidator validator;
    private final CatalogMatcher matcher;
    private final CatalogStore catalogStore;
    private final StreamImporter streamImporter;

    public ImportPipeline(SourceAdapterRegistry adapters,
                          AnalysisCache analysisCache,
                          FileAnnotator annotator,
                          ImportValidator validator,
                          CatalogMatcher matcher,
                          CatalogStore catalogStore,
                          StreamImporter streamImporter) {
        this.adapters = adapters;
        this.analysisCache = analysisCache;
        this.annotator = annotator;
        this.validator = validator;
        this.matcher = matcher;
        this.catalogStore = catalogStore;
        this.streamImporter = streamImporter;
    }

    /** Analyzes a source, ranks candidates and caches the result under a handle. */
    public AnalysisResult analyze(ImportSource source, MetaType requestedType) {
        MetaType metaType = requestedType == null ? MetaType.MOVIE : requestedType;
        Loaded loaded = load(source, metaType);
        AnalyzedItem item = loaded.item();
        List<Match> candidates = metaType == MetaType.TV && item.parsedTitle() == null
                ? List.of()
                : matcher.match(item.parsedTitle(), item.parsedYear(), metaType);
        AnalyzedItem withMatches = item.withCandidateMatches(candidates);
        analysisCache.update(loaded.handle(), new CachedAnalysis(withMatches, metaType));
        UUID existing = catalogStore.findStreamByContentIdentity(item.contentIdentity())
                .map(StreamRef::streamId)
                .orElse(null);
        LOGGER.info("ANALYZE kind={} identity={} files={} candidates={} handle={}", item.sourceKind(),
                item.contentIdentity(), item.filesKnown() ? item.files().size() : "unknown", candidates.size(),
                loaded.handle());
        return new AnalysisResult(withMatches, loaded.handle(), existing);
    }

    /** Applies annotation hints to a cached analysis without importing anything. */
    public List<FileEntry> previewAnnotation(String handle, AnnotationHints hints) {
        CachedAnalysis cached = analysisCache.get(handle, CachedAnalysis.class)
                .orElseThrow(() -> new AnalysisException(ImportErrorType.ANALYSIS_EXPIRED,
                        "Analysis expired; analyze the source again"));
        if (!cached.item().filesKnown()) {
            return List.of();
        }
        return annotator.annotate(cached.item().files(), hints);
    }

    public ImportOutcome importContent(ImportRequest request) {
        MetaType metaType = request.metaType() == null ? MetaType.MOVIE : request.metaType();
        Loaded loaded;
        try {
            loaded = load(request.source(), metaType);
        } catch (AnalysisException ex) {
            LOGGER.info("IMPORT REJECTED type={} message={}", ex.getType().id(), ex.getMessage());
            return ImportOutcome.error(ex.getType(), ex.getMessage());
        }
        String handle = loaded.handle();
        AnalyzedItem item = loaded.item();
        try {
            if (item.filesKnown()) {
                item = item.withFiles(annotator.annotate(item.files(), request.effectiveHints()));
            }
        } catch (AnalysisException ex) {
            return ImportOutcome.error(ex.getType(), ex.getMessage()).withAnalysisHandle(handle);
        }

        UUID existingStream = catalogStore.findStreamByContentIdentity(item.contentIdentity())
                .map(StreamRef::streamId)
                .orElse(null);
        ValidationContext context = new ValidationContext(metaType, request.forceImport(), request.validationToken(),
                existingStream, handle);
        Optional<ImportOutcome> screened = validator.screen(item, context);
        if (screened.isPresent()) {
            log(item, screened.get());
            return screened.get();
        }

        Selection selection = select(item, metaType, request);
        if (selection.outcome() != null) {
            ImportOutcome outcome = selection.outcome().withAnalysisHandle(handle);
            log(item, outcome);
            return outcome;
        }

        Optional<ImportOutcome> invalid = validator.validate(item, selection.match(), context);
        if (invalid.isPresent()) {
            log(item, invalid.get());
            return invalid.get();
        }

        List<FileEntry> files = item.includedFiles();
        CatalogWrite write = new CatalogWrite(item, selection.draft(), secondaryMedia(files, selection.draft(), metaType),
                files, null, item.attribute("url"));
        ImportResultItem result = streamImporter.commit(write);
        ImportOutcome outcome = switch (result.status()) {
            case SUCCESS -> ImportOutcome.success(item.contentIdentity(), result.streamId(), result.mediaId(),
                    "Imported '%s'".formatted(item.displayName()));
            case SKIPPED -> ImportOutcome.duplicate(item.contentIdentity(), result.streamId());
            case FAILED -> ImportOutcome.error(ImportErrorType.COMMIT_FAILED, result.message())
                    .withAnalysisHandle(handle);
        };
        if (result.status() == ResultItemStatus.SUCCESS) {
            analysisCache.remove(handle);
        }
        log(item, outcome);
        return outcome;
    }

    private Loaded load(ImportSource source, MetaType metaType) {
        if (source instanceof ImportSource.AnalysisHandle ref) {
            CachedAnalysis cached = analysisCache.get(ref.handle(), CachedAnalysis.class)
                    .orElseThrow(() -> new AnalysisException(ImportErrorType.ANALYSIS_EXPIRED,
                            "Analysis expired; analyze the source again"));
            return new Loaded(cached.item(), ref.handle());
        }
        AnalyzedItem item = adapters.analyze(source, metaType);
        String handle = analysisCache.put(AnalysisCache.ANALYSIS, new CachedAnalysis(item, metaType));
        return new Loaded(item, handle);
    }

    private Selection select(AnalyzedItem item, MetaType metaType, ImportRequest request) {
        String title = request.title() != null && !request.title().isBlank() ? request.title() : item.parsedTitle();
        Integer year = request.year() != null ? request.year() : item.parsedYear();

        if (request.metaId() != null && !request.metaId().isBlank()) {
            MediaDraft draft = streamImporter.resolveDraft(request.metaId().trim(), metaType, title, year, null);
            return Selection.of(draft, toMatch(draft));
        }
        if (request.createNew()) {
            if (title == null || title.isBlank()) {
                return Selection.stop(ImportOutcome.error(ImportErrorType.MEDIA_NOT_FOUND,
                        "A title is required to create new media"));
            }
            return Selection.of(StreamImporter.userMedia(metaType, title, year, null), null);
        }
        if (metaType == MetaType.TV) {
            return Selection.of(StreamImporter.channelMedia(item.displayName(), item.attribute("logo")), null);
        }

        List<Match> candidates = item.candidateMatches().isEmpty()
                ? matcher.match(item.parsedTitle(), item.parsedYear(), metaType)
                : item.candidateMatches();
        if (request.acceptBestMatch()) {
            if (!candidates.isEmpty()) {
                Match best = candidates.get(0);
                return Selection.of(streamImporter.resolveDraft(best.externalId(), metaType, best.title(), best.year(),
                        best.posterUrl()), best);
            }
            if (title == null || title.isBlank()) {
                return Selection.stop(ImportOutcome.error(ImportErrorType.MEDIA_NOT_FOUND,
                        "No title to match or create media from"));
            }
            return Selection.of(StreamImporter.userMedia(metaType, title, year, null), null);
        }
        Match auto = CatalogMatcher.autoSelect(candidates);
        if (auto != null) {
            return Selection.of(streamImporter.resolveDraft(auto.externalId(), metaType, auto.title(), auto.year(),
                    auto.posterUrl()), auto);
        }
        String message = candidates.isEmpty()
                ? "No matching media found; choose meta_id or create_new"
                : "Select the matching media from %d candidates".formatted(candidates.size());
        return Selection.stop(ImportOutcome.warning(item.contentIdentity(), message, candidates));
    }

    private Map<String, MediaDraft> secondaryMedia(List<FileEntry> files, MediaDraft primary, MetaType metaType) {
        Map<String, MediaDraft> secondary = new LinkedHashMap<>();
        for (FileEntry file : files) {
            String metaId = file.metaId();
            if (metaId == null || metaId.equals(primary.externalId()) || secondary.containsKey(metaId)) {
                continue;
            }
            ReleaseNameParser.Parsed parsed = ReleaseNameParser.parse(SourceFiles.baseName(file.filename()));
            secondary.put(metaId, streamImporter.resolveDraft(metaId, metaType, parsed.title(), parsed.year(), null));
        }
        return secondary;
    }

    private static Match toMatch(MediaDraft draft) {
        return new Match(draft.externalId(), draft.title(), draft.year(), draft.posterUrl(), draft.type(), null,
                draft.popularity(), null, null, draft.rating(), draft.genres(), draft.description());
    }

    private static void log(AnalyzedItem item, ImportOutcome outcome) {
        LOGGER.info("IMPORT DONE kind={} identity={} status={} message={}", item.sourceKind(),
                item.contentIdentity(), outcome.status(), outcome.message());
    }

    private record Loaded(AnalyzedItem item, String handle) {}

    private record Selection(MediaDraft draft, Match match, ImportOutcome outcome) {
        static Selection of(MediaDraft draft, Match match) {
            return new Selection(draft, match, null);
        }

        static Selection stop(ImportOutcome outcome) {
            return new Selection(null, null, outcome);
        }
    }
}
