package com.example.catalog_import.controller;

import com.example.catalog_import.dto.ImportOutcome;
import com.example.catalog_import.dto.web.AnalyzeRequest;
import com.example.catalog_import.dto.web.AnalyzeResponse;
import com.example.catalog_import.dto.web.AnnotateRequest;
import com.example.catalog_import.dto.web.AnnotateResponse;
import com.example.catalog_import.dto.web.NzbUrlsRequest;
import com.example.catalog_import.service.annotation.FileAnnotation;
import com.example.catalog_import.service.batch.NzbBatchService;
import com.example.catalog_import.service.importer.ImportPipeline;
import com.example.catalog_import.service.importer.ImportRequest;
import com.example.catalog_import.service.source.AnalysisException;
import com.example.catalog_import.service.source.ImportSource;
import com.example.catalog_import.util.MetaType;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.swagger.v3.oas.annotations.Operation;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.server.ResponseStatusException;

import java.io.IOException;
import java.util.List;

@RestController
@RequestMapping("/v1/import")
public class ContentImportController {
    private static final Logger LOGGER = LoggerFactory.getLogger(ContentImportController.class);

    private final ImportPipeline pipeline;
    private final NzbBatchService nzbBatchService;
    private final ObjectMapper objectMapper;

    public ContentImportController(ImportPipeline pipeline, NzbBatchService nzbBatchService,
                                   ObjectMapper objectMapper) {
        this.pipeline = pipeline;
        this.nzbBatchService = nzbBatchService;
        this.objectMapper = objectMapper;
    }

    @Operation(summary = "Analyze a source without importing it")
    @PostMapping("/analyze")
    public ResponseEntity<?> analyze(@Valid @RequestBody AnalyzeRequest request) {
        return analyze(request.source(), request.metaType());
    }

    @Operation(summary = "Analyze an uploaded .torrent file")
    @PostMapping(value = "/torrent/analyze", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<?> analyzeTorrent(@RequestPart("torrent_file") MultipartFile file,
                                            @RequestParam(value = "meta_type", required = false) String metaType) {
        return analyze(torrentSource(file), OutcomeResponses.metaType(metaType));
    }

    @Operation(summary = "Import a source, or continue an import from an analysis handle")
    @PostMapping
    public ResponseEntity<ImportOutcome> importContent(@RequestBody ImportRequest request) {
        if (request == null || request.source() == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "SOURCE_REQUIRED");
        }
        return OutcomeResponses.of(pipeline.importContent(request));
    }

    @Operation(summary = "Import an uploaded .torrent file")
    @PostMapping(value = "/torrent", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<ImportOutcome> importTorrent(
            @RequestPart("torrent_file") MultipartFile file,
            @RequestParam(value = "meta_type", required = false) String metaType,
            @RequestParam(value = "meta_id", required = false) String metaId,
            @RequestParam(value = "create_new", required = false, defaultValue = "false") boolean createNew,
            @RequestParam(value = "force_import", required = false, defaultValue = "false") boolean forceImport,
            @RequestParam(value = "validation_token", required = false) String validationToken,
            @RequestParam(value = "file_data", required = false) String fileData,
            @RequestParam(value = "title", required = false) String title,
            @RequestParam(value = "year", required = false) Integer year) {
        ImportRequest request = new ImportRequest(torrentSource(file), OutcomeResponses.metaType(metaType), metaId,
                createNew, forceImport, validationToken, parseFileData(fileData), null, false, title, year);
        return OutcomeResponses.of(pipeline.importContent(request));
    }

    @Operation(summary = "Preview season/episode assignment for a cached analysis")
    @PostMapping("/annotate")
    public ResponseEntity<?> annotate(@Valid @RequestBody AnnotateRequest request) {
        try {
            return ResponseEntity.ok(new AnnotateResponse(request.analysisHandle(),
                    pipeline.previewAnnotation(request.analysisHandle(), request.hints())));
        } catch (AnalysisException ex) {
            return OutcomeResponses.of(ImportOutcome.error(ex.getType(), ex.getMessage()));
        }
    }

    @Operation(summary = "Queue a list of NZB URLs as one background import")
    @PostMapping("/nzb/urls")
    public ResponseEntity<ImportOutcome> importNzbUrls(@Valid @RequestBody NzbUrlsRequest request) {
        return OutcomeResponses.of(nzbBatchService.enqueue(request.urls(), request.metaType()));
    }

    private ResponseEntity<?> analyze(ImportSource source, MetaType metaType) {
        try {
            return ResponseEntity.ok(AnalyzeResponse.of(pipeline.analyze(source, metaType)));
        } catch (AnalysisException ex) {
            LOGGER.info("ANALYZE REJECTED type={} message={}", ex.getType().id(), ex.getMessage());
            return OutcomeResponses.of(ImportOutcome.error(ex.getType(), ex.getMessage()));
        }
    }

    private static ImportSource torrentSource(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "TORRENT_FILE_REQUIRED");
        }
        try {
            return new ImportSource.TorrentFile(file.getBytes(), file.getOriginalFilename());
        } catch (IOException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "TORRENT_FILE_UNREADABLE", e);
        }
    }

    private List<FileAnnotation> parseFileData(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readValue(raw, new TypeReference<List<FileAnnotation>>() {});
        } catch (JsonProcessingException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "INVALID_FILE_DATA", e);
        }
    }
}
