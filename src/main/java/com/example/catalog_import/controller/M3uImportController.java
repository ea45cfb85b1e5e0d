package com.example.catalog_import.controller;

import com.example.catalog_import.dto.ImportOutcome;
import com.example.catalog_import.service.iptv.IptvSourceService;
import com.example.catalog_import.service.iptv.M3uImportCommand;
import com.example.catalog_import.service.iptv.M3uImportService;
import com.example.catalog_import.service.source.AnalysisException;
import io.swagger.v3.oas.annotations.Operation;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.server.ResponseStatusException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

@RestController
@RequestMapping("/v1/import/m3u")
public class M3uImportController {
    private final M3uImportService importService;
    private final IptvSourceService sourceService;

    public M3uImportController(M3uImportService importService, IptvSourceService sourceService) {
        this.importService = importService;
        this.sourceService = sourceService;
    }

    @Operation(summary = "Parse and classify a playlist given by URL or upload")
    @PostMapping(value = "/analyze", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<?> analyze(@RequestParam(value = "m3u_url", required = false) String m3uUrl,
                                     @RequestPart(value = "m3u_file", required = false) MultipartFile m3uFile) {
        sourceService.ensureEnabled();
        String content = null;
        if (m3uFile != null && !m3uFile.isEmpty()) {
            try {
                content = new String(m3uFile.getBytes(), StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "M3U_FILE_UNREADABLE", e);
            }
        }
        try {
            return ResponseEntity.ok(importService.analyze(m3uUrl, content));
        } catch (AnalysisException ex) {
            return OutcomeResponses.of(ImportOutcome.error(ex.getType(), ex.getMessage()));
        }
    }

    @Operation(summary = "Import an analyzed playlist; large playlists run as a background job")
    @PostMapping
    public ResponseEntity<ImportOutcome> importPlaylist(
            @RequestBody M3uImportCommand command,
            @RequestHeader(value = "X-Owner-Subject", required = false) String owner) {
        sourceService.ensureEnabled();
        return OutcomeResponses.of(importService.importPlaylist(command, owner));
    }
}
