package com.example.catalog_import.controller;

import com.example.catalog_import.dto.ImportOutcome;
import com.example.catalog_import.dto.web.XtreamAnalyzeRequest;
import com.example.catalog_import.service.iptv.IptvSourceService;
import com.example.catalog_import.service.iptv.XtreamImportCommand;
import com.example.catalog_import.service.iptv.XtreamImportService;
import com.example.catalog_import.service.source.AnalysisException;
import com.example.catalog_import.service.source.xtream.XtreamCredentials;
import io.swagger.v3.oas.annotations.Operation;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/import/xtream")
public class XtreamImportController {
    private final XtreamImportService importService;
    private final IptvSourceService sourceService;

    public XtreamImportController(XtreamImportService importService, IptvSourceService sourceService) {
        this.importService = importService;
        this.sourceService = sourceService;
    }

    @Operation(summary = "Log in to a panel and list its categories")
    @PostMapping("/analyze")
    public ResponseEntity<?> analyze(@Valid @RequestBody XtreamAnalyzeRequest request) {
        sourceService.ensureEnabled();
        try {
            XtreamCredentials credentials = new XtreamCredentials(request.serverUrl(), request.username(),
                    request.password());
            return ResponseEntity.ok(importService.analyze(credentials));
        } catch (AnalysisException ex) {
            return OutcomeResponses.of(ImportOutcome.error(ex.getType(), ex.getMessage()));
        }
    }

    @Operation(summary = "Import the selected categories of an analyzed panel")
    @PostMapping
    public ResponseEntity<ImportOutcome> importPanel(
            @RequestBody XtreamImportCommand command,
            @RequestHeader(value = "X-Owner-Subject", required = false) String owner) {
        sourceService.ensureEnabled();
        return OutcomeResponses.of(importService.importPanel(command, owner));
    }
}
