package com.example.catalog_import.controller;

import com.example.catalog_import.config.ImportProperties;
import com.example.catalog_import.dto.web.IptvSourceRequest;
import com.example.catalog_import.dto.web.IptvSourceResponse;
import com.example.catalog_import.model.IptvSource;
import com.example.catalog_import.service.iptv.IptvSourceService;
import com.example.catalog_import.service.iptv.IptvSourceUpdate;
import com.example.catalog_import.service.iptv.XtreamSelection;
import com.example.catalog_import.service.source.AnalysisException;
import com.example.catalog_import.service.source.xtream.XtreamCredentials;
import com.example.catalog_import.util.IptvSourceType;
import io.swagger.v3.oas.annotations.Operation;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/v1/iptv-sources")
public class IptvSourceController {
    private static final String OWNER_HEADER = "X-Owner-Subject";

    private final IptvSourceService sourceService;
    private final ImportProperties properties;

    public IptvSourceController(IptvSourceService sourceService, ImportProperties properties) {
        this.sourceService = sourceService;
        this.properties = properties;
    }

    @GetMapping("/settings")
    public Map<String, Object> settings() {
        return Map.of(
                "enabled", properties.getIptv().isEnabled(),
                "allow_public_sharing", properties.isPublicSharingEnabled());
    }

    @GetMapping
    public List<IptvSourceResponse> list(@RequestHeader(OWNER_HEADER) String owner) {
        return sourceService.list(owner).stream().map(IptvSourceResponse::of).toList();
    }

    @GetMapping("/{id}")
    public IptvSourceResponse get(@PathVariable UUID id, @RequestHeader(OWNER_HEADER) String owner) {
        return IptvSourceResponse.of(sourceService.get(id, owner));
    }

    @Operation(summary = "Save an M3U playlist or Xtream panel for later syncs")
    @PostMapping
    public ResponseEntity<IptvSourceResponse> create(@Valid @RequestBody IptvSourceRequest request,
                                                     @RequestHeader(OWNER_HEADER) String owner) {
        sourceService.ensureEnabled();
        IptvSource saved;
        try {
            if (request.sourceType() == IptvSourceType.M3U) {
                saved = sourceService.saveM3uSource(owner, request.name(), request.m3uUrl().trim(), request.isPublic());
            } else {
                XtreamSelection selection = new XtreamSelection(
                        !Boolean.FALSE.equals(request.importLive()),
                        !Boolean.FALSE.equals(request.importVod()),
                        !Boolean.FALSE.equals(request.importSeries()),
                        request.liveCategoryIds(), request.vodCategoryIds(), request.seriesCategoryIds());
                XtreamCredentials credentials = new XtreamCredentials(request.serverUrl(), request.username(),
                        request.password());
                saved = sourceService.saveXtreamSource(owner, request.name(), credentials, request.isPublic(),
                        selection);
            }
        } catch (AnalysisException ex) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, ex.getMessage(), ex);
        }
        return ResponseEntity.status(HttpStatus.CREATED).body(IptvSourceResponse.of(saved));
    }

    @PatchMapping("/{id}")
    public IptvSourceResponse update(@PathVariable UUID id, @RequestBody IptvSourceUpdate update,
                                     @RequestHeader(OWNER_HEADER) String owner) {
        return IptvSourceResponse.of(sourceService.update(id, owner, update));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable UUID id, @RequestHeader(OWNER_HEADER) String owner) {
        sourceService.delete(id, owner);
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "Queue a re-sync of a saved source")
    @PostMapping("/{id}/sync")
    public ResponseEntity<Map<String, Object>> sync(@PathVariable UUID id, @RequestHeader(OWNER_HEADER) String owner) {
        sourceService.ensureEnabled();
        UUID jobId = sourceService.sync(id, owner);
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(Map.of("status", "processing", "job_id", jobId, "source_id", id));
    }
}
