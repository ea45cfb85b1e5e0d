package com.example.catalog_import.controller;

import com.example.catalog_import.dto.ImportOutcome;
import com.example.catalog_import.dto.web.RssFeedResponse;
import com.example.catalog_import.service.rss.RssFeedRequest;
import com.example.catalog_import.service.rss.RssFeedService;
import com.example.catalog_import.service.rss.RssItem;
import io.swagger.v3.oas.annotations.Operation;
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

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/v1")
public class RssFeedController {
    private static final String OWNER_HEADER = "X-Owner-Subject";

    private final RssFeedService feedService;

    public RssFeedController(RssFeedService feedService) {
        this.feedService = feedService;
    }

    @GetMapping("/rss-feeds")
    public List<RssFeedResponse> list(@RequestHeader(OWNER_HEADER) String owner) {
        return feedService.list(owner).stream().map(RssFeedResponse::of).toList();
    }

    @PostMapping("/rss-feeds")
    public ResponseEntity<RssFeedResponse> create(@RequestBody RssFeedRequest request,
                                                  @RequestHeader(OWNER_HEADER) String owner) {
        return ResponseEntity.status(HttpStatus.CREATED).body(RssFeedResponse.of(feedService.create(owner, request)));
    }

    @PatchMapping("/rss-feeds/{id}")
    public RssFeedResponse update(@PathVariable UUID id, @RequestBody RssFeedRequest request,
                                  @RequestHeader(OWNER_HEADER) String owner) {
        return RssFeedResponse.of(feedService.update(id, owner, request));
    }

    @DeleteMapping("/rss-feeds/{id}")
    public ResponseEntity<Void> delete(@PathVariable UUID id, @RequestHeader(OWNER_HEADER) String owner) {
        feedService.delete(id, owner);
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "Submit scraped feed items; matching items are imported in the background")
    @PostMapping("/import/rss/{feedId}/items")
    public ResponseEntity<ImportOutcome> items(@PathVariable UUID feedId, @RequestBody List<RssItem> items,
                                               @RequestHeader(OWNER_HEADER) String owner) {
        return OutcomeResponses.of(feedService.processItems(feedId, owner, items));
    }
}
