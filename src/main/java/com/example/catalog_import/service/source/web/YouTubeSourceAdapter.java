package com.example.catalog_import.service.source.web;

import com.example.catalog_import.config.ImportProperties;
import com.example.catalog_import.dto.AnalyzedItem;
import com.example.catalog_import.dto.FileEntry;
import com.example.catalog_import.service.source.AnalysisException;
import com.example.catalog_import.service.source.ImportSource;
import com.example.catalog_import.service.source.SourceAdapter;
import com.example.catalog_import.util.MetaType;
import com.example.catalog_import.util.ReleaseNameParser;
import com.example.catalog_import.util.SourceKind;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * YouTube video: extracts the 11 character id and confirms the video exists through oEmbed, which also
 * yields its title and thumbnail.
 */
@Component
public class YouTubeSourceAdapter implements SourceAdapter<ImportSource.YouTube> {
    private static final Pattern URL_PATTERN = Pattern.compile(
            "(?:https?://)?(?:www\\.|m\\.)?(?:youtube\\.com/watch\\?(?:.*&)?v=|youtu\\.be/|youtube\\.com/shorts/|youtube\\.com/embed/)([a-zA-Z0-9_-]{11})");
    private static final Pattern BARE_ID = Pattern.compile("^[a-zA-Z0-9_-]{11}$");

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final ImportProperties properties;

    public YouTubeSourceAdapter(@Qualifier("sourceWebClient") WebClient webClient, ObjectMapper objectMapper,
                                ImportProperties properties) {
        this.webClient = webClient;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    @Override
    public Class<ImportSource.YouTube> sourceType() {
        return ImportSource.YouTube.class;
    }

    @Override
    public AnalyzedItem analyze(ImportSource.YouTube source, MetaType metaType) {
        String videoId = extractVideoId(source.url());
        String watchUrl = "https://www.youtube.com/watch?v=" + videoId;
        JsonNode oembed = fetchOembed(videoId, watchUrl);

        String title = oembed.hasNonNull("title") ? oembed.get("title").asText() : videoId;
        ReleaseNameParser.Parsed parsed = ReleaseNameParser.parse(title);
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("video_id", videoId);
        attributes.put("url", watchUrl);
        if (oembed.hasNonNull("author_name")) {
            attributes.put("channel", oembed.get("author_name").asText());
        }
        attributes.put("thumbnail", "https://img.youtube.com/vi/" + videoId + "/mqdefault.jpg");

        FileEntry file = new FileEntry(0, title, 0L, parsed.season(), parsed.episode(), parsed.episodeEnd(), true, null);
        return new AnalyzedItem(SourceKind.YOUTUBE, "youtube:" + videoId, title,
                parsed.title() != null ? parsed.title() : title, parsed.year(), parsed.release(), null, List.of(file),
                List.of(), attributes);
    }

    public static String extractVideoId(String raw) {
        if (raw == null || raw.isBlank()) {
            throw AnalysisException.malformed("YouTube URL is required");
        }
        String value = raw.trim();
        if (BARE_ID.matcher(value).matches()) {
            return value;
        }
        Matcher m = URL_PATTERN.matcher(value);
        if (!m.find()) {
            throw AnalysisException.malformed("Not a YouTube video URL: " + raw);
        }
        return m.group(1);
    }

    private JsonNode fetchOembed(String videoId, String watchUrl) {
        String endpoint = "https://www.youtube.com/oembed?format=json&url=" + URLEncoder.encode(watchUrl, StandardCharsets.UTF_8);
        try {
            String payload = webClient.get()
                    .uri(endpoint)
                    .retrieve()
                    .bodyToMono(String.class)
                    .block(properties.getProbeTimeout());
            if (payload == null || payload.isBlank()) {
                throw AnalysisException.unreachable("Empty oEmbed response for " + videoId, null);
            }
            return objectMapper.readTree(payload);
        } catch (WebClientResponseException ex) {
            int status = ex.getStatusCode().value();
            if (status == 404 || status == 400) {
                throw AnalysisException.malformed("YouTube video " + videoId + " does not exist");
            }
            if (status == 401 || status == 403) {
                throw AnalysisException.malformed("YouTube video " + videoId + " is private or not embeddable");
            }
            throw AnalysisException.unreachable("YouTube answered HTTP " + status, ex);
        } catch (WebClientRequestException ex) {
            throw AnalysisException.unreachable("Could not reach YouTube", ex);
        } catch (IllegalStateException ex) {
            throw AnalysisException.unreachable("YouTube lookup timed out", ex);
        } catch (IOException ex) {
            throw AnalysisException.unreachable("Unreadable oEmbed response for " + videoId, ex);
        }
    }
}
