package com.example.catalog_import.service.source.web;

import com.example.catalog_import.config.ImportProperties;
import com.example.catalog_import.service.source.AnalysisException;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.net.URI;
import java.time.Duration;
import java.util.Locale;

/**
 * Downloads untrusted inputs (playlists, NZB and torrent files) with bounded timeouts.
 */
@Component
public class SourceFetcher {
    private final WebClient webClient;
    private final ImportProperties properties;

    public SourceFetcher(@Qualifier("sourceWebClient") WebClient webClient, ImportProperties properties) {
        this.webClient = webClient;
        this.properties = properties;
    }

    public String fetchString(String rawUrl) {
        URI uri = requireHttpUrl(rawUrl);
        String body = execute(uri, String.class);
        if (body == null || body.isBlank()) {
            throw AnalysisException.malformed("Empty response from " + uri.getHost());
        }
        return body;
    }

    public byte[] fetchBytes(String rawUrl) {
        URI uri = requireHttpUrl(rawUrl);
        byte[] body = execute(uri, byte[].class);
        if (body == null || body.length == 0) {
            throw AnalysisException.malformed("Empty response from " + uri.getHost());
        }
        return body;
    }

    private <T> T execute(URI uri, Class<T> type) {
        Duration timeout = properties.getSourceTimeout();
        try {
            return webClient.get()
                    .uri(uri)
                    .retrieve()
                    .bodyToMono(type)
                    .block(timeout);
        } catch (WebClientResponseException ex) {
            HttpStatusCode status = ex.getStatusCode();
            throw AnalysisException.unreachable(uri.getHost() + " answered HTTP " + status.value(), ex);
        } catch (WebClientRequestException ex) {
            throw AnalysisException.unreachable("Could not reach " + uri.getHost() + ": " + ex.getMostSpecificCause().getMessage(), ex);
        } catch (IllegalStateException ex) {
            throw AnalysisException.unreachable("Timed out after " + timeout.toSeconds() + "s fetching " + uri.getHost(), ex);
        }
    }

    public static URI requireHttpUrl(String rawUrl) {
        if (rawUrl == null || rawUrl.isBlank()) {
            throw AnalysisException.malformed("URL is required");
        }
        URI uri;
        try {
            uri = URI.create(rawUrl.trim());
        } catch (IllegalArgumentException ex) {
            throw AnalysisException.malformed("Invalid URL: " + rawUrl);
        }
        String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
        if (!scheme.equals("http") && !scheme.equals("https")) {
            throw AnalysisException.malformed("Only http and https URLs are supported");
        }
        if (uri.getHost() == null || uri.getHost().isBlank()) {
            throw AnalysisException.malformed("URL has no host: " + rawUrl);
        }
        return uri;
    }
}
