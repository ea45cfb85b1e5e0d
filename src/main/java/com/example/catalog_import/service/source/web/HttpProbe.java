package com.example.catalog_import.service.source.web;

import com.example.catalog_import.config.ImportProperties;
import com.example.catalog_import.service.source.AnalysisException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.net.URI;

/**
 * Light liveness check of a stream URL via {@code HEAD}.
 */
@Component
public class HttpProbe {
    private static final Logger LOGGER = LoggerFactory.getLogger(HttpProbe.class);

    public record Result(int status, Long contentLength, String contentType) {}

    private final WebClient webClient;
    private final ImportProperties properties;

    public HttpProbe(@Qualifier("sourceWebClient") WebClient webClient, ImportProperties properties) {
        this.webClient = webClient;
        this.properties = properties;
    }

    /**
     * @throws AnalysisException {@code unreachable_source} when the host cannot be reached, times out, or
     *                           reports the resource as gone
     */
    public Result probe(URI uri) {
        try {
            ResponseEntity<Void> response = webClient.head()
                    .uri(uri)
                    .retrieve()
                    .toBodilessEntity()
                    .block(properties.getProbeTimeout());
            if (response == null) {
                throw AnalysisException.unreachable("No response from " + uri.getHost(), null);
            }
            HttpHeaders headers = response.getHeaders();
            long length = headers.getContentLength();
            String type = headers.getContentType() == null ? null : headers.getContentType().toString();
            return new Result(response.getStatusCode().value(), length >= 0 ? length : null, type);
        } catch (WebClientResponseException ex) {
            int status = ex.getStatusCode().value();
            // plenty of stream servers refuse HEAD or require auth but still serve the stream
            if (status == 401 || status == 403 || status == 405 || status == 501) {
                LOGGER.debug("Probe of {} answered {}, treating as reachable", uri.getHost(), status);
                return new Result(status, null, null);
            }
            throw AnalysisException.unreachable(uri.getHost() + " answered HTTP " + status, ex);
        } catch (WebClientRequestException ex) {
            throw AnalysisException.unreachable("Could not reach " + uri.getHost(), ex);
        } catch (IllegalStateException ex) {
            throw AnalysisException.unreachable("Probe of " + uri.getHost() + " timed out", ex);
        }
    }
}
