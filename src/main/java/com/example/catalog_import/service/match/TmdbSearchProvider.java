package com.example.catalog_import.service.match;

import com.example.catalog_import.config.MetadataProperties;
import com.example.catalog_import.dto.Match;
import com.example.catalog_import.util.MetaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import org.springframework.web.util.UriComponentsBuilder;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * TMDB-backed provider. External ids are {@code tmdb:<id>}; IMDb ids ({@code tt…}) are resolved through
 * {@code /find}.
 */
@Component
public class TmdbSearchProvider implements MetadataSearchProvider {
    private static final Logger LOGGER = LoggerFactory.getLogger(TmdbSearchProvider.class);
    private static final Duration TIMEOUT = Duration.ofSeconds(10);
    private static final int MAX_RESULTS = 10;

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final MetadataProperties properties;

    public TmdbSearchProvider(@Qualifier("metadataWebClient") WebClient webClient, ObjectMapper objectMapper,
                              MetadataProperties properties) {
        this.webClient = webClient;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    @Override
    public List<Match> search(String title, Integer year, MetaType type) {
        if (!properties.isEnabled() || title == null || title.isBlank()) {
            return List.of();
        }
        boolean movie = type != MetaType.SERIES;
        UriComponentsBuilder builder = base(movie ? "/search/movie" : "/search/tv").queryParam("query", title);
        if (year != null) {
            builder.queryParam(movie ? "year" : "first_air_date_year", year);
        }
        JsonNode root = get(builder);
        List<Match> matches = new ArrayList<>();
        if (root != null && root.path("results").isArray()) {
            for (JsonNode node : root.path("results")) {
                matches.add(toMatch(node, movie ? MetaType.MOVIE : MetaType.SERIES));
                if (matches.size() >= MAX_RESULTS) {
                    break;
                }
            }
        }
        return matches;
    }

    @Override
    public Optional<MediaDraft> fetch(String externalId, MetaType type) {
        if (!properties.isEnabled() || externalId == null) {
            return Optional.empty();
        }
        boolean movie = type != MetaType.SERIES;
        if (externalId.startsWith("tt")) {
            JsonNode root = get(base("/find/" + externalId).queryParam("external_source", "imdb_id"));
            if (root == null) {
                return Optional.empty();
            }
            JsonNode results = root.path(movie ? "movie_results" : "tv_results");
            if (!results.isArray() || results.isEmpty()) {
                return Optional.empty();
            }
            Match match = toMatch(results.get(0), movie ? MetaType.MOVIE : MetaType.SERIES);
            // the requested IMDb id stays the external id
            return Optional.of(new MediaDraft(externalId, match.type(), match.title(), match.year(), match.posterUrl(),
                    match.description(), match.genres(), match.popularity(), match.rating(), false));
        }
        if (!externalId.startsWith("tmdb:")) {
            return Optional.empty();
        }
        String id = externalId.substring("tmdb:".length());
        JsonNode node = get(base((movie ? "/movie/" : "/tv/") + id));
        if (node == null || !node.hasNonNull("id")) {
            return Optional.empty();
        }
        Match match = toMatch(node, movie ? MetaType.MOVIE : MetaType.SERIES);
        List<String> genres = new ArrayList<>();
        for (JsonNode genre : node.path("genres")) {
            String name = textOrNull(genre, "name");
            if (name != null) {
                genres.add(name);
            }
        }
        return Optional.of(new MediaDraft(externalId, match.type(), match.title(), match.year(), match.posterUrl(),
                match.description(), genres, match.popularity(), match.rating(), false));
    }

    private Match toMatch(JsonNode node, MetaType type) {
        String title = textOrNull(node, type == MetaType.MOVIE ? "title" : "name");
        String date = textOrNull(node, type == MetaType.MOVIE ? "release_date" : "first_air_date");
        Integer year = date != null && date.length() >= 4 && date.substring(0, 4).chars().allMatch(Character::isDigit)
                ? Integer.parseInt(date.substring(0, 4))
                : null;
        String poster = textOrNull(node, "poster_path");
        return new Match(
                "tmdb:" + node.path("id").asText(),
                title,
                year,
                poster == null ? null : properties.getImageBaseUrl() + poster,
                type,
                null,
                node.hasNonNull("popularity") ? node.get("popularity").asDouble() : null,
                null,
                null,
                node.hasNonNull("vote_average") ? node.get("vote_average").asDouble() : null,
                List.of(),
                textOrNull(node, "overview"));
    }

    private UriComponentsBuilder base(String path) {
        return UriComponentsBuilder.fromUriString(properties.getBaseUrl() + path)
                .queryParam("api_key", properties.getApiKey());
    }

    private JsonNode get(UriComponentsBuilder builder) {
        URI uri = builder.encode().build().toUri();
        try {
            String payload = webClient.get()
                    .uri(uri)
                    .retrieve()
                    .bodyToMono(String.class)
                    .block(TIMEOUT);
            if (payload == null || payload.isBlank()) {
                return null;
            }
            return objectMapper.readTree(payload);
        } catch (WebClientResponseException ex) {
            if (ex.getStatusCode().value() == 404) {
                LOGGER.debug("TMDB not found path={}", uri.getPath());
                return null;
            }
            throw new MetadataAccessException("TMDB lookup failed status=" + ex.getStatusCode().value(), ex);
        } catch (WebClientRequestException | IOException ex) {
            throw new MetadataAccessException("TMDB lookup failed", ex);
        } catch (IllegalStateException ex) {
            throw new MetadataAccessException("TMDB lookup timed out", ex);
        }
    }

    private String textOrNull(JsonNode node, String field) {
        if (node == null || !node.hasNonNull(field)) {
            return null;
        }
        String value = node.get(field).asText();
        return value != null && !value.isBlank() ? value : null;
    }
}
