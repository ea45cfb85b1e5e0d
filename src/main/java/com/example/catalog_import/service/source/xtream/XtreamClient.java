package com.example.catalog_import.service.source.xtream;

import com.example.catalog_import.config.ImportProperties;
import com.example.catalog_import.service.source.AnalysisException;
import com.fasterxml.jackson.core.JsonProcessingException;
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
import reactor.util.retry.Retry;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Client for the Xtream Codes {@code player_api.php} endpoint.
 */
@Component
public class XtreamClient {
    private static final Logger LOGGER = LoggerFactory.getLogger(XtreamClient.class);
    private static final int RETRY_MAX_ATTEMPTS = 2;
    private static final Duration RETRY_BACKOFF = Duration.ofMillis(500);

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final ImportProperties properties;

    public XtreamClient(@Qualifier("sourceWebClient") WebClient webClient, ObjectMapper objectMapper,
                        ImportProperties properties) {
        this.webClient = webClient;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    /**
     * Logs in and returns the account summary. A response without {@code user_info} or with {@code auth=0}
     * is an authentication failure.
     */
    public XtreamAccount authenticate(XtreamCredentials credentials) {
        JsonNode root = request(credentials, null, Map.of());
        JsonNode userInfo = root.get("user_info");
        if (userInfo == null || !userInfo.isObject()) {
            throw AnalysisException.unreachable("Authentication failed: invalid credentials or server response", null);
        }
        if (userInfo.path("auth").asInt(1) == 0) {
            throw AnalysisException.unreachable("Authentication failed: account disabled", null);
        }
        String status = text(userInfo, "status");
        if ("Expired".equalsIgnoreCase(status)) {
            LOGGER.warn("Xtream account expired server={} user={}", credentials.baseUrl(), credentials.username());
        }
        return new XtreamAccount(
                status,
                text(userInfo, "exp_date"),
                integer(userInfo, "max_connections"),
                integer(userInfo, "active_cons"),
                "1".equals(text(userInfo, "is_trial")));
    }

    /** Authenticates, then pulls every category tree and stream list. A failing tree is left empty. */
    public XtreamCatalog fetchCatalog(XtreamCredentials credentials) {
        XtreamAccount account = authenticate(credentials);
        Map<XtreamContentKind, List<XtreamCategory>> categories = new EnumMap<>(XtreamContentKind.class);
        Map<XtreamContentKind, List<XtreamStream>> streams = new EnumMap<>(XtreamContentKind.class);
        for (XtreamContentKind kind : XtreamContentKind.values()) {
            List<XtreamStream> list = streams(credentials, kind);
            Map<String, Integer> counts = XtreamCatalog.countByCategory(list);
            List<XtreamCategory> cats = categories(credentials, kind).stream()
                    .map(c -> new XtreamCategory(c.id(), c.name(), counts.getOrDefault(c.id(), 0)))
                    .toList();
            categories.put(kind, cats);
            streams.put(kind, list);
        }
        return new XtreamCatalog(credentials, account, categories, streams);
    }

    public List<XtreamCategory> categories(XtreamCredentials credentials, XtreamContentKind kind) {
        List<XtreamCategory> result = new ArrayList<>();
        try {
            JsonNode root = request(credentials, kind.categoriesAction(), Map.of());
            if (root.isArray()) {
                for (JsonNode node : root) {
                    result.add(new XtreamCategory(
                            node.path("category_id").asText(""),
                            textOr(node, "category_name", "Unknown"),
                            0));
                }
            }
        } catch (AnalysisException ex) {
            LOGGER.warn("Xtream {} failed server={}: {}", kind.categoriesAction(), credentials.baseUrl(), ex.getMessage());
        }
        return result;
    }

    public List<XtreamStream> streams(XtreamCredentials credentials, XtreamContentKind kind) {
        List<XtreamStream> result = new ArrayList<>();
        try {
            JsonNode root = request(credentials, kind.streamsAction(), Map.of());
            if (root.isArray()) {
                for (JsonNode node : root) {
                    String id = kind == XtreamContentKind.SERIES
                            ? node.path("series_id").asText("")
                            : node.path("stream_id").asText("");
                    String icon = kind == XtreamContentKind.SERIES ? text(node, "cover") : text(node, "stream_icon");
                    result.add(new XtreamStream(
                            kind,
                            id,
                            textOr(node, "name", "Unknown"),
                            node.path("category_id").asText(""),
                            icon,
                            text(node, "container_extension")));
                }
            }
        } catch (AnalysisException ex) {
            LOGGER.warn("Xtream {} failed server={}: {}", kind.streamsAction(), credentials.baseUrl(), ex.getMessage());
        }
        return result;
    }

    /** Episodes of one series in season order. Panels return {@code episodes} keyed by season number. */
    public List<XtreamEpisode> seriesEpisodes(XtreamCredentials credentials, String seriesId) {
        JsonNode root = request(credentials, "get_series_info", Map.of("series_id", seriesId));
        JsonNode episodes = root.path("episodes");
        List<XtreamEpisode> result = new ArrayList<>();
        if (episodes.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> seasons = episodes.fields();
            while (seasons.hasNext()) {
                Map.Entry<String, JsonNode> season = seasons.next();
                addEpisodes(result, parseIntOr(season.getKey(), 1), season.getValue());
            }
        } else if (episodes.isArray()) {
            // some panels send a list of per-season lists
            for (JsonNode seasonList : episodes) {
                addEpisodes(result, 0, seasonList);
            }
        }
        result.sort((a, b) -> a.season() != b.season()
                ? Integer.compare(a.season(), b.season())
                : Integer.compare(a.episode(), b.episode()));
        return result;
    }

    public static String buildStreamUrl(XtreamCredentials credentials, XtreamContentKind kind, String streamId,
                                        String extension) {
        String ext = kind == XtreamContentKind.LIVE || extension == null || extension.isBlank()
                ? kind.defaultExtension()
                : extension;
        return "%s/%s/%s/%s/%s.%s".formatted(credentials.baseUrl(), kind.pathSegment(), credentials.username(),
                credentials.password(), streamId, ext);
    }

    private void addEpisodes(List<XtreamEpisode> target, int seasonKey, JsonNode list) {
        if (!list.isArray()) {
            return;
        }
        for (JsonNode ep : list) {
            int season = seasonKey > 0 ? seasonKey : ep.path("season").asInt(1);
            target.add(new XtreamEpisode(
                    ep.path("id").asText(""),
                    season,
                    ep.path("episode_num").asInt(0),
                    text(ep, "title"),
                    text(ep, "container_extension")));
        }
    }

    private JsonNode request(XtreamCredentials credentials, String action, Map<String, String> params) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromUriString(credentials.apiUrl())
                .queryParam("username", credentials.username())
                .queryParam("password", credentials.password());
        if (action != null) {
            builder.queryParam("action", action);
        }
        params.forEach(builder::queryParam);
        URI uri = builder.encode().build().toUri();
        Duration timeout = properties.getSourceTimeout();

        String body;
        try {
            body = webClient.get()
                    .uri(uri)
                    .retrieve()
                    .bodyToMono(String.class)
                    .retryWhen(Retry.backoff(RETRY_MAX_ATTEMPTS, RETRY_BACKOFF)
                            .filter(WebClientRequestException.class::isInstance)
                            .doBeforeRetry(signal -> LOGGER.warn("Xtream retry attempt={} server={} action={}",
                                    signal.totalRetriesInARow() + 1, credentials.baseUrl(), action))
                            .onRetryExhaustedThrow((spec, signal) -> signal.failure()))
                    .block(timeout.multipliedBy(RETRY_MAX_ATTEMPTS + 1L));
        } catch (WebClientResponseException ex) {
            if (ex.getStatusCode().value() == 401 || ex.getStatusCode().value() == 403) {
                throw AnalysisException.unreachable("Authentication failed: invalid username or password", ex);
            }
            throw AnalysisException.unreachable("Xtream server answered HTTP " + ex.getStatusCode().value(), ex);
        } catch (WebClientRequestException ex) {
            throw AnalysisException.unreachable("Failed to connect to " + credentials.baseUrl(), ex);
        } catch (IllegalStateException ex) {
            throw AnalysisException.unreachable("Connection timeout to " + credentials.baseUrl(), ex);
        }
        if (body == null || body.isBlank()) {
            throw AnalysisException.malformed("Empty response from Xtream server");
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException ex) {
            throw AnalysisException.malformed("Xtream server returned invalid JSON");
        }
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text;
    }

    private static String textOr(JsonNode node, String field, String fallback) {
        String value = text(node, field);
        return value == null ? fallback : value;
    }

    private static Integer integer(JsonNode node, String field) {
        String value = text(node, field);
        return value == null ? null : parseIntOr(value, null);
    }

    private static Integer parseIntOr(String value, Integer fallback) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException ex) {
            return fallback;
        }
    }
}
