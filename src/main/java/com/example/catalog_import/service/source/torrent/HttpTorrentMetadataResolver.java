package com.example.catalog_import.service.source.torrent;

import com.example.catalog_import.config.ImportProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;

import java.util.Locale;
import java.util.Optional;

/**
 * Resolves magnet metadata through a torrent cache that serves {@code .torrent} files by info hash.
 */
@Component
class HttpTorrentMetadataResolver implements TorrentMetadataResolver {
    private static final Logger LOGGER = LoggerFactory.getLogger(HttpTorrentMetadataResolver.class);

    private final WebClient webClient;
    private final ImportProperties properties;

    HttpTorrentMetadataResolver(@Qualifier("sourceWebClient") WebClient webClient, ImportProperties properties) {
        this.webClient = webClient;
        this.properties = properties;
    }

    @Override
    public Optional<TorrentMetainfo> resolve(String infoHash) {
        String template = properties.getMagnetMetadataUrl();
        if (template == null || template.isBlank()) {
            return Optional.empty();
        }
        String url = template.replace("{hash}", infoHash.toUpperCase(Locale.ROOT));
        try {
            byte[] body = webClient.get()
                    .uri(url)
                    .retrieve()
                    .bodyToMono(byte[].class)
                    .block(properties.getMagnetResolveTimeout());
            if (body == null || body.length == 0 || body.length > properties.getMaxTorrentBytes()) {
                return Optional.empty();
            }
            TorrentMetainfo meta = TorrentMetainfoParser.parse(body);
            if (!meta.infoHash().equalsIgnoreCase(infoHash)) {
                LOGGER.warn("Torrent cache returned mismatching metadata expected={} got={}", infoHash, meta.infoHash());
                return Optional.empty();
            }
            return Optional.of(meta);
        } catch (WebClientException | BencodeException ex) {
            LOGGER.warn("Magnet metadata lookup failed hash={} reason={}", infoHash, ex.getMessage());
            return Optional.empty();
        } catch (IllegalStateException ex) {
            // block(timeout) signals an elapsed timeout this way
            LOGGER.warn("Magnet metadata lookup timed out hash={} timeout={}", infoHash, properties.getMagnetResolveTimeout());
            return Optional.empty();
        }
    }
}
