package com.example.catalog_import.config;

import io.netty.channel.ChannelOption;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;

/**
 * Outbound HTTP clients. {@code sourceWebClient} fetches untrusted inputs (playlists, NZB files, panels,
 * probes); {@code metadataWebClient} talks to the metadata provider.
 */
@Configuration
public class WebClientConfig {

    private static final String USER_AGENT = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 "
            + "(KHTML, like Gecko) Chrome/124.0 Safari/537.36";

    @Bean
    @Qualifier("sourceWebClient")
    public WebClient sourceWebClient(WebClient.Builder builder, ImportProperties properties) {
        HttpClient http = HttpClient.create()
                .followRedirect(true)
                .compress(true)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) Duration.ofSeconds(5).toMillis())
                .responseTimeout(properties.getSourceTimeout());

        // playlists of large panels easily exceed the default 256k buffer
        ExchangeStrategies strategies = ExchangeStrategies.builder()
                .codecs(cfg -> cfg.defaultCodecs().maxInMemorySize(64 * 1024 * 1024))
                .build();

        return builder.clone()
                .clientConnector(new ReactorClientHttpConnector(http))
                .exchangeStrategies(strategies)
                .defaultHeader(HttpHeaders.USER_AGENT, USER_AGENT)
                .build();
    }

    @Bean
    @Qualifier("metadataWebClient")
    public WebClient metadataWebClient(WebClient.Builder builder) {
        HttpClient http = HttpClient.create()
                .followRedirect(true)
                .compress(true)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) Duration.ofSeconds(5).toMillis())
                .responseTimeout(Duration.ofSeconds(10));

        return builder.clone()
                .clientConnector(new ReactorClientHttpConnector(http))
                .defaultHeader(HttpHeaders.USER_AGENT, USER_AGENT)
                .defaultHeader(HttpHeaders.ACCEPT, "application/json")
                .build();
    }
}
