package com.intention.config;

import io.netty.channel.ChannelOption;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;

/**
 * Shared WebClient for provider adapters.
 *
 * <p>The connector-level response timeout is only a ceiling: the slowest configured
 * provider timeout. Each adapter applies its own, shorter timeout per call.</p>
 */
@Slf4j
@Configuration
public class WebClientConfiguration {

    private static final int MAX_RESPONSE_BYTES = 4 * 1024 * 1024;
    private static final int CONNECT_TIMEOUT_MS = 10_000;

    private final IntentionProperties properties;

    public WebClientConfiguration(IntentionProperties properties) {
        this.properties = properties;
    }

    @Bean
    public WebClient webClient() {
        Duration ceiling = properties.getProviders().values().stream()
                .map(IntentionProperties.ProviderConfig::getTimeout)
                .filter(timeout -> timeout != null && !timeout.isNegative() && !timeout.isZero())
                .max(Duration::compareTo)
                .orElse(Duration.ofSeconds(60));

        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, CONNECT_TIMEOUT_MS)
                .responseTimeout(ceiling.plusSeconds(5));

        log.info("Provider WebClient response timeout ceiling: {}", ceiling);
        return WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(MAX_RESPONSE_BYTES))
                .build();
    }
}
