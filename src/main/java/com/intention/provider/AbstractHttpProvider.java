package com.intention.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.intention.config.IntentionProperties;
import com.intention.exception.ProviderException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.concurrent.TimeoutException;

/**
 * Abstract base class for HTTP providers with common functionality.
 *
 * <p>Subclasses build the vendor body and parse the vendor answer. This class
 * applies the per-call timeout, classifies failures and prices the call.</p>
 */
@Slf4j
public abstract class AbstractHttpProvider implements ProviderAdapter {

    protected final WebClient webClient;
    protected final IntentionProperties.ProviderConfig config;
    private final String name;

    protected AbstractHttpProvider(WebClient webClient, IntentionProperties properties, String providerName) {
        this.webClient = webClient;
        this.name = providerName;
        this.config = properties.getProviders().get(providerName);
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public boolean isEnabled() {
        return config != null && config.isEnabled();
    }

    @Override
    public String getDefaultModel() {
        return config != null && config.getModel() != null ? config.getModel() : fallbackModel();
    }

    @Override
    public BigDecimal estimateCost(ProviderRequest request) {
        if (config == null || config.getEstimatedCostPerCall() == null) {
            return BigDecimal.ZERO;
        }
        return config.getEstimatedCostPerCall();
    }

    @Override
    public Mono<ProviderResponse> complete(ProviderRequest request) {
        if (!isEnabled()) {
            return Mono.error(ProviderException.fatal(name, "Provider '" + name + "' is not enabled"));
        }

        String model = request.getModel() != null ? request.getModel() : getDefaultModel();
        log.debug("Sending request to {}: model={}, messages={}", name, model, request.getMessages().size());

        return send(request.toBuilder().model(model).build())
                .timeout(config.getTimeout())
                .map(body -> parseResponse(body, model))
                .onErrorMap(error -> !(error instanceof ProviderException), this::classify)
                .doOnError(error -> log.warn("Request failed for provider {}: {}", name, error.getMessage()));
    }

    /**
     * Issue the vendor call and return the raw response body.
     */
    protected abstract Mono<JsonNode> send(ProviderRequest request);

    /**
     * Convert the vendor body to a {@link ProviderResponse}, including token usage.
     *
     * @throws ProviderException if the body is not shaped like a completion
     */
    protected abstract ProviderResponse parseResponse(JsonNode body, String model);

    protected abstract String fallbackModel();

    protected String baseUrl(String fallback) {
        String configured = config.getBaseUrl();
        return configured == null || configured.isBlank() ? fallback : configured;
    }

    /**
     * Price a call from token usage; falls back to the configured estimate when usage is missing.
     */
    protected BigDecimal computeCost(Integer inputTokens, Integer outputTokens) {
        if (inputTokens == null && outputTokens == null) {
            return estimateCost(null);
        }
        BigDecimal input = perThousand(inputTokens, config.getInputCostPer1k());
        BigDecimal output = perThousand(outputTokens, config.getOutputCostPer1k());
        return input.add(output);
    }

    private static BigDecimal perThousand(Integer tokens, BigDecimal price) {
        if (tokens == null || price == null) {
            return BigDecimal.ZERO;
        }
        return price.multiply(BigDecimal.valueOf(tokens)).movePointLeft(3);
    }

    /**
     * Map a transport or HTTP failure onto a provider error kind.
     */
    protected ProviderException classify(Throwable error) {
        if (error instanceof WebClientResponseException response) {
            int status = response.getStatusCode().value();
            String message = String.format("%s returned %d: %s", name, status, abbreviate(response.getResponseBodyAsString()));
            if (status == 429) {
                return ProviderException.rateLimited(name, message, parseRetryAfter(response.getHeaders()));
            }
            if (status == 408 || status >= 500) {
                return ProviderException.transientFailure(name, message, status);
            }
            return ProviderException.fatal(name, message, status);
        }
        if (error instanceof WebClientRequestException) {
            return ProviderException.transientFailure(name, "Network error calling " + name + ": " + error.getMessage(), error);
        }
        if (error instanceof TimeoutException) {
            return ProviderException.transientFailure(name, name + " did not answer within " + config.getTimeout(), error);
        }
        return ProviderException.transientFailure(name, "Unexpected failure calling " + name + ": " + error.getMessage(), error);
    }

    /**
     * Retry-After is either delta-seconds or an HTTP date.
     */
    static Duration parseRetryAfter(HttpHeaders headers) {
        String value = headers.getFirst(HttpHeaders.RETRY_AFTER);
        if (value == null || value.isBlank()) {
            return null;
        }
        String trimmed = value.trim();
        try {
            return Duration.ofSeconds(Math.max(0, Long.parseLong(trimmed)));
        } catch (NumberFormatException e) {
            try {
                Instant at = ZonedDateTime.parse(trimmed, DateTimeFormatter.RFC_1123_DATE_TIME).toInstant();
                Duration delay = Duration.between(Instant.now(), at);
                return delay.isNegative() ? Duration.ZERO : delay;
            } catch (DateTimeParseException ignored) {
                log.debug("Unparseable Retry-After header: {}", trimmed);
                return null;
            }
        }
    }

    private static String abbreviate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() > 200 ? body.substring(0, 200) + "..." : body;
    }

    protected static Integer intOrNull(JsonNode node, String field) {
        return node != null && node.hasNonNull(field) ? node.get(field).asInt() : null;
    }
}
