package com.intention.provider;

import com.intention.exception.ProviderException;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;

/**
 * Interface for model providers.
 * Implementations handle provider-specific authentication, request/response mapping,
 * and API communication.
 */
public interface ProviderAdapter {

    /**
     * Get provider name (e.g., "openai", "anthropic", "perplexity").
     *
     * @return provider name
     */
    String getName();

    /**
     * Send a request.
     *
     * <p>Failures are signalled as {@link ProviderException} already classified as
     * transient, rate limited or fatal. Adapters never retry on their own.</p>
     *
     * @param request provider-neutral request
     * @return normalized response
     */
    Mono<ProviderResponse> complete(ProviderRequest request);

    /**
     * Check if provider is enabled and configured.
     *
     * @return true if ready to use
     */
    boolean isEnabled();

    /**
     * Model used when the template does not name one.
     */
    String getDefaultModel();

    /**
     * Amount reserved against a budget before a call is made.
     */
    default BigDecimal estimateCost(ProviderRequest request) {
        return BigDecimal.ZERO;
    }
}
