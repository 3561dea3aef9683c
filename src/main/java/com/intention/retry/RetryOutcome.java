package com.intention.retry;

import com.fasterxml.jackson.databind.JsonNode;
import com.intention.exception.IntentionException;
import com.intention.provider.ProviderResponse;
import lombok.Getter;

import java.math.BigDecimal;

/**
 * Terminal result of the retry loop: either a validated answer or a classified failure.
 * Both carry the cost incurred so the caller can commit it once.
 */
@Getter
public final class RetryOutcome {

    private final JsonNode data;
    private final ProviderResponse response;
    private final IntentionException failure;
    private final int attempts;
    private final BigDecimal totalCost;

    private RetryOutcome(JsonNode data, ProviderResponse response, IntentionException failure,
                         int attempts, BigDecimal totalCost) {
        this.data = data;
        this.response = response;
        this.failure = failure;
        this.attempts = attempts;
        this.totalCost = totalCost;
    }

    static RetryOutcome success(JsonNode data, ProviderResponse response, RetryState state) {
        return new RetryOutcome(data, response, null, state.getAttemptNumber(), state.getAccumulatedCost());
    }

    static RetryOutcome failure(IntentionException failure, RetryState state) {
        return new RetryOutcome(null, null, failure, state.getAttemptNumber(), state.getAccumulatedCost());
    }

    public boolean isSuccess() {
        return failure == null;
    }
}
