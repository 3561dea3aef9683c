package com.intention.retry;

import com.fasterxml.jackson.databind.JsonNode;
import com.intention.exception.IntentionException;
import com.intention.exception.ProviderException;
import com.intention.exception.RepairFailedException;
import com.intention.model.Message;
import com.intention.provider.ProviderAdapter;
import com.intention.provider.ProviderRequest;
import com.intention.provider.ProviderResponse;
import com.intention.template.ResponseSchema;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Drives one dispatch to a terminal outcome.
 *
 * <ul>
 *   <li>transient: backoff, then retry</li>
 *   <li>rate limited: wait retry-after (or backoff), then retry</li>
 *   <li>malformed: local reparse, then re-ask with the violations</li>
 *   <li>fatal, or a gate refusal: stop</li>
 * </ul>
 *
 * <p>Nothing is charged here. The accumulated cost travels in the {@link RetryOutcome}
 * and is committed exactly once by the caller.</p>
 */
@Slf4j
public class RetryOrchestrator {

    private final BackoffPolicy backoffPolicy;
    private final ResponseRepairer repairer;
    private final Sleeper sleeper;

    public RetryOrchestrator(BackoffPolicy backoffPolicy, ResponseRepairer repairer, Sleeper sleeper) {
        this.backoffPolicy = backoffPolicy;
        this.repairer = repairer;
        this.sleeper = sleeper;
    }

    public RetryOutcome execute(ProviderAdapter provider,
                                ProviderRequest request,
                                ResponseSchema schema,
                                RetryPolicy policy,
                                AttemptGate gate,
                                Deadline deadline) {
        RetryState state = new RetryState();
        ProviderRequest current = request;

        while (true) {
            try {
                gate.beforeAttempt(state.getAttemptNumber() + 1);
            } catch (IntentionException e) {
                log.info("Dispatch to {} refused before attempt {}: {}",
                        provider.getName(), state.getAttemptNumber() + 1, e.getMessage());
                return RetryOutcome.failure(e, state);
            }

            state.startAttempt();
            ProviderResponse response;
            try {
                response = call(provider, current);
            } catch (ProviderException e) {
                FailureKind kind = FailureKind.of(e);
                state.recordFailure(kind);

                if (kind == FailureKind.FATAL) {
                    log.warn("Fatal error from {} on attempt {}: {}", provider.getName(), state.getAttemptNumber(), e.getMessage());
                    return RetryOutcome.failure(e, state);
                }
                if (state.getRetries() >= policy.getMaxRetries()) {
                    log.warn("Giving up on {} after {} attempts: {}", provider.getName(), state.getAttemptNumber(), e.getMessage());
                    return RetryOutcome.failure(e, state);
                }

                Duration delay = kind == FailureKind.RATE_LIMITED
                        ? backoffPolicy.delayFor(state.getRetries(), e.getRetryAfter())
                        : backoffPolicy.delayFor(state.getRetries());
                if (delay.compareTo(deadline.remaining()) > 0) {
                    log.warn("Backoff of {} for {} exceeds remaining deadline {}, giving up",
                            delay, provider.getName(), deadline.remaining());
                    return RetryOutcome.failure(e, state);
                }

                state.scheduleRetry(delay);
                log.info("{} error from {} on attempt {}, retrying in {}ms",
                        kind, provider.getName(), state.getAttemptNumber(), delay.toMillis());
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException interrupted) {
                    Thread.currentThread().interrupt();
                    log.warn("Backoff for {} interrupted, giving up", provider.getName());
                    return RetryOutcome.failure(e, state);
                }
                continue;
            }

            state.addCost(response.getCost());

            Optional<JsonNode> parsed = repairer.extract(response.getContent());
            List<String> violations = parsed
                    .map(schema::validate)
                    .orElse(List.of("Response is not a valid JSON object"));
            if (violations.isEmpty()) {
                log.debug("Valid response from {} after {} attempts", provider.getName(), state.getAttemptNumber());
                return RetryOutcome.success(parsed.get(), response, state);
            }

            state.recordFailure(FailureKind.MALFORMED_RESPONSE);
            if (state.getRepairs() >= policy.getMaxRepairAttempts()) {
                log.warn("Response from {} still invalid after {} repair attempts: {}",
                        provider.getName(), state.getRepairs(), violations);
                return RetryOutcome.failure(new RepairFailedException(
                        "Response failed validation after " + state.getRepairs() + " repair attempts: "
                                + String.join("; ", violations),
                        response.getContent(), violations), state);
            }

            state.scheduleRepair();
            log.info("Malformed response from {} ({}), re-asking", provider.getName(), violations);
            current = request.withAppended(Message.assistant(response.getContent()), repairer.repairPrompt(violations));
        }
    }

    private ProviderResponse call(ProviderAdapter provider, ProviderRequest request) {
        ProviderResponse response;
        try {
            response = provider.complete(request).block();
        } catch (ProviderException e) {
            throw e;
        } catch (RuntimeException e) {
            throw ProviderException.transientFailure(provider.getName(),
                    "Provider " + provider.getName() + " failed: " + e.getMessage(), e);
        }
        if (response == null) {
            throw ProviderException.transientFailure(provider.getName(),
                    "Provider " + provider.getName() + " returned no response", (Throwable) null);
        }
        return response;
    }
}
