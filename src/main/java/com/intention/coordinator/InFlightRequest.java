package com.intention.coordinator;

import com.intention.fingerprint.RequestFingerprint;
import com.intention.model.ValidatedResponse;
import com.intention.retry.Deadline;
import lombok.Getter;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * The single dispatch currently running for a fingerprint, and who is waiting on it.
 *
 * <p>The dispatch runs until the latest deadline of any caller that joined it. Each caller's
 * own deadline only bounds that caller's wait.</p>
 */
@Getter
public class InFlightRequest {

    private final RequestFingerprint fingerprint;
    private final CompletableFuture<ValidatedResponse> result = new CompletableFuture<>();
    private final AtomicInteger waiterCount = new AtomicInteger(1);
    private final Instant startedAt;
    private final Deadline dispatchDeadline;
    private volatile DispatchState state = DispatchState.LOOKUP;

    public InFlightRequest(RequestFingerprint fingerprint, Instant startedAt, Deadline dispatchDeadline) {
        this.fingerprint = fingerprint;
        this.startedAt = startedAt;
        this.dispatchDeadline = dispatchDeadline;
    }

    /**
     * Register another caller sharing this dispatch.
     */
    int attach(Deadline callerDeadline) {
        dispatchDeadline.extendTo(callerDeadline);
        return waiterCount.incrementAndGet();
    }

    /**
     * A caller stopped waiting before the outcome was published.
     */
    int detach() {
        return waiterCount.decrementAndGet();
    }

    void transition(DispatchState next) {
        this.state = next;
    }

    void publish(ValidatedResponse response) {
        state = DispatchState.DONE;
        result.complete(response);
    }

    void fail(Throwable error) {
        state = DispatchState.FAILED;
        result.completeExceptionally(error);
    }

    public int getWaiters() {
        return waiterCount.get();
    }
}
