package com.intention.coordinator;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.intention.cache.ResponseCacheStore;
import com.intention.config.IntentionProperties;
import com.intention.cost.CostTracker;
import com.intention.exception.IntentionException;
import com.intention.exception.ProviderException;
import com.intention.exception.RateLimitTimeoutException;
import com.intention.exception.RequestTimeoutException;
import com.intention.fingerprint.RequestFingerprint;
import com.intention.fingerprint.RequestFingerprinter;
import com.intention.model.CacheEntry;
import com.intention.model.ExecuteOptions;
import com.intention.model.IntentAction;
import com.intention.model.Message;
import com.intention.model.ValidatedResponse;
import com.intention.provider.ProviderAdapter;
import com.intention.provider.ProviderRegistry;
import com.intention.provider.ProviderRequest;
import com.intention.ratelimit.ProviderRateLimiter;
import com.intention.retry.AttemptGate;
import com.intention.retry.Deadline;
import com.intention.retry.RetryOrchestrator;
import com.intention.retry.RetryOutcome;
import com.intention.retry.RetryPolicy;
import com.intention.template.PromptTemplate;
import com.intention.template.RenderedRequest;
import com.intention.template.TemplateRegistry;
import com.intention.template.TemplateSettings;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Single entry point for executing an intent.
 *
 * <pre>
 * render → fingerprint → cache lookup ─hit→ done
 *                                     └miss→ single-flight → [admit → pre-check → call] (retry loop)
 *                                                          → commit cost → store → publish to all waiters
 * </pre>
 *
 * <p>At most one dispatch per fingerprint runs at a time. Callers with the same fingerprint
 * attach to it and receive the same outcome, each with its own copy of the data. The dispatch
 * runs on its own executor until the latest deadline among the callers that joined it, so a
 * caller that gives up at its deadline does not stop it: the result is still cached and its
 * cost still committed.</p>
 */
@Slf4j
public class RequestCoordinator {

    private final TemplateRegistry templates;
    private final ProviderRegistry providers;
    private final RequestFingerprinter fingerprinter;
    private final ResponseCacheStore cache;
    private final ProviderRateLimiter rateLimiter;
    private final CostTracker costTracker;
    private final RetryOrchestrator retryOrchestrator;
    private final ExecutorService dispatchExecutor;
    private final IntentionProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private final Map<String, InFlightRequest> inFlight = new ConcurrentHashMap<>();

    public RequestCoordinator(TemplateRegistry templates,
                              ProviderRegistry providers,
                              RequestFingerprinter fingerprinter,
                              ResponseCacheStore cache,
                              ProviderRateLimiter rateLimiter,
                              CostTracker costTracker,
                              RetryOrchestrator retryOrchestrator,
                              ExecutorService dispatchExecutor,
                              IntentionProperties properties,
                              ObjectMapper objectMapper,
                              Clock clock) {
        this.templates = templates;
        this.providers = providers;
        this.fingerprinter = fingerprinter;
        this.cache = cache;
        this.rateLimiter = rateLimiter;
        this.costTracker = costTracker;
        this.retryOrchestrator = retryOrchestrator;
        this.dispatchExecutor = dispatchExecutor;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public ValidatedResponse execute(IntentAction action, String scopeId) {
        return execute(action, scopeId, ExecuteOptions.defaults());
    }

    /**
     * Execute an intent and return a response that satisfies the template's output schema.
     *
     * @param action  template name and input data
     * @param scopeId budget scope; blank uses the configured default scope
     * @param options deadline, cache behavior and provider override
     * @throws IntentionException classified failure; see {@link IntentionException#getKind()}
     */
    public ValidatedResponse execute(IntentAction action, String scopeId, ExecuteOptions options) {
        ExecuteOptions opts = options != null ? options : ExecuteOptions.defaults();
        Duration timeout = opts.getTimeout() != null ? opts.getTimeout() : properties.getCoordinator().getDefaultTimeout();
        Deadline deadline = Deadline.after(timeout);
        String scope = scopeId == null || scopeId.isBlank() ? properties.getCoordinator().getDefaultScope() : scopeId;

        PromptTemplate template = templates.get(action.getTemplate());
        RenderedRequest rendered = template.render(action);
        TemplateSettings settings = rendered.getSettings();

        String providerName = firstNonBlank(opts.getProvider(), settings.getProvider(), properties.getDefaultProvider());
        ProviderAdapter provider = providers.require(providerName);
        String model = settings.getModel() != null ? settings.getModel() : provider.getDefaultModel();

        Map<String, Object> params = new LinkedHashMap<>(rendered.getParameters());
        params.put("model", model);
        RequestFingerprint fingerprint = fingerprinter.fingerprint(
                providerName, rendered.getNamespace(), rendered.getPayload(), params);

        boolean cacheEnabled = properties.getCache().isEnabled();
        if (cacheEnabled && opts.shouldLookup()) {
            Optional<ValidatedResponse> hit = lookup(fingerprint, rendered, providerName);
            if (hit.isPresent()) {
                log.info("Cache hit for template '{}' ({})", rendered.getTemplateName(), fingerprint);
                return hit.get();
            }
        }

        Dispatch dispatch = new Dispatch(fingerprint, rendered, provider, model, scope,
                opts, cacheEnabled && opts.shouldStore());
        return await(joinOrStart(dispatch, deadline), deadline);
    }

    /**
     * Number of dispatches currently running.
     */
    public int inFlightCount() {
        return inFlight.size();
    }

    public List<InFlightRequest> inFlightRequests() {
        return new ArrayList<>(inFlight.values());
    }

    private Optional<ValidatedResponse> lookup(RequestFingerprint fingerprint, RenderedRequest rendered, String providerName) {
        return cache.get(fingerprint).map(entry -> fromCache(entry, rendered, providerName));
    }

    private InFlightRequest joinOrStart(Dispatch dispatch, Deadline callerDeadline) {
        String key = dispatch.fingerprint.getValue();
        InFlightRequest candidate = new InFlightRequest(dispatch.fingerprint, clock.instant(),
                Deadline.after(callerDeadline.getTimeout()));
        InFlightRequest existing = inFlight.putIfAbsent(key, candidate);
        if (existing != null) {
            int waiters = existing.attach(callerDeadline);
            log.info("Joining in-flight dispatch for {} ({} waiters)", dispatch.fingerprint, waiters);
            return existing;
        }

        try {
            dispatchExecutor.execute(() -> run(dispatch, candidate));
        } catch (RejectedExecutionException e) {
            inFlight.remove(key, candidate);
            candidate.fail(ProviderException.transientFailure(dispatch.provider.getName(),
                    "Dispatch rejected: coordinator is shutting down", e));
        }
        return candidate;
    }

    private void run(Dispatch dispatch, InFlightRequest flight) {
        try {
            ValidatedResponse response = dispatch(dispatch, flight);
            inFlight.remove(dispatch.fingerprint.getValue(), flight);
            flight.publish(response);
        } catch (RuntimeException e) {
            inFlight.remove(dispatch.fingerprint.getValue(), flight);
            flight.fail(e);
        } catch (Throwable e) {
            log.error("Dispatch for {} failed unexpectedly", dispatch.fingerprint, e);
            inFlight.remove(dispatch.fingerprint.getValue(), flight);
            flight.fail(ProviderException.transientFailure(dispatch.provider.getName(),
                    "Dispatch failed: " + e, e));
        }
    }

    private ValidatedResponse dispatch(Dispatch dispatch, InFlightRequest flight) {
        RenderedRequest rendered = dispatch.rendered;
        String providerName = dispatch.provider.getName();

        // Another dispatch may have stored this fingerprint between our miss and now
        if (dispatch.options.shouldLookup() && properties.getCache().isEnabled()) {
            Optional<ValidatedResponse> hit = lookup(dispatch.fingerprint, rendered, providerName);
            if (hit.isPresent()) {
                return hit.get();
            }
        }

        ProviderRequest request = ProviderRequest.builder()
                .model(dispatch.model)
                .messages(messagesOf(rendered.getPayload()))
                .parameters(new LinkedHashMap<>(rendered.getParameters()))
                .build();

        BigDecimal estimate = dispatch.provider.estimateCost(request);
        Deadline deadline = flight.getDispatchDeadline();
        AttemptGate gate = attemptNumber -> {
            flight.transition(DispatchState.ADMITTING);
            admit(providerName, deadline);
            costTracker.preCheck(dispatch.scope, estimate);
            flight.transition(DispatchState.DISPATCHING);
            log.debug("Attempt {} for {} admitted", attemptNumber, dispatch.fingerprint);
        };

        RetryOutcome outcome = retryOrchestrator.execute(dispatch.provider, request,
                rendered.getResponseSchema(), retryPolicy(rendered.getSettings()), gate, deadline);

        if (outcome.isSuccess() || outcome.getTotalCost().signum() > 0) {
            costTracker.commit(dispatch.scope, outcome.getTotalCost());
        }
        if (!outcome.isSuccess()) {
            throw outcome.getFailure();
        }

        ValidatedResponse response = ValidatedResponse.builder()
                .fingerprint(dispatch.fingerprint.getValue())
                .template(rendered.getTemplateName())
                .provider(providerName)
                .data(outcome.getData().deepCopy())
                .rawResponse(outcome.getResponse().getContent())
                .cost(outcome.getTotalCost())
                .cacheHit(false)
                .attempts(outcome.getAttempts())
                .createdAt(clock.instant())
                .build();

        if (dispatch.store) {
            flight.transition(DispatchState.STORING);
            store(dispatch.fingerprint, outcome.getData(), ttl(rendered.getSettings()));
        }

        log.info("Executed template '{}' via {} in {} attempts (cost={})",
                rendered.getTemplateName(), providerName, outcome.getAttempts(), outcome.getTotalCost());
        return response;
    }

    /**
     * Wait for a rate-limit token. A caller joining while we wait can push the dispatch
     * deadline later, in which case the wait continues.
     */
    private void admit(String providerName, Deadline deadline) {
        while (true) {
            try {
                rateLimiter.acquire(providerName, deadline.remaining());
                return;
            } catch (RateLimitTimeoutException e) {
                if (deadline.isExpired() || e.getWaited() == null || e.getWaited().isZero()) {
                    throw e;
                }
                log.debug("Dispatch deadline for provider '{}' was extended, still waiting for admission", providerName);
            }
        }
    }

    private void store(RequestFingerprint fingerprint, JsonNode data, Duration ttl) {
        try {
            cache.put(fingerprint, data, ttl);
        } catch (RuntimeException e) {
            // store failures never fail the call
            log.warn("Failed to cache response for {}: {}", fingerprint, e.getMessage());
        }
    }

    private ValidatedResponse await(InFlightRequest flight, Deadline deadline) {
        try {
            ValidatedResponse response = flight.getResult().get(deadline.remaining().toNanos(), TimeUnit.NANOSECONDS);
            return response.toBuilder().data(response.getData().deepCopy()).build();
        } catch (TimeoutException e) {
            flight.detach();
            log.warn("Deadline {} elapsed waiting for {} (state={})",
                    deadline.getTimeout(), flight.getFingerprint(), flight.getState());
            throw new RequestTimeoutException("Request did not complete within " + deadline.getTimeout(),
                    deadline.getTimeout(), e);
        } catch (InterruptedException e) {
            flight.detach();
            Thread.currentThread().interrupt();
            throw new RequestTimeoutException("Interrupted while waiting for " + flight.getFingerprint(),
                    deadline.getTimeout(), e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof IntentionException intentionException) {
                throw intentionException;
            }
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            throw new IllegalStateException("Dispatch failed for " + flight.getFingerprint(), cause);
        }
    }

    private ValidatedResponse fromCache(CacheEntry entry, RenderedRequest rendered, String providerName) {
        return ValidatedResponse.builder()
                .fingerprint(entry.getFingerprint())
                .template(rendered.getTemplateName())
                .provider(providerName)
                .data(entry.getResponse().deepCopy())
                .cost(BigDecimal.ZERO)
                .cacheHit(true)
                .attempts(0)
                .createdAt(entry.getCreatedAt())
                .build();
    }

    private List<Message> messagesOf(JsonNode payload) {
        List<Message> messages = new ArrayList<>();
        for (JsonNode node : payload.path("messages")) {
            messages.add(objectMapper.convertValue(node, Message.class));
        }
        return messages;
    }

    private RetryPolicy retryPolicy(TemplateSettings settings) {
        IntentionProperties.RetryConfig defaults = properties.getRetry();
        return new RetryPolicy(
                settings.getMaxRetries() != null ? settings.getMaxRetries() : defaults.getMaxRetries(),
                settings.getMaxRepairAttempts() != null ? settings.getMaxRepairAttempts() : defaults.getMaxRepairAttempts());
    }

    private Duration ttl(TemplateSettings settings) {
        return settings.getTtl() != null ? settings.getTtl() : properties.getCache().getDefaultTtl();
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return null;
    }

    /**
     * Everything the leader needs to run one dispatch.
     */
    private static final class Dispatch {
        final RequestFingerprint fingerprint;
        final RenderedRequest rendered;
        final ProviderAdapter provider;
        final String model;
        final String scope;
        final ExecuteOptions options;
        final boolean store;

        Dispatch(RequestFingerprint fingerprint, RenderedRequest rendered, ProviderAdapter provider, String model,
                 String scope, ExecuteOptions options, boolean store) {
            this.fingerprint = fingerprint;
            this.rendered = rendered;
            this.provider = provider;
            this.model = model;
            this.scope = scope;
            this.options = options;
            this.store = store;
        }
    }
}
