package com.intention.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Ticker;
import com.intention.cache.ResponseCacheStore;
import com.intention.coordinator.RequestCoordinator;
import com.intention.cost.CostTracker;
import com.intention.fingerprint.RequestFingerprinter;
import com.intention.provider.ProviderRegistry;
import com.intention.ratelimit.ProviderRateLimiter;
import com.intention.retry.BackoffPolicy;
import com.intention.retry.ResponseRepairer;
import com.intention.retry.RetryOrchestrator;
import com.intention.retry.Sleeper;
import com.intention.template.TemplateRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Wires the shared state objects (buckets, ledgers, cache) into the coordinator.
 */
@Configuration
public class CoordinatorConfiguration {

    private final IntentionProperties properties;

    public CoordinatorConfiguration(IntentionProperties properties) {
        this.properties = properties;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ProviderRateLimiter providerRateLimiter() {
        return new ProviderRateLimiter(properties.getProviders(), Ticker.systemTicker());
    }

    @Bean
    public CostTracker costTracker(Clock clock) {
        return new CostTracker(properties.getBudgets(), properties.getDefaultBudget(), clock);
    }

    @Bean
    public RetryOrchestrator retryOrchestrator(ObjectMapper objectMapper) {
        IntentionProperties.RetryConfig retry = properties.getRetry();
        BackoffPolicy backoff = new BackoffPolicy(retry.getBaseDelay(), retry.getMaxDelay(), retry.getJitterFactor());
        return new RetryOrchestrator(backoff, new ResponseRepairer(objectMapper), Sleeper.THREAD);
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService dispatchExecutor() {
        return Executors.newCachedThreadPool(new CustomizableThreadFactory("intention-dispatch-"));
    }

    @Bean
    public RequestCoordinator requestCoordinator(TemplateRegistry templates,
                                                 ProviderRegistry providers,
                                                 RequestFingerprinter fingerprinter,
                                                 ResponseCacheStore cache,
                                                 ProviderRateLimiter rateLimiter,
                                                 CostTracker costTracker,
                                                 RetryOrchestrator retryOrchestrator,
                                                 ExecutorService dispatchExecutor,
                                                 ObjectMapper objectMapper,
                                                 Clock clock) {
        return new RequestCoordinator(templates, providers, fingerprinter, cache, rateLimiter, costTracker,
                retryOrchestrator, dispatchExecutor, properties, objectMapper, clock);
    }
}
