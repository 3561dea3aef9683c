package com.intention.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.intention.cache.InMemoryResponseCacheStore;
import com.intention.config.IntentionProperties;
import com.intention.cost.CostTracker;
import com.intention.fingerprint.RequestFingerprint;
import com.intention.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the cache and budget management endpoints.
 */
class CacheControllerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private InMemoryResponseCacheStore cache;
    private CostTracker costTracker;
    private WebTestClient client;

    @BeforeEach
    void setUp() {
        MutableClock clock = MutableClock.startingAt("2024-05-01T00:00:00Z");
        cache = new InMemoryResponseCacheStore(100, clock);

        IntentionProperties.BudgetConfig demo = new IntentionProperties.BudgetConfig();
        demo.setLimit(new BigDecimal("1.00"));
        demo.setPeriod(Duration.ofHours(1));
        costTracker = new CostTracker(Map.of("demo", demo), new IntentionProperties.BudgetConfig(), clock);

        client = WebTestClient
                .bindToController(new CacheController(cache), new BudgetController(costTracker))
                .controllerAdvice(new ApiExceptionHandler())
                .build();
    }

    private RequestFingerprint put(String provider, String namespace, String digest) {
        RequestFingerprint fingerprint = new RequestFingerprint(provider, namespace, digest);
        cache.put(fingerprint, objectMapper.createObjectNode().put("v", digest), Duration.ofHours(1));
        return fingerprint;
    }

    @Test
    void testStats() {
        RequestFingerprint fingerprint = put("openai", "summarize@1.0.0", "aa");
        cache.get(fingerprint);
        cache.get(new RequestFingerprint("openai", "summarize@1.0.0", "zz"));

        client.get().uri("/v1/cache/stats")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.entries").isEqualTo(1)
                .jsonPath("$.hits").isEqualTo(1)
                .jsonPath("$.misses").isEqualTo(1)
                .jsonPath("$.hit_rate").isEqualTo(0.5);
    }

    @Test
    void testInvalidateOne() {
        RequestFingerprint fingerprint = put("openai", "summarize@1.0.0", "aa");

        client.delete().uri("/v1/cache/{fingerprint}", fingerprint.getValue())
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.removed").isEqualTo(1);

        assertTrue(cache.get(fingerprint).isEmpty());

        client.delete().uri("/v1/cache/{fingerprint}", fingerprint.getValue())
                .exchange()
                .expectStatus().isNotFound();
    }

    @Test
    void testMalformedFingerprint() {
        client.delete().uri("/v1/cache/{fingerprint}", "not-a-fingerprint")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("template_error");
    }

    @Test
    void testInvalidatePrefix() {
        put("openai", "summarize@1.0.0", "aa");
        put("openai", "summarize@1.0.0", "bb");
        RequestFingerprint other = put("anthropic", "summarize@1.0.0", "cc");

        client.delete().uri(uri -> uri.path("/v1/cache").queryParam("prefix", "openai:").build())
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.removed").isEqualTo(2);

        assertTrue(cache.get(other).isPresent());
    }

    @Test
    void testClear() {
        put("openai", "summarize@1.0.0", "aa");

        client.post().uri("/v1/cache/clear")
                .exchange()
                .expectStatus().isOk();

        assertEquals(0, cache.stats().getEntries());
    }

    @Test
    void testBudgetSnapshot() {
        costTracker.commit("demo", new BigDecimal("0.25"));

        client.get().uri("/v1/budgets/demo")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.scope_id").isEqualTo("demo")
                .jsonPath("$.spent").isEqualTo(0.25)
                .jsonPath("$.remaining").isEqualTo(0.75)
                .jsonPath("$.over_budget").isEqualTo(false);
    }
}
