package com.intention.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.intention.coordinator.RequestCoordinator;
import com.intention.exception.BudgetExceededException;
import com.intention.exception.ProviderException;
import com.intention.exception.RequestTimeoutException;
import com.intention.exception.TemplateException;
import com.intention.model.ExecuteOptions;
import com.intention.model.IntentAction;
import com.intention.model.ValidatedResponse;
import com.intention.service.IntentOptionsParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests for IntentController and its error mapping.
 */
class IntentControllerTest {

    private RequestCoordinator coordinator;
    private WebTestClient client;

    @BeforeEach
    void setUp() {
        coordinator = mock(RequestCoordinator.class);
        client = WebTestClient
                .bindToController(new IntentController(coordinator, new IntentOptionsParser()))
                .controllerAdvice(new ApiExceptionHandler())
                .build();
    }

    private static ValidatedResponse response(boolean cacheHit) {
        return ValidatedResponse.builder()
                .fingerprint("openai:summarize@1.0.0:abc")
                .template("summarize")
                .provider("openai")
                .data(new ObjectMapper().createObjectNode().put("summary", "short"))
                .cost(cacheHit ? BigDecimal.ZERO : new BigDecimal("0.0125"))
                .cacheHit(cacheHit)
                .attempts(cacheHit ? 0 : 2)
                .build();
    }

    @Test
    void testExecuteReturnsDataAndProvenanceHeaders() {
        when(coordinator.execute(any(IntentAction.class), eq("tenant-1"), any(ExecuteOptions.class)))
                .thenReturn(response(false));

        client.post().uri("/v1/intents/summarize")
                .contentType(MediaType.APPLICATION_JSON)
                .header("x-budget-scope", "tenant-1")
                .header("x-cache-refresh", "true")
                .bodyValue(Map.of("text", "long article"))
                .exchange()
                .expectStatus().isOk()
                .expectHeader().valueEquals("x-cache-hit", "false")
                .expectHeader().valueEquals("x-fingerprint", "openai:summarize@1.0.0:abc")
                .expectHeader().valueEquals("x-cost", "0.0125")
                .expectHeader().valueEquals("x-attempts", "2")
                .expectBody()
                .jsonPath("$.summary").isEqualTo("short");

        ArgumentCaptor<IntentAction> action = ArgumentCaptor.forClass(IntentAction.class);
        ArgumentCaptor<ExecuteOptions> options = ArgumentCaptor.forClass(ExecuteOptions.class);
        verify(coordinator).execute(action.capture(), eq("tenant-1"), options.capture());
        assertEquals("summarize", action.getValue().getTemplate());
        assertEquals("long article", action.getValue().getData().get("text"));
        assertTrue(options.getValue().isForceRefresh());
    }

    @Test
    void testCacheHitOmitsAttempts() {
        when(coordinator.execute(any(IntentAction.class), isNull(), any(ExecuteOptions.class)))
                .thenReturn(response(true));

        client.post().uri("/v1/intents/summarize")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("text", "long article"))
                .exchange()
                .expectStatus().isOk()
                .expectHeader().valueEquals("x-cache-hit", "true")
                .expectHeader().doesNotExist("x-attempts");
    }

    @Test
    void testTemplateErrorIsBadRequest() {
        when(coordinator.execute(any(IntentAction.class), any(), any(ExecuteOptions.class)))
                .thenThrow(new TemplateException("Missing required field: text"));

        client.post().uri("/v1/intents/summarize")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of())
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("template_error")
                .jsonPath("$.message").isEqualTo("Missing required field: text")
                .jsonPath("$.retryable").isEqualTo(false);
    }

    @Test
    void testBudgetExceededIsPaymentRequired() {
        when(coordinator.execute(any(IntentAction.class), any(), any(ExecuteOptions.class)))
                .thenThrow(new BudgetExceededException("demo", new BigDecimal("1.00"), new BigDecimal("1.00"),
                        new BigDecimal("0.02")));

        client.post().uri("/v1/intents/summarize")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("text", "x"))
                .exchange()
                .expectStatus().isEqualTo(402)
                .expectBody()
                .jsonPath("$.error").isEqualTo("budget_exceeded")
                .jsonPath("$.scope_id").isEqualTo("demo");
    }

    @Test
    void testRateLimitedCarriesRetryAfter() {
        when(coordinator.execute(any(IntentAction.class), any(), any(ExecuteOptions.class)))
                .thenThrow(ProviderException.rateLimited("openai", "openai returned 429", Duration.ofSeconds(20)));

        client.post().uri("/v1/intents/summarize")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("text", "x"))
                .exchange()
                .expectStatus().isEqualTo(429)
                .expectHeader().valueEquals("Retry-After", "20")
                .expectBody()
                .jsonPath("$.provider").isEqualTo("openai")
                .jsonPath("$.retryable").isEqualTo(true);
    }

    @Test
    void testTimeoutIsGatewayTimeout() {
        when(coordinator.execute(any(IntentAction.class), any(), any(ExecuteOptions.class)))
                .thenThrow(new RequestTimeoutException("Request did not complete within PT1S", Duration.ofSeconds(1)));

        client.post().uri("/v1/intents/summarize")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("text", "x"))
                .exchange()
                .expectStatus().isEqualTo(504)
                .expectBody()
                .jsonPath("$.error").isEqualTo("timeout");
    }
}
