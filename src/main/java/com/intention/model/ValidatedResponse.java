package com.intention.model;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Response that passed the template's output schema.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ValidatedResponse {

    private String fingerprint;
    private String template;
    private String provider;

    /**
     * Structured output, validated against the template's output schema.
     */
    private JsonNode data;

    /**
     * Raw provider text; absent for cache hits.
     */
    private String rawResponse;

    /**
     * Cost committed for this call; zero for cache hits.
     */
    private BigDecimal cost;

    private boolean cacheHit;

    /**
     * Provider calls made, including retries and repairs.
     */
    private int attempts;

    private Instant createdAt;
}
