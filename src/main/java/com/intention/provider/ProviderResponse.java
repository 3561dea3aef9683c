package com.intention.provider;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Raw answer from a provider, normalized across vendors.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProviderResponse {

    private String provider;
    private String model;

    /**
     * Text content of the first choice; expected to hold a JSON object.
     */
    private String content;

    private String finishReason;

    private Integer inputTokens;
    private Integer outputTokens;

    /**
     * Cost charged for this call.
     */
    @Builder.Default
    private BigDecimal cost = BigDecimal.ZERO;
}
