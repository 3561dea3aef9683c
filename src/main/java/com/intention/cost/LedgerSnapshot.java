package com.intention.cost;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;

/**
 * Point-in-time view of a budget scope.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LedgerSnapshot {

    private String scopeId;

    private BigDecimal spent;

    /**
     * {@code null} when the scope is unlimited.
     */
    private BigDecimal limit;

    private Instant periodStart;

    private Duration period;

    /**
     * Set once a committed charge pushed spend past the limit; cleared at rollover.
     */
    private boolean overBudget;

    public BigDecimal getRemaining() {
        return limit == null ? null : limit.subtract(spent).max(BigDecimal.ZERO);
    }
}
