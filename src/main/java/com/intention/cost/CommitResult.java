package com.intention.cost;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.math.BigDecimal;

/**
 * Outcome of {@link CostTracker#commit}.
 */
@Data
@AllArgsConstructor
public class CommitResult {

    private final String scopeId;
    private final BigDecimal charged;
    private final BigDecimal spent;
    private final BigDecimal limit;
    private final boolean overBudget;
}
