package com.intention.cost;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;

/**
 * Spend for one budget scope within the current period.
 *
 * <p>Not thread-safe on its own; {@link CostTracker} guards each ledger with its own monitor.</p>
 */
class CostLedger {

    private final String scopeId;
    private final BigDecimal budgetLimit;
    private final Duration period;

    private BigDecimal spentAmount = BigDecimal.ZERO;
    private Instant periodStart;
    private boolean overBudget;

    CostLedger(String scopeId, BigDecimal budgetLimit, Duration period, Instant periodStart) {
        this.scopeId = scopeId;
        this.budgetLimit = budgetLimit;
        this.period = period;
        this.periodStart = periodStart;
    }

    /**
     * Start a fresh period if {@code now} is at or past the end of the current one.
     * Skips whole idle periods so {@code periodStart} stays aligned to the original grid.
     *
     * @return true if the ledger was reset
     */
    boolean rollOverIfDue(Instant now) {
        if (period == null || period.isZero() || period.isNegative()) {
            return false;
        }
        Instant periodEnd = periodStart.plus(period);
        if (now.isBefore(periodEnd)) {
            return false;
        }
        long elapsedPeriods = Duration.between(periodStart, now).toNanos() / period.toNanos();
        periodStart = periodStart.plus(period.multipliedBy(elapsedPeriods));
        spentAmount = BigDecimal.ZERO;
        overBudget = false;
        return true;
    }

    boolean allows(BigDecimal estimatedCost) {
        if (overBudget) {
            return false;
        }
        return budgetLimit == null || spentAmount.add(estimatedCost).compareTo(budgetLimit) <= 0;
    }

    /**
     * Record spend unconditionally; the call already happened.
     */
    void charge(BigDecimal actualCost) {
        spentAmount = spentAmount.add(actualCost);
        if (budgetLimit != null && spentAmount.compareTo(budgetLimit) > 0) {
            overBudget = true;
        }
    }

    LedgerSnapshot snapshot() {
        return LedgerSnapshot.builder()
                .scopeId(scopeId)
                .spent(spentAmount)
                .limit(budgetLimit)
                .periodStart(periodStart)
                .period(period)
                .overBudget(overBudget)
                .build();
    }

    String getScopeId() {
        return scopeId;
    }

    BigDecimal getSpentAmount() {
        return spentAmount;
    }

    BigDecimal getBudgetLimit() {
        return budgetLimit;
    }

    boolean isOverBudget() {
        return overBudget;
    }
}
