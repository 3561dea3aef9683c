package com.intention.exception;

import java.math.BigDecimal;

/**
 * Dispatch was refused before calling the provider because the scope is out of budget.
 */
public class BudgetExceededException extends IntentionException {

    private final String scopeId;
    private final BigDecimal spent;
    private final BigDecimal limit;
    private final BigDecimal requested;

    public BudgetExceededException(String scopeId, BigDecimal spent, BigDecimal limit, BigDecimal requested) {
        super(ErrorKind.BUDGET_EXCEEDED, String.format(
                "Budget exceeded for scope '%s': spent=%s, requested=%s, limit=%s",
                scopeId, spent.toPlainString(), requested.toPlainString(), limit.toPlainString()));
        this.scopeId = scopeId;
        this.spent = spent;
        this.limit = limit;
        this.requested = requested;
    }

    public String getScopeId() {
        return scopeId;
    }

    public BigDecimal getSpent() {
        return spent;
    }

    public BigDecimal getLimit() {
        return limit;
    }

    public BigDecimal getRequested() {
        return requested;
    }
}
