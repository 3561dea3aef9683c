package com.intention.cost;

import com.intention.config.IntentionProperties;
import com.intention.exception.BudgetExceededException;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Accumulates spend per budget scope and enforces caps before dispatch.
 *
 * <p>{@link #preCheck} is advisory: two callers may both pass it and together overshoot.
 * {@link #commit} is authoritative and atomic per scope; it always records the spend and
 * flags the ledger over budget so that further pre-checks fail until the period rolls over.</p>
 */
@Slf4j
public class CostTracker {

    private final Map<String, IntentionProperties.BudgetConfig> budgets;
    private final IntentionProperties.BudgetConfig defaultBudget;
    private final Clock clock;
    private final Map<String, CostLedger> ledgers = new ConcurrentHashMap<>();

    public CostTracker(Map<String, IntentionProperties.BudgetConfig> budgets,
                       IntentionProperties.BudgetConfig defaultBudget,
                       Clock clock) {
        this.budgets = budgets;
        this.defaultBudget = defaultBudget;
        this.clock = clock;
    }

    /**
     * @throws BudgetExceededException if {@code spent + estimatedCost} would pass the limit,
     *                                 or a previous commit already did
     */
    public void preCheck(String scopeId, BigDecimal estimatedCost) {
        BigDecimal estimate = nonNegative(estimatedCost);
        CostLedger ledger = ledgerFor(scopeId);
        synchronized (ledger) {
            rollOver(ledger);
            if (!ledger.allows(estimate)) {
                log.warn("Budget pre-check failed for scope '{}': spent={}, estimate={}, limit={}, overBudget={}",
                        scopeId, ledger.getSpentAmount(), estimate, ledger.getBudgetLimit(), ledger.isOverBudget());
                throw new BudgetExceededException(scopeId, ledger.getSpentAmount(), ledger.getBudgetLimit(), estimate);
            }
        }
    }

    /**
     * Record actual spend for a call that already happened.
     */
    public CommitResult commit(String scopeId, BigDecimal actualCost) {
        BigDecimal cost = nonNegative(actualCost);
        CostLedger ledger = ledgerFor(scopeId);
        synchronized (ledger) {
            rollOver(ledger);
            ledger.charge(cost);
            CommitResult result = new CommitResult(scopeId, cost, ledger.getSpentAmount(),
                    ledger.getBudgetLimit(), ledger.isOverBudget());
            if (result.isOverBudget()) {
                log.warn("Scope '{}' is over budget after commit: spent={}, limit={}",
                        scopeId, result.getSpent(), result.getLimit());
            } else {
                log.debug("Committed cost {} to scope '{}' (spent={})", cost, scopeId, result.getSpent());
            }
            return result;
        }
    }

    public LedgerSnapshot snapshot(String scopeId) {
        CostLedger ledger = ledgerFor(scopeId);
        synchronized (ledger) {
            rollOver(ledger);
            return ledger.snapshot();
        }
    }

    private CostLedger ledgerFor(String scopeId) {
        if (scopeId == null || scopeId.isBlank()) {
            throw new IllegalArgumentException("Budget scope must not be blank");
        }
        return ledgers.computeIfAbsent(scopeId, id -> {
            IntentionProperties.BudgetConfig config = budgets.getOrDefault(id, defaultBudget);
            return new CostLedger(id, config.getLimit(), config.getPeriod(), clock.instant());
        });
    }

    private void rollOver(CostLedger ledger) {
        Instant now = clock.instant();
        if (ledger.rollOverIfDue(now)) {
            log.info("Budget period rolled over for scope '{}'", ledger.getScopeId());
        }
    }

    private static BigDecimal nonNegative(BigDecimal amount) {
        if (amount == null) {
            return BigDecimal.ZERO;
        }
        if (amount.signum() < 0) {
            throw new IllegalArgumentException("Cost must not be negative: " + amount);
        }
        return amount;
    }
}
