package com.intention.controller;

import com.intention.cost.CostTracker;
import com.intention.cost.LedgerSnapshot;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Read-only view of budget ledgers.
 */
@RestController
@RequestMapping("/v1/budgets")
public class BudgetController {

    private final CostTracker costTracker;

    public BudgetController(CostTracker costTracker) {
        this.costTracker = costTracker;
    }

    @GetMapping("/{scope}")
    public ResponseEntity<Map<String, Object>> getBudget(@PathVariable String scope) {
        LedgerSnapshot snapshot = costTracker.snapshot(scope);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("scope_id", snapshot.getScopeId());
        body.put("spent", snapshot.getSpent());
        body.put("limit", snapshot.getLimit());
        body.put("remaining", snapshot.getRemaining());
        body.put("over_budget", snapshot.isOverBudget());
        body.put("period_start", snapshot.getPeriodStart());
        body.put("period", snapshot.getPeriod());
        return ResponseEntity.ok(body);
    }
}
