package com.intention.controller;

import com.intention.exception.BudgetExceededException;
import com.intention.exception.ErrorKind;
import com.intention.exception.IntentionException;
import com.intention.exception.ProviderException;
import com.intention.exception.RepairFailedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps classified failures to JSON error bodies.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(IntentionException.class)
    public ResponseEntity<Map<String, Object>> handleIntention(IntentionException ex) {
        ErrorKind kind = ex.getKind();
        HttpStatus status = statusFor(kind);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", kind.name().toLowerCase());
        body.put("message", ex.getMessage());
        body.put("retryable", kind.isRetryable());

        HttpHeaders headers = new HttpHeaders();
        if (ex instanceof ProviderException providerException) {
            body.put("provider", providerException.getProviderId());
            if (providerException.getRetryAfter() != null) {
                headers.add(HttpHeaders.RETRY_AFTER, String.valueOf(providerException.getRetryAfter().toSeconds()));
            }
        } else if (ex instanceof BudgetExceededException budgetException) {
            body.put("scope_id", budgetException.getScopeId());
            body.put("spent", budgetException.getSpent());
            body.put("limit", budgetException.getLimit());
        } else if (ex instanceof RepairFailedException repairException) {
            body.put("violations", repairException.getViolations());
            body.put("raw_response", repairException.getLastRawResponse());
        }

        if (status.is5xxServerError()) {
            log.warn("Request failed with {}: {}", kind, ex.getMessage());
        } else {
            log.info("Request rejected with {}: {}", kind, ex.getMessage());
        }
        return new ResponseEntity<>(body, headers, status);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalArgument(IllegalArgumentException ex) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", "invalid_request");
        body.put("message", ex.getMessage());
        return new ResponseEntity<>(body, HttpStatus.BAD_REQUEST);
    }

    static HttpStatus statusFor(ErrorKind kind) {
        return switch (kind) {
            case TEMPLATE_ERROR -> HttpStatus.BAD_REQUEST;
            case BUDGET_EXCEEDED -> HttpStatus.PAYMENT_REQUIRED;
            case PROVIDER_RATE_LIMITED, RATE_LIMIT_TIMEOUT -> HttpStatus.TOO_MANY_REQUESTS;
            case TIMEOUT -> HttpStatus.GATEWAY_TIMEOUT;
            case PROVIDER_TRANSIENT, PROVIDER_FATAL, REPAIR_FAILED -> HttpStatus.BAD_GATEWAY;
        };
    }
}
