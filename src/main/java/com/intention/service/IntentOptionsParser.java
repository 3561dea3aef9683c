package com.intention.service;

import com.intention.model.CacheHeaders;
import com.intention.model.ExecuteOptions;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.format.DateTimeParseException;

/**
 * Parses per-request options from HTTP headers.
 *
 * Recognized headers:
 * - x-budget-scope: budget scope to charge
 * - x-cache-bypass: neither read nor store
 * - x-cache-refresh: skip the read, store the fresh result
 * - x-request-timeout: overall deadline (PT5S or 5000)
 * - x-provider: provider override
 */
@Slf4j
@Service
public class IntentOptionsParser {

    /**
     * @return parsed options (never null); unparseable values fall back to defaults
     */
    public ExecuteOptions parse(HttpHeaders headers) {
        ExecuteOptions.ExecuteOptionsBuilder builder = ExecuteOptions.builder();

        String bypass = headers.getFirst(CacheHeaders.CACHE_BYPASS);
        if (bypass != null) {
            builder.bypassCache(parseBoolean(bypass, false));
        }

        String refresh = headers.getFirst(CacheHeaders.CACHE_REFRESH);
        if (refresh != null) {
            builder.forceRefresh(parseBoolean(refresh, false));
        }

        String timeout = headers.getFirst(CacheHeaders.REQUEST_TIMEOUT);
        if (timeout != null && !timeout.isBlank()) {
            builder.timeout(parseTimeout(timeout));
        }

        String provider = headers.getFirst(CacheHeaders.PROVIDER);
        if (provider != null && !provider.isBlank()) {
            builder.provider(provider.trim().toLowerCase());
        }

        return builder.build();
    }

    /**
     * @return the requested budget scope, or {@code null} for the default scope
     */
    public String parseScope(HttpHeaders headers) {
        String scope = headers.getFirst(CacheHeaders.BUDGET_SCOPE);
        return scope == null || scope.isBlank() ? null : scope.trim();
    }

    /**
     * Parse boolean from string.
     * Accepts: true/false, 1/0, yes/no, on/off (case-insensitive)
     */
    private boolean parseBoolean(String value, boolean defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }

        String normalized = value.trim().toLowerCase();

        return switch (normalized) {
            case "true", "1", "yes", "on" -> true;
            case "false", "0", "no", "off" -> false;
            default -> {
                log.warn("Invalid boolean value: {}, using default: {}", value, defaultValue);
                yield defaultValue;
            }
        };
    }

    /**
     * ISO-8601 duration or plain milliseconds. Non-positive or invalid values are ignored.
     */
    private Duration parseTimeout(String value) {
        String trimmed = value.trim();
        Duration parsed;
        try {
            parsed = trimmed.chars().allMatch(Character::isDigit)
                    ? Duration.ofMillis(Long.parseLong(trimmed))
                    : Duration.parse(trimmed);
        } catch (NumberFormatException | DateTimeParseException e) {
            log.warn("Invalid request timeout: {}, using default", value);
            return null;
        }
        if (parsed.isZero() || parsed.isNegative()) {
            log.warn("Non-positive request timeout: {}, using default", value);
            return null;
        }
        return parsed;
    }
}
