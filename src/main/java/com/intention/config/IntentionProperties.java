package com.intention.config;

import com.intention.template.FieldType;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configuration properties for Intention.
 */
@Data
@Component
@ConfigurationProperties(prefix = "intention")
public class IntentionProperties {

    /**
     * Provider used when neither the caller nor the template names one.
     */
    private String defaultProvider = "openai";

    private Map<String, ProviderConfig> providers = new HashMap<>();
    private Map<String, BudgetConfig> budgets = new HashMap<>();
    private BudgetConfig defaultBudget = new BudgetConfig();
    private Map<String, TemplateConfig> templates = new LinkedHashMap<>();
    private CacheConfig cache = new CacheConfig();
    private RetryConfig retry = new RetryConfig();
    private CoordinatorConfig coordinator = new CoordinatorConfig();

    @Data
    public static class ProviderConfig {
        private boolean enabled = true;
        private String baseUrl;
        private String apiKey;
        private String model;

        /**
         * HTTP response timeout for a single call.
         */
        private Duration timeout = Duration.ofSeconds(60);

        /**
         * Token bucket size. Zero or negative disables local rate limiting.
         */
        private double capacity = 0;

        /**
         * Tokens added per second.
         */
        private double refillRate = 1;

        private BigDecimal inputCostPer1k = BigDecimal.ZERO;
        private BigDecimal outputCostPer1k = BigDecimal.ZERO;

        /**
         * Amount used for the budget pre-check before a call.
         */
        private BigDecimal estimatedCostPerCall = BigDecimal.ZERO;
    }

    @Data
    public static class BudgetConfig {

        /**
         * Spend cap for the period. {@code null} means unlimited.
         */
        private BigDecimal limit;

        /**
         * Length of a budget period. {@code null} means the ledger never resets.
         */
        private Duration period;
    }

    @Data
    public static class TemplateConfig {
        private String description;
        private String version = "1.0.0";
        private String provider;
        private String model;
        private String system;
        private String prompt;
        private Map<String, FieldType> input = new LinkedHashMap<>();
        private Map<String, FieldType> output = new LinkedHashMap<>();
        private Map<String, Object> parameters = new LinkedHashMap<>();
        private Duration ttl;
        private Integer maxRetries;
        private Integer maxRepairAttempts;
    }

    @Data
    public static class CacheConfig {
        private boolean enabled = true;

        /**
         * {@code memory} or {@code redis}.
         */
        private String backend = "memory";

        /**
         * Maximum entries kept in process; zero or negative means unbounded.
         */
        private long maxSize = 10000;

        /**
         * TTL for templates that do not declare one.
         */
        private Duration defaultTtl = Duration.ofHours(24);

        /**
         * Interval of the optional expired-entry sweep; unset disables it.
         */
        private Duration sweepInterval;
    }

    @Data
    public static class RetryConfig {
        private int maxRetries = 3;
        private int maxRepairAttempts = 2;
        private Duration baseDelay = Duration.ofMillis(500);
        private Duration maxDelay = Duration.ofSeconds(10);
        private double jitterFactor = 0.2;
    }

    @Data
    public static class CoordinatorConfig {

        /**
         * Overall deadline applied when the caller does not supply one.
         */
        private Duration defaultTimeout = Duration.ofSeconds(120);

        private String defaultScope = "default";
    }
}
