package com.intention.template;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-template dispatch settings. Unset values fall back to the global configuration.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TemplateSettings {

    private String provider;

    private String model;

    /**
     * Model parameters such as temperature or max_tokens.
     */
    @Builder.Default
    private Map<String, Object> parameters = new LinkedHashMap<>();

    private Duration ttl;

    private Integer maxRetries;

    private Integer maxRepairAttempts;

    public static TemplateSettings defaults() {
        return TemplateSettings.builder().build();
    }
}
