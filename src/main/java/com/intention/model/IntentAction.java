package com.intention.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A user action: the template to apply and the input data for it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IntentAction {

    private String template;

    @Builder.Default
    private Map<String, Object> data = new LinkedHashMap<>();

    public static IntentAction of(String template, Map<String, Object> data) {
        return new IntentAction(template, data == null ? new LinkedHashMap<>() : data);
    }
}
