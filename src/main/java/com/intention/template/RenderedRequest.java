package com.intention.template;

import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Provider-ready request produced by a template, plus what is needed to validate the answer.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class RenderedRequest {

    private String templateName;

    /**
     * {@code name@version}; used as the fingerprint namespace.
     */
    private String namespace;

    /**
     * Opaque request body, {@code {"messages": [...]}}.
     */
    private ObjectNode payload;

    private ResponseSchema responseSchema;

    private TemplateSettings settings;

    public Map<String, Object> getParameters() {
        return settings.getParameters();
    }
}
