package com.intention.template;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.intention.exception.TemplateException;
import com.intention.model.IntentAction;
import com.intention.model.Message;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base template: input/output schemas and prompt formatting.
 *
 * <p>Subclasses only decide how input data becomes prompt text. Rendering validates the
 * input, builds the request payload and attaches the output schema used to validate
 * the provider's answer.</p>
 */
public abstract class PromptTemplate {

    protected static final String DEFAULT_SYSTEM_PROMPT =
            "You are a helpful assistant that provides accurate, structured information in JSON format. "
                    + "Always ensure your responses are valid JSON objects.";

    private static final ObjectMapper PAYLOAD_MAPPER = new ObjectMapper();

    private final TemplateMetadata metadata;
    private final Map<String, FieldType> inputSchema;
    private final ResponseSchema outputSchema;
    private final TemplateSettings settings;

    protected PromptTemplate(TemplateMetadata metadata,
                             Map<String, FieldType> inputSchema,
                             Map<String, FieldType> outputSchema,
                             TemplateSettings settings) {
        if (metadata == null || metadata.getName() == null || metadata.getName().isBlank()) {
            throw new TemplateException("Template name must be defined");
        }
        if (inputSchema == null || inputSchema.isEmpty()) {
            throw new TemplateException("Input schema must be defined for template: " + metadata.getName());
        }
        if (outputSchema == null || outputSchema.isEmpty()) {
            throw new TemplateException("Output schema must be defined for template: " + metadata.getName());
        }
        this.metadata = metadata;
        this.inputSchema = Collections.unmodifiableMap(new LinkedHashMap<>(inputSchema));
        this.outputSchema = new ResponseSchema(outputSchema);
        this.settings = settings == null ? TemplateSettings.defaults() : settings;
    }

    /**
     * Convert validated input data to prompt text.
     */
    protected abstract String formatPrompt(Map<String, Object> data);

    /**
     * System instruction sent ahead of the prompt.
     */
    protected String systemPrompt() {
        return DEFAULT_SYSTEM_PROMPT;
    }

    /**
     * @throws TemplateException on the first missing or mistyped field
     */
    public void validateInput(Map<String, Object> data) {
        if (data == null) {
            throw new TemplateException("Input data is required for template: " + getName());
        }
        for (Map.Entry<String, FieldType> field : inputSchema.entrySet()) {
            if (!data.containsKey(field.getKey())) {
                throw new TemplateException("Missing required field: " + field.getKey());
            }
            Object value = data.get(field.getKey());
            if (!field.getValue().matches(value)) {
                throw new TemplateException(String.format("Invalid type for %s. Expected %s, got %s",
                        field.getKey(), field.getValue().displayName(),
                        value == null ? "null" : value.getClass().getSimpleName()));
            }
        }
    }

    public RenderedRequest render(IntentAction action) {
        validateInput(action.getData());

        String prompt;
        try {
            prompt = formatPrompt(action.getData());
        } catch (TemplateException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new TemplateException("Template '" + getName() + "' failed to format prompt: " + e.getMessage(), e);
        }

        ObjectNode payload = PAYLOAD_MAPPER.createObjectNode();
        ArrayNode messages = payload.putArray("messages");
        String system = systemPrompt();
        if (system != null && !system.isBlank()) {
            messages.add(PAYLOAD_MAPPER.valueToTree(Message.system(system)));
        }
        messages.add(PAYLOAD_MAPPER.valueToTree(Message.user(prompt)));

        return RenderedRequest.builder()
                .templateName(getName())
                .namespace(metadata.getNamespace())
                .payload(payload)
                .responseSchema(outputSchema)
                .settings(settings)
                .build();
    }

    public String getName() {
        return metadata.getName();
    }

    public TemplateMetadata getMetadata() {
        return metadata;
    }

    public Map<String, FieldType> getInputSchema() {
        return inputSchema;
    }

    public ResponseSchema getOutputSchema() {
        return outputSchema;
    }

    public TemplateSettings getSettings() {
        return settings;
    }
}
