package com.intention.template;

import com.intention.exception.TemplateException;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Template whose prompt is a text pattern with {@code {field}} placeholders.
 * Used for templates declared in configuration.
 */
public class PatternPromptTemplate extends PromptTemplate {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{([A-Za-z0-9_]+)}");

    private final String promptPattern;
    private final String systemPrompt;

    public PatternPromptTemplate(TemplateMetadata metadata,
                                 Map<String, FieldType> inputSchema,
                                 Map<String, FieldType> outputSchema,
                                 TemplateSettings settings,
                                 String promptPattern,
                                 String systemPrompt) {
        super(metadata, inputSchema, outputSchema, settings);
        if (promptPattern == null || promptPattern.isBlank()) {
            throw new TemplateException("Prompt pattern must be defined for template: " + metadata.getName());
        }
        this.promptPattern = promptPattern;
        this.systemPrompt = systemPrompt;
    }

    @Override
    protected String formatPrompt(Map<String, Object> data) {
        Matcher matcher = PLACEHOLDER.matcher(promptPattern);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            String field = matcher.group(1);
            if (!data.containsKey(field)) {
                throw new TemplateException("Prompt references unknown field: " + field);
            }
            matcher.appendReplacement(sb, Matcher.quoteReplacement(String.valueOf(data.get(field))));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }

    @Override
    protected String systemPrompt() {
        return systemPrompt != null ? systemPrompt : super.systemPrompt();
    }
}
