package com.intention.retry;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.intention.model.Message;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Structural repair of model output.
 *
 * <p>Local repair first: parse as-is, then strip markdown fences, then take the outermost
 * {@code {...}} span. When that still does not satisfy the schema the orchestrator re-asks
 * the provider with {@link #repairPrompt(List)}.</p>
 */
@Slf4j
public class ResponseRepairer {

    private static final Pattern FENCED = Pattern.compile("```(?:json)?\\s*(.*?)\\s*```", Pattern.DOTALL);
    private static final Pattern OBJECT_SPAN = Pattern.compile("\\{.*}", Pattern.DOTALL);

    private final ObjectMapper objectMapper;

    public ResponseRepairer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @return the JSON object found in the text, or empty when nothing parses
     */
    public Optional<JsonNode> extract(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        Optional<JsonNode> direct = parseObject(raw.trim());
        if (direct.isPresent()) {
            return direct;
        }

        Matcher fenced = FENCED.matcher(raw);
        if (fenced.find()) {
            Optional<JsonNode> inFence = parseObject(fenced.group(1));
            if (inFence.isPresent()) {
                return inFence;
            }
        }

        Matcher span = OBJECT_SPAN.matcher(raw);
        if (span.find()) {
            return parseObject(span.group());
        }
        return Optional.empty();
    }

    /**
     * Follow-up instruction sent after the model's invalid answer.
     */
    public Message repairPrompt(List<String> violations) {
        StringBuilder prompt = new StringBuilder(
                "Your previous response could not be used. Reply again with only a valid JSON object");
        if (violations.isEmpty()) {
            prompt.append('.');
        } else {
            prompt.append(" that fixes these problems:");
            for (String violation : violations) {
                prompt.append("\n- ").append(violation);
            }
        }
        return Message.user(prompt.toString());
    }

    private Optional<JsonNode> parseObject(String text) {
        try {
            JsonNode node = objectMapper.readTree(text);
            return node != null && node.isObject() ? Optional.of(node) : Optional.empty();
        } catch (JsonProcessingException e) {
            log.trace("Candidate is not JSON: {}", e.getOriginalMessage());
            return Optional.empty();
        }
    }
}
