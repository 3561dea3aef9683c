package com.intention.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.intention.config.IntentionProperties;
import com.intention.exception.ProviderException;
import com.intention.model.Message;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;

/**
 * Anthropic (Claude) provider.
 * Supports direct API access to Claude models.
 */
@Slf4j
@Component
public class AnthropicProvider extends AbstractHttpProvider {

    private static final String ANTHROPIC_VERSION = "2023-06-01";
    private static final int DEFAULT_MAX_TOKENS = 4096;

    private final ObjectMapper objectMapper;

    public AnthropicProvider(WebClient webClient, IntentionProperties properties, ObjectMapper objectMapper) {
        super(webClient, properties, "anthropic");
        this.objectMapper = objectMapper;
    }

    @Override
    protected String fallbackModel() {
        return "claude-3-5-haiku-latest";
    }

    @Override
    protected Mono<JsonNode> send(ProviderRequest request) {
        String endpoint = baseUrl("https://api.anthropic.com") + "/v1/messages";

        return webClient.post()
                .uri(endpoint)
                .header("x-api-key", config.getApiKey())
                .header("anthropic-version", ANTHROPIC_VERSION)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .bodyValue(buildBody(request))
                .retrieve()
                .bodyToMono(JsonNode.class);
    }

    /**
     * System messages move to the top-level {@code system} field; the rest become content blocks.
     */
    ObjectNode buildBody(ProviderRequest request) {
        ObjectNode body = objectMapper.createObjectNode();
        request.getParameters().forEach((key, value) -> body.set(key, objectMapper.valueToTree(value)));
        body.put("model", request.getModel());

        List<String> systemParts = new ArrayList<>();
        ArrayNode messages = body.putArray("messages");
        for (Message msg : request.getMessages()) {
            if (Message.SYSTEM.equals(msg.getRole())) {
                systemParts.add(msg.getContent());
                continue;
            }
            ObjectNode anthropicMsg = messages.addObject();
            anthropicMsg.put("role", msg.getRole());
            ObjectNode text = anthropicMsg.putArray("content").addObject();
            text.put("type", "text");
            text.put("text", msg.getContent());
        }
        if (!systemParts.isEmpty()) {
            body.put("system", String.join("\n\n", systemParts));
        }
        if (!body.has("max_tokens")) {
            body.put("max_tokens", DEFAULT_MAX_TOKENS);
        }
        return body;
    }

    @Override
    protected ProviderResponse parseResponse(JsonNode body, String model) {
        JsonNode content = body.path("content");
        if (!content.isArray()) {
            throw ProviderException.transientFailure(getName(), "No content in Anthropic response", null);
        }
        StringBuilder text = new StringBuilder();
        for (JsonNode item : content) {
            if ("text".equals(item.path("type").asText())) {
                text.append(item.path("text").asText());
            }
        }

        JsonNode usage = body.path("usage");
        Integer inputTokens = intOrNull(usage, "input_tokens");
        Integer outputTokens = intOrNull(usage, "output_tokens");

        return ProviderResponse.builder()
                .provider(getName())
                .model(body.hasNonNull("model") ? body.get("model").asText() : model)
                .content(text.toString())
                .finishReason(body.hasNonNull("stop_reason") ? mapStopReason(body.get("stop_reason").asText()) : "stop")
                .inputTokens(inputTokens)
                .outputTokens(outputTokens)
                .cost(computeCost(inputTokens, outputTokens))
                .build();
    }

    /**
     * Map Claude stop reasons to OpenAI finish reasons.
     */
    private String mapStopReason(String claudeStopReason) {
        return switch (claudeStopReason) {
            case "max_tokens" -> "length";
            case "end_turn", "stop_sequence" -> "stop";
            default -> claudeStopReason;
        };
    }
}
