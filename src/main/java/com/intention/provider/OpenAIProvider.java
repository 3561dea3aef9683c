package com.intention.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.intention.config.IntentionProperties;
import com.intention.exception.ProviderException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

/**
 * OpenAI chat completion provider.
 * Also the base for vendors exposing the same {@code /chat/completions} contract.
 */
@Slf4j
@Component
public class OpenAIProvider extends AbstractHttpProvider {

    private static final String DEFAULT_BASE_URL = "https://api.openai.com/v1";

    protected final ObjectMapper objectMapper;

    public OpenAIProvider(WebClient webClient, IntentionProperties properties, ObjectMapper objectMapper) {
        this(webClient, properties, objectMapper, "openai");
    }

    protected OpenAIProvider(WebClient webClient, IntentionProperties properties,
                             ObjectMapper objectMapper, String providerName) {
        super(webClient, properties, providerName);
        this.objectMapper = objectMapper;
    }

    @Override
    protected String fallbackModel() {
        return "gpt-4o-mini";
    }

    protected String defaultBaseUrl() {
        return DEFAULT_BASE_URL;
    }

    @Override
    protected Mono<JsonNode> send(ProviderRequest request) {
        String endpoint = baseUrl(defaultBaseUrl()) + "/chat/completions";

        return webClient.post()
                .uri(endpoint)
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + config.getApiKey())
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .header(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .bodyValue(buildBody(request))
                .retrieve()
                .bodyToMono(JsonNode.class);
    }

    ObjectNode buildBody(ProviderRequest request) {
        ObjectNode body = objectMapper.createObjectNode();
        request.getParameters().forEach((key, value) -> body.set(key, objectMapper.valueToTree(value)));
        body.put("model", request.getModel());
        body.set("messages", objectMapper.valueToTree(request.getMessages()));
        return body;
    }

    @Override
    protected ProviderResponse parseResponse(JsonNode body, String model) {
        JsonNode choices = body.path("choices");
        if (!choices.isArray() || choices.isEmpty()) {
            throw ProviderException.transientFailure(getName(), "No choices in " + getName() + " response", null);
        }
        JsonNode first = choices.get(0);
        JsonNode content = first.path("message").path("content");
        if (!content.isTextual()) {
            throw ProviderException.transientFailure(getName(), "Missing message content in " + getName() + " response", null);
        }

        JsonNode usage = body.path("usage");
        Integer inputTokens = intOrNull(usage, "prompt_tokens");
        Integer outputTokens = intOrNull(usage, "completion_tokens");

        return ProviderResponse.builder()
                .provider(getName())
                .model(body.hasNonNull("model") ? body.get("model").asText() : model)
                .content(content.asText())
                .finishReason(first.hasNonNull("finish_reason") ? first.get("finish_reason").asText() : null)
                .inputTokens(inputTokens)
                .outputTokens(outputTokens)
                .cost(computeCost(inputTokens, outputTokens))
                .build();
    }
}
