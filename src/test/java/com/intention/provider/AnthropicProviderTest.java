package com.intention.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.intention.config.IntentionProperties;
import com.intention.model.Message;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for AnthropicProvider body building and response parsing.
 */
class AnthropicProviderTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private AnthropicProvider provider;

    @BeforeEach
    void setUp() {
        IntentionProperties properties = new IntentionProperties();
        IntentionProperties.ProviderConfig config = new IntentionProperties.ProviderConfig();
        config.setApiKey("test");
        config.setInputCostPer1k(new BigDecimal("0.003"));
        config.setOutputCostPer1k(new BigDecimal("0.015"));
        properties.getProviders().put("anthropic", config);
        provider = new AnthropicProvider(WebClient.create(), properties, objectMapper);
    }

    @Test
    void testSystemMessagesMoveToTopLevel() {
        ProviderRequest request = ProviderRequest.builder()
                .model("claude-3-5-sonnet-latest")
                .messages(List.of(
                        Message.system("Answer in JSON."),
                        Message.user("Summarize"),
                        Message.assistant("oops"),
                        Message.user("Fix it")))
                .build();

        ObjectNode body = provider.buildBody(request);

        assertEquals("Answer in JSON.", body.get("system").asText());
        assertEquals(3, body.get("messages").size());
        assertEquals("user", body.get("messages").get(0).get("role").asText());
        assertEquals("text", body.get("messages").get(0).get("content").get(0).get("type").asText());
        assertEquals("Summarize", body.get("messages").get(0).get("content").get(0).get("text").asText());
        assertEquals("assistant", body.get("messages").get(1).get("role").asText());
        assertEquals(4096, body.get("max_tokens").asInt());
    }

    @Test
    void testExplicitMaxTokensIsKept() {
        ProviderRequest request = ProviderRequest.builder()
                .model("claude-3-5-haiku-latest")
                .messages(List.of(Message.user("hi")))
                .parameters(Map.of("max_tokens", 256))
                .build();

        ObjectNode body = provider.buildBody(request);

        assertEquals(256, body.get("max_tokens").asInt());
        assertFalse(body.has("system"));
    }

    @Test
    void testParseResponse() throws Exception {
        String json = """
                {"model": "claude-3-5-haiku-20241022", "stop_reason": "max_tokens",
                 "content": [{"type": "text", "text": "{\\"a\\": "}, {"type": "text", "text": "1}"}],
                 "usage": {"input_tokens": 2000, "output_tokens": 1000}}
                """;

        ProviderResponse response = provider.parseResponse(objectMapper.readTree(json), "claude-3-5-haiku-latest");

        assertEquals("{\"a\": 1}", response.getContent());
        assertEquals("length", response.getFinishReason());
        assertEquals("claude-3-5-haiku-20241022", response.getModel());
        assertEquals(0, new BigDecimal("0.021").compareTo(response.getCost()));
    }
}
