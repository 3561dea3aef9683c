package com.intention.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.intention.config.IntentionProperties;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Perplexity provider. Speaks the OpenAI chat completion contract.
 */
@Component
public class PerplexityProvider extends OpenAIProvider {

    public PerplexityProvider(WebClient webClient, IntentionProperties properties, ObjectMapper objectMapper) {
        super(webClient, properties, objectMapper, "perplexity");
    }

    @Override
    protected String fallbackModel() {
        return "sonar";
    }

    @Override
    protected String defaultBaseUrl() {
        return "https://api.perplexity.ai";
    }
}
