package com.intention.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.intention.coordinator.RequestCoordinator;
import com.intention.model.CacheHeaders;
import com.intention.model.ExecuteOptions;
import com.intention.model.IntentAction;
import com.intention.model.ValidatedResponse;
import com.intention.service.IntentOptionsParser;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Executes intents with cache provenance headers.
 */
@Slf4j
@RestController
@RequestMapping("/v1/intents")
public class IntentController {

    private final RequestCoordinator coordinator;
    private final IntentOptionsParser optionsParser;

    public IntentController(RequestCoordinator coordinator, IntentOptionsParser optionsParser) {
        this.coordinator = coordinator;
        this.optionsParser = optionsParser;
    }

    /**
     * Run a template against the posted input data. The body of the response is the validated output.
     */
    @PostMapping(value = "/{template}", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<JsonNode>> execute(
            @PathVariable String template,
            @RequestBody(required = false) Map<String, Object> data,
            @RequestHeader HttpHeaders headers) {

        ExecuteOptions options = optionsParser.parse(headers);
        String scope = optionsParser.parseScope(headers);
        log.info("Received intent for template '{}' (scope={}, bypass={}, refresh={})",
                template, scope, options.isBypassCache(), options.isForceRefresh());

        IntentAction action = IntentAction.of(template, data == null ? new LinkedHashMap<>() : data);

        // The coordinator blocks on admission, backoff and the in-flight result
        return Mono.fromCallable(() -> coordinator.execute(action, scope, options))
                .subscribeOn(Schedulers.boundedElastic())
                .map(this::toResponse);
    }

    private ResponseEntity<JsonNode> toResponse(ValidatedResponse response) {
        HttpHeaders headers = new HttpHeaders();
        headers.add(CacheHeaders.CACHE_HIT, String.valueOf(response.isCacheHit()));
        headers.add(CacheHeaders.FINGERPRINT, response.getFingerprint());
        if (response.getCost() != null) {
            headers.add(CacheHeaders.COST, response.getCost().toPlainString());
        }
        if (!response.isCacheHit()) {
            headers.add(CacheHeaders.ATTEMPTS, String.valueOf(response.getAttempts()));
        }

        return ResponseEntity.ok()
                .headers(headers)
                .body(response.getData());
    }
}
