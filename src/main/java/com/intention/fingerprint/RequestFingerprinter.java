package com.intention.fingerprint;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.intention.exception.TemplateException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.digest.DigestUtils;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Derives stable fingerprints for logical requests.
 *
 * Steps:
 * 1. Remove null values and provider-default parameters
 * 2. Sort JSON keys recursively
 * 3. Normalize numbers (1, 1.0 and 1.00 are equal)
 * 4. Normalize whitespace in strings
 * 5. SHA-256 over {provider, params, payload}
 *
 * Target: same logical request from any call site → same fingerprint
 */
@Slf4j
@Service
public class RequestFingerprinter {

    private final ObjectMapper objectMapper;

    // Model parameters equal to these are indistinguishable from absent ones
    private static final Map<String, Object> PARAMETER_DEFAULTS = Map.of(
            "temperature", 1.0,
            "top_p", 1.0,
            "n", 1,
            "stream", false,
            "presence_penalty", 0.0,
            "frequency_penalty", 0.0
    );

    public RequestFingerprinter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public RequestFingerprint fingerprint(String providerId, JsonNode payload, Map<String, ?> params) {
        return fingerprint(providerId, RequestFingerprint.DEFAULT_NAMESPACE, payload, params);
    }

    /**
     * Fingerprint a request.
     *
     * @param providerId target provider
     * @param namespace  label for prefix invalidation, usually {@code template@version}
     * @param payload    rendered request body; must be a JSON object
     * @param params     model parameters (model, temperature, max_tokens...)
     * @throws TemplateException when the input cannot be normalized
     */
    public RequestFingerprint fingerprint(String providerId, String namespace, JsonNode payload, Map<String, ?> params) {
        if (providerId == null || providerId.isBlank()) {
            throw new TemplateException("Provider id is required for fingerprinting");
        }
        if (payload == null || !payload.isObject()) {
            throw new TemplateException("Payload must be a JSON object");
        }

        ObjectNode envelope = objectMapper.createObjectNode();
        envelope.put("provider", providerId);
        envelope.set("params", canonicalizeParams(params));
        envelope.set("payload", canonicalizeNode(payload));

        String digest = DigestUtils.sha256Hex(serialize(envelope));
        try {
            return new RequestFingerprint(providerId, namespace, digest);
        } catch (IllegalArgumentException e) {
            throw new TemplateException("Cannot fingerprint request: " + e.getMessage(), e);
        }
    }

    /**
     * Canonical JSON form of a payload; exposed for diagnostics.
     */
    public String canonicalize(JsonNode payload) {
        if (payload == null) {
            throw new TemplateException("Payload must not be null");
        }
        return serialize(canonicalizeNode(payload));
    }

    private JsonNode canonicalizeParams(Map<String, ?> params) {
        ObjectNode raw = objectMapper.createObjectNode();
        if (params == null) {
            return raw;
        }
        for (Map.Entry<String, ?> entry : params.entrySet()) {
            JsonNode value = objectMapper.valueToTree(entry.getValue());
            if (!isDefaultValue(entry.getKey(), value)) {
                raw.set(entry.getKey(), value);
            }
        }
        return canonicalizeNode(raw);
    }

    /**
     * Recursively canonicalize a JSON node.
     */
    private JsonNode canonicalizeNode(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }

        if (node.isObject()) {
            return canonicalizeObject(node);
        } else if (node.isArray()) {
            return canonicalizeArray((ArrayNode) node);
        } else if (node.isNumber()) {
            return canonicalizeNumber(node);
        } else if (node.isTextual()) {
            return objectMapper.getNodeFactory().textNode(normalizeString(node.asText()));
        } else if (node.isBoolean()) {
            return node;
        }
        throw new TemplateException("Unsupported JSON value in request: " + node.getNodeType());
    }

    /**
     * Sorted keys, nulls dropped. ObjectNode keeps insertion order, so the result serializes sorted.
     */
    private JsonNode canonicalizeObject(JsonNode node) {
        ObjectNode canonical = objectMapper.createObjectNode();

        List<String> fieldNames = new ArrayList<>();
        node.fieldNames().forEachRemaining(fieldNames::add);
        Collections.sort(fieldNames);

        for (String fieldName : fieldNames) {
            JsonNode canonicalValue = canonicalizeNode(node.get(fieldName));
            if (canonicalValue != null) {
                canonical.set(fieldName, canonicalValue);
            }
        }

        return canonical;
    }

    /**
     * Array order is significant; null elements are kept as positional markers.
     */
    private JsonNode canonicalizeArray(ArrayNode node) {
        ArrayNode canonical = objectMapper.createArrayNode();

        for (JsonNode element : node) {
            JsonNode canonicalElement = canonicalizeNode(element);
            if (canonicalElement == null) {
                canonical.addNull();
            } else {
                canonical.add(canonicalElement);
            }
        }

        return canonical;
    }

    private JsonNode canonicalizeNumber(JsonNode node) {
        if (node.isDouble() || node.isFloat()) {
            double value = node.asDouble();
            if (Double.isNaN(value) || Double.isInfinite(value)) {
                throw new TemplateException("Non-finite number in request");
            }
        }
        return objectMapper.getNodeFactory().numberNode(node.decimalValue().stripTrailingZeros());
    }

    /**
     * Normalize string (trim, collapse whitespace).
     */
    private String normalizeString(String text) {
        return text.trim().replaceAll("\\s+", " ");
    }

    private boolean isDefaultValue(String fieldName, JsonNode value) {
        Object defaultValue = PARAMETER_DEFAULTS.get(fieldName);
        if (defaultValue == null || value == null) {
            return false;
        }

        if (defaultValue instanceof Number && value.isNumber()) {
            return value.decimalValue().compareTo(new BigDecimal(defaultValue.toString())) == 0;
        }
        if (defaultValue instanceof Boolean && value.isBoolean()) {
            return value.asBoolean() == (Boolean) defaultValue;
        }
        return false;
    }

    private String serialize(JsonNode node) {
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new TemplateException("Cannot serialize request for fingerprinting", e);
        }
    }
}
