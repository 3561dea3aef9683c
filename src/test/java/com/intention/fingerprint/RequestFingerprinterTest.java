package com.intention.fingerprint;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.intention.config.JacksonConfiguration;
import com.intention.exception.TemplateException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for RequestFingerprinter.
 */
class RequestFingerprinterTest {

    private ObjectMapper objectMapper;
    private RequestFingerprinter fingerprinter;

    @BeforeEach
    void setUp() {
        objectMapper = JacksonConfiguration.configure(new ObjectMapper());
        fingerprinter = new RequestFingerprinter(objectMapper);
    }

    private JsonNode json(String text) throws Exception {
        return objectMapper.readTree(text);
    }

    @Test
    void testKeyOrderDoesNotMatter() throws Exception {
        RequestFingerprint a = fingerprinter.fingerprint("openai",
                json("{\"messages\":[{\"role\":\"user\",\"content\":\"hi\"}],\"user\":\"u1\"}"), Map.of());
        RequestFingerprint b = fingerprinter.fingerprint("openai",
                json("{\"user\":\"u1\",\"messages\":[{\"content\":\"hi\",\"role\":\"user\"}]}"), Map.of());

        assertEquals(a, b);
        assertEquals(a.getValue(), b.getValue());
    }

    @Test
    void testWhitespaceIsNormalized() throws Exception {
        RequestFingerprint a = fingerprinter.fingerprint("openai",
                json("{\"prompt\":\"  find   red\\n shoes \"}"), Map.of());
        RequestFingerprint b = fingerprinter.fingerprint("openai",
                json("{\"prompt\":\"find red shoes\"}"), Map.of());

        assertEquals(a, b);
    }

    @Test
    void testNumberRepresentationsCollide() throws Exception {
        RequestFingerprint a = fingerprinter.fingerprint("openai", json("{\"limit\":1}"), Map.of("max_tokens", 100));
        RequestFingerprint b = fingerprinter.fingerprint("openai", json("{\"limit\":1.00}"), Map.of("max_tokens", 100.0));

        assertEquals(a, b);
    }

    @Test
    void testNullFieldsAndDefaultParametersAreIgnored() throws Exception {
        Map<String, Object> withDefaults = new LinkedHashMap<>();
        withDefaults.put("model", "gpt-4o-mini");
        withDefaults.put("temperature", 1.0);
        withDefaults.put("stream", false);
        withDefaults.put("stop", null);

        RequestFingerprint a = fingerprinter.fingerprint("openai",
                json("{\"prompt\":\"x\",\"extra\":null}"), withDefaults);
        RequestFingerprint b = fingerprinter.fingerprint("openai",
                json("{\"prompt\":\"x\"}"), Map.of("model", "gpt-4o-mini"));

        assertEquals(a, b);
    }

    @Test
    void testDistinctInputsDiffer() throws Exception {
        JsonNode payload = json("{\"prompt\":\"x\"}");

        RequestFingerprint base = fingerprinter.fingerprint("openai", payload, Map.of("model", "m1"));

        assertNotEquals(base, fingerprinter.fingerprint("anthropic", payload, Map.of("model", "m1")));
        assertNotEquals(base, fingerprinter.fingerprint("openai", payload, Map.of("model", "m2")));
        assertNotEquals(base, fingerprinter.fingerprint("openai", json("{\"prompt\":\"y\"}"), Map.of("model", "m1")));
        assertNotEquals(base, fingerprinter.fingerprint("openai", payload, Map.of("model", "m1", "temperature", 0.2)));
    }

    @Test
    void testNumberAndStringDoNotCollide() throws Exception {
        RequestFingerprint number = fingerprinter.fingerprint("openai", json("{\"v\":1}"), Map.of());
        RequestFingerprint text = fingerprinter.fingerprint("openai", json("{\"v\":\"1\"}"), Map.of());

        assertNotEquals(number, text);
    }

    @Test
    void testArrayOrderMatters() throws Exception {
        RequestFingerprint a = fingerprinter.fingerprint("openai", json("{\"tags\":[\"a\",\"b\"]}"), Map.of());
        RequestFingerprint b = fingerprinter.fingerprint("openai", json("{\"tags\":[\"b\",\"a\"]}"), Map.of());

        assertNotEquals(a, b);
    }

    @Test
    void testNamespaceIsPartOfValue() throws Exception {
        RequestFingerprint fp = fingerprinter.fingerprint("openai", "product_search@1.0.0",
                json("{\"prompt\":\"x\"}"), Map.of());

        assertTrue(fp.getValue().startsWith("openai:product_search@1.0.0:"));
        assertTrue(fp.hasPrefix(RequestFingerprint.providerPrefix("openai")));
        assertTrue(fp.hasPrefix(RequestFingerprint.namespacePrefix("openai", "product_search@1.0.0")));
        assertEquals(64, fp.getDigest().length());
        assertEquals(fp, RequestFingerprint.parse(fp.getValue()));
    }

    @Test
    void testCanonicalFormIsSorted() throws Exception {
        String canonical = fingerprinter.canonicalize(json("{\"b\":1.50,\"a\":{\"d\":\" x \",\"c\":null}}"));

        assertEquals("{\"a\":{\"d\":\"x\"},\"b\":1.5}", canonical);
    }

    @Test
    void testRejectsMalformedInput() throws Exception {
        assertThrows(TemplateException.class, () -> fingerprinter.fingerprint("", json("{}"), Map.of()));
        assertThrows(TemplateException.class, () -> fingerprinter.fingerprint("openai", json("[1,2]"), Map.of()));
        assertThrows(TemplateException.class, () -> fingerprinter.fingerprint("openai", null, Map.of()));
        assertThrows(TemplateException.class, () -> fingerprinter.fingerprint("open:ai", json("{}"), Map.of()));
    }
}
