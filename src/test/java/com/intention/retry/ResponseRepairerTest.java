package com.intention.retry;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.intention.model.Message;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ResponseRepairer.
 */
class ResponseRepairerTest {

    private ResponseRepairer repairer;

    @BeforeEach
    void setUp() {
        repairer = new ResponseRepairer(new ObjectMapper());
    }

    @Test
    void testPlainJson() {
        Optional<JsonNode> node = repairer.extract("{\"a\": 1}");

        assertTrue(node.isPresent());
        assertEquals(1, node.get().get("a").asInt());
    }

    @Test
    void testMarkdownFence() {
        Optional<JsonNode> node = repairer.extract("Here you go:\n```json\n{\"a\": [1, 2]}\n```\nEnjoy!");

        assertTrue(node.isPresent());
        assertEquals(2, node.get().get("a").size());
    }

    @Test
    void testObjectEmbeddedInProse() {
        Optional<JsonNode> node = repairer.extract("Sure! {\"name\": \"lamp\", \"price\": 19.5} Hope that helps.");

        assertTrue(node.isPresent());
        assertEquals("lamp", node.get().get("name").asText());
    }

    @Test
    void testNothingUsable() {
        assertTrue(repairer.extract("I cannot help with that").isEmpty());
        assertTrue(repairer.extract("[1, 2, 3]").isEmpty());
        assertTrue(repairer.extract("{broken").isEmpty());
        assertTrue(repairer.extract(null).isEmpty());
    }

    @Test
    void testRepairPromptListsViolations() {
        Message prompt = repairer.repairPrompt(List.of("Missing required field: total_found"));

        assertEquals(Message.USER, prompt.getRole());
        assertTrue(prompt.getContent().contains("Missing required field: total_found"));
    }
}
