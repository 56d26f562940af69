package com.pageanalyzer.core.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.logging.Level;

import static org.junit.jupiter.api.Assertions.*;

class StructuredLogTest {

    private static final ObjectMapper OM = new ObjectMapper();
    private final StructuredLog slog = StructuredLog.get(StructuredLogTest.class);

    @Test
    void key_values_become_json_fields() throws Exception {
        JsonNode n = OM.readTree(slog.toJson(Level.INFO, "analysis.done", null,
                "url", "https://example.com/", "status", 200, "elapsedMs", 15L, "score", 0.5, "cached", false));

        assertEquals("INFO", n.get("lvl").asText());
        assertEquals("StructuredLogTest", n.get("comp").asText());
        assertEquals("analysis.done", n.get("event").asText());
        assertEquals("https://example.com/", n.get("url").asText());
        assertEquals(200, n.get("status").asInt());
        assertEquals(15L, n.get("elapsedMs").asLong());
        assertEquals(0.5, n.get("score").asDouble(), 1e-9);
        assertFalse(n.get("cached").asBoolean());
        assertTrue(n.hasNonNull("ts"));
        assertFalse(n.has("_kv_mismatch"));
    }

    @Test
    void odd_pairs_and_errors_are_flagged() throws Exception {
        JsonNode n = OM.readTree(slog.toJson(Level.SEVERE, "fetch.fail",
                new IllegalStateException("boom"), "url", "u", "dangling"));

        assertTrue(n.get("_kv_mismatch").asBoolean());
        assertEquals("IllegalStateException", n.get("error").asText());
        assertEquals("boom", n.get("message").asText());
        assertEquals("SEVERE", n.get("lvl").asText());
    }
}
