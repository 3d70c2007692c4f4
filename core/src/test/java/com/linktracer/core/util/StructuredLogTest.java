package com.linktracer.core.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.logging.Level;

import static org.assertj.core.api.Assertions.assertThat;

class StructuredLogTest {

    @Test
    void event_is_one_json_object_with_typed_values() throws Exception {
        StructuredLog log = StructuredLog.get(StructuredLogTest.class);
        String line = log.toJson(Level.INFO, "url-checked", null,
                "url", "https://ex.com", "status", 404, "inbound", true, "sources", List.of("a", "b"));

        JsonNode n = new ObjectMapper().readTree(line);
        assertThat(n.get("event").asText()).isEqualTo("url-checked");
        assertThat(n.get("comp").asText()).isEqualTo("StructuredLogTest");
        assertThat(n.get("lvl").asText()).isEqualTo("INFO");
        assertThat(n.get("status").asInt()).isEqualTo(404);
        assertThat(n.get("inbound").asBoolean()).isTrue();
        assertThat(n.get("sources").size()).isEqualTo(2);
        assertThat(line).doesNotContain("\n");
    }

    @Test
    void odd_kv_count_and_throwable_are_flagged() throws Exception {
        StructuredLog log = StructuredLog.get(StructuredLogTest.class);
        String line = log.toJson(Level.SEVERE, "task-failed", new IllegalStateException("boom"), "dangling");

        JsonNode n = new ObjectMapper().readTree(line);
        assertThat(n.get("_kv_mismatch").asBoolean()).isTrue();
        assertThat(n.get("error").asText()).isEqualTo("IllegalStateException");
        assertThat(n.get("message").asText()).isEqualTo("boom");
    }
}
