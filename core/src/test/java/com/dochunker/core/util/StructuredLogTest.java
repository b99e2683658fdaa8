package com.dochunker.core.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.logging.Level;

import static org.assertj.core.api.Assertions.assertThat;

class StructuredLogTest {

    private final ObjectMapper om = new ObjectMapper();

    @Test
    void event_line_carries_base_fields_and_typed_pairs() throws Exception {
        String json = StructuredLog.get(StructuredLogTest.class)
                .buildJson(Level.INFO, "page-fetched", null, "url", "https://d/a", "status", 200, "ok", true);

        JsonNode n = om.readTree(json);
        assertThat(n.get("event").asText()).isEqualTo("page-fetched");
        assertThat(n.get("lvl").asText()).isEqualTo("INFO");
        assertThat(n.get("comp").asText()).isEqualTo("StructuredLogTest");
        assertThat(n.has("ts")).isTrue();
        assertThat(n.get("status").isInt()).isTrue();
        assertThat(n.get("ok").asBoolean()).isTrue();
        assertThat(n.get("url").asText()).isEqualTo("https://d/a");
    }

    @Test
    void odd_pair_count_is_flagged_and_errors_are_summarised() throws Exception {
        String json = StructuredLog.get(StructuredLogTest.class)
                .buildJson(Level.SEVERE, "crawl-failed", new IllegalStateException("boom"), "dangling");

        JsonNode n = om.readTree(json);
        assertThat(n.get("_kv_mismatch").asBoolean()).isTrue();
        assertThat(n.get("error").asText()).isEqualTo("IllegalStateException");
        assertThat(n.get("message").asText()).isEqualTo("boom");
    }
}
