package com.contextgraph.tools;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class NormalizedEventParserTest {

    private final NormalizedEventParser parser = new NormalizedEventParser();

    @Test
    void parsesCanonicalEvent() {
        String json = "{\"kind\":\"write\",\"id\":\"call-1\",\"tool_name\":\"issue_refund\","
            + "\"args\":{\"amount\":20},\"output\":{\"ok\":true},\"timestamp\":\"2024-05-01T10:00:00Z\"}";
        NormalizedEvent event = parser.parse(json);
        assertEquals(ToolKind.WRITE, event.getKind());
        assertEquals("call-1", event.getId());
        assertEquals("issue_refund", event.getToolName());
        assertEquals(20, event.getArgs().get("amount"));
        assertEquals(Map.of("ok", true), event.getOutput());
        assertEquals(Instant.parse("2024-05-01T10:00:00Z"), event.getTimestamp());
        assertFalse(event.hasError());
    }

    @Test
    void acceptsNameAliasAndStringifiedArgs() {
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("name", "lookup_customer");
        raw.put("args", "{\"customer_id\":\"c-9\"}");
        raw.put("output", "[1,2]");

        NormalizedEvent event = parser.fromMap(raw);
        assertEquals("lookup_customer", event.getToolName());
        assertNull(event.getKind());
        assertEquals("c-9", event.getArgs().get("customer_id"));
        assertEquals(List.of(1, 2), event.getOutput());
    }

    @Test
    void unparseableArgsAreKeptRaw() {
        assertEquals(Map.of("raw", "not json"), parser.parseArgs("not json"));
        assertEquals(Map.of("raw", "{broken"), parser.parseArgs("{broken"));
        assertEquals(Map.of("raw", 7), parser.parseArgs(7));
        assertEquals(Map.of(), parser.parseArgs(null));
    }

    @Test
    void plainTextOutputStaysText() {
        assertEquals("refund issued", parser.parseOutput("refund issued"));
        assertEquals("{broken", parser.parseOutput("{broken"));
    }

    @Test
    void errorIsCarried() {
        NormalizedEvent event = parser.parse("{\"tool_name\":\"send_email\",\"error\":\"smtp down\"}");
        assertTrue(event.hasError());
        assertEquals("smtp down", event.getError());
    }

    @Test
    void offsetlessTimestampReadAsUtc() {
        NormalizedEvent event = parser.parse("{\"tool_name\":\"t\",\"timestamp\":\"2024-05-01T10:00:00.123456\"}");
        assertEquals(Instant.parse("2024-05-01T10:00:00.123456Z"), event.getTimestamp());
    }

    @Test
    void rejectsMalformedPayloads() {
        assertThrows(IllegalArgumentException.class, () -> parser.parse(""));
        assertThrows(IllegalArgumentException.class, () -> parser.parse("{nope"));
        assertThrows(IllegalArgumentException.class, () -> parser.parse("[1]"));
        assertThrows(IllegalArgumentException.class, () -> parser.parse("{\"args\":{}}"));
    }

    @Test
    void payloadWrapping() {
        assertEquals(Map.of("value", "ok"), Payloads.asMap("ok"));
        assertEquals(Map.of("a", 1), Payloads.asMap(Map.of("a", 1)));
        assertNull(Payloads.asMap(null));
    }
}
