package com.contextgraph.tools;

import com.contextgraph.storage.JsonStorage;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Turns loosely shaped tool-call notifications into {@link NormalizedEvent}s.
 *
 * Adapters see events as plain maps, framework objects flattened to maps, or JSON
 * strings, and tool arguments/outputs are frequently themselves stringified JSON.
 * This is the one place that shape-polymorphism is resolved; the accumulator only
 * ever sees the canonical event.
 */
public class NormalizedEventParser {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public NormalizedEventParser() {
        this(JsonStorage.mapper());
    }

    public NormalizedEventParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper != null ? objectMapper : JsonStorage.mapper();
    }

    public NormalizedEvent parse(String json) {
        if (json == null || json.isBlank()) {
            throw new IllegalArgumentException("Event payload is empty");
        }
        JsonNode node;
        try {
            node = objectMapper.readTree(json.trim());
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Event payload is not valid JSON: " + e.getMessage(), e);
        }
        if (node == null || !node.isObject()) {
            throw new IllegalArgumentException("Event payload must be a JSON object");
        }
        return fromMap(objectMapper.convertValue(node, MAP_TYPE));
    }

    public NormalizedEvent fromMap(Map<String, Object> raw) {
        if (raw == null) {
            throw new IllegalArgumentException("Event payload is required");
        }
        String toolName = firstText(raw, "tool_name", "name", "tool");
        if (toolName == null || toolName.isBlank()) {
            throw new IllegalArgumentException("tool_name is required");
        }
        Object error = raw.get("error");
        Object timestamp = raw.get("timestamp");
        return NormalizedEvent.builder(toolName.trim())
            .kind(ToolKind.fromValue(asText(raw.get("kind"))))
            .id(asText(raw.get("id")))
            .args(parseArgs(raw.containsKey("args") ? raw.get("args") : raw.get("arguments")))
            .output(parseOutput(raw.get("output")))
            .error(error != null ? error.toString() : null)
            .timestamp(timestamp != null ? JsonStorage.parseInstant(timestamp.toString()) : null)
            .build();
    }

    /**
     * Arguments must end up as a map: JSON text is parsed, anything unparseable is
     * kept under {@code raw}.
     */
    Map<String, Object> parseArgs(Object args) {
        if (args == null) {
            return Map.of();
        }
        if (args instanceof Map<?, ?>) {
            return stringKeys((Map<?, ?>) args);
        }
        if (args instanceof String) {
            String text = ((String) args).trim();
            if (text.isEmpty()) {
                return Map.of();
            }
            try {
                JsonNode node = objectMapper.readTree(text);
                if (node != null && node.isObject()) {
                    return objectMapper.convertValue(node, MAP_TYPE);
                }
            } catch (JsonProcessingException ignored) {
                // not JSON; keep the text below
            }
            Map<String, Object> wrapped = new LinkedHashMap<>();
            wrapped.put("raw", args);
            return wrapped;
        }
        Map<String, Object> wrapped = new LinkedHashMap<>();
        wrapped.put("raw", args);
        return wrapped;
    }

    /**
     * Outputs that are JSON text become structured values; plain text stays text.
     */
    Object parseOutput(Object output) {
        if (!(output instanceof String)) {
            return output;
        }
        String text = ((String) output).trim();
        if (!(text.startsWith("{") || text.startsWith("["))) {
            return output;
        }
        try {
            return objectMapper.readValue(text, Object.class);
        } catch (JsonProcessingException e) {
            return output;
        }
    }

    private static Map<String, Object> stringKeys(Map<?, ?> source) {
        Map<String, Object> result = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : source.entrySet()) {
            result.put(String.valueOf(entry.getKey()), entry.getValue());
        }
        return result;
    }

    private static String firstText(Map<String, Object> raw, String... keys) {
        for (String key : keys) {
            String value = asText(raw.get(key));
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return null;
    }

    private static String asText(Object value) {
        return value != null ? value.toString() : null;
    }
}
