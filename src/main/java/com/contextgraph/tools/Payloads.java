package com.contextgraph.tools;

import com.contextgraph.storage.JsonStorage;
import com.fasterxml.jackson.core.type.TypeReference;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Snapshots, action results and interrupt payloads are stored as maps.
 *
 * <p>Payloads are converted once into plain JSON values (maps, lists, strings,
 * numbers, booleans) through the wire-format mapper and frozen, so a recorded
 * payload is exactly what gets stored and can no longer change under its hash.
 */
public final class Payloads {

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private Payloads() {
    }

    /**
     * Maps are kept as structured payloads with string keys; any other non-null value
     * is wrapped as {@code {"value": v}}. Values the mapper cannot convert are kept as
     * their string form.
     */
    public static Map<String, Object> asMap(Object value) {
        if (value == null) {
            return null;
        }
        Map<String, Object> payload;
        if (value instanceof Map<?, ?>) {
            payload = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
                payload.put(String.valueOf(entry.getKey()), entry.getValue());
            }
        } else {
            payload = new LinkedHashMap<>();
            payload.put("value", value);
        }
        return freeze(toJson(payload));
    }

    public static Map<String, Object> copyArgs(Map<String, Object> args) {
        return args != null ? new LinkedHashMap<>(args) : new LinkedHashMap<>();
    }

    private static Map<String, Object> toJson(Map<String, Object> payload) {
        try {
            return JsonStorage.mapper().convertValue(payload, MAP_TYPE);
        } catch (IllegalArgumentException e) {
            Map<String, Object> converted = new LinkedHashMap<>();
            for (Map.Entry<String, Object> entry : payload.entrySet()) {
                converted.put(entry.getKey(), toJsonValue(entry.getValue()));
            }
            return converted;
        }
    }

    private static Object toJsonValue(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return JsonStorage.mapper().convertValue(value, Object.class);
        } catch (IllegalArgumentException e) {
            return String.valueOf(value);
        }
    }

    @SuppressWarnings("unchecked")
    private static Object freezeValue(Object value) {
        if (value instanceof Map<?, ?>) {
            return freeze((Map<String, Object>) value);
        }
        if (value instanceof List<?>) {
            List<Object> items = new ArrayList<>();
            for (Object item : (List<?>) value) {
                items.add(freezeValue(item));
            }
            return Collections.unmodifiableList(items);
        }
        return value;
    }

    private static Map<String, Object> freeze(Map<String, Object> payload) {
        Map<String, Object> frozen = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : payload.entrySet()) {
            frozen.put(entry.getKey(), freezeValue(entry.getValue()));
        }
        return Collections.unmodifiableMap(frozen);
    }
}
