package com.contextgraph.storage;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;

/**
 * Shared JSON plumbing: the wire-format mapper and crash-safe file writes.
 */
public class JsonStorage {

    private static final ObjectMapper mapper = createMapper();

    private JsonStorage() {
    }

    /**
     * Mapper for the decision-record wire format: snake_case properties, ISO-8601
     * instants, lowercase enums (declared on the enums), unknown fields ignored.
     */
    public static ObjectMapper createMapper() {
        SimpleModule lenientInstants = new SimpleModule("lenient-instants");
        lenientInstants.addDeserializer(Instant.class, new LenientInstantDeserializer());

        ObjectMapper objectMapper = new ObjectMapper();
        objectMapper.registerModule(new JavaTimeModule());
        objectMapper.registerModule(lenientInstants);
        objectMapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
        objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        objectMapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return objectMapper;
    }

    public static ObjectMapper mapper() {
        return mapper;
    }

    /**
     * Accepts {@code 2024-05-01T10:00:00Z}, {@code 2024-05-01T10:00:00+02:00} and offset-less
     * {@code 2024-05-01T10:00:00.123456}, the last read as UTC.
     */
    public static Instant parseInstant(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String text = raw.trim();
        try {
            return OffsetDateTime.parse(text).toInstant();
        } catch (DateTimeParseException ignored) {
            // fall through to the offset-less form
        }
        try {
            return LocalDateTime.parse(text).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid ISO-8601 timestamp: " + raw, e);
        }
    }

    /**
     * Atomic write: write to .tmp file, then rename.
     */
    public static void writeJsonAtomic(Path target, Object value, ObjectMapper objectMapper) throws IOException {
        Path parent = target.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path tmpFile = target.resolveSibling(target.getFileName().toString() + ".tmp");
        String json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        Files.writeString(tmpFile, json, StandardCharsets.UTF_8);
        try {
            Files.move(tmpFile, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmpFile, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    static final class LenientInstantDeserializer extends StdDeserializer<Instant> {

        LenientInstantDeserializer() {
            super(Instant.class);
        }

        @Override
        public Instant deserialize(JsonParser parser, DeserializationContext context) throws IOException {
            if (parser.currentToken().isNumeric()) {
                return Instant.ofEpochMilli(parser.getLongValue());
            }
            String text = parser.getValueAsString();
            try {
                return parseInstant(text);
            } catch (IllegalArgumentException e) {
                return (Instant) context.handleWeirdStringValue(Instant.class, text, e.getMessage());
            }
        }
    }
}
