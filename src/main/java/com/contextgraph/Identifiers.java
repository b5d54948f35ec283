package com.contextgraph;

import com.contextgraph.storage.JsonStorage;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.PrettyPrinter;
import com.fasterxml.jackson.core.SerializableString;
import com.fasterxml.jackson.core.io.CharacterEscapes;
import com.fasterxml.jackson.core.io.SerializedString;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.UUID;

/**
 * Opaque identifiers and content fingerprints for decision records.
 *
 * The canonical text mirrors Python's {@code json.dumps(data, sort_keys=True)}, so a
 * snapshot hashed by the Python SDK and by this class yields the same fingerprint. Values
 * that are not plain JSON are written the way the wire-format mapper writes them.
 */
public final class Identifiers {

    private static final int HASH_LENGTH = 16;
    private static final ObjectWriter CANONICAL = createCanonicalWriter();

    private Identifiers() {
    }

    public static String generateId() {
        return UUID.randomUUID().toString();
    }

    /**
     * First 16 hex characters of the SHA-256 digest of the canonical form of {@code snapshot}.
     * Advisory only: used for diffing and precedent lookups, never for access control.
     */
    public static String generateHash(Object snapshot) {
        String canonical = canonicalJson(snapshot);
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] bytes = digest.digest(canonical.getBytes(StandardCharsets.UTF_8));
            return bytesToHex(bytes).substring(0, HASH_LENGTH);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }

    /**
     * @throws IllegalArgumentException if the value cannot be written as JSON
     */
    public static String canonicalJson(Object value) {
        try {
            return CANONICAL.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Value is not JSON-serializable: " + e.getOriginalMessage(), e);
        }
    }

    private static ObjectWriter createCanonicalWriter() {
        SimpleModule floats = new SimpleModule("python-floats");
        floats.addSerializer(Double.class, new PythonFloatSerializer());
        floats.addSerializer(Float.class, new PythonFloatSerializer());
        floats.addSerializer(BigDecimal.class, new PythonFloatSerializer());

        ObjectMapper objectMapper = JsonStorage.createMapper();
        objectMapper.registerModule(floats);
        objectMapper.enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
        objectMapper.setConfig(objectMapper.getSerializationConfig()
            .with(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY));
        return objectMapper.writer(new PythonSeparators()).with(new AsciiEscapes());
    }

    /**
     * Python float repr: shortest round-trip digits, ".0" on integral values,
     * scientific notation outside [1e-4, 1e16) with a signed two-digit exponent.
     */
    static String formatFloat(double d) {
        if (Double.isNaN(d)) {
            return "NaN";
        }
        if (Double.isInfinite(d)) {
            return d > 0 ? "Infinity" : "-Infinity";
        }
        if (d == 0.0) {
            return (1 / d < 0) ? "-0.0" : "0.0";
        }
        double abs = Math.abs(d);
        String shortest = Double.toString(d);
        if (abs >= 1e-4 && abs < 1e16) {
            String plain = new BigDecimal(shortest).toPlainString();
            return plain.contains(".") ? plain : plain + ".0";
        }
        BigDecimal decimal = new BigDecimal(shortest).stripTrailingZeros();
        String digits = decimal.unscaledValue().abs().toString();
        int exponent = digits.length() - 1 - decimal.scale();
        StringBuilder mantissa = new StringBuilder();
        if (d < 0) {
            mantissa.append('-');
        }
        mantissa.append(digits.charAt(0));
        if (digits.length() > 1) {
            mantissa.append('.').append(digits, 1, digits.length());
        }
        String exp = String.valueOf(Math.abs(exponent));
        if (exp.length() < 2) {
            exp = "0" + exp;
        }
        return mantissa + "e" + (exponent < 0 ? "-" : "+") + exp;
    }

    static String bytesToHex(byte[] bytes) {
        StringBuilder sb = new StringBuilder(bytes.length * 2);
        for (byte b : bytes) {
            sb.append(String.format("%02x", b));
        }
        return sb.toString();
    }

    /**
     * Python float repr for every non-integral number.
     */
    private static final class PythonFloatSerializer extends StdSerializer<Number> {

        PythonFloatSerializer() {
            super(Number.class);
        }

        @Override
        public void serialize(Number value, JsonGenerator gen, SerializerProvider provider) throws IOException {
            gen.writeNumber(formatFloat(value.doubleValue()));
        }
    }

    /**
     * Compact output with Python's default {@code ", "} and {@code ": "} separators.
     */
    private static final class PythonSeparators implements PrettyPrinter {

        @Override
        public void writeRootValueSeparator(JsonGenerator gen) throws IOException {
            gen.writeRaw(' ');
        }

        @Override
        public void writeStartObject(JsonGenerator gen) throws IOException {
            gen.writeRaw('{');
        }

        @Override
        public void writeEndObject(JsonGenerator gen, int nrOfEntries) throws IOException {
            gen.writeRaw('}');
        }

        @Override
        public void writeObjectEntrySeparator(JsonGenerator gen) throws IOException {
            gen.writeRaw(", ");
        }

        @Override
        public void writeObjectFieldValueSeparator(JsonGenerator gen) throws IOException {
            gen.writeRaw(": ");
        }

        @Override
        public void writeStartArray(JsonGenerator gen) throws IOException {
            gen.writeRaw('[');
        }

        @Override
        public void writeEndArray(JsonGenerator gen, int nrOfValues) throws IOException {
            gen.writeRaw(']');
        }

        @Override
        public void writeArrayValueSeparator(JsonGenerator gen) throws IOException {
            gen.writeRaw(", ");
        }

        @Override
        public void beforeArrayValues(JsonGenerator gen) {
        }

        @Override
        public void beforeObjectEntries(JsonGenerator gen) {
        }
    }

    /**
     * {@code ensure_ascii}: everything outside printable ASCII becomes a lowercase
     * four-digit unicode escape, one per UTF-16 unit. Quote, backslash and the short
     * control escapes stay as Jackson writes them.
     */
    private static final class AsciiEscapes extends CharacterEscapes {

        private final int[] asciiEscapes;

        AsciiEscapes() {
            int[] escapes = CharacterEscapes.standardAsciiEscapesForJSON();
            for (int c = 0; c < 0x20; c++) {
                if (escapes[c] == CharacterEscapes.ESCAPE_STANDARD) {
                    escapes[c] = CharacterEscapes.ESCAPE_CUSTOM;
                }
            }
            escapes[0x7f] = CharacterEscapes.ESCAPE_CUSTOM;
            this.asciiEscapes = escapes;
        }

        @Override
        public int[] getEscapeCodesForAscii() {
            return asciiEscapes;
        }

        @Override
        public SerializableString getEscapeSequence(int ch) {
            if (ch >= 0x20 && ch < 0x7f) {
                return null;
            }
            return new SerializedString(String.format("\\u%04x", ch));
        }
    }
}
