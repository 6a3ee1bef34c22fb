package com.di.bqsampler.entity;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;
import java.util.function.Function;

/**
 * Field accessors used by the hand-written {@code fromJson} converters.
 *
 * <p>Scalar accessors are strict and raise {@link IllegalArgumentException} on a type
 * mismatch. {@link #nested} is lenient: a nested value object that cannot be built is
 * logged and read as {@code null}.
 */
@Slf4j
public final class JsonFields {

    public static final ObjectMapper MAPPER = new ObjectMapper();

    private JsonFields() {}

    /**
     * Parses {@code json}; unparsable or blank text yields an empty object.
     */
    public static JsonNode parseOrEmpty(String json, String context) {
        if (json == null || json.isBlank()) {
            return MAPPER.createObjectNode();
        }
        try {
            JsonNode node = MAPPER.readTree(json);
            return node != null ? node : MAPPER.createObjectNode();
        } catch (Exception e) {
            log.warn("[JSON] Could not parse JSON for {}. Ignoring. Error: {}", context, e.getMessage());
            return MAPPER.createObjectNode();
        }
    }

    public static ObjectNode newObject() {
        return MAPPER.createObjectNode();
    }

    public static JsonNode requireObject(JsonNode node, Class<?> type) {
        if (node == null || !node.isObject()) {
            throw new IllegalArgumentException(
                    String.format("%s must be a JSON object, got: %s", type.getSimpleName(), node));
        }
        return node;
    }

    public static boolean isAbsent(JsonNode node, String field) {
        return node == null || !node.hasNonNull(field);
    }

    public static String text(JsonNode node, String field) {
        if (isAbsent(node, field)) {
            return null;
        }
        JsonNode value = node.get(field);
        if (!value.isTextual()) {
            throw new IllegalArgumentException(
                    String.format("Field '%s' must be a string, got: %s", field, value));
        }
        return value.asText();
    }

    public static Long longValue(JsonNode node, String field) {
        if (isAbsent(node, field)) {
            return null;
        }
        JsonNode value = node.get(field);
        if (!value.isIntegralNumber() || !value.canConvertToLong()) {
            throw new IllegalArgumentException(
                    String.format("Field '%s' must be an integer, got: %s", field, value));
        }
        return value.longValue();
    }

    public static Double decimal(JsonNode node, String field) {
        if (isAbsent(node, field)) {
            return null;
        }
        JsonNode value = node.get(field);
        if (!value.isNumber()) {
            throw new IllegalArgumentException(
                    String.format("Field '%s' must be a number, got: %s", field, value));
        }
        return value.doubleValue();
    }

    /**
     * Builds a nested value object; conversion failures are logged and read as {@code null}.
     */
    public static <T> T nested(JsonNode node, String field, Function<JsonNode, T> converter, Class<?> owner) {
        if (isAbsent(node, field)) {
            return null;
        }
        try {
            return converter.apply(node.get(field));
        } catch (RuntimeException e) {
            log.warn("[JSON] Could not create field <{}> for type <{}>. Ignoring. Error: {}",
                    field, owner.getSimpleName(), e.getMessage());
            return null;
        }
    }

    /**
     * Builds a nested value object that the owner cannot do without.
     */
    public static <T> T required(JsonNode node, String field, Function<JsonNode, T> converter, Class<?> owner) {
        T value = Optional.ofNullable(node)
                .filter(n -> n.hasNonNull(field))
                .map(n -> converter.apply(n.get(field)))
                .orElse(null);
        if (value == null) {
            throw new IllegalArgumentException(
                    String.format("Field '%s' is required for %s", field, owner.getSimpleName()));
        }
        return value;
    }

    public static void putIfPresent(ObjectNode target, String field, String value) {
        if (value != null) {
            target.put(field, value);
        }
    }

    public static void putIfPresent(ObjectNode target, String field, Long value) {
        if (value != null) {
            target.put(field, value);
        }
    }

    public static void putIfPresent(ObjectNode target, String field, Double value) {
        if (value != null) {
            target.put(field, value);
        }
    }
}
