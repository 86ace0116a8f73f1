package com.questrail.arena.ingest.events;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Lenient field access over client JSON. Missing or mistyped fields read as
 * the supplied default instead of failing.
 */
public final class JsonFields {

    private JsonFields() {}

    public static int intValue(JsonNode node, String field, int defaultValue) {
        if (node == null) {
            return defaultValue;
        }
        JsonNode value = node.get(field);
        if (value == null) {
            return defaultValue;
        }
        if (value.isNumber()) {
            return value.asInt();
        }
        if (value.isTextual() && isDigits(value.asText())) {
            return value.asInt(defaultValue);
        }
        return defaultValue;
    }

    /** Like {@link #intValue} but returns null when the field is absent or not numeric. */
    public static Integer intOrNull(JsonNode node, String field) {
        if (node == null) {
            return null;
        }
        JsonNode value = node.get(field);
        return value != null && value.isNumber() ? value.asInt() : null;
    }

    public static String text(JsonNode node, String field) {
        if (node == null) {
            return null;
        }
        JsonNode value = node.get(field);
        return value != null && value.isTextual() ? value.asText() : null;
    }

    public static String text(JsonNode node, String field, String defaultValue) {
        String value = text(node, field);
        return value != null ? value : defaultValue;
    }

    /**
     * @return the first of {@code fields} present on {@code node}, or null
     */
    public static JsonNode first(JsonNode node, String... fields) {
        if (node == null) {
            return null;
        }
        for (String field : fields) {
            JsonNode value = node.get(field);
            if (value != null && !value.isNull()) {
                return value;
            }
        }
        return null;
    }

    /**
     * Elements of the array at {@code field}; empty when absent or not an array.
     */
    public static Iterable<JsonNode> elements(JsonNode node, String field) {
        if (node == null) {
            return Collections.emptyList();
        }
        return elements(node.get(field));
    }

    public static Iterable<JsonNode> elements(JsonNode array) {
        if (array == null || !array.isArray()) {
            return Collections.emptyList();
        }
        return array;
    }

    public static List<Integer> ints(JsonNode array) {
        List<Integer> out = new ArrayList<>();
        for (JsonNode element : elements(array)) {
            if (element.isNumber()) {
                out.add(element.asInt());
            }
        }
        return out;
    }

    public static List<String> strings(JsonNode array) {
        List<String> out = new ArrayList<>();
        for (JsonNode element : elements(array)) {
            if (element.isTextual()) {
                out.add(element.asText());
            }
        }
        return out;
    }

    static boolean isDigits(String s) {
        return !s.isEmpty() && s.chars().allMatch(Character::isDigit);
    }
}
