package com.questrail.arena.ingest.events;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/**
 * One annotation of a game-state diff:
 * {@code {id, affectorId, affectedIds[], type[], details[{key, valueInt32[] | valueString[]}]}}.
 */
final class Annotation {

    private final int id;
    private final int affectorId;
    private final List<Integer> affectedIds;
    private final List<String> types;
    private final JsonNode details;

    private Annotation(int id, int affectorId, List<Integer> affectedIds, List<String> types, JsonNode details) {
        this.id = id;
        this.affectorId = affectorId;
        this.affectedIds = affectedIds;
        this.types = types;
        this.details = details;
    }

    static List<Annotation> parseAll(JsonNode array) {
        List<Annotation> out = new ArrayList<>();
        for (JsonNode a : JsonFields.elements(array)) {
            if (!a.isObject()) {
                continue;
            }
            JsonNode type = a.get("type");
            List<String> types = type != null && type.isTextual()
                    ? List.of(type.asText())
                    : JsonFields.strings(type);
            out.add(new Annotation(
                    JsonFields.intValue(a, "id", 0),
                    JsonFields.intValue(a, "affectorId", 0),
                    JsonFields.ints(a.get("affectedIds")),
                    types,
                    a.get("details")));
        }
        return out;
    }

    int id() {
        return id;
    }

    int affectorId() {
        return affectorId;
    }

    List<Integer> affectedIds() {
        return affectedIds;
    }

    boolean is(String type) {
        return types.contains(type);
    }

    List<Integer> ints(String key) {
        JsonNode detail = detail(key);
        return detail == null ? List.of() : JsonFields.ints(detail.get("valueInt32"));
    }

    Integer firstInt(String key) {
        List<Integer> values = ints(key);
        return values.isEmpty() ? null : values.get(0);
    }

    int firstIntOr(String key, int defaultValue) {
        Integer value = firstInt(key);
        return value != null ? value : defaultValue;
    }

    String firstString(String key) {
        JsonNode detail = detail(key);
        if (detail == null) {
            return null;
        }
        List<String> values = JsonFields.strings(detail.get("valueString"));
        return values.isEmpty() ? null : values.get(0);
    }

    private JsonNode detail(String key) {
        for (JsonNode d : JsonFields.elements(details)) {
            if (key.equals(JsonFields.text(d, "key"))) {
                return d;
            }
        }
        return null;
    }
}
