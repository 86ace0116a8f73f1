package com.questrail.arena.ingest.legacy;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Matches and the most recent collection found in one body of log text.
 */
public record LegacyLogResult(List<LegacyMatchRecord> matches, Map<Integer, Integer> collection) {
    public LegacyLogResult {
        matches = List.copyOf(matches);
        collection = collection == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(collection));
    }

    public Optional<Map<Integer, Integer>> collectionIfPresent() {
        return Optional.ofNullable(collection);
    }
}
