package com.questrail.arena.ingest.events;

/**
 * Outcome of a match from the local player's point of view.
 */
public enum MatchResult {
    WIN("win"),
    LOSS("loss"),
    DRAW("draw");

    private final String wireName;

    MatchResult(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
