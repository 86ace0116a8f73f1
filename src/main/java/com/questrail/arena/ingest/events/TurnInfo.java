package com.questrail.arena.ingest.events;

import java.util.Objects;

/**
 * Turn position carried by a game-state message. Phase and step are empty
 * strings when absent.
 */
public record TurnInfo(int turnNumber, int activePlayer, String phase, String step) {
    public TurnInfo {
        Objects.requireNonNull(phase, "phase");
        Objects.requireNonNull(step, "step");
    }
}
