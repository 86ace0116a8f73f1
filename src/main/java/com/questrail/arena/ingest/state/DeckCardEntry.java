package com.questrail.arena.ingest.state;

/**
 * One line of the tracked deck: a card, how many copies were submitted and
 * how many are believed to remain in the library.
 *
 * @param grpId     card identity
 * @param name      resolved display name, or {@code null} until resolved
 * @param quantity  submitted copies
 * @param remaining copies not yet drawn or otherwise moved out of the library
 */
public record DeckCardEntry(int grpId, String name, int quantity, int remaining) {

    public DeckCardEntry {
        if (quantity < 0) {
            throw new IllegalArgumentException("quantity must be >= 0");
        }
        if (remaining < 0 || remaining > quantity) {
            throw new IllegalArgumentException("remaining must be within [0, quantity]");
        }
    }

    public static DeckCardEntry full(int grpId, int quantity) {
        return new DeckCardEntry(grpId, null, quantity, quantity);
    }

    public DeckCardEntry withRemaining(int remaining) {
        return new DeckCardEntry(grpId, name, quantity, remaining);
    }

    public DeckCardEntry withName(String name) {
        return new DeckCardEntry(grpId, name, quantity, remaining);
    }

    public boolean isResolved() {
        return name != null;
    }
}
