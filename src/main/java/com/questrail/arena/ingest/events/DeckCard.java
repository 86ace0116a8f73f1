package com.questrail.arena.ingest.events;

/**
 * One deck-list line: a card definition and how many copies.
 */
public record DeckCard(int grpId, int quantity) {
    public DeckCard {
        if (grpId <= 0) {
            throw new IllegalArgumentException("grpId must be positive: " + grpId);
        }
        if (quantity < 0) {
            throw new IllegalArgumentException("quantity must be >= 0: " + quantity);
        }
    }
}
