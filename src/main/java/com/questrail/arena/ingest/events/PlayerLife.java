package com.questrail.arena.ingest.events;

/**
 * A seat's life total as listed in a game-state message's players array.
 */
public record PlayerLife(int seatId, int lifeTotal) {
}
