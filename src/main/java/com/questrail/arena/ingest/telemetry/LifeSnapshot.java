package com.questrail.arena.ingest.telemetry;

/**
 * Both life totals right after a life change.
 */
public record LifeSnapshot(int turn, int playerLife, int opponentLife) {
}
