package com.questrail.arena.ingest.state;

/**
 * Receives a snapshot after every event the engine processes.
 */
@FunctionalInterface
public interface GameStateListener {
    void onStateChange(GameStateSnapshot snapshot);
}
