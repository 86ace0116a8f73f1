package com.questrail.arena.ingest.telemetry;

/**
 * Kinds of recorded action, with their wire names.
 */
public enum TelemetryActionType {
    MATCH_START("match_start"),
    DECK_SUBMITTED("deck_submitted"),
    MULLIGAN_KEEP("mulligan_keep"),
    MULLIGAN_MULL("mulligan_mull"),
    CARD_DRAWN("card_drawn"),
    CARD_PLAYED("card_played"),
    OPPONENT_CARD_PLAYED("opponent_card_played"),
    LIFE_CHANGE("life_change"),
    TURN_START("turn_start"),
    PHASE_CHANGE("phase_change"),
    SIDEBOARD_START("sideboard_start"),
    MATCH_END("match_end");

    private final String wireName;

    TelemetryActionType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
