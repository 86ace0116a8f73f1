package com.questrail.arena.ingest.telemetry;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Objects;

/**
 * One recorded action.
 *
 * @param matchId     match the action belongs to
 * @param gameNumber  game within the match, starting at 1
 * @param turnNumber  turn at the time of the action; 0 before the first turn
 * @param phase       phase at the time of the action; empty when unknown
 * @param actionType  what happened
 * @param player      whose action it was
 * @param grpId       card involved, or null
 * @param cardName    display name of the card, or null when unknown
 * @param details     action-specific fields, or null
 * @param actionOrder strictly increasing within a match, starting at 0
 */
public record TelemetryAction(
        String matchId,
        int gameNumber,
        int turnNumber,
        String phase,
        TelemetryActionType actionType,
        Player player,
        Integer grpId,
        String cardName,
        ObjectNode details,
        long actionOrder
) {
    public enum Player {
        SELF("self"),
        OPPONENT("opponent");

        private final String wireName;

        Player(String wireName) {
            this.wireName = wireName;
        }

        public String wireName() {
            return wireName;
        }
    }

    public TelemetryAction {
        Objects.requireNonNull(matchId, "matchId");
        Objects.requireNonNull(phase, "phase");
        Objects.requireNonNull(actionType, "actionType");
        Objects.requireNonNull(player, "player");
        details = details != null ? details.deepCopy() : null;
    }

    /**
     * Returns a copy of the details; the stored node is never handed out.
     */
    @Override
    public ObjectNode details() {
        return details != null ? details.deepCopy() : null;
    }
}
