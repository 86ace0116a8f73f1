package com.questrail.arena.ingest.telemetry;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Whole-match summary returned by the final flush.
 *
 * @param onPlay              true if the local player took turn 1, null if no
 *                            turn 1 was seen
 * @param matchEndTime        null if the match never completed
 * @param result              wire name of the result, null if never completed
 * @param opponentCardsByTurn grpIds the opponent played or revealed, keyed by turn
 */
public record MatchTelemetrySummary(
        String matchId,
        List<Integer> openingHand,
        int mulliganCount,
        Boolean onPlay,
        Instant matchStartTime,
        Instant matchEndTime,
        int gameCount,
        String result,
        List<LifeSnapshot> lifeProgression,
        List<Integer> drawOrder,
        List<SideboardChange> sideboardChanges,
        Map<Integer, List<Integer>> opponentCardsByTurn
) {
    public MatchTelemetrySummary {
        openingHand = List.copyOf(openingHand);
        lifeProgression = List.copyOf(lifeProgression);
        drawOrder = List.copyOf(drawOrder);
        sideboardChanges = List.copyOf(sideboardChanges);
        Map<Integer, List<Integer>> byTurn = new TreeMap<>();
        opponentCardsByTurn.forEach((turn, ids) -> byTurn.put(turn, List.copyOf(new ArrayList<>(ids))));
        opponentCardsByTurn = Collections.unmodifiableMap(byTurn);
    }
}
