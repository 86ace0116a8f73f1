package com.questrail.arena.ingest.telemetry;

import com.questrail.arena.ingest.events.DeckCard;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Multiset difference between two deck lists.
 *
 * <p>For every grpId the quantity delta decides the side: a positive delta
 * puts that many copies in {@code boardedIn}, a negative one in
 * {@code boardedOut}. Ids are listed in first-seen order, the old deck's
 * ids before new ones.</p>
 */
public record SideboardDiff(List<Integer> boardedIn, List<Integer> boardedOut) {

    public SideboardDiff {
        boardedIn = List.copyOf(boardedIn);
        boardedOut = List.copyOf(boardedOut);
    }

    public static SideboardDiff between(List<DeckCard> before, List<DeckCard> after) {
        Map<Integer, Integer> deltas = new LinkedHashMap<>();
        for (DeckCard card : before) {
            deltas.merge(card.grpId(), -card.quantity(), Integer::sum);
        }
        for (DeckCard card : after) {
            deltas.merge(card.grpId(), card.quantity(), Integer::sum);
        }

        List<Integer> in = new ArrayList<>();
        List<Integer> out = new ArrayList<>();
        deltas.forEach((grpId, delta) -> {
            for (int i = 0; i < Math.abs(delta); i++) {
                (delta > 0 ? in : out).add(grpId);
            }
        });
        return new SideboardDiff(in, out);
    }

    public boolean isEmpty() {
        return boardedIn.isEmpty() && boardedOut.isEmpty();
    }
}
