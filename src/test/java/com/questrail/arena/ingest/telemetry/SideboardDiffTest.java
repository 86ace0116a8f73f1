package com.questrail.arena.ingest.telemetry;

import com.questrail.arena.ingest.events.DeckCard;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SideboardDiffTest {

    private static final int A = 101;
    private static final int B = 102;
    private static final int C = 103;

    @Test
    void quantityDeltasDecideSide() {
        SideboardDiff diff = SideboardDiff.between(
                List.of(new DeckCard(A, 4), new DeckCard(B, 2)),
                List.of(new DeckCard(A, 2), new DeckCard(C, 2), new DeckCard(B, 2)));

        assertEquals(List.of(C, C), diff.boardedIn());
        assertEquals(List.of(A, A), diff.boardedOut());
    }

    @Test
    void removedCardIsFullyBoardedOut() {
        SideboardDiff diff = SideboardDiff.between(
                List.of(new DeckCard(A, 1), new DeckCard(B, 3)),
                List.of(new DeckCard(B, 3)));

        assertEquals(List.of(), diff.boardedIn());
        assertEquals(List.of(A), diff.boardedOut());
    }

    @Test
    void reorderedDeckIsUnchanged() {
        SideboardDiff diff = SideboardDiff.between(
                List.of(new DeckCard(A, 2), new DeckCard(B, 2)),
                List.of(new DeckCard(B, 2), new DeckCard(A, 2)));

        assertTrue(diff.isEmpty());
    }
}
