package com.questrail.arena.ingest.state;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * GameStateSnapshot
 * -----------------------------------------------------------------------------
 * Immutable view of one match as the {@link GameStateEngine} currently
 * understands it.
 *
 * <h2>Contents</h2>
 * <ul>
 *   <li>match identity: id, game number, seats, names, format;</li>
 *   <li>the submitted deck with per-card remaining counts, the sideboard and
 *       commander ids;</li>
 *   <li>zone contents as grpId lists, split by owner;</li>
 *   <li>life totals and turn position;</li>
 *   <li>draw history, mulligan state and per-card draw probabilities.</li>
 * </ul>
 *
 * <h2>Invariants</h2>
 * {@code librarySize} equals the sum of {@code remaining} over
 * {@code deckList}, so the values of {@code drawProbabilities} sum to 1 when
 * the library is non-empty and the map is empty otherwise.
 *
 * <p>All list and map components are copied on construction; a snapshot
 * handed to a listener never changes afterwards.</p>
 */
public record GameStateSnapshot(
        String matchId,
        int gameNumber,
        int playerSeatId,
        int opponentSeatId,
        String playerName,
        String opponentName,
        String format,
        List<DeckCardEntry> deckList,
        List<DeckCardEntry> sideboardList,
        List<Integer> commanderGrpIds,
        int librarySize,
        List<Integer> hand,
        List<Integer> battlefield,
        List<Integer> graveyard,
        List<Integer> exile,
        List<Integer> opponentBattlefield,
        List<Integer> opponentGraveyard,
        int playerLife,
        int opponentLife,
        int turnNumber,
        String phase,
        String step,
        int activePlayer,
        List<Integer> opponentCardsSeen,
        List<Integer> cardsDrawn,
        int mulliganCount,
        List<Integer> openingHand,
        boolean active,
        boolean sideboarding,
        Map<Integer, Double> drawProbabilities
) {
    public GameStateSnapshot {
        deckList = List.copyOf(deckList);
        sideboardList = List.copyOf(sideboardList);
        commanderGrpIds = List.copyOf(commanderGrpIds);
        hand = List.copyOf(hand);
        battlefield = List.copyOf(battlefield);
        graveyard = List.copyOf(graveyard);
        exile = List.copyOf(exile);
        opponentBattlefield = List.copyOf(opponentBattlefield);
        opponentGraveyard = List.copyOf(opponentGraveyard);
        opponentCardsSeen = List.copyOf(opponentCardsSeen);
        cardsDrawn = List.copyOf(cardsDrawn);
        openingHand = List.copyOf(openingHand);
        // Deck order is kept for display.
        drawProbabilities = Collections.unmodifiableMap(new LinkedHashMap<>(drawProbabilities));
    }

    /**
     * @return the remaining count for {@code grpId} in the main deck, or 0 if
     *         it is not part of the deck
     */
    public int remaining(int grpId) {
        for (DeckCardEntry entry : deckList) {
            if (entry.grpId() == grpId) {
                return entry.remaining();
            }
        }
        return 0;
    }
}
