package com.questrail.arena.ingest.legacy;

import com.questrail.arena.ingest.events.DeckCard;
import com.questrail.arena.ingest.events.MatchResult;

import java.util.List;
import java.util.Objects;

/**
 * Coarse per-match summary built from whole blocks, without the diff-aware
 * event path.
 *
 * @param deckCards         the last submitted main deck, or null when none was seen
 * @param turns             highest turn number observed
 * @param cardsPlayed       distinct grpIds seen on seat 1 objects
 * @param opponentCardsSeen distinct grpIds seen on seat 2 objects
 */
public record LegacyMatchRecord(
        String matchId,
        String playerName,
        String opponentName,
        MatchResult result,
        String format,
        int turns,
        List<DeckCard> deckCards,
        List<Integer> cardsPlayed,
        List<Integer> opponentCardsSeen
) {
    public LegacyMatchRecord {
        Objects.requireNonNull(matchId, "matchId");
        Objects.requireNonNull(result, "result");
        deckCards = deckCards == null ? null : List.copyOf(deckCards);
        cardsPlayed = List.copyOf(cardsPlayed);
        opponentCardsSeen = List.copyOf(opponentCardsSeen);
    }
}
