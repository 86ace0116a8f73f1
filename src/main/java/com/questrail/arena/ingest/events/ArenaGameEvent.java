package com.questrail.arena.ingest.events;

import java.util.List;
import java.util.Objects;

/**
 * ArenaGameEvent
 * -----------------------------------------------------------------------------
 * Typed domain events decoded from the client log.
 *
 * <h2>Role in the architecture</h2>
 * {@link EventExtractor} is the only producer. The game state engine folds
 * them into a live snapshot and the telemetry recorder turns them into an
 * action log; both see the same ordered stream.
 *
 * <h2>Design constraints</h2>
 * <ul>
 *   <li>The set of variants is closed; consumers dispatch with
 *       {@code instanceof} over the nested records.</li>
 *   <li>Events are immutable; list components are copied on construction.</li>
 *   <li>Card events are only produced once a nonzero grpId is known.</li>
 * </ul>
 */
public sealed interface ArenaGameEvent
        permits ArenaGameEvent.MatchStart,
                ArenaGameEvent.MatchComplete,
                ArenaGameEvent.DeckSubmission,
                ArenaGameEvent.GameStateUpdate,
                ArenaGameEvent.MulliganPrompt,
                ArenaGameEvent.CardDrawn,
                ArenaGameEvent.CardPlayed,
                ArenaGameEvent.ZoneChange,
                ArenaGameEvent.LifeTotalChange,
                ArenaGameEvent.TurnChange,
                ArenaGameEvent.PhaseChange,
                ArenaGameEvent.DamageDealt,
                ArenaGameEvent.Intermission
{
    /**
     * Snake-case name of the variant, e.g. {@code "zone_change"}.
     */
    String type();

    // -------------------------------------------------------------------------
    // Match lifecycle
    // -------------------------------------------------------------------------

    /**
     * A new match began. {@code format} is the event id the local player
     * queued into; names may be null when the roster omitted them.
     */
    record MatchStart(
            String matchId,
            int playerSeatId,
            int playerTeamId,
            String playerName,
            String opponentName,
            String format
    ) implements ArenaGameEvent {
        public MatchStart {
            Objects.requireNonNull(matchId, "matchId");
        }

        @Override
        public String type() {
            return "match_start";
        }
    }

    record MatchComplete(String matchId, MatchResult result, Integer winningTeamId) implements ArenaGameEvent {
        public MatchComplete {
            Objects.requireNonNull(matchId, "matchId");
            Objects.requireNonNull(result, "result");
        }

        @Override
        public String type() {
            return "match_complete";
        }
    }

    /**
     * The local player submitted a deck. {@code mainDeck} is never empty.
     */
    record DeckSubmission(
            List<DeckCard> mainDeck,
            List<DeckCard> sideboard,
            List<Integer> commanderGrpIds
    ) implements ArenaGameEvent {
        public DeckSubmission {
            mainDeck = List.copyOf(mainDeck);
            sideboard = List.copyOf(sideboard);
            commanderGrpIds = List.copyOf(commanderGrpIds);
        }

        @Override
        public String type() {
            return "deck_submission";
        }
    }

    /**
     * Between games of a match; {@code gameNumber} is the game about to start.
     */
    record Intermission(int gameNumber) implements ArenaGameEvent {
        @Override
        public String type() {
            return "intermission";
        }
    }

    // -------------------------------------------------------------------------
    // Game-state diffs
    // -------------------------------------------------------------------------

    /**
     * Raw content of one game-state message, after identity bookkeeping.
     * {@code turnInfo} is null when the message carried none;
     * {@code deletedInstanceIds} lists instances the diff retired.
     */
    record GameStateUpdate(
            List<GameObject> objects,
            List<GameZone> zones,
            TurnInfo turnInfo,
            List<PlayerLife> players,
            List<Integer> deletedInstanceIds
    ) implements ArenaGameEvent {
        public GameStateUpdate {
            objects = List.copyOf(objects);
            zones = List.copyOf(zones);
            players = List.copyOf(players);
            deletedInstanceIds = List.copyOf(deletedInstanceIds);
        }

        @Override
        public String type() {
            return "game_state_update";
        }
    }

    /**
     * A mulligan decision was requested. Emitted first with an empty hand;
     * emitted again with the hand filled once a later diff reveals it.
     */
    record MulliganPrompt(int seatId, int mulliganCount, List<Integer> hand) implements ArenaGameEvent {
        public MulliganPrompt {
            hand = List.copyOf(hand);
        }

        public boolean hasHand() {
            return !hand.isEmpty();
        }

        @Override
        public String type() {
            return "mulligan_prompt";
        }
    }

    record CardDrawn(int grpId, int instanceId, int ownerSeatId) implements ArenaGameEvent {
        @Override
        public String type() {
            return "card_drawn";
        }
    }

    record CardPlayed(
            int grpId,
            int instanceId,
            int ownerSeatId,
            ZoneType fromZone,
            ZoneType toZone
    ) implements ArenaGameEvent {
        public CardPlayed {
            Objects.requireNonNull(fromZone, "fromZone");
            Objects.requireNonNull(toZone, "toZone");
        }

        @Override
        public String type() {
            return "card_played";
        }
    }

    /**
     * An object moved between zones. {@code category} is the client's reason
     * tag ({@code Draw}, {@code CastSpell}, {@code Destroy}, ...), null when absent.
     */
    record ZoneChange(
            int grpId,
            int instanceId,
            int ownerSeatId,
            int fromZoneId,
            int toZoneId,
            ZoneType fromZone,
            ZoneType toZone,
            String category
    ) implements ArenaGameEvent {
        public ZoneChange {
            Objects.requireNonNull(fromZone, "fromZone");
            Objects.requireNonNull(toZone, "toZone");
        }

        @Override
        public String type() {
            return "zone_change";
        }
    }

    /**
     * A seat's life total changed. {@code delta} is the signed change from the
     * previously known total.
     */
    record LifeTotalChange(int seatId, int lifeTotal, int delta) implements ArenaGameEvent {
        @Override
        public String type() {
            return "life_total_change";
        }
    }

    record TurnChange(int turnNumber, int activePlayer) implements ArenaGameEvent {
        @Override
        public String type() {
            return "turn_change";
        }
    }

    record PhaseChange(String phase, String step, int turnNumber) implements ArenaGameEvent {
        public PhaseChange {
            Objects.requireNonNull(phase, "phase");
            Objects.requireNonNull(step, "step");
        }

        @Override
        public String type() {
            return "phase_change";
        }
    }

    /**
     * Damage from a card. Exactly one of {@code targetSeatId} (a player) and
     * {@code targetGrpId} (a card) is non-null.
     */
    record DamageDealt(int sourceGrpId, Integer targetSeatId, Integer targetGrpId, int amount) implements ArenaGameEvent {
        public DamageDealt {
            if ((targetSeatId == null) == (targetGrpId == null)) {
                throw new IllegalArgumentException("exactly one damage target must be set");
            }
        }

        @Override
        public String type() {
            return "damage_dealt";
        }
    }
}
