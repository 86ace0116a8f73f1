package com.questrail.arena.ingest.telemetry;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.arena.ingest.config.TelemetryConfig;
import com.questrail.arena.ingest.events.ArenaGameEvent;
import com.questrail.arena.ingest.events.DeckCard;
import com.questrail.arena.ingest.events.StartingLife;
import com.questrail.arena.ingest.internal.time.SystemWallClock;
import com.questrail.arena.ingest.internal.time.WallClock;
import com.questrail.arena.ingest.state.GameStateSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

/**
 * TelemetryRecorder
 * -----------------------------------------------------------------------------
 * Turns the event stream of one match into an ordered action log.
 *
 * <h2>Inputs</h2>
 * {@link #onEvent(ArenaGameEvent, GameStateSnapshot)} is called with each
 * event after the game state engine has applied it, together with the
 * engine's resulting snapshot. The snapshot supplies the local seat, the
 * current turn and the opponent cards observed so far.
 *
 * <h2>Mulligans</h2>
 * A prompt with a nonzero count means the previous hand was mulliganed and
 * is recorded as {@code mulligan_mull}. The keep is recorded when the first
 * turn of the game begins, with the last hand revealed for a prompt.
 *
 * <h2>Sideboarding</h2>
 * After an intermission, the next deck submission is compared against the
 * deck it replaces; the difference is kept per game for the summary.
 *
 * <h2>Flushing</h2>
 * {@link #flush()} returns the actions recorded since the previous flush;
 * {@link #shouldFlush()} turns true once the configured number of turns has
 * passed. {@link #flushFinal()} also returns the match summary.
 *
 * <p>Not thread-safe; driven from the poll thread.</p>
 */
public final class TelemetryRecorder {
    private static final Logger log = LoggerFactory.getLogger(TelemetryRecorder.class);

    private final TelemetryConfig config;
    private final WallClock wallClock;
    private final CardNameSource names;
    private final JsonNodeFactory json = JsonNodeFactory.instance;

    private String matchId = "";
    private int gameNumber = 1;
    private long actionCounter;
    private final List<TelemetryAction> pending = new ArrayList<>();
    private long flushedCount;

    private final List<Integer> openingHand = new ArrayList<>();
    private int mulliganCount;
    private Boolean onPlay;
    private Instant matchStartTime;
    private Instant matchEndTime;
    private String result;
    private final List<Integer> drawOrder = new ArrayList<>();
    private final List<LifeSnapshot> lifeProgression = new ArrayList<>();
    private final List<SideboardChange> sideboardChanges = new ArrayList<>();
    private final Map<Integer, List<Integer>> opponentCardsByTurn = new TreeMap<>();
    private final Set<Integer> opponentCardsRecorded = new HashSet<>();

    private int lastPlayerLife = StartingLife.STANDARD;
    private int lastOpponentLife = StartingLife.STANDARD;
    private int lastFlushTurn;
    private int currentTurn;
    private String currentPhase = "";

    private List<DeckCard> submittedDeck = List.of();
    private boolean awaitingResubmission;

    private boolean mulliganPromptSeen;
    private boolean keepRecorded;
    private final List<Integer> promptHand = new ArrayList<>();

    public TelemetryRecorder() {
        this(TelemetryConfig.defaults(), SystemWallClock.INSTANCE, CardNameSource.none());
    }

    public TelemetryRecorder(TelemetryConfig config, WallClock wallClock, CardNameSource names) {
        this.config = Objects.requireNonNull(config, "config");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.names = Objects.requireNonNull(names, "names");
    }

    // -------------------------------------------------------------------------
    // Match boundaries
    // -------------------------------------------------------------------------

    /**
     * Begins a new match log, discarding anything recorded before.
     */
    public void startMatch(String matchId, String format, String playerName, String opponentName) {
        Objects.requireNonNull(matchId, "matchId");
        reset();
        this.matchId = matchId;
        this.matchStartTime = wallClock.now();

        ObjectNode details = json.objectNode();
        details.put("format", format);
        details.put("playerName", playerName);
        details.put("opponentName", opponentName);
        record(TelemetryActionType.MATCH_START, 0, "", TelemetryAction.Player.SELF, null, details);
    }

    /**
     * True once a match has been started and not reset since.
     */
    public boolean hasMatch() {
        return !matchId.isEmpty();
    }

    public String matchId() {
        return matchId;
    }

    /**
     * Discards every action and all summary data.
     */
    public void reset() {
        matchId = "";
        gameNumber = 1;
        actionCounter = 0;
        pending.clear();
        flushedCount = 0;
        openingHand.clear();
        mulliganCount = 0;
        onPlay = null;
        matchStartTime = null;
        matchEndTime = null;
        result = null;
        drawOrder.clear();
        lifeProgression.clear();
        sideboardChanges.clear();
        opponentCardsByTurn.clear();
        opponentCardsRecorded.clear();
        lastPlayerLife = StartingLife.STANDARD;
        lastOpponentLife = StartingLife.STANDARD;
        lastFlushTurn = 0;
        currentTurn = 0;
        currentPhase = "";
        submittedDeck = List.of();
        awaitingResubmission = false;
        resetMulligan();
    }

    // -------------------------------------------------------------------------
    // Event intake
    // -------------------------------------------------------------------------

    public void onEvent(ArenaGameEvent event, GameStateSnapshot snapshot) {
        Objects.requireNonNull(event, "event");
        Objects.requireNonNull(snapshot, "snapshot");

        if (event instanceof ArenaGameEvent.MatchStart e) {
            startMatch(e.matchId(), e.format(), e.playerName(), e.opponentName());
            lastPlayerLife = snapshot.playerLife();
            lastOpponentLife = snapshot.opponentLife();
            return;
        }
        if (!hasMatch()) {
            log.trace("No match in progress; ignoring {}", event.type());
            return;
        }

        if (event instanceof ArenaGameEvent.MatchComplete e) {
            onMatchComplete(e);
        } else if (event instanceof ArenaGameEvent.DeckSubmission e) {
            onDeckSubmission(e);
        } else if (event instanceof ArenaGameEvent.MulliganPrompt e) {
            onMulliganPrompt(e, snapshot);
        } else if (event instanceof ArenaGameEvent.TurnChange e) {
            onTurnChange(e, snapshot);
        } else if (event instanceof ArenaGameEvent.PhaseChange e) {
            onPhaseChange(e);
        } else if (event instanceof ArenaGameEvent.CardDrawn e) {
            onCardDrawn(e, snapshot);
        } else if (event instanceof ArenaGameEvent.CardPlayed e) {
            onCardPlayed(e, snapshot);
        } else if (event instanceof ArenaGameEvent.LifeTotalChange e) {
            onLifeChange(e, snapshot);
        } else if (event instanceof ArenaGameEvent.Intermission e) {
            onIntermission(e, snapshot);
        } else if (event instanceof ArenaGameEvent.GameStateUpdate) {
            recordNewlySeenOpponentCards(snapshot);
        }
    }

    private void onMatchComplete(ArenaGameEvent.MatchComplete e) {
        matchEndTime = wallClock.now();
        result = e.result().wireName();
        ObjectNode details = json.objectNode();
        details.put("result", result);
        record(TelemetryActionType.MATCH_END, currentTurn, currentPhase, TelemetryAction.Player.SELF, null, details);
    }

    private void onDeckSubmission(ArenaGameEvent.DeckSubmission e) {
        if (awaitingResubmission && !submittedDeck.isEmpty()) {
            SideboardDiff diff = SideboardDiff.between(submittedDeck, e.mainDeck());
            sideboardChanges.add(new SideboardChange(gameNumber, diff.boardedIn(), diff.boardedOut()));
        }
        awaitingResubmission = false;
        submittedDeck = e.mainDeck();

        ObjectNode details = json.objectNode();
        details.put("mainCount", e.mainDeck().size());
        details.put("sideboardCount", e.sideboard().size());
        details.put("cardCount", e.mainDeck().stream().mapToInt(DeckCard::quantity).sum());
        record(TelemetryActionType.DECK_SUBMITTED, currentTurn, currentPhase, TelemetryAction.Player.SELF, null, details);
    }

    private void onMulliganPrompt(ArenaGameEvent.MulliganPrompt e, GameStateSnapshot snapshot) {
        if (e.seatId() != snapshot.playerSeatId()) {
            return;
        }
        mulliganPromptSeen = true;
        if (e.hasHand()) {
            promptHand.clear();
            promptHand.addAll(e.hand());
            return;
        }

        mulliganCount = e.mulliganCount();
        if (e.mulliganCount() > 0) {
            ObjectNode details = json.objectNode();
            details.put("mulliganCount", e.mulliganCount());
            details.put("handSize", promptHand.size());
            record(TelemetryActionType.MULLIGAN_MULL, 0, "", TelemetryAction.Player.SELF, null, details);
        }
        promptHand.clear();
    }

    private void onTurnChange(ArenaGameEvent.TurnChange e, GameStateSnapshot snapshot) {
        if (mulliganPromptSeen && !keepRecorded) {
            recordKeep(promptHand.isEmpty() ? snapshot.openingHand() : promptHand);
        }

        currentTurn = e.turnNumber();
        boolean self = e.activePlayer() == snapshot.playerSeatId();
        if (e.turnNumber() == 1 && onPlay == null) {
            onPlay = self;
        }
        record(TelemetryActionType.TURN_START, e.turnNumber(), "", player(self), null, null);
    }

    private void recordKeep(List<Integer> hand) {
        keepRecorded = true;
        openingHand.clear();
        openingHand.addAll(hand);

        ObjectNode details = json.objectNode();
        details.put("handSize", hand.size());
        ArrayNode ids = details.putArray("hand");
        hand.forEach(ids::add);
        details.put("mulliganCount", mulliganCount);
        record(TelemetryActionType.MULLIGAN_KEEP, 0, "", TelemetryAction.Player.SELF, null, details);
    }

    private void onPhaseChange(ArenaGameEvent.PhaseChange e) {
        currentPhase = e.phase();
        ObjectNode details = json.objectNode();
        details.put("step", e.step());
        record(TelemetryActionType.PHASE_CHANGE, e.turnNumber(), e.phase(), TelemetryAction.Player.SELF, null, details);
    }

    private void onCardDrawn(ArenaGameEvent.CardDrawn e, GameStateSnapshot snapshot) {
        if (e.ownerSeatId() != snapshot.playerSeatId()) {
            return;
        }
        drawOrder.add(e.grpId());
        record(TelemetryActionType.CARD_DRAWN, snapshot.turnNumber(), currentPhase,
                TelemetryAction.Player.SELF, e.grpId(), null);
    }

    private void onCardPlayed(ArenaGameEvent.CardPlayed e, GameStateSnapshot snapshot) {
        boolean self = e.ownerSeatId() == snapshot.playerSeatId();
        int turn = snapshot.turnNumber();
        record(TelemetryActionType.CARD_PLAYED, turn, currentPhase, player(self), e.grpId(), null);
        if (!self) {
            opponentCardsByTurn.computeIfAbsent(turn, t -> new ArrayList<>()).add(e.grpId());
            opponentCardsRecorded.add(e.grpId());
        }
    }

    /**
     * Opponent cards the engine saw on the battlefield or in the graveyard
     * without a matching play, e.g. after joining mid-game.
     */
    private void recordNewlySeenOpponentCards(GameStateSnapshot snapshot) {
        int turn = snapshot.turnNumber();
        for (Integer grpId : snapshot.opponentCardsSeen()) {
            if (opponentCardsRecorded.add(grpId)) {
                opponentCardsByTurn.computeIfAbsent(turn, t -> new ArrayList<>()).add(grpId);
                record(TelemetryActionType.OPPONENT_CARD_PLAYED, turn, currentPhase,
                        TelemetryAction.Player.OPPONENT, grpId, null);
            }
        }
    }

    private void onLifeChange(ArenaGameEvent.LifeTotalChange e, GameStateSnapshot snapshot) {
        boolean self = e.seatId() == snapshot.playerSeatId();
        if (self) {
            lastPlayerLife = e.lifeTotal();
        } else {
            lastOpponentLife = e.lifeTotal();
        }
        int turn = snapshot.turnNumber();
        lifeProgression.add(new LifeSnapshot(turn, lastPlayerLife, lastOpponentLife));

        ObjectNode details = json.objectNode();
        details.put("lifeTotal", e.lifeTotal());
        details.put("seatId", e.seatId());
        details.put("delta", e.delta());
        record(TelemetryActionType.LIFE_CHANGE, turn, currentPhase, player(self), null, details);
    }

    private void onIntermission(ArenaGameEvent.Intermission e, GameStateSnapshot snapshot) {
        gameNumber = e.gameNumber();
        ObjectNode details = json.objectNode();
        details.put("gameNumber", e.gameNumber());
        record(TelemetryActionType.SIDEBOARD_START, currentTurn, "", TelemetryAction.Player.SELF, null, details);

        awaitingResubmission = true;
        lastPlayerLife = snapshot.playerLife();
        lastOpponentLife = snapshot.opponentLife();
        currentTurn = 0;
        currentPhase = "";
        lastFlushTurn = 0;
        resetMulligan();
    }

    private void resetMulligan() {
        mulliganPromptSeen = false;
        keepRecorded = false;
        promptHand.clear();
    }

    // -------------------------------------------------------------------------
    // Flushing
    // -------------------------------------------------------------------------

    public boolean shouldFlush() {
        return currentTurn - lastFlushTurn >= config.flushIntervalTurns() && !pending.isEmpty();
    }

    /**
     * Returns and clears the actions recorded since the previous flush.
     */
    public TelemetryBatch flush() {
        TelemetryBatch batch = new TelemetryBatch(drainPending(), null);
        lastFlushTurn = currentTurn;
        return batch;
    }

    /**
     * Like {@link #flush()}, with the match summary attached.
     */
    public TelemetryBatch flushFinal() {
        List<TelemetryAction> actions = drainPending();
        MatchTelemetrySummary summary = new MatchTelemetrySummary(
                matchId,
                openingHand,
                mulliganCount,
                onPlay,
                matchStartTime,
                matchEndTime,
                gameNumber,
                result,
                lifeProgression,
                drawOrder,
                sideboardChanges,
                opponentCardsByTurn);
        log.debug("Final telemetry flush for {}: {} actions in total", matchId, flushedCount);
        return new TelemetryBatch(actions, summary);
    }

    /**
     * Actions recorded for this match, flushed or not.
     */
    public long actionCount() {
        return flushedCount + pending.size();
    }

    public int pendingCount() {
        return pending.size();
    }

    // -------------------------------------------------------------------------
    // Helpers
    // -------------------------------------------------------------------------

    private List<TelemetryAction> drainPending() {
        List<TelemetryAction> actions = new ArrayList<>(pending);
        pending.clear();
        flushedCount += actions.size();
        return actions;
    }

    private void record(TelemetryActionType type,
                        int turnNumber,
                        String phase,
                        TelemetryAction.Player player,
                        Integer grpId,
                        ObjectNode details) {
        String cardName = grpId != null ? names.nameOf(grpId).orElse(null) : null;
        pending.add(new TelemetryAction(
                matchId, gameNumber, turnNumber, phase, type, player, grpId, cardName, details, actionCounter++));
    }

    private static TelemetryAction.Player player(boolean self) {
        return self ? TelemetryAction.Player.SELF : TelemetryAction.Player.OPPONENT;
    }
}
