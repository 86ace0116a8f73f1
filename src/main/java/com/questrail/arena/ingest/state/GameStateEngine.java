package com.questrail.arena.ingest.state;

import com.questrail.arena.ingest.events.ArenaGameEvent;
import com.questrail.arena.ingest.events.GameObject;
import com.questrail.arena.ingest.events.GameZone;
import com.questrail.arena.ingest.events.StartingLife;
import com.questrail.arena.ingest.events.TurnInfo;
import com.questrail.arena.ingest.events.ZoneType;
import com.questrail.arena.ingest.internal.time.Cancellable;
import com.questrail.arena.ingest.internal.time.SystemWallClock;
import com.questrail.arena.ingest.internal.time.WallClock;
import com.questrail.arena.ingest.observability.IngestObservabilitySink;
import com.questrail.arena.ingest.observability.ListenerFailureEvent;
import com.questrail.arena.ingest.observability.NullIngestObservabilitySink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * GameStateEngine
 * -----------------------------------------------------------------------------
 * Folds the ordered {@link ArenaGameEvent} stream into a live
 * {@link GameStateSnapshot} and notifies subscribers after every event.
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   idle --match_start--> active --intermission--> sideboarding
 *                           ^                           |
 *                           +------- next turn ---------+
 *   active | sideboarding --match_complete--> inactive
 * </pre>
 * {@code match_start} discards everything, including the instance tables,
 * and sets both life totals from the format. {@code intermission} clears
 * per-game state, restores every deck entry to its full quantity and
 * resets life.
 *
 * <h2>Deck tracking</h2>
 * A deck entry's {@code remaining} drops by one when the local player draws
 * the card, or when one of their cards leaves the library for anywhere but
 * the hand. It never goes below zero; a card not in the submitted deck
 * changes nothing. {@code librarySize} is always the sum of
 * {@code remaining}.
 *
 * <h2>Zone contents</h2>
 * The engine keeps its own {@code instanceId -> zoneId / grpId / owner}
 * tables and rebuilds every zone list from them after each diff and zone
 * change. A missed intermediate diff is repaired by the next one.
 *
 * <h2>Threading</h2>
 * Not thread-safe; driven from the single poll thread. {@link #snapshot()}
 * and subscription may be called from any thread, and a listener may
 * unsubscribe during dispatch.
 */
public final class GameStateEngine {
    private static final Logger log = LoggerFactory.getLogger(GameStateEngine.class);

    static final String LISTENER_CHANNEL = "game-state";

    private final IngestObservabilitySink sink;
    private final WallClock wallClock;
    private final List<GameStateListener> listeners = new CopyOnWriteArrayList<>();

    // Match identity
    private String matchId;
    private int gameNumber = 1;
    private int playerSeatId = 1;
    private String playerName;
    private String opponentName;
    private String format;
    private boolean active;
    private boolean sideboarding;

    // Deck
    private final List<DeckCardEntry> deckList = new ArrayList<>();
    private final List<DeckCardEntry> sideboardList = new ArrayList<>();
    private final List<Integer> commanderGrpIds = new ArrayList<>();
    private final Map<Integer, String> cardNames = new HashMap<>();

    // Per-game position
    private int playerLife = StartingLife.STANDARD;
    private int opponentLife = StartingLife.STANDARD;
    private int turnNumber;
    private String phase = "";
    private String step = "";
    private int activePlayer;
    private int mulliganCount;
    private final List<Integer> openingHand = new ArrayList<>();
    private final List<Integer> cardsDrawn = new ArrayList<>();
    private final Set<Integer> opponentCardsSeen = new LinkedHashSet<>();

    // Zone contents, rebuilt from the instance tables
    private List<Integer> hand = List.of();
    private List<Integer> battlefield = List.of();
    private List<Integer> graveyard = List.of();
    private List<Integer> exile = List.of();
    private List<Integer> opponentBattlefield = List.of();
    private List<Integer> opponentGraveyard = List.of();

    // Instance tables
    private final Map<Integer, GameZone> zones = new HashMap<>();
    private final Map<Integer, Integer> objectZones = new TreeMap<>();
    private final Map<Integer, Integer> objectGrpIds = new HashMap<>();
    private final Map<Integer, Integer> objectOwners = new HashMap<>();
    private final Map<Integer, String> objectNames = new HashMap<>();

    private volatile GameStateSnapshot current;

    public GameStateEngine() {
        this(NullIngestObservabilitySink.INSTANCE, SystemWallClock.INSTANCE);
    }

    public GameStateEngine(IngestObservabilitySink sink, WallClock wallClock) {
        this.sink = Objects.requireNonNull(sink, "sink");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.current = buildSnapshot();
    }

    // -------------------------------------------------------------------------
    // Public API
    // -------------------------------------------------------------------------

    /**
     * Applies one event, then dispatches the resulting snapshot to every
     * current subscriber.
     */
    public void process(ArenaGameEvent event) {
        Objects.requireNonNull(event, "event");
        apply(event);
        current = buildSnapshot();
        dispatch(current);
    }

    public void processAll(List<ArenaGameEvent> events) {
        Objects.requireNonNull(events, "events");
        for (ArenaGameEvent event : events) {
            process(event);
        }
    }

    /**
     * @return the snapshot as of the last processed event
     */
    public GameStateSnapshot snapshot() {
        return current;
    }

    /**
     * Dispatches the current snapshot without applying an event, e.g. after
     * card names were attached with {@link #resolveCard}.
     */
    public void publish() {
        dispatch(current);
    }

    /**
     * Registers {@code listener} for every subsequent snapshot.
     *
     * @return handle that removes the listener
     */
    public Cancellable subscribe(GameStateListener listener) {
        Objects.requireNonNull(listener, "listener");
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    /**
     * Attaches a display name to deck and sideboard entries for {@code grpId}.
     * The first name recorded for a card wins; later calls for the same card
     * are ignored.
     *
     * @return {@code true} if the name was recorded
     */
    public boolean resolveCard(int grpId, String name) {
        if (name == null || name.isBlank() || cardNames.containsKey(grpId)) {
            return false;
        }
        cardNames.put(grpId, name);
        applyName(deckList, grpId, name);
        applyName(sideboardList, grpId, name);
        current = buildSnapshot();
        return true;
    }

    /**
     * Names seen inline on game objects, keyed by grpId. Only readable names
     * are kept; numeric localization ids are skipped.
     */
    public Map<Integer, String> objectNames() {
        return Collections.unmodifiableMap(new HashMap<>(objectNames));
    }

    /**
     * Returns the engine to its idle state. Subscribers stay registered and
     * are not notified.
     */
    public void reset() {
        matchId = null;
        gameNumber = 1;
        playerSeatId = 1;
        playerName = null;
        opponentName = null;
        format = null;
        active = false;
        sideboarding = false;
        deckList.clear();
        sideboardList.clear();
        commanderGrpIds.clear();
        cardNames.clear();
        objectNames.clear();
        opponentCardsSeen.clear();
        resetGame(StartingLife.STANDARD);
        current = buildSnapshot();
    }

    // -------------------------------------------------------------------------
    // Event handlers
    // -------------------------------------------------------------------------

    private void apply(ArenaGameEvent event) {
        if (event instanceof ArenaGameEvent.MatchStart e) {
            onMatchStart(e);
        } else if (event instanceof ArenaGameEvent.DeckSubmission e) {
            onDeckSubmission(e);
        } else if (event instanceof ArenaGameEvent.GameStateUpdate e) {
            onGameStateUpdate(e);
        } else if (event instanceof ArenaGameEvent.MulliganPrompt e) {
            onMulliganPrompt(e);
        } else if (event instanceof ArenaGameEvent.CardDrawn e) {
            onCardDrawn(e);
        } else if (event instanceof ArenaGameEvent.CardPlayed e) {
            onCardPlayed(e);
        } else if (event instanceof ArenaGameEvent.ZoneChange e) {
            onZoneChange(e);
        } else if (event instanceof ArenaGameEvent.LifeTotalChange e) {
            onLifeChange(e);
        } else if (event instanceof ArenaGameEvent.TurnChange e) {
            onTurnChange(e);
        } else if (event instanceof ArenaGameEvent.PhaseChange e) {
            onPhaseChange(e);
        } else if (event instanceof ArenaGameEvent.Intermission e) {
            onIntermission(e);
        } else if (event instanceof ArenaGameEvent.MatchComplete e) {
            onMatchComplete(e);
        }
        // DamageDealt is informational; life moves through LifeTotalChange.
    }

    private void onMatchStart(ArenaGameEvent.MatchStart e) {
        reset();
        matchId = e.matchId();
        playerSeatId = e.playerSeatId();
        playerName = e.playerName();
        opponentName = e.opponentName();
        format = e.format();
        active = true;
        int life = StartingLife.forFormat(format);
        playerLife = life;
        opponentLife = life;
        log.debug("Tracking match {} as seat {} ({} life)", matchId, playerSeatId, life);
    }

    private void onDeckSubmission(ArenaGameEvent.DeckSubmission e) {
        deckList.clear();
        e.mainDeck().forEach(c -> deckList.add(named(DeckCardEntry.full(c.grpId(), c.quantity()))));
        sideboardList.clear();
        e.sideboard().forEach(c -> sideboardList.add(named(DeckCardEntry.full(c.grpId(), c.quantity()))));
        commanderGrpIds.clear();
        commanderGrpIds.addAll(e.commanderGrpIds());
    }

    private void onGameStateUpdate(ArenaGameEvent.GameStateUpdate e) {
        for (Integer id : e.deletedInstanceIds()) {
            objectZones.remove(id);
            objectGrpIds.remove(id);
            objectOwners.remove(id);
        }

        for (GameZone zone : e.zones()) {
            zones.put(zone.zoneId(), zone);
            for (Integer id : zone.objectInstanceIds()) {
                objectZones.put(id, zone.zoneId());
            }
        }

        for (GameObject go : e.objects()) {
            objectGrpIds.put(go.instanceId(), go.grpId());
            if (go.ownerSeatId() != 0) {
                objectOwners.put(go.instanceId(), go.ownerSeatId());
            }
            if (go.zoneId() != 0) {
                objectZones.put(go.instanceId(), go.zoneId());
            }
            if (go.hasReadableName()) {
                objectNames.put(go.grpId(), go.name());
            }
        }

        rebuildZoneContents();

        if (openingHand.isEmpty() && turnNumber <= 1 && !hand.isEmpty()) {
            openingHand.addAll(hand);
        }

        TurnInfo turnInfo = e.turnInfo();
        if (turnInfo != null) {
            if (turnInfo.turnNumber() > 0) {
                turnNumber = turnInfo.turnNumber();
            }
            activePlayer = turnInfo.activePlayer();
            if (!turnInfo.phase().isEmpty()) {
                phase = turnInfo.phase();
            }
            if (!turnInfo.step().isEmpty()) {
                step = turnInfo.step();
            }
        }
        // Life is left to LifeTotalChange: the players array can lag behind
        // annotation-driven totals.
    }

    private void onMulliganPrompt(ArenaGameEvent.MulliganPrompt e) {
        if (e.seatId() != playerSeatId) {
            return;
        }
        mulliganCount = e.mulliganCount();
        if (e.hasHand()) {
            openingHand.clear();
            openingHand.addAll(e.hand());
        }
    }

    private void onCardDrawn(ArenaGameEvent.CardDrawn e) {
        if (e.ownerSeatId() != playerSeatId) {
            return;
        }
        cardsDrawn.add(e.grpId());
        decrementDeckCard(e.grpId());
    }

    private void onCardPlayed(ArenaGameEvent.CardPlayed e) {
        if (e.ownerSeatId() != playerSeatId) {
            opponentCardsSeen.add(e.grpId());
        }
    }

    private void onZoneChange(ArenaGameEvent.ZoneChange e) {
        objectZones.put(e.instanceId(), e.toZoneId());
        objectGrpIds.put(e.instanceId(), e.grpId());
        if (e.ownerSeatId() != 0) {
            objectOwners.put(e.instanceId(), e.ownerSeatId());
        }

        // Draws are counted by CardDrawn; this covers tutors, mills and ramp.
        if (e.ownerSeatId() == playerSeatId
                && e.fromZone() == ZoneType.LIBRARY
                && e.toZone() != ZoneType.HAND) {
            decrementDeckCard(e.grpId());
        }

        rebuildZoneContents();
    }

    private void onLifeChange(ArenaGameEvent.LifeTotalChange e) {
        if (e.seatId() == playerSeatId) {
            playerLife = e.lifeTotal();
        } else {
            opponentLife = e.lifeTotal();
        }
    }

    private void onTurnChange(ArenaGameEvent.TurnChange e) {
        turnNumber = e.turnNumber();
        activePlayer = e.activePlayer();
        sideboarding = false;
    }

    private void onPhaseChange(ArenaGameEvent.PhaseChange e) {
        phase = e.phase();
        step = e.step();
        if (e.turnNumber() > 0) {
            turnNumber = e.turnNumber();
        }
    }

    private void onIntermission(ArenaGameEvent.Intermission e) {
        sideboarding = true;
        gameNumber = e.gameNumber();
        deckList.replaceAll(entry -> entry.withRemaining(entry.quantity()));
        resetGame(StartingLife.forFormat(format));
    }

    private void onMatchComplete(ArenaGameEvent.MatchComplete e) {
        active = false;
        sideboarding = false;
        log.debug("Match {} finished: {}", e.matchId(), e.result());
    }

    // -------------------------------------------------------------------------
    // Helpers
    // -------------------------------------------------------------------------

    private void resetGame(int startingLife) {
        playerLife = startingLife;
        opponentLife = startingLife;
        turnNumber = 0;
        phase = "";
        step = "";
        activePlayer = 0;
        mulliganCount = 0;
        openingHand.clear();
        cardsDrawn.clear();
        zones.clear();
        objectZones.clear();
        objectGrpIds.clear();
        objectOwners.clear();
        hand = List.of();
        battlefield = List.of();
        graveyard = List.of();
        exile = List.of();
        opponentBattlefield = List.of();
        opponentGraveyard = List.of();
    }

    private void decrementDeckCard(int grpId) {
        for (int i = 0; i < deckList.size(); i++) {
            DeckCardEntry entry = deckList.get(i);
            if (entry.grpId() == grpId && entry.remaining() > 0) {
                deckList.set(i, entry.withRemaining(entry.remaining() - 1));
                return;
            }
        }
    }

    private DeckCardEntry named(DeckCardEntry entry) {
        String name = cardNames.get(entry.grpId());
        return name != null ? entry.withName(name) : entry;
    }

    private static void applyName(List<DeckCardEntry> entries, int grpId, String name) {
        for (int i = 0; i < entries.size(); i++) {
            DeckCardEntry entry = entries.get(i);
            if (entry.grpId() == grpId && !entry.isResolved()) {
                entries.set(i, entry.withName(name));
            }
        }
    }

    private void rebuildZoneContents() {
        List<Integer> ownHand = new ArrayList<>();
        List<Integer> ownBattlefield = new ArrayList<>();
        List<Integer> ownGraveyard = new ArrayList<>();
        List<Integer> ownExile = new ArrayList<>();
        List<Integer> oppBattlefield = new ArrayList<>();
        List<Integer> oppGraveyard = new ArrayList<>();

        for (Map.Entry<Integer, Integer> placement : objectZones.entrySet()) {
            int instanceId = placement.getKey();
            GameZone zone = zones.get(placement.getValue());
            Integer grpId = objectGrpIds.get(instanceId);
            if (zone == null || grpId == null) {
                continue;
            }
            int owner = objectOwners.getOrDefault(instanceId, zone.ownerSeatId());

            if (owner == playerSeatId) {
                switch (zone.type()) {
                    case HAND -> ownHand.add(grpId);
                    case BATTLEFIELD -> ownBattlefield.add(grpId);
                    case GRAVEYARD -> ownGraveyard.add(grpId);
                    case EXILE -> ownExile.add(grpId);
                    default -> {
                    }
                }
            } else if (owner != 0) {
                if (zone.type() == ZoneType.BATTLEFIELD) {
                    oppBattlefield.add(grpId);
                    opponentCardsSeen.add(grpId);
                } else if (zone.type() == ZoneType.GRAVEYARD) {
                    oppGraveyard.add(grpId);
                    opponentCardsSeen.add(grpId);
                }
            }
        }

        hand = ownHand;
        battlefield = ownBattlefield;
        graveyard = ownGraveyard;
        exile = ownExile;
        opponentBattlefield = oppBattlefield;
        opponentGraveyard = oppGraveyard;
    }

    private int librarySize() {
        int size = 0;
        for (DeckCardEntry entry : deckList) {
            size += entry.remaining();
        }
        return size;
    }

    private Map<Integer, Double> drawProbabilities(int librarySize) {
        Map<Integer, Double> probabilities = new LinkedHashMap<>();
        if (librarySize <= 0) {
            return probabilities;
        }
        for (DeckCardEntry entry : deckList) {
            if (entry.remaining() > 0) {
                probabilities.merge(entry.grpId(), (double) entry.remaining() / librarySize, Double::sum);
            }
        }
        return probabilities;
    }

    private GameStateSnapshot buildSnapshot() {
        int librarySize = librarySize();
        return new GameStateSnapshot(
                matchId,
                gameNumber,
                playerSeatId,
                playerSeatId == 1 ? 2 : 1,
                playerName,
                opponentName,
                format,
                deckList,
                sideboardList,
                commanderGrpIds,
                librarySize,
                hand,
                battlefield,
                graveyard,
                exile,
                opponentBattlefield,
                opponentGraveyard,
                playerLife,
                opponentLife,
                turnNumber,
                phase,
                step,
                activePlayer,
                new ArrayList<>(opponentCardsSeen),
                cardsDrawn,
                mulliganCount,
                openingHand,
                active,
                sideboarding,
                drawProbabilities(librarySize));
    }

    private void dispatch(GameStateSnapshot snapshot) {
        for (GameStateListener listener : listeners) {
            try {
                listener.onStateChange(snapshot);
            } catch (RuntimeException e) {
                sink.onListenerFailure(new ListenerFailureEvent(wallClock.now(), LISTENER_CHANNEL, listener, e));
            }
        }
    }
}
