package com.questrail.arena.ingest.events;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * ExtractionContext
 * -----------------------------------------------------------------------------
 * Decode state carried across polls for one watcher lifetime.
 *
 * <h2>Contents</h2>
 * <ul>
 *   <li>who the local player is: seat, team, display name;</li>
 *   <li>the current match id and game number;</li>
 *   <li>the zone table ({@code zoneId -> type, owner});</li>
 *   <li>per-instance identity ({@code instanceId -> grpId},
 *       {@code instanceId -> owner seat}) and the remap chain
 *       ({@code newId -> origId});</li>
 *   <li>last-known life per seat and the last turn, phase and step, which make
 *       life and turn events edge-triggered;</li>
 *   <li>mulligan prompts still waiting for their hand;</li>
 *   <li>decode statistics.</li>
 * </ul>
 *
 * <h2>Ownership</h2>
 * Not thread-safe. A context belongs to the single thread that runs the poll
 * cycle; {@link EventExtractor} is the only writer. {@link #reset()} returns it
 * to the state of a freshly constructed context and is called on rotation,
 * truncation and restart.
 */
public final class ExtractionContext {

    public static final int DEFAULT_SEAT = 1;
    public static final int DEFAULT_LIFE = StartingLife.STANDARD;

    /** Zone table entry. */
    public record ZoneEntry(ZoneType type, int ownerSeatId) {
    }

    /** A mulligan prompt whose hand has not been revealed yet. */
    record PendingPrompt(int seatId, int mulliganCount) {
    }

    private String playerName;
    private int playerSeatId = DEFAULT_SEAT;
    private int playerTeamId = DEFAULT_SEAT;
    private String currentMatchId;
    private int gameNumber = 1;
    private int startingLife = DEFAULT_LIFE;

    private final Map<Integer, ZoneEntry> zones = new HashMap<>();
    private final Map<Integer, Integer> grpIds = new HashMap<>();
    private final Map<Integer, Integer> owners = new HashMap<>();
    private final Map<Integer, Integer> idChanges = new HashMap<>();
    private final Map<Integer, Integer> lastLife = new HashMap<>();
    private int lastTurnNumber;
    private String lastPhase = "";
    private String lastStep = "";
    private final Deque<PendingPrompt> pendingPrompts = new ArrayDeque<>();

    private final ExtractionStats stats = new ExtractionStats();

    /**
     * Clears everything, including the player's identity and statistics.
     */
    public void reset() {
        playerName = null;
        playerSeatId = DEFAULT_SEAT;
        playerTeamId = DEFAULT_SEAT;
        currentMatchId = null;
        gameNumber = 1;
        startingLife = DEFAULT_LIFE;
        resetGameState();
        stats.reset();
    }

    /**
     * Clears per-game state: zones, identities, the remap chain, life, turn
     * position and pending prompts. Instance ids are only meaningful within
     * one game.
     */
    void resetGameState() {
        zones.clear();
        grpIds.clear();
        owners.clear();
        idChanges.clear();
        lastLife.clear();
        lastTurnNumber = 0;
        lastPhase = "";
        lastStep = "";
        pendingPrompts.clear();
    }

    // -------------------------------------------------------------------------
    // Identity resolution
    // -------------------------------------------------------------------------

    /**
     * Resolves the grpId for {@code instanceId}: a direct entry if one exists,
     * otherwise the first known grpId along the remap chain. A chain that loops
     * back on itself ends the walk.
     *
     * @return the grpId, or 0 if none is known
     */
    public int resolveGrpId(int instanceId) {
        return walk(instanceId, grpIds);
    }

    /**
     * Resolves the owner seat for {@code instanceId} the same way as
     * {@link #resolveGrpId(int)}.
     *
     * @return the owner seat, or 0 if none is known
     */
    public int resolveOwner(int instanceId) {
        return walk(instanceId, owners);
    }

    private int walk(int instanceId, Map<Integer, Integer> table) {
        Set<Integer> visited = new HashSet<>();
        Integer current = instanceId;
        while (current != null && visited.add(current)) {
            Integer value = table.get(current);
            if (value != null && value != 0) {
                return value;
            }
            current = idChanges.get(current);
        }
        return 0;
    }

    // -------------------------------------------------------------------------
    // Mutators (extractor only)
    // -------------------------------------------------------------------------

    void putZone(int zoneId, ZoneType type, int ownerSeatId) {
        zones.put(zoneId, new ZoneEntry(type, ownerSeatId));
    }

    void putIdentity(int instanceId, int grpId, int ownerSeatId) {
        grpIds.put(instanceId, grpId);
        if (ownerSeatId != 0) {
            owners.put(instanceId, ownerSeatId);
        }
    }

    void forget(int instanceId) {
        grpIds.remove(instanceId);
        owners.remove(instanceId);
    }

    /**
     * Records {@code newId -> origId} and copies any identity already known for
     * {@code origId} onto {@code newId}. A self-remap is ignored.
     */
    void remap(int origId, int newId) {
        if (origId == newId) {
            return;
        }
        idChanges.put(newId, origId);
        Integer grpId = grpIds.get(origId);
        if (grpId != null && grpId != 0) {
            grpIds.put(newId, grpId);
        }
        Integer owner = owners.get(origId);
        if (owner != null && owner != 0) {
            owners.put(newId, owner);
        }
    }

    void setPlayerName(String playerName) {
        this.playerName = playerName;
    }

    void setPlayer(int seatId, int teamId) {
        this.playerSeatId = seatId;
        this.playerTeamId = teamId;
    }

    void setCurrentMatchId(String matchId) {
        this.currentMatchId = matchId;
    }

    void setGameNumber(int gameNumber) {
        this.gameNumber = gameNumber;
    }

    void setStartingLife(int startingLife) {
        this.startingLife = startingLife;
    }

    void setLastLife(int seatId, int life) {
        lastLife.put(seatId, life);
    }

    void setLastTurnNumber(int turnNumber) {
        this.lastTurnNumber = turnNumber;
    }

    void setLastPhaseAndStep(String phase, String step) {
        this.lastPhase = phase;
        this.lastStep = step;
    }

    void addPendingPrompt(int seatId, int mulliganCount) {
        pendingPrompts.push(new PendingPrompt(seatId, mulliganCount));
    }

    /**
     * Removes and returns the most recent prompt for {@code seatId} still
     * waiting for a hand.
     */
    Optional<PendingPrompt> takeLatestPendingPrompt(int seatId) {
        Iterator<PendingPrompt> it = pendingPrompts.iterator();
        while (it.hasNext()) {
            PendingPrompt prompt = it.next();
            if (prompt.seatId() == seatId) {
                it.remove();
                return Optional.of(prompt);
            }
        }
        return Optional.empty();
    }

    // -------------------------------------------------------------------------
    // Accessors
    // -------------------------------------------------------------------------

    public String playerName() {
        return playerName;
    }

    public int playerSeatId() {
        return playerSeatId;
    }

    public int playerTeamId() {
        return playerTeamId;
    }

    public String currentMatchId() {
        return currentMatchId;
    }

    public int gameNumber() {
        return gameNumber;
    }

    public Optional<ZoneEntry> zone(int zoneId) {
        return Optional.ofNullable(zones.get(zoneId));
    }

    public int knownInstanceCount() {
        return grpIds.size();
    }

    public int remapCount() {
        return idChanges.size();
    }

    /**
     * @return the last-known life for {@code seatId}, or empty before any was seen
     */
    /**
     * Life total a seat holds before any change is seen, taken from the
     * format of the current match. Survives game boundaries within a match.
     */
    public int startingLife() {
        return startingLife;
    }

    public Optional<Integer> lastLife(int seatId) {
        return Optional.ofNullable(lastLife.get(seatId));
    }

    public int lastTurnNumber() {
        return lastTurnNumber;
    }

    public String lastPhase() {
        return lastPhase;
    }

    public String lastStep() {
        return lastStep;
    }

    public int pendingPromptCount() {
        return pendingPrompts.size();
    }

    public ExtractionStats stats() {
        return stats;
    }
}
