package com.questrail.arena.ingest.events;

import com.fasterxml.jackson.databind.JsonNode;
import com.questrail.arena.ingest.block.BlockExtractor;
import com.questrail.arena.ingest.block.JsonBlock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * EventExtractor
 * =============================================================================
 * Decodes {@link JsonBlock}s into {@link ArenaGameEvent}s.
 *
 * <h2>Purity</h2>
 * Extraction is a function of (block, context): the only mutable state touched
 * is the {@link ExtractionContext} passed in. Restarting the decoder means
 * resetting the context; the extractor itself holds nothing.
 *
 * <h2>Block shapes handled</h2>
 * <ul>
 *   <li>authentication responses and {@code screenName} fields: the local
 *       player's display name;</li>
 *   <li>{@code matchGameRoomStateChangedEvent}: match start (roster) and match
 *       completion (final result);</li>
 *   <li>deck submission calls and the connect response's deck message;</li>
 *   <li>{@code greToClientEvent} messages: mulligan requests, intermissions and
 *       game-state diffs.</li>
 * </ul>
 *
 * <h2>Game-state diffs</h2>
 * Applied in this order, which decides which identities and life totals are
 * visible to later steps of the same diff:
 * <ol>
 *   <li>{@code diffDeletedInstanceIds} purge identity entries;</li>
 *   <li>zones and game objects update the zone table and identity maps;</li>
 *   <li>annotations, by type: ObjectIdChanged, Shuffle, ZoneTransfer,
 *       ModifiedLife, DamageDealt;</li>
 *   <li>turn and phase, edge-triggered;</li>
 *   <li>the players array's life totals, edge-triggered against the same
 *       last-known table the annotations update;</li>
 *   <li>the {@code game_state_update} event itself;</li>
 *   <li>mulligan hand backfill.</li>
 * </ol>
 * A card event whose grpId cannot be resolved is dropped and counted as a
 * miss; the rest of the diff is still decoded.
 */
public final class EventExtractor {
    private static final Logger log = LoggerFactory.getLogger(EventExtractor.class);

    /** Method tags that carry a deck submission. */
    public static final Set<String> DECK_SUBMISSION_METHODS =
            Set.of("EventSetDeckV2", "Event.DeckSubmitV3", "DeckSubmit", "DeckSubmitV3");

    static final String ROOM_STATE_COMPLETED = "MatchGameRoomStateType_MatchCompleted";
    static final String MATCH_SCOPE = "MatchScope_Match";
    static final String RESULT_DRAW = "ResultType_Draw";

    static final String MSG_MULLIGAN_REQ = "GREMessageType_MulliganReq";
    static final String MSG_GROUP_REQ = "GREMessageType_GroupReq";
    static final String MSG_INTERMISSION_REQ = "GREMessageType_IntermissionReq";

    static final String ANN_OBJECT_ID_CHANGED = "AnnotationType_ObjectIdChanged";
    static final String ANN_SHUFFLE = "AnnotationType_Shuffle";
    static final String ANN_ZONE_TRANSFER = "AnnotationType_ZoneTransfer";
    static final String ANN_MODIFIED_LIFE = "AnnotationType_ModifiedLife";
    static final String ANN_DAMAGE_DEALT = "AnnotationType_DamageDealt";

    static final String PHASE_BEGINNING = "Phase_Beginning";
    static final String CATEGORY_RESOLVE = "Resolve";

    /**
     * Decodes every block in order against one context.
     *
     * <p>A block whose shape trips the decoder is logged and skipped; the
     * remaining blocks are still decoded.</p>
     */
    public List<ArenaGameEvent> extractAll(List<JsonBlock> blocks, ExtractionContext ctx) {
        Objects.requireNonNull(blocks, "blocks");
        Objects.requireNonNull(ctx, "ctx");

        List<ArenaGameEvent> events = new ArrayList<>();
        for (JsonBlock block : blocks) {
            try {
                events.addAll(extract(block, ctx));
            } catch (RuntimeException e) {
                log.warn("Skipping undecodable '{}' block", block.tag(), e);
            }
        }
        return events;
    }

    /**
     * Decodes one block, updating {@code ctx}.
     */
    public List<ArenaGameEvent> extract(JsonBlock block, ExtractionContext ctx) {
        Objects.requireNonNull(block, "block");
        Objects.requireNonNull(ctx, "ctx");

        List<ArenaGameEvent> events = new ArrayList<>();
        JsonNode payload = block.payload();

        detectPlayerName(payload, ctx);

        JsonNode roomEvent = payload.get("matchGameRoomStateChangedEvent");
        if (roomEvent != null && roomEvent.isObject()) {
            decodeRoomState(roomEvent, ctx, events);
        }

        if (DECK_SUBMISSION_METHODS.contains(block.tag())) {
            decodeDeckSubmission(payload, events);
        }

        JsonNode gre = payload.get("greToClientEvent");
        if (gre != null && gre.isObject()) {
            for (JsonNode msg : JsonFields.elements(gre, "greToClientMessages")) {
                decodeGreMessage(msg, ctx, events);
            }
        }

        return events;
    }

    // -------------------------------------------------------------------------
    // Player identity and match lifecycle
    // -------------------------------------------------------------------------

    private static void detectPlayerName(JsonNode payload, ExtractionContext ctx) {
        String fromAuth = JsonFields.text(payload.get("authenticateResponse"), "screenName");
        if (fromAuth != null) {
            ctx.setPlayerName(fromAuth);
        }
        String topLevel = JsonFields.text(payload, "screenName");
        if (topLevel != null) {
            ctx.setPlayerName(topLevel);
        }
    }

    private void decodeRoomState(JsonNode roomEvent, ExtractionContext ctx, List<ArenaGameEvent> out) {
        JsonNode room = roomEvent.has("gameRoomInfo") ? roomEvent.get("gameRoomInfo") : roomEvent;
        JsonNode config = room.get("gameRoomConfig");
        String stateType = JsonFields.text(room, "stateType");
        boolean completed = ROOM_STATE_COMPLETED.equals(stateType);

        String matchId = JsonFields.text(config, "matchId");
        if (matchId != null && !completed) {
            decodeMatchStart(matchId, config, ctx, out);
        }

        JsonNode finalResult = room.get("finalMatchResult");
        if (completed && finalResult != null && ctx.currentMatchId() != null) {
            decodeMatchComplete(finalResult, ctx, out);
        }
    }

    private void decodeMatchStart(String matchId, JsonNode config, ExtractionContext ctx, List<ArenaGameEvent> out) {
        List<JsonNode> roster = new ArrayList<>();
        JsonFields.elements(config, "reservedPlayers").forEach(roster::add);

        String knownName = ctx.playerName();
        String playerName = knownName;
        String opponentName = null;
        int seatId = ExtractionContext.DEFAULT_SEAT;
        int teamId = ExtractionContext.DEFAULT_SEAT;
        String format = null;

        for (JsonNode rp : roster) {
            String rpName = JsonFields.text(rp, "playerName");
            int rpSeat = JsonFields.intValue(rp, "systemSeatId", 0);
            boolean self = knownName != null
                    ? knownName.equals(rpName)
                    : rpSeat == ExtractionContext.DEFAULT_SEAT;
            if (self) {
                playerName = rpName != null ? rpName : playerName;
                seatId = rpSeat != 0 ? rpSeat : ExtractionContext.DEFAULT_SEAT;
                teamId = JsonFields.intValue(rp, "teamId", ExtractionContext.DEFAULT_SEAT);
                format = JsonFields.text(rp, "eventId", format);
            } else {
                opponentName = rpName;
            }
        }

        // Roster without usable names: first entry is taken as the local player.
        if (playerName == null && roster.size() >= 2) {
            JsonNode rp0 = roster.get(0);
            playerName = JsonFields.text(rp0, "playerName");
            opponentName = JsonFields.text(roster.get(1), "playerName");
            seatId = JsonFields.intValue(rp0, "systemSeatId", ExtractionContext.DEFAULT_SEAT);
            teamId = JsonFields.intValue(rp0, "teamId", ExtractionContext.DEFAULT_SEAT);
            format = JsonFields.text(rp0, "eventId");
        }

        ctx.setPlayer(seatId, teamId);

        // Room state is re-announced during a match; only a new id starts one.
        if (matchId.equals(ctx.currentMatchId())) {
            return;
        }

        ctx.resetGameState();
        ctx.setCurrentMatchId(matchId);
        ctx.setGameNumber(1);
        ctx.setStartingLife(StartingLife.forFormat(format));
        log.debug("Match {} started: seat {} team {} format {}", matchId, seatId, teamId, format);
        out.add(new ArenaGameEvent.MatchStart(matchId, seatId, teamId, playerName, opponentName, format));
    }

    private void decodeMatchComplete(JsonNode finalResult, ExtractionContext ctx, List<ArenaGameEvent> out) {
        MatchResult result = MatchResult.DRAW;
        Integer winningTeamId = null;

        for (JsonNode r : JsonFields.elements(finalResult, "resultList")) {
            if (!MATCH_SCOPE.equals(JsonFields.text(r, "scope"))) {
                continue;
            }
            winningTeamId = JsonFields.intOrNull(r, "winningTeamId");
            if (RESULT_DRAW.equals(JsonFields.text(r, "result"))) {
                result = MatchResult.DRAW;
            } else if (winningTeamId != null && winningTeamId == ctx.playerTeamId()) {
                result = MatchResult.WIN;
            } else if (winningTeamId != null) {
                result = MatchResult.LOSS;
            }
            break;
        }

        log.debug("Match {} complete: {}", ctx.currentMatchId(), result);
        out.add(new ArenaGameEvent.MatchComplete(ctx.currentMatchId(), result, winningTeamId));
        ctx.setCurrentMatchId(null);
    }

    // -------------------------------------------------------------------------
    // Deck submission
    // -------------------------------------------------------------------------

    private static void decodeDeckSubmission(JsonNode payload, List<ArenaGameEvent> out) {
        JsonNode parsed = payload.get(BlockExtractor.PARSED_REQUEST_FIELD);
        JsonNode request = parsed != null && parsed.isObject() ? parsed : payload;
        JsonNode deck = JsonFields.first(request, "Deck", "deck", "CourseDeck");
        if (deck == null || !deck.isObject()) {
            deck = request;
        }

        List<DeckCard> main = DeckLists.parseEntries(JsonFields.first(deck, "MainDeck", "mainDeck"));
        List<DeckCard> sideboard = DeckLists.parseEntries(
                JsonFields.first(deck, "Sideboard", "sideboard", "SideboardCards"));
        List<Integer> commanders = DeckLists.parseIds(JsonFields.first(deck, "CommandZone", "commandZone"));

        if (!main.isEmpty()) {
            out.add(new ArenaGameEvent.DeckSubmission(main, sideboard, commanders));
        }
    }

    private static void decodeConnectDeck(JsonNode deckMessage, List<ArenaGameEvent> out) {
        List<Integer> ids = new ArrayList<>(JsonFields.ints(deckMessage.get("deckCards")));
        List<Integer> commanders = JsonFields.ints(deckMessage.get("commanderCards"));
        ids.addAll(commanders);

        List<DeckCard> main = DeckLists.countIds(ids);
        List<DeckCard> sideboard = DeckLists.countIds(JsonFields.ints(deckMessage.get("sideboardCards")));
        if (!main.isEmpty()) {
            out.add(new ArenaGameEvent.DeckSubmission(main, sideboard, commanders));
        }
    }

    // -------------------------------------------------------------------------
    // GRE messages
    // -------------------------------------------------------------------------

    private void decodeGreMessage(JsonNode msg, ExtractionContext ctx, List<ArenaGameEvent> out) {
        String msgType = JsonFields.text(msg, "type", "");

        JsonNode connect = msg.get("connectResp");
        if (connect != null && connect.isObject()) {
            JsonNode deckMessage = connect.get("deckMessage");
            if (deckMessage != null && deckMessage.isObject()) {
                decodeConnectDeck(deckMessage, out);
            }
        }

        if (MSG_MULLIGAN_REQ.equals(msgType) || MSG_GROUP_REQ.equals(msgType)) {
            JsonNode prompt = msg.get("mulliganReq");
            if (prompt != null && prompt.isObject()) {
                int seatId = JsonFields.intValue(prompt, "systemSeatId", ctx.playerSeatId());
                int count = JsonFields.intValue(prompt, "mulliganCount", 0);
                ctx.addPendingPrompt(seatId, count);
                out.add(new ArenaGameEvent.MulliganPrompt(seatId, count, List.of()));
            }
        }

        if (MSG_INTERMISSION_REQ.equals(msgType)) {
            int next = ctx.gameNumber() + 1;
            ctx.setGameNumber(next);
            ctx.resetGameState();
            out.add(new ArenaGameEvent.Intermission(next));
        }

        JsonNode gsm = msg.get("gameStateMessage");
        if (gsm != null && gsm.isObject()) {
            decodeGameState(gsm, ctx, out);
        }
    }

    private void decodeGameState(JsonNode gsm, ExtractionContext ctx, List<ArenaGameEvent> out) {
        ExtractionStats stats = ctx.stats();
        stats.gameStateMessage();

        // 1. Deleted instances
        List<Integer> deleted = JsonFields.ints(gsm.get("diffDeletedInstanceIds"));
        for (Integer id : deleted) {
            ctx.forget(id);
        }
        stats.diffDeleted(deleted.size());

        // 2. Zones and objects
        List<GameZone> zones = new ArrayList<>();
        for (JsonNode z : JsonFields.elements(gsm, "zones")) {
            int zoneId = JsonFields.intValue(z, "zoneId", 0);
            ZoneType type = ZoneType.fromWireName(JsonFields.text(z, "type"));
            int owner = JsonFields.intValue(z, "ownerSeatId", 0);
            ctx.putZone(zoneId, type, owner);
            zones.add(new GameZone(zoneId, type, owner, JsonFields.ints(z.get("objectInstanceIds"))));
        }

        List<GameObject> objects = new ArrayList<>();
        for (JsonNode go : JsonFields.elements(gsm, "gameObjects")) {
            int instanceId = JsonFields.intValue(go, "instanceId", 0);
            int grpId = JsonFields.intValue(go, "grpId", 0);
            if (instanceId == 0 || grpId == 0) {
                continue;
            }
            int owner = JsonFields.intValue(go, "ownerSeatId", 0);
            ctx.putIdentity(instanceId, grpId, owner);
            objects.add(new GameObject(
                    instanceId,
                    grpId,
                    owner,
                    JsonFields.intValue(go, "controllerSeatId", owner),
                    JsonFields.intValue(go, "zoneId", 0),
                    JsonFields.text(go, "visibility", "Visibility_Public"),
                    JsonFields.strings(go.get("cardTypes")),
                    JsonFields.strings(go.get("subtypes")),
                    nameOf(go)));
        }

        // 3. Annotations, in fixed type order
        List<Annotation> annotations = Annotation.parseAll(gsm.get("annotations"));
        for (Annotation a : annotations) {
            if (a.is(ANN_OBJECT_ID_CHANGED)) {
                applyObjectIdChanged(a, ctx);
            }
        }
        for (Annotation a : annotations) {
            if (a.is(ANN_SHUFFLE)) {
                applyShuffle(a, ctx);
            }
        }
        for (Annotation a : annotations) {
            if (a.is(ANN_ZONE_TRANSFER)) {
                decodeZoneTransfer(a, ctx, out);
            }
        }
        for (Annotation a : annotations) {
            if (a.is(ANN_MODIFIED_LIFE)) {
                decodeModifiedLife(a, ctx, out);
            }
        }
        for (Annotation a : annotations) {
            if (a.is(ANN_DAMAGE_DEALT)) {
                decodeDamage(a, ctx, out);
            }
        }

        // 4. Turn and phase
        TurnInfo turnInfo = null;
        JsonNode rawTurn = gsm.get("turnInfo");
        if (rawTurn != null && rawTurn.isObject()) {
            turnInfo = new TurnInfo(
                    JsonFields.intValue(rawTurn, "turnNumber", 0),
                    JsonFields.intValue(rawTurn, "activePlayer", 0),
                    JsonFields.text(rawTurn, "phase", ""),
                    JsonFields.text(rawTurn, "step", ""));
            decodeTurn(turnInfo, ctx, out);
        }

        // 5. Players array life totals
        List<PlayerLife> players = new ArrayList<>();
        for (JsonNode p : JsonFields.elements(gsm, "players")) {
            int seatId = JsonFields.intValue(p, "systemSeatNumber",
                    JsonFields.intValue(p, "systemSeatId", JsonFields.intValue(p, "seatId", 0)));
            Integer life = JsonFields.intOrNull(p, "lifeTotal");
            if (seatId == 0 || life == null) {
                continue;
            }
            players.add(new PlayerLife(seatId, life));
            Optional<Integer> previous = ctx.lastLife(seatId);
            if (previous.isPresent() && previous.get() != life.intValue()) {
                out.add(new ArenaGameEvent.LifeTotalChange(seatId, life, life - previous.get()));
            }
            ctx.setLastLife(seatId, life);
        }

        // 6. The diff itself
        out.add(new ArenaGameEvent.GameStateUpdate(objects, zones, turnInfo, players, deleted));

        // 7. Mulligan hand backfill
        if (turnInfo != null && PHASE_BEGINNING.equals(turnInfo.phase()) && ctx.lastTurnNumber() <= 1) {
            backfillMulliganHand(zones, ctx, out);
        }
    }

    private static String nameOf(JsonNode go) {
        JsonNode name = go.get("name");
        if (name == null || name.isNull()) {
            return null;
        }
        return name.isValueNode() ? name.asText() : null;
    }

    // -------------------------------------------------------------------------
    // Annotations
    // -------------------------------------------------------------------------

    private static void applyObjectIdChanged(Annotation a, ExtractionContext ctx) {
        Integer origId = a.firstInt("orig_id");
        Integer newId = a.firstInt("new_id");
        if (origId == null || newId == null) {
            return;
        }
        ctx.remap(origId, newId);
        ctx.stats().objectIdChange();
    }

    private static void applyShuffle(Annotation a, ExtractionContext ctx) {
        List<Integer> oldIds = a.ints("OldIds");
        List<Integer> newIds = a.ints("NewIds");
        if (oldIds.size() != newIds.size()) {
            log.debug("Ignoring shuffle annotation {} with {} old and {} new ids", a.id(), oldIds.size(), newIds.size());
            return;
        }
        for (int i = 0; i < oldIds.size(); i++) {
            ctx.remap(oldIds.get(i), newIds.get(i));
        }
        ctx.stats().shuffleRemaps(oldIds.size());
    }

    private static void decodeZoneTransfer(Annotation a, ExtractionContext ctx, List<ArenaGameEvent> out) {
        if (a.affectedIds().isEmpty()) {
            return;
        }
        ExtractionStats stats = ctx.stats();
        stats.zoneTransfer();

        int instanceId = a.affectedIds().get(0);
        int fromZoneId = a.firstIntOr("zone_src", 0);
        int toZoneId = a.firstIntOr("zone_dest", 0);
        String category = a.firstString("category");

        int grpId = ctx.resolveGrpId(instanceId);
        if (grpId == 0) {
            stats.grpIdMiss();
            log.trace("Dropping zone transfer of unresolved instance {}", instanceId);
            return;
        }
        stats.grpIdHit();

        Optional<ExtractionContext.ZoneEntry> from = ctx.zone(fromZoneId);
        Optional<ExtractionContext.ZoneEntry> to = ctx.zone(toZoneId);
        ZoneType fromType = from.map(ExtractionContext.ZoneEntry::type).orElse(ZoneType.UNKNOWN);
        ZoneType toType = to.map(ExtractionContext.ZoneEntry::type).orElse(ZoneType.UNKNOWN);

        int owner = ctx.resolveOwner(instanceId);
        if (owner == 0) {
            owner = from.map(ExtractionContext.ZoneEntry::ownerSeatId)
                    .filter(seat -> seat != 0)
                    .orElse(to.map(ExtractionContext.ZoneEntry::ownerSeatId).orElse(0));
        }

        out.add(new ArenaGameEvent.ZoneChange(grpId, instanceId, owner, fromZoneId, toZoneId, fromType, toType, category));

        if (fromType == ZoneType.LIBRARY && toType == ZoneType.HAND) {
            out.add(new ArenaGameEvent.CardDrawn(grpId, instanceId, owner));
        }

        boolean fromHandOrLibrary = fromType == ZoneType.HAND || fromType == ZoneType.LIBRARY;
        boolean toBattlefieldOrStack = toType == ZoneType.BATTLEFIELD || toType == ZoneType.STACK;
        boolean resolved = fromType == ZoneType.STACK && toType == ZoneType.BATTLEFIELD
                && CATEGORY_RESOLVE.equals(category);
        if ((fromHandOrLibrary && toBattlefieldOrStack) || resolved) {
            out.add(new ArenaGameEvent.CardPlayed(grpId, instanceId, owner, fromType, toType));
        }
    }

    private static void decodeModifiedLife(Annotation a, ExtractionContext ctx, List<ArenaGameEvent> out) {
        Integer delta = a.firstInt("life");
        if (delta == null || delta == 0) {
            return;
        }
        for (Integer seatId : a.affectedIds()) {
            int before = ctx.lastLife(seatId).orElse(ctx.startingLife());
            int after = before + delta;
            ctx.setLastLife(seatId, after);
            out.add(new ArenaGameEvent.LifeTotalChange(seatId, after, delta));
        }
    }

    private static void decodeDamage(Annotation a, ExtractionContext ctx, List<ArenaGameEvent> out) {
        Integer amount = a.firstInt("damage_amount");
        if (amount == null || amount <= 0 || a.affectedIds().isEmpty()) {
            return;
        }
        ExtractionStats stats = ctx.stats();

        int sourceGrpId = ctx.resolveGrpId(a.affectorId());
        if (sourceGrpId == 0) {
            stats.grpIdMiss();
            return;
        }
        stats.grpIdHit();

        int target = a.affectedIds().get(0);
        int targetGrpId = ctx.resolveGrpId(target);
        if (targetGrpId != 0) {
            out.add(new ArenaGameEvent.DamageDealt(sourceGrpId, null, targetGrpId, amount));
        } else {
            out.add(new ArenaGameEvent.DamageDealt(sourceGrpId, target, null, amount));
        }
    }

    // -------------------------------------------------------------------------
    // Turn position and mulligans
    // -------------------------------------------------------------------------

    private static void decodeTurn(TurnInfo turnInfo, ExtractionContext ctx, List<ArenaGameEvent> out) {
        int turnNumber = turnInfo.turnNumber();
        if (turnNumber > 0 && turnNumber != ctx.lastTurnNumber()) {
            ctx.setLastTurnNumber(turnNumber);
            out.add(new ArenaGameEvent.TurnChange(turnNumber, turnInfo.activePlayer()));
        }

        String phase = turnInfo.phase();
        String step = turnInfo.step();
        if (!phase.isEmpty() && (!phase.equals(ctx.lastPhase()) || !step.equals(ctx.lastStep()))) {
            ctx.setLastPhaseAndStep(phase, step);
            out.add(new ArenaGameEvent.PhaseChange(phase, step, ctx.lastTurnNumber()));
        }
    }

    private static void backfillMulliganHand(List<GameZone> zones, ExtractionContext ctx, List<ArenaGameEvent> out) {
        int seat = ctx.playerSeatId();
        for (GameZone zone : zones) {
            if (zone.type() != ZoneType.HAND || zone.ownerSeatId() != seat || zone.objectInstanceIds().isEmpty()) {
                continue;
            }
            List<Integer> hand = new ArrayList<>();
            for (Integer instanceId : zone.objectInstanceIds()) {
                int grpId = ctx.resolveGrpId(instanceId);
                if (grpId != 0) {
                    hand.add(grpId);
                }
            }
            if (hand.isEmpty()) {
                continue;
            }
            ctx.takeLatestPendingPrompt(seat).ifPresent(prompt ->
                    out.add(new ArenaGameEvent.MulliganPrompt(prompt.seatId(), prompt.mulliganCount(), hand)));
        }
    }
}
