package com.questrail.arena.ingest.events;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.arena.ingest.fixtures.ArenaLogFixtures.Gsm;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static com.questrail.arena.ingest.fixtures.ArenaLogFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class EventExtractorTest {

    private static final String LIBRARY = "ZoneType_Library";
    private static final String HAND = "ZoneType_Hand";
    private static final String BATTLEFIELD = "ZoneType_Battlefield";
    private static final String STACK = "ZoneType_Stack";

    private EventExtractor extractor;
    private ExtractionContext ctx;

    @BeforeEach
    void setUp() {
        extractor = new EventExtractor();
        ctx = new ExtractionContext();
    }

    private List<ArenaGameEvent> feed(ObjectNode payload) {
        return extractor.extract(standalone(payload), ctx);
    }

    private static <T> List<T> ofType(List<ArenaGameEvent> events, Class<T> type) {
        return events.stream().filter(type::isInstance).map(type::cast).collect(Collectors.toList());
    }

    private static List<String> types(List<ArenaGameEvent> events) {
        return events.stream().map(ArenaGameEvent::type).collect(Collectors.toList());
    }

    /** Seat 1 zones: library 32, hand 31, stack 27, battlefield 28. */
    private Gsm seatOneZones() {
        return gsm()
                .zone(32, LIBRARY, 1)
                .zone(31, HAND, 1)
                .zone(27, STACK, 0)
                .zone(28, BATTLEFIELD, 0);
    }

    // -------------------------------------------------------------------------
    // Match lifecycle
    // -------------------------------------------------------------------------

    @Test
    void matchStartIdentifiesLocalPlayerByScreenName() {
        feed(authenticate("Alice#12345"));
        List<ArenaGameEvent> events = feed(matchStart("m-1", "Alice#12345", 2, 2, "Bob#999", "Brawl_Event"));

        ArenaGameEvent.MatchStart start = ofType(events, ArenaGameEvent.MatchStart.class).get(0);
        assertEquals("m-1", start.matchId());
        assertEquals(2, start.playerSeatId());
        assertEquals(2, start.playerTeamId());
        assertEquals("Alice#12345", start.playerName());
        assertEquals("Bob#999", start.opponentName());
        assertEquals("Brawl_Event", start.format());
        assertEquals(2, ctx.playerSeatId());
        assertEquals("m-1", ctx.currentMatchId());
    }

    @Test
    void matchStartWithoutKnownNameAssumesSeatOne() {
        ArenaGameEvent.MatchStart start = ofType(
                feed(matchStart("m-1", "Alice", 1, 1, "Bob", "Ladder")), ArenaGameEvent.MatchStart.class).get(0);

        assertEquals(1, start.playerSeatId());
        assertEquals("Alice", start.playerName());
        assertEquals("Bob", start.opponentName());
    }

    @Test
    void reannouncedRoomStateDoesNotRestartMatch() {
        feed(matchStart("m-1", "Alice", 1, 1, "Bob", "Ladder"));
        List<ArenaGameEvent> again = feed(matchStart("m-1", "Alice", 1, 1, "Bob", "Ladder"));

        assertTrue(ofType(again, ArenaGameEvent.MatchStart.class).isEmpty());
    }

    @Test
    void matchCompleteResolvesResultFromWinningTeam() {
        feed(matchStart("m-1", "Alice", 1, 1, "Bob", "Ladder"));
        ArenaGameEvent.MatchComplete win = ofType(feed(matchComplete("m-1", 1)), ArenaGameEvent.MatchComplete.class).get(0);
        assertEquals(MatchResult.WIN, win.result());
        assertEquals("m-1", win.matchId());
        assertNull(ctx.currentMatchId());

        feed(matchStart("m-2", "Alice", 1, 1, "Bob", "Ladder"));
        assertEquals(MatchResult.LOSS,
                ofType(feed(matchComplete("m-2", 2)), ArenaGameEvent.MatchComplete.class).get(0).result());

        feed(matchStart("m-3", "Alice", 1, 1, "Bob", "Ladder"));
        assertEquals(MatchResult.DRAW,
                ofType(feed(matchDraw("m-3")), ArenaGameEvent.MatchComplete.class).get(0).result());
    }

    @Test
    void completionWithoutCurrentMatchIsIgnored() {
        assertTrue(feed(matchComplete("m-unknown", 1)).isEmpty());
    }

    // -------------------------------------------------------------------------
    // Decks
    // -------------------------------------------------------------------------

    @Test
    void deckSubmissionFromRequestPayload() {
        ObjectNode payload = deck(new int[][]{{111, 4}, {222, 2}}, new int[][]{{333, 1}});

        List<ArenaGameEvent> events = extractor.extract(request("EventSetDeckV2", payload), ctx);

        ArenaGameEvent.DeckSubmission submission = ofType(events, ArenaGameEvent.DeckSubmission.class).get(0);
        assertEquals(List.of(new DeckCard(111, 4), new DeckCard(222, 2)), submission.mainDeck());
        assertEquals(List.of(new DeckCard(333, 1)), submission.sideboard());
    }

    @Test
    void deckSubmissionPrefersParsedRequest() {
        ObjectNode payload = JsonNodeFactory.instance.objectNode();
        payload.put("request", "ignored");
        payload.set("_parsed_request", deck(new int[][]{{444, 3}}, new int[0][]));

        List<ArenaGameEvent> events = extractor.extract(request("Event.DeckSubmitV3", payload), ctx);

        assertEquals(List.of(new DeckCard(444, 3)),
                ofType(events, ArenaGameEvent.DeckSubmission.class).get(0).mainDeck());
    }

    @Test
    void emptyMainDeckEmitsNothing() {
        List<ArenaGameEvent> events = extractor.extract(
                request("EventSetDeckV2", deck(new int[0][], new int[][]{{1, 1}})), ctx);
        assertTrue(events.isEmpty());
    }

    @Test
    void connectResponseDeckCountsDuplicateIds() {
        ObjectNode msg = JsonNodeFactory.instance.objectNode();
        msg.put("type", "GREMessageType_ConnectResp");
        ObjectNode deckMessage = msg.putObject("connectResp").putObject("deckMessage");
        deckMessage.putArray("deckCards").add(5).add(5).add(6);
        deckMessage.putArray("commanderCards").add(9);

        ArenaGameEvent.DeckSubmission submission =
                ofType(feed(gre(msg)), ArenaGameEvent.DeckSubmission.class).get(0);

        assertEquals(List.of(new DeckCard(5, 2), new DeckCard(6, 1), new DeckCard(9, 1)), submission.mainDeck());
        assertEquals(List.of(9), submission.commanderGrpIds());
    }

    // -------------------------------------------------------------------------
    // Zone transfers and identity
    // -------------------------------------------------------------------------

    @Test
    void drawFromLibraryEmitsZoneChangeThenCardDrawn() {
        feed(gre(seatOneZones().object(100, 555, 1, 32).message()));

        List<ArenaGameEvent> events = feed(gre(gsm().zoneTransfer(100, 32, 31, "Draw").message()));

        assertEquals(List.of("zone_change", "card_drawn", "game_state_update"), types(events));
        ArenaGameEvent.CardDrawn drawn = ofType(events, ArenaGameEvent.CardDrawn.class).get(0);
        assertEquals(555, drawn.grpId());
        assertEquals(1, drawn.ownerSeatId());
        ArenaGameEvent.ZoneChange change = ofType(events, ArenaGameEvent.ZoneChange.class).get(0);
        assertEquals(ZoneType.LIBRARY, change.fromZone());
        assertEquals(ZoneType.HAND, change.toZone());
        assertEquals("Draw", change.category());
    }

    @Test
    void playingLandFromHandEmitsCardPlayed() {
        feed(gre(seatOneZones().object(100, 555, 1, 31).message()));

        List<ArenaGameEvent> events = feed(gre(gsm().zoneTransfer(100, 31, 28, "PlayLand").message()));

        ArenaGameEvent.CardPlayed played = ofType(events, ArenaGameEvent.CardPlayed.class).get(0);
        assertEquals(555, played.grpId());
        assertEquals(ZoneType.HAND, played.fromZone());
        assertEquals(ZoneType.BATTLEFIELD, played.toZone());
    }

    @Test
    void spellResolvingFromStackCountsAsPlayed() {
        feed(gre(seatOneZones().object(100, 555, 1, 27).message()));

        List<ArenaGameEvent> events = feed(gre(gsm().zoneTransfer(100, 27, 28, "Resolve").message()));

        assertEquals(1, ofType(events, ArenaGameEvent.CardPlayed.class).size());
    }

    @Test
    void unresolvedInstanceIsDroppedAndCountedAsMiss() {
        feed(gre(seatOneZones().message()));

        List<ArenaGameEvent> events = feed(gre(gsm().zoneTransfer(999, 32, 31, "Draw").message()));

        assertTrue(ofType(events, ArenaGameEvent.ZoneChange.class).isEmpty());
        assertEquals(1, ctx.stats().snapshot().grpIdMisses());
        assertEquals(1, ofType(events, ArenaGameEvent.GameStateUpdate.class).size());
    }

    @Test
    void objectIdChangeCarriesIdentityToNewInstance() {
        feed(gre(seatOneZones().object(100, 555, 1, 31).message()));

        List<ArenaGameEvent> events = feed(gre(gsm()
                .objectIdChanged(100, 200)
                .zoneTransfer(200, 31, 27, "CastSpell")
                .message()));

        ArenaGameEvent.CardPlayed played = ofType(events, ArenaGameEvent.CardPlayed.class).get(0);
        assertEquals(555, played.grpId());
        assertEquals(200, played.instanceId());
        assertEquals(1, played.ownerSeatId());
    }

    @Test
    void shuffleRemapsLibraryInstances() {
        feed(gre(seatOneZones().object(10, 7, 1, 32).object(11, 8, 1, 32).message()));

        List<ArenaGameEvent> events = feed(gre(gsm()
                .shuffle(new int[]{10, 11}, new int[]{20, 21})
                .zoneTransfer(21, 32, 31, "Draw")
                .message()));

        assertEquals(8, ofType(events, ArenaGameEvent.CardDrawn.class).get(0).grpId());
        assertEquals(2, ctx.stats().snapshot().shuffleRemaps());
    }

    @Test
    void remapCycleTerminatesUnresolved() {
        feed(gre(seatOneZones().message()));

        List<ArenaGameEvent> events = feed(gre(gsm()
                .objectIdChanged(300, 301)
                .objectIdChanged(301, 300)
                .zoneTransfer(300, 32, 31, "Draw")
                .message()));

        assertTrue(ofType(events, ArenaGameEvent.CardDrawn.class).isEmpty());
        assertEquals(0, ctx.resolveGrpId(300));
        assertEquals(0, ctx.resolveGrpId(301));
    }

    @Test
    void deletedInstancesAreForgotten() {
        feed(gre(seatOneZones().object(50, 555, 1, 31).message()));

        List<ArenaGameEvent> events = feed(gre(gsm()
                .deleted(50)
                .zoneTransfer(50, 31, 28, "PlayLand")
                .message()));

        assertTrue(ofType(events, ArenaGameEvent.CardPlayed.class).isEmpty());
        assertEquals(List.of(50), ofType(events, ArenaGameEvent.GameStateUpdate.class).get(0).deletedInstanceIds());
        assertEquals(1, ctx.stats().snapshot().diffDeleted());
    }

    @Test
    void ownerFallsBackToSourceZoneOwner() {
        feed(gre(gsm().zone(36, LIBRARY, 2).zone(35, HAND, 2).object(400, 42, 0, 36).message()));

        List<ArenaGameEvent> events = feed(gre(gsm().zoneTransfer(400, 36, 35, "Draw").message()));

        assertEquals(2, ofType(events, ArenaGameEvent.CardDrawn.class).get(0).ownerSeatId());
    }

    @Test
    void damageToPlayerTargetsSeat() {
        feed(gre(seatOneZones().object(100, 555, 1, 28).message()));

        List<ArenaGameEvent> events = feed(gre(gsm().damage(100, 2, 3).message()));

        ArenaGameEvent.DamageDealt damage = ofType(events, ArenaGameEvent.DamageDealt.class).get(0);
        assertEquals(555, damage.sourceGrpId());
        assertEquals(Integer.valueOf(2), damage.targetSeatId());
        assertNull(damage.targetGrpId());
        assertEquals(3, damage.amount());
    }

    // -------------------------------------------------------------------------
    // Life, turns and phases
    // -------------------------------------------------------------------------

    @Test
    void modifiedLifeAppliesDeltasCumulatively() {
        List<ArenaGameEvent.LifeTotalChange> changes = new ArrayList<>();
        changes.addAll(ofType(feed(gre(gsm().modifiedLife(1, -2).message())), ArenaGameEvent.LifeTotalChange.class));
        changes.addAll(ofType(feed(gre(gsm().modifiedLife(1, -3).message())), ArenaGameEvent.LifeTotalChange.class));
        changes.addAll(ofType(feed(gre(gsm().modifiedLife(1, 1).message())), ArenaGameEvent.LifeTotalChange.class));

        assertEquals(List.of(18, 15, 16), changes.stream().map(ArenaGameEvent.LifeTotalChange::lifeTotal).collect(Collectors.toList()));
        assertEquals(List.of(-2, -3, 1), changes.stream().map(ArenaGameEvent.LifeTotalChange::delta).collect(Collectors.toList()));
    }

    @Test
    void modifiedLifeStartsFromFormatStartingLife() {
        feed(authenticate("Alice#12345"));
        feed(matchStart("m-brawl", "Alice#12345", 1, 1, "Bob#999", "Play_Brawl_Historic"));

        ArenaGameEvent.LifeTotalChange own = ofType(feed(gre(gsm().modifiedLife(1, -2).message())),
                ArenaGameEvent.LifeTotalChange.class).get(0);
        ArenaGameEvent.LifeTotalChange opponent = ofType(feed(gre(gsm().modifiedLife(2, -5).message())),
                ArenaGameEvent.LifeTotalChange.class).get(0);
        assertEquals(23, own.lifeTotal());
        assertEquals(20, opponent.lifeTotal());

        feed(matchStart("m-ladder", "Alice#12345", 1, 1, "Bob#999", "Ladder"));
        ArenaGameEvent.LifeTotalChange ladder = ofType(feed(gre(gsm().modifiedLife(1, -2).message())),
                ArenaGameEvent.LifeTotalChange.class).get(0);
        assertEquals(18, ladder.lifeTotal());
    }

    @Test
    void playersArrayDoesNotRepeatAnnotatedLife() {
        List<ArenaGameEvent> events = feed(gre(gsm().modifiedLife(2, -4).player(2, 16).message()));

        assertEquals(1, ofType(events, ArenaGameEvent.LifeTotalChange.class).size());
    }

    @Test
    void playersArrayReportsChangeAgainstLastKnown() {
        feed(gre(gsm().player(1, 20).player(2, 20).message()));
        List<ArenaGameEvent> events = feed(gre(gsm().player(1, 20).player(2, 13).message()));

        ArenaGameEvent.LifeTotalChange change = ofType(events, ArenaGameEvent.LifeTotalChange.class).get(0);
        assertEquals(2, change.seatId());
        assertEquals(13, change.lifeTotal());
        assertEquals(-7, change.delta());
        assertEquals(1, ofType(events, ArenaGameEvent.LifeTotalChange.class).size());
    }

    @Test
    void turnAndPhaseAreEdgeTriggered() {
        List<ArenaGameEvent> first = feed(gre(gsm().turn(3, 1, "Phase_Main1", "").message()));
        List<ArenaGameEvent> repeat = feed(gre(gsm().turn(3, 1, "Phase_Main1", "").message()));
        List<ArenaGameEvent> combat = feed(gre(gsm().turn(3, 1, "Phase_Combat", "Step_DeclareAttack").message()));

        assertEquals(List.of("turn_change", "phase_change", "game_state_update"), types(first));
        assertEquals(List.of("game_state_update"), types(repeat));
        ArenaGameEvent.PhaseChange phase = ofType(combat, ArenaGameEvent.PhaseChange.class).get(0);
        assertEquals("Phase_Combat", phase.phase());
        assertEquals("Step_DeclareAttack", phase.step());
        assertEquals(3, phase.turnNumber());
    }

    // -------------------------------------------------------------------------
    // Mulligans and intermission
    // -------------------------------------------------------------------------

    @Test
    void mulliganPromptIsBackfilledWithOpeningHand() {
        List<ArenaGameEvent> prompt = feed(gre(mulliganReq(1, 0)));
        ArenaGameEvent.MulliganPrompt empty = ofType(prompt, ArenaGameEvent.MulliganPrompt.class).get(0);
        assertTrue(empty.hand().isEmpty());

        List<ArenaGameEvent> events = feed(gre(gsm()
                .zone(32, LIBRARY, 1)
                .zone(31, HAND, 1, 100, 101)
                .object(100, 555, 1, 31)
                .object(101, 666, 1, 31)
                .turn(1, 1, "Phase_Beginning", "Step_Upkeep")
                .message()));

        ArenaGameEvent.MulliganPrompt filled = ofType(events, ArenaGameEvent.MulliganPrompt.class).get(0);
        assertEquals(List.of(555, 666), filled.hand());
        assertEquals(0, ctx.pendingPromptCount());
        assertEquals("mulligan_prompt", events.get(events.size() - 1).type());
    }

    @Test
    void intermissionAdvancesGameAndForgetsInstances() {
        feed(matchStart("m-1", "Alice", 1, 1, "Bob", "Ladder"));
        feed(gre(seatOneZones().object(100, 555, 1, 32).message()));

        List<ArenaGameEvent> events = feed(gre(intermissionReq()));
        assertEquals(2, ofType(events, ArenaGameEvent.Intermission.class).get(0).gameNumber());
        assertEquals(2, ctx.gameNumber());

        List<ArenaGameEvent> after = feed(gre(seatOneZones().zoneTransfer(100, 32, 31, "Draw").message()));
        assertTrue(ofType(after, ArenaGameEvent.CardDrawn.class).isEmpty());
        assertEquals("m-1", ctx.currentMatchId());
    }

    @Test
    void extractAllSkipsNothingValidAndKeepsOrder() {
        List<ArenaGameEvent> events = extractor.extractAll(List.of(
                standalone(matchStart("m-1", "Alice", 1, 1, "Bob", "Ladder")),
                request("EventSetDeckV2", deck(new int[][]{{111, 4}}, new int[0][])),
                standalone(gre(gsm().turn(1, 1, "Phase_Main1", "").message())),
                standalone(matchComplete("m-1", 1))), ctx);

        assertEquals(List.of("match_start", "deck_submission", "turn_change", "phase_change",
                "game_state_update", "match_complete"), types(events));
    }
}
