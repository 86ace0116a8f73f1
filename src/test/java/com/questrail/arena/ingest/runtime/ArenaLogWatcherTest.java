package com.questrail.arena.ingest.runtime;

import com.questrail.arena.ingest.config.ResolverConfig;
import com.questrail.arena.ingest.config.TailerConfig;
import com.questrail.arena.ingest.config.TelemetryConfig;
import com.questrail.arena.ingest.events.ArenaGameEvent;
import com.questrail.arena.ingest.legacy.LegacyMatchRecord;
import com.questrail.arena.ingest.observability.IngestErrorEvent;
import com.questrail.arena.ingest.observability.ListenerFailureEvent;
import com.questrail.arena.ingest.observability.RecordingIngestObservabilitySink;
import com.questrail.arena.ingest.observability.TailerResetEvent;
import com.questrail.arena.ingest.resolve.IdentityResolver;
import com.questrail.arena.ingest.resolve.ResolvedCard;
import com.questrail.arena.ingest.state.GameStateSnapshot;
import com.questrail.arena.ingest.tail.InMemoryLogFile;
import com.questrail.arena.ingest.telemetry.TelemetryBatch;
import com.questrail.arena.ingest.time.DeterministicScheduler;
import com.questrail.arena.ingest.time.FixedWallClock;
import com.questrail.arena.ingest.time.ManualMonotonicClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import static com.questrail.arena.ingest.fixtures.ArenaLogFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class ArenaLogWatcherTest {

    private static final Instant START = Instant.parse("2024-05-01T12:00:00Z");
    private static final String LIBRARY = "ZoneType_Library";
    private static final String HAND = "ZoneType_Hand";
    private static final String BATTLEFIELD = "ZoneType_Battlefield";

    private ManualMonotonicClock clock;
    private DeterministicScheduler scheduler;
    private FixedWallClock wallClock;
    private InMemoryLogFile file;
    private RecordingIngestObservabilitySink sink;

    private final List<ArenaGameEvent> events = new ArrayList<>();
    private final List<TelemetryBatch> batches = new ArrayList<>();
    private final List<LegacyMatchRecord> legacyMatches = new ArrayList<>();
    private final List<Map<Integer, Integer>> collections = new ArrayList<>();

    @BeforeEach
    void setUp() {
        clock = new ManualMonotonicClock();
        scheduler = new DeterministicScheduler(clock);
        wallClock = new FixedWallClock(START);
        file = new InMemoryLogFile().append("[UnityCrossThreadLogger]client booted\n");
        sink = new RecordingIngestObservabilitySink();
    }

    private ArenaLogWatcher.Builder builder() {
        return ArenaLogWatcher.builder()
                .withTailerConfig(TailerConfig.defaults(Path.of("Player.log")))
                .withProbe(file)
                .withScheduler(scheduler)
                .withClock(clock)
                .withWallClock(wallClock)
                .withObservabilitySink(sink)
                .withEventCallback((event, snapshot) -> events.add(event))
                .withTelemetryCallback(batches::add)
                .withMatchCallback(legacyMatches::add)
                .withCollectionCallback(collections::add);
    }

    private ArenaLogWatcher started(ArenaLogWatcher.Builder builder) {
        ArenaLogWatcher watcher = builder.build();
        watcher.start();
        return watcher;
    }

    private static IdentityResolver resolverKnowing(int grpId, String name) {
        return IdentityResolver.builder()
                .withExecutor(Runnable::run)
                .withConfig(ResolverConfig.builder().withRemoteMinInterval(Duration.ZERO).build())
                .withRemote(id -> id == grpId
                        ? Optional.of(new ResolvedCard(id, name, "{U}", 1, "Instant", null, null, null,
                                ResolvedCard.Source.REMOTE))
                        : Optional.empty())
                .build();
    }

    private void feed(ArenaLogWatcher watcher, String... lines) {
        for (String line : lines) {
            file.append(line);
        }
        watcher.poll();
    }

    private List<String> eventTypes() {
        return events.stream().map(ArenaGameEvent::type).collect(Collectors.toList());
    }

    private static String openingDiff() {
        return standaloneLine(gre(gsm()
                .zone(32, LIBRARY, 1)
                .zone(31, HAND, 1, 100, 101)
                .zone(28, BATTLEFIELD, 0)
                .namedObject(100, 222, 1, 31, "Shock")
                .object(101, 111, 1, 31)
                .turn(1, 1, "Phase_Beginning", "Step_Upkeep")
                .message()));
    }

    // -------------------------------------------------------------------------
    // Live match
    // -------------------------------------------------------------------------

    @Test
    void existingContentIsSkippedOnStart() {
        ArenaLogWatcher watcher = started(builder());
        watcher.poll();

        assertTrue(events.isEmpty());
        assertTrue(watcher.isRunning());
        assertNull(watcher.snapshot().matchId());
    }

    @Test
    void fullMatchFlowsThroughEngineAndTelemetry() {
        ArenaLogWatcher watcher = started(builder().withResolver(resolverKnowing(111, "Opt")));

        feed(watcher,
                standaloneLine(authenticate("Alice")),
                standaloneLine(matchStart("m-1", "Alice", 1, 1, "Bob", "Ladder")),
                requestLine("EventSetDeckV2", deck(new int[][]{{111, 4}, {222, 2}}, new int[0][])),
                standaloneLine(gre(mulliganReq(1, 0))),
                openingDiff(),
                standaloneLine(gre(gsm()
                        .object(102, 111, 1, 31)
                        .zoneTransfer(102, 32, 31, "Draw")
                        .turn(1, 1, "Phase_Main1", "")
                        .message())));

        GameStateSnapshot live = watcher.snapshot();
        assertEquals("m-1", live.matchId());
        assertTrue(live.active());
        assertEquals("Bob", live.opponentName());
        assertEquals(3, live.remaining(111));
        assertEquals(5, live.librarySize());
        assertEquals(List.of(222, 111), live.openingHand());
        assertTrue(eventTypes().containsAll(List.of("match_start", "deck_submission", "mulligan_prompt", "card_drawn")));

        // Resolved names are applied on the scheduler thread.
        scheduler.runDueTasks();
        GameStateSnapshot named = watcher.snapshot();
        assertEquals("Opt", named.deckList().get(0).name());
        assertEquals("Shock", named.deckList().get(1).name());

        feed(watcher, standaloneLine(matchComplete("m-1", 1)));

        assertFalse(watcher.snapshot().active());
        TelemetryBatch last = batches.get(batches.size() - 1);
        assertTrue(last.hasSummary());
        assertEquals("m-1", last.summary().matchId());
        assertEquals("win", last.summary().result());
        assertEquals(List.of(111), last.summary().drawOrder());
        assertTrue(sink.eventsOfType(IngestErrorEvent.class).isEmpty());
    }

    @Test
    void intermissionFlushesWithoutSummary() {
        ArenaLogWatcher watcher = started(builder());

        feed(watcher,
                standaloneLine(matchStart("m-1", "Alice", 1, 1, "Bob", "Ladder")),
                standaloneLine(gre(intermissionReq())));

        assertEquals(1, batches.size());
        assertFalse(batches.get(0).hasSummary());
        assertEquals(2, watcher.snapshot().gameNumber());
        assertTrue(watcher.snapshot().sideboarding());
    }

    @Test
    void replacedMatchIsFinalizedBeforeTheNextStarts() {
        ArenaLogWatcher watcher = started(builder());

        feed(watcher,
                standaloneLine(matchStart("m-1", "Alice", 1, 1, "Bob", "Ladder")),
                standaloneLine(matchStart("m-2", "Alice", 1, 1, "Carol", "Ladder")));

        assertEquals(1, batches.size());
        assertEquals("m-1", batches.get(0).summary().matchId());
        assertNull(batches.get(0).summary().result());
        assertEquals("m-2", watcher.snapshot().matchId());
    }

    @Test
    void diffWithoutMatchStartJoinsInProgress() {
        ArenaLogWatcher watcher = started(builder().withTelemetryConfig(new TelemetryConfig(1)));

        feed(watcher,
                standaloneLine(gre(gsm().turn(3, 2, "Phase_Main1", "").message())),
                standaloneLine(gre(gsm().turn(4, 1, "Phase_Main1", "").message())));

        assertEquals(1, batches.size());
        String matchId = batches.get(0).actions().get(0).matchId();
        assertEquals("unknown-" + START.toEpochMilli(), matchId);
    }

    @Test
    void trailingDiffsAfterCompletionDoNotStartPhantomMatch() {
        ArenaLogWatcher watcher = started(builder());

        feed(watcher,
                standaloneLine(matchStart("m-1", "Alice", 1, 1, "Bob", "Ladder")),
                standaloneLine(matchComplete("m-1", 2)),
                standaloneLine(gre(gsm().turn(9, 2, "Phase_Ending", "Step_Cleanup").message())));

        assertEquals(1, batches.size());
        assertEquals("loss", batches.get(0).summary().result());
    }

    // -------------------------------------------------------------------------
    // Match history and collection
    // -------------------------------------------------------------------------

    @Test
    void completedMatchesAreReportedOnce() {
        ArenaLogWatcher watcher = started(builder());
        String[] match = {
                "[UnityCrossThreadLogger]{\"matchId\":\"match-001-test\",\"gameStateMessage\":{\"turnInfo\":{\"turnNumber\":1}}}\n",
                "[UnityCrossThreadLogger]==> MatchComplete(12346): {\"matchComplete\":{\"result\":\"ResultType_Win\"}}\n"
        };

        feed(watcher, match);
        feed(watcher, match);

        assertEquals(1, legacyMatches.size());
        assertEquals("match-001-test", legacyMatches.get(0).matchId());
    }

    @Test
    void collectionIsReported() {
        ArenaLogWatcher watcher = started(builder());

        feed(watcher, "[UnityCrossThreadLogger]<== PlayerInventory.GetPlayerCardsV3(7): {\"67890\": 4, \"12345\": 1}\n");

        assertEquals(List.of(Map.of(67890, 4, 12345, 1)), collections);
    }

    @Test
    void blockSplitAcrossPollsIsDecodedOnce() {
        ArenaLogWatcher watcher = started(builder());
        String line = standaloneLine(matchStart("m-1", "Alice", 1, 1, "Bob", "Ladder"));
        int cut = line.length() / 2;

        feed(watcher, line.substring(0, cut));
        assertTrue(events.isEmpty());
        feed(watcher, line.substring(cut));

        assertEquals(List.of("match_start"), eventTypes());
    }

    // -------------------------------------------------------------------------
    // Failures, resets and lifecycle
    // -------------------------------------------------------------------------

    @Test
    void failingCallbackIsIsolated() {
        ArenaLogWatcher watcher = started(builder().withEventCallback((event, snapshot) -> {
            throw new IllegalStateException("consumer down");
        }));

        feed(watcher, standaloneLine(matchStart("m-1", "Alice", 1, 1, "Bob", "Ladder")));

        assertEquals("m-1", watcher.snapshot().matchId());
        List<ListenerFailureEvent> failures = sink.eventsOfType(ListenerFailureEvent.class);
        assertEquals(1, failures.size());
        assertEquals(ArenaLogWatcher.EVENT_CHANNEL, failures.get(0).channel());
    }

    @Test
    void rotationDiscardsPipelineState() {
        ArenaLogWatcher watcher = started(builder());
        feed(watcher, standaloneLine(matchStart("m-1", "Alice", 1, 1, "Bob", "Ladder")));

        file.rotate("");
        watcher.poll();

        assertNull(watcher.snapshot().matchId());
        assertTrue(sink.hasEventOfType(TailerResetEvent.class));

        feed(watcher, standaloneLine(matchStart("m-1", "Alice", 1, 1, "Bob", "Ladder")));
        assertEquals("m-1", watcher.snapshot().matchId());
    }

    @Test
    void stopIsIdempotentAndFinal() {
        ArenaLogWatcher watcher = started(builder());
        feed(watcher, standaloneLine(matchStart("m-1", "Alice", 1, 1, "Bob", "Ladder")));

        watcher.stop();
        watcher.stop();

        assertFalse(watcher.isRunning());
        assertNull(watcher.snapshot().matchId());
        assertEquals(0, scheduler.pendingCount());
        assertThrows(IllegalStateException.class, watcher::start);
    }

    @Test
    void builderRequiresTailerConfig() {
        assertThrows(NullPointerException.class, () -> ArenaLogWatcher.builder().build());
    }
}
