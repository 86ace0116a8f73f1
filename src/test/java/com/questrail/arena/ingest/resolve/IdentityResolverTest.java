package com.questrail.arena.ingest.resolve;

import com.questrail.arena.ingest.config.ResolverConfig;
import com.questrail.arena.ingest.observability.RecordingIngestObservabilitySink;
import com.questrail.arena.ingest.observability.RemoteLookupFailureEvent;
import com.questrail.arena.ingest.time.ManualMonotonicClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class IdentityResolverTest {

    private InMemoryQueryAdapter storage;
    private RecordingIngestObservabilitySink sink;
    private ManualMonotonicClock clock;
    private List<Long> sleeps;
    private ExecutorService pool;

    @BeforeEach
    void setUp() {
        storage = new InMemoryQueryAdapter();
        sink = new RecordingIngestObservabilitySink();
        clock = new ManualMonotonicClock();
        sleeps = new ArrayList<>();
    }

    @AfterEach
    void tearDown() {
        if (pool != null) {
            pool.shutdownNow();
        }
    }

    private IdentityResolver.Builder direct() {
        return IdentityResolver.builder()
                .withExecutor(Runnable::run)
                .withClock(clock)
                .withObservabilitySink(sink)
                .withSleeper(sleeps::add);
    }

    private static ResolvedCard remoteCard(int grpId, String name) {
        return new ResolvedCard(grpId, name, "{G}", 1, "Creature", null, null, null, ResolvedCard.Source.REMOTE);
    }

    // -------------------------------------------------------------------------
    // Tiers
    // -------------------------------------------------------------------------

    @Test
    void persistentCacheHitIsNotWrittenBack() {
        storage.putCached(1, "Opt");
        IdentityResolver resolver = direct().withStorage(storage).build();

        ResolvedCard card = resolver.resolve(1).join();

        assertEquals("Opt", card.name());
        assertEquals(ResolvedCard.Source.CACHE, card.source());
        assertEquals(2.0, card.cmc());
        assertTrue(storage.writes.isEmpty());
    }

    @Test
    void catalogHitIsWrittenBackWithArenaIdSource() {
        storage.putCatalog(2, "Shock", "{R}");
        IdentityResolver resolver = direct().withStorage(storage).build();

        ResolvedCard card = resolver.resolve(2).join();

        assertEquals(ResolvedCard.Source.CATALOG, card.source());
        assertEquals("{R}", card.manaCost());
        assertEquals(1, storage.writes.size());
        Object[] write = storage.writes.get(0);
        assertEquals(2, write[0]);
        assertEquals("Shock", write[1]);
        assertEquals("arena_id", write[8]);
    }

    @Test
    void remoteHitIsWrittenBackWithScryfallSource() {
        IdentityResolver resolver = direct()
                .withStorage(storage)
                .withRemote(grpId -> Optional.of(remoteCard(grpId, "Llanowar Elves")))
                .build();

        ResolvedCard card = resolver.resolve(3).join();

        assertEquals(ResolvedCard.Source.REMOTE, card.source());
        assertEquals("scryfall", storage.writes.get(0)[8]);
    }

    @Test
    void unknownIdResolvesToPlaceholderKeptInMemoryOnly() {
        IdentityResolver resolver = direct()
                .withStorage(storage)
                .withRemote(grpId -> Optional.empty())
                .build();

        ResolvedCard card = resolver.resolve(5).join();

        assertTrue(card.isPlaceholder());
        assertEquals("Unknown (grpId: 5)", card.name());
        assertTrue(storage.writes.isEmpty());
        assertEquals(Optional.of(card), resolver.getCached(5));
    }

    @Test
    void resolvedCardsAreServedFromMemory() {
        storage.putCatalog(2, "Shock", "{R}");
        IdentityResolver resolver = direct().withStorage(storage).build();

        resolver.resolve(2).join();
        int queriesAfterFirst = storage.queries;
        ResolvedCard again = resolver.resolve(2).join();

        assertEquals("Shock", again.name());
        assertEquals(queriesAfterFirst, storage.queries);
        assertEquals(1, resolver.cacheSize());
    }

    @Test
    void storageFailureFallsThroughToRemote() {
        storage.failReads = true;
        IdentityResolver resolver = direct()
                .withStorage(storage)
                .withRemote(grpId -> Optional.of(remoteCard(grpId, "Forest")))
                .build();

        assertEquals("Forest", resolver.resolve(9).join().name());
    }

    @Test
    void remoteFailureDegradesToPlaceholderAndIsReported() {
        IdentityResolver resolver = direct()
                .withRemote(grpId -> {
                    throw new RemoteLookupException("HTTP 503");
                })
                .build();

        ResolvedCard card = resolver.resolve(6).join();

        assertTrue(card.isPlaceholder());
        List<RemoteLookupFailureEvent> failures = sink.eventsOfType(RemoteLookupFailureEvent.class);
        assertEquals(1, failures.size());
        assertEquals(6, failures.get(0).grpId());
    }

    @Test
    void unexpectedRemoteErrorDegradesToPlaceholderAndIsCached() {
        AtomicInteger calls = new AtomicInteger();
        IdentityResolver resolver = direct()
                .withRemote(grpId -> {
                    calls.incrementAndGet();
                    throw new IllegalStateException("malformed card payload");
                })
                .build();

        CompletableFuture<ResolvedCard> first = resolver.resolve(4242);

        assertFalse(first.isCompletedExceptionally());
        assertTrue(first.join().isPlaceholder());
        assertTrue(resolver.getCached(4242).isPresent());
        assertTrue(resolver.resolve(4242).join().isPlaceholder());
        assertEquals(1, calls.get());
        List<RemoteLookupFailureEvent> failures = sink.eventsOfType(RemoteLookupFailureEvent.class);
        assertEquals(1, failures.size());
        assertTrue(failures.get(0).cause() instanceof IllegalStateException);
    }

    @Test
    void batchSurvivesUnexpectedRemoteError() {
        IdentityResolver resolver = direct()
                .withRemote(grpId -> {
                    if (grpId == 2) {
                        throw new IllegalStateException("boom");
                    }
                    return Optional.of(remoteCard(grpId, "Card " + grpId));
                })
                .build();

        Map<Integer, ResolvedCard> resolved = resolver.resolveMany(List.of(1, 2, 3)).join();

        assertEquals("Card 1", resolved.get(1).name());
        assertTrue(resolved.get(2).isPlaceholder());
        assertEquals("Card 3", resolved.get(3).name());
    }

    @Test
    void nameHintsNamePlaceholders() {
        IdentityResolver resolver = direct().build();
        resolver.setNameHints(Map.of(7, "Grizzly Bears", 8, "40512"));

        assertEquals("Grizzly Bears", resolver.resolve(7).join().name());
        assertTrue(resolver.resolve(7).join().isPlaceholder());
        assertEquals("Unknown (grpId: 8)", resolver.resolve(8).join().name());
    }

    @Test
    void rejectedExecutionYieldsPlaceholder() {
        IdentityResolver resolver = IdentityResolver.builder()
                .withExecutor(task -> {
                    throw new RejectedExecutionException("shut down");
                })
                .build();

        assertTrue(resolver.resolve(10).join().isPlaceholder());
        assertTrue(resolver.getCached(10).isEmpty());
    }

    // -------------------------------------------------------------------------
    // Batch operations
    // -------------------------------------------------------------------------

    @Test
    void resolveManyLooksUpEachIdOnceInOrder() {
        AtomicInteger calls = new AtomicInteger();
        IdentityResolver resolver = direct()
                .withRemote(grpId -> {
                    calls.incrementAndGet();
                    return Optional.of(remoteCard(grpId, "Card " + grpId));
                })
                .build();

        Map<Integer, ResolvedCard> cards = resolver.resolveMany(List.of(30, 10, 30, 20)).join();

        assertEquals(List.of(30, 10, 20), new ArrayList<>(cards.keySet()));
        assertEquals("Card 10", cards.get(10).name());
        assertEquals(3, calls.get());
    }

    @Test
    void warmCacheLoadsKnownRowsOnly() {
        storage.putCached(1, "Opt");
        storage.putCached(2, "Shock");
        IdentityResolver resolver = direct().withStorage(storage).build();

        assertEquals(2, resolver.warmCache(List.of(1, 2, 3, 1)));
        assertEquals(2, resolver.cacheSize());
        assertEquals("Shock", resolver.getCached(2).orElseThrow().name());
        assertEquals(0, resolver.warmCache(List.of(1, 2)));
    }

    @Test
    void warmCacheWithoutStorageLoadsNothing() {
        assertEquals(0, direct().build().warmCache(List.of(1, 2)));
    }

    // -------------------------------------------------------------------------
    // Concurrency and pacing
    // -------------------------------------------------------------------------

    @Test
    void concurrentRequestsForOneIdShareOneLookup() throws Exception {
        pool = Executors.newFixedThreadPool(4);
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger calls = new AtomicInteger();

        IdentityResolver resolver = IdentityResolver.builder()
                .withExecutor(pool)
                .withConfig(ResolverConfig.builder().withRemoteMinInterval(Duration.ZERO).build())
                .withRemote(grpId -> {
                    calls.incrementAndGet();
                    entered.countDown();
                    try {
                        release.await();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    return Optional.of(remoteCard(grpId, "Slow Card"));
                })
                .build();

        List<CompletableFuture<ResolvedCard>> futures = new ArrayList<>();
        futures.add(resolver.resolve(77777));
        assertTrue(entered.await(5, TimeUnit.SECONDS));
        for (int i = 0; i < 4; i++) {
            futures.add(resolver.resolve(77777));
        }
        release.countDown();

        for (CompletableFuture<ResolvedCard> f : futures) {
            assertEquals("Slow Card", f.get(5, TimeUnit.SECONDS).name());
        }
        assertEquals(1, calls.get());
        for (CompletableFuture<ResolvedCard> f : futures) {
            assertSame(futures.get(0), f);
        }
    }

    @Test
    void remoteCallsAreSpacedByMinimumInterval() {
        IdentityResolver resolver = direct()
                .withRemote(grpId -> Optional.of(remoteCard(grpId, "Card " + grpId)))
                .build();

        resolver.resolve(1).join();
        resolver.resolve(2).join();
        resolver.resolve(3).join();

        assertEquals(List.of(
                Duration.ofMillis(100).toNanos(),
                Duration.ofMillis(200).toNanos()), sleeps);
    }

    @Test
    void gateOpensOnceIntervalHasPassed() throws InterruptedException {
        RemoteCallGate gate = new RemoteCallGate(clock, Duration.ofMillis(100), sleeps::add);

        assertEquals(0, gate.acquire());
        clock.advanceMillis(40);
        assertEquals(Duration.ofMillis(60).toNanos(), gate.acquire());
        clock.advanceMillis(500);
        assertEquals(0, gate.acquire());
        assertEquals(List.of(Duration.ofMillis(60).toNanos()), sleeps);
    }
}
