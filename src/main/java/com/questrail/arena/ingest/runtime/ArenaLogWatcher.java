package com.questrail.arena.ingest.runtime;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.questrail.arena.ingest.block.BlockExtractor;
import com.questrail.arena.ingest.block.JsonBlock;
import com.questrail.arena.ingest.block.StreamingBlockBuffer;
import com.questrail.arena.ingest.config.BlockExtractionPolicy;
import com.questrail.arena.ingest.config.StreamingBufferPolicy;
import com.questrail.arena.ingest.config.TailerConfig;
import com.questrail.arena.ingest.config.TelemetryConfig;
import com.questrail.arena.ingest.events.ArenaGameEvent;
import com.questrail.arena.ingest.events.EventExtractor;
import com.questrail.arena.ingest.events.ExtractionContext;
import com.questrail.arena.ingest.internal.time.Cancellable;
import com.questrail.arena.ingest.internal.time.MonotonicClock;
import com.questrail.arena.ingest.internal.time.MonotonicScheduler;
import com.questrail.arena.ingest.internal.time.ScheduledExecutorScheduler;
import com.questrail.arena.ingest.internal.time.SystemMonotonicClock;
import com.questrail.arena.ingest.internal.time.SystemWallClock;
import com.questrail.arena.ingest.internal.time.WallClock;
import com.questrail.arena.ingest.legacy.LegacyLogParser;
import com.questrail.arena.ingest.legacy.LegacyMatchRecord;
import com.questrail.arena.ingest.observability.IngestErrorEvent;
import com.questrail.arena.ingest.observability.IngestObservabilitySink;
import com.questrail.arena.ingest.observability.ListenerFailureEvent;
import com.questrail.arena.ingest.observability.Slf4jIngestObservabilitySink;
import com.questrail.arena.ingest.resolve.IdentityResolver;
import com.questrail.arena.ingest.resolve.ResolvedCard;
import com.questrail.arena.ingest.state.DeckCardEntry;
import com.questrail.arena.ingest.state.GameStateEngine;
import com.questrail.arena.ingest.state.GameStateListener;
import com.questrail.arena.ingest.state.GameStateSnapshot;
import com.questrail.arena.ingest.tail.FileSystemLogFileProbe;
import com.questrail.arena.ingest.tail.LogChunkListener;
import com.questrail.arena.ingest.tail.LogFileProbe;
import com.questrail.arena.ingest.tail.LogTailer;
import com.questrail.arena.ingest.tail.ResetReason;
import com.questrail.arena.ingest.telemetry.TelemetryBatch;
import com.questrail.arena.ingest.telemetry.TelemetryRecorder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.BiConsumer;
import java.util.function.Consumer;

/**
 * ArenaLogWatcher
 * =============================================================================
 * Composition root and lifecycle owner for the ingestion pipeline.
 *
 * <pre>
 *   LogTailer --chunk--> LegacyLogParser             --> match / collection callbacks
 *                   \--> StreamingBlockBuffer
 *                          --> EventExtractor
 *                          --> GameStateEngine       --> subscribers
 *                          --> TelemetryRecorder     --> telemetry callback
 * </pre>
 *
 * <h2>Threading</h2>
 * Every chunk is processed on the scheduler thread that drives the tailer.
 * Card lookups complete on the resolver's executor; their results are handed
 * back to the scheduler before they touch the engine, so the engine and the
 * extraction context are only ever mutated from one thread.
 *
 * <h2>Telemetry boundaries</h2>
 * A batch is emitted every {@link TelemetryConfig#flushIntervalTurns()} turns,
 * at each intermission, and with the match summary on match completion. A
 * match that is replaced by a new one before completing is flushed with its
 * summary first. If the first thing seen is a game-state diff, the watcher
 * joined mid-match and starts a telemetry log with whatever is known.
 *
 * <h2>Resets</h2>
 * Rotation, truncation and {@link #stop()} discard the block buffers, the
 * extraction context, the engine state and the telemetry log.
 */
public final class ArenaLogWatcher {
    private static final Logger log = LoggerFactory.getLogger(ArenaLogWatcher.class);

    static final String MATCH_CHANNEL = "legacy-match";
    static final String COLLECTION_CHANNEL = "collection";
    static final String EVENT_CHANNEL = "game-event";
    static final String TELEMETRY_CHANNEL = "telemetry";

    private final LogTailer tailer;
    private final MonotonicScheduler scheduler;
    private final MonotonicClock clock;
    private final WallClock wallClock;
    private final IngestObservabilitySink sink;
    private final ScheduledExecutorService ownedExecutor;

    private final BlockExtractor blockExtractor;
    private final StreamingBlockBuffer streamingBuffer;
    private final StreamingBufferPolicy bufferPolicy;
    private final LegacyLogParser legacyParser;
    private final EventExtractor eventExtractor = new EventExtractor();
    private final ExtractionContext context = new ExtractionContext();
    private final GameStateEngine engine;
    private final TelemetryRecorder telemetry;
    private final IdentityResolver resolver;

    private final Consumer<LegacyMatchRecord> matchCallback;
    private final Consumer<Map<Integer, Integer>> collectionCallback;
    private final BiConsumer<ArenaGameEvent, GameStateSnapshot> eventCallback;
    private final Consumer<TelemetryBatch> telemetryCallback;

    private final StringBuilder legacyBuffer = new StringBuilder();
    private final Set<String> seenMatchIds = new HashSet<>();
    private boolean telemetryFinalized;
    private boolean matchEnded;
    private volatile boolean stopped;

    private ArenaLogWatcher(Builder b, MonotonicScheduler scheduler, ScheduledExecutorService ownedExecutor) {
        this.scheduler = scheduler;
        this.ownedExecutor = ownedExecutor;
        this.clock = b.clock;
        this.wallClock = b.wallClock;
        this.sink = b.sink;
        this.resolver = b.resolver;
        this.bufferPolicy = b.bufferPolicy;
        this.blockExtractor = new BlockExtractor(b.mapperOrDefault(), b.extractionPolicy);
        this.streamingBuffer = new StreamingBlockBuffer(blockExtractor, b.bufferPolicy);
        this.legacyParser = new LegacyLogParser(blockExtractor);
        this.engine = new GameStateEngine(b.sink, b.wallClock);
        this.telemetry = new TelemetryRecorder(b.telemetryConfig, b.wallClock, this::cardName);
        this.matchCallback = b.matchCallback;
        this.collectionCallback = b.collectionCallback;
        this.eventCallback = b.eventCallback;
        this.telemetryCallback = b.telemetryCallback;
        this.tailer = new LogTailer(
                b.tailerConfig, b.probe, scheduler, b.clock, b.wallClock, new ChunkHandler(), b.sink);
    }

    public static Builder builder() {
        return new Builder();
    }

    // -------------------------------------------------------------------------
    // Lifecycle
    // -------------------------------------------------------------------------

    public void start() {
        synchronized (this) {
            if (stopped) {
                throw new IllegalStateException("ArenaLogWatcher cannot be restarted");
            }
        }
        tailer.start();
    }

    /**
     * Stops tailing and discards all pipeline state. Idempotent; an executor
     * created by the builder is shut down.
     */
    public void stop() {
        synchronized (this) {
            if (stopped) {
                return;
            }
            stopped = true;
        }
        tailer.stop();
        if (ownedExecutor != null) {
            ownedExecutor.shutdown();
            try {
                if (!ownedExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                    ownedExecutor.shutdownNow();
                }
            } catch (InterruptedException e) {
                ownedExecutor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }

    public boolean isRunning() {
        return tailer.isRunning();
    }

    /**
     * Runs one poll tick on the calling thread.
     */
    public void poll() {
        tailer.poll();
    }

    public GameStateSnapshot snapshot() {
        return engine.snapshot();
    }

    public Cancellable subscribe(GameStateListener listener) {
        return engine.subscribe(listener);
    }

    // -------------------------------------------------------------------------
    // Chunk intake
    // -------------------------------------------------------------------------

    private final class ChunkHandler implements LogChunkListener {
        @Override
        public void onChunk(String text) {
            try {
                processLegacy(text);
                processStreaming(text);
            } catch (RuntimeException e) {
                sink.onError(new IngestErrorEvent(wallClock.now(), "ArenaLogWatcher",
                        "Failed to process log chunk", e));
            }
        }

        @Override
        public void onReset(ResetReason reason) {
            log.debug("Discarding pipeline state after {}", reason);
            legacyBuffer.setLength(0);
            streamingBuffer.clear();
            context.reset();
            engine.reset();
            telemetry.reset();
            telemetryFinalized = false;
            matchEnded = false;
        }
    }

    private void processLegacy(String text) {
        legacyBuffer.append(text);
        List<JsonBlock> blocks = blockExtractor.extract(legacyBuffer.toString());

        boolean found = false;
        for (LegacyMatchRecord match : legacyParser.extractMatches(blocks)) {
            if (seenMatchIds.add(match.matchId())) {
                notify(MATCH_CHANNEL, matchCallback, match);
                found = true;
            }
        }
        Optional<Map<Integer, Integer>> collection = legacyParser.extractCollection(blocks);
        if (collection.isPresent()) {
            notify(COLLECTION_CHANNEL, collectionCallback, collection.get());
            found = true;
        }

        if (found) {
            legacyBuffer.setLength(0);
        } else if (legacyBuffer.length() > bufferPolicy.trimThreshold()) {
            legacyBuffer.delete(0, legacyBuffer.length() - bufferPolicy.retainedChars());
        }
    }

    private void processStreaming(String text) {
        List<JsonBlock> blocks = streamingBuffer.append(text);
        if (blocks.isEmpty()) {
            return;
        }
        List<ArenaGameEvent> events = eventExtractor.extractAll(blocks, context);
        log.trace("{} new blocks -> {} events ({})", blocks.size(), events.size(), context.stats().snapshot());
        for (ArenaGameEvent event : events) {
            handle(event);
        }
    }

    // -------------------------------------------------------------------------
    // Event routing
    // -------------------------------------------------------------------------

    private void handle(ArenaGameEvent event) {
        if (event instanceof ArenaGameEvent.MatchStart e) {
            if (telemetry.hasMatch() && !telemetryFinalized) {
                log.debug("Match {} replaced by {} before completing", telemetry.matchId(), e.matchId());
                emitTelemetry(telemetry.flushFinal());
            }
            telemetryFinalized = false;
            matchEnded = false;
        } else if (event instanceof ArenaGameEvent.GameStateUpdate && !telemetry.hasMatch() && !matchEnded) {
            String matchId = context.currentMatchId() != null
                    ? context.currentMatchId()
                    : "unknown-" + wallClock.now().toEpochMilli();
            log.info("Joined match {} in progress", matchId);
            telemetry.startMatch(matchId, null, context.playerName(), null);
            telemetryFinalized = false;
        }

        engine.process(event);
        GameStateSnapshot snapshot = engine.snapshot();
        telemetry.onEvent(event, snapshot);

        if (event instanceof ArenaGameEvent.MatchComplete) {
            emitTelemetry(telemetry.flushFinal());
            telemetry.reset();
            telemetryFinalized = true;
            matchEnded = true;
        } else if (event instanceof ArenaGameEvent.Intermission) {
            emitTelemetry(telemetry.flush());
        } else if (event instanceof ArenaGameEvent.TurnChange) {
            if (telemetry.shouldFlush()) {
                emitTelemetry(telemetry.flush());
            }
        } else if (event instanceof ArenaGameEvent.DeckSubmission e) {
            resolveDeck(e);
        } else if (event instanceof ArenaGameEvent.GameStateUpdate) {
            applyObjectNames();
        }

        notify(EVENT_CHANNEL, eventCallback, event, snapshot);
    }

    private void emitTelemetry(TelemetryBatch batch) {
        if (!batch.isEmpty() || batch.hasSummary()) {
            notify(TELEMETRY_CHANNEL, telemetryCallback, batch);
        }
    }

    // -------------------------------------------------------------------------
    // Card names
    // -------------------------------------------------------------------------

    private void resolveDeck(ArenaGameEvent.DeckSubmission e) {
        if (resolver == null) {
            return;
        }
        Set<Integer> grpIds = new LinkedHashSet<>();
        e.mainDeck().forEach(c -> grpIds.add(c.grpId()));
        e.sideboard().forEach(c -> grpIds.add(c.grpId()));
        resolver.resolveMany(grpIds).whenComplete((resolved, failure) -> {
            if (failure != null) {
                sink.onError(new IngestErrorEvent(wallClock.now(), "ArenaLogWatcher",
                        "Deck name resolution failed", failure));
                return;
            }
            scheduler.scheduleAtNanos(clock.nowNanos(), () -> applyResolved(grpIds, resolved));
        });
    }

    private void applyResolved(Set<Integer> grpIds, Map<Integer, ResolvedCard> resolved) {
        if (stopped) {
            return;
        }
        Map<Integer, String> objectNames = engine.objectNames();
        boolean changed = false;
        for (Integer grpId : grpIds) {
            ResolvedCard card = resolved.get(grpId);
            String name = card != null && !card.isPlaceholder() && isReadable(card.name())
                    ? card.name()
                    : objectNames.get(grpId);
            if (isReadable(name)) {
                changed |= engine.resolveCard(grpId, name);
            }
        }
        if (changed) {
            engine.publish();
        }
    }

    private void applyObjectNames() {
        Map<Integer, String> objectNames = engine.objectNames();
        if (resolver != null) {
            resolver.setNameHints(objectNames);
        }
        boolean changed = false;
        for (DeckCardEntry entry : engine.snapshot().deckList()) {
            if (!entry.isResolved() && isReadable(objectNames.get(entry.grpId()))) {
                changed |= engine.resolveCard(entry.grpId(), objectNames.get(entry.grpId()));
            }
        }
        if (changed) {
            engine.publish();
        }
    }

    /**
     * Best display name available without a lookup: inline object names, then
     * resolved deck entries, then the resolver's memory.
     */
    private Optional<String> cardName(int grpId) {
        String name = engine.objectNames().get(grpId);
        if (name != null) {
            return Optional.of(name);
        }
        for (DeckCardEntry entry : engine.snapshot().deckList()) {
            if (entry.grpId() == grpId && entry.isResolved()) {
                return Optional.of(entry.name());
            }
        }
        if (resolver != null) {
            return resolver.getCached(grpId)
                    .filter(card -> !card.isPlaceholder())
                    .map(ResolvedCard::name);
        }
        return Optional.empty();
    }

    private static boolean isReadable(String name) {
        return name != null && !name.isBlank() && !name.chars().allMatch(Character::isDigit);
    }

    // -------------------------------------------------------------------------
    // Callback dispatch
    // -------------------------------------------------------------------------

    private <T> void notify(String channel, Consumer<T> callback, T value) {
        if (callback == null) {
            return;
        }
        try {
            callback.accept(value);
        } catch (RuntimeException e) {
            sink.onListenerFailure(new ListenerFailureEvent(wallClock.now(), channel, callback, e));
        }
    }

    private <A, B> void notify(String channel, BiConsumer<A, B> callback, A first, B second) {
        if (callback == null) {
            return;
        }
        try {
            callback.accept(first, second);
        } catch (RuntimeException e) {
            sink.onListenerFailure(new ListenerFailureEvent(wallClock.now(), channel, callback, e));
        }
    }

    // -------------------------------------------------------------------------
    // Builder
    // -------------------------------------------------------------------------

    public static final class Builder {
        private TailerConfig tailerConfig;
        private LogFileProbe probe = FileSystemLogFileProbe.INSTANCE;
        private MonotonicScheduler scheduler;
        private MonotonicClock clock = SystemMonotonicClock.INSTANCE;
        private WallClock wallClock = SystemWallClock.INSTANCE;
        private IngestObservabilitySink sink = new Slf4jIngestObservabilitySink();
        private IdentityResolver resolver;
        private BlockExtractionPolicy extractionPolicy = BlockExtractionPolicy.defaults();
        private StreamingBufferPolicy bufferPolicy = StreamingBufferPolicy.defaults();
        private TelemetryConfig telemetryConfig = TelemetryConfig.defaults();
        private ObjectMapper mapper;
        private Consumer<LegacyMatchRecord> matchCallback;
        private Consumer<Map<Integer, Integer>> collectionCallback;
        private BiConsumer<ArenaGameEvent, GameStateSnapshot> eventCallback;
        private Consumer<TelemetryBatch> telemetryCallback;

        private Builder() {
        }

        public Builder withTailerConfig(TailerConfig config) {
            this.tailerConfig = config;
            return this;
        }

        public Builder withProbe(LogFileProbe probe) {
            this.probe = Objects.requireNonNull(probe, "probe");
            return this;
        }

        /**
         * Scheduler that drives polling. It must run tasks one at a time.
         * Without one, the watcher creates and owns a single-threaded executor.
         */
        public Builder withScheduler(MonotonicScheduler scheduler) {
            this.scheduler = scheduler;
            return this;
        }

        public Builder withClock(MonotonicClock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        public Builder withWallClock(WallClock wallClock) {
            this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
            return this;
        }

        /** Defaults to logging pipeline events through SLF4J. */
        public Builder withObservabilitySink(IngestObservabilitySink sink) {
            this.sink = Objects.requireNonNull(sink, "sink");
            return this;
        }

        /** Card name lookups for submitted decks; optional. */
        public Builder withResolver(IdentityResolver resolver) {
            this.resolver = resolver;
            return this;
        }

        public Builder withExtractionPolicy(BlockExtractionPolicy policy) {
            this.extractionPolicy = Objects.requireNonNull(policy, "policy");
            return this;
        }

        public Builder withBufferPolicy(StreamingBufferPolicy policy) {
            this.bufferPolicy = Objects.requireNonNull(policy, "policy");
            return this;
        }

        public Builder withTelemetryConfig(TelemetryConfig config) {
            this.telemetryConfig = Objects.requireNonNull(config, "config");
            return this;
        }

        public Builder withObjectMapper(ObjectMapper mapper) {
            this.mapper = mapper;
            return this;
        }

        public Builder withMatchCallback(Consumer<LegacyMatchRecord> callback) {
            this.matchCallback = callback;
            return this;
        }

        public Builder withCollectionCallback(Consumer<Map<Integer, Integer>> callback) {
            this.collectionCallback = callback;
            return this;
        }

        public Builder withEventCallback(BiConsumer<ArenaGameEvent, GameStateSnapshot> callback) {
            this.eventCallback = callback;
            return this;
        }

        public Builder withTelemetryCallback(Consumer<TelemetryBatch> callback) {
            this.telemetryCallback = callback;
            return this;
        }

        private ObjectMapper mapperOrDefault() {
            return mapper != null ? mapper : new ObjectMapper();
        }

        public ArenaLogWatcher build() {
            Objects.requireNonNull(tailerConfig, "tailerConfig");

            if (scheduler != null) {
                return new ArenaLogWatcher(this, scheduler, null);
            }
            ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "arena-log-watcher");
                t.setDaemon(true);
                return t;
            });
            return new ArenaLogWatcher(this, new ScheduledExecutorScheduler(executor, clock), executor);
        }
    }
}
