package com.questrail.arena.ingest.resolve;

import com.questrail.arena.ingest.config.ResolverConfig;
import com.questrail.arena.ingest.internal.time.MonotonicClock;
import com.questrail.arena.ingest.internal.time.SystemMonotonicClock;
import com.questrail.arena.ingest.internal.time.SystemWallClock;
import com.questrail.arena.ingest.internal.time.WallClock;
import com.questrail.arena.ingest.observability.IngestObservabilitySink;
import com.questrail.arena.ingest.observability.NullIngestObservabilitySink;
import com.questrail.arena.ingest.observability.RemoteLookupFailureEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.RejectedExecutionException;

/**
 * IdentityResolver
 * =============================================================================
 * Resolves grpIds to card metadata through four tiers.
 *
 * <h2>Tiers</h2>
 * <ol>
 *   <li>in-process cache;</li>
 *   <li>the persistent {@code grp_id_cache} table;</li>
 *   <li>the card catalog, joined on its {@code arena_id} column (hits are
 *       written back to {@code grp_id_cache} with source {@code arena_id});</li>
 *   <li>the remote lookup, spaced by
 *       {@link ResolverConfig#remoteMinInterval()} (hits are written back with
 *       source {@code scryfall}).</li>
 * </ol>
 * An id nobody knows resolves to a placeholder, which is kept in the
 * in-process cache only. Resolution never completes exceptionally for a
 * missing card or a failed remote call.
 *
 * <h2>Concurrency</h2>
 * Lookups run on the supplied {@link Executor}. At most one lookup per id is
 * in flight: concurrent callers for the same id share one future. Every
 * table here belongs to the instance, so independent resolvers never share
 * state.
 */
public final class IdentityResolver {
    private static final Logger log = LoggerFactory.getLogger(IdentityResolver.class);

    static final String SOURCE_ARENA_ID = "arena_id";
    static final String SOURCE_SCRYFALL = "scryfall";

    static final String SELECT_CACHED =
            "SELECT * FROM grp_id_cache WHERE grp_id = ?";
    static final String SELECT_CACHED_IN =
            "SELECT * FROM grp_id_cache WHERE grp_id IN (%s)";
    static final String SELECT_CATALOG =
            "SELECT id, name, mana_cost, cmc, type_line, oracle_text, image_uri_small, image_uri_normal"
                    + " FROM cards WHERE arena_id = ? LIMIT 1";
    static final String UPSERT_CACHED =
            "INSERT OR REPLACE INTO grp_id_cache"
                    + " (grp_id, card_name, image_uri_small, image_uri_normal, mana_cost, cmc, type_line, oracle_text, source)"
                    + " VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)";

    static final int WARM_BATCH_SIZE = 500;

    private final QueryAdapter storage;
    private final RemoteCardLookup remote;
    private final Executor executor;
    private final IngestObservabilitySink sink;
    private final WallClock wallClock;
    private final RemoteCallGate gate;

    private final Map<Integer, ResolvedCard> memory = new ConcurrentHashMap<>();
    private final Map<Integer, CompletableFuture<ResolvedCard>> pending = new ConcurrentHashMap<>();
    private final Map<Integer, String> nameHints = new ConcurrentHashMap<>();

    private IdentityResolver(Builder b) {
        this.storage = b.storage;
        this.remote = b.remote;
        this.executor = Objects.requireNonNull(b.executor, "executor");
        this.sink = Objects.requireNonNull(b.sink, "sink");
        this.wallClock = Objects.requireNonNull(b.wallClock, "wallClock");
        this.gate = new RemoteCallGate(b.clock, b.config.remoteMinInterval(), b.sleeper);
    }

    public static Builder builder() {
        return new Builder();
    }

    // -------------------------------------------------------------------------
    // Public API
    // -------------------------------------------------------------------------

    /**
     * Resolves one grpId. Completes immediately for a cached id; otherwise
     * joins the lookup already in flight for it, or starts one.
     */
    public CompletableFuture<ResolvedCard> resolve(int grpId) {
        ResolvedCard cached = memory.get(grpId);
        if (cached != null) {
            return CompletableFuture.completedFuture(cached);
        }

        CompletableFuture<ResolvedCard> created = new CompletableFuture<>();
        CompletableFuture<ResolvedCard> inFlight = pending.putIfAbsent(grpId, created);
        if (inFlight != null) {
            return inFlight;
        }

        // A lookup may have finished between the cache check and the claim.
        cached = memory.get(grpId);
        if (cached != null) {
            pending.remove(grpId, created);
            created.complete(cached);
            return created;
        }

        try {
            executor.execute(() -> runLookup(grpId, created));
        } catch (RejectedExecutionException e) {
            log.warn("Lookup of grpId {} rejected by executor; using placeholder", grpId);
            pending.remove(grpId, created);
            created.complete(placeholderFor(grpId));
        }
        return created;
    }

    /**
     * Resolves every id in {@code grpIds}; duplicates are looked up once.
     *
     * @return future of an insertion-ordered map of grpId to card
     */
    public CompletableFuture<Map<Integer, ResolvedCard>> resolveMany(Collection<Integer> grpIds) {
        Objects.requireNonNull(grpIds, "grpIds");
        Map<Integer, CompletableFuture<ResolvedCard>> futures = new LinkedHashMap<>();
        for (Integer grpId : new LinkedHashSet<>(grpIds)) {
            futures.put(grpId, resolve(grpId));
        }
        return CompletableFuture.allOf(futures.values().toArray(new CompletableFuture[0]))
                .thenApply(ignored -> {
                    Map<Integer, ResolvedCard> out = new LinkedHashMap<>();
                    futures.forEach((grpId, f) -> out.put(grpId, f.join()));
                    return out;
                });
    }

    /**
     * @return the in-process entry for {@code grpId}; never triggers a lookup
     */
    public Optional<ResolvedCard> getCached(int grpId) {
        return Optional.ofNullable(memory.get(grpId));
    }

    /**
     * Loads {@code grpIds} from the persistent cache straight into the
     * in-process cache, skipping ids already there.
     *
     * @return number of entries loaded
     */
    public int warmCache(Collection<Integer> grpIds) {
        Objects.requireNonNull(grpIds, "grpIds");
        if (storage == null) {
            return 0;
        }
        List<Integer> wanted = new ArrayList<>();
        for (Integer grpId : new LinkedHashSet<>(grpIds)) {
            if (!memory.containsKey(grpId)) {
                wanted.add(grpId);
            }
        }

        int loaded = 0;
        for (int from = 0; from < wanted.size(); from += WARM_BATCH_SIZE) {
            List<Integer> batch = wanted.subList(from, Math.min(wanted.size(), from + WARM_BATCH_SIZE));
            String sql = String.format(SELECT_CACHED_IN, String.join(", ", Collections.nCopies(batch.size(), "?")));
            List<Map<String, Object>> rows;
            try {
                rows = storage.queryAll(sql, batch.toArray());
            } catch (RuntimeException e) {
                log.warn("Cache warm-up stopped after {} entries", loaded, e);
                return loaded;
            }
            for (Map<String, Object> row : rows) {
                ResolvedCard card = fromCacheRow(row);
                if (card != null && memory.putIfAbsent(card.grpId(), card) == null) {
                    loaded++;
                }
            }
        }
        log.debug("Warmed {} of {} requested grpIds", loaded, wanted.size());
        return loaded;
    }

    public int cacheSize() {
        return memory.size();
    }

    /**
     * Replaces the names used for placeholders, typically the readable names
     * seen inline on game objects. Numeric and blank names are ignored.
     */
    public void setNameHints(Map<Integer, String> hints) {
        Objects.requireNonNull(hints, "hints");
        nameHints.clear();
        hints.forEach((grpId, name) -> {
            if (name != null && !name.isBlank() && !name.chars().allMatch(Character::isDigit)) {
                nameHints.put(grpId, name);
            }
        });
    }

    // -------------------------------------------------------------------------
    // Tiers
    // -------------------------------------------------------------------------

    private void runLookup(int grpId, CompletableFuture<ResolvedCard> target) {
        try {
            ResolvedCard card = lookup(grpId);
            memory.put(grpId, card);
            target.complete(card);
        } catch (RuntimeException e) {
            target.completeExceptionally(e);
        } finally {
            pending.remove(grpId, target);
        }
    }

    private ResolvedCard lookup(int grpId) {
        Optional<ResolvedCard> hit = lookupCache(grpId);
        if (hit.isPresent()) {
            return hit.get();
        }

        hit = lookupCatalog(grpId);
        if (hit.isPresent()) {
            store(hit.get(), SOURCE_ARENA_ID);
            return hit.get();
        }

        hit = lookupRemote(grpId);
        if (hit.isPresent()) {
            store(hit.get(), SOURCE_SCRYFALL);
            return hit.get();
        }

        return placeholderFor(grpId);
    }

    private Optional<ResolvedCard> lookupCache(int grpId) {
        if (storage == null) {
            return Optional.empty();
        }
        try {
            return storage.queryOne(SELECT_CACHED, grpId).map(IdentityResolver::fromCacheRow);
        } catch (RuntimeException e) {
            log.warn("grp_id_cache lookup failed for {}", grpId, e);
            return Optional.empty();
        }
    }

    private Optional<ResolvedCard> lookupCatalog(int grpId) {
        if (storage == null) {
            return Optional.empty();
        }
        try {
            return storage.queryOne(SELECT_CATALOG, grpId).map(row -> fromCatalogRow(grpId, row));
        } catch (RuntimeException e) {
            log.warn("Catalog lookup failed for {}", grpId, e);
            return Optional.empty();
        }
    }

    private Optional<ResolvedCard> lookupRemote(int grpId) {
        if (remote == null) {
            return Optional.empty();
        }
        try {
            gate.acquire();
            return remote.lookup(grpId).map(card -> card.withSource(ResolvedCard.Source.REMOTE));
        } catch (RuntimeException e) {
            // RemoteLookupException, or anything else a lookup implementation lets escape.
            sink.onRemoteLookupFailure(new RemoteLookupFailureEvent(wallClock.now(), grpId, e));
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            sink.onRemoteLookupFailure(new RemoteLookupFailureEvent(wallClock.now(), grpId, e));
            return Optional.empty();
        }
    }

    private void store(ResolvedCard card, String source) {
        if (storage == null) {
            return;
        }
        try {
            storage.execute(UPSERT_CACHED,
                    card.grpId(),
                    card.name(),
                    card.imageUriSmall(),
                    card.imageUriNormal(),
                    card.manaCost(),
                    card.cmc(),
                    card.typeLine(),
                    card.oracleText(),
                    source);
        } catch (RuntimeException e) {
            log.warn("Could not write grpId {} back to grp_id_cache", card.grpId(), e);
        }
    }

    private ResolvedCard placeholderFor(int grpId) {
        String hint = nameHints.get(grpId);
        return hint != null ? ResolvedCard.placeholder(grpId, hint) : ResolvedCard.placeholder(grpId);
    }

    // -------------------------------------------------------------------------
    // Row mapping
    // -------------------------------------------------------------------------

    static ResolvedCard fromCacheRow(Map<String, Object> row) {
        Object grpId = row.get("grp_id");
        Object name = row.get("card_name");
        if (!(grpId instanceof Number) || name == null) {
            return null;
        }
        return new ResolvedCard(
                ((Number) grpId).intValue(),
                name.toString(),
                string(row, "mana_cost"),
                number(row, "cmc"),
                string(row, "type_line"),
                string(row, "oracle_text"),
                string(row, "image_uri_small"),
                string(row, "image_uri_normal"),
                ResolvedCard.Source.CACHE);
    }

    static ResolvedCard fromCatalogRow(int grpId, Map<String, Object> row) {
        Object name = row.get("name");
        if (name == null) {
            return null;
        }
        return new ResolvedCard(
                grpId,
                name.toString(),
                string(row, "mana_cost"),
                number(row, "cmc"),
                string(row, "type_line"),
                string(row, "oracle_text"),
                string(row, "image_uri_small"),
                string(row, "image_uri_normal"),
                ResolvedCard.Source.CATALOG);
    }

    private static String string(Map<String, Object> row, String column) {
        Object value = row.get(column);
        return value != null ? value.toString() : null;
    }

    private static double number(Map<String, Object> row, String column) {
        Object value = row.get(column);
        return value instanceof Number n ? n.doubleValue() : 0;
    }

    // -------------------------------------------------------------------------
    // Builder
    // -------------------------------------------------------------------------

    public static final class Builder {
        private QueryAdapter storage;
        private RemoteCardLookup remote;
        private ResolverConfig config = ResolverConfig.defaults();
        private MonotonicClock clock = SystemMonotonicClock.INSTANCE;
        private Executor executor = ForkJoinPool.commonPool();
        private IngestObservabilitySink sink = NullIngestObservabilitySink.INSTANCE;
        private WallClock wallClock = SystemWallClock.INSTANCE;
        private RemoteCallGate.Sleeper sleeper = RemoteCallGate.THREAD_SLEEPER;

        private Builder() {
        }

        /** Persistent cache and catalog; without one those tiers are skipped. */
        public Builder withStorage(QueryAdapter storage) {
            this.storage = storage;
            return this;
        }

        /** Remote tier; without one it is skipped. */
        public Builder withRemote(RemoteCardLookup remote) {
            this.remote = remote;
            return this;
        }

        public Builder withConfig(ResolverConfig config) {
            this.config = Objects.requireNonNull(config, "config");
            return this;
        }

        public Builder withClock(MonotonicClock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        public Builder withExecutor(Executor executor) {
            this.executor = Objects.requireNonNull(executor, "executor");
            return this;
        }

        public Builder withObservabilitySink(IngestObservabilitySink sink) {
            this.sink = Objects.requireNonNull(sink, "sink");
            return this;
        }

        public Builder withWallClock(WallClock wallClock) {
            this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
            return this;
        }

        Builder withSleeper(RemoteCallGate.Sleeper sleeper) {
            this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
            return this;
        }

        public IdentityResolver build() {
            return new IdentityResolver(this);
        }
    }
}
