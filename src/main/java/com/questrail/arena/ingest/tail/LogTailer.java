package com.questrail.arena.ingest.tail;

import com.questrail.arena.ingest.config.TailerConfig;
import com.questrail.arena.ingest.internal.time.Cancellable;
import com.questrail.arena.ingest.internal.time.MonotonicClock;
import com.questrail.arena.ingest.internal.time.MonotonicScheduler;
import com.questrail.arena.ingest.internal.time.WallClock;
import com.questrail.arena.ingest.observability.IngestErrorEvent;
import com.questrail.arena.ingest.observability.IngestObservabilitySink;
import com.questrail.arena.ingest.observability.TailerResetEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Objects;
import java.util.Optional;

/**
 * LogTailer
 * =============================================================================
 * Follows an append-only log file and delivers each newly appended byte range,
 * decoded as UTF-8, to a {@link LogChunkListener}.
 *
 * <h2>Poll cycle</h2>
 * Every tick:
 * <ol>
 *   <li>stat the file; a missing file is a silent skip (the client may simply
 *       not be running);</li>
 *   <li>identity differs from the last one seen: rotation, reset to offset 0;</li>
 *   <li>size below the consumed offset: truncation, reset to offset 0;</li>
 *   <li>size at or below the consumed offset: nothing to do;</li>
 *   <li>otherwise read exactly {@code [offset, size)} and deliver it.</li>
 * </ol>
 * A reset notifies the listener first, then the same tick re-reads from the
 * start of the new content. Any I/O failure other than a missing file is
 * reported to the {@link IngestObservabilitySink} and polling continues.
 *
 * <h2>Start modes</h2>
 * Normal mode seeks to the current end. Catch-up mode first delivers a bounded
 * trailing window so a match already in progress can be reconstructed.
 *
 * <h2>Threading</h2>
 * All public methods are synchronized; ticks are expected to run on a single
 * scheduler thread, and {@link #stop()} may be called from any thread. No chunk
 * is delivered once {@code stop()} has returned.
 */
public final class LogTailer {
    private static final Logger log = LoggerFactory.getLogger(LogTailer.class);

    // Upper bound on a single read call; larger deltas are read in pieces.
    private static final int MAX_READ_BYTES = 16 * 1024 * 1024;

    private final TailerConfig config;
    private final LogFileProbe probe;
    private final MonotonicScheduler scheduler;
    private final MonotonicClock clock;
    private final WallClock wallClock;
    private final LogChunkListener listener;
    private final IngestObservabilitySink sink;
    private final Utf8ChunkDecoder decoder = new Utf8ChunkDecoder();

    private boolean running;
    private Cancellable nextTick;
    private long offset;
    private FileIdentity identity;

    public LogTailer(TailerConfig config,
                     LogFileProbe probe,
                     MonotonicScheduler scheduler,
                     MonotonicClock clock,
                     WallClock wallClock,
                     LogChunkListener listener,
                     IngestObservabilitySink sink) {
        this.config = Objects.requireNonNull(config, "config");
        this.probe = Objects.requireNonNull(probe, "probe");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.listener = Objects.requireNonNull(listener, "listener");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    /**
     * Establishes the starting position and schedules the poll cycle.
     * Calling {@code start()} on a running tailer has no effect.
     */
    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        offset = 0;
        identity = null;

        try {
            Optional<LogFileStat> stat = probe.stat(config.logPath());
            if (stat.isPresent()) {
                LogFileStat s = stat.get();
                identity = s.identity();
                if (config.catchUp()) {
                    long window = Math.min(s.size(), config.catchUpWindowBytes());
                    log.debug("Catch-up read of {} trailing bytes from {}", window, config.logPath());
                    readRange(s.size() - window, s.size());
                }
                offset = s.size();
            } else {
                log.debug("Log file {} not present yet; waiting for it to appear", config.logPath());
            }
        } catch (IOException e) {
            sink.onError(new IngestErrorEvent(wallClock.now(), "LogTailer",
                    "Cannot access log file " + config.logPath(), e));
        }

        scheduleNextTick();
    }

    /**
     * Runs one poll tick. Normally driven by the scheduler; exposed so callers
     * and tests can drive the tailer deterministically.
     */
    public synchronized void poll() {
        if (!running) {
            return;
        }

        try {
            Optional<LogFileStat> stat = probe.stat(config.logPath());
            if (stat.isEmpty()) {
                return;
            }
            LogFileStat s = stat.get();

            if (identity != null && !identity.equals(s.identity())) {
                reset(ResetReason.ROTATION);
            }
            identity = s.identity();

            if (s.size() < offset) {
                reset(ResetReason.TRUNCATION);
            }

            if (s.size() <= offset) {
                return;
            }

            long end = s.size();
            readRange(offset, end);
            offset = end;
        } catch (IOException | RuntimeException e) {
            sink.onError(new IngestErrorEvent(wallClock.now(), "LogTailer",
                    "Poll of " + config.logPath() + " failed", e));
        }
    }

    /**
     * Cancels the poll cycle and clears the position. Idempotent.
     */
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        if (nextTick != null) {
            nextTick.cancel();
            nextTick = null;
        }

        long discarded = identity != null ? offset : -1;
        offset = 0;
        identity = null;
        decoder.reset();
        sink.onTailerReset(new TailerResetEvent(wallClock.now(), config.logPath(), ResetReason.RESTART, discarded));
        listener.onReset(ResetReason.RESTART);
    }

    /**
     * @return the consumed position, or {@code null} before the file has been seen
     */
    public synchronized LogPosition position() {
        return identity == null ? null : new LogPosition(offset, identity);
    }

    public synchronized boolean isRunning() {
        return running;
    }

    // -------------------------------------------------------------------------

    private void reset(ResetReason reason) {
        sink.onTailerReset(new TailerResetEvent(wallClock.now(), config.logPath(), reason, offset));
        offset = 0;
        decoder.reset();
        listener.onReset(reason);
    }

    private void readRange(long from, long to) throws IOException {
        long pos = from;
        while (pos < to) {
            int len = (int) Math.min(to - pos, MAX_READ_BYTES);
            byte[] bytes = probe.read(config.logPath(), pos, len);
            if (bytes.length == 0) {
                break;
            }
            pos += bytes.length;

            String text = decoder.decode(bytes);
            if (!text.isEmpty()) {
                listener.onChunk(text);
            }
        }
    }

    private void scheduleNextTick() {
        nextTick = scheduler.scheduleAfter(config.pollInterval(), clock, this::tick);
    }

    private void tick() {
        synchronized (this) {
            if (!running) {
                return;
            }
            try {
                poll();
            } finally {
                if (running) {
                    scheduleNextTick();
                }
            }
        }
    }
}
