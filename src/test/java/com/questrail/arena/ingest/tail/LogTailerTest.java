package com.questrail.arena.ingest.tail;

import com.questrail.arena.ingest.config.TailerConfig;
import com.questrail.arena.ingest.internal.time.SystemWallClock;
import com.questrail.arena.ingest.observability.IngestErrorEvent;
import com.questrail.arena.ingest.observability.RecordingIngestObservabilitySink;
import com.questrail.arena.ingest.observability.TailerResetEvent;
import com.questrail.arena.ingest.time.DeterministicScheduler;
import com.questrail.arena.ingest.time.ManualMonotonicClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LogTailerTest {

    private static final Path LOG = Path.of("Player.log");

    private ManualMonotonicClock clock;
    private DeterministicScheduler scheduler;
    private InMemoryLogFile file;
    private RecordingChunkListener listener;
    private RecordingIngestObservabilitySink sink;

    @BeforeEach
    void setUp() {
        clock = new ManualMonotonicClock();
        scheduler = new DeterministicScheduler(clock);
        file = new InMemoryLogFile();
        listener = new RecordingChunkListener();
        sink = new RecordingIngestObservabilitySink();
    }

    private LogTailer tailer(TailerConfig config) {
        return new LogTailer(config, file, scheduler, clock, SystemWallClock.INSTANCE, listener, sink);
    }

    private LogTailer tailer() {
        return tailer(TailerConfig.defaults(LOG));
    }

    @Test
    void normalStartSkipsExistingContentAndDeliversOnlyAppendedBytes() {
        file.append("old line\n");
        LogTailer tailer = tailer();
        tailer.start();

        assertTrue(listener.chunks.isEmpty());
        assertEquals(9, tailer.position().offset());

        file.append("new line\n");
        tailer.poll();

        assertEquals(List.of("new line\n"), listener.chunks);
        assertEquals(file.size(), tailer.position().offset());
    }

    @Test
    void pollWithoutGrowthDeliversNothing() {
        file.append("abc");
        LogTailer tailer = tailer();
        tailer.start();
        tailer.poll();
        tailer.poll();

        assertTrue(listener.chunks.isEmpty());
    }

    @Test
    void catchUpDeliversBoundedTrailingWindow() {
        file.append("0123456789");
        LogTailer tailer = tailer(TailerConfig.builder()
                .withLogPath(LOG)
                .withCatchUp(true)
                .withCatchUpWindowBytes(4)
                .build());
        tailer.start();

        assertEquals(List.of("6789"), listener.chunks);
        assertEquals(10, tailer.position().offset());
    }

    @Test
    void catchUpOnSmallFileDeliversWholeFile() {
        file.append("short");
        LogTailer tailer = tailer(TailerConfig.builder().withLogPath(LOG).withCatchUp(true).build());
        tailer.start();

        assertEquals("short", listener.joined());
    }

    @Test
    void missingFileIsSilentUntilItAppears() {
        LogTailer tailer = tailer();
        tailer.start();
        tailer.poll();

        assertNull(tailer.position());
        assertTrue(listener.chunks.isEmpty());
        assertTrue(sink.getAllEvents().isEmpty());

        file.append("first\n");
        tailer.poll();

        assertEquals("first\n", listener.joined());
    }

    @Test
    void truncationResetsAndRereadsFromStart() {
        file.append("a long first session\n");
        LogTailer tailer = tailer();
        tailer.start();

        file.truncate("fresh\n");
        tailer.poll();

        assertEquals(List.of(ResetReason.TRUNCATION), listener.resets);
        assertEquals(List.of(ResetReason.TRUNCATION, "fresh\n"), listener.timeline);
        assertEquals(6, tailer.position().offset());
        assertTrue(sink.hasEventOfType(TailerResetEvent.class));
    }

    @Test
    void rotationResetsToOffsetZero() {
        file.append("session one\n");
        LogTailer tailer = tailer();
        tailer.start();

        // Larger than the consumed offset, so only the identity change reveals it.
        file.rotate("session two is longer\n");
        tailer.poll();

        assertEquals(List.of(ResetReason.ROTATION), listener.resets);
        assertEquals("session two is longer\n", listener.joined());
        TailerResetEvent event = sink.eventsOfType(TailerResetEvent.class).get(0);
        assertEquals(ResetReason.ROTATION, event.reason());
        assertEquals(12, event.previousOffset());
    }

    @Test
    void ioFailureIsReportedAndPollingContinues() {
        file.append("x");
        LogTailer tailer = tailer();
        tailer.start();

        file.failNextStat(new IOException("permission denied"));
        tailer.poll();
        file.append("y");
        tailer.poll();

        List<IngestErrorEvent> errors = sink.eventsOfType(IngestErrorEvent.class);
        assertEquals(1, errors.size());
        assertEquals("LogTailer", errors.get(0).component());
        assertEquals("y", listener.joined());
    }

    @Test
    void uncheckedStatFailureIsReportedAndTickingContinues() {
        file.append("");
        LogTailer tailer = tailer();
        tailer.start();

        file.failNextStat(new UncheckedIOException(new IOException("stale handle")));
        clock.advanceMillis(500);
        scheduler.runDueTasks();

        assertEquals(1, scheduler.pendingCount());
        file.append("after\n");
        clock.advanceMillis(500);
        scheduler.runDueTasks();

        assertEquals("after\n", listener.joined());
        List<IngestErrorEvent> errors = sink.eventsOfType(IngestErrorEvent.class);
        assertEquals(1, errors.size());
        assertTrue(errors.get(0).cause() instanceof UncheckedIOException);
    }

    @Test
    void uncheckedReadFailureKeepsOffsetForRetry() {
        file.append("");
        LogTailer tailer = tailer();
        tailer.start();

        file.append("line\n");
        file.failNextRead(new SecurityException("read denied"));
        tailer.poll();

        assertTrue(listener.chunks.isEmpty());
        assertEquals(0, tailer.position().offset());
        assertTrue(sink.eventsOfType(IngestErrorEvent.class).get(0).cause() instanceof SecurityException);

        tailer.poll();
        assertEquals("line\n", listener.joined());
    }

    @Test
    void splitCodePointIsCarriedIntoNextChunk() {
        file.append("");
        LogTailer tailer = tailer();
        tailer.start();

        byte[] euro = "€".getBytes(StandardCharsets.UTF_8);
        file.append(Arrays.copyOfRange(euro, 0, 2));
        tailer.poll();
        assertTrue(listener.chunks.isEmpty());

        file.append(Arrays.copyOfRange(euro, 2, 3));
        tailer.poll();
        assertEquals("€", listener.joined());
    }

    @Test
    void scheduledTicksPollAtConfiguredInterval() {
        file.append("");
        LogTailer tailer = tailer(TailerConfig.builder()
                .withLogPath(LOG)
                .withPollInterval(Duration.ofMillis(250))
                .build());
        tailer.start();
        file.append("tick\n");

        clock.advanceMillis(100);
        scheduler.runDueTasks();
        assertTrue(listener.chunks.isEmpty());

        clock.advanceMillis(150);
        scheduler.runDueTasks();
        assertEquals("tick\n", listener.joined());

        file.append("again\n");
        clock.advance(Duration.ofMillis(250));
        scheduler.runDueTasks();
        assertEquals("tick\nagain\n", listener.joined());
    }

    @Test
    void stopIsIdempotentAndEndsDelivery() {
        file.append("");
        LogTailer tailer = tailer();
        tailer.start();

        tailer.stop();
        tailer.stop();

        assertEquals(List.of(ResetReason.RESTART), listener.resets);
        assertNull(tailer.position());
        assertFalse(tailer.isRunning());

        file.append("late\n");
        tailer.poll();
        clock.advanceMillis(1_000);
        scheduler.runDueTasks();
        assertTrue(listener.chunks.isEmpty());
        assertEquals(0, scheduler.pendingCount());
    }
}
