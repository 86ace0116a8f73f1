package com.questrail.arena.ingest.observability;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.questrail.arena.ingest.tail.ResetReason;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class Slf4jIngestObservabilitySinkTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    private final Slf4jIngestObservabilitySink sink = new Slf4jIngestObservabilitySink();
    private final Logger logger = (Logger) LoggerFactory.getLogger(Slf4jIngestObservabilitySink.class);
    private final ListAppender<ILoggingEvent> appender = new ListAppender<>();

    @BeforeEach
    void attach() {
        appender.start();
        logger.addAppender(appender);
    }

    @AfterEach
    void detach() {
        logger.detachAppender(appender);
        appender.stop();
    }

    private ILoggingEvent only() {
        assertEquals(1, appender.list.size());
        return appender.list.get(0);
    }

    @Test
    void resetIsInfoWithDiscardedOffset() {
        sink.onTailerReset(new TailerResetEvent(NOW, Path.of("Player.log"), ResetReason.ROTATION, 4096));

        ILoggingEvent event = only();
        assertEquals(Level.INFO, event.getLevel());
        assertTrue(event.getFormattedMessage().contains("ROTATION"));
        assertTrue(event.getFormattedMessage().contains("4096"));
    }

    @Test
    void resetWithoutPositionOmitsOffset() {
        sink.onTailerReset(new TailerResetEvent(NOW, Path.of("Player.log"), ResetReason.RESTART, -1));

        assertFalse(only().getFormattedMessage().contains("offset"));
    }

    @Test
    void listenerFailureIsWarnWithCause() {
        IllegalStateException cause = new IllegalStateException("boom");
        sink.onListenerFailure(new ListenerFailureEvent(NOW, "game-state", "listener", cause));

        ILoggingEvent event = only();
        assertEquals(Level.WARN, event.getLevel());
        assertTrue(event.getFormattedMessage().contains("game-state"));
        assertNotNull(event.getThrowableProxy());
    }

    @Test
    void remoteFailureIsWarn() {
        sink.onRemoteLookupFailure(new RemoteLookupFailureEvent(NOW, 68456, new IOException("timeout")));

        ILoggingEvent event = only();
        assertEquals(Level.WARN, event.getLevel());
        assertTrue(event.getFormattedMessage().contains("68456"));
    }

    @Test
    void errorIsLoggedAtErrorLevel() {
        sink.onError(new IngestErrorEvent(NOW, "LogTailer", "Poll failed", new IOException("denied")));

        ILoggingEvent event = only();
        assertEquals(Level.ERROR, event.getLevel());
        assertEquals("LogTailer: Poll failed", event.getFormattedMessage());
    }
}
