package com.questrail.arena.ingest.observability;

import com.questrail.arena.ingest.tail.ResetReason;

import java.nio.file.Path;
import java.time.Instant;

/**
 * Record describing a tailer reset. {@code previousOffset} is the byte offset
 * that was discarded, or -1 when no position had been established.
 */
public record TailerResetEvent(
    Instant timestamp,
    Path path,
    ResetReason reason,
    long previousOffset
) {
}
