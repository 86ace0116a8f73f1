package com.questrail.arena.ingest.observability;

import java.time.Instant;

/**
 * Record describing a listener that threw during dispatch.
 */
public record ListenerFailureEvent(
    Instant timestamp,
    String channel,
    Object listener,
    Throwable cause
) {
}
