package com.questrail.arena.ingest.observability;

import java.time.Instant;

/**
 * Record describing a failed remote card lookup.
 */
public record RemoteLookupFailureEvent(
    Instant timestamp,
    int grpId,
    Throwable cause
) {
}
