package com.questrail.arena.ingest.observability;

import java.time.Instant;

/**
 * Record representing a reported, non-fatal error in the ingestion pipeline.
 */
public record IngestErrorEvent(
    Instant timestamp,
    String component,
    String message,
    Throwable cause
) {
}
