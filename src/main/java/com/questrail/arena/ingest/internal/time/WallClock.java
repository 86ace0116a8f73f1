package com.questrail.arena.ingest.internal.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * Wall-clock source for human-readable timestamps (match start/end in
 * telemetry summaries). Never used to gate polling or rate limiting.
 */
public interface WallClock
{
    Instant now();
}
