package com.questrail.arena.ingest.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for poll cadence and remote-lookup spacing.
 *
 * <h2>Binding invariant</h2>
 * Anything that gates behavior on elapsed time (the tailer's poll cycle, the
 * resolver's minimum interval between remote calls) MUST read this clock.
 * Wall-clock time is used only for telemetry timestamps, see {@link WallClock}.
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds.
     * Values are only meaningful for elapsed time computations.
     */
    long nowNanos();
}
