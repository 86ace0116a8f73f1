package com.questrail.arena.ingest.internal.time;

/**
 * Cancellable
 * =============================================================================
 * Handle returned for anything that can be withdrawn later: a scheduled poll
 * tick, or a state-change subscription.
 */
public interface Cancellable
{
    /**
     * Attempt to cancel.
     *
     * @return {@code true} if this call cancelled it; {@code false} if it had
     *         already run or was cancelled before.
     */
    boolean cancel();
}
