package com.questrail.arena.ingest.tail;

/**
 * Why the tailer discarded its position. Every reason obliges downstream
 * consumers to drop buffered text and decode context.
 */
public enum ResetReason {
    /** The path now refers to a different file. */
    ROTATION,
    /** The file shrank below the consumed offset. */
    TRUNCATION,
    /** The tailer was stopped. */
    RESTART
}
