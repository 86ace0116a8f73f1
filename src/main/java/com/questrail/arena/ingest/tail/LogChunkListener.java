package com.questrail.arena.ingest.tail;

/**
 * Receives decoded text appended to the log, in file order.
 */
public interface LogChunkListener {

    /**
     * Newly appended text, decoded as UTF-8. A chunk never splits a code point
     * but may split a line or a JSON block.
     */
    void onChunk(String text);

    /**
     * The tailer discarded its position; everything derived from earlier chunks
     * is stale. Called before any chunk of the replacement content.
     */
    void onReset(ResetReason reason);
}
