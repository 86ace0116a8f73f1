/**
 * Log tailing.
 *
 * <p>{@link com.questrail.arena.ingest.tail.LogTailer} owns the byte offset and file
 * identity for one log path and turns file growth into text chunks. It knows nothing
 * about the content; rotation and truncation are surfaced as
 * {@link com.questrail.arena.ingest.tail.ResetReason}s so downstream buffers and decode
 * context can be discarded.</p>
 */
package com.questrail.arena.ingest.tail;
