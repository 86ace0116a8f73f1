/**
 * Decoding of log blocks into typed game events.
 *
 * <p>{@link com.questrail.arena.ingest.events.EventExtractor} is stateless; everything it
 * needs to remember between blocks (zone table, instance identities, the id-remap chain,
 * last-known life and turn position) lives in an
 * {@link com.questrail.arena.ingest.events.ExtractionContext} owned by the caller.</p>
 */
package com.questrail.arena.ingest.events;
