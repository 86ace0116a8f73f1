/**
 * Per-match action log and summary, flushed in batches.
 */
package com.questrail.arena.ingest.telemetry;
