/**
 * Runtime Wiring
 * =============================================================================
 *
 * <p>{@link com.questrail.arena.ingest.runtime.ArenaLogWatcher} assembles the
 * pipeline and owns its lifecycle. Everything below it is single-purpose and
 * unaware of the other stages; this package is the only place where they meet.</p>
 *
 * <h2>Threading</h2>
 * <p>All pipeline state is confined to the scheduler thread that drives the
 * tailer. Callbacks run on that thread too and must not block.</p>
 */
package com.questrail.arena.ingest.runtime;
