/**
 * Clock and scheduler abstractions.
 *
 * <p>Production code runs on {@link com.questrail.arena.ingest.internal.time.SystemMonotonicClock}
 * and {@link com.questrail.arena.ingest.internal.time.ScheduledExecutorScheduler}; tests
 * substitute a manually advanced clock and a scheduler that only runs due tasks on demand,
 * which makes poll cycles and remote-lookup spacing fully deterministic.</p>
 */
package com.questrail.arena.ingest.internal.time;
