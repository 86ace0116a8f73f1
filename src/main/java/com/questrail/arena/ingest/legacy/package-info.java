/**
 * Match history and collection import from whole log blocks.
 *
 * <p>Older than the event pipeline and much coarser: it reports only finished
 * matches with a result, plus the last card collection seen.</p>
 */
package com.questrail.arena.ingest.legacy;
