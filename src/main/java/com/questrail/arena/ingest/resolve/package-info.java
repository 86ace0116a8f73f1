/**
 * Card Identity Resolution
 * =============================================================================
 *
 * <p>Maps the client's grpIds to card metadata through a chain of lookups,
 * cheapest first:</p>
 *
 * <ol>
 *   <li>in-memory cache</li>
 *   <li>the {@code grp_id_cache} table</li>
 *   <li>the card catalog's {@code arena_id} column</li>
 *   <li>the remote card service, spaced by
 *       {@link com.questrail.arena.ingest.resolve.RemoteCallGate}</li>
 *   <li>a placeholder</li>
 * </ol>
 *
 * <p>Storage is reached only through
 * {@link com.questrail.arena.ingest.resolve.QueryAdapter}; hits from the catalog
 * or the remote service are written back to {@code grp_id_cache}. Failures in
 * any layer fall through to the next and never reach the caller.</p>
 */
package com.questrail.arena.ingest.resolve;
