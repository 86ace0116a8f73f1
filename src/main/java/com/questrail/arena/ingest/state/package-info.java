/**
 * Live match state.
 *
 * <p>{@link com.questrail.arena.ingest.state.GameStateEngine} folds decoded events
 * into an immutable {@link com.questrail.arena.ingest.state.GameStateSnapshot}: deck
 * remaining counts and draw odds, zone contents, life, turn position, mulligans and
 * the opponent's revealed cards. Subscribers receive a fresh snapshot after each
 * event.</p>
 */
package com.questrail.arena.ingest.state;
