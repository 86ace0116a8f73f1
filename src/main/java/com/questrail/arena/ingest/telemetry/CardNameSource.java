package com.questrail.arena.ingest.telemetry;

import java.util.Optional;

/**
 * Supplies display names for recorded card actions.
 */
@FunctionalInterface
public interface CardNameSource {
    Optional<String> nameOf(int grpId);

    static CardNameSource none() {
        return grpId -> Optional.empty();
    }
}
