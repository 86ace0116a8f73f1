package com.questrail.arena.ingest.events;

import java.util.List;
import java.util.Objects;

/**
 * A zone as reported by one game-state message. {@code objectInstanceIds} is
 * empty when the message carried no membership list for the zone.
 */
public record GameZone(int zoneId, ZoneType type, int ownerSeatId, List<Integer> objectInstanceIds) {
    public GameZone {
        Objects.requireNonNull(type, "type");
        objectInstanceIds = List.copyOf(objectInstanceIds);
    }
}
