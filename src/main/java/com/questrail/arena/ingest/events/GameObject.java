package com.questrail.arena.ingest.events;

import java.util.List;
import java.util.Objects;

/**
 * A card-like game object from a game-state message.
 *
 * <p>{@code name} is whatever the client sent; for most cards this is a
 * numeric localization id rather than a readable name, and it may be null.</p>
 */
public record GameObject(
        int instanceId,
        int grpId,
        int ownerSeatId,
        int controllerSeatId,
        int zoneId,
        String visibility,
        List<String> cardTypes,
        List<String> subtypes,
        String name
) {
    public GameObject {
        Objects.requireNonNull(visibility, "visibility");
        cardTypes = List.copyOf(cardTypes);
        subtypes = List.copyOf(subtypes);
    }

    /** True when {@code name} is present and not a bare localization id. */
    public boolean hasReadableName() {
        return name != null && !name.isBlank() && !name.chars().allMatch(Character::isDigit);
    }
}
