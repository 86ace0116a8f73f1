package com.questrail.arena.ingest.events;

/**
 * Zone kinds as named by the game client's state messages.
 */
public enum ZoneType {
    HAND("ZoneType_Hand"),
    LIBRARY("ZoneType_Library"),
    BATTLEFIELD("ZoneType_Battlefield"),
    GRAVEYARD("ZoneType_Graveyard"),
    EXILE("ZoneType_Exile"),
    STACK("ZoneType_Stack"),
    COMMAND("ZoneType_Command"),
    LIMBO("ZoneType_Limbo"),
    /** Any zone type not listed above, or a zone id not yet seen. */
    UNKNOWN("unknown");

    private final String wireName;

    ZoneType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static ZoneType fromWireName(String name) {
        if (name != null) {
            for (ZoneType type : values()) {
                if (type.wireName.equals(name)) {
                    return type;
                }
            }
        }
        return UNKNOWN;
    }
}
