package com.questrail.arena.ingest.events;

import java.util.Locale;

/**
 * Starting life total by format name. Matching is a case-insensitive
 * substring test on the event id the player queued into.
 */
public final class StartingLife {

    public static final int STANDARD = 20;
    public static final int BRAWL = 25;
    public static final int COMMANDER = 40;

    private StartingLife() {
    }

    public static int forFormat(String format) {
        if (format == null) {
            return STANDARD;
        }
        String f = format.toLowerCase(Locale.ROOT);
        if (f.contains("brawl")) {
            return BRAWL;
        }
        if (f.contains("commander") || f.contains("edh")) {
            return COMMANDER;
        }
        return STANDARD;
    }
}
