package com.questrail.arena.ingest.telemetry;

import java.util.List;

/**
 * Cards swapped before {@code game}. Each list repeats a grpId once per copy.
 */
public record SideboardChange(int game, List<Integer> boardedIn, List<Integer> boardedOut) {
    public SideboardChange {
        boardedIn = List.copyOf(boardedIn);
        boardedOut = List.copyOf(boardedOut);
    }
}
