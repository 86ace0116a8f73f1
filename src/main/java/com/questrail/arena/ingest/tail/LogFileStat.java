package com.questrail.arena.ingest.tail;

import java.util.Objects;

/**
 * Result of stat-ing the log file: its current size and identity.
 */
public record LogFileStat(long size, FileIdentity identity) {
    public LogFileStat {
        Objects.requireNonNull(identity, "identity");
    }
}
