package com.questrail.arena.ingest.tail;

import java.util.Objects;

/**
 * Byte offset already consumed from the file with the given identity.
 */
public record LogPosition(long offset, FileIdentity fileIdentity) {
    public LogPosition {
        Objects.requireNonNull(fileIdentity, "fileIdentity");
        if (offset < 0) {
            throw new IllegalArgumentException("offset must be >= 0");
        }
    }

    public LogPosition withOffset(long newOffset) {
        return new LogPosition(newOffset, fileIdentity);
    }
}
