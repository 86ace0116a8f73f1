package com.questrail.arena.ingest.tail;

import java.util.Objects;

/**
 * Opaque identity of a log file. Two stats of the same path that return
 * different identities mean the file was replaced (rotation).
 *
 * <p>On POSIX file systems the key is derived from the file key (device and
 * inode). Where the platform offers none, creation time stands in.</p>
 */
public record FileIdentity(String key) {
    public FileIdentity {
        Objects.requireNonNull(key, "key");
    }

    public static FileIdentity of(Object fileKey) {
        return new FileIdentity(String.valueOf(fileKey));
    }
}
