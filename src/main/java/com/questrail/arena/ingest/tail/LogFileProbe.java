package com.questrail.arena.ingest.tail;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * File-system seam used by {@link LogTailer}.
 */
public interface LogFileProbe {

    /**
     * @return the file's size and identity, or empty when the file does not exist
     * @throws IOException for any failure other than a missing file
     */
    Optional<LogFileStat> stat(Path path) throws IOException;

    /**
     * Reads up to {@code length} bytes starting at {@code offset}. Returns fewer
     * bytes only when the file ends first.
     */
    byte[] read(Path path, long offset, int length) throws IOException;
}
