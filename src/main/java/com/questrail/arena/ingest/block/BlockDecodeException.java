package com.questrail.arena.ingest.block;

/**
 * Thrown when collected text is not a usable JSON object.
 *
 * <p>{@link BlockExtractor} catches it and drops the block; it never escapes
 * the extraction of a batch.</p>
 */
public class BlockDecodeException extends RuntimeException {
    public BlockDecodeException(String message) {
        super(message);
    }

    public BlockDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
