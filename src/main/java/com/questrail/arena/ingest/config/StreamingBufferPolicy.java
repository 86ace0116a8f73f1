package com.questrail.arena.ingest.config;

/**
 * Bounds for the streaming block buffer. Once the buffer grows past
 * {@code trimThreshold} characters only the last {@code retainedChars}
 * are kept.
 */
public record StreamingBufferPolicy(int trimThreshold, int retainedChars) {

    public StreamingBufferPolicy {
        if (retainedChars <= 0) {
            throw new IllegalArgumentException("retainedChars must be positive");
        }
        if (trimThreshold <= retainedChars) {
            throw new IllegalArgumentException("trimThreshold must exceed retainedChars");
        }
    }

    public static StreamingBufferPolicy defaults() {
        return new StreamingBufferPolicy(500_000, 250_000);
    }
}
