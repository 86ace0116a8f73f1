package com.questrail.arena.ingest.config;

/**
 * Limits applied while collecting multi-line JSON. {@code maxJsonLines} caps
 * how many continuation lines a single unbalanced block may consume.
 */
public record BlockExtractionPolicy(int maxJsonLines) {

    public BlockExtractionPolicy {
        if (maxJsonLines <= 0) {
            throw new IllegalArgumentException("maxJsonLines must be positive");
        }
    }

    public static BlockExtractionPolicy defaults() {
        return new BlockExtractionPolicy(200);
    }
}
