package com.questrail.arena.ingest.config;

/**
 * Telemetry batching configuration. A periodic flush becomes due once
 * {@code flushIntervalTurns} turns have passed since the previous flush.
 */
public record TelemetryConfig(int flushIntervalTurns) {

    public TelemetryConfig {
        if (flushIntervalTurns <= 0) {
            throw new IllegalArgumentException("flushIntervalTurns must be positive");
        }
    }

    public static TelemetryConfig defaults() {
        return new TelemetryConfig(3);
    }
}
