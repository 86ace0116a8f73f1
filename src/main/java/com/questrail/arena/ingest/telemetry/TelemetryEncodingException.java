package com.questrail.arena.ingest.telemetry;

/**
 * A telemetry batch could not be serialized.
 */
public class TelemetryEncodingException extends RuntimeException {
    public TelemetryEncodingException(String message) {
        super(message);
    }

    public TelemetryEncodingException(String message, Throwable cause) {
        super(message, cause);
    }
}
