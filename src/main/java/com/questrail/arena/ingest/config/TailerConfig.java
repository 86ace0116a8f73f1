package com.questrail.arena.ingest.config;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * TailerConfig
 * -----------------------------------------------------------------------------
 * Operational configuration for the log tailer.
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>logPath</b>: the client's log file. It may not exist yet; the
 *       tailer keeps polling until it appears.</li>
 *   <li><b>pollInterval</b>: spacing between poll ticks.</li>
 *   <li><b>catchUp</b>: when set, start-up reads a trailing window of the
 *       existing file instead of seeking to its end, so a match already in
 *       progress can be reconstructed.</li>
 *   <li><b>catchUpWindowBytes</b>: upper bound on that trailing read.</li>
 * </ul>
 */
public record TailerConfig(
        Path logPath,
        Duration pollInterval,
        boolean catchUp,
        int catchUpWindowBytes
) {
    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofMillis(500);
    public static final int DEFAULT_CATCH_UP_WINDOW_BYTES = 5 * 1024 * 1024;

    public TailerConfig {
        Objects.requireNonNull(logPath, "logPath");
        Objects.requireNonNull(pollInterval, "pollInterval");

        if (pollInterval.isNegative() || pollInterval.isZero()) {
            throw new IllegalArgumentException("pollInterval must be positive");
        }
        if (catchUpWindowBytes <= 0) {
            throw new IllegalArgumentException("catchUpWindowBytes must be positive");
        }
    }

    /**
     * Tails {@code logPath} from its current end with a 500 ms poll interval.
     */
    public static TailerConfig defaults(Path logPath) {
        return new TailerConfig(logPath, DEFAULT_POLL_INTERVAL, false, DEFAULT_CATCH_UP_WINDOW_BYTES);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Path logPath;
        private Duration pollInterval = DEFAULT_POLL_INTERVAL;
        private boolean catchUp = false;
        private int catchUpWindowBytes = DEFAULT_CATCH_UP_WINDOW_BYTES;

        public Builder withLogPath(Path logPath) {
            this.logPath = logPath;
            return this;
        }

        public Builder withPollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
            return this;
        }

        public Builder withCatchUp(boolean catchUp) {
            this.catchUp = catchUp;
            return this;
        }

        public Builder withCatchUpWindowBytes(int catchUpWindowBytes) {
            this.catchUpWindowBytes = catchUpWindowBytes;
            return this;
        }

        public TailerConfig build() {
            return new TailerConfig(logPath, pollInterval, catchUp, catchUpWindowBytes);
        }
    }
}
