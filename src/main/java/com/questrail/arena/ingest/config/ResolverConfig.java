package com.questrail.arena.ingest.config;

import java.net.URI;
import java.time.Duration;
import java.util.Objects;

/**
 * ResolverConfig
 * -----------------------------------------------------------------------------
 * Configuration for the card identity resolver's remote tier.
 *
 * <ul>
 *   <li><b>remoteMinInterval</b>: minimum spacing between two remote calls,
 *       across all ids.</li>
 *   <li><b>remoteBaseUri</b>: lookup endpoint; the numeric id is appended.</li>
 *   <li><b>userAgent</b>: sent with every remote request.</li>
 *   <li><b>requestTimeout</b>: per-request timeout for the HTTP client.</li>
 * </ul>
 */
public record ResolverConfig(
        Duration remoteMinInterval,
        URI remoteBaseUri,
        String userAgent,
        Duration requestTimeout
) {
    public ResolverConfig {
        Objects.requireNonNull(remoteMinInterval, "remoteMinInterval");
        Objects.requireNonNull(remoteBaseUri, "remoteBaseUri");
        Objects.requireNonNull(userAgent, "userAgent");
        Objects.requireNonNull(requestTimeout, "requestTimeout");

        if (remoteMinInterval.isNegative()) {
            throw new IllegalArgumentException("remoteMinInterval must be non-negative");
        }
        if (requestTimeout.isNegative() || requestTimeout.isZero()) {
            throw new IllegalArgumentException("requestTimeout must be positive");
        }
    }

    /**
     * <ul>
     *   <li>remoteMinInterval: 100ms</li>
     *   <li>remoteBaseUri: {@code https://api.scryfall.com/cards/arena/}</li>
     *   <li>requestTimeout: 10s</li>
     * </ul>
     */
    public static ResolverConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Duration remoteMinInterval = Duration.ofMillis(100);
        private URI remoteBaseUri = URI.create("https://api.scryfall.com/cards/arena/");
        private String userAgent = "arena-log-ingest/0.1";
        private Duration requestTimeout = Duration.ofSeconds(10);

        public Builder withRemoteMinInterval(Duration remoteMinInterval) {
            this.remoteMinInterval = remoteMinInterval;
            return this;
        }

        public Builder withRemoteBaseUri(URI remoteBaseUri) {
            this.remoteBaseUri = remoteBaseUri;
            return this;
        }

        public Builder withUserAgent(String userAgent) {
            this.userAgent = userAgent;
            return this;
        }

        public Builder withRequestTimeout(Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
            return this;
        }

        public ResolverConfig build() {
            return new ResolverConfig(remoteMinInterval, remoteBaseUri, userAgent, requestTimeout);
        }
    }
}
