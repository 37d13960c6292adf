package com.mk.fx.qa.httpload.http;

import java.time.Duration;
import java.util.Objects;

/**
 * Settings shared by both clients of a {@link TransportPool}.
 *
 * @param requestTimeout total time allowed for one exchange, body drain included; also bounds
 *     connect, connection lease and response inactivity
 * @param maxConnections upper bound of pooled connections per client
 * @param idleTimeout idle time after which pooled keep-alive connections are evicted
 */
public record TransportSettings(Duration requestTimeout, int maxConnections, Duration idleTimeout) {

    public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(10);
    public static final int DEFAULT_MAX_CONNECTIONS = 100;
    public static final Duration DEFAULT_IDLE_TIMEOUT = Duration.ofSeconds(30);

    public TransportSettings {
        Objects.requireNonNull(requestTimeout, "requestTimeout");
        Objects.requireNonNull(idleTimeout, "idleTimeout");
        if (requestTimeout.isZero() || requestTimeout.isNegative()) {
            throw new IllegalArgumentException("requestTimeout must be positive");
        }
        if (maxConnections < 1) {
            throw new IllegalArgumentException("maxConnections must be >= 1");
        }
    }

    public static TransportSettings defaults() {
        return new TransportSettings(DEFAULT_REQUEST_TIMEOUT, DEFAULT_MAX_CONNECTIONS, DEFAULT_IDLE_TIMEOUT);
    }
}
