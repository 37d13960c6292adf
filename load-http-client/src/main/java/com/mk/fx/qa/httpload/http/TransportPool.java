package com.mk.fx.qa.httpload.http;

import lombok.extern.slf4j.Slf4j;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClientBuilder;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.http.HeaderElements;
import org.apache.hc.core5.http.HttpHeaders;
import org.apache.hc.core5.io.CloseMode;
import org.apache.hc.core5.util.TimeValue;
import org.apache.hc.core5.util.Timeout;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.LongAdder;
import java.util.function.DoubleSupplier;

/**
 * Holds the two pre-built HTTP clients used for a run and picks one of them per request.
 *
 * <p>The {@link TransportKind#KEEP_ALIVE} client reuses connections from a bounded pool and evicts
 * them once idle for {@link TransportSettings#idleTimeout()}. The {@link TransportKind#NO_KEEP_ALIVE}
 * client sends {@code Connection: close} and never returns a connection to its pool, so every
 * exchange opens a fresh connection.
 *
 * <p>Both clients are immutable after construction and are shared by all workers. Neither retries
 * failed requests. Connect, lease and socket inactivity are bounded by the request timeout, and the
 * pool's {@link RequestDeadline} bounds each exchange as a whole.
 */
@Slf4j
public final class TransportPool implements AutoCloseable {

    private final CloseableHttpClient keepAliveClient;
    private final CloseableHttpClient noKeepAliveClient;
    private final RequestDeadline deadline;
    private final double keepAliveRatio;
    private final DoubleSupplier draw;
    private final Map<TransportKind, LongAdder> selections = new EnumMap<>(TransportKind.class);

    TransportPool(
            CloseableHttpClient keepAliveClient,
            CloseableHttpClient noKeepAliveClient,
            RequestDeadline deadline,
            double keepAliveRatio,
            DoubleSupplier draw) {
        this.keepAliveClient = Objects.requireNonNull(keepAliveClient, "keepAliveClient");
        this.noKeepAliveClient = Objects.requireNonNull(noKeepAliveClient, "noKeepAliveClient");
        this.deadline = Objects.requireNonNull(deadline, "deadline");
        this.keepAliveRatio = validateRatio(keepAliveRatio);
        this.draw = Objects.requireNonNull(draw, "draw");
        for (TransportKind kind : TransportKind.values()) {
            selections.put(kind, new LongAdder());
        }
    }

    /**
     * Builds both clients.
     *
     * @param settings timeouts and pool bounds shared by both clients
     * @param keepAliveRatio probability in {@code [0.0, 1.0]} that a request uses the keep-alive client
     * @return a pool ready to be shared by all workers
     * @throws IllegalArgumentException if the ratio is outside {@code [0.0, 1.0]}
     */
    public static TransportPool create(TransportSettings settings, double keepAliveRatio) {
        Objects.requireNonNull(settings, "settings");
        validateRatio(keepAliveRatio);

        var keepAlive = baseBuilder(settings)
                .evictIdleConnections(TimeValue.ofMilliseconds(settings.idleTimeout().toMillis()))
                .build();

        var noKeepAlive = baseBuilder(settings)
                .setConnectionReuseStrategy((request, response, context) -> false)
                .addRequestInterceptorFirst((request, entity, context) ->
                        request.setHeader(HttpHeaders.CONNECTION, HeaderElements.CLOSE))
                .build();

        log.info(
                "Transport pool initialised - keep-alive ratio: {}, request timeout: {}, max connections: {}, idle timeout: {}",
                keepAliveRatio,
                settings.requestTimeout(),
                settings.maxConnections(),
                settings.idleTimeout());

        return new TransportPool(
                keepAlive,
                noKeepAlive,
                new RequestDeadline(settings.requestTimeout()),
                keepAliveRatio,
                () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * Draws the transport for one request. Each call is an independent Bernoulli trial with
     * probability {@code keepAliveRatio} of returning {@link TransportKind#KEEP_ALIVE}.
     */
    public TransportKind select() {
        var kind = draw.getAsDouble() < keepAliveRatio ? TransportKind.KEEP_ALIVE : TransportKind.NO_KEEP_ALIVE;
        selections.get(kind).increment();
        return kind;
    }

    /** Returns the client backing the given transport kind. */
    public CloseableHttpClient client(TransportKind kind) {
        Objects.requireNonNull(kind, "kind");
        return kind == TransportKind.KEEP_ALIVE ? keepAliveClient : noKeepAliveClient;
    }

    /** Total deadline shared by both clients; see {@link RequestExecutor#execute}. */
    public RequestDeadline deadline() {
        return deadline;
    }

    public double keepAliveRatio() {
        return keepAliveRatio;
    }

    /** Number of times {@link #select()} returned the given kind. */
    public long selectionCount(TransportKind kind) {
        return selections.get(kind).sum();
    }

    @Override
    public void close() {
        keepAliveClient.close(CloseMode.GRACEFUL);
        noKeepAliveClient.close(CloseMode.GRACEFUL);
        deadline.close();
        log.debug(
                "Transport pool closed - keep-alive selections: {}, no-keep-alive selections: {}",
                selectionCount(TransportKind.KEEP_ALIVE),
                selectionCount(TransportKind.NO_KEEP_ALIVE));
    }

    private static HttpClientBuilder baseBuilder(TransportSettings settings) {
        var timeout = Timeout.ofMilliseconds(settings.requestTimeout().toMillis());

        var connectionManager = PoolingHttpClientConnectionManagerBuilder.create()
                .setMaxConnTotal(settings.maxConnections())
                .setMaxConnPerRoute(settings.maxConnections())
                .setDefaultConnectionConfig(ConnectionConfig.custom()
                        .setConnectTimeout(timeout)
                        .setSocketTimeout(timeout)
                        .build())
                .build();

        return HttpClients.custom()
                .setConnectionManager(connectionManager)
                .setDefaultRequestConfig(RequestConfig.custom()
                        .setConnectionRequestTimeout(timeout)
                        .setResponseTimeout(timeout)
                        .build())
                .disableAutomaticRetries();
    }

    private static double validateRatio(double ratio) {
        if (Double.isNaN(ratio) || ratio < 0.0 || ratio > 1.0) {
            throw new IllegalArgumentException("keepAliveRatio must be between 0.0 and 1.0, was " + ratio);
        }
        return ratio;
    }
}
