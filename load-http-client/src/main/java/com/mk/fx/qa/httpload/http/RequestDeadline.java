package com.mk.fx.qa.httpload.http;

import lombok.extern.slf4j.Slf4j;
import org.apache.hc.core5.concurrent.Cancellable;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Total deadline of one exchange, body drain included. Socket and response timeouts only bound
 * inactivity; a server that keeps trickling bytes is stopped here.
 *
 * <p>One daemon scheduler thread is shared by all workers. When a deadline fires the request is
 * cancelled, which closes its connection; the blocked exchange then fails with an
 * {@link java.io.IOException} on the worker thread.
 */
@Slf4j
public final class RequestDeadline implements AutoCloseable {

    private final Duration timeout;
    private final ScheduledExecutorService scheduler;

    public RequestDeadline(Duration timeout) {
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        if (timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r);
            t.setName("request-deadline");
            t.setDaemon(true);
            return t;
        });
    }

    public Duration timeout() {
        return timeout;
    }

    /**
     * Arms the deadline for one request. The caller must cancel the returned handle once the
     * exchange is over.
     */
    public ScheduledFuture<?> arm(Cancellable request) {
        Objects.requireNonNull(request, "request");
        return scheduler.schedule(() -> {
            if (request.cancel()) {
                log.debug("Request cancelled after exceeding the {} deadline", timeout);
            }
        }, timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    @Override
    public void close() {
        scheduler.shutdownNow();
    }
}
