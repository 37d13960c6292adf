package com.mk.fx.qa.httpload.http;

import com.google.common.annotations.VisibleForTesting;
import lombok.extern.slf4j.Slf4j;
import org.apache.hc.client5.http.classic.methods.HttpUriRequestBase;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.core5.http.ContentType;
import org.apache.hc.core5.http.HttpHeaders;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.apache.hc.core5.http.io.entity.StringEntity;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Performs single HTTP exchanges and classifies their outcome. This implementation does not
 * include retry logic and never throws for a failed exchange: construction errors, transport
 * errors and exchanges cut off by the {@link RequestDeadline} are reported as
 * {@link ExchangeResult#noResponse()}.
 *
 * <p>Latency runs from the entry into the response handler to the end of the body drain. The
 * handler is entered as soon as the response head has been parsed, which stands in for the first
 * response byte.
 */
@Slf4j
public class RequestExecutor {

    /** Default value of the {@code User-Agent} header. */
    public static final String DEFAULT_USER_AGENT = "http-load-tester";

    /** RFC 9110 token characters allowed in a method name. */
    private static final Pattern METHOD_TOKEN = Pattern.compile("[!#$%&'*+\\-.^_`|~0-9A-Za-z]+");

    /** Value sent in the {@code User-Agent} header. */
    private final String userAgent;

    public RequestExecutor() {
        this(DEFAULT_USER_AGENT);
    }

    /**
     * @param userAgent value of the {@code User-Agent} header sent with every request
     */
    public RequestExecutor(String userAgent) {
        Objects.requireNonNull(userAgent, "userAgent");
        this.userAgent = userAgent.isBlank() ? DEFAULT_USER_AGENT : userAgent.trim();
    }

    /**
     * Executes one request and drains the response body.
     *
     * @param client the client selected for this request
     * @param deadline total deadline applied to the whole exchange
     * @param spec target URL and body
     * @param method HTTP method name, e.g. {@code POST}
     * @return the classified result; never {@code null}
     */
    public ExchangeResult execute(
            CloseableHttpClient client, RequestDeadline deadline, RequestSpec spec, String method) {
        Objects.requireNonNull(client, "client");
        Objects.requireNonNull(deadline, "deadline");
        Objects.requireNonNull(spec, "spec");

        HttpUriRequestBase request;
        try {
            request = buildRequest(spec, method);
        } catch (IllegalArgumentException e) {
            log.debug("Unable to build {} request to {}: {}", method, spec.url(), e.getMessage());
            return ExchangeResult.noResponse();
        }

        var timer = deadline.arm(request);
        try {
            return send(client, request);
        } finally {
            timer.cancel(false);
        }
    }

    private ExchangeResult send(CloseableHttpClient client, HttpUriRequestBase request) {
        try {
            return client.execute(request, response -> {
                var firstByteAt = System.nanoTime();
                EntityUtils.consume(response.getEntity());
                var latency = measure(firstByteAt, System.nanoTime());

                log.debug("{} {} completed in {} ms with status {}",
                        request.getMethod(), request.getRequestUri(), latency.toMillis(), response.getCode());
                return ExchangeResult.received(response.getCode(), latency);
            });
        } catch (IOException e) {
            log.debug("{} {} failed{}: {} - {}",
                    request.getMethod(),
                    request.getRequestUri(),
                    request.isCancelled() ? " after the request deadline" : "",
                    e.getClass().getSimpleName(),
                    e.getMessage());
            return ExchangeResult.noResponse();
        }
    }

    /**
     * Builds the request with the fixed headers and the JSON body.
     *
     * @throws IllegalArgumentException if the method is not a valid token or the URL cannot be parsed
     */
    @VisibleForTesting
    HttpUriRequestBase buildRequest(RequestSpec spec, String method) {
        if (method == null || !METHOD_TOKEN.matcher(method).matches()) {
            throw new IllegalArgumentException("Invalid HTTP method: " + method);
        }
        var uri = URI.create(spec.url());
        if (uri.getScheme() == null || uri.getHost() == null) {
            throw new IllegalArgumentException("URL must be absolute: " + spec.url());
        }

        var request = new HttpUriRequestBase(method, uri);
        request.setHeader(HttpHeaders.USER_AGENT, userAgent);
        request.setEntity(new StringEntity(spec.body(), ContentType.APPLICATION_JSON));
        return request;
    }

    /**
     * @param firstByteAt {@link System#nanoTime()} on entry into the response handler
     * @param completedAt {@link System#nanoTime()} after the body was drained
     */
    @VisibleForTesting
    static Duration measure(long firstByteAt, long completedAt) {
        return Duration.ofNanos(Math.max(0, completedAt - firstByteAt));
    }
}
