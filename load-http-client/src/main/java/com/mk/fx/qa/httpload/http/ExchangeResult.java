package com.mk.fx.qa.httpload.http;

import java.time.Duration;

/**
 * Outcome of one HTTP exchange.
 *
 * @param success true when the status code is in {@code [200, 300)}
 * @param latency measured latency, {@link Duration#ZERO} when no response was received
 * @param statusCode response status, {@code 0} when no response was received
 * @param responded true when a response (of any status) was received
 */
public record ExchangeResult(boolean success, Duration latency, int statusCode, boolean responded) {

    private static final ExchangeResult NO_RESPONSE = new ExchangeResult(false, Duration.ZERO, 0, false);

    /** Result for a request that could not be built or whose exchange failed at transport level. */
    public static ExchangeResult noResponse() {
        return NO_RESPONSE;
    }

    /** Result for a received response; success is derived from the status code. */
    public static ExchangeResult received(int statusCode, Duration latency) {
        return new ExchangeResult(isSuccessful(statusCode), latency, statusCode, true);
    }

    static boolean isSuccessful(int statusCode) {
        return statusCode >= 200 && statusCode < 300;
    }
}
