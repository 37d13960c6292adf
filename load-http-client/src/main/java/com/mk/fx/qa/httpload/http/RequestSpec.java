package com.mk.fx.qa.httpload.http;

import java.util.Objects;

/**
 * Target URL and body of one request. Drawn fresh for every request and never shared.
 *
 * @param url absolute target URL
 * @param body request body sent as JSON text, empty when there is nothing to send
 */
public record RequestSpec(String url, String body) {

    public RequestSpec {
        Objects.requireNonNull(url, "url");
        body = body != null ? body : "";
    }
}
