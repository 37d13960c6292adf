package com.mk.fx.qa.httpload.http;

/** The two client configurations held by a {@link TransportPool}. */
public enum TransportKind {
    /** Persistent connections reused from a bounded idle pool. */
    KEEP_ALIVE,
    /** A fresh connection per request, closed once the response is drained. */
    NO_KEEP_ALIVE
}
