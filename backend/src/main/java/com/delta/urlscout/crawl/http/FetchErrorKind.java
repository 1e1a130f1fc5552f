package com.delta.urlscout.crawl.http;

public enum FetchErrorKind {
    /** Timeouts, connection failures, 408, 429 and 5xx. Retried before being reported. */
    TRANSIENT,
    /** Other 4xx, DNS failures and malformed URLs. Never retried. */
    PERMANENT
}
