package com.delta.urlscout.crawl.model;

import java.time.Instant;

public record HostCrawlState(
    String host,
    int requests,
    int retriedRequests,
    int failedRequests,
    int rateLimitedResponses,
    String lastErrorCategory,
    Instant lastRequestAt
) {
}
