package com.delta.urlscout.crawl.model;

import java.time.Instant;
import java.util.List;

public record DiscoveredUrl(
    String url,
    List<String> phases,
    Instant firstSeenAt,
    String sourceUrl,
    int depth,
    Integer httpStatus
) {
}
