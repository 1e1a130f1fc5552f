package com.delta.urlscout.crawl.api;

import java.util.List;

public record DiscoveryApiRunRequest(
    String baseUrl,
    Integer maxPages,
    List<String> phases
) {
}
