package com.delta.urlscout.crawl.model;

import java.util.List;

/**
 * One discovery run. {@code maxPages} and {@code phases} fall back to the configured values when
 * {@code null}; an empty phase list means every phase.
 */
public record DiscoveryRequest(
    String baseUrl,
    Integer maxPages,
    List<String> phases
) {
    public DiscoveryRequest {
        phases = phases == null ? List.of() : List.copyOf(phases);
    }
}
