package com.delta.urlscout.crawl.model;

import java.time.Instant;
import java.util.List;

public record DiscoveryRunStatus(
    String runId,
    String baseUrl,
    DiscoveryState state,
    String currentPhase,
    List<String> completedPhases,
    int urlsFound,
    int pendingUrls,
    Instant startedAt,
    Instant finishedAt,
    String terminationReason,
    String statusUrl
) {
}
