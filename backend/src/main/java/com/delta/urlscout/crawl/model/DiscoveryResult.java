package com.delta.urlscout.crawl.model;

import com.delta.urlscout.crawl.phase.PhaseStats;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record DiscoveryResult(
    String runId,
    String baseUrl,
    String baseDomain,
    Instant startedAt,
    Instant finishedAt,
    DiscoveryState state,
    int totalUrls,
    int outOfScopeUrls,
    List<DiscoveredUrl> urls,
    List<PhaseStats> phaseStats,
    Map<String, Integer> discoveryStats,
    int llmKeywordsGenerated,
    Map<String, HostCrawlState> hosts,
    String terminationReason,
    double discoveryTimeSeconds
) {
    public List<String> urlsFoundBy(String phase) {
        return urls.stream()
            .filter(url -> url.phases().contains(phase))
            .map(DiscoveredUrl::url)
            .toList();
    }
}
