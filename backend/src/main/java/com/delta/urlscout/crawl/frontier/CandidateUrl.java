package com.delta.urlscout.crawl.frontier;

import java.time.Instant;

public record CandidateUrl(
    String rawUrl,
    String sourceUrl,
    String phase,
    int depth,
    Instant discoveredAt
) {
    public static CandidateUrl of(String rawUrl, String sourceUrl, String phase) {
        return new CandidateUrl(rawUrl, sourceUrl, phase, 0, Instant.now());
    }

    public static CandidateUrl of(String rawUrl, String sourceUrl, String phase, int depth) {
        return new CandidateUrl(rawUrl, sourceUrl, phase, depth, Instant.now());
    }
}
