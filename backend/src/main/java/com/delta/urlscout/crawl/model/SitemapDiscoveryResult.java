package com.delta.urlscout.crawl.model;

import java.util.List;
import java.util.Map;

public record SitemapDiscoveryResult(
    List<String> fetchedSitemaps,
    List<SitemapUrlEntry> urls,
    Map<String, Integer> errors,
    int fetches,
    int parseErrors
) {
    public int errorCount(String key) {
        return errors.getOrDefault(key, 0);
    }
}
