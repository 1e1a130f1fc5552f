package com.delta.urlscout.crawl.model;

public record SitemapUrlEntry(
    String url,
    String lastmod,
    String sitemapUrl
) {
}
