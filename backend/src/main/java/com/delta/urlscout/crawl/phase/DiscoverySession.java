package com.delta.urlscout.crawl.phase;

import com.delta.urlscout.config.CrawlerProperties;
import com.delta.urlscout.crawl.archive.ArchiveSource;
import com.delta.urlscout.crawl.extract.LinkExtractor;
import com.delta.urlscout.crawl.frontier.Frontier;
import com.delta.urlscout.crawl.http.Fetcher;
import com.delta.urlscout.crawl.robots.RobotsTxtService;
import com.delta.urlscout.crawl.sitemap.SitemapService;
import com.delta.urlscout.crawl.suggest.SuggestionService;

import java.time.Clock;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;

/**
 * State and collaborators shared by all phases of one run.
 */
public record DiscoverySession(
    String runId,
    Frontier frontier,
    DiscoveryBudget budget,
    CrawlerProperties properties,
    Fetcher fetcher,
    LinkExtractor linkExtractor,
    SuggestionService suggestionService,
    RobotsTxtService robotsTxtService,
    SitemapService sitemapService,
    List<ArchiveSource> archiveSources,
    ExecutorService crawlExecutor,
    Clock clock,
    Set<String> processedSitemaps
) {
}
