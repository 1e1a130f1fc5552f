package com.delta.urlscout.crawl.phase;

import com.delta.urlscout.config.CrawlerProperties;
import com.delta.urlscout.crawl.archive.ArchiveSource;
import com.delta.urlscout.crawl.extract.ExtractedLinks;
import com.delta.urlscout.crawl.extract.ExtractionMode;
import com.delta.urlscout.crawl.frontier.AdmitResult;
import com.delta.urlscout.crawl.frontier.CandidateUrl;
import com.delta.urlscout.crawl.frontier.Frontier;
import com.delta.urlscout.crawl.frontier.ScopeRule;
import com.delta.urlscout.crawl.http.Fetcher;
import com.delta.urlscout.crawl.model.HttpFetchResult;
import com.delta.urlscout.crawl.robots.RobotsTxtService;
import com.delta.urlscout.crawl.sitemap.SitemapService;
import com.delta.urlscout.crawl.suggest.Suggestion;
import com.delta.urlscout.crawl.suggest.SuggestionPrompt;
import org.jsoup.Jsoup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.ExecutorService;

/**
 * Per-phase view of a run: shared session state plus this phase's counters. Fetches and admits
 * made through the context are attributed to the phase.
 */
public class PhaseContext {
    private static final Logger log = LoggerFactory.getLogger(PhaseContext.class);
    private static final int SOFT_404_MIN_BODY_LENGTH = 200;
    private static final List<String> SOFT_404_TITLE_MARKERS = List.of(
        "404", "not found", "page not found", "ページが見つかりません"
    );

    private final DiscoverySession session;
    private final String phase;
    private final PhaseStatsCollector stats;

    public PhaseContext(DiscoverySession session, String phase) {
        this.session = session;
        this.phase = phase;
        this.stats = new PhaseStatsCollector(phase);
    }

    public String phase() {
        return phase;
    }

    public PhaseStatsCollector stats() {
        return stats;
    }

    public Frontier frontier() {
        return session.frontier();
    }

    public ScopeRule scope() {
        return session.frontier().scopeRule();
    }

    public CrawlerProperties properties() {
        return session.properties();
    }

    public SitemapService sitemapService() {
        return session.sitemapService();
    }

    public RobotsTxtService robotsTxtService() {
        return session.robotsTxtService();
    }

    public List<ArchiveSource> archiveSources() {
        return session.archiveSources();
    }

    public ExecutorService crawlExecutor() {
        return session.crawlExecutor();
    }

    public Clock clock() {
        return session.clock();
    }

    public Set<String> processedSitemaps() {
        return session.processedSitemaps();
    }

    public String rootUrl() {
        return scope().rootUrl();
    }

    /**
     * {@code scheme://authority} of the base URL, without a trailing slash.
     */
    public String origin() {
        URI uri = URI.create(rootUrl());
        return uri.getScheme() + "://" + uri.getRawAuthority();
    }

    public String domain() {
        return scope().registrableDomain();
    }

    public boolean shouldStop() {
        return Thread.currentThread().isInterrupted() || session.budget().isExhausted(session.frontier());
    }

    public AdmitResult admit(String rawUrl, String sourceUrl) {
        AdmitResult result = session.frontier().admit(rawUrl, sourceUrl, phase);
        stats.recordAdmit(result);
        return result;
    }

    public AdmitResult admit(String rawUrl, String sourceUrl, int depth) {
        AdmitResult result = session.frontier().admit(
            new CandidateUrl(rawUrl, sourceUrl, phase, depth, session.clock().instant())
        );
        stats.recordAdmit(result);
        return result;
    }

    public HttpFetchResult get(String url) {
        return get(url, Fetcher.HTML_ACCEPT);
    }

    public HttpFetchResult get(String url, String accept) {
        if (!session.robotsTxtService().isAllowed(url)) {
            return blockedByRobots(url);
        }
        return recordFetch(url, session.fetcher().get(url, accept));
    }

    public HttpFetchResult head(String url) {
        if (!session.robotsTxtService().isAllowed(url)) {
            return blockedByRobots(url);
        }
        return recordFetch(url, session.fetcher().head(url));
    }

    public HttpFetchResult postForm(String url, String formBody) {
        if (!session.robotsTxtService().isAllowed(url)) {
            return blockedByRobots(url);
        }
        return recordFetch(url, session.fetcher().postForm(url, formBody, Fetcher.HTML_ACCEPT));
    }

    /**
     * Existence check: HEAD, or GET when the server does not support HEAD. Redirects to the site
     * root and error pages served with 200 count as missing.
     */
    public ProbeResult probe(String url) {
        HttpFetchResult fetch = head(url);
        if (fetch.statusCode() == 405 || fetch.statusCode() == 501) {
            fetch = get(url);
        }
        if (!fetch.isSuccessful()) {
            return new ProbeResult(url, false, false, fetch);
        }
        boolean soft404 = isSoft404(url, fetch);
        return new ProbeResult(url, !soft404, soft404, fetch);
    }

    public Set<String> extractLinks(HttpFetchResult fetch, ExtractionMode mode) {
        if (fetch == null || !fetch.isSuccessful() || fetch.body() == null) {
            return Set.of();
        }
        ExtractedLinks links = session.linkExtractor().extractLinks(
            fetch.body(),
            fetch.contentType(),
            fetch.finalUrlOrRequested(),
            mode
        );
        stats.recordParseErrors(links.parseErrors());
        return links.urls();
    }

    public Suggestion suggest(SuggestionPrompt prompt) {
        Suggestion suggestion = session.suggestionService().suggest(prompt);
        stats.recordSuggestion(suggestion);
        return suggestion;
    }

    boolean isSoft404(String requestedUrl, HttpFetchResult fetch) {
        String finalUrl = fetch.finalUrlOrRequested();
        if (finalUrl != null && !sameUrl(finalUrl, requestedUrl) && isSiteRoot(finalUrl) && !isSiteRoot(requestedUrl)) {
            return true;
        }
        String body = fetch.body();
        // HEAD responses carry no body
        if (body == null || body.isEmpty()) {
            return false;
        }
        if (body.strip().length() < SOFT_404_MIN_BODY_LENGTH) {
            return true;
        }
        String contentType = fetch.contentType() == null ? "" : fetch.contentType().toLowerCase(Locale.ROOT);
        if (!contentType.isEmpty() && !contentType.contains("html")) {
            return false;
        }
        String title = Jsoup.parse(body).title().toLowerCase(Locale.ROOT);
        for (String marker : SOFT_404_TITLE_MARKERS) {
            if (title.contains(marker)) {
                return true;
            }
        }
        return false;
    }

    private boolean isSiteRoot(String url) {
        try {
            URI uri = URI.create(url);
            String path = uri.getRawPath();
            return (path == null || path.isEmpty() || "/".equals(path)) && uri.getRawQuery() == null;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    private boolean sameUrl(String left, String right) {
        return stripSlash(left).equalsIgnoreCase(stripSlash(right));
    }

    private static String stripSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    private HttpFetchResult recordFetch(String url, HttpFetchResult fetch) {
        stats.recordFetch(fetch);
        if (fetch.statusCode() > 0) {
            session.frontier().recordStatus(url, fetch.statusCode());
        }
        return fetch;
    }

    private HttpFetchResult blockedByRobots(String url) {
        log.debug("Skipping url disallowed by robots phase={} url={}", phase, url);
        return new HttpFetchResult(
            url,
            null,
            0,
            null,
            null,
            null,
            null,
            Instant.now(),
            Duration.ZERO,
            "blocked_by_robots",
            "disallowed by robots.txt",
            0
        );
    }
}
