package com.delta.urlscout.crawl.phase;

import com.delta.urlscout.config.CrawlerProperties;
import com.delta.urlscout.crawl.extract.ExtractionMode;
import com.delta.urlscout.crawl.model.HttpFetchResult;
import com.delta.urlscout.crawl.model.SitemapDiscoveryResult;
import com.delta.urlscout.crawl.model.SitemapUrlEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

@Component
public class SitemapDiscoveryPhase implements DiscoveryPhase {
    private static final Logger log = LoggerFactory.getLogger(SitemapDiscoveryPhase.class);

    static final List<String> SITEMAP_PATHS = List.of(
        "/sitemap.xml",
        "/sitemap_index.xml",
        "/sitemaps.xml",
        "/wp-sitemap.xml",
        "/sitemap/sitemap.xml",
        "/news-sitemap.xml",
        "/page-sitemap.xml",
        "/post-sitemap.xml",
        "/product-sitemap.xml"
    );
    static final List<String> HTML_SITEMAP_PATHS = List.of(
        "/sitemap",
        "/sitemap.html",
        "/sitemap.htm",
        "/site-map"
    );

    @Override
    public String name() {
        return PhaseNames.SITEMAP;
    }

    @Override
    public PhaseStats run(PhaseContext context) {
        CrawlerProperties.Sitemap settings = context.properties().getSitemap();
        String origin = context.origin();

        Set<String> seeds = new LinkedHashSet<>();
        for (String path : SITEMAP_PATHS) {
            seeds.add(origin + path);
        }
        seeds.addAll(context.robotsTxtService().getRules(context.rootUrl()).getSitemapUrls());

        SitemapDiscoveryResult result = context.sitemapService().discover(
            new ArrayList<>(seeds),
            context.processedSitemaps(),
            settings.getMaxDepth(),
            settings.getMaxSitemaps(),
            settings.getMaxUrls(),
            context::shouldStop
        );
        recordSitemapOutcome(context, result);
        for (SitemapUrlEntry entry : result.urls()) {
            context.admit(entry.url(), entry.sitemapUrl(), 0);
        }
        log.info(
            "sitemap discovery sitemaps={} urls={} new={}",
            result.fetchedSitemaps().size(),
            result.urls().size(),
            context.stats().newUrls()
        );

        if (settings.isProbeHtmlSitemaps() && !context.shouldStop()) {
            List<String> htmlSitemaps = new ArrayList<>();
            for (String path : HTML_SITEMAP_PATHS) {
                htmlSitemaps.add(origin + path);
            }
            List<HtmlSitemapPage> pages = PageBatchFetcher.runAll(context, htmlSitemaps, url -> {
                HttpFetchResult fetch = context.get(url);
                return fetch.isSuccessful() && isHtml(fetch) ? new HtmlSitemapPage(url, fetch) : null;
            });
            for (HtmlSitemapPage page : pages) {
                if (context.scope().isInScope(page.fetch().finalUrlOrRequested()) && !context.isSoft404(page.url(), page.fetch())) {
                    context.admit(page.url(), null, 0);
                    for (String link : context.extractLinks(page.fetch(), ExtractionMode.STANDARD)) {
                        context.admit(link, page.url(), 1);
                    }
                }
            }
        }
        return context.stats().snapshot(PhaseStatus.COMPLETED);
    }

    /**
     * Shared with the robots phase, which expands sitemap hints through the same service.
     */
    static void recordSitemapOutcome(PhaseContext context, SitemapDiscoveryResult result) {
        context.stats().recordFetches(result.fetches());
        context.stats().recordParseErrors(result.parseErrors());
        int transientErrors = 0;
        int permanentErrors = 0;
        for (Map.Entry<String, Integer> error : result.errors().entrySet()) {
            String key = error.getKey();
            if ("http_404".equals(key) || "http_410".equals(key) || "blocked_by_robots".equals(key)) {
                continue;
            }
            if (key.startsWith("http_5") || "http_429".equals(key) || "timeout".equals(key) || "io_error".equals(key)) {
                transientErrors += error.getValue();
            } else if (!"gzip_decode_error".equals(key) && !"not_xml".equals(key) && !"xml_parse_error".equals(key)) {
                permanentErrors += error.getValue();
            }
        }
        context.stats().recordErrors(transientErrors, permanentErrors);
    }

    private static boolean isHtml(HttpFetchResult fetch) {
        String contentType = fetch.contentType();
        return contentType == null || contentType.toLowerCase(Locale.ROOT).contains("html");
    }

    private record HtmlSitemapPage(String url, HttpFetchResult fetch) {
    }
}
