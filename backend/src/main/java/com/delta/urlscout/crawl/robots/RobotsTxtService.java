package com.delta.urlscout.crawl.robots;

import com.delta.urlscout.config.CrawlerProperties;
import com.delta.urlscout.crawl.http.Fetcher;
import com.delta.urlscout.crawl.model.HttpFetchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Service
public class RobotsTxtService {
    private static final Logger log = LoggerFactory.getLogger(RobotsTxtService.class);

    private final CrawlerProperties properties;
    private final Fetcher fetcher;
    private final Map<String, RobotsRules> cache = new ConcurrentHashMap<>();
    private final Map<String, RobotsRules> aiTxtCache = new ConcurrentHashMap<>();

    public RobotsTxtService(CrawlerProperties properties, Fetcher fetcher) {
        this.properties = properties;
        this.fetcher = fetcher;
    }

    /**
     * Rules for the origin ({@code scheme://authority}) of {@code url}.
     */
    public RobotsRules getRules(String url) {
        String origin = originOf(url);
        if (origin == null) {
            return RobotsRules.allowAll();
        }
        return cache.computeIfAbsent(origin, this::loadRobots);
    }

    public boolean isAllowed(String url) {
        if (!properties.getRobots().isRespect()) {
            return true;
        }
        URI uri = toUri(url);
        if (uri == null || uri.getHost() == null) {
            return true;
        }
        RobotsRules rules = getRules(url);
        String path = uri.getRawPath() == null || uri.getRawPath().isBlank() ? "/" : uri.getRawPath();
        if (uri.getRawQuery() != null && !uri.getRawQuery().isBlank()) {
            path = path + "?" + uri.getRawQuery();
        }
        return rules.isAllowed(path);
    }

    /**
     * Rules declared in the origin's {@code ai.txt}, which uses the robots.txt syntax. Only the
     * path and sitemap hints are used; allow-all when absent or disabled.
     */
    public RobotsRules getAiTxtRules(String url) {
        String origin = originOf(url);
        if (origin == null || !properties.getRobots().isFetchAiTxt()) {
            return RobotsRules.allowAll();
        }
        return aiTxtCache.computeIfAbsent(origin, this::loadAiTxt);
    }

    public void clear() {
        cache.clear();
        aiTxtCache.clear();
    }

    private RobotsRules loadRobots(String origin) {
        String robotsUrl = origin + "/robots.txt";
        HttpFetchResult fetch = fetcher.get(robotsUrl, Fetcher.TEXT_ACCEPT);
        if (fetch.isSuccessful()) {
            RobotsRules rules = RobotsRules.parse(fetch.body());
            log.debug(
                "Loaded robots origin={} sitemaps={} disallowHints={}",
                origin,
                rules.getSitemapUrls().size(),
                rules.getDisallowedPaths().size()
            );
            return rules;
        }
        if (fetch.errorCode() == null && fetch.statusCode() >= 400 && fetch.statusCode() < 500) {
            log.debug("No robots.txt origin={} status={}", origin, fetch.statusCode());
            return RobotsRules.allowAll();
        }
        boolean failOpen = properties.getRobots().isFailOpen();
        log.warn(
            "robots fetch failed origin={} status={} errorCode={} decision={}",
            origin,
            fetch.statusCode(),
            fetch.errorCode(),
            failOpen ? "allow_all" : "disallow_all"
        );
        return failOpen ? RobotsRules.allowAll() : RobotsRules.disallowAll();
    }

    private RobotsRules loadAiTxt(String origin) {
        HttpFetchResult fetch = fetcher.get(origin + "/ai.txt", Fetcher.TEXT_ACCEPT);
        if (!fetch.isSuccessful() || fetch.body() == null || looksLikeHtml(fetch)) {
            return RobotsRules.allowAll();
        }
        return RobotsRules.parse(fetch.body());
    }

    private boolean looksLikeHtml(HttpFetchResult fetch) {
        String contentType = fetch.contentType() == null ? "" : fetch.contentType().toLowerCase(Locale.ROOT);
        return contentType.contains("html") || fetch.body().trim().startsWith("<");
    }

    static String originOf(String url) {
        URI uri = toUri(url);
        if (uri == null || uri.getHost() == null || uri.getScheme() == null) {
            return null;
        }
        return uri.getScheme().toLowerCase(Locale.ROOT) + "://" + uri.getRawAuthority().toLowerCase(Locale.ROOT);
    }

    private static URI toUri(String url) {
        if (url == null) {
            return null;
        }
        try {
            return new URI(url);
        } catch (URISyntaxException e) {
            return null;
        }
    }
}
