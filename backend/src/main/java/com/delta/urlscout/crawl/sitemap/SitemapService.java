package com.delta.urlscout.crawl.sitemap;

import com.delta.urlscout.crawl.http.Fetcher;
import com.delta.urlscout.crawl.model.HttpFetchResult;
import com.delta.urlscout.crawl.model.SitemapDiscoveryResult;
import com.delta.urlscout.crawl.model.SitemapUrlEntry;
import com.delta.urlscout.crawl.robots.RobotsTxtService;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.BooleanSupplier;
import java.util.zip.GZIPInputStream;

/**
 * Expands sitemap and sitemap index documents (plain or gzip) into page URLs.
 */
@Service
public class SitemapService {
    private static final Logger log = LoggerFactory.getLogger(SitemapService.class);
    private static final int MAX_SITEMAP_BYTES = 10_000_000;

    private final Fetcher fetcher;
    private final RobotsTxtService robotsTxtService;

    public SitemapService(Fetcher fetcher, RobotsTxtService robotsTxtService) {
        this.fetcher = fetcher;
        this.robotsTxtService = robotsTxtService;
    }

    /**
     * Breadth-first expansion of {@code seedSitemaps}. {@code visitedSitemaps} is shared across
     * calls of one run so that a sitemap is fetched at most once; it must be thread-safe when
     * shared between threads. Missing seeds (404) are not errors, the candidate list is a guess.
     */
    public SitemapDiscoveryResult discover(
        List<String> seedSitemaps,
        Set<String> visitedSitemaps,
        int maxDepth,
        int maxSitemaps,
        int maxUrls,
        BooleanSupplier shouldStop
    ) {
        ArrayDeque<SitemapTask> queue = new ArrayDeque<>();
        for (String seed : seedSitemaps) {
            String normalized = normalizeSitemapUrl(seed);
            if (normalized != null) {
                queue.addLast(new SitemapTask(normalized, 0));
            }
        }

        LinkedHashMap<String, SitemapUrlEntry> discoveredUrls = new LinkedHashMap<>();
        List<String> fetchedSitemaps = new ArrayList<>();
        Map<String, Integer> errors = new LinkedHashMap<>();
        int fetches = 0;
        int parseErrors = 0;
        int processed = 0;

        while (!queue.isEmpty() && processed < maxSitemaps) {
            if (shouldStop != null && shouldStop.getAsBoolean()) {
                break;
            }
            SitemapTask current = queue.removeFirst();
            if (current.depth() > maxDepth || !visitedSitemaps.add(current.url())) {
                continue;
            }
            processed++;

            if (!robotsTxtService.isAllowed(current.url())) {
                log.debug("Sitemap blocked by robots url={}", current.url());
                increment(errors, "blocked_by_robots");
                continue;
            }

            HttpFetchResult fetch = fetcher.get(current.url(), Fetcher.XML_ACCEPT, MAX_SITEMAP_BYTES);
            fetches++;
            if (!fetch.isSuccessful()) {
                increment(errors, errorKey(fetch));
                continue;
            }
            String xmlPayload;
            try {
                xmlPayload = extractXmlPayload(fetch);
            } catch (IOException e) {
                log.debug("Sitemap gzip decode failed url={} error={}", current.url(), e.getMessage());
                increment(errors, "gzip_decode_error");
                parseErrors++;
                continue;
            }
            if (xmlPayload == null || xmlPayload.isBlank()) {
                increment(errors, "empty_sitemap_payload");
                continue;
            }
            if (!looksLikeXml(xmlPayload)) {
                increment(errors, "not_xml");
                parseErrors++;
                continue;
            }

            Document xml;
            try {
                xml = Jsoup.parse(xmlPayload, "", Parser.xmlParser());
            } catch (RuntimeException e) {
                increment(errors, "xml_parse_error");
                parseErrors++;
                continue;
            }
            fetchedSitemaps.add(current.url());

            List<Element> childSitemaps = xml.select("sitemap > loc");
            if (!childSitemaps.isEmpty() && current.depth() < maxDepth) {
                for (Element loc : childSitemaps) {
                    String child = normalizeSitemapUrl(loc.text());
                    if (child != null && !visitedSitemaps.contains(child)) {
                        queue.addLast(new SitemapTask(child, current.depth() + 1));
                    }
                }
            }

            for (Element urlElement : xml.select("url")) {
                Element locElement = urlElement.selectFirst("loc");
                if (locElement == null) {
                    continue;
                }
                String loc = normalizeSitemapUrl(locElement.text());
                if (loc == null || discoveredUrls.containsKey(loc)) {
                    continue;
                }
                Element lastmodElement = urlElement.selectFirst("lastmod");
                String lastmod = lastmodElement == null ? null : lastmodElement.text().trim();
                discoveredUrls.put(loc, new SitemapUrlEntry(loc, lastmod, current.url()));
                if (discoveredUrls.size() >= maxUrls) {
                    break;
                }
            }
            if (discoveredUrls.size() >= maxUrls) {
                log.info("Sitemap url cap reached maxUrls={}", maxUrls);
                break;
            }
        }

        return new SitemapDiscoveryResult(
            fetchedSitemaps,
            new ArrayList<>(discoveredUrls.values()),
            errors,
            fetches,
            parseErrors
        );
    }

    private String errorKey(HttpFetchResult fetch) {
        if (fetch.errorCode() != null) {
            return fetch.errorCode();
        }
        if (fetch.statusCode() > 0) {
            return "http_" + fetch.statusCode();
        }
        return "unknown_error";
    }

    private void increment(Map<String, Integer> errors, String key) {
        errors.merge(key, 1, Integer::sum);
    }

    private boolean looksLikeXml(String payload) {
        String head = payload.stripLeading();
        if (head.startsWith("\uFEFF")) {
            head = head.substring(1);
        }
        String lower = head.length() > 512 ? head.substring(0, 512).toLowerCase(Locale.ROOT) : head.toLowerCase(Locale.ROOT);
        return lower.startsWith("<?xml") || lower.startsWith("<urlset") || lower.startsWith("<sitemapindex")
            || (lower.startsWith("<") && !lower.startsWith("<!doctype html") && !lower.startsWith("<html"));
    }

    private String extractXmlPayload(HttpFetchResult fetch) throws IOException {
        byte[] bodyBytes = fetch.bodyBytes();
        if (bodyBytes == null && fetch.body() != null) {
            bodyBytes = fetch.body().getBytes(StandardCharsets.UTF_8);
        }
        if (bodyBytes == null) {
            return fetch.body();
        }

        if (isGzipPayload(bodyBytes)) {
            try (GZIPInputStream gzipInputStream = new GZIPInputStream(new ByteArrayInputStream(bodyBytes))) {
                return new String(gzipInputStream.readAllBytes(), StandardCharsets.UTF_8);
            }
        }
        return new String(bodyBytes, StandardCharsets.UTF_8);
    }

    private boolean isGzipPayload(byte[] bodyBytes) {
        return bodyBytes.length >= 2
            && (bodyBytes[0] & 0xFF) == 0x1f
            && (bodyBytes[1] & 0xFF) == 0x8b;
    }

    private String normalizeSitemapUrl(String url) {
        if (url == null || url.isBlank()) {
            return null;
        }
        String normalized = url.trim();
        if (!normalized.contains("://")) {
            normalized = "https://" + normalized;
        }
        String lower = normalized.toLowerCase(Locale.ROOT);
        return lower.startsWith("http://") || lower.startsWith("https://") ? normalized : null;
    }

    private record SitemapTask(String url, int depth) {
    }
}
