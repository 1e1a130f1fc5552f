package com.delta.urlscout.crawl.archive;

import com.delta.urlscout.config.CrawlerProperties;
import com.delta.urlscout.crawl.http.FetchErrorKind;
import com.delta.urlscout.crawl.http.Fetcher;
import com.delta.urlscout.crawl.model.HttpFetchResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.function.BooleanSupplier;

/**
 * Common Crawl URL index. Uses the newest collection listed in {@code collinfo.json}; each index
 * page is newline-delimited JSON.
 */
@Component
public class CommonCrawlIndexSource implements ArchiveSource {
    private static final Logger log = LoggerFactory.getLogger(CommonCrawlIndexSource.class);
    private static final int MAX_RESPONSE_BYTES = 20_000_000;

    private final CrawlerProperties properties;
    private final Fetcher fetcher;
    private final ObjectMapper objectMapper;

    public CommonCrawlIndexSource(CrawlerProperties properties, Fetcher fetcher, ObjectMapper objectMapper) {
        this.properties = properties;
        this.fetcher = fetcher;
        this.objectMapper = objectMapper;
    }

    @Override
    public String name() {
        return "common_crawl";
    }

    @Override
    public boolean isEnabled() {
        return properties.getArchive().isCommonCrawlEnabled();
    }

    @Override
    public ArchiveLookupResult lookup(String domain, int maxUrls, BooleanSupplier shouldStop) {
        CrawlerProperties.Archive archive = properties.getArchive();
        Set<String> urls = new LinkedHashSet<>();
        int fetches = 0;
        int transientErrors = 0;
        int permanentErrors = 0;
        int parseErrors = 0;

        HttpFetchResult collections = fetcher.get(archive.getCommonCrawlCollectionsUrl(), Fetcher.JSON_ACCEPT);
        fetches++;
        if (!collections.isSuccessful()) {
            log.warn("common crawl collection list unavailable status={} errorCode={}",
                collections.statusCode(), collections.errorCode());
            boolean transientFailure = collections.errorKind() == FetchErrorKind.TRANSIENT;
            return new ArchiveLookupResult(name(), new ArrayList<>(), fetches,
                transientFailure ? 1 : 0, transientFailure ? 0 : 1, 0);
        }
        String cdxApi;
        try {
            cdxApi = latestCdxApi(collections.body());
        } catch (JsonProcessingException e) {
            log.warn("common crawl collection list unparseable error={}", e.getOriginalMessage());
            return new ArchiveLookupResult(name(), new ArrayList<>(), fetches, 0, 0, 1);
        }
        if (cdxApi == null) {
            return new ArchiveLookupResult(name(), new ArrayList<>(), fetches, 0, 0, 1);
        }

        for (int page = 0; page < archive.getMaxApiPages() && urls.size() < maxUrls; page++) {
            if (shouldStop.getAsBoolean()) {
                break;
            }
            String requestUrl = cdxApi
                + "?url=" + URLEncoder.encode(domain + "/*", StandardCharsets.UTF_8)
                + "&output=json&fl=url&page=" + page;
            HttpFetchResult fetch = fetcher.get(requestUrl, Fetcher.JSON_ACCEPT, MAX_RESPONSE_BYTES);
            fetches++;
            if (!fetch.isSuccessful()) {
                // the index answers 404 once the page number passes the last page
                if (fetch.statusCode() != 404) {
                    if (fetch.errorKind() == FetchErrorKind.TRANSIENT) {
                        transientErrors++;
                    } else {
                        permanentErrors++;
                    }
                    log.warn("common crawl page failed domain={} page={} status={} errorCode={}",
                        domain, page, fetch.statusCode(), fetch.errorCode());
                }
                break;
            }
            int before = urls.size();
            for (String line : fetch.body() == null ? new String[0] : fetch.body().split("\\R")) {
                if (line.isBlank() || urls.size() >= maxUrls) {
                    continue;
                }
                try {
                    JsonNode node = objectMapper.readTree(line);
                    String url = node.path("url").asText(null);
                    if (url != null && !url.isBlank()) {
                        urls.add(url);
                    }
                } catch (JsonProcessingException e) {
                    parseErrors++;
                }
            }
            if (urls.size() == before) {
                break;
            }
        }
        log.info("common crawl lookup domain={} index={} urls={} fetches={}", domain, cdxApi, urls.size(), fetches);
        return new ArchiveLookupResult(name(), new ArrayList<>(urls), fetches, transientErrors, permanentErrors, parseErrors);
    }

    String latestCdxApi(String body) throws JsonProcessingException {
        if (body == null || body.isBlank()) {
            return null;
        }
        JsonNode root = objectMapper.readTree(body);
        if (!root.isArray() || root.isEmpty()) {
            return null;
        }
        String api = root.get(0).path("cdx-api").asText(null);
        return api == null || api.isBlank() ? null : api;
    }
}
