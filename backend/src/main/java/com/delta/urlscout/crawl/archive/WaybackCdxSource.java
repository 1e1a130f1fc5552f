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
import java.util.List;
import java.util.Set;
import java.util.function.BooleanSupplier;

/**
 * Wayback Machine CDX server. With {@code showResumeKey=true} the JSON array ends with an empty row
 * followed by a one-element row holding the key for the next page.
 */
@Component
public class WaybackCdxSource implements ArchiveSource {
    private static final Logger log = LoggerFactory.getLogger(WaybackCdxSource.class);
    private static final int MAX_RESPONSE_BYTES = 20_000_000;

    private final CrawlerProperties properties;
    private final Fetcher fetcher;
    private final ObjectMapper objectMapper;

    public WaybackCdxSource(CrawlerProperties properties, Fetcher fetcher, ObjectMapper objectMapper) {
        this.properties = properties;
        this.fetcher = fetcher;
        this.objectMapper = objectMapper;
    }

    @Override
    public String name() {
        return "wayback";
    }

    @Override
    public boolean isEnabled() {
        return properties.getArchive().isWaybackEnabled();
    }

    @Override
    public ArchiveLookupResult lookup(String domain, int maxUrls, BooleanSupplier shouldStop) {
        CrawlerProperties.Archive archive = properties.getArchive();
        Set<String> urls = new LinkedHashSet<>();
        int fetches = 0;
        int transientErrors = 0;
        int permanentErrors = 0;
        int parseErrors = 0;
        String resumeKey = null;

        for (int page = 0; page < archive.getMaxApiPages() && urls.size() < maxUrls; page++) {
            if (shouldStop.getAsBoolean()) {
                break;
            }
            int limit = Math.min(archive.getPageSize(), maxUrls - urls.size());
            String requestUrl = buildUrl(archive.getWaybackEndpoint(), domain, limit, resumeKey);
            HttpFetchResult fetch = fetcher.get(requestUrl, Fetcher.JSON_ACCEPT, MAX_RESPONSE_BYTES);
            fetches++;
            if (!fetch.isSuccessful()) {
                if (fetch.errorKind() == FetchErrorKind.TRANSIENT) {
                    transientErrors++;
                } else {
                    permanentErrors++;
                }
                log.warn("wayback lookup failed domain={} page={} status={} errorCode={}",
                    domain, page, fetch.statusCode(), fetch.errorCode());
                break;
            }
            CdxPage parsed;
            try {
                parsed = parsePage(fetch.body());
            } catch (JsonProcessingException e) {
                parseErrors++;
                log.warn("wayback response unparseable domain={} page={} error={}", domain, page, e.getOriginalMessage());
                break;
            }
            for (String url : parsed.urls()) {
                if (urls.size() >= maxUrls) {
                    break;
                }
                urls.add(url);
            }
            resumeKey = parsed.resumeKey();
            if (resumeKey == null || parsed.urls().isEmpty()) {
                break;
            }
        }
        log.info("wayback lookup domain={} urls={} fetches={}", domain, urls.size(), fetches);
        return new ArchiveLookupResult(name(), new ArrayList<>(urls), fetches, transientErrors, permanentErrors, parseErrors);
    }

    CdxPage parsePage(String body) throws JsonProcessingException {
        if (body == null || body.isBlank()) {
            return new CdxPage(new ArrayList<>(), null);
        }
        JsonNode root = objectMapper.readTree(body);
        ArrayList<String> urls = new ArrayList<>();
        String resumeKey = null;
        if (!root.isArray()) {
            return new CdxPage(urls, null);
        }
        boolean afterSeparator = false;
        for (int i = 0; i < root.size(); i++) {
            JsonNode row = root.get(i);
            if (!row.isArray()) {
                continue;
            }
            if (row.isEmpty()) {
                afterSeparator = true;
                continue;
            }
            String value = row.get(0).asText(null);
            if (afterSeparator) {
                resumeKey = value;
                break;
            }
            if (i == 0 && "original".equals(value)) {
                continue;
            }
            if (value != null && !value.isBlank()) {
                urls.add(value);
            }
        }
        return new CdxPage(urls, resumeKey);
    }

    private String buildUrl(String endpoint, String domain, int limit, String resumeKey) {
        StringBuilder url = new StringBuilder(endpoint)
            .append("?url=").append(encode(domain + "/*"))
            .append("&output=json&fl=original&collapse=urlkey")
            .append("&limit=").append(limit)
            .append("&showResumeKey=true");
        if (resumeKey != null) {
            url.append("&resumeKey=").append(encode(resumeKey));
        }
        return url.toString();
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    record CdxPage(List<String> urls, String resumeKey) {
    }
}
