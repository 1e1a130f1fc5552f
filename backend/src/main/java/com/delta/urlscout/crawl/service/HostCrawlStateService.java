package com.delta.urlscout.crawl.service;

import com.delta.urlscout.crawl.model.HostCrawlState;
import com.delta.urlscout.crawl.model.HttpFetchResult;
import com.delta.urlscout.crawl.util.ReasonCodeClassifier;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Per-host request accounting for reporting. One logical request is counted once, however many
 * attempts it took.
 */
@Service
public class HostCrawlStateService {
    private final Map<String, Counters> counters = new ConcurrentHashMap<>();

    public void recordResult(String host, HttpFetchResult result) {
        if (host == null || host.isBlank() || result == null) {
            return;
        }
        Counters hostCounters = countersFor(host);
        hostCounters.requests.incrementAndGet();
        if (result.wasRetried()) {
            hostCounters.retried.incrementAndGet();
        }
        if (!result.isSuccessful()) {
            hostCounters.failed.incrementAndGet();
            hostCounters.lastErrorCategory = result.errorCode() != null
                ? ReasonCodeClassifier.fromErrorCode(result.errorCode(), result.errorMessage())
                : ReasonCodeClassifier.fromHttpStatus(result.statusCode());
        }
        hostCounters.lastRequestAt = Instant.now();
    }

    public void recordRateLimited(String host) {
        if (host == null || host.isBlank()) {
            return;
        }
        countersFor(host).rateLimited.incrementAndGet();
    }

    public HostCrawlState stateFor(String host) {
        if (host == null || host.isBlank()) {
            return null;
        }
        Counters hostCounters = counters.get(normalizeHost(host));
        return hostCounters == null ? null : hostCounters.toState(normalizeHost(host));
    }

    public Map<String, HostCrawlState> snapshot() {
        Map<String, HostCrawlState> out = new LinkedHashMap<>();
        counters.entrySet().stream()
            .sorted(Map.Entry.comparingByKey(Comparator.naturalOrder()))
            .forEach(entry -> out.put(entry.getKey(), entry.getValue().toState(entry.getKey())));
        return out;
    }

    public void reset() {
        counters.clear();
    }

    private Counters countersFor(String host) {
        return counters.computeIfAbsent(normalizeHost(host), ignored -> new Counters());
    }

    private String normalizeHost(String host) {
        return host.trim().toLowerCase(Locale.ROOT);
    }

    private static final class Counters {
        private final AtomicInteger requests = new AtomicInteger();
        private final AtomicInteger retried = new AtomicInteger();
        private final AtomicInteger failed = new AtomicInteger();
        private final AtomicInteger rateLimited = new AtomicInteger();
        private volatile String lastErrorCategory;
        private volatile Instant lastRequestAt;

        private HostCrawlState toState(String host) {
            return new HostCrawlState(
                host,
                requests.get(),
                retried.get(),
                failed.get(),
                rateLimited.get(),
                lastErrorCategory,
                lastRequestAt
            );
        }
    }
}
