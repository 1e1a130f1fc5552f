package com.delta.urlscout.crawl.frontier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Deduplicated set of every URL seen during a run plus the queue of in-scope pages still waiting
 * for link expansion. All mutation goes through a single monitor so that concurrent admits of the
 * same canonical URL yield exactly one new record.
 */
public class Frontier {
    private static final Logger log = LoggerFactory.getLogger(Frontier.class);
    static final int MAX_OUT_OF_SCOPE_RECORDS = 100_000;

    private final ScopeRule scopeRule;
    private final int maxPages;
    private final boolean unifyScheme;
    private final Clock clock;
    private final Map<String, UrlRecord> records = new LinkedHashMap<>();
    private final Deque<UrlRecord> pending = new ArrayDeque<>();
    private final Set<String> everQueued = new HashSet<>();
    private final Map<ExpansionKind, Set<String>> claims = new EnumMap<>(ExpansionKind.class);
    private int inScopeCount;
    private int outOfScopeCount;
    private boolean atCapacity;

    public Frontier(ScopeRule scopeRule, int maxPages, boolean unifyScheme, Clock clock) {
        this.scopeRule = scopeRule;
        this.maxPages = Math.max(1, maxPages);
        this.unifyScheme = unifyScheme;
        this.clock = clock == null ? Clock.systemUTC() : clock;
        for (ExpansionKind kind : ExpansionKind.values()) {
            claims.put(kind, new HashSet<>());
        }
    }

    public AdmitResult admit(String candidate, String sourceUrl, String phase) {
        int depth = 0;
        if (sourceUrl != null) {
            UrlRecord source = get(sourceUrl);
            if (source != null) {
                depth = source.getDepth() + 1;
            }
        }
        return admit(new CandidateUrl(candidate, sourceUrl, phase, depth, clock.instant()));
    }

    public AdmitResult admit(CandidateUrl candidate) {
        if (candidate == null) {
            return AdmitResult.invalid();
        }
        String base = candidate.sourceUrl() != null ? candidate.sourceUrl() : scopeRule.rootUrl();
        String canonical = UrlNormalizer.normalize(candidate.rawUrl(), base);
        if (canonical == null) {
            return AdmitResult.invalid();
        }
        boolean inScope = scopeRule.isInScope(canonical);
        if (inScope && unifyScheme) {
            canonical = withScheme(canonical, scopeRule.scheme());
        }

        synchronized (this) {
            UrlRecord existing = records.get(canonical);
            if (existing != null) {
                existing.addPhase(candidate.phase());
                existing.lowerDepth(candidate.depth());
                return new AdmitResult(
                    existing.isInScope() ? AdmitStatus.DUPLICATE : AdmitStatus.OUT_OF_SCOPE,
                    false,
                    false,
                    existing
                );
            }
            Instant seenAt = candidate.discoveredAt() == null ? clock.instant() : candidate.discoveredAt();
            if (!inScope) {
                if (outOfScopeCount >= MAX_OUT_OF_SCOPE_RECORDS) {
                    return new AdmitResult(AdmitStatus.OUT_OF_SCOPE, false, false, null);
                }
                UrlRecord record = new UrlRecord(
                    canonical, seenAt, candidate.sourceUrl(), candidate.phase(), false, candidate.depth()
                );
                records.put(canonical, record);
                outOfScopeCount++;
                return new AdmitResult(AdmitStatus.OUT_OF_SCOPE, true, false, record);
            }
            if (inScopeCount >= maxPages) {
                if (!atCapacity) {
                    log.info("Frontier reached capacity maxPages={}", maxPages);
                }
                atCapacity = true;
                return AdmitResult.capacityReached();
            }
            UrlRecord record = new UrlRecord(
                canonical, seenAt, candidate.sourceUrl(), candidate.phase(), true, candidate.depth()
            );
            records.put(canonical, record);
            inScopeCount++;
            if (inScopeCount >= maxPages) {
                atCapacity = true;
            }
            boolean queued = false;
            if (scopeRule.isExpandable(canonical) && everQueued.add(canonical)) {
                pending.addLast(record);
                queued = true;
            }
            return new AdmitResult(AdmitStatus.NEW, true, queued, record);
        }
    }

    /**
     * Removes up to {@code max} records from the pending queue, claiming each for
     * {@link ExpansionKind#LINKS}. Records already claimed elsewhere are dropped.
     */
    public synchronized List<UrlRecord> pollPending(int max) {
        return pollPending(max, Integer.MAX_VALUE);
    }

    /**
     * Like {@link #pollPending(int)} but only takes records whose depth is below
     * {@code depthLimit}; deeper records stay queued.
     */
    public synchronized List<UrlRecord> pollPending(int max, int depthLimit) {
        List<UrlRecord> batch = new ArrayList<>();
        Iterator<UrlRecord> iterator = pending.iterator();
        while (batch.size() < max && iterator.hasNext()) {
            UrlRecord record = iterator.next();
            if (record.getDepth() >= depthLimit) {
                continue;
            }
            iterator.remove();
            if (claims.get(ExpansionKind.LINKS).add(record.getCanonicalUrl())) {
                batch.add(record);
            }
        }
        return batch;
    }

    public synchronized List<UrlRecord> pendingSnapshot() {
        return List.copyOf(pending);
    }

    public synchronized int pendingCount() {
        return pending.size();
    }

    /**
     * Returns {@code true} the first time {@code url} is claimed for {@code kind}.
     */
    public boolean claim(ExpansionKind kind, String url) {
        String canonical = canonicalize(url);
        if (canonical == null) {
            return false;
        }
        synchronized (this) {
            return claims.get(kind).add(canonical);
        }
    }

    public boolean isClaimed(ExpansionKind kind, String url) {
        String canonical = canonicalize(url);
        if (canonical == null) {
            return false;
        }
        synchronized (this) {
            return claims.get(kind).contains(canonical);
        }
    }

    public synchronized List<String> claimedUrls(ExpansionKind kind) {
        List<String> ordered = new ArrayList<>();
        Set<String> claimed = claims.get(kind);
        for (String url : records.keySet()) {
            if (claimed.contains(url)) {
                ordered.add(url);
            }
        }
        return ordered;
    }

    public boolean contains(String url) {
        return get(url) != null;
    }

    public UrlRecord get(String url) {
        String canonical = canonicalize(url);
        if (canonical == null) {
            return null;
        }
        synchronized (this) {
            return records.get(canonical);
        }
    }

    public void recordStatus(String url, int httpStatus) {
        UrlRecord record = get(url);
        if (record != null && httpStatus > 0) {
            record.setHttpStatus(httpStatus);
        }
    }

    /**
     * In-scope records in first-seen order.
     */
    public synchronized List<UrlRecord> inScopeRecords() {
        List<UrlRecord> result = new ArrayList<>(inScopeCount);
        for (UrlRecord record : records.values()) {
            if (record.isInScope()) {
                result.add(record);
            }
        }
        return result;
    }

    /**
     * Number of in-scope records first found by each phase, in first-seen order of the phases.
     */
    public synchronized Map<String, Integer> newUrlsByPhase() {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (UrlRecord record : records.values()) {
            if (record.isInScope() && record.getFirstPhase() != null) {
                counts.merge(record.getFirstPhase(), 1, Integer::sum);
            }
        }
        return counts;
    }

    public synchronized int inScopeCount() {
        return inScopeCount;
    }

    public synchronized int outOfScopeCount() {
        return outOfScopeCount;
    }

    public synchronized boolean isAtCapacity() {
        return atCapacity;
    }

    public int maxPages() {
        return maxPages;
    }

    public ScopeRule scopeRule() {
        return scopeRule;
    }

    private String canonicalize(String url) {
        String canonical = UrlNormalizer.normalize(url, scopeRule.rootUrl());
        if (canonical != null && unifyScheme && scopeRule.isInScope(canonical)) {
            canonical = withScheme(canonical, scopeRule.scheme());
        }
        return canonical;
    }

    private static String withScheme(String canonical, String scheme) {
        if (scheme == null || canonical.startsWith(scheme + "://")) {
            return canonical;
        }
        URI uri = URI.create(canonical);
        return scheme + canonical.substring(uri.getScheme().length());
    }
}
