package com.delta.urlscout.crawl.frontier;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

public class UrlRecord {
    private final String canonicalUrl;
    private final Instant firstSeenAt;
    private final String sourceUrl;
    private final String firstPhase;
    private final boolean inScope;
    private final Set<String> phases = new LinkedHashSet<>();
    private volatile int depth;
    private volatile Integer httpStatus;

    UrlRecord(String canonicalUrl, Instant firstSeenAt, String sourceUrl, String firstPhase, boolean inScope, int depth) {
        this.canonicalUrl = canonicalUrl;
        this.firstSeenAt = firstSeenAt;
        this.sourceUrl = sourceUrl;
        this.firstPhase = firstPhase;
        this.inScope = inScope;
        this.depth = Math.max(0, depth);
        if (firstPhase != null) {
            phases.add(firstPhase);
        }
    }

    public String getCanonicalUrl() {
        return canonicalUrl;
    }

    public Instant getFirstSeenAt() {
        return firstSeenAt;
    }

    public String getSourceUrl() {
        return sourceUrl;
    }

    public String getFirstPhase() {
        return firstPhase;
    }

    public boolean isInScope() {
        return inScope;
    }

    public int getDepth() {
        return depth;
    }

    public Integer getHttpStatus() {
        return httpStatus;
    }

    public List<String> getPhases() {
        synchronized (phases) {
            return List.copyOf(phases);
        }
    }

    void addPhase(String phase) {
        if (phase == null) {
            return;
        }
        synchronized (phases) {
            phases.add(phase);
        }
    }

    void lowerDepth(int candidateDepth) {
        if (candidateDepth >= 0 && candidateDepth < depth) {
            depth = candidateDepth;
        }
    }

    void setHttpStatus(Integer httpStatus) {
        this.httpStatus = httpStatus;
    }
}
