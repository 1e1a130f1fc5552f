package com.delta.urlscout.crawl.phase;

import com.delta.urlscout.crawl.frontier.AdmitResult;
import com.delta.urlscout.crawl.http.FetchErrorKind;
import com.delta.urlscout.crawl.model.HttpFetchResult;
import com.delta.urlscout.crawl.suggest.Suggestion;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread-safe counters for one phase execution.
 */
public class PhaseStatsCollector {
    private final String phase;
    private final AtomicInteger candidatesSeen = new AtomicInteger();
    private final AtomicInteger newUrls = new AtomicInteger();
    private final AtomicInteger duplicates = new AtomicInteger();
    private final AtomicInteger outOfScope = new AtomicInteger();
    private final AtomicInteger fetches = new AtomicInteger();
    private final AtomicInteger transientErrors = new AtomicInteger();
    private final AtomicInteger permanentErrors = new AtomicInteger();
    private final AtomicInteger parseErrors = new AtomicInteger();
    private final AtomicInteger suggestionsUsed = new AtomicInteger();

    public PhaseStatsCollector(String phase) {
        this.phase = phase;
    }

    public void recordAdmit(AdmitResult result) {
        candidatesSeen.incrementAndGet();
        switch (result.status()) {
            case NEW -> newUrls.incrementAndGet();
            case DUPLICATE -> duplicates.incrementAndGet();
            case OUT_OF_SCOPE -> outOfScope.incrementAndGet();
            default -> {
            }
        }
    }

    public void recordFetch(HttpFetchResult result) {
        fetches.incrementAndGet();
        FetchErrorKind kind = result.errorKind();
        if (kind == FetchErrorKind.TRANSIENT) {
            transientErrors.incrementAndGet();
        } else if (kind == FetchErrorKind.PERMANENT) {
            permanentErrors.incrementAndGet();
        }
    }

    public void recordErrors(int transientCount, int permanentCount) {
        transientErrors.addAndGet(Math.max(0, transientCount));
        permanentErrors.addAndGet(Math.max(0, permanentCount));
    }

    public void recordFetches(int count) {
        fetches.addAndGet(Math.max(0, count));
    }

    public void recordParseErrors(int count) {
        if (count > 0) {
            parseErrors.addAndGet(count);
        }
    }

    public void recordSuggestion(Suggestion suggestion) {
        if (suggestion.fromModel()) {
            suggestionsUsed.addAndGet(suggestion.values().size());
        }
    }

    public int newUrls() {
        return newUrls.get();
    }

    public PhaseStats snapshot(PhaseStatus status) {
        return new PhaseStats(
            phase,
            status,
            candidatesSeen.get(),
            newUrls.get(),
            duplicates.get(),
            outOfScope.get(),
            fetches.get(),
            transientErrors.get(),
            permanentErrors.get(),
            parseErrors.get(),
            suggestionsUsed.get(),
            null,
            Duration.ZERO
        );
    }
}
