package com.delta.urlscout.crawl.phase;

import java.time.Duration;

public record PhaseStats(
    String phase,
    PhaseStatus status,
    int candidatesSeen,
    int newUrls,
    int duplicates,
    int outOfScope,
    int fetches,
    int transientErrors,
    int permanentErrors,
    int parseErrors,
    int suggestionsUsed,
    String error,
    Duration duration
) {
    public static PhaseStats skipped(String phase, String reason) {
        return new PhaseStats(phase, PhaseStatus.SKIPPED, 0, 0, 0, 0, 0, 0, 0, 0, 0, reason, Duration.ZERO);
    }

    public PhaseStats withOutcome(PhaseStatus newStatus, String newError, Duration newDuration) {
        return new PhaseStats(
            phase,
            newStatus,
            candidatesSeen,
            newUrls,
            duplicates,
            outOfScope,
            fetches,
            transientErrors,
            permanentErrors,
            parseErrors,
            suggestionsUsed,
            newError,
            newDuration
        );
    }
}
