package com.delta.urlscout.crawl.frontier;

/**
 * Outcome of a single {@link Frontier#admit} call. {@code record} is {@code null} for invalid and
 * capacity-rejected candidates.
 */
public record AdmitResult(
    AdmitStatus status,
    boolean isNew,
    boolean queued,
    UrlRecord record
) {
    static AdmitResult invalid() {
        return new AdmitResult(AdmitStatus.INVALID, false, false, null);
    }

    static AdmitResult capacityReached() {
        return new AdmitResult(AdmitStatus.CAPACITY_REACHED, false, false, null);
    }

    public boolean isNewInScope() {
        return isNew && record != null && record.isInScope();
    }
}
