package com.delta.urlscout.crawl.phase;

public enum PhaseStatus {
    COMPLETED,
    FAILED,
    SKIPPED
}
