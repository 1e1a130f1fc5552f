package com.delta.urlscout.crawl.model;

public enum DiscoveryState {
    IDLE,
    RUNNING,
    COMPLETED,
    ABORTED;

    public boolean isFinished() {
        return this == COMPLETED || this == ABORTED;
    }
}
