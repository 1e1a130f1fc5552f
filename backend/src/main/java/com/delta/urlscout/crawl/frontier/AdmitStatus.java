package com.delta.urlscout.crawl.frontier;

public enum AdmitStatus {
    NEW,
    DUPLICATE,
    OUT_OF_SCOPE,
    INVALID,
    CAPACITY_REACHED
}
