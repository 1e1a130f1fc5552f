package com.delta.urlscout.crawl.extract;

public enum ExtractionMode {
    STANDARD,
    /** Adds link/area tags, every src attribute and path-like data-* attributes. */
    AGGRESSIVE
}
