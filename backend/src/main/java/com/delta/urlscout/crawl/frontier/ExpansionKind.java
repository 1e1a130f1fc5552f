package com.delta.urlscout.crawl.frontier;

/**
 * Ways a recorded URL can be expanded. Each URL is claimed at most once per kind.
 */
public enum ExpansionKind {
    LINKS,
    PARENTS,
    AGGRESSIVE
}
