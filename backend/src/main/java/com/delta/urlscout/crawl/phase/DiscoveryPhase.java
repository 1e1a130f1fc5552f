package com.delta.urlscout.crawl.phase;

/**
 * One discovery strategy. Phases only add URLs to the frontier through
 * {@link PhaseContext#admit}; they must check {@link PhaseContext#shouldStop()} before each
 * dispatch and return normally once it is set.
 */
public interface DiscoveryPhase {
    String name();

    PhaseStats run(PhaseContext context);
}
