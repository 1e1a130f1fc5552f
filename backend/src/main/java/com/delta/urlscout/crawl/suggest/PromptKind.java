package com.delta.urlscout.crawl.suggest;

public enum PromptKind {
    ROBOTS_ANALYSIS,
    DIRECTORY_DISCOVERY,
    HIERARCHICAL_PARENTS,
    SEARCH_QUERIES;

    /**
     * Search-query prompts return free-text terms; every other kind returns site paths.
     */
    public boolean returnsPaths() {
        return this != SEARCH_QUERIES;
    }
}
