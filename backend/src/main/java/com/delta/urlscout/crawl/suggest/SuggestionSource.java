package com.delta.urlscout.crawl.suggest;

public enum SuggestionSource {
    MODEL,
    CACHE,
    FALLBACK
}
