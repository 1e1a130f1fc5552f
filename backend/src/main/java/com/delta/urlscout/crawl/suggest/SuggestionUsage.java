package com.delta.urlscout.crawl.suggest;

public record SuggestionUsage(
    int modelCalls,
    int cacheHits,
    int fallbacks,
    int modelValues
) {
}
