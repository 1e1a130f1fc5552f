package com.delta.urlscout.crawl.suggest;

import java.util.List;

public record Suggestion(
    List<String> values,
    SuggestionSource source
) {
    public Suggestion {
        values = values == null ? List.of() : List.copyOf(values);
    }

    public boolean fromModel() {
        return source == SuggestionSource.MODEL || source == SuggestionSource.CACHE;
    }
}
