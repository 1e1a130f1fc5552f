package com.delta.urlscout.crawl.extract;

import java.util.Set;

public record ExtractedLinks(Set<String> urls, int parseErrors) {
    public static ExtractedLinks empty() {
        return new ExtractedLinks(Set.of(), 0);
    }
}
