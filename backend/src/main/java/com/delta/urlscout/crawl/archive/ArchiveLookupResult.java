package com.delta.urlscout.crawl.archive;

import java.util.List;

public record ArchiveLookupResult(
    String source,
    List<String> urls,
    int fetches,
    int transientErrors,
    int permanentErrors,
    int parseErrors
) {
}
