package com.delta.urlscout.crawl.archive;

import java.util.function.BooleanSupplier;

/**
 * Historical URL index queried by domain. Implementations page through the upstream API and stop
 * at {@code maxUrls}, at the configured page limit, or when {@code shouldStop} turns true.
 */
public interface ArchiveSource {
    String name();

    boolean isEnabled();

    ArchiveLookupResult lookup(String domain, int maxUrls, BooleanSupplier shouldStop);
}
