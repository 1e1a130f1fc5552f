package com.delta.urlscout.crawl.phase;

import com.delta.urlscout.crawl.model.HttpFetchResult;

public record ProbeResult(
    String url,
    boolean exists,
    boolean soft404,
    HttpFetchResult fetch
) {
    public int statusCode() {
        return fetch == null ? 0 : fetch.statusCode();
    }
}
