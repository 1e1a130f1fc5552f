package com.delta.urlscout.crawl.phase;

import com.delta.urlscout.crawl.frontier.UrlRecord;
import com.delta.urlscout.crawl.model.HttpFetchResult;

public record FetchedPage(
    UrlRecord record,
    HttpFetchResult fetch
) {
    public String url() {
        return record.getCanonicalUrl();
    }
}
