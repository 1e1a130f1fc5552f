package com.delta.urlscout.crawl.http;

import com.delta.urlscout.crawl.model.HttpFetchResult;

import java.time.Duration;

/**
 * Rate-limited HTTP access shared by every discovery phase. Implementations never throw for
 * network or HTTP failures; they report them through {@link HttpFetchResult#errorCode()} and the
 * status code.
 */
public interface Fetcher {
    String HTML_ACCEPT = "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8";
    String XML_ACCEPT = "application/xml,text/xml;q=0.9,*/*;q=0.1";
    String TEXT_ACCEPT = "text/plain,text/*;q=0.9,*/*;q=0.1";
    String JSON_ACCEPT = "application/json,text/plain;q=0.9,*/*;q=0.1";

    HttpFetchResult fetch(String url, Duration timeout);

    HttpFetchResult get(String url, String acceptHeader);

    HttpFetchResult get(String url, String acceptHeader, int maxBytes);

    HttpFetchResult head(String url);

    HttpFetchResult postForm(String url, String formBody, String acceptHeader);
}
