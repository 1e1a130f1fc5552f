package com.delta.urlscout.crawl.http;

import com.delta.urlscout.config.CrawlerProperties;
import com.delta.urlscout.crawl.model.HttpFetchResult;
import com.delta.urlscout.crawl.service.HostCrawlStateService;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;

class PoliteHttpClientMaxBytesTest {
    private MockWebServer server;
    private ExecutorService executor;

    @AfterEach
    void tearDown() throws Exception {
        if (server != null) {
            server.shutdown();
        }
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    @Test
    void rejectsBodiesLargerThanTheLimitWithoutRetrying() throws Exception {
        server = new MockWebServer();
        server.enqueue(new MockResponse().setResponseCode(200).setBody("x".repeat(4096)));
        server.start();

        CrawlerProperties properties = new CrawlerProperties();
        properties.setPerHostDelayMs(1);
        properties.setRequestMaxRetries(2);
        properties.setRequestRetryBaseDelayMs(1);
        executor = Executors.newFixedThreadPool(1);
        PoliteHttpClient client = new PoliteHttpClient(properties, executor, new HostCrawlStateService());

        HttpFetchResult result = client.get(server.url("/big").toString(), Fetcher.TEXT_ACCEPT, 1024);

        assertThat(result.errorCode()).isEqualTo("body_too_large");
        assertThat(result.body()).isNull();
        assertThat(result.isSuccessful()).isFalse();
        assertThat(server.getRequestCount()).isEqualTo(1);
    }

    @Test
    void invalidUrlsFailWithoutNetworkAccess() {
        CrawlerProperties properties = new CrawlerProperties();
        executor = Executors.newFixedThreadPool(1);
        PoliteHttpClient client = new PoliteHttpClient(properties, executor, new HostCrawlStateService());

        HttpFetchResult result = client.get("http://", Fetcher.HTML_ACCEPT);

        assertThat(result.errorCode()).isEqualTo("invalid_url");
        assertThat(result.errorKind()).isEqualTo(FetchErrorKind.PERMANENT);
    }
}
