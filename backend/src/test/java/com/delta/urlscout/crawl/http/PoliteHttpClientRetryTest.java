package com.delta.urlscout.crawl.http;

import com.delta.urlscout.config.CrawlerProperties;
import com.delta.urlscout.crawl.model.HostCrawlState;
import com.delta.urlscout.crawl.model.HttpFetchResult;
import com.delta.urlscout.crawl.service.HostCrawlStateService;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;

class PoliteHttpClientRetryTest {
    private MockWebServer server;
    private ExecutorService executor;
    private HostCrawlStateService hostCrawlStateService;
    private PoliteHttpClient client;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();

        CrawlerProperties properties = new CrawlerProperties();
        properties.setGlobalConcurrency(1);
        properties.setPerHostDelayMs(1);
        properties.setRequestTimeoutSeconds(5);
        properties.setRequestMaxRetries(2);
        properties.setRequestRetryBaseDelayMs(1);
        properties.setRequestRetryMaxDelayMs(5);
        properties.setRateLimitCooldownMs(0);

        executor = Executors.newFixedThreadPool(1);
        hostCrawlStateService = new HostCrawlStateService();
        client = new PoliteHttpClient(properties, executor, hostCrawlStateService);
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
        executor.shutdownNow();
    }

    @Test
    void retriesRateLimitedRequestAndCountsItOnce() {
        server.enqueue(new MockResponse().setResponseCode(429).setBody("slow down"));
        server.enqueue(new MockResponse().setResponseCode(200).setBody("<html>ok</html>"));

        HttpFetchResult result = client.get(server.url("/page").toString(), Fetcher.HTML_ACCEPT);

        assertThat(result.statusCode()).isEqualTo(200);
        assertThat(result.isSuccessful()).isTrue();
        assertThat(result.attempts()).isEqualTo(2);
        assertThat(result.wasRetried()).isTrue();
        assertThat(server.getRequestCount()).isEqualTo(2);

        HostCrawlState state = hostCrawlStateService.stateFor(server.getHostName());
        assertThat(state).isNotNull();
        assertThat(state.requests()).isEqualTo(1);
        assertThat(state.retriedRequests()).isEqualTo(1);
        assertThat(state.failedRequests()).isZero();
        assertThat(state.rateLimitedResponses()).isEqualTo(1);
    }

    @Test
    void doesNotRetryPermanentFailures() {
        server.enqueue(new MockResponse().setResponseCode(404).setBody("missing"));

        HttpFetchResult result = client.get(server.url("/missing").toString(), Fetcher.HTML_ACCEPT);

        assertThat(result.statusCode()).isEqualTo(404);
        assertThat(result.errorKind()).isEqualTo(FetchErrorKind.PERMANENT);
        assertThat(result.attempts()).isEqualTo(1);
        assertThat(server.getRequestCount()).isEqualTo(1);
    }

    @Test
    void givesUpAfterConfiguredRetriesOnServerErrors() {
        server.enqueue(new MockResponse().setResponseCode(503));
        server.enqueue(new MockResponse().setResponseCode(503));
        server.enqueue(new MockResponse().setResponseCode(503));

        HttpFetchResult result = client.get(server.url("/flaky").toString(), Fetcher.HTML_ACCEPT);

        assertThat(result.statusCode()).isEqualTo(503);
        assertThat(result.errorKind()).isEqualTo(FetchErrorKind.TRANSIENT);
        assertThat(result.attempts()).isEqualTo(3);
        assertThat(server.getRequestCount()).isEqualTo(3);
    }

    @Test
    void honoursRetryAfterLongerThanTheConfiguredCooldown() {
        server.enqueue(new MockResponse().setResponseCode(429).setHeader("Retry-After", "1"));
        server.enqueue(new MockResponse().setResponseCode(200).setBody("<html>ok</html>"));

        long startedAt = System.nanoTime();
        HttpFetchResult result = client.get(server.url("/busy").toString(), Fetcher.HTML_ACCEPT);
        Duration elapsed = Duration.ofNanos(System.nanoTime() - startedAt);

        assertThat(result.statusCode()).isEqualTo(200);
        assertThat(result.attempts()).isEqualTo(2);
        assertThat(elapsed).isGreaterThanOrEqualTo(Duration.ofMillis(900));
    }

    @Test
    void readsRetryAfterInSecondsOrAsHttpDate() {
        Instant now = Instant.parse("2024-05-10T08:00:00Z");

        assertThat(PoliteHttpClient.retryAfter("30", now)).isEqualTo(Duration.ofSeconds(30));
        assertThat(PoliteHttpClient.retryAfter("Fri, 10 May 2024 08:00:45 GMT", now)).isEqualTo(Duration.ofSeconds(45));
        assertThat(PoliteHttpClient.retryAfter("86400", now)).isEqualTo(PoliteHttpClient.MAX_RETRY_AFTER);
        assertThat(PoliteHttpClient.retryAfter("soon", now)).isZero();
        assertThat(PoliteHttpClient.retryAfter("-5", now)).isZero();
        assertThat(PoliteHttpClient.retryAfter(null, now)).isZero();
    }
}
