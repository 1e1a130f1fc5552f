package com.delta.urlscout.crawl.robots;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.delta.urlscout.config.CrawlerProperties;
import com.delta.urlscout.crawl.http.Fetcher;
import com.delta.urlscout.crawl.model.HttpFetchResult;
import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class RobotsTxtServiceDecisionTest {

  @Mock private Fetcher fetcher;

  @Test
  void failClosedDisallowsCrawlWhenRobotsUnavailable() {
    when(fetcher.get(anyString(), anyString())).thenReturn(errorFetch());

    CrawlerProperties properties = new CrawlerProperties();
    properties.getRobots().setFailOpen(false);
    RobotsTxtService service = new RobotsTxtService(properties, fetcher);

    assertFalse(service.isAllowed("https://example.com/docs"));
  }

  @Test
  void failOpenAllowsCrawlWhenRobotsUnavailable() {
    when(fetcher.get(anyString(), anyString())).thenReturn(errorFetch());

    CrawlerProperties properties = new CrawlerProperties();
    properties.getRobots().setFailOpen(true);
    RobotsTxtService service = new RobotsTxtService(properties, fetcher);

    assertTrue(service.isAllowed("https://example.com/docs"));
  }

  @Test
  void missingRobotsAllowsEverythingEvenWhenFailClosed() {
    when(fetcher.get(anyString(), anyString())).thenReturn(statusFetch(404, ""));

    CrawlerProperties properties = new CrawlerProperties();
    properties.getRobots().setFailOpen(false);
    RobotsTxtService service = new RobotsTxtService(properties, fetcher);

    assertTrue(service.isAllowed("https://example.com/docs"));
  }

  @Test
  void rulesAreFetchedOncePerOriginAndApplyToQueries() {
    when(fetcher.get(eq("https://example.com/robots.txt"), anyString()))
        .thenReturn(statusFetch(200, "User-agent: *\nDisallow: /search?\nSitemap: https://example.com/map.xml\n"));

    RobotsTxtService service = new RobotsTxtService(new CrawlerProperties(), fetcher);

    assertTrue(service.isAllowed("https://example.com/search"));
    assertFalse(service.isAllowed("https://example.com/search?q=x"));
    assertEquals(List.of("https://example.com/map.xml"), service.getRules("https://example.com/any").getSitemapUrls());
    verify(fetcher, times(1)).get(eq("https://example.com/robots.txt"), anyString());
  }

  @Test
  void robotsCanBeIgnoredEntirely() {
    CrawlerProperties properties = new CrawlerProperties();
    properties.getRobots().setRespect(false);
    RobotsTxtService service = new RobotsTxtService(properties, fetcher);

    assertTrue(service.isAllowed("https://example.com/private"));
  }

  private HttpFetchResult errorFetch() {
    return new HttpFetchResult(
        "https://example.com/robots.txt",
        null,
        0,
        null,
        null,
        null,
        null,
        Instant.now(),
        Duration.ofMillis(5),
        "io_error",
        "connection failed",
        1);
  }

  private HttpFetchResult statusFetch(int status, String body) {
    return new HttpFetchResult(
        "https://example.com/robots.txt",
        URI.create("https://example.com/robots.txt"),
        status,
        body,
        body.getBytes(),
        "text/plain",
        null,
        Instant.now(),
        Duration.ofMillis(5),
        null,
        null,
        1);
  }
}
