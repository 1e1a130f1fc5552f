package com.delta.urlscout.crawl.http;

import com.delta.urlscout.config.CrawlerProperties;
import com.delta.urlscout.crawl.model.HttpFetchResult;
import com.delta.urlscout.crawl.service.HostCrawlStateService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.UnknownHostException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.channels.UnresolvedAddressException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadLocalRandom;

@Service
public class PoliteHttpClient implements Fetcher {
    private static final Logger log = LoggerFactory.getLogger(PoliteHttpClient.class);
    static final Duration MAX_RETRY_AFTER = Duration.ofMinutes(2);

    private final CrawlerProperties properties;
    private final HttpClient client;
    private final Semaphore globalLimiter;
    private final Map<String, Semaphore> hostLimiters = new ConcurrentHashMap<>();
    private final Map<String, Object> hostLocks = new ConcurrentHashMap<>();
    private final Map<String, Instant> hostNextAllowed = new ConcurrentHashMap<>();
    private final HostCrawlStateService hostCrawlStateService;

    public PoliteHttpClient(
        CrawlerProperties properties,
        @Qualifier("httpExecutor") ExecutorService httpExecutor,
        HostCrawlStateService hostCrawlStateService
    ) {
        this.properties = properties;
        this.client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
            .version(HttpClient.Version.HTTP_1_1)
            .executor(httpExecutor)
            .build();
        this.globalLimiter = new Semaphore(Math.max(1, properties.getGlobalConcurrency()));
        this.hostCrawlStateService = hostCrawlStateService;
    }

    @Override
    public HttpFetchResult fetch(String url, Duration timeout) {
        return send(url, "GET", HTML_ACCEPT, null, null, timeout, properties.getMaxBodyBytes());
    }

    @Override
    public HttpFetchResult get(String url, String acceptHeader) {
        return send(url, "GET", acceptHeader, null, null, null, properties.getMaxBodyBytes());
    }

    @Override
    public HttpFetchResult get(String url, String acceptHeader, int maxBytes) {
        return send(url, "GET", acceptHeader, null, null, null, maxBytes);
    }

    @Override
    public HttpFetchResult head(String url) {
        return send(url, "HEAD", "*/*", null, null, null, properties.getMaxBodyBytes());
    }

    @Override
    public HttpFetchResult postForm(String url, String formBody, String acceptHeader) {
        return send(
            url,
            "POST",
            acceptHeader,
            formBody == null ? "" : formBody,
            "application/x-www-form-urlencoded",
            null,
            properties.getMaxBodyBytes()
        );
    }

    private HttpFetchResult send(
        String url,
        String method,
        String acceptHeader,
        String body,
        String contentType,
        Duration timeout,
        int maxBytes
    ) {
        int maxAttempts = Math.max(1, 1 + properties.getRequestMaxRetries());
        HttpFetchResult lastResult = null;
        int attempt = 1;
        for (; attempt <= maxAttempts; attempt++) {
            lastResult = executeOnce(url, method, acceptHeader, body, contentType, timeout, maxBytes);
            if (!shouldRetry(lastResult) || attempt >= maxAttempts) {
                break;
            }
            log.debug("Retrying {} {} after attempt={} status={} errorCode={}",
                method, url, attempt, lastResult.statusCode(), lastResult.errorCode());
            if (!sleepBackoff(attempt)) {
                break;
            }
        }
        HttpFetchResult result = lastResult.withAttempts(Math.min(attempt, maxAttempts));
        URI uri = normalizeUri(url);
        if (hostCrawlStateService != null && uri != null && uri.getHost() != null) {
            hostCrawlStateService.recordResult(uri.getHost(), result);
        }
        return result;
    }

    private HttpFetchResult executeOnce(
        String url,
        String method,
        String acceptHeader,
        String body,
        String contentType,
        Duration timeout,
        int maxBytes
    ) {
        Instant startedAt = Instant.now();
        URI uri = normalizeUri(url);
        if (uri == null || uri.getHost() == null) {
            return errorResult(url, startedAt, "invalid_url", "URL missing host or malformed");
        }

        String host = uri.getHost().toLowerCase(Locale.ROOT);
        boolean acquired = false;
        boolean hostAcquired = false;
        try {
            globalLimiter.acquire();
            acquired = true;
            Semaphore hostLimiter = hostLimiters.computeIfAbsent(
                host,
                ignored -> new Semaphore(Math.max(1, properties.getPerHostConcurrency()))
            );
            hostLimiter.acquire();
            hostAcquired = true;
            enforcePerHostDelay(host);

            String safeAccept = (acceptHeader == null || acceptHeader.isBlank()) ? "*/*" : acceptHeader;
            Duration requestTimeout = timeout == null || timeout.isZero() || timeout.isNegative()
                ? Duration.ofSeconds(properties.getRequestTimeoutSeconds())
                : timeout;
            HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
                .timeout(requestTimeout)
                .header("User-Agent", CrawlerProperties.normalizeUserAgent(properties.getUserAgent()))
                .header("Accept", safeAccept)
                .header("Accept-Language", "en-US,en;q=0.8");
            HttpRequest request;
            if ("POST".equalsIgnoreCase(method)) {
                request = builder
                    .header("Content-Type", contentType == null || contentType.isBlank() ? "application/json" : contentType)
                    .POST(HttpRequest.BodyPublishers.ofString(body == null ? "" : body, StandardCharsets.UTF_8))
                    .build();
            } else if ("HEAD".equalsIgnoreCase(method)) {
                request = builder.method("HEAD", HttpRequest.BodyPublishers.noBody()).build();
            } else {
                request = builder.GET().build();
            }

            HttpResponse<InputStream> response = client.send(request, HttpResponse.BodyHandlers.ofInputStream());
            if (response.statusCode() == 429) {
                if (hostCrawlStateService != null) {
                    hostCrawlStateService.recordRateLimited(host);
                }
                Duration cooldown = Duration.ofMillis(properties.getRateLimitCooldownMs());
                Duration requested = retryAfter(response.headers().firstValue("Retry-After").orElse(null), Instant.now());
                extendBackoff(host, requested.compareTo(cooldown) > 0 ? requested : cooldown);
            } else if (response.statusCode() == 403) {
                extendBackoff(host, Duration.ofMillis(properties.getRateLimitCooldownMs()));
            }
            byte[] responseBytes;
            try (InputStream stream = response.body()) {
                responseBytes = stream.readNBytes(Math.max(1, maxBytes) + 1);
            }
            if (responseBytes.length > maxBytes) {
                return new HttpFetchResult(
                    url,
                    response.uri(),
                    response.statusCode(),
                    null,
                    null,
                    response.headers().firstValue("Content-Type").orElse(null),
                    response.headers().firstValue("Content-Encoding").orElse(null),
                    Instant.now(),
                    Duration.between(startedAt, Instant.now()),
                    "body_too_large",
                    "body exceeded " + maxBytes + " bytes",
                    1
                );
            }
            return new HttpFetchResult(
                url,
                response.uri(),
                response.statusCode(),
                new String(responseBytes, StandardCharsets.UTF_8),
                responseBytes,
                response.headers().firstValue("Content-Type").orElse(null),
                response.headers().firstValue("Content-Encoding").orElse(null),
                Instant.now(),
                Duration.between(startedAt, Instant.now()),
                null,
                null,
                1
            );
        } catch (HttpTimeoutException e) {
            return errorResult(url, startedAt, "timeout", e.getMessage());
        } catch (UnknownHostException e) {
            return errorResult(url, startedAt, "dns_failure", e.getMessage());
        } catch (IOException e) {
            if (hasUnresolvedCause(e)) {
                return errorResult(url, startedAt, "dns_failure", e.getMessage());
            }
            return errorResult(url, startedAt, "io_error", e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return errorResult(url, startedAt, "interrupted", e.getMessage());
        } catch (IllegalArgumentException e) {
            return errorResult(url, startedAt, "invalid_url", e.getMessage());
        } catch (Exception e) {
            return errorResult(url, startedAt, "http_error", e.getMessage());
        } finally {
            if (hostAcquired) {
                Semaphore hostLimiter = hostLimiters.get(host);
                if (hostLimiter != null) {
                    hostLimiter.release();
                }
            }
            if (acquired) {
                globalLimiter.release();
            }
        }
    }

    private boolean shouldRetry(HttpFetchResult result) {
        if (result == null || result.isSuccessful()) {
            return false;
        }
        if ("body_too_large".equals(result.errorCode())) {
            return false;
        }
        return result.errorKind() == FetchErrorKind.TRANSIENT;
    }

    private boolean hasUnresolvedCause(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof UnknownHostException || current instanceof UnresolvedAddressException) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    private boolean sleepBackoff(int attempt) {
        int baseDelayMs = properties.getRequestRetryBaseDelayMs();
        if (baseDelayMs <= 0) {
            return true;
        }
        int maxDelayMs = properties.getRequestRetryMaxDelayMs();
        long delay = (long) baseDelayMs * (1L << Math.max(0, attempt - 1));
        if (maxDelayMs > 0) {
            delay = Math.min(delay, maxDelayMs);
        }
        if (delay <= 0) {
            return true;
        }
        long jitter = ThreadLocalRandom.current().nextLong(Math.max(1L, delay / 2));
        long sleepMs = (delay / 2) + jitter;
        try {
            Thread.sleep(sleepMs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private void enforcePerHostDelay(String host) throws InterruptedException {
        Object lock = hostLocks.computeIfAbsent(host, ignored -> new Object());
        synchronized (lock) {
            Instant now = Instant.now();
            Instant allowedAt = hostNextAllowed.getOrDefault(host, now);
            if (allowedAt.isAfter(now)) {
                long sleepMs = Duration.between(now, allowedAt).toMillis();
                if (sleepMs > 0) {
                    Thread.sleep(sleepMs);
                }
            }
            hostNextAllowed.put(host, Instant.now().plusMillis(Math.max(1, properties.getPerHostDelayMs())));
        }
    }

    /**
     * Delay requested by a {@code Retry-After} header, in delta-seconds or HTTP-date form, capped
     * at {@link #MAX_RETRY_AFTER}. Zero when absent or unreadable.
     */
    static Duration retryAfter(String header, Instant now) {
        if (header == null || header.isBlank()) {
            return Duration.ZERO;
        }
        String value = header.trim();
        Duration requested;
        try {
            requested = Duration.ofSeconds(Long.parseLong(value));
        } catch (NumberFormatException notSeconds) {
            try {
                requested = Duration.between(now, ZonedDateTime.parse(value, DateTimeFormatter.RFC_1123_DATE_TIME).toInstant());
            } catch (DateTimeParseException e) {
                log.debug("Ignoring unreadable Retry-After value={}", value);
                return Duration.ZERO;
            }
        }
        if (requested.isNegative()) {
            return Duration.ZERO;
        }
        return requested.compareTo(MAX_RETRY_AFTER) > 0 ? MAX_RETRY_AFTER : requested;
    }

    private void extendBackoff(String host, Duration duration) {
        if (duration.isZero()) {
            return;
        }
        Object lock = hostLocks.computeIfAbsent(host, ignored -> new Object());
        synchronized (lock) {
            Instant candidate = Instant.now().plus(duration);
            Instant current = hostNextAllowed.getOrDefault(host, Instant.now());
            if (candidate.isAfter(current)) {
                hostNextAllowed.put(host, candidate);
                log.info("Cooling down host={} until={}", host, candidate);
            }
        }
    }

    private HttpFetchResult errorResult(String url, Instant startedAt, String code, String message) {
        return new HttpFetchResult(
            url,
            null,
            0,
            null,
            null,
            null,
            null,
            Instant.now(),
            Duration.between(startedAt, Instant.now()),
            code,
            message,
            1
        );
    }

    private URI normalizeUri(String input) {
        if (input == null || input.isBlank()) {
            return null;
        }
        String value = input.trim();
        if (!value.startsWith("http://") && !value.startsWith("https://")) {
            value = "https://" + value;
        }
        try {
            return new URI(value);
        } catch (URISyntaxException e) {
            return null;
        }
    }
}
