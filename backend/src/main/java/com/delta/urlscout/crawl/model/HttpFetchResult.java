package com.delta.urlscout.crawl.model;

import com.delta.urlscout.crawl.http.FetchErrorKind;
import com.delta.urlscout.crawl.util.ReasonCodeClassifier;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;

public record HttpFetchResult(
    String requestedUrl,
    URI finalUri,
    int statusCode,
    String body,
    byte[] bodyBytes,
    String contentType,
    String contentEncoding,
    Instant fetchedAt,
    Duration duration,
    String errorCode,
    String errorMessage,
    int attempts
) {
    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300 && errorCode == null;
    }

    public String finalUrlOrRequested() {
        return finalUri != null ? finalUri.toString() : requestedUrl;
    }

    public boolean wasRetried() {
        return attempts > 1;
    }

    /**
     * Classifies a failed fetch. Returns {@code null} for successful results.
     */
    public FetchErrorKind errorKind() {
        if (isSuccessful()) {
            return null;
        }
        String reason = errorCode != null
            ? ReasonCodeClassifier.fromErrorCode(errorCode, errorMessage)
            : ReasonCodeClassifier.fromHttpStatus(statusCode);
        return ReasonCodeClassifier.isRetryable(reason) ? FetchErrorKind.TRANSIENT : FetchErrorKind.PERMANENT;
    }

    public HttpFetchResult withAttempts(int attemptCount) {
        return new HttpFetchResult(
            requestedUrl,
            finalUri,
            statusCode,
            body,
            bodyBytes,
            contentType,
            contentEncoding,
            fetchedAt,
            duration,
            errorCode,
            errorMessage,
            attemptCount
        );
    }
}
