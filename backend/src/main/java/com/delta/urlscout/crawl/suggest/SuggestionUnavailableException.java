package com.delta.urlscout.crawl.suggest;

/**
 * The model could not produce an answer: not configured, upstream error, timeout or an
 * unreadable response body.
 */
public class SuggestionUnavailableException extends RuntimeException {
    public SuggestionUnavailableException(String message) {
        super(message);
    }

    public SuggestionUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
