package com.delta.urlscout.crawl.suggest;

/**
 * Single-shot text completion.
 */
public interface SuggestionClient {
    /**
     * @throws SuggestionUnavailableException when no answer could be obtained
     */
    String complete(String systemPrompt, String userPrompt);
}
