package com.delta.urlscout.crawl.suggest;

import java.util.List;

/**
 * Input to the suggestion service. {@code samples} are URLs already found on the site and
 * {@code hints} are kind-specific extra context such as robots.txt paths.
 */
public record SuggestionPrompt(
    PromptKind kind,
    String domain,
    SiteType siteType,
    List<String> samples,
    List<String> hints
) {
    public SuggestionPrompt {
        samples = samples == null ? List.of() : List.copyOf(samples);
        hints = hints == null ? List.of() : List.copyOf(hints);
        siteType = siteType == null ? SiteTypeDetector.detect(domain) : siteType;
    }

    public static SuggestionPrompt of(PromptKind kind, String domain, List<String> samples, List<String> hints) {
        return new SuggestionPrompt(kind, domain, null, samples, hints);
    }
}
