package com.delta.urlscout.crawl.suggest;

import java.util.List;
import java.util.Locale;

/**
 * Built-in prompt texts, one per {@link PromptKind}.
 */
final class SuggestionPrompts {
    static final String SYSTEM_PROMPT =
        "You help map the public structure of websites. Answer with one item per line and nothing else.";
    private static final int MAX_SAMPLES = 10;
    private static final int MAX_HINTS = 40;

    private SuggestionPrompts() {
    }

    static String render(SuggestionPrompt prompt, int maxSuggestions) {
        String site = prompt.siteType().label() + " website " + prompt.domain();
        String samples = bulletList(prompt.samples(), MAX_SAMPLES);
        String hints = bulletList(prompt.hints(), MAX_HINTS);
        return switch (prompt.kind()) {
            case ROBOTS_ANALYSIS -> """
                The robots.txt of the %s lists these restricted or allowed paths:
                %s
                Known URLs on the site:
                %s
                Suggest up to %d public paths on the same site that probably exist near these areas
                (parent directories, index pages, sibling sections). Return one path per line, starting with /.
                """.formatted(site, hints, samples, maxSuggestions);
            case DIRECTORY_DISCOVERY -> """
                Suggest up to %d top-level directories that the %s most likely has
                (content, services, resources, support, news, archives and sections specific to %s sites).
                Known URLs on the site:
                %s
                Return one directory per line in /directory/ form.
                """.formatted(maxSuggestions, site, prompt.siteType().label(), samples);
            case HIERARCHICAL_PARENTS -> """
                These URLs were found on the %s:
                %s
                Suggest up to %d parent directories that probably contain further pages
                (for example /services/ or /about/). Return one directory per line in /directory/ form.
                """.formatted(site, samples, maxSuggestions);
            case SEARCH_QUERIES -> """
                Suggest up to %d short search terms a visitor would type into the site search of the %s
                to reach its different content areas. Return one term per line, without quotes or operators.
                """.formatted(maxSuggestions, site);
        };
    }

    /**
     * Cache key text: case and whitespace do not distinguish prompts.
     */
    static String normalize(String text) {
        return text.toLowerCase(Locale.ROOT).replaceAll("\\s+", " ").trim();
    }

    private static String bulletList(List<String> values, int max) {
        if (values.isEmpty()) {
            return "- (none)";
        }
        StringBuilder out = new StringBuilder();
        int count = 0;
        for (String value : values) {
            if (count++ >= max) {
                break;
            }
            if (out.length() > 0) {
                out.append('\n');
            }
            out.append("- ").append(value);
        }
        return out.toString();
    }
}
