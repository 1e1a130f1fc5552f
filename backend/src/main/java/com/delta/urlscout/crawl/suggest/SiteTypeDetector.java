package com.delta.urlscout.crawl.suggest;

import java.util.List;
import java.util.Locale;

/**
 * Guesses the kind of site from tokens in its host name.
 */
public final class SiteTypeDetector {
    private static final List<String> GOVERNMENT_TOKENS = List.of("gov", "city", "municipal", "pref", "lg.jp", "admin");
    private static final List<String> EDUCATIONAL_TOKENS = List.of("edu", "ac.", "university", "college", "school");
    private static final List<String> NEWS_TOKENS = List.of("news", "media", "blog", "press", "times");
    private static final List<String> ECOMMERCE_TOKENS = List.of("shop", "store", "mall", "cart", "ecommerce");
    private static final List<String> ORGANIZATION_TOKENS = List.of(".org", "or.jp", "nonprofit", "foundation");

    private SiteTypeDetector() {
    }

    public static SiteType detect(String host) {
        if (host == null || host.isBlank()) {
            return SiteType.CORPORATE;
        }
        String lower = host.toLowerCase(Locale.ROOT);
        if (containsAny(lower, GOVERNMENT_TOKENS)) {
            return SiteType.GOVERNMENT;
        }
        if (containsAny(lower, EDUCATIONAL_TOKENS)) {
            return SiteType.EDUCATIONAL;
        }
        if (containsAny(lower, NEWS_TOKENS)) {
            return SiteType.NEWS;
        }
        if (containsAny(lower, ECOMMERCE_TOKENS)) {
            return SiteType.ECOMMERCE;
        }
        if (containsAny(lower, ORGANIZATION_TOKENS)) {
            return SiteType.ORGANIZATION;
        }
        return SiteType.CORPORATE;
    }

    private static boolean containsAny(String value, List<String> tokens) {
        for (String token : tokens) {
            if (value.contains(token)) {
                return true;
            }
        }
        return false;
    }
}
