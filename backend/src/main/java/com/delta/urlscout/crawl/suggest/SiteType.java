package com.delta.urlscout.crawl.suggest;

import java.util.Locale;

public enum SiteType {
    GOVERNMENT,
    EDUCATIONAL,
    NEWS,
    ECOMMERCE,
    ORGANIZATION,
    CORPORATE;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
