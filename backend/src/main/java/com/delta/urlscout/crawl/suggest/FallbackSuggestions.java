package com.delta.urlscout.crawl.suggest;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Deterministic answers used whenever the model is unavailable.
 */
public final class FallbackSuggestions {
    public static final int MAX_FALLBACK_VALUES = 15;

    private static final Map<SiteType, List<String>> PATHS = Map.of(
        SiteType.GOVERNMENT, List.of(
            "/admin/", "/admin/index.html", "/council/", "/council/meetings.html", "/council/members.html",
            "/departments/", "/departments/list.html", "/services/", "/services/index.html",
            "/services/online.html", "/documents/", "/documents/forms.html", "/statistics/",
            "/budget/", "/policies/", "/budget/current.html", "/policies/index.html"
        ),
        SiteType.EDUCATIONAL, List.of(
            "/admin/", "/admin/portal.html", "/students/", "/students/portal.html", "/students/services.html",
            "/faculty/", "/faculty/directory.html", "/courses/", "/courses/catalog.html",
            "/courses/schedule.html", "/research/", "/research/projects.html", "/library/",
            "/admissions/", "/admissions/apply.html", "/departments/"
        ),
        SiteType.NEWS, List.of(
            "/news/", "/news/index.html", "/news/latest.html", "/articles/", "/archive/",
            "/archive/index.html", "/categories/", "/topics/", "/authors/", "/press/",
            "/press/releases.html", "/events/", "/media/", "/about/", "/contact/"
        ),
        SiteType.ECOMMERCE, List.of(
            "/products/", "/products/index.html", "/catalog/", "/categories/", "/collections/",
            "/sale/", "/new/", "/brands/", "/support/", "/support/faq.html", "/shipping/",
            "/returns/", "/about/", "/contact/", "/account/"
        ),
        SiteType.ORGANIZATION, List.of(
            "/about/", "/about/mission.html", "/about/history.html", "/programs/", "/projects/",
            "/members/", "/membership/", "/events/", "/news/", "/reports/", "/reports/annual.html",
            "/donate/", "/volunteer/", "/resources/", "/contact/"
        ),
        SiteType.CORPORATE, List.of(
            "/admin/", "/admin/login.html", "/admin/dashboard.html", "/api/", "/docs/", "/docs/index.html",
            "/support/", "/support/faq.html", "/support/contact.html", "/resources/",
            "/resources/downloads.html", "/products/", "/products/index.html", "/products/catalog.html",
            "/services/", "/services/overview.html", "/about/", "/about/team.html", "/contact/"
        )
    );

    private static final List<String> SEARCH_TERMS = List.of(
        "news", "information", "service", "about", "contact", "help", "search", "index", "list", "archive"
    );

    private FallbackSuggestions() {
    }

    public static List<String> forPrompt(SuggestionPrompt prompt, Clock clock) {
        List<String> values = switch (prompt.kind()) {
            case ROBOTS_ANALYSIS -> PATHS.get(prompt.siteType());
            case DIRECTORY_DISCOVERY, HIERARCHICAL_PARENTS -> directoriesOnly(PATHS.get(prompt.siteType()));
            case SEARCH_QUERIES -> searchTerms(prompt.domain(), clock);
        };
        return values.size() > MAX_FALLBACK_VALUES ? List.copyOf(values.subList(0, MAX_FALLBACK_VALUES)) : values;
    }

    private static List<String> directoriesOnly(List<String> paths) {
        List<String> directories = new ArrayList<>();
        for (String path : paths) {
            if (path.endsWith("/")) {
                directories.add(path);
            }
        }
        return directories;
    }

    private static List<String> searchTerms(String domain, Clock clock) {
        List<String> terms = new ArrayList<>();
        String token = domainToken(domain);
        if (token != null) {
            terms.add(token);
        }
        terms.addAll(SEARCH_TERMS);
        int year = LocalDate.now(clock).getYear();
        terms.add(Integer.toString(year));
        terms.add(Integer.toString(year - 1));
        return terms;
    }

    /**
     * First label of the domain that is not {@code www}, e.g. {@code example} for {@code www.example.com}.
     */
    public static String domainToken(String domain) {
        if (domain == null || domain.isBlank()) {
            return null;
        }
        for (String label : domain.split("\\.")) {
            if (!label.isBlank() && !"www".equalsIgnoreCase(label)) {
                return label.toLowerCase(Locale.ROOT);
            }
        }
        return null;
    }
}
