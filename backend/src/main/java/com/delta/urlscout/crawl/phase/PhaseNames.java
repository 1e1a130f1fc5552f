package com.delta.urlscout.crawl.phase;

import java.util.List;

/**
 * Phase identifiers as they appear in output files ({@code source_module}), in execution order.
 */
public final class PhaseNames {
    public static final String SITEMAP = "sitemap_discovery";
    public static final String ROBOTS = "robots_analysis";
    public static final String ARCHIVE = "archive_seeding";
    public static final String RECURSIVE = "recursive_crawl";
    public static final String HIERARCHICAL = "hierarchical_crawl";
    public static final String DIRECTORY = "directory_probing";
    public static final String PATH_EXPLORATION = "path_exploration";
    public static final String PATTERN = "pattern_generation";
    public static final String AGGRESSIVE = "aggressive_crawl";
    public static final String FORM_SEARCH = "form_search_probing";

    public static final List<String> ORDER = List.of(
        SITEMAP,
        ROBOTS,
        ARCHIVE,
        RECURSIVE,
        HIERARCHICAL,
        DIRECTORY,
        PATH_EXPLORATION,
        PATTERN,
        AGGRESSIVE,
        FORM_SEARCH
    );

    private PhaseNames() {
    }
}
