package com.delta.urlscout.crawl.phase;

import com.delta.urlscout.crawl.frontier.UrlNormalizer;

/**
 * Resolution of generated or suggested paths against the run's base URL.
 */
final class CandidatePaths {
    private CandidatePaths() {
    }

    /**
     * Absolute in-scope URL for {@code pathOrUrl}, or {@code null} when it falls outside the scope.
     * Directory paths keep their trailing slash so that servers see the form they publish.
     */
    static String resolve(PhaseContext context, String pathOrUrl) {
        if (pathOrUrl == null || pathOrUrl.isBlank()) {
            return null;
        }
        String value = pathOrUrl.trim();
        String absolute = value.startsWith("http://") || value.startsWith("https://")
            ? value
            : context.origin() + (value.startsWith("/") ? value : "/" + value);
        String canonical = UrlNormalizer.normalize(absolute);
        if (canonical == null || !context.scope().isInScope(canonical)) {
            return null;
        }
        return absolute;
    }

    /**
     * {@code /a/b/} for {@code /a/b}; the root stays {@code /}.
     */
    static String asDirectory(String path) {
        if (path == null || path.isEmpty()) {
            return "/";
        }
        return path.endsWith("/") ? path : path + "/";
    }
}
