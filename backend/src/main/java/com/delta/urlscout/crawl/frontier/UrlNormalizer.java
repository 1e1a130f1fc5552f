package com.delta.urlscout.crawl.frontier;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Canonical form used as the frontier key: lower-case scheme and host, no default port, no dot
 * segments or repeated slashes, no trailing slash except at the root, tracking parameters removed,
 * remaining query parameters sorted, fragment dropped. Applying it twice yields the same string.
 */
public final class UrlNormalizer {
    private static final Set<String> TRACKING_PARAMS = Set.of(
        "gclid",
        "dclid",
        "fbclid",
        "msclkid",
        "yclid",
        "mc_cid",
        "mc_eid",
        "_ga",
        "_gl",
        "igshid",
        "ref",
        "ref_src",
        "source",
        "gh_src",
        "lever-source"
    );
    private static final String ILLEGAL_CHARS = " \"<>\\^`{|}";

    private UrlNormalizer() {
    }

    public static String normalize(String raw) {
        return normalize(raw, null);
    }

    /**
     * Normalizes {@code raw}, resolving it against {@code baseUrl} when it is relative.
     * Returns {@code null} for anything that is not an absolute http(s) URL with a host.
     */
    public static String normalize(String raw, String baseUrl) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String value = escape(raw.trim());
        try {
            URI uri = new URI(value);
            if (!uri.isAbsolute()) {
                if (baseUrl == null || baseUrl.isBlank()) {
                    return null;
                }
                URI base = new URI(escape(baseUrl.trim()));
                if (base.getRawPath() == null || base.getRawPath().isEmpty()) {
                    base = base.resolve("/");
                }
                uri = base.resolve(uri);
            }
            return canonicalize(uri);
        } catch (URISyntaxException | IllegalArgumentException e) {
            return null;
        }
    }

    public static boolean isTrackingParam(String key) {
        if (key == null || key.isBlank()) {
            return false;
        }
        String lower = key.toLowerCase(Locale.ROOT);
        return lower.startsWith("utm_") || TRACKING_PARAMS.contains(lower);
    }

    private static String canonicalize(URI uri) {
        String scheme = uri.getScheme() == null ? null : uri.getScheme().toLowerCase(Locale.ROOT);
        if (!"http".equals(scheme) && !"https".equals(scheme)) {
            return null;
        }
        String host = uri.getHost();
        if (host == null || host.isBlank()) {
            return null;
        }
        host = host.toLowerCase(Locale.ROOT);
        while (host.endsWith(".")) {
            host = host.substring(0, host.length() - 1);
        }
        if (host.isEmpty()) {
            return null;
        }
        int port = uri.getPort();
        if (("http".equals(scheme) && port == 80) || ("https".equals(scheme) && port == 443)) {
            port = -1;
        }

        StringBuilder out = new StringBuilder();
        out.append(scheme).append("://").append(host);
        if (port > 0) {
            out.append(':').append(port);
        }
        out.append(normalizePath(uri.getRawPath()));
        String query = normalizeQuery(uri.getRawQuery());
        if (query != null) {
            out.append('?').append(query);
        }
        return out.toString();
    }

    static String normalizePath(String rawPath) {
        if (rawPath == null || rawPath.isEmpty()) {
            return "/";
        }
        String path = rawPath.replaceAll("/{2,}", "/");
        List<String> segments = new ArrayList<>();
        for (String segment : path.split("/", -1)) {
            if (segment.isEmpty() || segment.equals(".")) {
                continue;
            }
            if (segment.equals("..")) {
                if (!segments.isEmpty()) {
                    segments.remove(segments.size() - 1);
                }
                continue;
            }
            segments.add(upperCaseEscapes(segment));
        }
        if (segments.isEmpty()) {
            return "/";
        }
        return "/" + String.join("/", segments);
    }

    static String normalizeQuery(String rawQuery) {
        if (rawQuery == null || rawQuery.isBlank()) {
            return null;
        }
        List<String> kept = new ArrayList<>();
        for (String part : rawQuery.split("&")) {
            if (part.isBlank()) {
                continue;
            }
            int eq = part.indexOf('=');
            String key = eq >= 0 ? part.substring(0, eq) : part;
            if (isTrackingParam(key)) {
                continue;
            }
            kept.add(upperCaseEscapes(part));
        }
        if (kept.isEmpty()) {
            return null;
        }
        kept.sort(null);
        return String.join("&", kept);
    }

    /**
     * Percent-encodes the characters browsers tolerate in an href but {@link URI} rejects, and
     * any {@code %} that does not start an escape.
     */
    public static String escape(String value) {
        StringBuilder out = new StringBuilder(value.length() + 8);
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == '%' && !(i + 2 < value.length() && isHex(value.charAt(i + 1)) && isHex(value.charAt(i + 2)))) {
                out.append("%25");
            } else if (ILLEGAL_CHARS.indexOf(c) >= 0 || c < 0x20) {
                out.append(String.format(Locale.ROOT, "%%%02X", (int) c));
            } else {
                out.append(c);
            }
        }
        return out.toString();
    }

    private static String upperCaseEscapes(String value) {
        if (value.indexOf('%') < 0) {
            return value;
        }
        StringBuilder out = new StringBuilder(value);
        for (int i = 0; i + 2 < out.length(); i++) {
            if (out.charAt(i) == '%' && isHex(out.charAt(i + 1)) && isHex(out.charAt(i + 2))) {
                out.setCharAt(i + 1, Character.toUpperCase(out.charAt(i + 1)));
                out.setCharAt(i + 2, Character.toUpperCase(out.charAt(i + 2)));
                i += 2;
            }
        }
        return out.toString();
    }

    private static boolean isHex(char c) {
        return (c >= '0' && c <= '9') || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }
}
