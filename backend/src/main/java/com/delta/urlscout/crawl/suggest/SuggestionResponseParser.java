package com.delta.urlscout.crawl.suggest;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Turns a free-text model answer into site paths or search terms. Lines that cannot be read are
 * dropped; an answer with no usable line parses to an empty list.
 */
public final class SuggestionResponseParser {
    private static final Pattern LIST_MARKER = Pattern.compile("^(?:[-*+•]+|\\d+[.)]|\\d+\\s*-)\\s*");
    private static final Pattern SEARCH_OPERATOR = Pattern.compile("\\b(?:site|inurl|intitle|filetype):", Pattern.CASE_INSENSITIVE);
    private static final int MAX_URL_LENGTH = 500;
    private static final int MAX_TERM_LENGTH = 80;

    private SuggestionResponseParser() {
    }

    public static List<String> parse(String response, PromptKind kind, String domain, int maxValues) {
        if (response == null || response.isBlank()) {
            return List.of();
        }
        Set<String> values = new LinkedHashSet<>();
        for (String rawLine : response.split("\\R")) {
            if (values.size() >= maxValues) {
                break;
            }
            String line = cleanLine(rawLine);
            if (line == null) {
                continue;
            }
            String value = kind.returnsPaths() ? toPath(line, domain) : toTerm(line);
            if (value != null) {
                values.add(value);
            }
        }
        return new ArrayList<>(values);
    }

    private static String cleanLine(String rawLine) {
        String line = rawLine.trim();
        if (line.isEmpty() || line.startsWith("#") || line.startsWith("//") || line.startsWith("```")) {
            return null;
        }
        line = LIST_MARKER.matcher(line).replaceFirst("").trim();
        line = stripQuotes(line);
        return line.isEmpty() ? null : line;
    }

    static String toPath(String line, String domain) {
        String candidate = line.split("\\s+")[0];
        candidate = stripQuotes(candidate);
        while (candidate.endsWith(",") || candidate.endsWith(";")) {
            candidate = candidate.substring(0, candidate.length() - 1);
        }
        candidate = stripQuotes(candidate);
        String path;
        if (candidate.toLowerCase(Locale.ROOT).startsWith("http")) {
            path = pathOnDomain(candidate, domain);
        } else if (candidate.startsWith("/")) {
            path = candidate;
        } else if (candidate.contains("/") && !candidate.contains(":")) {
            path = "/" + candidate;
        } else {
            path = null;
        }
        if (path == null || path.length() >= MAX_URL_LENGTH) {
            return null;
        }
        int query = path.indexOf('?');
        String pathOnly = query >= 0 ? path.substring(0, query) : path;
        String lastSegment = pathOnly.substring(pathOnly.lastIndexOf('/') + 1).toLowerCase(Locale.ROOT);
        if (pathOnly.endsWith("/") || lastSegment.endsWith(".html") || lastSegment.endsWith(".htm")
            || !lastSegment.contains(".")) {
            return path;
        }
        return null;
    }

    private static String pathOnDomain(String url, String domain) {
        try {
            URI uri = new URI(url);
            String host = uri.getHost();
            if (host == null || domain == null) {
                return null;
            }
            String lowerHost = host.toLowerCase(Locale.ROOT);
            String lowerDomain = domain.toLowerCase(Locale.ROOT);
            if (!lowerHost.equals(lowerDomain) && !lowerHost.endsWith("." + lowerDomain)) {
                return null;
            }
            String path = uri.getRawPath() == null || uri.getRawPath().isEmpty() ? "/" : uri.getRawPath();
            return uri.getRawQuery() == null ? path : path + "?" + uri.getRawQuery();
        } catch (URISyntaxException e) {
            return null;
        }
    }

    private static String toTerm(String line) {
        if (SEARCH_OPERATOR.matcher(line).find()) {
            return null;
        }
        String term = line.replaceAll("\\s+", " ").trim();
        if (term.isEmpty() || term.length() > MAX_TERM_LENGTH) {
            return null;
        }
        return term;
    }

    private static String stripQuotes(String value) {
        String result = value;
        while (result.length() >= 1 && isQuote(result.charAt(0))) {
            result = result.substring(1);
        }
        while (result.length() >= 1 && isQuote(result.charAt(result.length() - 1))) {
            result = result.substring(0, result.length() - 1);
        }
        return result.trim();
    }

    private static boolean isQuote(char c) {
        return c == '"' || c == '\'' || c == '`';
    }
}
