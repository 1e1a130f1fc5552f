package com.delta.urlscout.crawl.frontier;

import com.delta.urlscout.config.CrawlerProperties;
import com.delta.urlscout.crawl.service.DiscoveryConfigurationException;
import de.malkusch.whoisServerList.publicSuffixList.PublicSuffixList;
import de.malkusch.whoisServerList.publicSuffixList.PublicSuffixListFactory;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Immutable definition of what belongs to a run: the base URL's registrable domain (or exact host),
 * an optional path prefix and an extension allow/deny policy. In-scope documents such as PDFs are
 * reported but never fetched for link expansion.
 */
public final class ScopeRule {
    private static final PublicSuffixList publicSuffixList = new PublicSuffixListFactory().build();

    private static final Set<String> ASSET_EXTENSIONS = Set.of(
        "jpg", "jpeg", "png", "gif", "bmp", "svg", "webp", "ico", "tif", "tiff", "avif",
        "css", "js", "mjs", "map",
        "woff", "woff2", "ttf", "otf", "eot",
        "mp3", "mp4", "avi", "mov", "wmv", "flv", "webm", "ogg", "wav", "m4a",
        "zip", "rar", "7z", "tar", "gz", "tgz", "bz2", "xz",
        "exe", "dmg", "msi", "apk", "iso", "bin",
        "xml", "json", "csv", "txt", "rss"
    );
    private static final Set<String> OFFICE_EXTENSIONS = Set.of(
        "doc", "docx", "xls", "xlsx", "ppt", "pptx", "odt", "ods", "odp", "rtf"
    );
    private static final Set<String> PAGE_EXTENSIONS = Set.of(
        "html", "htm", "xhtml", "shtml", "php", "asp", "aspx", "jsp", "jspx", "cfm", "do", "action", "pl", "cgi"
    );

    private final String baseUrl;
    private final String scheme;
    private final String baseHost;
    private final String registrableDomain;
    private final boolean includeSubdomains;
    private final String pathPrefix;
    private final Set<String> deniedExtensions;

    private ScopeRule(
        String baseUrl,
        String scheme,
        String baseHost,
        String registrableDomain,
        boolean includeSubdomains,
        String pathPrefix,
        Set<String> deniedExtensions
    ) {
        this.baseUrl = baseUrl;
        this.scheme = scheme;
        this.baseHost = baseHost;
        this.registrableDomain = registrableDomain;
        this.includeSubdomains = includeSubdomains;
        this.pathPrefix = pathPrefix;
        this.deniedExtensions = Set.copyOf(deniedExtensions);
    }

    public static ScopeRule forBaseUrl(String baseUrl, CrawlerProperties.Scope scope) {
        String canonical = UrlNormalizer.normalize(baseUrl == null ? null : withScheme(baseUrl.trim()));
        if (canonical == null) {
            throw new DiscoveryConfigurationException("invalid base URL: " + baseUrl);
        }
        URI uri = URI.create(canonical);
        String host = uri.getHost();
        String domain = registrableDomainOf(host);

        String prefix = scope.getPathPrefix();
        if (prefix != null && !prefix.isBlank()) {
            if (!prefix.startsWith("/")) {
                throw new DiscoveryConfigurationException("scope path prefix must start with '/': " + prefix);
            }
            prefix = UrlNormalizer.normalizePath(prefix);
        } else {
            prefix = "/";
        }

        Set<String> denied = new HashSet<>(ASSET_EXTENSIONS);
        if (!scope.isIncludePdfs()) {
            denied.add("pdf");
        }
        if (!scope.isIncludeOfficeDocuments()) {
            denied.addAll(OFFICE_EXTENSIONS);
        }
        addLowerCase(denied, scope.getDeniedExtensions());
        for (String allowed : scope.getExtraAllowedExtensions()) {
            if (allowed != null) {
                denied.remove(stripDot(allowed));
            }
        }
        String rootUrl = uri.getScheme() + "://" + uri.getRawAuthority() + prefix;
        return new ScopeRule(rootUrl, uri.getScheme(), host, domain, scope.isIncludeSubdomains(), prefix, denied);
    }

    /**
     * Normalized root of the scope, e.g. {@code https://example.com/} or {@code https://example.com/docs}.
     */
    public String rootUrl() {
        return baseUrl;
    }

    public String scheme() {
        return scheme;
    }

    public String baseHost() {
        return baseHost;
    }

    public String registrableDomain() {
        return registrableDomain;
    }

    public String pathPrefix() {
        return pathPrefix;
    }

    public boolean isInScope(String canonicalUrl) {
        URI uri = toUri(canonicalUrl);
        if (uri == null || uri.getHost() == null) {
            return false;
        }
        if (!isHostInScope(uri.getHost().toLowerCase(Locale.ROOT))) {
            return false;
        }
        String path = uri.getRawPath() == null || uri.getRawPath().isEmpty() ? "/" : uri.getRawPath();
        if (!isUnderPrefix(path)) {
            return false;
        }
        String extension = extensionOf(path);
        return extension.isEmpty() || !deniedExtensions.contains(extension);
    }

    /**
     * In scope and worth fetching for links: no extension, or a page-like one.
     */
    public boolean isExpandable(String canonicalUrl) {
        if (!isInScope(canonicalUrl)) {
            return false;
        }
        URI uri = toUri(canonicalUrl);
        String extension = extensionOf(uri == null ? null : uri.getRawPath());
        return extension.isEmpty() || PAGE_EXTENSIONS.contains(extension);
    }

    public boolean isHostInScope(String host) {
        if (host == null) {
            return false;
        }
        String lower = host.toLowerCase(Locale.ROOT);
        if (lower.equals(baseHost) || stripWww(lower).equals(stripWww(baseHost))) {
            return true;
        }
        if (!includeSubdomains) {
            return false;
        }
        return lower.equals(registrableDomain) || lower.endsWith("." + registrableDomain);
    }

    public boolean isUnderPrefix(String path) {
        if ("/".equals(pathPrefix)) {
            return true;
        }
        return path.equals(pathPrefix) || path.startsWith(pathPrefix + "/");
    }

    /**
     * Lower-case extension of the last path segment, or an empty string when there is none.
     * Purely numeric suffixes such as {@code v1.2} do not count as extensions.
     */
    public static String extensionOf(String path) {
        if (path == null || path.isEmpty()) {
            return "";
        }
        String lastSegment = path.substring(path.lastIndexOf('/') + 1);
        int dot = lastSegment.lastIndexOf('.');
        if (dot < 0 || dot == lastSegment.length() - 1) {
            return "";
        }
        String extension = lastSegment.substring(dot + 1).toLowerCase(Locale.ROOT);
        if (extension.length() > 6 || !extension.chars().allMatch(Character::isLetterOrDigit)
            || extension.chars().noneMatch(Character::isLetter)) {
            return "";
        }
        return extension;
    }

    static String registrableDomainOf(String host) {
        String domain;
        try {
            domain = publicSuffixList.getRegistrableDomain(host);
        } catch (RuntimeException e) {
            // IP literals and single-label hosts have no registrable domain
            return host;
        }
        return domain == null ? host : domain.toLowerCase(Locale.ROOT);
    }

    private static String withScheme(String value) {
        if (value.startsWith("http://") || value.startsWith("https://") || value.contains("://")) {
            return value;
        }
        return "https://" + value;
    }

    private static String stripWww(String host) {
        return host.startsWith("www.") ? host.substring(4) : host;
    }

    private static String stripDot(String extension) {
        String trimmed = extension.trim().toLowerCase(Locale.ROOT);
        return trimmed.startsWith(".") ? trimmed.substring(1) : trimmed;
    }

    private static void addLowerCase(Set<String> target, List<String> values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                target.add(stripDot(value));
            }
        }
    }

    private static URI toUri(String url) {
        if (url == null) {
            return null;
        }
        try {
            return new URI(url);
        } catch (URISyntaxException e) {
            return null;
        }
    }
}
