package com.delta.urlscout.crawl.extract;

import com.delta.urlscout.crawl.frontier.UrlNormalizer;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Attribute;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Produces absolute candidate URLs from a fetched document. Extraction is best effort: malformed
 * markup yields whatever could be read, and nothing is ever thrown to the caller.
 */
@Component
public class LinkExtractor {
    private static final Logger log = LoggerFactory.getLogger(LinkExtractor.class);

    private static final Pattern CSS_URL = Pattern.compile("url\\(\\s*['\"]?([^'\")\\s]+)['\"]?\\s*\\)", Pattern.CASE_INSENSITIVE);
    private static final Pattern META_REFRESH_URL = Pattern.compile("url\\s*=\\s*['\"]?([^'\";\\s]+)", Pattern.CASE_INSENSITIVE);
    private static final List<Pattern> SCRIPT_PATTERNS = List.of(
        Pattern.compile("['\"]([^'\"\\s<>]+\\.(?:html?|php|aspx?|jsp)(?:\\?[^'\"\\s<>]*)?)['\"]", Pattern.CASE_INSENSITIVE),
        Pattern.compile("(?:location(?:\\.href)?|href)\\s*=\\s*['\"]([^'\"\\s<>]+)['\"]", Pattern.CASE_INSENSITIVE),
        Pattern.compile("\\burl\\s*:\\s*['\"]([^'\"\\s<>]+)['\"]", Pattern.CASE_INSENSITIVE)
    );
    private static final Set<String> DROPPED_SCHEMES = Set.of("javascript", "mailto", "tel", "data", "ftp", "file", "sms");

    public Set<String> extract(String body, String contentType, String baseUrl) {
        return extractLinks(body, contentType, baseUrl, ExtractionMode.STANDARD).urls();
    }

    public ExtractedLinks extractLinks(String body, String contentType, String baseUrl, ExtractionMode mode) {
        if (body == null || body.isBlank()) {
            return ExtractedLinks.empty();
        }
        LinkedHashSet<String> out = new LinkedHashSet<>();
        int parseErrors = 0;
        try {
            if (isXml(contentType, body)) {
                extractFromXml(body, baseUrl, out);
            } else {
                parseErrors += extractFromHtml(body, baseUrl, mode, out);
            }
        } catch (RuntimeException e) {
            parseErrors++;
            log.debug("Link extraction degraded for {}: {}", baseUrl, e.getMessage());
        }
        return new ExtractedLinks(out, parseErrors);
    }

    private void extractFromXml(String body, String baseUrl, Set<String> out) {
        Document xml = Jsoup.parse(body, "", Parser.xmlParser());
        for (Element loc : xml.select("loc")) {
            addResolved(baseUrl, loc.text(), out);
        }
        for (Element link : xml.select("item > link")) {
            addResolved(baseUrl, link.text(), out);
        }
        for (Element link : xml.select("entry > link[href]")) {
            addResolved(baseUrl, link.attr("href"), out);
        }
    }

    private int extractFromHtml(String body, String baseUrl, ExtractionMode mode, Set<String> out) {
        int parseErrors = 0;
        Document doc = Jsoup.parse(body, baseUrl == null ? "" : baseUrl);
        // reflects <base href> when the page declares one
        String documentBase = doc.baseUri();
        for (Element anchor : doc.select("a[href]")) {
            addAttribute(anchor, "href", out);
        }
        for (Element form : doc.select("form[action]")) {
            addAttribute(form, "action", out);
        }
        for (Element frame : doc.select("frame[src], iframe[src]")) {
            addAttribute(frame, "src", out);
        }
        for (Element meta : doc.select("meta[http-equiv=refresh]")) {
            Matcher matcher = META_REFRESH_URL.matcher(meta.attr("content"));
            if (matcher.find()) {
                addResolved(documentBase, matcher.group(1), out);
            }
        }
        for (Element style : doc.select("style")) {
            collectMatches(CSS_URL, style.data(), documentBase, out);
        }
        for (Element styled : doc.select("[style]")) {
            collectMatches(CSS_URL, styled.attr("style"), documentBase, out);
        }
        for (Element script : doc.select("script")) {
            String code = script.data();
            if (code == null || code.isBlank()) {
                continue;
            }
            try {
                for (Pattern pattern : SCRIPT_PATTERNS) {
                    collectMatches(pattern, code, documentBase, out);
                }
            } catch (RuntimeException e) {
                parseErrors++;
            }
        }
        if (mode == ExtractionMode.AGGRESSIVE) {
            for (Element link : doc.select("link[href], area[href]")) {
                addAttribute(link, "href", out);
            }
            for (Element withSrc : doc.select("[src]")) {
                addAttribute(withSrc, "src", out);
            }
            for (Element element : doc.getAllElements()) {
                for (Attribute attribute : element.attributes()) {
                    if (attribute.getKey().startsWith("data-") && looksLikePath(attribute.getValue())) {
                        addAttribute(element, attribute.getKey(), out);
                    }
                }
            }
        }
        return parseErrors;
    }

    private void collectMatches(Pattern pattern, String text, String baseUrl, Set<String> out) {
        if (text == null || text.isBlank()) {
            return;
        }
        Matcher matcher = pattern.matcher(text);
        while (matcher.find()) {
            addResolved(baseUrl, matcher.group(1), out);
        }
    }

    private boolean looksLikePath(String value) {
        if (value == null) {
            return false;
        }
        String trimmed = value.trim();
        if (trimmed.isEmpty() || trimmed.length() > 2048 || trimmed.contains(" ")) {
            return false;
        }
        String lower = trimmed.toLowerCase(Locale.ROOT);
        return lower.startsWith("/") || lower.startsWith("http://") || lower.startsWith("https://")
            || lower.contains(".htm");
    }

    private boolean isXml(String contentType, String body) {
        if (contentType != null) {
            String lower = contentType.toLowerCase(Locale.ROOT);
            if (lower.contains("html")) {
                return false;
            }
            if (lower.contains("xml")) {
                return true;
            }
        }
        String head = body.stripLeading();
        head = head.substring(0, Math.min(head.length(), 512)).toLowerCase(Locale.ROOT);
        return head.startsWith("<?xml") && (head.contains("<urlset") || head.contains("<sitemapindex")
            || head.contains("<rss") || head.contains("<feed"));
    }

    private void addAttribute(Element element, String attribute, Set<String> out) {
        if (isSkipped(element.attr(attribute))) {
            return;
        }
        addAbsolute(element.absUrl(attribute), out);
    }

    private void addResolved(String baseUrl, String raw, Set<String> out) {
        if (isSkipped(raw)) {
            return;
        }
        String value = UrlNormalizer.escape(raw.trim());
        try {
            URI relative = new URI(value);
            if (relative.isAbsolute() || baseUrl == null || baseUrl.isBlank()) {
                addAbsolute(relative.toString(), out);
                return;
            }
            URI base = new URI(UrlNormalizer.escape(baseUrl.trim()));
            if (base.getRawPath() == null || base.getRawPath().isEmpty()) {
                base = base.resolve("/");
            }
            addAbsolute(base.resolve(relative).toString(), out);
        } catch (URISyntaxException | IllegalArgumentException e) {
            log.debug("Unresolvable reference {} against {}: {}", raw, baseUrl, e.getMessage());
        }
    }

    /**
     * Adds {@code absolute} in a form {@link URI} accepts, when it is an http(s) URL with a host.
     */
    private void addAbsolute(String absolute, Set<String> out) {
        if (absolute == null || absolute.isBlank()) {
            return;
        }
        try {
            URI uri = new URI(UrlNormalizer.escape(absolute.trim()));
            String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
            if ((scheme.equals("http") || scheme.equals("https")) && uri.getHost() != null) {
                out.add(uri.toString());
            }
        } catch (URISyntaxException e) {
            log.debug("Dropping malformed link {}: {}", absolute, e.getMessage());
        }
    }

    private static boolean isSkipped(String raw) {
        if (raw == null) {
            return true;
        }
        String value = raw.trim();
        if (value.isEmpty() || value.startsWith("#")) {
            return true;
        }
        int colon = value.indexOf(':');
        return colon > 0 && DROPPED_SCHEMES.contains(value.substring(0, colon).toLowerCase(Locale.ROOT));
    }
}
