package com.delta.urlscout.crawl.phase;

import com.delta.urlscout.config.CrawlerProperties;
import com.delta.urlscout.crawl.frontier.ScopeRule;
import com.delta.urlscout.crawl.frontier.UrlRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Model-free variations of the paths found so far: singular and plural forms and listing pages
 * of frequent directories, common file names with the extensions the site uses, and the same
 * pages under other language prefixes. Every variation is existence-checked before admission.
 */
@Component
public class PathExplorationPhase implements DiscoveryPhase {
    private static final Logger log = LoggerFactory.getLogger(PathExplorationPhase.class);

    static final List<String> LISTING_SUFFIXES = List.of("archive", "list", "index", "all", "latest");
    static final List<String> COMMON_FILENAMES = List.of(
        "index", "default", "main", "home", "about", "contact", "info", "help", "search", "sitemap", "news", "blog"
    );
    static final List<String> LANGUAGE_CODES = List.of("en", "ja", "zh", "ko", "es", "fr", "de", "it", "pt", "ru");
    private static final Pattern NUMERIC = Pattern.compile("\\d+");
    private static final int MAX_EXTENSIONS = 3;
    private static final int MAX_LANGUAGE_SOURCES = 20;

    @Override
    public String name() {
        return PhaseNames.PATH_EXPLORATION;
    }

    @Override
    public PhaseStats run(PhaseContext context) {
        CrawlerProperties.PathExploration settings = context.properties().getPathExploration();
        List<String> paths = new ArrayList<>();
        for (UrlRecord record : context.frontier().inScopeRecords()) {
            String path = URI.create(record.getCanonicalUrl()).getRawPath();
            paths.add(path == null || path.isEmpty() ? "/" : path);
        }

        Set<String> generated = generate(paths, settings.getMinSegmentFrequency());
        List<String> candidates = new ArrayList<>();
        for (String path : generated) {
            if (candidates.size() >= settings.getMaxGeneratedUrls()) {
                break;
            }
            String url = CandidatePaths.resolve(context, path);
            if (url != null && !context.frontier().contains(url)) {
                candidates.add(url);
            }
        }

        List<ProbeResult> found = PageBatchFetcher.runAll(context, candidates, url -> {
            ProbeResult probe = context.probe(url);
            return probe.exists() ? probe : null;
        });
        for (ProbeResult probe : found) {
            context.admit(probe.url(), null, 1);
        }
        log.info(
            "path exploration analyzed={} generated={} checked={} found={} new={}",
            paths.size(),
            generated.size(),
            candidates.size(),
            found.size(),
            context.stats().newUrls()
        );
        return context.stats().snapshot(PhaseStatus.COMPLETED);
    }

    /**
     * Candidate paths derived from {@code paths}, most promising first.
     */
    static Set<String> generate(List<String> paths, int minFrequency) {
        Map<String, Integer> directoryCounts = new LinkedHashMap<>();
        Map<String, Integer> extensionCounts = new HashMap<>();
        Set<String> languageSources = new LinkedHashSet<>();
        Set<String> languagesSeen = new LinkedHashSet<>();

        for (String path : paths) {
            List<String> segments = segments(path);
            StringBuilder directory = new StringBuilder();
            for (int i = 0; i < segments.size() - 1; i++) {
                directory.append('/').append(segments.get(i));
                directoryCounts.merge(directory.toString(), 1, Integer::sum);
            }
            String extension = ScopeRule.extensionOf(path);
            if (!extension.isEmpty()) {
                extensionCounts.merge(extension, 1, Integer::sum);
            }
            if (!segments.isEmpty() && LANGUAGE_CODES.contains(segments.get(0))) {
                languagesSeen.add(segments.get(0));
                if (segments.size() > 1 && languageSources.size() < MAX_LANGUAGE_SOURCES) {
                    languageSources.add(String.join("/", segments.subList(1, segments.size())));
                }
            }
        }

        Set<String> generated = new LinkedHashSet<>();
        directoryCounts.entrySet().stream()
            .filter(entry -> entry.getValue() >= minFrequency)
            .sorted(Map.Entry.<String, Integer>comparingByValue().reversed())
            .forEach(entry -> addDirectoryVariations(entry.getKey(), generated));

        List<String> extensions = extensionCounts.entrySet().stream()
            .filter(entry -> isPageExtension(entry.getKey()))
            .sorted(Map.Entry.<String, Integer>comparingByValue().reversed().thenComparing(Map.Entry.comparingByKey()))
            .limit(MAX_EXTENSIONS)
            .map(Map.Entry::getKey)
            .toList();
        for (String extension : extensions) {
            for (String filename : COMMON_FILENAMES) {
                generated.add("/" + filename + "." + extension);
            }
        }

        if (!languagesSeen.isEmpty()) {
            for (String rest : languageSources) {
                for (String language : LANGUAGE_CODES) {
                    if (!languagesSeen.contains(language)) {
                        generated.add("/" + language + "/" + rest);
                    }
                }
            }
        }
        generated.removeIf(path -> paths.contains(path) || paths.contains(path.endsWith("/") ? path.substring(0, path.length() - 1) : path));
        return generated;
    }

    private static void addDirectoryVariations(String directory, Set<String> out) {
        int slash = directory.lastIndexOf('/');
        String parent = directory.substring(0, slash + 1);
        String segment = directory.substring(slash + 1);
        if (segment.length() < 2 || NUMERIC.matcher(segment).matches() || LANGUAGE_CODES.contains(segment)) {
            return;
        }
        if (segment.endsWith("s") && segment.length() > 2) {
            out.add(parent + segment.substring(0, segment.length() - 1) + "/");
        } else if (!segment.endsWith("s")) {
            out.add(parent + segment + "s/");
        }
        for (String suffix : LISTING_SUFFIXES) {
            out.add(directory + "/" + suffix + "/");
        }
    }

    private static boolean isPageExtension(String extension) {
        return switch (extension) {
            case "html", "htm", "php", "asp", "aspx", "jsp", "shtml", "cfm" -> true;
            default -> false;
        };
    }

    private static List<String> segments(String path) {
        List<String> segments = new ArrayList<>();
        for (String segment : path.split("/")) {
            if (!segment.isEmpty()) {
                segments.add(segment);
            }
        }
        return segments;
    }
}
