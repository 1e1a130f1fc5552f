package com.delta.urlscout.crawl.phase;

import com.delta.urlscout.config.CrawlerProperties;
import com.delta.urlscout.crawl.extract.ExtractionMode;
import com.delta.urlscout.crawl.frontier.ExpansionKind;
import com.delta.urlscout.crawl.frontier.UrlNormalizer;
import com.delta.urlscout.crawl.frontier.UrlRecord;
import com.delta.urlscout.crawl.suggest.PromptKind;
import com.delta.urlscout.crawl.suggest.Suggestion;
import com.delta.urlscout.crawl.suggest.SuggestionPrompt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Walks up the path of every known page ({@code /a/b/c} to {@code /a/b/} to {@code /a/}) and
 * fetches each parent once. A parent that answers is admitted together with the links on it
 * that point below it.
 */
@Component
public class HierarchicalCrawlPhase implements DiscoveryPhase {
    private static final Logger log = LoggerFactory.getLogger(HierarchicalCrawlPhase.class);

    @Override
    public String name() {
        return PhaseNames.HIERARCHICAL;
    }

    @Override
    public PhaseStats run(PhaseContext context) {
        CrawlerProperties.Hierarchical settings = context.properties().getHierarchical();

        Map<String, String> parentToSource = new LinkedHashMap<>();
        for (UrlRecord record : context.frontier().inScopeRecords()) {
            String origin = originOf(record.getCanonicalUrl());
            if (origin == null) {
                continue;
            }
            for (String parentPath : parentPaths(record.getCanonicalUrl(), settings.getMaxParentLevels())) {
                if (context.scope().isInScope(origin + stripSlash(parentPath))) {
                    parentToSource.putIfAbsent(origin + parentPath, record.getCanonicalUrl());
                }
            }
        }
        if (settings.isUseSuggestions() && !context.shouldStop()) {
            Suggestion suggestion = context.suggest(SuggestionPrompt.of(
                PromptKind.HIERARCHICAL_PARENTS,
                context.domain(),
                RobotsAnalysisPhase.sampleUrls(context),
                List.of()
            ));
            for (String path : suggestion.values()) {
                String url = CandidatePaths.resolve(context, path);
                if (url != null) {
                    parentToSource.putIfAbsent(url, null);
                }
            }
        }

        List<String> parents = new ArrayList<>();
        for (String parent : parentToSource.keySet()) {
            if (context.frontier().claim(ExpansionKind.PARENTS, parent)) {
                parents.add(parent);
            }
        }

        List<ProbeResult> answered = PageBatchFetcher.runAll(context, parents, parent -> {
            ProbeResult probe = new ProbeResult(parent, false, false, context.get(parent));
            if (!probe.fetch().isSuccessful() || context.isSoft404(parent, probe.fetch())) {
                return null;
            }
            return new ProbeResult(parent, true, false, probe.fetch());
        });
        CrawlerProperties.ChildMatch childMatch = settings.getChildMatch();
        for (ProbeResult parent : answered) {
            context.admit(parent.url(), parentToSource.get(parent.url()));
            String parentCanonical = UrlNormalizer.normalize(parent.url());
            String parentOrigin = originOf(parentCanonical);
            String parentPath = pathOf(parentCanonical);
            for (String link : context.extractLinks(parent.fetch(), ExtractionMode.STANDARD)) {
                String canonical = UrlNormalizer.normalize(link);
                if (canonical != null
                    && (childMatch == CrawlerProperties.ChildMatch.ANY || Objects.equals(parentOrigin, originOf(canonical)))
                    && isChild(parentPath, pathOf(canonical), childMatch)) {
                    context.admit(link, parent.url());
                }
            }
        }
        log.info(
            "hierarchical crawl parents={} answered={} new={} childMatch={}",
            parents.size(),
            answered.size(),
            context.stats().newUrls(),
            childMatch
        );
        return context.stats().snapshot(PhaseStatus.COMPLETED);
    }

    /**
     * Parent directories of the URL's path, nearest first, excluding the root.
     */
    static List<String> parentPaths(String url, int maxLevels) {
        String path = pathOf(url);
        List<String> parents = new ArrayList<>();
        if (path == null) {
            return parents;
        }
        String current = stripSlash(path);
        while (parents.size() < maxLevels) {
            int slash = current.lastIndexOf('/');
            if (slash <= 0) {
                break;
            }
            current = current.substring(0, slash);
            parents.add(current + "/");
        }
        return parents;
    }

    static boolean isChild(String parentPath, String candidatePath, CrawlerProperties.ChildMatch mode) {
        if (parentPath == null || candidatePath == null) {
            return false;
        }
        String parent = stripSlash(parentPath);
        String child = stripSlash(candidatePath);
        if (child.equals(parent)) {
            return false;
        }
        return switch (mode) {
            case ANY -> true;
            case PREFIX -> child.startsWith(parent);
            case SEGMENT -> "/".equals(parent) || parent.isEmpty() || child.startsWith(parent + "/");
        };
    }

    private static String pathOf(String url) {
        if (url == null) {
            return null;
        }
        try {
            String path = URI.create(url).getRawPath();
            return path == null || path.isEmpty() ? "/" : path;
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    /**
     * {@code scheme://authority} of the URL, or {@code null} when it cannot be parsed.
     */
    static String originOf(String url) {
        if (url == null) {
            return null;
        }
        try {
            URI uri = URI.create(url);
            if (uri.getScheme() == null || uri.getRawAuthority() == null) {
                return null;
            }
            return uri.getScheme() + "://" + uri.getRawAuthority();
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    private static String stripSlash(String path) {
        return path.length() > 1 && path.endsWith("/") ? path.substring(0, path.length() - 1) : path;
    }
}
