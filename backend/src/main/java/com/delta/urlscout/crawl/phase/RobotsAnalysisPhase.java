package com.delta.urlscout.crawl.phase;

import com.delta.urlscout.config.CrawlerProperties;
import com.delta.urlscout.crawl.model.SitemapDiscoveryResult;
import com.delta.urlscout.crawl.model.SitemapUrlEntry;
import com.delta.urlscout.crawl.robots.RobotsRules;
import com.delta.urlscout.crawl.suggest.PromptKind;
import com.delta.urlscout.crawl.suggest.Suggestion;
import com.delta.urlscout.crawl.suggest.SuggestionPrompt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Reads robots.txt and ai.txt. Sitemap hints are expanded; restricted paths are never queued
 * directly but handed to the suggestion service, and the public paths it proposes are admitted
 * once they are shown to exist.
 */
@Component
public class RobotsAnalysisPhase implements DiscoveryPhase {
    private static final Logger log = LoggerFactory.getLogger(RobotsAnalysisPhase.class);
    private static final int SAMPLE_SIZE = 10;

    @Override
    public String name() {
        return PhaseNames.ROBOTS;
    }

    @Override
    public PhaseStats run(PhaseContext context) {
        String robotsUrl = context.origin() + "/robots.txt";
        RobotsRules robots = context.robotsTxtService().getRules(context.rootUrl());
        RobotsRules aiTxt = context.robotsTxtService().getAiTxtRules(context.rootUrl());

        Set<String> sitemapHints = new LinkedHashSet<>(robots.getSitemapUrls());
        sitemapHints.addAll(aiTxt.getSitemapUrls());
        sitemapHints.removeAll(context.processedSitemaps());
        if (!sitemapHints.isEmpty() && !context.shouldStop()) {
            CrawlerProperties.Sitemap settings = context.properties().getSitemap();
            SitemapDiscoveryResult result = context.sitemapService().discover(
                new ArrayList<>(sitemapHints),
                context.processedSitemaps(),
                settings.getMaxDepth(),
                settings.getMaxSitemaps(),
                settings.getMaxUrls(),
                context::shouldStop
            );
            SitemapDiscoveryPhase.recordSitemapOutcome(context, result);
            for (SitemapUrlEntry entry : result.urls()) {
                context.admit(entry.url(), entry.sitemapUrl(), 0);
            }
        }

        Set<String> pathHints = new LinkedHashSet<>(robots.getDisallowedPaths());
        pathHints.addAll(robots.getAllowedPaths());
        pathHints.addAll(aiTxt.getDisallowedPaths());
        pathHints.addAll(aiTxt.getAllowedPaths());
        if (pathHints.isEmpty() || context.shouldStop()) {
            log.info("robots analysis sitemapHints={} pathHints=0 new={}", sitemapHints.size(), context.stats().newUrls());
            return context.stats().snapshot(PhaseStatus.COMPLETED);
        }

        Suggestion suggestion = context.suggest(SuggestionPrompt.of(
            PromptKind.ROBOTS_ANALYSIS,
            context.domain(),
            sampleUrls(context),
            new ArrayList<>(pathHints)
        ));
        List<String> candidates = new ArrayList<>();
        for (String path : suggestion.values()) {
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
            context.admit(probe.url(), robotsUrl, 1);
        }
        log.info(
            "robots analysis sitemapHints={} pathHints={} suggestions={} source={} confirmed={} new={}",
            sitemapHints.size(),
            pathHints.size(),
            suggestion.values().size(),
            suggestion.source(),
            found.size(),
            context.stats().newUrls()
        );
        return context.stats().snapshot(PhaseStatus.COMPLETED);
    }

    static List<String> sampleUrls(PhaseContext context) {
        List<String> samples = new ArrayList<>();
        context.frontier().inScopeRecords().stream()
            .limit(SAMPLE_SIZE)
            .forEach(record -> samples.add(record.getCanonicalUrl()));
        return samples;
    }
}
