package com.delta.urlscout.crawl.phase;

import com.delta.urlscout.config.CrawlerProperties;
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
 * One pass of existence checks over a fixed list of common directories plus suggested ones.
 */
@Component
public class DirectoryProbingPhase implements DiscoveryPhase {
    private static final Logger log = LoggerFactory.getLogger(DirectoryProbingPhase.class);

    static final List<String> COMMON_DIRECTORIES = List.of(
        // administration
        "/admin/", "/administration/", "/manage/", "/management/", "/control/", "/console/", "/dashboard/",
        "/panel/", "/backend/", "/system/", "/config/", "/settings/", "/tools/",
        // information
        "/about/", "/info/", "/information/", "/overview/", "/profile/", "/company/", "/organization/",
        "/corporate/", "/history/", "/mission/", "/vision/", "/team/", "/staff/", "/leadership/", "/board/",
        // services
        "/services/", "/service/", "/products/", "/product/", "/solutions/", "/offerings/", "/programs/",
        "/program/", "/plans/", "/features/",
        // resources
        "/resources/", "/resource/", "/documents/", "/document/", "/files/", "/downloads/", "/download/",
        "/library/", "/archive/", "/archives/", "/catalog/", "/collection/", "/gallery/", "/portfolio/",
        "/forms/", "/guides/", "/manuals/", "/documentation/", "/docs/",
        // news
        "/news/", "/press/", "/media/", "/blog/", "/articles/", "/posts/", "/updates/", "/announcements/",
        "/releases/", "/events/", "/newsletter/", "/magazine/", "/journal/",
        // support
        "/support/", "/help/", "/contact/", "/feedback/", "/customer/", "/faq/", "/questions/", "/helpdesk/",
        // content
        "/content/", "/pages/", "/page/", "/sections/", "/categories/", "/category/", "/topics/", "/topic/",
        "/departments/", "/department/", "/divisions/",
        // portal
        "/portal/", "/gateway/", "/main/", "/home/", "/index/", "/start/", "/welcome/", "/sitemap/",
        // data
        "/data/", "/statistics/", "/stats/", "/reports/", "/report/", "/research/", "/studies/", "/surveys/",
        // search
        "/search/", "/find/", "/browse/", "/explore/", "/directory/"
    );

    @Override
    public String name() {
        return PhaseNames.DIRECTORY;
    }

    @Override
    public PhaseStats run(PhaseContext context) {
        CrawlerProperties.DirectoryProbe settings = context.properties().getDirectoryProbe();

        Set<String> directories = new LinkedHashSet<>(COMMON_DIRECTORIES);
        for (String extra : settings.getExtraDirectories()) {
            if (extra != null && !extra.isBlank()) {
                directories.add(CandidatePaths.asDirectory(extra.trim()));
            }
        }
        if (settings.isUseSuggestions() && !context.shouldStop()) {
            Suggestion suggestion = context.suggest(SuggestionPrompt.of(
                PromptKind.DIRECTORY_DISCOVERY,
                context.domain(),
                RobotsAnalysisPhase.sampleUrls(context),
                List.of()
            ));
            directories.addAll(suggestion.values());
        }

        String prefix = context.scope().pathPrefix();
        List<String> candidates = new ArrayList<>();
        for (String directory : directories) {
            String path = "/".equals(prefix) ? directory : prefix + (directory.startsWith("/") ? directory : "/" + directory);
            String url = CandidatePaths.resolve(context, path);
            if (url != null && !context.frontier().contains(url)) {
                candidates.add(url);
            }
            if (candidates.size() >= settings.getMaxCandidates()) {
                break;
            }
        }

        List<ProbeResult> found = PageBatchFetcher.runAll(context, candidates, url -> {
            ProbeResult probe = context.probe(url);
            return probe.exists() ? probe : null;
        });
        for (ProbeResult probe : found) {
            context.admit(probe.url(), null, 1);
        }
        log.info("directory probing candidates={} found={} new={}", candidates.size(), found.size(), context.stats().newUrls());
        return context.stats().snapshot(PhaseStatus.COMPLETED);
    }
}
