package com.delta.urlscout.crawl.phase;

import com.delta.urlscout.crawl.extract.ExtractionMode;
import com.delta.urlscout.crawl.frontier.ExpansionKind;
import com.delta.urlscout.crawl.frontier.UrlRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Re-reads pages with the wider extraction mode: link and area tags, every {@code src} and
 * path-like {@code data-*} attributes. Covers pages already expanded by the recursive crawl and
 * pages still queued beyond its depth limit.
 */
@Component
public class AggressiveCrawlPhase implements DiscoveryPhase {
    private static final Logger log = LoggerFactory.getLogger(AggressiveCrawlPhase.class);

    @Override
    public String name() {
        return PhaseNames.AGGRESSIVE;
    }

    @Override
    public PhaseStats run(PhaseContext context) {
        int maxPages = context.properties().getAggressive().getMaxPagesToScan();
        List<UrlRecord> targets = selectTargets(context, maxPages);
        if (targets.isEmpty()) {
            log.info("aggressive crawl found no pages to scan");
            return context.stats().snapshot(PhaseStatus.COMPLETED);
        }

        List<FetchedPage> pages = PageBatchFetcher.runAll(
            context,
            targets,
            record -> new FetchedPage(record, context.get(record.getCanonicalUrl()))
        );
        int scanned = 0;
        for (FetchedPage page : pages) {
            if (!page.fetch().isSuccessful()) {
                continue;
            }
            scanned++;
            int childDepth = page.record().getDepth() + 1;
            for (String link : context.extractLinks(page.fetch(), ExtractionMode.AGGRESSIVE)) {
                context.admit(link, page.url(), childDepth);
            }
        }
        log.info("aggressive crawl targets={} scanned={} new={}", targets.size(), scanned, context.stats().newUrls());
        return context.stats().snapshot(PhaseStatus.COMPLETED);
    }

    private List<UrlRecord> selectTargets(PhaseContext context, int maxPages) {
        Map<String, UrlRecord> ordered = new LinkedHashMap<>();
        for (String url : context.frontier().claimedUrls(ExpansionKind.LINKS)) {
            UrlRecord record = context.frontier().get(url);
            if (record != null && record.isInScope()) {
                ordered.putIfAbsent(record.getCanonicalUrl(), record);
            }
        }
        for (UrlRecord record : context.frontier().pendingSnapshot()) {
            ordered.putIfAbsent(record.getCanonicalUrl(), record);
        }
        List<UrlRecord> targets = new ArrayList<>();
        for (UrlRecord record : ordered.values()) {
            if (targets.size() >= maxPages) {
                break;
            }
            if (context.frontier().claim(ExpansionKind.AGGRESSIVE, record.getCanonicalUrl())) {
                targets.add(record);
            }
        }
        return targets;
    }
}
