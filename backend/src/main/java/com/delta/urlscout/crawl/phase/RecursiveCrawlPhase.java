package com.delta.urlscout.crawl.phase;

import com.delta.urlscout.crawl.extract.ExtractionMode;
import com.delta.urlscout.crawl.frontier.UrlRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Breadth-first link following from the base URL and every queued page, down to the configured
 * depth. Pages at the depth limit stay queued for later phases.
 */
@Component
public class RecursiveCrawlPhase implements DiscoveryPhase {
    private static final Logger log = LoggerFactory.getLogger(RecursiveCrawlPhase.class);

    @Override
    public String name() {
        return PhaseNames.RECURSIVE;
    }

    @Override
    public PhaseStats run(PhaseContext context) {
        int maxDepth = context.properties().getRecursive().getMaxDepth();
        int batchSize = Math.max(1, context.properties().getGlobalConcurrency() * 4);
        context.admit(context.rootUrl(), null, 0);

        int pagesExpanded = 0;
        while (!context.shouldStop()) {
            List<UrlRecord> batch = context.frontier().pollPending(batchSize, maxDepth);
            if (batch.isEmpty()) {
                break;
            }
            List<FetchedPage> pages = PageBatchFetcher.runAll(
                context,
                batch,
                record -> new FetchedPage(record, context.get(record.getCanonicalUrl()))
            );
            for (FetchedPage page : pages) {
                if (!page.fetch().isSuccessful()) {
                    continue;
                }
                pagesExpanded++;
                int childDepth = page.record().getDepth() + 1;
                for (String link : context.extractLinks(page.fetch(), ExtractionMode.STANDARD)) {
                    context.admit(link, page.url(), childDepth);
                }
            }
            log.debug("recursive crawl batch size={} pending={}", batch.size(), context.frontier().pendingCount());
        }
        log.info("recursive crawl pagesExpanded={} new={} maxDepth={}", pagesExpanded, context.stats().newUrls(), maxDepth);
        return context.stats().snapshot(PhaseStatus.COMPLETED);
    }
}
