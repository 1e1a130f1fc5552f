package com.delta.urlscout.crawl.phase;

import com.delta.urlscout.crawl.archive.ArchiveLookupResult;
import com.delta.urlscout.crawl.archive.ArchiveSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class ArchiveSeedingPhase implements DiscoveryPhase {
    private static final Logger log = LoggerFactory.getLogger(ArchiveSeedingPhase.class);

    @Override
    public String name() {
        return PhaseNames.ARCHIVE;
    }

    @Override
    public PhaseStats run(PhaseContext context) {
        int maxUrls = context.properties().getArchive().getMaxUrls();
        String queryDomain = context.properties().getScope().isIncludeSubdomains()
            ? context.domain()
            : context.scope().baseHost();

        for (ArchiveSource source : context.archiveSources()) {
            int remaining = maxUrls - context.stats().newUrls();
            if (remaining <= 0 || context.shouldStop()) {
                break;
            }
            if (!source.isEnabled()) {
                log.debug("archive source disabled source={}", source.name());
                continue;
            }
            ArchiveLookupResult lookup = source.lookup(queryDomain, remaining, context::shouldStop);
            context.stats().recordFetches(lookup.fetches());
            context.stats().recordErrors(lookup.transientErrors(), lookup.permanentErrors());
            context.stats().recordParseErrors(lookup.parseErrors());
            int before = context.stats().newUrls();
            for (String url : lookup.urls()) {
                if (context.stats().newUrls() >= maxUrls || context.frontier().isAtCapacity()) {
                    break;
                }
                context.admit(url, null, 0);
            }
            log.info(
                "archive seeding source={} domain={} returned={} new={}",
                source.name(),
                queryDomain,
                lookup.urls().size(),
                context.stats().newUrls() - before
            );
        }
        return context.stats().snapshot(PhaseStatus.COMPLETED);
    }
}
