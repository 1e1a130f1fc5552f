package com.delta.urlscout.crawl.phase;

import com.delta.urlscout.config.CrawlerProperties;
import com.delta.urlscout.crawl.frontier.UrlRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Infers numeric and date templates from admitted paths and walks each template's sibling values.
 * Templates run in parallel; within a template, checks are sequential so that a run of
 * consecutive misses can end the walk.
 */
@Component
public class PatternGenerationPhase implements DiscoveryPhase {
    private static final Logger log = LoggerFactory.getLogger(PatternGenerationPhase.class);
    private static final List<String> SKIPPED_DIRECTORIES = List.of(
        "/css/", "/js/", "/images/", "/img/", "/assets/", "/static/"
    );

    @Override
    public String name() {
        return PhaseNames.PATTERN;
    }

    @Override
    public PhaseStats run(PhaseContext context) {
        CrawlerProperties.Pattern settings = context.properties().getPattern();
        List<PatternTemplate> templates = inferTemplates(context.frontier().inScopeRecords(), settings.getMinSamples());
        if (templates.isEmpty()) {
            log.info("pattern generation found no template with minSamples={}", settings.getMinSamples());
            return context.stats().snapshot(PhaseStatus.COMPLETED);
        }

        AtomicInteger remaining = new AtomicInteger(settings.getMaxGeneratedUrls());
        YearMonth latest = YearMonth.now(context.clock());
        List<TemplateOutcome> outcomes = PageBatchFetcher.runAll(
            context,
            templates,
            template -> walk(context, template, settings, latest, remaining)
        );
        int found = outcomes.stream().mapToInt(TemplateOutcome::found).sum();
        int checked = outcomes.stream().mapToInt(TemplateOutcome::checked).sum();
        log.info(
            "pattern generation templates={} checked={} found={} new={}",
            templates.size(),
            checked,
            found,
            context.stats().newUrls()
        );
        return context.stats().snapshot(PhaseStatus.COMPLETED);
    }

    static List<PatternTemplate> inferTemplates(List<UrlRecord> records, int minSamples) {
        Map<String, PatternTemplate> byKey = new LinkedHashMap<>();
        Map<String, String> sourceByKey = new LinkedHashMap<>();
        for (UrlRecord record : records) {
            URI uri = URI.create(record.getCanonicalUrl());
            String path = uri.getRawPath();
            if (uri.getRawQuery() != null || path == null || isSkipped(path)) {
                continue;
            }
            PatternTemplate.Parsed parsed = PatternTemplate.parse(path);
            if (parsed == null) {
                continue;
            }
            String origin = uri.getScheme() + "://" + uri.getRawAuthority();
            String key = origin + parsed.template().key();
            PatternTemplate template = byKey.computeIfAbsent(key, ignored -> parsed.template());
            template.addSample(parsed.value());
            sourceByKey.putIfAbsent(key, origin);
        }
        List<PatternTemplate> eligible = new ArrayList<>();
        for (Map.Entry<String, PatternTemplate> entry : byKey.entrySet()) {
            if (entry.getValue().samples().size() >= Math.max(1, minSamples)) {
                entry.getValue().bindOrigin(sourceByKey.get(entry.getKey()));
                eligible.add(entry.getValue());
            }
        }
        return eligible;
    }

    private TemplateOutcome walk(
        PhaseContext context,
        PatternTemplate template,
        CrawlerProperties.Pattern settings,
        YearMonth latest,
        AtomicInteger remaining
    ) {
        int consecutiveFailures = 0;
        int checked = 0;
        int found = 0;
        String source = template.origin() + template.render(template.samples().first());
        for (int value : template.variants(settings.getMaxVariantsPerTemplate(), latest)) {
            if (context.shouldStop() || consecutiveFailures >= settings.getMaxConsecutiveFailures()) {
                break;
            }
            String url = template.origin() + template.render(value);
            if (context.frontier().contains(url)) {
                consecutiveFailures = 0;
                continue;
            }
            if (remaining.getAndDecrement() <= 0) {
                break;
            }
            checked++;
            ProbeResult probe = context.probe(url);
            if (probe.exists()) {
                context.admit(url, source, 1);
                found++;
                consecutiveFailures = 0;
            } else {
                consecutiveFailures++;
            }
        }
        log.debug("pattern template={} checked={} found={} stoppedAfterFailures={}",
            template.key(), checked, found, consecutiveFailures);
        return new TemplateOutcome(checked, found);
    }

    private static boolean isSkipped(String path) {
        String withSlash = path + "/";
        for (String skipped : SKIPPED_DIRECTORIES) {
            if (withSlash.contains(skipped)) {
                return true;
            }
        }
        return false;
    }

    private record TemplateOutcome(int checked, int found) {
    }
}
