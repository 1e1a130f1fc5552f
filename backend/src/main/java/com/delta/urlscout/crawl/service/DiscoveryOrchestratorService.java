package com.delta.urlscout.crawl.service;

import com.delta.urlscout.config.CrawlerProperties;
import com.delta.urlscout.crawl.archive.ArchiveSource;
import com.delta.urlscout.crawl.extract.LinkExtractor;
import com.delta.urlscout.crawl.frontier.Frontier;
import com.delta.urlscout.crawl.frontier.ScopeRule;
import com.delta.urlscout.crawl.frontier.UrlRecord;
import com.delta.urlscout.crawl.http.Fetcher;
import com.delta.urlscout.crawl.model.DiscoveredUrl;
import com.delta.urlscout.crawl.model.DiscoveryRequest;
import com.delta.urlscout.crawl.model.DiscoveryResult;
import com.delta.urlscout.crawl.model.DiscoveryState;
import com.delta.urlscout.crawl.phase.DiscoveryBudget;
import com.delta.urlscout.crawl.phase.DiscoveryPhase;
import com.delta.urlscout.crawl.phase.DiscoverySession;
import com.delta.urlscout.crawl.phase.PhaseContext;
import com.delta.urlscout.crawl.phase.PhaseNames;
import com.delta.urlscout.crawl.phase.PhaseStats;
import com.delta.urlscout.crawl.phase.PhaseStatus;
import com.delta.urlscout.crawl.phase.ProbeResult;
import com.delta.urlscout.crawl.robots.RobotsTxtService;
import com.delta.urlscout.crawl.sitemap.SitemapService;
import com.delta.urlscout.crawl.suggest.SuggestionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;

/**
 * Runs the discovery phases in their fixed order against one shared frontier and assembles the
 * result. Budget stops end the run early but still produce a completed result; configuration
 * errors abort it.
 */
@Service
public class DiscoveryOrchestratorService {
    private static final Logger log = LoggerFactory.getLogger(DiscoveryOrchestratorService.class);
    static final String COMPLETED_REASON = "completed";
    static final String VALIDATION_STEP = "url_validation";

    private final CrawlerProperties properties;
    private final Fetcher fetcher;
    private final LinkExtractor linkExtractor;
    private final SuggestionService suggestionService;
    private final RobotsTxtService robotsTxtService;
    private final SitemapService sitemapService;
    private final List<ArchiveSource> archiveSources;
    private final Map<String, DiscoveryPhase> phasesByName;
    private final HostCrawlStateService hostCrawlStateService;
    private final ExecutorService crawlExecutor;
    private final Clock clock;

    public DiscoveryOrchestratorService(
        CrawlerProperties properties,
        Fetcher fetcher,
        LinkExtractor linkExtractor,
        SuggestionService suggestionService,
        RobotsTxtService robotsTxtService,
        SitemapService sitemapService,
        List<ArchiveSource> archiveSources,
        List<DiscoveryPhase> phases,
        HostCrawlStateService hostCrawlStateService,
        @Qualifier("crawlExecutor") ExecutorService crawlExecutor,
        Clock clock
    ) {
        this.properties = properties;
        this.fetcher = fetcher;
        this.linkExtractor = linkExtractor;
        this.suggestionService = suggestionService;
        this.robotsTxtService = robotsTxtService;
        this.sitemapService = sitemapService;
        this.archiveSources = List.copyOf(archiveSources);
        this.phasesByName = new LinkedHashMap<>();
        for (DiscoveryPhase phase : phases) {
            phasesByName.put(phase.name(), phase);
        }
        this.hostCrawlStateService = hostCrawlStateService;
        this.crawlExecutor = crawlExecutor;
        this.clock = clock;
    }

    public DiscoveryResult run(DiscoveryRequest request) {
        return run(UUID.randomUUID().toString(), request, new DiscoveryProgress());
    }

    public DiscoveryResult run(String runId, DiscoveryRequest request, DiscoveryProgress progress) {
        Instant startedAt = clock.instant();
        progress.state(DiscoveryState.RUNNING);
        ScopeRule scope;
        List<String> selectedPhases;
        try {
            scope = ScopeRule.forBaseUrl(request.baseUrl(), properties.getScope());
            selectedPhases = selectPhases(request.phases());
        } catch (DiscoveryConfigurationException e) {
            log.warn("discovery run aborted runId={} baseUrl={} reason={}", runId, request.baseUrl(), e.getMessage());
            progress.state(DiscoveryState.ABORTED);
            return abortedResult(runId, request.baseUrl(), startedAt, e.getMessage());
        }

        int maxPages = request.maxPages() == null
            ? properties.getDiscovery().getMaxPages()
            : Math.max(1, request.maxPages());
        Frontier frontier = new Frontier(scope, maxPages, properties.getScope().isUnifyScheme(), clock);
        DiscoveryBudget budget = new DiscoveryBudget(
            clock,
            Duration.ofSeconds(properties.getDiscovery().getMaxDurationSeconds())
        );
        progress.attach(frontier, budget);
        robotsTxtService.clear();
        suggestionService.resetUsage();
        hostCrawlStateService.reset();

        DiscoverySession session = new DiscoverySession(
            runId,
            frontier,
            budget,
            properties,
            fetcher,
            linkExtractor,
            suggestionService,
            robotsTxtService,
            sitemapService,
            archiveSources,
            crawlExecutor,
            clock,
            ConcurrentHashMap.newKeySet()
        );
        log.info(
            "discovery run started runId={} root={} domain={} maxPages={} phases={}",
            runId,
            scope.rootUrl(),
            scope.registrableDomain(),
            maxPages,
            selectedPhases
        );

        List<PhaseStats> phaseStats = new ArrayList<>();
        for (String phaseName : selectedPhases) {
            if (budget.isExhausted(frontier)) {
                phaseStats.add(PhaseStats.skipped(phaseName, budget.stopReason()));
                log.info("phase skipped runId={} phase={} reason={}", runId, phaseName, budget.stopReason());
                continue;
            }
            progress.startPhase(phaseName);
            phaseStats.add(runPhase(runId, phasesByName.get(phaseName), session));
            progress.finishPhase(phaseName);
        }

        validateUrls(runId, session);

        String stopReason = budget.stopReason();
        progress.state(DiscoveryState.COMPLETED);
        DiscoveryResult result = assemble(
            runId,
            scope,
            frontier,
            startedAt,
            phaseStats,
            stopReason == null ? COMPLETED_REASON : stopReason
        );
        log.info(
            "discovery run finished runId={} urls={} outOfScope={} reason={} seconds={}",
            runId,
            result.totalUrls(),
            result.outOfScopeUrls(),
            result.terminationReason(),
            String.format(Locale.ROOT, "%.1f", result.discoveryTimeSeconds())
        );
        return result;
    }

    /**
     * Validates a base URL the same way a run would, so callers can reject it up front.
     */
    public void validate(DiscoveryRequest request) {
        ScopeRule.forBaseUrl(request.baseUrl(), properties.getScope());
        selectPhases(request.phases());
    }

    private PhaseStats runPhase(String runId, DiscoveryPhase phase, DiscoverySession session) {
        PhaseContext context = new PhaseContext(session, phase.name());
        Instant phaseStarted = clock.instant();
        log.info("phase started runId={} phase={} urls={}", runId, phase.name(), session.frontier().inScopeCount());
        PhaseStats stats;
        try {
            PhaseStats outcome = phase.run(context);
            stats = outcome.withOutcome(outcome.status(), outcome.error(), Duration.between(phaseStarted, clock.instant()));
        } catch (Exception e) {
            log.warn("phase failed runId={} phase={} error={}", runId, phase.name(), e.toString(), e);
            stats = context.stats().snapshot(PhaseStatus.FAILED)
                .withOutcome(PhaseStatus.FAILED, e.getClass().getSimpleName() + ": " + e.getMessage(),
                    Duration.between(phaseStarted, clock.instant()));
        }
        log.info(
            "phase finished runId={} phase={} status={} new={} duplicates={} outOfScope={} fetches={} "
                + "transientErrors={} permanentErrors={} parseErrors={} ms={}",
            runId,
            stats.phase(),
            stats.status(),
            stats.newUrls(),
            stats.duplicates(),
            stats.outOfScope(),
            stats.fetches(),
            stats.transientErrors(),
            stats.permanentErrors(),
            stats.parseErrors(),
            stats.duration().toMillis()
        );
        return stats;
    }

    /**
     * Checks in-scope URLs that no phase fetched, recording the status each answers with. Runs
     * unless the run was cancelled or its deadline passed; a page-cap stop does not prevent it.
     */
    private void validateUrls(String runId, DiscoverySession session) {
        CrawlerProperties.Validation settings = properties.getValidation();
        DiscoveryBudget budget = session.budget();
        if (!settings.isEnabled() || isOutOfTime(budget)) {
            return;
        }
        List<String> unchecked = new ArrayList<>();
        for (UrlRecord record : session.frontier().inScopeRecords()) {
            if (record.getHttpStatus() == null) {
                unchecked.add(record.getCanonicalUrl());
                if (unchecked.size() >= settings.getMaxUrls()) {
                    break;
                }
            }
        }
        if (unchecked.isEmpty()) {
            return;
        }
        log.info("url validation started runId={} urls={}", runId, unchecked.size());
        PhaseContext context = new PhaseContext(session, VALIDATION_STEP);
        List<CompletableFuture<ProbeResult>> futures = new ArrayList<>(unchecked.size());
        for (String url : unchecked) {
            futures.add(CompletableFuture
                .supplyAsync(() -> isOutOfTime(budget) ? null : context.probe(url), crawlExecutor)
                .exceptionally(error -> {
                    log.warn("url validation failed runId={} url={} error={}", runId, url, error.toString());
                    return null;
                }));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        int valid = 0;
        int invalid = 0;
        for (CompletableFuture<ProbeResult> future : futures) {
            ProbeResult check = future.join();
            if (check == null) {
                continue;
            }
            session.frontier().recordStatus(check.url(), check.statusCode());
            if (check.exists()) {
                valid++;
            } else {
                invalid++;
            }
        }
        log.info("url validation finished runId={} valid={} invalid={}", runId, valid, invalid);
    }

    private boolean isOutOfTime(DiscoveryBudget budget) {
        Instant deadline = budget.deadline();
        return budget.isCancelled() || (deadline != null && !clock.instant().isBefore(deadline));
    }

    private List<String> selectPhases(List<String> requested) {
        List<String> wanted = requested == null || requested.isEmpty()
            ? properties.getDiscovery().getPhases()
            : requested;
        List<String> normalized = new ArrayList<>();
        for (String name : wanted) {
            if (name != null && !name.isBlank()) {
                normalized.add(name.trim().toLowerCase(Locale.ROOT));
            }
        }
        for (String name : normalized) {
            if (!PhaseNames.ORDER.contains(name)) {
                throw new DiscoveryConfigurationException("unknown discovery phase: " + name);
            }
        }
        List<String> selected = new ArrayList<>();
        for (String name : PhaseNames.ORDER) {
            if ((normalized.isEmpty() || normalized.contains(name)) && phasesByName.containsKey(name)) {
                selected.add(name);
            }
        }
        return selected;
    }

    private DiscoveryResult assemble(
        String runId,
        ScopeRule scope,
        Frontier frontier,
        Instant startedAt,
        List<PhaseStats> phaseStats,
        String terminationReason
    ) {
        Instant finishedAt = clock.instant();
        List<DiscoveredUrl> urls = new ArrayList<>();
        for (UrlRecord record : frontier.inScopeRecords()) {
            urls.add(new DiscoveredUrl(
                record.getCanonicalUrl(),
                record.getPhases(),
                record.getFirstSeenAt(),
                record.getSourceUrl(),
                record.getDepth(),
                record.getHttpStatus()
            ));
        }
        Map<String, Integer> discoveryStats = new LinkedHashMap<>();
        Map<String, Integer> byPhase = frontier.newUrlsByPhase();
        for (PhaseStats stats : phaseStats) {
            discoveryStats.put(stats.phase(), byPhase.getOrDefault(stats.phase(), 0));
        }
        return new DiscoveryResult(
            runId,
            scope.rootUrl(),
            scope.registrableDomain(),
            startedAt,
            finishedAt,
            DiscoveryState.COMPLETED,
            urls.size(),
            frontier.outOfScopeCount(),
            List.copyOf(urls),
            List.copyOf(phaseStats),
            discoveryStats,
            suggestionService.usage().modelValues(),
            hostCrawlStateService.snapshot(),
            terminationReason,
            Duration.between(startedAt, finishedAt).toMillis() / 1000.0
        );
    }

    private DiscoveryResult abortedResult(String runId, String baseUrl, Instant startedAt, String reason) {
        Instant finishedAt = clock.instant();
        return new DiscoveryResult(
            runId,
            baseUrl,
            null,
            startedAt,
            finishedAt,
            DiscoveryState.ABORTED,
            0,
            0,
            List.of(),
            List.of(),
            Map.of(),
            0,
            Map.of(),
            reason,
            Duration.between(startedAt, finishedAt).toMillis() / 1000.0
        );
    }
}
