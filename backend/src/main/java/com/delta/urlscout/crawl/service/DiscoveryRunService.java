package com.delta.urlscout.crawl.service;

import com.delta.urlscout.config.CrawlerProperties;
import com.delta.urlscout.crawl.model.DiscoveryRequest;
import com.delta.urlscout.crawl.model.DiscoveryResult;
import com.delta.urlscout.crawl.model.DiscoveryRunStatus;
import com.delta.urlscout.crawl.model.DiscoveryState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutorService;

/**
 * Asynchronous runs for the HTTP API. One run at a time; finished runs are kept in memory up to
 * {@code crawler.api.max-retained-runs}.
 */
@Service
public class DiscoveryRunService {
    private static final Logger log = LoggerFactory.getLogger(DiscoveryRunService.class);

    private final DiscoveryOrchestratorService orchestratorService;
    private final DiscoveryResultWriter resultWriter;
    private final ExecutorService discoveryRunExecutor;
    private final CrawlerProperties properties;
    private final Clock clock;
    private final Map<String, RunEntry> runs = new LinkedHashMap<>();

    public DiscoveryRunService(
        DiscoveryOrchestratorService orchestratorService,
        DiscoveryResultWriter resultWriter,
        @Qualifier("discoveryRunExecutor") ExecutorService discoveryRunExecutor,
        CrawlerProperties properties,
        Clock clock
    ) {
        this.orchestratorService = orchestratorService;
        this.resultWriter = resultWriter;
        this.discoveryRunExecutor = discoveryRunExecutor;
        this.properties = properties;
        this.clock = clock;
    }

    public DiscoveryRunStatus startAsync(DiscoveryRequest request) {
        orchestratorService.validate(request);
        RunEntry entry;
        synchronized (runs) {
            for (RunEntry existing : runs.values()) {
                if (!existing.isFinished()) {
                    throw new ActiveDiscoveryRunException("Discovery run " + existing.runId + " is still running");
                }
            }
            entry = new RunEntry(UUID.randomUUID().toString(), request, clock.instant());
            runs.put(entry.runId, entry);
            evictFinished();
        }
        discoveryRunExecutor.submit(() -> execute(entry));
        log.info("discovery run queued runId={} baseUrl={}", entry.runId, request.baseUrl());
        return toStatus(entry);
    }

    public DiscoveryRunStatus getStatus(String runId) {
        RunEntry entry = find(runId);
        return entry == null ? null : toStatus(entry);
    }

    public DiscoveryResult getResult(String runId) {
        RunEntry entry = find(runId);
        return entry == null ? null : entry.result;
    }

    public DiscoveryRunStatus cancel(String runId) {
        RunEntry entry = find(runId);
        if (entry == null) {
            return null;
        }
        if (!entry.isFinished()) {
            entry.progress.cancel();
            log.info("discovery run cancel requested runId={}", runId);
        }
        return toStatus(entry);
    }

    private void execute(RunEntry entry) {
        try {
            DiscoveryResult result = orchestratorService.run(entry.runId, entry.request, entry.progress);
            entry.result = result;
            if (result.state() == DiscoveryState.COMPLETED) {
                resultWriter.write(result);
            }
        } catch (IOException e) {
            log.warn("discovery output could not be written runId={} error={}", entry.runId, e.getMessage(), e);
        } catch (Exception e) {
            log.warn("discovery run failed runId={}", entry.runId, e);
            entry.failure = e.getClass().getSimpleName() + ": " + e.getMessage();
        } finally {
            entry.finishedAt = clock.instant();
            entry.done = true;
        }
    }

    private RunEntry find(String runId) {
        synchronized (runs) {
            return runs.get(runId);
        }
    }

    private void evictFinished() {
        int maxRetained = properties.getApi().getMaxRetainedRuns();
        Iterator<RunEntry> iterator = runs.values().iterator();
        while (runs.size() > maxRetained && iterator.hasNext()) {
            if (iterator.next().isFinished()) {
                iterator.remove();
            }
        }
    }

    private DiscoveryRunStatus toStatus(RunEntry entry) {
        DiscoveryResult result = entry.result;
        DiscoveryState state = entry.failure != null ? DiscoveryState.ABORTED : entry.progress.state();
        String reason = entry.failure != null ? entry.failure : result == null ? null : result.terminationReason();
        return new DiscoveryRunStatus(
            entry.runId,
            entry.request.baseUrl(),
            state,
            entry.progress.currentPhase(),
            entry.progress.completedPhases(),
            result == null ? entry.progress.urlsFound() : result.totalUrls(),
            entry.progress.pendingUrls(),
            entry.submittedAt,
            entry.finishedAt,
            reason,
            "/api/discovery/runs/" + entry.runId
        );
    }

    private static final class RunEntry {
        private final String runId;
        private final DiscoveryRequest request;
        private final Instant submittedAt;
        private final DiscoveryProgress progress = new DiscoveryProgress();
        private volatile DiscoveryResult result;
        private volatile String failure;
        private volatile Instant finishedAt;
        private volatile boolean done;

        private RunEntry(String runId, DiscoveryRequest request, Instant submittedAt) {
            this.runId = runId;
            this.request = request;
            this.submittedAt = submittedAt;
        }

        private boolean isFinished() {
            return done;
        }
    }
}
