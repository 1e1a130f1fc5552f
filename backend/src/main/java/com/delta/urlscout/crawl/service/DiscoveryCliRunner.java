package com.delta.urlscout.crawl.service;

import com.delta.urlscout.config.CrawlerProperties;
import com.delta.urlscout.crawl.model.DiscoveryRequest;
import com.delta.urlscout.crawl.model.DiscoveryResult;
import com.delta.urlscout.crawl.model.DiscoveryState;
import com.delta.urlscout.crawl.phase.PhaseStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

@Component
public class DiscoveryCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(DiscoveryCliRunner.class);

    private final CrawlerProperties properties;
    private final DiscoveryOrchestratorService orchestratorService;
    private final DiscoveryResultWriter resultWriter;
    private final ConfigurableApplicationContext applicationContext;

    public DiscoveryCliRunner(
        CrawlerProperties properties,
        DiscoveryOrchestratorService orchestratorService,
        DiscoveryResultWriter resultWriter,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.orchestratorService = orchestratorService;
        this.resultWriter = resultWriter;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getCli().isRun()) {
            return;
        }

        DiscoveryRequest request = new DiscoveryRequest(
            properties.getDiscovery().getBaseUrl(),
            properties.getDiscovery().getMaxPages(),
            properties.getDiscovery().getPhases()
        );
        DiscoveryResult result = orchestratorService.run(request);
        log.info(
            "Discovery run {} finished with state {}: urls={}, reason={}, seconds={}",
            result.runId(),
            result.state(),
            result.totalUrls(),
            result.terminationReason(),
            result.discoveryTimeSeconds()
        );
        for (PhaseStats stats : result.phaseStats()) {
            log.info(
                "Summary {}: status={}, new={}, duplicates={}, outOfScope={}, fetches={}, errors={}/{}, suggestions={}",
                stats.phase(),
                stats.status(),
                stats.newUrls(),
                stats.duplicates(),
                stats.outOfScope(),
                stats.fetches(),
                stats.transientErrors(),
                stats.permanentErrors(),
                stats.suggestionsUsed()
            );
        }

        int exitCode = result.state() == DiscoveryState.COMPLETED ? 0 : 1;
        if (result.state() == DiscoveryState.COMPLETED) {
            try {
                List<Path> files = resultWriter.write(result);
                files.forEach(file -> log.info("Wrote {}", file));
            } catch (IOException e) {
                log.warn("Discovery output could not be written to {}", properties.getOutput().getDirectory(), e);
                exitCode = 2;
            }
        }

        if (properties.getCli().isExitAfterRun()) {
            int finalExitCode = exitCode;
            int code = SpringApplication.exit(applicationContext, () -> finalExitCode);
            System.exit(code);
        }
    }
}
