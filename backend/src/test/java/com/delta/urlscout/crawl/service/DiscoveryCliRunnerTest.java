package com.delta.urlscout.crawl.service;

import com.delta.urlscout.config.CrawlerProperties;
import com.delta.urlscout.crawl.model.DiscoveryRequest;
import com.delta.urlscout.crawl.model.DiscoveryResult;
import com.delta.urlscout.crawl.model.DiscoveryState;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.context.ConfigurableApplicationContext;

import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DiscoveryCliRunnerTest {

    @Mock
    private DiscoveryOrchestratorService orchestratorService;
    @Mock
    private DiscoveryResultWriter resultWriter;
    @Mock
    private ConfigurableApplicationContext applicationContext;

    @Test
    void doesNothingUnlessEnabled() {
        CrawlerProperties properties = new CrawlerProperties();
        properties.getCli().setRun(false);

        runner(properties).run(new DefaultApplicationArguments());

        verifyNoInteractions(orchestratorService, resultWriter);
    }

    @Test
    void runsConfiguredBaseUrlAndWritesOutput() throws IOException {
        CrawlerProperties properties = cliProperties();
        when(orchestratorService.run(any(DiscoveryRequest.class))).thenReturn(result(DiscoveryState.COMPLETED));

        runner(properties).run(new DefaultApplicationArguments());

        ArgumentCaptor<DiscoveryRequest> request = ArgumentCaptor.forClass(DiscoveryRequest.class);
        verify(orchestratorService).run(request.capture());
        assertEquals("https://example.com/", request.getValue().baseUrl());
        assertEquals(Integer.valueOf(250), request.getValue().maxPages());
        assertEquals(List.of("sitemap_discovery"), request.getValue().phases());
        verify(resultWriter).write(any(DiscoveryResult.class));
    }

    @Test
    void abortedRunWritesNothing() throws IOException {
        CrawlerProperties properties = cliProperties();
        when(orchestratorService.run(any(DiscoveryRequest.class))).thenReturn(result(DiscoveryState.ABORTED));

        runner(properties).run(new DefaultApplicationArguments());

        verify(resultWriter, never()).write(any(DiscoveryResult.class));
    }

    private DiscoveryCliRunner runner(CrawlerProperties properties) {
        return new DiscoveryCliRunner(properties, orchestratorService, resultWriter, applicationContext);
    }

    private static CrawlerProperties cliProperties() {
        CrawlerProperties properties = new CrawlerProperties();
        properties.getCli().setRun(true);
        properties.getCli().setExitAfterRun(false);
        properties.getDiscovery().setBaseUrl("https://example.com/");
        properties.getDiscovery().setMaxPages(250);
        properties.getDiscovery().setPhases(List.of("sitemap_discovery"));
        return properties;
    }

    private static DiscoveryResult result(DiscoveryState state) {
        Instant now = Instant.parse("2024-05-10T08:00:00Z");
        return new DiscoveryResult(
            "run-1",
            "https://example.com/",
            "example.com",
            now,
            now,
            state,
            0,
            0,
            List.of(),
            List.of(),
            Map.of(),
            0,
            Map.of(),
            state == DiscoveryState.COMPLETED ? "completed" : "invalid base URL",
            0.0
        );
    }
}
