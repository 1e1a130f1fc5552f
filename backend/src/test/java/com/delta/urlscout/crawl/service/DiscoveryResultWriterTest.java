package com.delta.urlscout.crawl.service;

import com.delta.urlscout.config.CrawlConfig;
import com.delta.urlscout.config.CrawlerProperties;
import com.delta.urlscout.crawl.model.DiscoveredUrl;
import com.delta.urlscout.crawl.model.DiscoveryResult;
import com.delta.urlscout.crawl.model.DiscoveryState;
import com.delta.urlscout.crawl.model.HostCrawlState;
import com.delta.urlscout.crawl.phase.PhaseNames;
import com.delta.urlscout.crawl.phase.PhaseStats;
import com.delta.urlscout.crawl.phase.PhaseStatus;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

class DiscoveryResultWriterTest {
    private static final Instant STARTED = Instant.parse("2024-05-10T07:59:00Z");
    private static final Instant FINISHED = Instant.parse("2024-05-10T08:00:00Z");

    private final ObjectMapper objectMapper = new CrawlConfig().objectMapper();

    @TempDir
    Path outputDir;

    @Test
    void writesOneFilePerExecutedPhaseAndAConsolidatedFile() throws Exception {
        DiscoveryResultWriter writer = new DiscoveryResultWriter(new CrawlerProperties(), objectMapper);

        List<Path> files = writer.write(sampleResult(), outputDir);

        assertThat(files).extracting(path -> path.getFileName().toString()).containsExactly(
            "example.com_sitemap_discovery_20240510T080000Z.json",
            "example.com_recursive_crawl_20240510T080000Z.json",
            "example.com_consolidated_20240510T080000Z.json"
        );
        assertThat(files).allSatisfy(path -> assertThat(Files.exists(path)).isTrue());

        JsonNode sitemap = objectMapper.readTree(files.get(0).toFile());
        assertThat(sitemap.path("source_module").asText()).isEqualTo(PhaseNames.SITEMAP);
        assertThat(sitemap.path("base_domain").asText()).isEqualTo("example.com");
        assertThat(sitemap.path("total_urls").asInt()).isEqualTo(1);
        assertThat(sitemap.path("urls").get(0).asText()).isEqualTo("https://example.com/a");
        assertThat(sitemap.path("timestamp").asText()).isEqualTo("2024-05-10T08:00:00Z");

        JsonNode recursive = objectMapper.readTree(files.get(1).toFile());
        assertThat(recursive.path("total_urls").asInt()).isEqualTo(2);
    }

    @Test
    void consolidatedDocumentUsesSnakeCaseThroughout() throws Exception {
        DiscoveryResultWriter writer = new DiscoveryResultWriter(new CrawlerProperties(), objectMapper);

        List<Path> files = writer.write(sampleResult(), outputDir);
        JsonNode consolidated = objectMapper.readTree(files.get(files.size() - 1).toFile());

        assertThat(consolidated.path("source_module").asText()).isEqualTo("consolidated");
        assertThat(consolidated.path("total_urls").asInt()).isEqualTo(2);
        assertThat(consolidated.path("termination_reason").asText()).isEqualTo("completed");
        assertThat(consolidated.path("llm_keywords_generated").asInt()).isEqualTo(4);
        assertThat(consolidated.path("discovery_stats").path(PhaseNames.SITEMAP).asInt()).isEqualTo(1);
        JsonNode firstUrl = consolidated.path("urls").get(0);
        assertThat(firstUrl.path("source_url").asText()).isEqualTo("https://example.com/sitemap.xml");
        assertThat(firstUrl.path("first_seen_at").asText()).isEqualTo("2024-05-10T07:59:10Z");
        assertThat(firstUrl.path("http_status").asInt()).isEqualTo(200);
        JsonNode skipped = consolidated.path("phase_stats").get(2);
        assertThat(skipped.path("status").asText()).isEqualTo("SKIPPED");
        assertThat(skipped.path("error").asText()).isEqualTo("max_pages_reached");
        assertThat(consolidated.path("phase_stats").get(0).path("new_urls").asInt()).isEqualTo(1);
        assertThat(consolidated.path("hosts").path("example.com").path("rate_limited_responses").asInt()).isEqualTo(1);
    }

    @Test
    void disabledOutputWritesNothing() throws Exception {
        CrawlerProperties properties = new CrawlerProperties();
        properties.getOutput().setEnabled(false);
        properties.getOutput().setDirectory(outputDir.toString());

        List<Path> files = new DiscoveryResultWriter(properties, objectMapper).write(sampleResult());

        assertThat(files).isEmpty();
        try (Stream<Path> entries = Files.list(outputDir)) {
            assertThat(entries).isEmpty();
        }
    }

    private static DiscoveryResult sampleResult() {
        List<DiscoveredUrl> urls = List.of(
            new DiscoveredUrl(
                "https://example.com/a",
                List.of(PhaseNames.SITEMAP, PhaseNames.RECURSIVE),
                Instant.parse("2024-05-10T07:59:10Z"),
                "https://example.com/sitemap.xml",
                0,
                200
            ),
            new DiscoveredUrl(
                "https://example.com/b",
                List.of(PhaseNames.RECURSIVE),
                Instant.parse("2024-05-10T07:59:20Z"),
                "https://example.com/a",
                1,
                null
            )
        );
        List<PhaseStats> phaseStats = List.of(
            new PhaseStats(PhaseNames.SITEMAP, PhaseStatus.COMPLETED, 1, 1, 0, 0, 3, 0, 0, 0, 0, null, Duration.ofSeconds(2)),
            new PhaseStats(PhaseNames.RECURSIVE, PhaseStatus.COMPLETED, 3, 1, 2, 0, 2, 0, 0, 0, 0, null, Duration.ofSeconds(5)),
            PhaseStats.skipped(PhaseNames.HIERARCHICAL, "max_pages_reached")
        );
        return new DiscoveryResult(
            "run-1",
            "https://example.com/",
            "example.com",
            STARTED,
            FINISHED,
            DiscoveryState.COMPLETED,
            2,
            0,
            urls,
            phaseStats,
            Map.of(PhaseNames.SITEMAP, 1, PhaseNames.RECURSIVE, 1),
            4,
            Map.of("example.com", new HostCrawlState("example.com", 5, 1, 0, 1, null, FINISHED)),
            "completed",
            60.0
        );
    }
}
