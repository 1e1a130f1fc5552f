package com.delta.urlscout.crawl.service;

import com.delta.urlscout.config.CrawlerProperties;
import com.delta.urlscout.crawl.model.DiscoveryResult;
import com.delta.urlscout.crawl.phase.PhaseStats;
import com.delta.urlscout.crawl.phase.PhaseStatus;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Writes one JSON document per executed phase plus a consolidated document. Property names are
 * snake_case.
 */
@Service
public class DiscoveryResultWriter {
    private static final Logger log = LoggerFactory.getLogger(DiscoveryResultWriter.class);
    private static final DateTimeFormatter FILE_TIMESTAMP =
        DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss'Z'").withZone(ZoneOffset.UTC);
    static final String CONSOLIDATED = "consolidated";

    private final CrawlerProperties properties;
    private final ObjectMapper objectMapper;

    public DiscoveryResultWriter(CrawlerProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper.copy()
            .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
            .enable(SerializationFeature.INDENT_OUTPUT);
    }

    public List<Path> write(DiscoveryResult result) throws IOException {
        if (!properties.getOutput().isEnabled()) {
            return List.of();
        }
        return write(result, Path.of(properties.getOutput().getDirectory()));
    }

    public List<Path> write(DiscoveryResult result, Path directory) throws IOException {
        Files.createDirectories(directory);
        String stamp = FILE_TIMESTAMP.format(result.finishedAt());
        String prefix = fileSafe(result.baseDomain() == null ? "unknown" : result.baseDomain());
        List<Path> written = new ArrayList<>();
        for (PhaseStats stats : result.phaseStats()) {
            if (stats.status() == PhaseStatus.SKIPPED) {
                continue;
            }
            Path file = directory.resolve(prefix + "_" + stats.phase() + "_" + stamp + ".json");
            objectMapper.writeValue(file.toFile(), phaseDocument(result, stats.phase()));
            written.add(file);
        }
        Path consolidated = directory.resolve(prefix + "_" + CONSOLIDATED + "_" + stamp + ".json");
        objectMapper.writeValue(consolidated.toFile(), consolidatedDocument(result));
        written.add(consolidated);
        log.info("discovery output written runId={} files={} directory={}", result.runId(), written.size(), directory);
        return written;
    }

    Map<String, Object> phaseDocument(DiscoveryResult result, String phase) {
        List<String> urls = result.urlsFoundBy(phase);
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("timestamp", result.finishedAt());
        document.put("source_module", phase);
        document.put("base_domain", result.baseDomain());
        document.put("total_urls", urls.size());
        document.put("urls", urls);
        return document;
    }

    Map<String, Object> consolidatedDocument(DiscoveryResult result) {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("timestamp", result.finishedAt());
        document.put("source_module", CONSOLIDATED);
        document.put("base_domain", result.baseDomain());
        document.put("total_urls", result.totalUrls());
        document.put("urls", result.urls());
        document.put("discovery_time_seconds", result.discoveryTimeSeconds());
        document.put("llm_keywords_generated", result.llmKeywordsGenerated());
        document.put("discovery_stats", result.discoveryStats());
        document.put("phase_stats", result.phaseStats());
        document.put("hosts", result.hosts());
        document.put("termination_reason", result.terminationReason());
        document.put("state", result.state());
        return document;
    }

    private static String fileSafe(String value) {
        return value.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9.-]", "_");
    }
}
