package com.delta.urlscout.crawl.suggest;

import com.delta.urlscout.config.CrawlerProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.ExecutorService;

/**
 * Talks to any endpoint that implements the OpenAI {@code /chat/completions} contract
 * (OpenAI, OpenRouter, Ollama, vLLM and similar).
 */
@Component
public class OpenAiCompatibleSuggestionClient implements SuggestionClient {
    private static final Logger log = LoggerFactory.getLogger(OpenAiCompatibleSuggestionClient.class);

    private final CrawlerProperties properties;
    private final ObjectMapper objectMapper;
    private final HttpClient client;

    public OpenAiCompatibleSuggestionClient(
        CrawlerProperties properties,
        ObjectMapper objectMapper,
        @Qualifier("httpExecutor") ExecutorService httpExecutor
    ) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.client = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.getSuggestion().getTimeoutSeconds()))
            .version(HttpClient.Version.HTTP_1_1)
            .executor(httpExecutor)
            .build();
    }

    @Override
    public String complete(String systemPrompt, String userPrompt) {
        CrawlerProperties.Suggestion settings = properties.getSuggestion();
        if (settings.getApiKey() == null || settings.getApiKey().isBlank()) {
            throw new SuggestionUnavailableException("suggestion api key is not configured");
        }
        URI uri;
        try {
            uri = URI.create(stripTrailingSlash(settings.getBaseUrl()) + "/chat/completions");
        } catch (IllegalArgumentException e) {
            throw new SuggestionUnavailableException("invalid suggestion base url: " + settings.getBaseUrl(), e);
        }

        String requestBody;
        try {
            requestBody = objectMapper.writeValueAsString(buildRequest(settings.getModel(), systemPrompt, userPrompt));
        } catch (JsonProcessingException e) {
            throw new SuggestionUnavailableException("could not encode completion request", e);
        }
        HttpRequest request = HttpRequest.newBuilder(uri)
            .timeout(Duration.ofSeconds(settings.getTimeoutSeconds()))
            .header("Authorization", "Bearer " + settings.getApiKey())
            .header("Content-Type", "application/json")
            .header("Accept", "application/json")
            .header("User-Agent", CrawlerProperties.normalizeUserAgent(properties.getUserAgent()))
            .POST(HttpRequest.BodyPublishers.ofString(requestBody, StandardCharsets.UTF_8))
            .build();

        HttpResponse<String> response;
        try {
            response = client.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (HttpTimeoutException e) {
            throw new SuggestionUnavailableException("completion request timed out", e);
        } catch (IOException e) {
            throw new SuggestionUnavailableException("completion request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SuggestionUnavailableException("completion request interrupted", e);
        }
        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            log.warn("completion endpoint returned status={} model={}", response.statusCode(), settings.getModel());
            throw new SuggestionUnavailableException("completion endpoint returned status " + response.statusCode());
        }
        return extractContent(response.body());
    }

    private ObjectNode buildRequest(String model, String systemPrompt, String userPrompt) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("model", model);
        root.put("temperature", 0.3);
        ArrayNode messages = root.putArray("messages");
        messages.addObject().put("role", "system").put("content", systemPrompt);
        messages.addObject().put("role", "user").put("content", userPrompt);
        return root;
    }

    String extractContent(String body) {
        try {
            JsonNode root = objectMapper.readTree(body == null ? "" : body);
            JsonNode content = root.path("choices").path(0).path("message").path("content");
            if (!content.isTextual() || content.asText().isBlank()) {
                throw new SuggestionUnavailableException("completion response has no message content");
            }
            return content.asText();
        } catch (JsonProcessingException e) {
            throw new SuggestionUnavailableException("completion response is not JSON", e);
        }
    }

    private static String stripTrailingSlash(String value) {
        if (value == null) {
            return "";
        }
        String trimmed = value.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }
}
