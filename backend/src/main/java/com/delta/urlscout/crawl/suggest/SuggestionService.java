package com.delta.urlscout.crawl.suggest;

import com.delta.urlscout.config.CrawlerProperties;
import com.delta.urlscout.crawl.util.HashUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Budgeted access to the model. Callers always get an answer: cached model output, a fresh model
 * answer, or the static fallback for the prompt kind and site type.
 */
@Service
public class SuggestionService {
    private static final Logger log = LoggerFactory.getLogger(SuggestionService.class);

    private final CrawlerProperties properties;
    private final SuggestionClient client;
    private final SuggestionBudget budget;
    private final Clock clock;
    private final Map<String, List<String>> cache = new ConcurrentHashMap<>();
    private final Map<String, CompletableFuture<List<String>>> inFlight = new ConcurrentHashMap<>();
    private final AtomicInteger modelCalls = new AtomicInteger();
    private final AtomicInteger cacheHits = new AtomicInteger();
    private final AtomicInteger fallbacks = new AtomicInteger();
    private final AtomicInteger modelValues = new AtomicInteger();

    public SuggestionService(
        CrawlerProperties properties,
        SuggestionClient client,
        SuggestionBudget budget,
        Clock clock
    ) {
        this.properties = properties;
        this.client = client;
        this.budget = budget;
        this.clock = clock;
    }

    public Suggestion suggest(SuggestionPrompt prompt) {
        int maxSuggestions = properties.getSuggestion().getMaxSuggestions();
        String userPrompt = SuggestionPrompts.render(prompt, maxSuggestions);
        String cacheKey = HashUtils.sha256Hex(prompt.kind().name(), SuggestionPrompts.normalize(userPrompt));

        List<String> cached = cache.get(cacheKey);
        if (cached != null) {
            cacheHits.incrementAndGet();
            modelValues.addAndGet(cached.size());
            log.debug("suggestion cache hit kind={} domain={}", prompt.kind(), prompt.domain());
            return new Suggestion(cached, SuggestionSource.CACHE);
        }
        if (!properties.getSuggestion().isEnabled()) {
            return fallback(prompt, "disabled");
        }

        // concurrent misses for the same prompt share one model call and one budget slot
        CompletableFuture<List<String>> pending = new CompletableFuture<>();
        CompletableFuture<List<String>> leader = inFlight.putIfAbsent(cacheKey, pending);
        if (leader != null) {
            return awaitShared(prompt, leader);
        }
        try {
            List<String> values = cache.get(cacheKey);
            if (values != null) {
                pending.complete(values);
                cacheHits.incrementAndGet();
                modelValues.addAndGet(values.size());
                return new Suggestion(values, SuggestionSource.CACHE);
            }
            Suggestion answer = askModel(prompt, userPrompt, maxSuggestions);
            if (answer.source() == SuggestionSource.MODEL) {
                cache.put(cacheKey, answer.values());
                pending.complete(answer.values());
            } else {
                pending.complete(List.of());
            }
            return answer;
        } catch (RuntimeException e) {
            pending.completeExceptionally(e);
            throw e;
        } finally {
            inFlight.remove(cacheKey, pending);
        }
    }

    private Suggestion askModel(SuggestionPrompt prompt, String userPrompt, int maxSuggestions) {
        Optional<Instant> slot = budget.reserve();
        if (slot.isEmpty()) {
            return fallback(prompt, "daily_limit_reached");
        }
        if (!waitUntil(slot.get())) {
            return fallback(prompt, "interrupted");
        }

        List<String> values;
        try {
            modelCalls.incrementAndGet();
            String answer = client.complete(SuggestionPrompts.SYSTEM_PROMPT, userPrompt);
            values = SuggestionResponseParser.parse(answer, prompt.kind(), prompt.domain(), maxSuggestions);
        } catch (SuggestionUnavailableException e) {
            log.warn("suggestion model unavailable kind={} domain={} error={}", prompt.kind(), prompt.domain(), e.getMessage());
            return fallback(prompt, "model_error");
        } catch (RuntimeException e) {
            log.warn("suggestion model failed kind={} domain={}", prompt.kind(), prompt.domain(), e);
            return fallback(prompt, "model_error");
        }
        if (values.isEmpty()) {
            log.warn("suggestion answer unparseable kind={} domain={}", prompt.kind(), prompt.domain());
            return fallback(prompt, "unparseable");
        }
        modelValues.addAndGet(values.size());
        log.info("suggestion model answer kind={} domain={} values={}", prompt.kind(), prompt.domain(), values.size());
        return new Suggestion(values, SuggestionSource.MODEL);
    }

    private Suggestion awaitShared(SuggestionPrompt prompt, CompletableFuture<List<String>> leader) {
        List<String> shared;
        try {
            shared = leader.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return fallback(prompt, "interrupted");
        } catch (ExecutionException e) {
            return fallback(prompt, "model_error");
        }
        if (shared.isEmpty()) {
            return fallback(prompt, "shared_call_failed");
        }
        cacheHits.incrementAndGet();
        modelValues.addAndGet(shared.size());
        log.debug("suggestion shared in-flight answer kind={} domain={}", prompt.kind(), prompt.domain());
        return new Suggestion(shared, SuggestionSource.CACHE);
    }

    public SuggestionUsage usage() {
        return new SuggestionUsage(modelCalls.get(), cacheHits.get(), fallbacks.get(), modelValues.get());
    }

    /**
     * Clears per-run counters. The response cache and the daily budget are kept.
     */
    public void resetUsage() {
        modelCalls.set(0);
        cacheHits.set(0);
        fallbacks.set(0);
        modelValues.set(0);
    }

    private Suggestion fallback(SuggestionPrompt prompt, String reason) {
        fallbacks.incrementAndGet();
        log.debug("suggestion fallback kind={} siteType={} reason={}", prompt.kind(), prompt.siteType(), reason);
        return new Suggestion(FallbackSuggestions.forPrompt(prompt, clock), SuggestionSource.FALLBACK);
    }

    private boolean waitUntil(Instant slot) {
        long sleepMs = Duration.between(clock.instant(), slot).toMillis();
        if (sleepMs <= 0) {
            return true;
        }
        try {
            Thread.sleep(sleepMs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
