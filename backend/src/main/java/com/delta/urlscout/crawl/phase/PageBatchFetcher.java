package com.delta.urlscout.crawl.phase;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * Runs one task per input on the shared crawl pool and waits for all of them. Each task checks
 * the run budget before it starts, so a stop request prevents further dispatch while tasks
 * already in flight are allowed to finish.
 */
public final class PageBatchFetcher {
    private static final Logger log = LoggerFactory.getLogger(PageBatchFetcher.class);

    private PageBatchFetcher() {
    }

    /**
     * Results in input order. Inputs skipped because of a stop request, and tasks returning
     * {@code null}, are left out.
     */
    public static <I, T> List<T> runAll(PhaseContext context, Collection<I> inputs, Function<I, T> task) {
        List<CompletableFuture<T>> futures = new ArrayList<>(inputs.size());
        for (I input : inputs) {
            if (context.shouldStop()) {
                break;
            }
            CompletableFuture<T> future = CompletableFuture
                .supplyAsync(() -> context.shouldStop() ? null : task.apply(input), context.crawlExecutor())
                .exceptionally(error -> {
                    log.warn("phase task failed phase={} input={} error={}", context.phase(), input, error.toString());
                    context.stats().recordErrors(0, 1);
                    return null;
                });
            futures.add(future);
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        List<T> results = new ArrayList<>(futures.size());
        for (CompletableFuture<T> future : futures) {
            T value = future.join();
            if (value != null) {
                results.add(value);
            }
        }
        return results;
    }
}
