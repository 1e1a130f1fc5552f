package com.delta.urlscout.crawl.phase;

import com.delta.urlscout.crawl.frontier.Frontier;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Run-wide stop conditions: wall-clock deadline, explicit cancellation and the page ceiling.
 * The first condition hit is kept as the stop reason.
 */
public class DiscoveryBudget {
    public static final String CANCELLED = "cancelled";
    public static final String DEADLINE_REACHED = "deadline_reached";
    public static final String MAX_PAGES_REACHED = "max_pages_reached";

    private final Clock clock;
    private final Instant deadline;
    private volatile boolean cancelled;
    private String stopReason;

    public DiscoveryBudget(Clock clock, Duration maxDuration) {
        this.clock = clock;
        this.deadline = maxDuration == null || maxDuration.isZero() || maxDuration.isNegative()
            ? null
            : clock.instant().plus(maxDuration);
    }

    public void cancel() {
        cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public Instant deadline() {
        return deadline;
    }

    /**
     * Checked before each dispatch. Once it returns {@code true} it keeps returning {@code true}.
     */
    public synchronized boolean isExhausted(Frontier frontier) {
        if (stopReason != null) {
            return true;
        }
        if (cancelled) {
            stopReason = CANCELLED;
        } else if (deadline != null && !clock.instant().isBefore(deadline)) {
            stopReason = DEADLINE_REACHED;
        } else if (frontier != null && frontier.isAtCapacity()) {
            stopReason = MAX_PAGES_REACHED;
        }
        return stopReason != null;
    }

    public synchronized String stopReason() {
        return stopReason;
    }
}
