package com.delta.urlscout.crawl.suggest;

import com.delta.urlscout.config.CrawlerProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Optional;

/**
 * Daily ceiling and minimum spacing for model calls. {@link #reserve()} is atomic: each granted
 * reservation consumes one unit of today's quota and is given a start instant no earlier than the
 * previous reservation plus the spacing, so concurrent callers never exceed either limit.
 */
@Component
public class SuggestionBudget {
    private final Clock clock;
    private final int dailyLimit;
    private final Duration minSpacing;
    private final ZoneId zone;
    private LocalDate day;
    private int usedToday;
    private Instant lastSlot;

    @Autowired
    public SuggestionBudget(CrawlerProperties properties, Clock clock) {
        this(
            clock,
            properties.getSuggestion().getDailyLimit(),
            Duration.ofMillis(properties.getSuggestion().getMinSpacingMs()),
            zoneOf(properties.getSuggestion().getZoneId())
        );
    }

    SuggestionBudget(Clock clock, int dailyLimit, Duration minSpacing, ZoneId zone) {
        this.clock = clock;
        this.dailyLimit = Math.max(0, dailyLimit);
        this.minSpacing = minSpacing.isNegative() ? Duration.ZERO : minSpacing;
        this.zone = zone;
    }

    /**
     * Returns the instant at which the caller may issue its model call, or empty when today's
     * quota is spent.
     */
    public synchronized Optional<Instant> reserve() {
        rollDay();
        if (usedToday >= dailyLimit) {
            return Optional.empty();
        }
        Instant now = clock.instant();
        Instant slot = now;
        if (lastSlot != null) {
            Instant earliest = lastSlot.plus(minSpacing);
            if (earliest.isAfter(now)) {
                slot = earliest;
            }
        }
        lastSlot = slot;
        usedToday++;
        return Optional.of(slot);
    }

    public synchronized int usedToday() {
        rollDay();
        return usedToday;
    }

    public synchronized int remainingToday() {
        rollDay();
        return Math.max(0, dailyLimit - usedToday);
    }

    private void rollDay() {
        LocalDate today = LocalDate.ofInstant(clock.instant(), zone);
        if (!today.equals(day)) {
            day = today;
            usedToday = 0;
        }
    }

    static ZoneId zoneOf(String zoneId) {
        if (zoneId == null || zoneId.isBlank()) {
            return ZoneOffset.UTC;
        }
        try {
            return ZoneId.of(zoneId.trim());
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("Invalid crawler.suggestion.zone-id: " + zoneId, e);
        }
    }
}
