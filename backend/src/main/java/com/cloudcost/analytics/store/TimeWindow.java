package com.cloudcost.analytics.store;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Closed time interval {@code [from, to]}.
 */
public record TimeWindow(
        Instant from,
        Instant to
) {
    public TimeWindow {
        if (from == null || to == null) {
            throw new IllegalArgumentException("Time window bounds are required");
        }
        if (from.isAfter(to)) {
            throw new IllegalArgumentException("Time window starts after it ends: " + from + " > " + to);
        }
    }

    /**
     * The window ending now and spanning the given number of days.
     */
    public static TimeWindow lastDays(int days, Clock clock) {
        Instant now = clock.instant();
        return new TimeWindow(now.minus(Duration.ofDays(days)), now);
    }

    /**
     * Parse a dashboard range such as {@code 7d}, {@code 30d} or {@code 90d}.
     * Anything else falls back to 30 days.
     */
    public static TimeWindow fromRange(String range, Clock clock) {
        int days = switch (range == null ? "" : range) {
            case "7d" -> 7;
            case "90d" -> 90;
            default -> 30;
        };
        return lastDays(days, clock);
    }
}
