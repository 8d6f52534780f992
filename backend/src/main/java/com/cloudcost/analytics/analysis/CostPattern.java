package com.cloudcost.analytics.analysis;

import com.cloudcost.analytics.domain.model.Trend;

import java.time.Instant;

/**
 * Result of pattern analysis for one series.
 *
 * @param key dimension the pattern describes
 * @param timestamp timestamp of the most recent record
 * @param actualCost amount of the most recent record
 * @param expectedCost trailing moving average baseline
 * @param trend half-over-half direction
 * @param seasonality day-of-week signal, or null when absent or not evaluated
 * @param dataPoints number of records in the series
 */
public record CostPattern(
        DimensionKey key,
        Instant timestamp,
        double actualCost,
        double expectedCost,
        Trend trend,
        Seasonality seasonality,
        int dataPoints
) {
    public boolean hasSeasonality() {
        return seasonality != null;
    }
}
