package com.cloudcost.analytics.analysis;

import com.cloudcost.analytics.domain.model.CostRecord;
import com.cloudcost.analytics.domain.model.Trend;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.DayOfWeek;
import java.time.ZoneOffset;
import java.util.*;

/**
 * Derives an expected-cost baseline, a trend and an optional seasonality signal per series.
 *
 * BASELINE:
 * Trailing moving average over the last {@value #MOVING_AVERAGE_WINDOW} points, or over all
 * points when the series is shorter.
 *
 * TREND:
 * Mean of the second half against mean of the first half (split by index). A relative
 * change below {@value #STABLE_TREND_BAND} is STABLE.
 *
 * SEASONALITY:
 * Only for series with at least {@value #SEASONALITY_MIN_POINTS} points. Costs are bucketed
 * by UTC day of week; a bucket whose variance exceeds twice the mean bucket variance marks
 * a daily seasonal signal.
 */
@Service
@Slf4j
public class PatternAnalyzer {

    static final int MOVING_AVERAGE_WINDOW = 7;
    static final double STABLE_TREND_BAND = 0.10;
    static final int SEASONALITY_MIN_POINTS = 30;
    private static final double SEASONALITY_VARIANCE_RATIO = 2.0;

    public List<CostPattern> analyze(Collection<CostSeries> series) {
        List<CostPattern> patterns = new ArrayList<>(series.size());
        for (CostSeries s : series) {
            patterns.add(analyze(s));
        }
        log.debug("Analyzed {} cost series", patterns.size());
        return patterns;
    }

    public CostPattern analyze(CostSeries series) {
        double[] costs = series.costs();
        CostRecord latest = series.latest();

        return new CostPattern(
                series.key(),
                latest.getRecordedAt(),
                latest.getAmount().doubleValue(),
                expectedCost(costs),
                trend(costs),
                seasonality(series),
                costs.length
        );
    }

    double expectedCost(double[] costs) {
        int window = Math.min(MOVING_AVERAGE_WINDOW, costs.length);
        double sum = 0;
        for (int i = costs.length - window; i < costs.length; i++) {
            sum += costs[i];
        }
        return sum / window;
    }

    Trend trend(double[] costs) {
        if (costs.length < 2) {
            return Trend.STABLE;
        }

        int split = costs.length / 2;
        double firstMean = mean(costs, 0, split);
        double secondMean = mean(costs, split, costs.length);

        // Relative change is undefined against a zero first half
        if (firstMean == 0) {
            return secondMean > 0 ? Trend.INCREASING : Trend.STABLE;
        }

        double change = (secondMean - firstMean) / firstMean;
        if (Math.abs(change) < STABLE_TREND_BAND) {
            return Trend.STABLE;
        }
        return change > 0 ? Trend.INCREASING : Trend.DECREASING;
    }

    Seasonality seasonality(CostSeries series) {
        if (series.size() < SEASONALITY_MIN_POINTS) {
            return null;
        }

        Map<DayOfWeek, List<Double>> buckets = new EnumMap<>(DayOfWeek.class);
        for (CostRecord record : series.records()) {
            DayOfWeek day = record.getRecordedAt().atZone(ZoneOffset.UTC).getDayOfWeek();
            buckets.computeIfAbsent(day, d -> new ArrayList<>()).add(record.getAmount().doubleValue());
        }

        double maxVariance = 0;
        double varianceSum = 0;
        for (List<Double> bucket : buckets.values()) {
            double variance = variance(bucket.stream().mapToDouble(Double::doubleValue).toArray());
            maxVariance = Math.max(maxVariance, variance);
            varianceSum += variance;
        }
        double meanVariance = varianceSum / buckets.size();

        if (meanVariance > 0 && maxVariance > meanVariance * SEASONALITY_VARIANCE_RATIO) {
            return new Seasonality(SeasonalityPeriod.DAILY, maxVariance / meanVariance);
        }
        return null;
    }

    private static double mean(double[] values, int from, int to) {
        double sum = 0;
        for (int i = from; i < to; i++) {
            sum += values[i];
        }
        return sum / (to - from);
    }

    /**
     * Population variance.
     */
    static double variance(double[] values) {
        double mean = mean(values, 0, values.length);
        double variance = 0;
        for (double v : values) {
            variance += (v - mean) * (v - mean);
        }
        return variance / values.length;
    }
}
