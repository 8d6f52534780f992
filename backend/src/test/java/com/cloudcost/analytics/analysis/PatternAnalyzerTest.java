package com.cloudcost.analytics.analysis;

import com.cloudcost.analytics.domain.model.Trend;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static com.cloudcost.analytics.analysis.CostRecordFixtures.series;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class PatternAnalyzerTest {

    private final PatternAnalyzer analyzer = new PatternAnalyzer();

    @Nested
    @DisplayName("Expected cost")
    class ExpectedCostTests {

        @Test
        @DisplayName("Should average all points of a series shorter than the window")
        void shouldAverageShortSeries() {
            CostPattern pattern = analyzer.analyze(series(10, 20, 30, 40));

            assertThat(pattern.expectedCost()).isCloseTo(25.0, within(1e-9));
        }

        @Test
        @DisplayName("Should average the seven points of a full-window series")
        void shouldAverageSevenPoints() {
            CostPattern pattern = analyzer.analyze(series(100, 100, 100, 100, 100, 100, 200));

            assertThat(pattern.expectedCost()).isCloseTo(800.0 / 7, within(1e-9));
            assertThat(pattern.actualCost()).isEqualTo(200.0);
            assertThat(pattern.dataPoints()).isEqualTo(7);
        }

        @Test
        @DisplayName("Should use only the trailing seven points of a long series")
        void shouldUseTrailingWindow() {
            CostPattern pattern = analyzer.analyze(series(1000, 1000, 10, 10, 10, 10, 10, 10, 10));

            assertThat(pattern.expectedCost()).isCloseTo(10.0, within(1e-9));
        }

        @Test
        @DisplayName("Should handle a single-point series")
        void shouldHandleSinglePoint() {
            CostPattern pattern = analyzer.analyze(series(42));

            assertThat(pattern.expectedCost()).isEqualTo(42.0);
            assertThat(pattern.trend()).isEqualTo(Trend.STABLE);
            assertThat(pattern.hasSeasonality()).isFalse();
        }
    }

    @Nested
    @DisplayName("Trend")
    class TrendTests {

        @Test
        @DisplayName("Should classify a 20% rise as increasing")
        void shouldDetectIncrease() {
            assertThat(analyzer.trend(new double[]{100, 100, 110, 130})).isEqualTo(Trend.INCREASING);
        }

        @Test
        @DisplayName("Should classify a halving as decreasing")
        void shouldDetectDecrease() {
            assertThat(analyzer.trend(new double[]{200, 200, 100, 100})).isEqualTo(Trend.DECREASING);
        }

        @Test
        @DisplayName("Should classify changes under 10% as stable")
        void shouldDetectStable() {
            assertThat(analyzer.trend(new double[]{100, 100, 100, 105})).isEqualTo(Trend.STABLE);
        }

        @Test
        @DisplayName("Should split odd-length series with the extra point in the second half")
        void shouldSplitOddSeries() {
            // first half [100], second half [100, 130] -> +15%
            assertThat(analyzer.trend(new double[]{100, 100, 130})).isEqualTo(Trend.INCREASING);
        }

        @Test
        @DisplayName("Should not divide by a zero first half")
        void shouldHandleZeroFirstHalf() {
            assertThat(analyzer.trend(new double[]{0, 0, 5, 5})).isEqualTo(Trend.INCREASING);
            assertThat(analyzer.trend(new double[]{0, 0, 0, 0})).isEqualTo(Trend.STABLE);
        }
    }

    @Nested
    @DisplayName("Seasonality")
    class SeasonalityTests {

        @Test
        @DisplayName("Should report a daily signal when one weekday varies far more than the rest")
        void shouldDetectWeekdaySignal() {
            // 35 days from a Monday; Mondays alternate 50/150, other days are flat
            double[] costs = new double[35];
            Arrays.fill(costs, 100);
            for (int week = 0; week < 5; week++) {
                costs[week * 7] = week % 2 == 0 ? 50 : 150;
            }

            CostPattern pattern = analyzer.analyze(series(costs));

            assertThat(pattern.hasSeasonality()).isTrue();
            assertThat(pattern.seasonality().period()).isEqualTo(SeasonalityPeriod.DAILY);
            // Monday variance is the only non-zero bucket: max / mean = 7
            assertThat(pattern.seasonality().amplitude()).isCloseTo(7.0, within(1e-9));
        }

        @Test
        @DisplayName("Should report nothing for a flat series")
        void shouldIgnoreFlatSeries() {
            double[] costs = new double[40];
            Arrays.fill(costs, 100);

            assertThat(analyzer.analyze(series(costs)).hasSeasonality()).isFalse();
        }

        @Test
        @DisplayName("Should not evaluate series with fewer than 30 points")
        void shouldSkipShortSeries() {
            double[] costs = new double[29];
            Arrays.fill(costs, 100);
            costs[0] = 10;
            costs[7] = 500;

            assertThat(analyzer.analyze(series(costs)).hasSeasonality()).isFalse();
        }
    }
}
