package com.cloudcost.analytics.forecast;

import java.time.LocalDate;

/**
 * Predicted cost for one future day with its confidence band.
 */
public record Forecast(
        LocalDate date,
        double predictedCost,
        ConfidenceInterval confidenceInterval
) {
    public record ConfidenceInterval(double low, double high) {

        public double width() {
            return high - low;
        }
    }
}
