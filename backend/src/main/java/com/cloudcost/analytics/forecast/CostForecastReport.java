package com.cloudcost.analytics.forecast;

import java.util.List;
import java.util.Map;

/**
 * Forecasts for a user's total spend and for each cost dimension with enough history.
 *
 * @param total forecast over all records summed per day; empty with fewer than 2 days
 * @param byDimension forecasts keyed by dimension key string ({@code provider:service:project})
 */
public record CostForecastReport(
        String userId,
        List<Forecast> total,
        Map<String, List<Forecast>> byDimension,
        SimulationInput simulation
) {}
