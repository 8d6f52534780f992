package com.cloudcost.analytics.api;

import jakarta.validation.Valid;
import jakarta.validation.constraints.PositiveOrZero;

/**
 * @param timeframe history range used for the forecast: 7d, 30d or 90d
 */
public record ForecastRequest(
        String timeframe,
        String provider,
        String service,
        String project,
        @Valid SimulationRequest simulationInput
) {
    public record SimulationRequest(
            @PositiveOrZero int newDeployments,
            @PositiveOrZero double expectedGrowth,
            String plannedChanges
    ) {}
}
