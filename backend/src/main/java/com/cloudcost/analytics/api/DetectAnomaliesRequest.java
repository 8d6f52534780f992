package com.cloudcost.analytics.api;

import jakarta.validation.constraints.PositiveOrZero;

/**
 * Body of an on-demand detection run. Every field is optional.
 */
public record DetectAnomaliesRequest(
        String provider,
        String service,
        String project,
        String sensitivity,
        @PositiveOrZero Double threshold
) {}
