package com.cloudcost.analytics.analysis;

/**
 * Day-of-week cost pattern. Amplitude is the ratio of the largest bucket variance to the
 * mean bucket variance, so it is always above 2 when reported.
 */
public record Seasonality(
        SeasonalityPeriod period,
        double amplitude
) {}
