package com.cloudcost.analytics.analysis;

/**
 * Granularity of a detected seasonal signal. Only day-of-week buckets are evaluated today.
 */
public enum SeasonalityPeriod {
    DAILY
}
