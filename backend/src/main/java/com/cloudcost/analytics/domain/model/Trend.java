package com.cloudcost.analytics.domain.model;

/**
 * Direction of a cost series, comparing the mean of its second half to its first half.
 */
public enum Trend {
    INCREASING,
    DECREASING,
    STABLE
}
