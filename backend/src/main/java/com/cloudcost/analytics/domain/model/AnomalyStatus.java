package com.cloudcost.analytics.domain.model;

/**
 * Lifecycle of a detected anomaly. Detection always creates ACTIVE anomalies;
 * the other states are set by the resolution workflow.
 */
public enum AnomalyStatus {
    ACTIVE,
    RESOLVED,
    IGNORED
}
