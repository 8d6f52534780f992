package com.cloudcost.analytics.domain.model;

public enum AlertType {
    ANOMALY,
    THRESHOLD,
    FORECAST
}
