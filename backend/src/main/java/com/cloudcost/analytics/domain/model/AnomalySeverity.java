package com.cloudcost.analytics.domain.model;

/**
 * Ordinal severity of a cost anomaly, derived from its deviation.
 *
 * Bands are evaluated high to low:
 * - CRITICAL: deviation > 1.0
 * - HIGH: deviation > 0.5
 * - MEDIUM: deviation > 0.3
 * - LOW: everything else
 */
public enum AnomalySeverity {
    LOW("#65a30d"),
    MEDIUM("#d97706"),
    HIGH("#ea580c"),
    CRITICAL("#dc2626");

    private final String displayColor;

    AnomalySeverity(String displayColor) {
        this.displayColor = displayColor;
    }

    /**
     * Hex colour used when rendering alerts.
     */
    public String getDisplayColor() {
        return displayColor;
    }

    public static AnomalySeverity fromDeviation(double deviation) {
        if (deviation > 1.0) return CRITICAL;
        if (deviation > 0.5) return HIGH;
        if (deviation > 0.3) return MEDIUM;
        return LOW;
    }
}
