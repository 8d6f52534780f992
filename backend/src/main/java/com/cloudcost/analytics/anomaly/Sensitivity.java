package com.cloudcost.analytics.anomaly;

import com.cloudcost.analytics.error.ValidationException;

import java.util.Locale;

/**
 * Detection sensitivity. A more sensitive level uses a lower deviation threshold.
 */
public enum Sensitivity {
    LOW(0.5),
    MEDIUM(0.3),
    HIGH(0.2);

    private final double defaultThreshold;

    Sensitivity(double defaultThreshold) {
        this.defaultThreshold = defaultThreshold;
    }

    public double getDefaultThreshold() {
        return defaultThreshold;
    }

    /**
     * Parse {@code low}, {@code medium} or {@code high}; null or blank means MEDIUM.
     */
    public static Sensitivity fromCode(String code) {
        if (code == null || code.isBlank()) {
            return MEDIUM;
        }
        try {
            return valueOf(code.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Unknown sensitivity: " + code);
        }
    }
}
