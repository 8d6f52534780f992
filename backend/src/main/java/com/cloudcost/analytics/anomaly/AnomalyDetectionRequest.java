package com.cloudcost.analytics.anomaly;

import com.cloudcost.analytics.error.ValidationException;
import com.cloudcost.analytics.store.DimensionFilter;

/**
 * Parameters of one detection run.
 *
 * @param userId owner of the cost data
 * @param filter optional dimension restriction
 * @param sensitivity level used when no explicit threshold is given
 * @param threshold explicit deviation threshold, overrides the sensitivity
 */
public record AnomalyDetectionRequest(
        String userId,
        DimensionFilter filter,
        Sensitivity sensitivity,
        Double threshold
) {
    public AnomalyDetectionRequest {
        if (userId == null || userId.isBlank()) {
            throw new ValidationException("userId is required");
        }
        if (threshold != null && (threshold.isNaN() || threshold < 0)) {
            throw new ValidationException("Deviation threshold must be a non-negative number: " + threshold);
        }
        filter = filter == null ? DimensionFilter.all() : filter;
        sensitivity = sensitivity == null ? Sensitivity.MEDIUM : sensitivity;
    }

    public static AnomalyDetectionRequest forUser(String userId) {
        return new AnomalyDetectionRequest(userId, DimensionFilter.all(), Sensitivity.MEDIUM, null);
    }

    public double effectiveThreshold() {
        return threshold != null ? threshold : sensitivity.getDefaultThreshold();
    }
}
