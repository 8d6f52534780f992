package com.cloudcost.analytics.anomaly;

import com.cloudcost.analytics.domain.model.Anomaly;

import java.util.List;

/**
 * Result of one detection pass.
 *
 * @param anomalies every anomaly found in the run, including ones stored by earlier runs
 * @param newAnomalies the subset that was stored for the first time by this run
 */
public record DetectionRun(
        String userId,
        List<Anomaly> anomalies,
        List<Anomaly> newAnomalies
) {
}
