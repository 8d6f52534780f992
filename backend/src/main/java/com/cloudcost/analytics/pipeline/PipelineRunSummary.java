package com.cloudcost.analytics.pipeline;

import com.cloudcost.analytics.alerting.DispatchReport;
import com.cloudcost.analytics.domain.model.Anomaly;

import java.util.List;
import java.util.Map;

/**
 * Outcome of one detection-and-alerting run for a user.
 *
 * @param anomalies anomalies detected and saved
 * @param dispatches reports of alerts that were dispatched or suppressed
 * @param failedDispatches alert id to error message for dispatches that failed
 */
public record PipelineRunSummary(
        String userId,
        List<Anomaly> anomalies,
        List<DispatchReport> dispatches,
        Map<String, String> failedDispatches
) {
    public int alertsRaised() {
        return dispatches.size() + failedDispatches.size();
    }
}
