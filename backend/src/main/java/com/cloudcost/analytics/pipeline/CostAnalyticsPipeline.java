package com.cloudcost.analytics.pipeline;

import com.cloudcost.analytics.alerting.AlertConfig;
import com.cloudcost.analytics.alerting.AlertDispatcher;
import com.cloudcost.analytics.alerting.AlertFactory;
import com.cloudcost.analytics.alerting.DispatchReport;
import com.cloudcost.analytics.anomaly.AnomalyDetectionRequest;
import com.cloudcost.analytics.anomaly.AnomalyDetector;
import com.cloudcost.analytics.anomaly.DetectionRun;
import com.cloudcost.analytics.domain.model.Alert;
import com.cloudcost.analytics.domain.model.Anomaly;
import com.cloudcost.analytics.domain.model.AnomalyStatus;
import com.cloudcost.analytics.store.AlertStore;
import com.cloudcost.analytics.store.SettingsStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs detection for a user and turns the anomalies into dispatched alerts.
 *
 * DECISION FLOW:
 * 1. Detect and save anomalies (NoData and store failures propagate)
 * 2. Load the user's alert configuration
 * 3. Raise an alert for each newly stored ACTIVE anomaly whose deviation reaches the user's
 *    threshold for its severity; anomalies seen by an earlier run were already alerted on
 * 4. Persist the alert as PENDING and dispatch it
 *
 * A failed dispatch is recorded in the summary; the remaining alerts are still dispatched.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CostAnalyticsPipeline {

    private final AnomalyDetector anomalyDetector;
    private final SettingsStore settingsStore;
    private final AlertStore alertStore;
    private final AlertFactory alertFactory;
    private final AlertDispatcher alertDispatcher;

    public PipelineRunSummary run(AnomalyDetectionRequest request) {
        DetectionRun detection = anomalyDetector.detectAnomalies(request);
        AlertConfig config = settingsStore.getAlertConfig(request.userId());

        List<DispatchReport> dispatches = new ArrayList<>();
        Map<String, String> failed = new LinkedHashMap<>();

        for (Anomaly anomaly : detection.newAnomalies()) {
            if (anomaly.getStatus() != AnomalyStatus.ACTIVE) {
                continue;
            }
            if (anomaly.getDeviation() < config.threshold(anomaly.getSeverity())) {
                log.debug("Anomaly {} below user threshold for {}", anomaly.getId(), anomaly.getSeverity());
                continue;
            }

            Alert alert = alertStore.createAlert(alertFactory.fromAnomaly(anomaly));
            try {
                dispatches.add(alertDispatcher.dispatch(alert, config));
            } catch (RuntimeException e) {
                log.error("Alert {} for anomaly {} failed: {}", alert.getId(), anomaly.getId(), e.getMessage(), e);
                failed.put(alert.getId(), e.getMessage());
            }
        }

        log.info("Pipeline run for user {}: {} anomalies ({} new), {} alerts dispatched, {} failed",
                request.userId(), detection.anomalies().size(), detection.newAnomalies().size(),
                dispatches.size(), failed.size());
        return new PipelineRunSummary(request.userId(), detection.anomalies(), dispatches, failed);
    }
}
