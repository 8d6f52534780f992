package com.cloudcost.analytics.scheduler;

import com.cloudcost.analytics.anomaly.AnomalyDetectionRequest;
import com.cloudcost.analytics.anomaly.Sensitivity;
import com.cloudcost.analytics.error.NoDataException;
import com.cloudcost.analytics.pipeline.CostAnalyticsPipeline;
import com.cloudcost.analytics.pipeline.PipelineRunSummary;
import com.cloudcost.analytics.store.BillingStore;
import com.cloudcost.analytics.store.DimensionFilter;
import com.cloudcost.analytics.store.TimeWindow;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;

/**
 * Scheduled anomaly scan over every user with recent cost data.
 *
 * One user's failure is logged and does not stop the scan.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AnomalyScanJob {

    private final CostAnalyticsPipeline pipeline;
    private final BillingStore billingStore;
    private final Clock clock;

    @Value("${analytics.detection.lookback-days:30}")
    private int lookbackDays = 30;

    @Value("${analytics.detection.default-sensitivity:medium}")
    private String defaultSensitivity = "medium";

    /**
     * Runs daily at 3 AM by default.
     */
    @Scheduled(cron = "${analytics.scan.cron:0 0 3 * * *}")
    public void scanAllUsers() {
        log.info("Starting scheduled anomaly scan");

        List<String> users = billingStore.findActiveUsers(TimeWindow.lastDays(lookbackDays, clock));
        Sensitivity sensitivity = Sensitivity.fromCode(defaultSensitivity);

        int scanned = 0;
        int anomalies = 0;
        int failed = 0;

        for (String userId : users) {
            try {
                PipelineRunSummary summary = pipeline.run(
                        new AnomalyDetectionRequest(userId, DimensionFilter.all(), sensitivity, null));
                anomalies += summary.anomalies().size();
                scanned++;
            } catch (NoDataException e) {
                log.info("Skipping user {}: {}", userId, e.getMessage());
            } catch (Exception e) {
                failed++;
                log.error("Anomaly scan failed for user {}: {}", userId, e.getMessage(), e);
            }
        }

        log.info("Anomaly scan complete: {} users scanned, {} anomalies, {} failed",
                scanned, anomalies, failed);
    }
}
