package com.cloudcost.analytics.anomaly;

import com.cloudcost.analytics.analysis.CostPattern;
import com.cloudcost.analytics.analysis.CostSeries;
import com.cloudcost.analytics.analysis.DimensionKey;
import com.cloudcost.analytics.analysis.PatternAnalyzer;
import com.cloudcost.analytics.analysis.SeriesGrouper;
import com.cloudcost.analytics.domain.model.Anomaly;
import com.cloudcost.analytics.domain.model.AnomalySeverity;
import com.cloudcost.analytics.domain.model.AnomalyStatus;
import com.cloudcost.analytics.domain.model.CostRecord;
import com.cloudcost.analytics.error.NoDataException;
import com.cloudcost.analytics.store.AnomalyStore;
import com.cloudcost.analytics.store.BillingStore;
import com.cloudcost.analytics.store.TimeWindow;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Flags series whose latest cost deviates from the expected baseline.
 *
 * DETECTION FLOW:
 * 1. Fetch the lookback window of cost records (fails with NoData when empty)
 * 2. Group into series and analyze patterns
 * 3. deviation = |actual - expected| / expected; series with a zero or negative baseline are skipped
 * 4. deviation above the threshold produces an ACTIVE anomaly with severity and root cause
 * 5. All anomalies of the run are saved in one batch; a store failure fails the run
 *    Anomalies stored by an earlier run keep their stored status
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AnomalyDetector {

    private final BillingStore billingStore;
    private final AnomalyStore anomalyStore;
    private final SeriesGrouper seriesGrouper;
    private final PatternAnalyzer patternAnalyzer;
    private final RootCauseAnalyzer rootCauseAnalyzer;
    private final Clock clock;

    @Value("${analytics.detection.lookback-days:30}")
    private int lookbackDays = 30;

    public DetectionRun detectAnomalies(AnomalyDetectionRequest request) {
        TimeWindow window = TimeWindow.lastDays(lookbackDays, clock);
        log.info("Detecting anomalies for user {} ({}), threshold {}",
                request.userId(), request.filter(), request.effectiveThreshold());

        List<CostRecord> records = billingStore.fetchCostRecords(request.userId(), request.filter(), window);
        if (records.isEmpty()) {
            throw new NoDataException(String.format(
                    "No cost data for user %s (%s) between %s and %s",
                    request.userId(), request.filter(), window.from(), window.to()));
        }

        Map<DimensionKey, CostSeries> series = seriesGrouper.group(records);
        List<CostPattern> patterns = patternAnalyzer.analyze(series.values());
        List<Anomaly> anomalies = detect(request.userId(), patterns, request.effectiveThreshold());

        List<Anomaly> created = anomalyStore.saveAnomalies(request.userId(), anomalies);

        log.info("Detected {} anomalies ({} new) across {} series for user {}",
                anomalies.size(), created.size(), series.size(), request.userId());
        return new DetectionRun(request.userId(), anomalies, created);
    }

    /**
     * Evaluate patterns against a threshold without touching any store.
     */
    public List<Anomaly> detect(String userId, List<CostPattern> patterns, double threshold) {
        List<Anomaly> anomalies = new ArrayList<>();

        for (CostPattern pattern : patterns) {
            if (pattern.expectedCost() <= 0) {
                log.debug("Skipping series {} with non-positive expected cost {}",
                        pattern.key(), pattern.expectedCost());
                continue;
            }

            double deviation = deviation(pattern.actualCost(), pattern.expectedCost());
            if (deviation > threshold) {
                anomalies.add(toAnomaly(userId, pattern, deviation));
            }
        }
        return anomalies;
    }

    public static double deviation(double actualCost, double expectedCost) {
        return Math.abs(actualCost - expectedCost) / expectedCost;
    }

    private Anomaly toAnomaly(String userId, CostPattern pattern, double deviation) {
        RootCauseAssessment rootCause = rootCauseAnalyzer.assess(pattern, deviation);
        DimensionKey key = pattern.key();

        return Anomaly.builder()
                .id(anomalyId(userId, key, pattern.timestamp()))
                .userId(userId)
                .detectedFor(pattern.timestamp())
                .provider(key.provider())
                .service(key.service())
                .project(key.project())
                .actualCost(pattern.actualCost())
                .expectedCost(pattern.expectedCost())
                .deviation(deviation)
                .severity(AnomalySeverity.fromDeviation(deviation))
                .rootCauseCategory(rootCause.cause())
                .rootCause(rootCause.description())
                .status(AnomalyStatus.ACTIVE)
                .createdAt(LocalDateTime.now(clock))
                .build();
    }

    static String anomalyId(String userId, DimensionKey key, Instant timestamp) {
        String name = userId + "|" + key + "|" + timestamp;
        return UUID.nameUUIDFromBytes(name.getBytes(StandardCharsets.UTF_8)).toString();
    }
}
