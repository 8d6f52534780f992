package com.cloudcost.analytics.alerting;

import com.cloudcost.analytics.domain.model.Alert;
import com.cloudcost.analytics.domain.model.AlertStatus;
import com.cloudcost.analytics.domain.model.AlertType;
import com.cloudcost.analytics.domain.model.Anomaly;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Builds pending alerts from detected anomalies.
 */
@Component
@RequiredArgsConstructor
public class AlertFactory {

    private final Clock clock;

    public Alert fromAnomaly(Anomaly anomaly) {
        boolean above = anomaly.getActualCost() >= anomaly.getExpectedCost();

        String message = String.format(
                "%s %s (project %s) cost $%.2f is %.0f%% %s the expected $%.2f. %s.",
                anomaly.getProvider().getDisplayName(),
                anomaly.getService(),
                anomaly.getProject(),
                anomaly.getActualCost(),
                anomaly.getDeviation() * 100,
                above ? "above" : "below",
                anomaly.getExpectedCost(),
                anomaly.getRootCause());

        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put("anomalyId", anomaly.getId());
        metadata.put("provider", anomaly.getProvider().name());
        metadata.put("service", anomaly.getService());
        metadata.put("project", anomaly.getProject());
        metadata.put("actualCost", String.format("%.2f", anomaly.getActualCost()));
        metadata.put("expectedCost", String.format("%.2f", anomaly.getExpectedCost()));
        metadata.put("deviation", String.format("%.3f", anomaly.getDeviation()));
        metadata.put("rootCause", anomaly.getRootCauseCategory().name());

        return Alert.builder()
                .id(UUID.randomUUID().toString())
                .userId(anomaly.getUserId())
                .type(AlertType.ANOMALY)
                .severity(anomaly.getSeverity())
                .title(String.format("%s cost anomaly detected in %s",
                        anomaly.getSeverity().name(), anomaly.getService()))
                .message(message)
                .metadata(metadata)
                .status(AlertStatus.PENDING)
                .createdAt(LocalDateTime.now(clock))
                .build();
    }
}
