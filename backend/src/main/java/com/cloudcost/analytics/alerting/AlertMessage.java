package com.cloudcost.analytics.alerting;

import com.cloudcost.analytics.domain.model.Alert;
import com.cloudcost.analytics.domain.model.AlertType;
import com.cloudcost.analytics.domain.model.AnomalySeverity;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * Channel-independent content of an alert, handed to every channel sender.
 */
public record AlertMessage(
        String alertId,
        String userId,
        AlertType type,
        AnomalySeverity severity,
        String title,
        String body,
        Map<String, String> metadata,
        LocalDateTime createdAt
) {
    public static AlertMessage from(Alert alert) {
        return new AlertMessage(
                alert.getId(),
                alert.getUserId(),
                alert.getType(),
                alert.getSeverity(),
                alert.getTitle(),
                alert.getMessage(),
                alert.getMetadata() == null ? Map.of() : Map.copyOf(alert.getMetadata()),
                alert.getCreatedAt()
        );
    }
}
