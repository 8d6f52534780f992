package com.cloudcost.analytics.alerting;

import com.cloudcost.analytics.domain.model.AnomalySeverity;
import com.cloudcost.analytics.domain.model.NotificationChannel;
import com.cloudcost.analytics.error.ValidationException;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Read-only view of a user's alert preferences.
 *
 * @param channels enabled delivery channels
 * @param thresholds minimum deviation per severity for an alert to be raised
 * @param notifyOnSeverity whether alerts of a severity are delivered at all
 * @param emailAddress email recipient, null to use the user id
 * @param chatChannel chat channel, null to use the configured default
 */
public record AlertConfig(
        String userId,
        Set<NotificationChannel> channels,
        Map<AnomalySeverity, Double> thresholds,
        Map<AnomalySeverity, Boolean> notifyOnSeverity,
        String emailAddress,
        String chatChannel
) {
    public AlertConfig {
        channels = channels == null || channels.isEmpty()
                ? Set.of()
                : Set.copyOf(EnumSet.copyOf(channels));
        if (thresholds != null) {
            for (Map.Entry<AnomalySeverity, Double> threshold : thresholds.entrySet()) {
                Double value = threshold.getValue();
                if (threshold.getKey() == null || value == null || value.isNaN() || value < 0) {
                    throw new ValidationException(
                            "Threshold for " + threshold.getKey() + " must be a non-negative number, got " + value);
                }
            }
        }
        if (notifyOnSeverity != null) {
            for (Map.Entry<AnomalySeverity, Boolean> notify : notifyOnSeverity.entrySet()) {
                if (notify.getKey() == null || notify.getValue() == null) {
                    throw new ValidationException("Notification flag for " + notify.getKey() + " must be set");
                }
            }
        }
        thresholds = Map.copyOf(thresholds == null ? Map.of() : thresholds);
        notifyOnSeverity = Map.copyOf(notifyOnSeverity == null ? Map.of() : notifyOnSeverity);
    }

    /**
     * Configuration used when a user has never saved alert settings:
     * email and in-app on, chat off; thresholds critical 1.0, high 0.5, medium 0.3, low 0.2;
     * notify on critical and high only.
     */
    public static AlertConfig defaults(String userId) {
        Map<AnomalySeverity, Double> thresholds = new EnumMap<>(AnomalySeverity.class);
        thresholds.put(AnomalySeverity.CRITICAL, 1.0);
        thresholds.put(AnomalySeverity.HIGH, 0.5);
        thresholds.put(AnomalySeverity.MEDIUM, 0.3);
        thresholds.put(AnomalySeverity.LOW, 0.2);

        Map<AnomalySeverity, Boolean> notify = new EnumMap<>(AnomalySeverity.class);
        notify.put(AnomalySeverity.CRITICAL, true);
        notify.put(AnomalySeverity.HIGH, true);
        notify.put(AnomalySeverity.MEDIUM, false);
        notify.put(AnomalySeverity.LOW, false);

        return new AlertConfig(
                userId,
                EnumSet.of(NotificationChannel.EMAIL, NotificationChannel.IN_APP),
                thresholds,
                notify,
                null,
                null
        );
    }

    public boolean isEnabled(NotificationChannel channel) {
        return channels.contains(channel);
    }

    public boolean shouldNotify(AnomalySeverity severity) {
        return Boolean.TRUE.equals(notifyOnSeverity.get(severity));
    }

    /**
     * Minimum deviation for the severity; 0 when unset.
     */
    public double threshold(AnomalySeverity severity) {
        return thresholds.getOrDefault(severity, 0.0);
    }
}
