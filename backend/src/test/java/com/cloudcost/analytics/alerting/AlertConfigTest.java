package com.cloudcost.analytics.alerting;

import com.cloudcost.analytics.domain.model.AnomalySeverity;
import com.cloudcost.analytics.domain.model.NotificationChannel;
import com.cloudcost.analytics.error.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AlertConfigTest {

    @Test
    @DisplayName("Defaults should enable email and in-app and notify on critical and high only")
    void shouldProvideDefaults() {
        AlertConfig config = AlertConfig.defaults("user-1");

        assertThat(config.isEnabled(NotificationChannel.EMAIL)).isTrue();
        assertThat(config.isEnabled(NotificationChannel.IN_APP)).isTrue();
        assertThat(config.isEnabled(NotificationChannel.CHAT)).isFalse();

        assertThat(config.threshold(AnomalySeverity.CRITICAL)).isEqualTo(1.0);
        assertThat(config.threshold(AnomalySeverity.HIGH)).isEqualTo(0.5);
        assertThat(config.threshold(AnomalySeverity.MEDIUM)).isEqualTo(0.3);
        assertThat(config.threshold(AnomalySeverity.LOW)).isEqualTo(0.2);

        assertThat(config.shouldNotify(AnomalySeverity.CRITICAL)).isTrue();
        assertThat(config.shouldNotify(AnomalySeverity.HIGH)).isTrue();
        assertThat(config.shouldNotify(AnomalySeverity.MEDIUM)).isFalse();
        assertThat(config.shouldNotify(AnomalySeverity.LOW)).isFalse();
    }

    @Test
    @DisplayName("Unset thresholds and preferences should not block alerts or notify")
    void shouldTreatMissingEntriesConservatively() {
        AlertConfig config = new AlertConfig("user-1", Set.of(), Map.of(), Map.of(), null, null);

        assertThat(config.threshold(AnomalySeverity.HIGH)).isZero();
        assertThat(config.shouldNotify(AnomalySeverity.HIGH)).isFalse();
        assertThat(config.channels()).isEmpty();
    }

    @Test
    @DisplayName("Should reject negative thresholds")
    void shouldRejectNegativeThreshold() {
        assertThatThrownBy(() -> new AlertConfig("user-1", Set.of(NotificationChannel.EMAIL),
                Map.of(AnomalySeverity.LOW, -0.1), Map.of(), null, null))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("LOW");
    }

    @Test
    @DisplayName("Should reject a missing threshold value with a validation error")
    void shouldRejectNullThreshold() {
        Map<AnomalySeverity, Double> thresholds = new HashMap<>();
        thresholds.put(AnomalySeverity.HIGH, null);

        assertThatThrownBy(() -> new AlertConfig("user-1", Set.of(NotificationChannel.EMAIL),
                thresholds, Map.of(), null, null))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("HIGH");
    }

    @Test
    @DisplayName("Should reject a missing notification flag with a validation error")
    void shouldRejectNullNotifyFlag() {
        Map<AnomalySeverity, Boolean> notify = new HashMap<>();
        notify.put(AnomalySeverity.CRITICAL, null);

        assertThatThrownBy(() -> new AlertConfig("user-1", Set.of(NotificationChannel.EMAIL),
                Map.of(), notify, null, null))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("CRITICAL");
    }
}
