package com.cloudcost.analytics.domain.model;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.TimeZone;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Lifecycle callbacks stamp UTC wall-clock time regardless of the JVM zone.
 */
class EntityTimestampTest {

    private TimeZone systemZone;

    @BeforeEach
    void setUp() {
        systemZone = TimeZone.getDefault();
        TimeZone.setDefault(TimeZone.getTimeZone("Asia/Kolkata"));
    }

    @AfterEach
    void tearDown() {
        TimeZone.setDefault(systemZone);
    }

    @Test
    @DisplayName("Anomaly creation time should be UTC")
    void anomalyShouldStampUtc() {
        Anomaly anomaly = new Anomaly();

        anomaly.onCreate();

        assertThat(anomaly.getCreatedAt()).isCloseTo(LocalDateTime.now(ZoneOffset.UTC), within(1, ChronoUnit.MINUTES));
        assertThat(anomaly.getStatus()).isEqualTo(AnomalyStatus.ACTIVE);
    }

    @Test
    @DisplayName("Alert settings creation and update times should be UTC")
    void alertSettingsShouldStampUtc() {
        AlertSettings settings = new AlertSettings();

        settings.onCreate();
        settings.onUpdate();

        assertThat(settings.getCreatedAt()).isCloseTo(LocalDateTime.now(ZoneOffset.UTC), within(1, ChronoUnit.MINUTES));
        assertThat(settings.getUpdatedAt()).isCloseTo(LocalDateTime.now(ZoneOffset.UTC), within(1, ChronoUnit.MINUTES));
    }

    @Test
    @DisplayName("Notification creation time should be UTC")
    void notificationShouldStampUtc() {
        Notification notification = new Notification();

        notification.onCreate();

        assertThat(notification.getCreatedAt()).isCloseTo(LocalDateTime.now(ZoneOffset.UTC), within(1, ChronoUnit.MINUTES));
    }

    @Test
    @DisplayName("Should keep a creation time that was already set")
    void shouldKeepExplicitCreationTime() {
        LocalDateTime firstSeen = LocalDateTime.of(2024, 1, 7, 6, 0);
        Anomaly anomaly = Anomaly.builder().createdAt(firstSeen).status(AnomalyStatus.RESOLVED).build();

        anomaly.onCreate();

        assertThat(anomaly.getCreatedAt()).isEqualTo(firstSeen);
        assertThat(anomaly.getStatus()).isEqualTo(AnomalyStatus.RESOLVED);
    }
}
