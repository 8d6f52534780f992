package com.cloudcost.analytics.domain.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;
import java.time.ZoneOffset;

/**
 * Persisted per-user alert preferences.
 *
 * Columns left null on insert are filled from {@code AlertConfig.defaults}.
 */
@Entity
@Table(name = "alert_settings", indexes = {
    @Index(name = "idx_alert_settings_user", columnList = "userId", unique = true)
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AlertSettings {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true, length = 64)
    private String userId;

    private Boolean emailEnabled;

    private Boolean chatEnabled;

    private Boolean inAppEnabled;

    /**
     * Recipient for email alerts. Falls back to the user id.
     */
    @Column(length = 256)
    private String emailAddress;

    /**
     * Chat channel for alerts. Falls back to the configured default channel.
     */
    @Column(length = 128)
    private String chatChannel;

    private Double criticalThreshold;

    private Double highThreshold;

    private Double mediumThreshold;

    private Double lowThreshold;

    private Boolean notifyOnCritical;

    private Boolean notifyOnHigh;

    private Boolean notifyOnMedium;

    private Boolean notifyOnLow;

    @Column(nullable = false)
    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now(ZoneOffset.UTC);
        }
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now(ZoneOffset.UTC);
    }
}
