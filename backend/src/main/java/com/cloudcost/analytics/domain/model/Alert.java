package com.cloudcost.analytics.domain.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A user-facing notification about an anomaly, threshold breach or forecast.
 */
@Entity
@Table(name = "alerts", indexes = {
    @Index(name = "idx_alert_user_created", columnList = "userId, createdAt"),
    @Index(name = "idx_alert_status", columnList = "status")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Alert {

    @Id
    @Column(length = 36)
    private String id;

    @Column(nullable = false, length = 64)
    private String userId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private AlertType type;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private AnomalySeverity severity;

    @Column(nullable = false, length = 256)
    private String title;

    @Column(nullable = false, length = 2048)
    private String message;

    /**
     * Free-form context rendered alongside the message (dimension, costs, deviation).
     */
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "alert_metadata", joinColumns = @JoinColumn(name = "alert_id"))
    @MapKeyColumn(name = "meta_key", length = 64)
    @Column(name = "meta_value", length = 512)
    @Builder.Default
    private Map<String, String> metadata = new LinkedHashMap<>();

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private AlertStatus status;

    /**
     * Message of the error that failed the dispatch, if any.
     */
    @Column(length = 1024)
    private String failureReason;

    /**
     * Creation time in UTC.
     */
    @Column(nullable = false)
    private LocalDateTime createdAt;

    private LocalDateTime statusUpdatedAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now(ZoneOffset.UTC);
        }
        if (status == null) {
            status = AlertStatus.PENDING;
        }
    }
}
