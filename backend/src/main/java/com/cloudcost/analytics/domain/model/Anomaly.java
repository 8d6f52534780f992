package com.cloudcost.analytics.domain.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

/**
 * A cost series whose latest actual cost deviates from its expected baseline
 * by more than the detection threshold.
 *
 * {@code deviation = |actualCost - expectedCost| / expectedCost}; expected cost is never zero.
 */
@Entity
@Table(name = "anomalies", indexes = {
    @Index(name = "idx_anomaly_user_time", columnList = "userId, detectedFor"),
    @Index(name = "idx_anomaly_severity", columnList = "userId, severity")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Anomaly {

    /**
     * Name-based UUID over user, dimension and timestamp. Identical input yields the same id.
     */
    @Id
    @Column(length = 36)
    private String id;

    @Column(nullable = false, length = 64)
    private String userId;

    /**
     * Timestamp of the cost record the anomaly was detected on.
     */
    @Column(nullable = false)
    private Instant detectedFor;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private CloudProvider provider;

    @Column(nullable = false, length = 128)
    private String service;

    @Column(nullable = false, length = 128)
    private String project;

    @Column(nullable = false)
    private double actualCost;

    @Column(nullable = false)
    private double expectedCost;

    @Column(nullable = false)
    private double deviation;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private AnomalySeverity severity;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private RootCause rootCauseCategory;

    @Column(length = 512)
    private String rootCause;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private AnomalyStatus status;

    /**
     * First detection time. Re-detection of the same anomaly keeps it.
     */
    @Column(nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now(ZoneOffset.UTC);
        }
        if (status == null) {
            status = AnomalyStatus.ACTIVE;
        }
    }
}
