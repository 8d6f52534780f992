package com.cloudcost.analytics.domain.model;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Objects;

/**
 * A single cost observation for one provider service, optionally tagged with a project.
 *
 * Records are produced by billing ingestion and are append-only: no setters are exposed,
 * analysis derives everything else (series, patterns, forecasts) per run.
 */
@Entity
@Table(name = "cost_records", indexes = {
    @Index(name = "idx_cost_record_user_time", columnList = "userId, recordedAt"),
    @Index(name = "idx_cost_record_dimension", columnList = "provider, service, project")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
public class CostRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 64)
    private String userId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private CloudProvider provider;

    /**
     * Provider service name, e.g. EC2, Blob Storage, BigQuery.
     */
    @Column(nullable = false, length = 128)
    private String service;

    /**
     * Value of the {@code project} tag. Null for untagged spend.
     */
    @Column(length = 128)
    private String project;

    /**
     * Cost in USD for the billing interval ending at {@link #recordedAt}.
     */
    @Column(nullable = false, precision = 14, scale = 4)
    private BigDecimal amount;

    @Column(nullable = false)
    private Instant recordedAt;

    @Column(nullable = false)
    private LocalDateTime ingestedAt;

    @Column(length = 64)
    private String dataSource;

    @PrePersist
    protected void onCreate() {
        if (ingestedAt == null) {
            ingestedAt = LocalDateTime.now(ZoneOffset.UTC);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CostRecord that = (CostRecord) o;
        return Objects.equals(userId, that.userId) &&
               provider == that.provider &&
               Objects.equals(service, that.service) &&
               Objects.equals(project, that.project) &&
               Objects.equals(recordedAt, that.recordedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(userId, provider, service, project, recordedAt);
    }
}
