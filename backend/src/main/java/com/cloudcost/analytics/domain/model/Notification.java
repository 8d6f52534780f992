package com.cloudcost.analytics.domain.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * In-app inbox entry created by the in-app alert channel.
 */
@Entity
@Table(name = "notifications", indexes = {
    @Index(name = "idx_notification_user_status", columnList = "userId, status")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Notification {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 64)
    private String userId;

    @Column(length = 36)
    private String alertId;

    @Column(nullable = false, length = 256)
    private String title;

    @Column(nullable = false, length = 2048)
    private String message;

    @Enumerated(EnumType.STRING)
    @Column(length = 16)
    private AlertType type;

    @Enumerated(EnumType.STRING)
    @Column(length = 16)
    private AnomalySeverity severity;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "notification_metadata", joinColumns = @JoinColumn(name = "notification_id"))
    @MapKeyColumn(name = "meta_key", length = 64)
    @Column(name = "meta_value", length = 512)
    @Builder.Default
    private Map<String, String> metadata = new LinkedHashMap<>();

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private NotificationStatus status;

    @Column(nullable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now(ZoneOffset.UTC);
        }
        if (status == null) {
            status = NotificationStatus.UNREAD;
        }
    }
}
