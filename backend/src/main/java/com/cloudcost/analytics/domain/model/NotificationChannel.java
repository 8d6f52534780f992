package com.cloudcost.analytics.domain.model;

/**
 * Notification delivery mechanisms an alert can be fanned out to.
 */
public enum NotificationChannel {
    EMAIL,
    CHAT,
    IN_APP
}
