package com.cloudcost.analytics.domain.model;

public enum NotificationStatus {
    UNREAD,
    READ
}
