package com.cloudcost.analytics.error;

import com.cloudcost.analytics.domain.model.NotificationChannel;
import lombok.Getter;

/**
 * A single notification channel failed to deliver. Never fatal to a dispatch.
 */
@Getter
public class DeliveryException extends CostAnalyticsException {

    private final NotificationChannel channel;

    public DeliveryException(NotificationChannel channel, String message) {
        super(message);
        this.channel = channel;
    }

    public DeliveryException(NotificationChannel channel, String message, Throwable cause) {
        super(message, cause);
        this.channel = channel;
    }
}
