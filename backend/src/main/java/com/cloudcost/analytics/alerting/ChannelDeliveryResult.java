package com.cloudcost.analytics.alerting;

import com.cloudcost.analytics.domain.model.NotificationChannel;

/**
 * Outcome of one channel's delivery attempt.
 *
 * @param error failure message, null when delivered
 */
public record ChannelDeliveryResult(
        NotificationChannel channel,
        boolean delivered,
        String error
) {
    public static ChannelDeliveryResult success(NotificationChannel channel) {
        return new ChannelDeliveryResult(channel, true, null);
    }

    public static ChannelDeliveryResult failure(NotificationChannel channel, String error) {
        return new ChannelDeliveryResult(channel, false, error);
    }
}
