package com.cloudcost.analytics.alerting;

import com.cloudcost.analytics.domain.model.NotificationChannel;

/**
 * Delivery capability for one notification channel.
 */
public interface ChannelSender {

    NotificationChannel channel();

    /**
     * Deliver an alert.
     *
     * @param target channel-specific address: email recipient, chat channel or user id
     * @param message alert content; title and body plus structured metadata
     * @throws com.cloudcost.analytics.error.DeliveryException when the channel rejects or fails
     */
    void send(String target, AlertMessage message);
}
