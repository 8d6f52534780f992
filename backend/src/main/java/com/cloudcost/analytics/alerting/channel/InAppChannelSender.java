package com.cloudcost.analytics.alerting.channel;

import com.cloudcost.analytics.alerting.AlertMessage;
import com.cloudcost.analytics.alerting.ChannelSender;
import com.cloudcost.analytics.domain.model.Notification;
import com.cloudcost.analytics.domain.model.NotificationChannel;
import com.cloudcost.analytics.domain.model.NotificationStatus;
import com.cloudcost.analytics.domain.repository.NotificationRepository;
import com.cloudcost.analytics.error.DeliveryException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;

/**
 * Stores alerts in the user's in-app notification inbox.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class InAppChannelSender implements ChannelSender {

    private final NotificationRepository notificationRepository;

    @Override
    public NotificationChannel channel() {
        return NotificationChannel.IN_APP;
    }

    @Override
    public void send(String target, AlertMessage message) {
        Notification notification = Notification.builder()
                .userId(target)
                .alertId(message.alertId())
                .title(message.title())
                .message(message.body())
                .type(message.type())
                .severity(message.severity())
                .metadata(new LinkedHashMap<>(message.metadata()))
                .status(NotificationStatus.UNREAD)
                .build();

        try {
            notificationRepository.save(notification);
        } catch (DataAccessException e) {
            throw new DeliveryException(channel(), "Failed to create in-app notification for " + target, e);
        }
        log.info("In-app notification created for user {}", target);
    }
}
