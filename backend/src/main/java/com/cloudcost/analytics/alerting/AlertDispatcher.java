package com.cloudcost.analytics.alerting;

import com.cloudcost.analytics.domain.model.Alert;
import com.cloudcost.analytics.domain.model.AlertStatus;
import com.cloudcost.analytics.domain.model.NotificationChannel;
import com.cloudcost.analytics.error.ValidationException;
import com.cloudcost.analytics.store.AlertStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Fans an alert out to the user's enabled notification channels.
 *
 * STATE MACHINE:
 * PENDING -> SENT once every enabled channel has been attempted, whatever the individual
 * outcomes. PENDING -> FAILED only when the alert is malformed or the final status cannot
 * be stored; the error is then rethrown. Terminal alerts are rejected untouched.
 *
 * Alerts whose severity the user does not want are a no-op: no channel is contacted and
 * the status stays PENDING.
 *
 * Channel order is unspecified; each channel runs as its own task on the dispatch executor.
 */
@Service
@Slf4j
public class AlertDispatcher {

    private final Map<NotificationChannel, ChannelSender> channelSenders;
    private final AlertStore alertStore;
    private final Executor dispatchExecutor;

    @Value("${analytics.alerting.slack.default-channel:#cloud-monitoring}")
    private String defaultChatChannel = "#cloud-monitoring";

    public AlertDispatcher(Map<NotificationChannel, ChannelSender> channelSenders,
                           AlertStore alertStore,
                           @Qualifier("alertDispatchExecutor") Executor dispatchExecutor) {
        this.channelSenders = channelSenders;
        this.alertStore = alertStore;
        this.dispatchExecutor = dispatchExecutor;
    }

    public DispatchReport dispatch(Alert alert, AlertConfig config) {
        validate(alert, config);

        if (!config.shouldNotify(alert.getSeverity())) {
            log.debug("Alert {} suppressed: user {} does not notify on {}",
                    alert.getId(), alert.getUserId(), alert.getSeverity());
            return DispatchReport.suppressed(alert.getId());
        }

        AlertMessage message = AlertMessage.from(alert);
        List<CompletableFuture<ChannelDeliveryResult>> deliveries = new ArrayList<>();
        for (NotificationChannel channel : NotificationChannel.values()) {
            if (config.isEnabled(channel)) {
                String target = resolveTarget(channel, alert, config);
                deliveries.add(submit(channel, target, message));
            }
        }

        CompletableFuture.allOf(deliveries.toArray(new CompletableFuture[0])).join();
        List<ChannelDeliveryResult> results = deliveries.stream()
                .map(CompletableFuture::join)
                .toList();

        try {
            alertStore.updateAlertStatus(alert.getId(), AlertStatus.SENT, null);
        } catch (RuntimeException e) {
            markFailed(alert, e);
            throw e;
        }
        alert.setStatus(AlertStatus.SENT);

        DispatchReport report = DispatchReport.sent(alert.getId(), results);
        log.info("Alert {} sent over {} channel(s), {} failed",
                alert.getId(), results.size(), report.failures().size());
        return report;
    }

    private void validate(Alert alert, AlertConfig config) {
        if (alert == null || alert.getId() == null || alert.getId().isBlank()) {
            throw new ValidationException("Alert with an id is required");
        }
        if (alert.getStatus() != null && alert.getStatus().isTerminal()) {
            throw new ValidationException(
                    "Alert " + alert.getId() + " is already " + alert.getStatus() + " and cannot be dispatched again");
        }

        String problem = null;
        if (config == null) {
            problem = "no alert configuration";
        } else if (alert.getUserId() == null || alert.getUserId().isBlank()) {
            problem = "missing user";
        } else if (alert.getSeverity() == null) {
            problem = "missing severity";
        } else if (alert.getTitle() == null || alert.getTitle().isBlank()) {
            problem = "missing title";
        } else if (alert.getMessage() == null) {
            problem = "missing message";
        }

        if (problem != null) {
            ValidationException error = new ValidationException("Alert " + alert.getId() + " is malformed: " + problem);
            markFailed(alert, error);
            throw error;
        }
    }

    private CompletableFuture<ChannelDeliveryResult> submit(NotificationChannel channel, String target,
                                                            AlertMessage message) {
        try {
            return CompletableFuture.supplyAsync(() -> deliver(channel, target, message), dispatchExecutor);
        } catch (RuntimeException e) {
            // executor saturated or shut down: the channel counts as attempted and failed
            log.warn("Channel {} failed to deliver alert {}: {}", channel, message.alertId(), e.getMessage());
            return CompletableFuture.completedFuture(ChannelDeliveryResult.failure(channel, e.getMessage()));
        }
    }

    private ChannelDeliveryResult deliver(NotificationChannel channel, String target, AlertMessage message) {
        ChannelSender sender = channelSenders.get(channel);
        try {
            if (sender == null) {
                throw new IllegalStateException("No sender registered for channel " + channel);
            }
            sender.send(target, message);
            return ChannelDeliveryResult.success(channel);
        } catch (RuntimeException e) {
            log.warn("Channel {} failed to deliver alert {}: {}", channel, message.alertId(), e.getMessage());
            return ChannelDeliveryResult.failure(channel, e.getMessage());
        }
    }

    private String resolveTarget(NotificationChannel channel, Alert alert, AlertConfig config) {
        return switch (channel) {
            case EMAIL -> config.emailAddress() != null ? config.emailAddress() : alert.getUserId();
            case CHAT -> config.chatChannel() != null ? config.chatChannel() : defaultChatChannel;
            case IN_APP -> alert.getUserId();
        };
    }

    private void markFailed(Alert alert, RuntimeException cause) {
        log.error("Dispatch of alert {} failed: {}", alert.getId(), cause.getMessage());
        alert.setStatus(AlertStatus.FAILED);
        alert.setFailureReason(cause.getMessage());
        try {
            alertStore.updateAlertStatus(alert.getId(), AlertStatus.FAILED, cause.getMessage());
        } catch (RuntimeException e) {
            cause.addSuppressed(e);
        }
    }
}
