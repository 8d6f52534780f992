package com.cloudcost.analytics.alerting;

import com.cloudcost.analytics.domain.model.AlertSettings;
import com.cloudcost.analytics.domain.model.AnomalySeverity;
import com.cloudcost.analytics.domain.model.NotificationChannel;
import com.cloudcost.analytics.domain.repository.AlertSettingsRepository;
import com.cloudcost.analytics.error.PersistenceException;
import com.cloudcost.analytics.store.SettingsStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Reads and writes per-user alert settings.
 *
 * Users without stored settings get {@link AlertConfig#defaults(String)}; columns left
 * null in a stored row fall back to the same defaults.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AlertSettingsService implements SettingsStore {

    static final String CACHE_NAME = "alert-settings";

    private final AlertSettingsRepository alertSettingsRepository;

    @Override
    @Cacheable(value = CACHE_NAME, key = "#userId")
    @Transactional(readOnly = true)
    public AlertConfig getAlertConfig(String userId) {
        return alertSettingsRepository.findByUserId(userId)
                .map(this::toConfig)
                .orElseGet(() -> {
                    log.debug("No alert settings stored for user {}, using defaults", userId);
                    return AlertConfig.defaults(userId);
                });
    }

    @CacheEvict(value = CACHE_NAME, key = "#userId")
    @Transactional
    public AlertConfig saveAlertConfig(String userId, AlertConfig config) {
        AlertSettings settings = alertSettingsRepository.findByUserId(userId)
                .orElseGet(() -> AlertSettings.builder().userId(userId).build());

        settings.setEmailEnabled(config.isEnabled(NotificationChannel.EMAIL));
        settings.setChatEnabled(config.isEnabled(NotificationChannel.CHAT));
        settings.setInAppEnabled(config.isEnabled(NotificationChannel.IN_APP));
        settings.setEmailAddress(config.emailAddress());
        settings.setChatChannel(config.chatChannel());
        settings.setCriticalThreshold(config.thresholds().get(AnomalySeverity.CRITICAL));
        settings.setHighThreshold(config.thresholds().get(AnomalySeverity.HIGH));
        settings.setMediumThreshold(config.thresholds().get(AnomalySeverity.MEDIUM));
        settings.setLowThreshold(config.thresholds().get(AnomalySeverity.LOW));
        settings.setNotifyOnCritical(config.notifyOnSeverity().get(AnomalySeverity.CRITICAL));
        settings.setNotifyOnHigh(config.notifyOnSeverity().get(AnomalySeverity.HIGH));
        settings.setNotifyOnMedium(config.notifyOnSeverity().get(AnomalySeverity.MEDIUM));
        settings.setNotifyOnLow(config.notifyOnSeverity().get(AnomalySeverity.LOW));

        try {
            AlertSettings saved = alertSettingsRepository.save(settings);
            log.info("Alert settings saved for user {}", userId);
            return toConfig(saved);
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to save alert settings for user " + userId, e);
        }
    }

    AlertConfig toConfig(AlertSettings settings) {
        AlertConfig defaults = AlertConfig.defaults(settings.getUserId());

        Set<NotificationChannel> channels = EnumSet.noneOf(NotificationChannel.class);
        addIf(channels, NotificationChannel.EMAIL, settings.getEmailEnabled(), defaults);
        addIf(channels, NotificationChannel.CHAT, settings.getChatEnabled(), defaults);
        addIf(channels, NotificationChannel.IN_APP, settings.getInAppEnabled(), defaults);

        Map<AnomalySeverity, Double> thresholds = new EnumMap<>(AnomalySeverity.class);
        thresholds.put(AnomalySeverity.CRITICAL, orDefault(settings.getCriticalThreshold(), defaults.threshold(AnomalySeverity.CRITICAL)));
        thresholds.put(AnomalySeverity.HIGH, orDefault(settings.getHighThreshold(), defaults.threshold(AnomalySeverity.HIGH)));
        thresholds.put(AnomalySeverity.MEDIUM, orDefault(settings.getMediumThreshold(), defaults.threshold(AnomalySeverity.MEDIUM)));
        thresholds.put(AnomalySeverity.LOW, orDefault(settings.getLowThreshold(), defaults.threshold(AnomalySeverity.LOW)));

        Map<AnomalySeverity, Boolean> notify = new EnumMap<>(AnomalySeverity.class);
        notify.put(AnomalySeverity.CRITICAL, orDefault(settings.getNotifyOnCritical(), defaults.shouldNotify(AnomalySeverity.CRITICAL)));
        notify.put(AnomalySeverity.HIGH, orDefault(settings.getNotifyOnHigh(), defaults.shouldNotify(AnomalySeverity.HIGH)));
        notify.put(AnomalySeverity.MEDIUM, orDefault(settings.getNotifyOnMedium(), defaults.shouldNotify(AnomalySeverity.MEDIUM)));
        notify.put(AnomalySeverity.LOW, orDefault(settings.getNotifyOnLow(), defaults.shouldNotify(AnomalySeverity.LOW)));

        return new AlertConfig(
                settings.getUserId(),
                channels,
                thresholds,
                notify,
                settings.getEmailAddress(),
                settings.getChatChannel()
        );
    }

    private static void addIf(Set<NotificationChannel> channels, NotificationChannel channel,
                              Boolean enabled, AlertConfig defaults) {
        if (orDefault(enabled, defaults.isEnabled(channel))) {
            channels.add(channel);
        }
    }

    private static <T> T orDefault(T value, T fallback) {
        return value != null ? value : fallback;
    }
}
