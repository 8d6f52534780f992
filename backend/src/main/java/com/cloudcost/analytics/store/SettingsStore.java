package com.cloudcost.analytics.store;

import com.cloudcost.analytics.alerting.AlertConfig;

/**
 * Per-user alert preferences.
 */
public interface SettingsStore {

    /**
     * The user's alert configuration, or {@link AlertConfig#defaults(String)} when none is stored.
     */
    AlertConfig getAlertConfig(String userId);
}
