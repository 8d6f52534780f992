package com.cloudcost.analytics.store;

import com.cloudcost.analytics.domain.model.Alert;
import com.cloudcost.analytics.domain.model.AlertStatus;

import java.util.List;

public interface AlertStore {

    /**
     * Persist a newly created alert.
     *
     * @throws com.cloudcost.analytics.error.PersistenceException when the write fails
     */
    Alert createAlert(Alert alert);

    /**
     * Record a terminal status, with the error message when the dispatch failed.
     *
     * @throws com.cloudcost.analytics.error.PersistenceException when the write fails
     */
    void updateAlertStatus(String alertId, AlertStatus status, String failureReason);

    List<Alert> findAlerts(String userId, TimeWindow window);
}
