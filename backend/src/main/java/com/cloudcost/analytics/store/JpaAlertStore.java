package com.cloudcost.analytics.store;

import com.cloudcost.analytics.domain.model.Alert;
import com.cloudcost.analytics.domain.model.AlertStatus;
import com.cloudcost.analytics.domain.repository.AlertRepository;
import com.cloudcost.analytics.error.PersistenceException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;

@Component
@RequiredArgsConstructor
@Slf4j
public class JpaAlertStore implements AlertStore {

    private final AlertRepository alertRepository;

    @Override
    @Transactional
    public Alert createAlert(Alert alert) {
        try {
            return alertRepository.saveAndFlush(alert);
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to create alert " + alert.getId(), e);
        }
    }

    @Override
    @Transactional
    public void updateAlertStatus(String alertId, AlertStatus status, String failureReason) {
        try {
            Alert alert = alertRepository.findById(alertId)
                    .orElseThrow(() -> new PersistenceException("Alert not found: " + alertId));
            alert.setStatus(status);
            alert.setFailureReason(failureReason);
            alert.setStatusUpdatedAt(LocalDateTime.now(ZoneOffset.UTC));
            alertRepository.saveAndFlush(alert);
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to update status of alert " + alertId, e);
        }
        log.debug("Alert {} -> {}", alertId, status);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Alert> findAlerts(String userId, TimeWindow window) {
        return alertRepository.findByUserIdAndCreatedAtBetweenOrderByCreatedAtDesc(
                userId,
                LocalDateTime.ofInstant(window.from(), ZoneOffset.UTC),
                LocalDateTime.ofInstant(window.to(), ZoneOffset.UTC)
        );
    }
}
