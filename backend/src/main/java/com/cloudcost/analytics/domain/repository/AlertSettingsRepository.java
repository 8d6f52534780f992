package com.cloudcost.analytics.domain.repository;

import com.cloudcost.analytics.domain.model.AlertSettings;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface AlertSettingsRepository extends JpaRepository<AlertSettings, Long> {

    Optional<AlertSettings> findByUserId(String userId);
}
