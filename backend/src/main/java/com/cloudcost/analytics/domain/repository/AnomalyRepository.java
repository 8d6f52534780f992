package com.cloudcost.analytics.domain.repository;

import com.cloudcost.analytics.domain.model.Anomaly;
import com.cloudcost.analytics.domain.model.AnomalySeverity;
import com.cloudcost.analytics.domain.model.CloudProvider;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public interface AnomalyRepository extends JpaRepository<Anomaly, String> {

    /**
     * Anomalies for a user in a time window, newest first. Null filters match everything.
     */
    @Query("SELECT a FROM Anomaly a WHERE a.userId = :userId " +
           "AND (:provider IS NULL OR a.provider = :provider) " +
           "AND (:service IS NULL OR a.service = :service) " +
           "AND (:severity IS NULL OR a.severity = :severity) " +
           "AND a.detectedFor >= :since AND a.detectedFor <= :until " +
           "ORDER BY a.detectedFor DESC")
    List<Anomaly> search(
            @Param("userId") String userId,
            @Param("provider") CloudProvider provider,
            @Param("service") String service,
            @Param("severity") AnomalySeverity severity,
            @Param("since") Instant since,
            @Param("until") Instant until
    );
}
