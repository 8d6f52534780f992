package com.cloudcost.analytics.domain.repository;

import com.cloudcost.analytics.domain.model.CloudProvider;
import com.cloudcost.analytics.domain.model.CostRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public interface CostRecordRepository extends JpaRepository<CostRecord, Long> {

    /**
     * Cost records for a user in a time window, oldest first.
     * Null filter arguments match everything; project {@code default} matches untagged records.
     */
    @Query("SELECT c FROM CostRecord c WHERE c.userId = :userId " +
           "AND (:provider IS NULL OR c.provider = :provider) " +
           "AND (:service IS NULL OR c.service = :service) " +
           "AND (:project IS NULL OR c.project = :project " +
           "     OR (:project = 'default' AND c.project IS NULL)) " +
           "AND c.recordedAt >= :since AND c.recordedAt <= :until " +
           "ORDER BY c.recordedAt ASC")
    List<CostRecord> findForAnalysis(
            @Param("userId") String userId,
            @Param("provider") CloudProvider provider,
            @Param("service") String service,
            @Param("project") String project,
            @Param("since") Instant since,
            @Param("until") Instant until
    );

    /**
     * Users with at least one cost record since the given instant.
     */
    @Query("SELECT DISTINCT c.userId FROM CostRecord c WHERE c.recordedAt >= :since")
    List<String> findActiveUserIds(@Param("since") Instant since);

    boolean existsByUserId(String userId);
}
