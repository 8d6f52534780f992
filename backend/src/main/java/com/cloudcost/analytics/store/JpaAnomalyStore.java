package com.cloudcost.analytics.store;

import com.cloudcost.analytics.domain.model.Anomaly;
import com.cloudcost.analytics.domain.model.AnomalySeverity;
import com.cloudcost.analytics.domain.repository.AnomalyRepository;
import com.cloudcost.analytics.error.PersistenceException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

@Component
@RequiredArgsConstructor
@Slf4j
public class JpaAnomalyStore implements AnomalyStore {

    private final AnomalyRepository anomalyRepository;

    @Override
    @Transactional
    public List<Anomaly> saveAnomalies(String userId, List<Anomaly> anomalies) {
        if (anomalies.isEmpty()) {
            return List.of();
        }
        List<Anomaly> created = new ArrayList<>();
        try {
            Map<String, Anomaly> stored = anomalyRepository.findAllById(
                    anomalies.stream().map(Anomaly::getId).toList()
            ).stream().collect(Collectors.toMap(Anomaly::getId, Function.identity()));

            for (Anomaly anomaly : anomalies) {
                Anomaly previous = stored.get(anomaly.getId());
                if (previous == null) {
                    created.add(anomaly);
                } else {
                    // status belongs to the resolution workflow
                    anomaly.setStatus(previous.getStatus());
                    anomaly.setCreatedAt(previous.getCreatedAt());
                }
            }

            anomalyRepository.saveAll(anomalies);
            anomalyRepository.flush();
        } catch (DataAccessException e) {
            throw new PersistenceException(
                    "Failed to save " + anomalies.size() + " anomalies for user " + userId, e);
        }
        log.info("Saved {} anomalies for user {} ({} new)", anomalies.size(), userId, created.size());
        return created;
    }

    @Override
    @Transactional(readOnly = true)
    public List<Anomaly> findAnomalies(String userId, DimensionFilter filter,
                                       AnomalySeverity severity, TimeWindow window) {
        DimensionFilter f = filter == null ? DimensionFilter.all() : filter;
        return anomalyRepository.search(
                userId, f.provider(), f.service(), severity, window.from(), window.to()
        );
    }
}
