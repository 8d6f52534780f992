package com.cloudcost.analytics.store;

import com.cloudcost.analytics.domain.model.Anomaly;
import com.cloudcost.analytics.domain.model.AnomalySeverity;

import java.util.List;

public interface AnomalyStore {

    /**
     * Persist a batch of anomalies atomically: either all are stored or none is.
     * An anomaly that is already stored keeps its status and first detection time;
     * only the measured values are refreshed.
     *
     * @return the anomalies that were not stored before this call
     * @throws com.cloudcost.analytics.error.PersistenceException when the write fails
     */
    List<Anomaly> saveAnomalies(String userId, List<Anomaly> anomalies);

    /**
     * Anomalies for a user in a window, newest first.
     *
     * @param filter provider/service restriction; the project component is ignored
     * @param severity optional severity restriction
     */
    List<Anomaly> findAnomalies(String userId, DimensionFilter filter, AnomalySeverity severity, TimeWindow window);
}
