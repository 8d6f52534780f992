package com.cloudcost.analytics.store;

import com.cloudcost.analytics.domain.model.CostRecord;

import java.util.List;

/**
 * Read access to ingested cost records.
 */
public interface BillingStore {

    /**
     * Cost records for a user within the window, oldest first.
     */
    List<CostRecord> fetchCostRecords(String userId, DimensionFilter filter, TimeWindow window);

    /**
     * Users with cost records inside the window.
     */
    List<String> findActiveUsers(TimeWindow window);
}
