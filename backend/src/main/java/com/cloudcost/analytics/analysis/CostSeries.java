package com.cloudcost.analytics.analysis;

import com.cloudcost.analytics.domain.model.CostRecord;

import java.util.List;

/**
 * Records sharing a dimension key, ordered by timestamp ascending. Never empty.
 */
public record CostSeries(
        DimensionKey key,
        List<CostRecord> records
) {
    public CostSeries {
        if (records == null || records.isEmpty()) {
            throw new IllegalArgumentException("A cost series needs at least one record: " + key);
        }
        records = List.copyOf(records);
    }

    public double[] costs() {
        return records.stream()
                .mapToDouble(r -> r.getAmount().doubleValue())
                .toArray();
    }

    public CostRecord latest() {
        return records.get(records.size() - 1);
    }

    public int size() {
        return records.size();
    }
}
