package com.cloudcost.analytics.analysis;

import com.cloudcost.analytics.domain.model.CostRecord;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * Partitions a flat list of cost records into per-dimension series.
 *
 * No record is dropped. Series appear in the order their first record appears in the
 * input; records within a series are sorted by timestamp (stable for equal timestamps).
 */
@Component
public class SeriesGrouper {

    public Map<DimensionKey, CostSeries> group(List<CostRecord> records) {
        Map<DimensionKey, List<CostRecord>> buckets = new LinkedHashMap<>();
        for (CostRecord record : records) {
            buckets.computeIfAbsent(DimensionKey.of(record), k -> new ArrayList<>()).add(record);
        }

        Map<DimensionKey, CostSeries> series = new LinkedHashMap<>();
        buckets.forEach((key, bucket) -> {
            bucket.sort(Comparator.comparing(CostRecord::getRecordedAt));
            series.put(key, new CostSeries(key, bucket));
        });
        return series;
    }
}
