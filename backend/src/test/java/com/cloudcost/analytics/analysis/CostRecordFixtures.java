package com.cloudcost.analytics.analysis;

import com.cloudcost.analytics.domain.model.CloudProvider;
import com.cloudcost.analytics.domain.model.CostRecord;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/**
 * Builders for cost records used across the analytics tests.
 */
public final class CostRecordFixtures {

    /**
     * A Monday.
     */
    public static final Instant START = Instant.parse("2024-01-01T00:00:00Z");

    private CostRecordFixtures() {
    }

    public static CostRecord record(CloudProvider provider, String service, String project,
                                    double amount, Instant at) {
        return CostRecord.builder()
                .userId("user-1")
                .provider(provider)
                .service(service)
                .project(project)
                .amount(BigDecimal.valueOf(amount))
                .recordedAt(at)
                .build();
    }

    /**
     * One record per day starting at {@link #START} for AWS EC2 in project "checkout".
     */
    public static List<CostRecord> dailySeries(double... amounts) {
        return dailySeries(CloudProvider.AWS, "EC2", "checkout", amounts);
    }

    public static List<CostRecord> dailySeries(CloudProvider provider, String service, String project,
                                               double... amounts) {
        List<CostRecord> records = new ArrayList<>();
        for (int i = 0; i < amounts.length; i++) {
            records.add(record(provider, service, project, amounts[i], START.plus(i, ChronoUnit.DAYS)));
        }
        return records;
    }

    public static CostSeries series(double... amounts) {
        List<CostRecord> records = dailySeries(amounts);
        return new CostSeries(DimensionKey.of(records.get(0)), records);
    }
}
