package com.cloudcost.analytics.store;

import com.cloudcost.analytics.domain.model.CostRecord;
import com.cloudcost.analytics.domain.repository.CostRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
@RequiredArgsConstructor
@Slf4j
public class JpaBillingStore implements BillingStore {

    private final CostRecordRepository costRecordRepository;

    @Override
    public List<CostRecord> fetchCostRecords(String userId, DimensionFilter filter, TimeWindow window) {
        DimensionFilter f = filter == null ? DimensionFilter.all() : filter;
        List<CostRecord> records = costRecordRepository.findForAnalysis(
                userId, f.provider(), f.service(), f.project(), window.from(), window.to()
        );
        log.debug("Fetched {} cost records for user {} ({})", records.size(), userId, f);
        return records;
    }

    @Override
    public List<String> findActiveUsers(TimeWindow window) {
        return costRecordRepository.findActiveUserIds(window.from());
    }
}
