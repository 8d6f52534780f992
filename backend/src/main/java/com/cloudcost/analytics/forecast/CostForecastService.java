package com.cloudcost.analytics.forecast;

import com.cloudcost.analytics.analysis.SeriesGrouper;
import com.cloudcost.analytics.domain.model.CostRecord;
import com.cloudcost.analytics.store.BillingStore;
import com.cloudcost.analytics.store.DimensionFilter;
import com.cloudcost.analytics.store.TimeWindow;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Produces forecasts for a user from the stored billing history.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CostForecastService {

    private final BillingStore billingStore;
    private final SeriesGrouper seriesGrouper;
    private final ForecastEngine forecastEngine;
    private final Clock clock;

    /**
     * @param timeframe history range: {@code 7d}, {@code 30d} or {@code 90d}
     */
    public CostForecastReport forecast(String userId, DimensionFilter filter,
                                       String timeframe, SimulationInput simulation) {
        SimulationInput sim = simulation == null ? SimulationInput.none() : simulation;
        TimeWindow window = TimeWindow.fromRange(timeframe, clock);

        List<CostRecord> records = billingStore.fetchCostRecords(userId, filter, window);
        log.info("Forecasting {} days for user {} from {} cost records",
                forecastEngine.getHorizonDays(), userId, records.size());

        List<Forecast> total = forecastEngine.forecast(records, sim);

        Map<String, List<Forecast>> byDimension = new LinkedHashMap<>();
        forecastEngine.forecastBySeries(seriesGrouper.group(records).values(), sim)
                .forEach((key, forecasts) -> byDimension.put(key.toString(), forecasts));

        return new CostForecastReport(userId, total, byDimension, sim);
    }
}
