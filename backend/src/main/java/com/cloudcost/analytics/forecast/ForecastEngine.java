package com.cloudcost.analytics.forecast;

import com.cloudcost.analytics.analysis.CostSeries;
import com.cloudcost.analytics.analysis.DimensionKey;
import com.cloudcost.analytics.domain.model.CostRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.*;

/**
 * Extrapolates daily cost with a geometric growth rate.
 *
 * ALGORITHM:
 * 1. Sum records into UTC daily totals; fewer than 2 days yields no forecast
 * 2. Growth rate r solves last = first x (1 + r)^(days - 1)
 * 3. Day i of the horizon: last x (1 + r)^i, scaled by the simulation multiplier
 * 4. Confidence band: predicted +/- 1.96 x stddev of the historical daily totals
 *
 * The band has the same width on every horizon day; it does not widen with distance.
 * A series whose first day cost is zero or negative is extrapolated flat (r = 0).
 */
@Service
@Slf4j
public class ForecastEngine {

    static final int MINIMUM_DAYS = 2;
    private static final double Z_95 = 1.96;

    @Value("${analytics.forecast.horizon-days:30}")
    private int horizonDays = 30;

    /**
     * Cost share added per new deployment in a simulation.
     */
    @Value("${analytics.forecast.deployment-impact-coefficient:0.10}")
    private double deploymentImpactCoefficient = 0.10;

    public List<Forecast> forecast(List<CostRecord> records, SimulationInput simulation) {
        SortedMap<LocalDate, Double> daily = dailyTotals(records);
        if (daily.size() < MINIMUM_DAYS) {
            log.debug("Skipping forecast: {} distinct day(s) of history", daily.size());
            return List.of();
        }

        double[] costs = daily.values().stream().mapToDouble(Double::doubleValue).toArray();
        double growthRate = growthRate(costs);
        double lastCost = costs[costs.length - 1];
        double halfWidth = Z_95 * Math.sqrt(variance(costs));
        double multiplier = (simulation == null ? SimulationInput.none() : simulation)
                .multiplier(deploymentImpactCoefficient);

        LocalDate lastDay = daily.lastKey();
        List<Forecast> forecasts = new ArrayList<>(horizonDays);
        for (int i = 1; i <= horizonDays; i++) {
            double predicted = lastCost * Math.pow(1 + growthRate, i) * multiplier;
            forecasts.add(new Forecast(
                    lastDay.plusDays(i),
                    predicted,
                    new Forecast.ConfidenceInterval(predicted - halfWidth, predicted + halfWidth)
            ));
        }
        return forecasts;
    }

    /**
     * Forecast each series independently. Series without enough history are left out.
     */
    public Map<DimensionKey, List<Forecast>> forecastBySeries(Collection<CostSeries> series,
                                                              SimulationInput simulation) {
        Map<DimensionKey, List<Forecast>> result = new LinkedHashMap<>();
        for (CostSeries s : series) {
            List<Forecast> forecasts = forecast(s.records(), simulation);
            if (!forecasts.isEmpty()) {
                result.put(s.key(), forecasts);
            }
        }
        return result;
    }

    public int getHorizonDays() {
        return horizonDays;
    }

    SortedMap<LocalDate, Double> dailyTotals(List<CostRecord> records) {
        SortedMap<LocalDate, Double> daily = new TreeMap<>();
        for (CostRecord record : records) {
            LocalDate day = record.getRecordedAt().atZone(ZoneOffset.UTC).toLocalDate();
            daily.merge(day, record.getAmount().doubleValue(), Double::sum);
        }
        return daily;
    }

    double growthRate(double[] costs) {
        double first = costs[0];
        double last = costs[costs.length - 1];
        if (first <= 0 || last < 0) {
            return 0;
        }
        return Math.pow(last / first, 1.0 / (costs.length - 1)) - 1;
    }

    private static double variance(double[] values) {
        double mean = 0;
        for (double v : values) mean += v;
        mean /= values.length;

        double variance = 0;
        for (double v : values) {
            variance += (v - mean) * (v - mean);
        }
        return variance / values.length;
    }
}
