package com.cloudcost.analytics.config;

import com.cloudcost.analytics.domain.model.CloudProvider;
import com.cloudcost.analytics.domain.model.CostRecord;
import com.cloudcost.analytics.domain.repository.CostRecordRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Local development configuration.
 *
 * ENABLED WHEN: app.env=local (the default)
 *
 * Seeds the in-memory H2 database with 45 days of cost history for a demo user so
 * detection, forecasting and alerting can be exercised without a billing pipeline.
 * The last day of the EC2 series is a deliberate spike.
 */
@Configuration
@ConditionalOnProperty(name = "app.env", havingValue = "local", matchIfMissing = true)
@Slf4j
public class LocalDevConfig {

    static final String DEMO_USER = "demo-user";
    private static final int HISTORY_DAYS = 45;

    @Bean
    public CommandLineRunner seedDemoCostData(CostRecordRepository costRecordRepository, Clock clock) {
        return args -> {
            if (costRecordRepository.existsByUserId(DEMO_USER)) {
                log.info("LOCAL MODE: demo cost data already present");
                return;
            }

            Random random = new Random(42); // Fixed seed for consistent results
            Instant today = clock.instant().truncatedTo(ChronoUnit.DAYS);
            List<CostRecord> records = new ArrayList<>();

            for (int day = HISTORY_DAYS; day >= 1; day--) {
                Instant at = today.minus(day, ChronoUnit.DAYS);
                boolean lastDay = day == 1;

                records.add(record(CloudProvider.AWS, "EC2", "checkout",
                        lastDay ? 420.0 : 180.0 + random.nextGaussian() * 8, at));
                records.add(record(CloudProvider.AWS, "Data Transfer", null,
                        60.0 + (HISTORY_DAYS - day) * 0.9 + random.nextGaussian() * 3, at));
                records.add(record(CloudProvider.AZURE, "Virtual Machines", "analytics",
                        95.0 + random.nextGaussian() * 4, at));
                records.add(record(CloudProvider.GCP, "BigQuery", "reporting",
                        40.0 + (at.atZone(ZoneOffset.UTC).getDayOfWeek().getValue() == 1 ? 35.0 : 0.0)
                                + random.nextGaussian() * 2, at));
            }

            costRecordRepository.saveAll(records);
            log.info("LOCAL MODE: seeded {} cost records for {}", records.size(), DEMO_USER);
        };
    }

    private static CostRecord record(CloudProvider provider, String service, String project,
                                     double amount, Instant at) {
        return CostRecord.builder()
                .userId(DEMO_USER)
                .provider(provider)
                .service(service)
                .project(project)
                .amount(BigDecimal.valueOf(Math.max(0, amount)).setScale(4, RoundingMode.HALF_UP))
                .recordedAt(at)
                .dataSource("local-seed")
                .build();
    }
}
