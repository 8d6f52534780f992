package com.cloudcost.analytics;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Multi-cloud cost analytics service.
 *
 * Turns billing records into expected-cost baselines, anomalies, forecasts and
 * alerts delivered over email, Slack and the in-app inbox.
 */
@SpringBootApplication
@EnableCaching
@EnableScheduling
public class CostAnalyticsApplication {

    public static void main(String[] args) {
        SpringApplication.run(CostAnalyticsApplication.class, args);
    }
}
