package com.cloudcost.analytics.config;

import com.cloudcost.analytics.alerting.ChannelSender;
import com.cloudcost.analytics.domain.model.NotificationChannel;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;

/**
 * Infrastructure beans shared by the analytics and alerting services.
 */
@Configuration
public class AnalyticsConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Map<NotificationChannel, ChannelSender> channelSenders(List<ChannelSender> senders) {
        Map<NotificationChannel, ChannelSender> byChannel = new EnumMap<>(NotificationChannel.class);
        for (ChannelSender sender : senders) {
            ChannelSender previous = byChannel.put(sender.channel(), sender);
            if (previous != null) {
                throw new IllegalStateException("Two senders registered for channel " + sender.channel());
            }
        }
        return byChannel;
    }

    /**
     * Timeouts bound each chat call; a hanging channel only delays its own task.
     */
    @Bean
    public RestTemplate restTemplate(
            RestTemplateBuilder builder,
            @Value("${analytics.alerting.http.connect-timeout-ms:5000}") long connectTimeoutMs,
            @Value("${analytics.alerting.http.read-timeout-ms:10000}") long readTimeoutMs
    ) {
        return builder
                .setConnectTimeout(Duration.ofMillis(connectTimeoutMs))
                .setReadTimeout(Duration.ofMillis(readTimeoutMs))
                .build();
    }

    @Bean(name = "alertDispatchExecutor")
    public Executor alertDispatchExecutor(
            @Value("${analytics.alerting.executor.core-pool-size:3}") int corePoolSize,
            @Value("${analytics.alerting.executor.max-pool-size:12}") int maxPoolSize,
            @Value("${analytics.alerting.executor.queue-capacity:100}") int queueCapacity
    ) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("AlertDispatch-");
        executor.initialize();
        return executor;
    }
}
