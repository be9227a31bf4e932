package com.ingestmanager.ingestmanager.ingestion;

import com.ingestmanager.ingestmanager.schedule.TriggerEvaluator;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;

/**
 * Enables binding of ingestion configuration properties and wires the runner's shared infrastructure.
 */
@Configuration
@EnableConfigurationProperties(IngestionProperties.class)
public class IngestionConfig {

    @Bean
    public Clock ingestionClock() {
        return Clock.systemUTC();
    }

    @Bean
    public TriggerEvaluator triggerEvaluator(IngestionProperties ingestionProperties) {
        return new TriggerEvaluator(ZoneId.of(ingestionProperties.getZoneId()));
    }

    /**
     * Bounded pool used when due jobs of one iteration are dispatched concurrently.
     */
    @Bean
    public ThreadPoolTaskExecutor ingestionTaskExecutor(IngestionProperties ingestionProperties) {
        int size = Math.max(1, ingestionProperties.getMaxConcurrency());
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(size);
        executor.setMaxPoolSize(size);
        executor.setThreadNamePrefix(IngestionConstants.WORKER_THREAD_PREFIX);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        return executor;
    }

    /**
     * Single-threaded scheduler that drives {@code --poll}. Shutdown interrupts a running iteration.
     */
    @Bean
    public ThreadPoolTaskScheduler ingestionTaskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix(IngestionConstants.SCHEDULER_THREAD_PREFIX);
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.setAwaitTerminationSeconds(30);
        return scheduler;
    }

    @Bean
    public RestTemplate ingestionRestTemplate(RestTemplateBuilder builder, IngestionProperties ingestionProperties) {
        Duration timeout = Duration.ofSeconds(ingestionProperties.getHttpTimeoutSeconds());
        return builder
                .setConnectTimeout(timeout)
                .setReadTimeout(timeout)
                .build();
    }
}
