package com.reclaimradar.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Pool for the ledger refresh, retention cleanup and scheduled sync jobs. A scheduled sync can hold its thread for
 * the whole report poll, so the pool keeps one thread per job and lets a running sync finish on shutdown.
 */
@Configuration
@EnableScheduling
public class SchedulerConfig {

    public static final String SCHEDULER_POOL = "reclaimSchedulerPool";

    @Bean(name = SCHEDULER_POOL)
    public ThreadPoolTaskScheduler reclaimSchedulerPool(
            @Value("${reclaimradar.scheduler.pool-size:3}") int poolSize,
            @Value("${reclaimradar.scheduler.shutdown-wait-seconds:60}") int shutdownWaitSeconds) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(poolSize);
        scheduler.setThreadNamePrefix("reclaim-job-");
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(shutdownWaitSeconds);
        scheduler.initialize();
        return scheduler;
    }
}
