package com.lnradar.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Scheduler pool for the poll tick and the digest. One thread each by default, so a slow digest never delays a tick.
 */
@Configuration
@EnableScheduling
@Slf4j
public class SchedulerConfig {

    public static final String SCHEDULER_POOL = "scheduler-pool";

    @Bean(name = SCHEDULER_POOL)
    public ThreadPoolTaskScheduler schedulerPool(@Value("${lnradar.scheduler.pool-size:2}") int poolSize) {
        ThreadPoolTaskScheduler s = new ThreadPoolTaskScheduler();
        s.setPoolSize(poolSize);
        s.setThreadNamePrefix("lnradar-scheduler-");
        s.setErrorHandler(t -> log.error("Scheduled job failed: {}", t.getMessage(), t));
        s.setWaitForTasksToCompleteOnShutdown(true);
        s.initialize();
        return s;
    }
}
