package com.lnradar.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Named thread pools. Maintenance work (memo re-sanitization) runs off the request and scheduler threads.
 */
@Configuration
@EnableAsync
public class AsyncConfig {

    public static final String MAINTENANCE_EXECUTOR = "maintenance-executor";

    /** Single thread so two re-sanitization passes never interleave. */
    @Bean(name = MAINTENANCE_EXECUTOR)
    public Executor maintenanceExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(1);
        e.setMaxPoolSize(1);
        e.setThreadNamePrefix("maintenance-");
        e.initialize();
        return e;
    }
}
