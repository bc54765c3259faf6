package com.lnradar.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.cache.CacheManager;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;
import java.util.concurrent.Executor;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(classes = {
        CaffeineConfig.class,
        AsyncConfig.class,
        SchedulerConfig.class,
        ClockConfig.class
})
class CacheAndExecutorConfigTest {

    @Autowired
    CacheManager cacheManager;

    @Autowired
    @Qualifier(AsyncConfig.MAINTENANCE_EXECUTOR)
    Executor maintenanceExecutor;

    @Autowired
    @Qualifier(SchedulerConfig.SCHEDULER_POOL)
    ThreadPoolTaskScheduler schedulerPool;

    @Autowired
    Clock clock;

    @Test
    @DisplayName("pay-link cache is created and usable")
    void cacheCreatedAndUsed() {
        assertThat(cacheManager.getCache(CaffeineConfig.PAY_LINK_CACHE)).isNotNull();

        cacheManager.getCache(CaffeineConfig.PAY_LINK_CACHE).put("key1", "value1");
        assertThat(cacheManager.getCache(CaffeineConfig.PAY_LINK_CACHE).get("key1").get()).isEqualTo("value1");
    }

    @Test
    @DisplayName("maintenance executor is single-threaded")
    void executorCreated() {
        assertThat(maintenanceExecutor).isInstanceOf(ThreadPoolTaskExecutor.class);
        ThreadPoolTaskExecutor e = (ThreadPoolTaskExecutor) maintenanceExecutor;
        assertThat(e.getCorePoolSize()).isEqualTo(1);
        assertThat(e.getMaxPoolSize()).isEqualTo(1);
        assertThat(e.getThreadNamePrefix()).isEqualTo("maintenance-");
    }

    @Test
    @DisplayName("scheduler pool has one thread per scheduled job")
    void schedulerPoolCreated() {
        assertThat(schedulerPool.getThreadNamePrefix()).isEqualTo("lnradar-scheduler-");
        assertThat(schedulerPool.getScheduledThreadPoolExecutor().getCorePoolSize()).isEqualTo(2);
    }

    @Test
    @DisplayName("clock is UTC")
    void clockIsUtc() {
        assertThat(clock.getZone().getId()).isEqualTo("Z");
    }
}
