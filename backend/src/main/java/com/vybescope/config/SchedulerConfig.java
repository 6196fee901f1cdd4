package com.vybescope.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;

/**
 * Scheduler pool (2 threads) for the cycle triggers and @Scheduled jobs (dedup eviction).
 * Triggers only hand work to the cycle executor, so two threads are enough.
 */
@Configuration
@EnableScheduling
public class SchedulerConfig {

    public static final String SCHEDULER_POOL = "scheduler-pool";

    @Bean(name = SCHEDULER_POOL)
    public ThreadPoolTaskScheduler schedulerPool() {
        ThreadPoolTaskScheduler s = new ThreadPoolTaskScheduler();
        s.setPoolSize(2);
        s.setThreadNamePrefix("scheduler-");
        s.initialize();
        return s;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
