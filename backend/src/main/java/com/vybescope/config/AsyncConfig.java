package com.vybescope.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Named thread pools: cycle-executor runs whole ticks, fetch-executor runs per-entity provider calls.
 * The fetch pool size is the bound on concurrent provider requests across both cycles.
 */
@Configuration
public class AsyncConfig {

    public static final String CYCLE_EXECUTOR = "cycle-executor";
    public static final String FETCH_EXECUTOR = "fetch-executor";

    /**
     * One thread per cycle plus headroom. No queue: a trigger that finds no free thread is dropped,
     * which is the same outcome as skipping an overlapping tick.
     */
    @Bean(name = CYCLE_EXECUTOR)
    public ThreadPoolTaskExecutor cycleExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(2);
        e.setMaxPoolSize(4);
        e.setQueueCapacity(0);
        e.setThreadNamePrefix("cycle-");
        e.setWaitForTasksToCompleteOnShutdown(true);
        e.setAwaitTerminationSeconds(30);
        e.initialize();
        return e;
    }

    @Bean(name = FETCH_EXECUTOR)
    public ThreadPoolTaskExecutor fetchExecutor(@Value("${vybescope.alerts.fetch-concurrency:4}") int fetchConcurrency) {
        int size = Math.max(1, fetchConcurrency);
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(size);
        e.setMaxPoolSize(size);
        e.setThreadNamePrefix("fetch-");
        e.initialize();
        return e;
    }
}
