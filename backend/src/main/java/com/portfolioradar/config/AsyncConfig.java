package com.portfolioradar.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Bounded worker pool for per-asset snapshot backfill. Callers cap in-flight assets further with
 * portfolioradar.snapshot.backfill.parallelism.
 */
@Configuration
public class AsyncConfig {

    public static final String BACKFILL_EXECUTOR = "backfill-executor";

    @Bean(name = BACKFILL_EXECUTOR)
    public Executor backfillExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(4);
        e.setMaxPoolSize(4);
        e.setQueueCapacity(1_000);
        e.setThreadNamePrefix("backfill-");
        e.initialize();
        return e;
    }
}
