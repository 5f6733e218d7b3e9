package com.catalogenricher.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Named thread pools. fetch-executor runs metadata lookups, one task per row, sized to
 * enricher.fetch.max-concurrent so pool size and the fetch semaphore agree.
 */
@Configuration
public class AsyncConfig {

    public static final String FETCH_EXECUTOR = "fetch-executor";

    @Bean(name = FETCH_EXECUTOR)
    public Executor fetchExecutor(@Value("${enricher.fetch.max-concurrent:2}") int maxConcurrent) {
        int size = Math.max(1, maxConcurrent);
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(size);
        e.setMaxPoolSize(size);
        e.setThreadNamePrefix("fetch-");
        e.setWaitForTasksToCompleteOnShutdown(true);
        e.initialize();
        return e;
    }
}
