package com.ai.codescope.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Bounded worker pool for per-file content scans (grep, find).
 */
@Configuration
public class ScanExecutorConfig {

    @Bean(name = "scanTaskExecutor")
    public ThreadPoolTaskExecutor scanTaskExecutor(CodescopeProperties properties) {
        int workers = Math.max(1, properties.getScan().getWorkers());

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(workers);
        executor.setMaxPoolSize(workers);
        executor.setQueueCapacity(Math.max(1, properties.getScan().getBatchSize()) * 4);
        executor.setThreadNamePrefix("scan-");
        // Saturated pool: the request thread scans the file itself instead of failing
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }
}
