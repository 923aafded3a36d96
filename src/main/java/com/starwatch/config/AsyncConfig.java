package com.starwatch.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.SimpleAsyncTaskExecutor;

@Configuration
public class AsyncConfig {

    // No concurrency limit here, EnrichmentScheduler bounds dispatch.
    @Bean(name = "enrichmentTaskExecutor")
    public AsyncTaskExecutor enrichmentTaskExecutor() {
        SimpleAsyncTaskExecutor executor = new SimpleAsyncTaskExecutor("enrich-");
        executor.setDaemon(true);
        return executor;
    }
}
