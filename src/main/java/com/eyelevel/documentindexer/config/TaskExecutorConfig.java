package com.eyelevel.documentindexer.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Thread pool that runs indexing jobs submitted asynchronously. Each job occupies one thread for
 * its whole pipeline; the pool size bounds how many files are indexed concurrently.
 */
@Configuration
public class TaskExecutorConfig {

    @Bean("applicationTaskExecutor")
    public AsyncTaskExecutor applicationTaskExecutor(
            @Value("${app.indexing.executor.core-pool-size:4}") int corePoolSize,
            @Value("${app.indexing.executor.max-pool-size:8}") int maxPoolSize,
            @Value("${app.indexing.executor.queue-capacity:100}") int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("indexing-job-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }
}
