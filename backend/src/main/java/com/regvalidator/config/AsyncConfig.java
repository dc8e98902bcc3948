package com.regvalidator.config;

import com.regvalidator.batch.BatchProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Named thread pools. batch-executor runs one transcript validation per task; transcripts share only the
 * read-only catalog, so the pool needs no further coordination.
 */
@Configuration
public class AsyncConfig {

    public static final String BATCH_EXECUTOR = "batch-executor";

    @Bean(name = BATCH_EXECUTOR)
    public ThreadPoolTaskExecutor batchExecutor(BatchProperties properties) {
        int workers = Math.max(1, properties.getWorkerThreads());
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(workers);
        e.setMaxPoolSize(workers);
        e.setThreadNamePrefix("batch-");
        e.setWaitForTasksToCompleteOnShutdown(true);
        e.initialize();
        return e;
    }
}
