package com.receiptly.backend.config;

import java.util.concurrent.Executor;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Executor for document processing. OCR calls run here, outside request threads and outside
 * any database transaction.
 */
@Configuration
public class AsyncExecutorConfig {

    @Bean(name = "documentProcessingTaskExecutor")
    public Executor documentProcessingTaskExecutor(
            @Value("${receiptly.processing.core-pool-size:2}") int corePoolSize,
            @Value("${receiptly.processing.max-pool-size:4}") int maxPoolSize,
            @Value("${receiptly.processing.queue-capacity:200}") int queueCapacity
    ) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("document-processing-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }
}
