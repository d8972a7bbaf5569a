package com.docuvision.pipeline.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

@Configuration
public class ExecutorConfig {

    /**
     * Bounded pool for downloading and processing the documents of one manifest.
     * When the queue is full the submitting thread runs the task itself.
     */
    @Bean
    public ThreadPoolTaskExecutor manifestTaskExecutor(@Value("${docuvision.manifest.max-workers:4}") int maxWorkers) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(maxWorkers);
        executor.setMaxPoolSize(maxWorkers);
        executor.setQueueCapacity(maxWorkers * 25);
        executor.setThreadNamePrefix("manifest-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        return executor;
    }

    @Bean
    public ThreadPoolTaskExecutor resourceEventExecutor(@Value("${docuvision.events.workers:2}") int workers,
                                                        @Value("${docuvision.events.queue-capacity:100}") int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(workers);
        executor.setMaxPoolSize(workers);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("resource-event-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        return executor;
    }
}
