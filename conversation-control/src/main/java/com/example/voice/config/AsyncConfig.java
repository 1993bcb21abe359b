package com.example.voice.config;

import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class AsyncConfig {

    /**
     * Drains per-subscriber broadcast queues. Rejected drains drop the subscriber instead of
     * running on the publishing thread.
     */
    @Bean(name = "broadcastExecutor")
    public ThreadPoolTaskExecutor broadcastExecutor(
            @Value("${voice.broadcast.pool-size:8}") int poolSize) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(1000);
        executor.setThreadNamePrefix("broadcast-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }

    /**
     * Performs Kafka sends off the request thread. The backlog is bounded and overflow is
     * rejected, so a broker outage sheds events instead of stalling callers.
     */
    @Bean(name = "eventPublishExecutor")
    public ThreadPoolTaskExecutor eventPublishExecutor(
            @Value("${voice.kafka.publish-pool-size:2}") int poolSize,
            @Value("${voice.kafka.publish-backlog:10000}") int backlog) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(backlog);
        executor.setThreadNamePrefix("event-publish-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(5);
        executor.initialize();
        return executor;
    }

    /**
     * Runs synchronous webhook work so the caller can stop waiting once the response budget is spent.
     */
    @Bean(name = "webhookExecutor")
    public ThreadPoolTaskExecutor webhookExecutor(
            @Value("${voice.webhook.pool-size:16}") int poolSize) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize * 2);
        executor.setQueueCapacity(200);
        executor.setThreadNamePrefix("webhook-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        executor.initialize();
        return executor;
    }
}
