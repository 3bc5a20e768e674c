package com.aim.auth.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Enables Spring's @Async support for usage recording and @Scheduled for
 * the hourly purge of expired token revocations.
 *
 * Usage records are written on this pool so a slow or broken store never
 * delays the response. When the queue is full the record is dropped with a
 * warning instead of running on the request thread.
 */
@Slf4j
@EnableAsync
@EnableScheduling
@Configuration
public class AsyncConfig {

    @Bean(name = "usageExecutor")
    public Executor usageExecutor(
            @Value("${aim.usage.executor.core-size:2}") int coreSize,
            @Value("${aim.usage.executor.max-size:4}") int maxSize,
            @Value("${aim.usage.executor.queue-capacity:1000}") int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(coreSize);
        executor.setMaxPoolSize(maxSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("usage-");
        executor.setRejectedExecutionHandler((task, pool) ->
                log.warn("Usage queue full ({} pending); dropping usage record", pool.getQueue().size()));
        executor.initialize();
        return executor;
    }
}
