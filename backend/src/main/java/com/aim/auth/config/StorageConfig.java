package com.aim.auth.config;

import com.aim.auth.exception.StorageUnavailableException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.support.RetryTemplate;

import java.time.Clock;

/**
 * Storage-boundary infrastructure: the retry policy for idempotent reads
 * and the clock used for every timestamp and token expiry.
 */
@Configuration
public class StorageConfig {

    @Value("${aim.store.retry.max-attempts:3}")
    private int maxAttempts;

    @Value("${aim.store.retry.initial-backoff-ms:50}")
    private long initialBackoffMs;

    @Value("${aim.store.retry.max-backoff-ms:500}")
    private long maxBackoffMs;

    @Bean
    public RetryTemplate storageRetryTemplate() {
        return RetryTemplate.builder()
                .maxAttempts(maxAttempts)
                .exponentialBackoff(initialBackoffMs, 2.0, maxBackoffMs)
                .retryOn(StorageUnavailableException.class)
                .build();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
