package com.aim.auth.usage;

import com.aim.auth.model.UsageRecord;
import com.aim.auth.store.UserStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.time.Clock;

/**
 * Best-effort usage accounting. Runs on the usage executor so the request
 * never waits on it; a failed append is logged and dropped.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class UsageRecorder {

    private final UserStore userStore;
    private final Clock clock;

    @Async("usageExecutor")
    public void record(String userId, String endpoint, int statusCode, long durationMs) {
        try {
            userStore.appendUsage(UsageRecord.builder()
                    .userId(userId)
                    .endpoint(endpoint)
                    .statusCode(statusCode)
                    .durationMs(durationMs)
                    .timestamp(clock.instant())
                    .build());
        } catch (RuntimeException e) {
            log.warn("Failed to record usage (non-fatal): user={}, endpoint={}: {}",
                    userId, endpoint, e.getMessage());
        }
    }
}
