package com.aim.auth.usage;

import com.aim.auth.exception.StorageUnavailableException;
import com.aim.auth.model.UsageRecord;
import com.aim.auth.store.UserStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;

/**
 * Unit tests for UsageRecorder.
 */
@ExtendWith(MockitoExtension.class)
class UsageRecorderTest {

    private static final Instant NOW = Instant.parse("2026-03-02T10:00:00Z");

    @Mock
    private UserStore userStore;

    private UsageRecorder recorder;

    @BeforeEach
    void setUp() {
        recorder = new UsageRecorder(userStore, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void record_AppendsUsage() {
        recorder.record("user-1", "/auth/profile", 200, 12);

        ArgumentCaptor<UsageRecord> captor = ArgumentCaptor.forClass(UsageRecord.class);
        verify(userStore).appendUsage(captor.capture());
        UsageRecord saved = captor.getValue();
        assertThat(saved.getUserId()).isEqualTo("user-1");
        assertThat(saved.getEndpoint()).isEqualTo("/auth/profile");
        assertThat(saved.getStatusCode()).isEqualTo(200);
        assertThat(saved.getDurationMs()).isEqualTo(12);
        assertThat(saved.getTimestamp()).isEqualTo(NOW);
    }

    @Test
    void record_StoreFailure_IsSwallowed() {
        doThrow(new StorageUnavailableException("append usage", new RuntimeException("down")))
                .when(userStore).appendUsage(any(UsageRecord.class));

        assertThatCode(() -> recorder.record("user-1", "/auth/profile", 200, 12))
                .doesNotThrowAnyException();
    }
}
