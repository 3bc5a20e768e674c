package com.aim.auth.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * One authenticated API call. Append-only: the core never updates or deletes rows.
 */
@Entity
@Table(name = "api_usage", indexes = {
        @Index(name = "idx_api_usage_user", columnList = "userId"),
        @Index(name = "idx_api_usage_recorded_at", columnList = "recorded_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UsageRecord {

    @Id
    @Column(length = 36)
    private String id;

    @Column(nullable = false, length = 36)
    private String userId;

    @Column(nullable = false)
    private String endpoint;

    @Column(name = "recorded_at", nullable = false)
    private Instant timestamp;

    @Column(nullable = false)
    private int statusCode;

    @Column(nullable = false)
    private long durationMs;

    @PrePersist
    public void prePersist() {
        if (id == null)
            id = UUID.randomUUID().toString();
    }
}
