package com.aim.auth.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Persisted record of a JWT revoked before its natural expiry.
 * Keyed by the token's unique "jti" claim.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "revoked_tokens", indexes = {
        @Index(name = "idx_revoked_tokens_expires", columnList = "expiresAt")
})
public class RevokedToken {

    /** JWT ID claim, unique per token. */
    @Id
    @Column(nullable = false, updatable = false)
    private String tokenId;

    @Column(nullable = false, length = 36)
    private String userId;

    /** The token's own expiry; the row can be purged after this instant. */
    @Column(nullable = false)
    private Instant expiresAt;

    @Column(nullable = false)
    private Instant revokedAt;
}
