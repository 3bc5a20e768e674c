package com.aim.auth.repository;

import com.aim.auth.model.RevokedToken;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;

/**
 * Repository for revoked JWT entries.
 */
@Repository
public interface RevokedTokenRepository extends JpaRepository<RevokedToken, String> {

    /** Check whether a token (by jti) has been revoked. */
    boolean existsByTokenId(String tokenId);

    /** Bulk purge of entries whose token has expired anyway. */
    @Modifying
    @Transactional
    @Query("DELETE FROM RevokedToken r WHERE r.expiresAt < :cutoff")
    int deleteExpiredBefore(@Param("cutoff") Instant cutoff);
}
