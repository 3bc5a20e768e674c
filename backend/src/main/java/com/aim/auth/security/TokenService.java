package com.aim.auth.security;

import com.aim.auth.exception.AuthErrorKind;
import com.aim.auth.exception.AuthException;
import com.aim.auth.model.Role;
import com.aim.auth.model.RevokedToken;
import com.aim.auth.model.User;
import com.aim.auth.store.UserStore;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.io.Decoders;
import io.jsonwebtoken.security.Keys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import javax.crypto.SecretKey;
import java.time.Clock;
import java.time.Instant;
import java.util.Date;
import java.util.UUID;

/**
 * TokenService handles all JWT operations:
 * - Issuing access tokens (default 24 h) and refresh tokens (default 30 days)
 * - Verifying tokens with a distinct failure kind per check
 * - Revoking tokens by their jti, and purging revocations once the token expired
 * - Exchanging a refresh token for an access token carrying the user's current role
 *
 * Token lifecycle: issued → valid → expired | revoked. Both end states are final.
 */
@Slf4j
@Service
public class TokenService {

    static final String TOKEN_TYPE_CLAIM = "type";
    static final String USER_ID_CLAIM = "user_id";
    static final String ROLE_CLAIM = "role";

    private final SecretKey signingKey;
    private final JwtParser parser;
    private final long accessTokenExpiration;
    private final long refreshTokenExpiration;
    private final UserStore userStore;
    private final Clock clock;

    public TokenService(
            @Value("${jwt.secret:}") String secretKey,
            @Value("${jwt.access-token.expiration:86400000}") long accessTokenExpiration,
            @Value("${jwt.refresh-token.expiration:2592000000}") long refreshTokenExpiration,
            UserStore userStore,
            Clock clock) {
        this.signingKey = resolveSigningKey(secretKey);
        this.accessTokenExpiration = accessTokenExpiration;
        this.refreshTokenExpiration = refreshTokenExpiration;
        this.userStore = userStore;
        this.clock = clock;
        this.parser = Jwts.parser()
                .verifyWith(signingKey)
                .clock(() -> Date.from(clock.instant()))
                .build();
    }

    // ─────────────────────────────────────────────────────────────────────────
    // Token Generation
    // ─────────────────────────────────────────────────────────────────────────

    public String issueAccessToken(UserPrincipal principal) {
        return buildToken(principal, TokenType.ACCESS, accessTokenExpiration);
    }

    /**
     * Long-lived token, only good for {@link #refresh(String)}.
     */
    public String issueRefreshToken(UserPrincipal principal) {
        return buildToken(principal, TokenType.REFRESH, refreshTokenExpiration);
    }

    private String buildToken(UserPrincipal principal, TokenType type, long expiration) {
        Instant now = clock.instant();
        return Jwts.builder()
                .subject(principal.getUsername())
                .claim(USER_ID_CLAIM, principal.getUserId())
                .claim(ROLE_CLAIM, principal.getRole().getValue())
                .claim(TOKEN_TYPE_CLAIM, type.claimValue())
                .id(UUID.randomUUID().toString()) // unique jti per token
                .issuedAt(Date.from(now))
                .expiration(Date.from(now.plusMillis(expiration)))
                .signWith(signingKey)
                .compact();
    }

    // ─────────────────────────────────────────────────────────────────────────
    // Verification
    // ─────────────────────────────────────────────────────────────────────────

    /**
     * Checks signature and structure, then expiry, then revocation, then type.
     *
     * @throws AuthException with kind TOKEN_MALFORMED, TOKEN_EXPIRED,
     *                       TOKEN_REVOKED or WRONG_TOKEN_TYPE
     */
    public TokenClaims verify(String token, TokenType expectedType) {
        TokenClaims claims = toTokenClaims(parse(token));

        if (userStore.isTokenRevoked(claims.getTokenId())) {
            throw new AuthException(AuthErrorKind.TOKEN_REVOKED, "Token has been revoked");
        }
        if (claims.getType() != expectedType) {
            throw new AuthException(AuthErrorKind.WRONG_TOKEN_TYPE,
                    "Expected " + expectedType.claimValue() + " token but got " + claims.getType().claimValue());
        }
        return claims;
    }

    /**
     * Issues a new access token for the holder of a valid refresh token.
     * The role comes from the store, not from the refresh token, so role
     * changes apply without a new login. The refresh token itself is kept.
     */
    public String refresh(String refreshToken) {
        TokenClaims claims = verify(refreshToken, TokenType.REFRESH);

        User user = userStore.findById(claims.getUserId())
                .orElseThrow(() -> new AuthException(AuthErrorKind.USER_NOT_FOUND,
                        "User no longer exists: " + claims.getUserId()));
        if (!user.isActive()) {
            throw new AuthException(AuthErrorKind.USER_INACTIVE, "User is inactive: " + user.getUsername());
        }

        log.info("Access token refreshed for '{}'", user.getUsername());
        return issueAccessToken(UserPrincipal.of(user));
    }

    // ─────────────────────────────────────────────────────────────────────────
    // Revocation
    // ─────────────────────────────────────────────────────────────────────────

    /**
     * Revokes a token by storing its jti together with its original expiry.
     * Tokens that are already expired or do not verify are not stored.
     */
    public void revoke(String token) {
        revoke(token, null);
    }

    /**
     * Same as {@link #revoke(String)}, but only when the token was issued to
     * {@code ownerId}. Tokens of other users are left alone.
     */
    public void revoke(String token, String ownerId) {
        Claims claims;
        try {
            claims = parse(token);
        } catch (AuthException e) {
            log.info("Skipping revocation of unusable token ({})", e.getKind());
            return;
        }
        String tokenUserId = claims.get(USER_ID_CLAIM, String.class);
        if (ownerId != null && !ownerId.equals(tokenUserId)) {
            log.warn("Refusing to revoke a token of user id={} on behalf of user id={}", tokenUserId, ownerId);
            return;
        }
        RevokedToken entry = RevokedToken.builder()
                .tokenId(claims.getId())
                .userId(tokenUserId)
                .expiresAt(claims.getExpiration().toInstant())
                .revokedAt(clock.instant())
                .build();

        userStore.saveRevokedToken(entry);
        log.info("Token revoked for user '{}' (jti={})", claims.getSubject(), entry.getTokenId());
    }

    /**
     * Scheduled cleanup: a revoked token past its expiry would fail as
     * expired anyway, so its entry can go.
     */
    @Scheduled(fixedRateString = "${jwt.revocation.purge-interval:3600000}",
            initialDelayString = "${jwt.revocation.purge-interval:3600000}")
    public void purgeExpiredRevocations() {
        int removed = userStore.deleteRevokedTokensExpiredBefore(clock.instant());
        log.debug("Purged {} expired revoked tokens", removed);
    }

    public long getAccessTokenExpiration() {
        return accessTokenExpiration;
    }

    public long getRefreshTokenExpiration() {
        return refreshTokenExpiration;
    }

    // ─────────────────────────────────────────────────────────────────────────
    // Claims Extraction
    // ─────────────────────────────────────────────────────────────────────────

    private Claims parse(String token) {
        try {
            return parser.parseSignedClaims(token).getPayload();
        } catch (ExpiredJwtException e) {
            throw new AuthException(AuthErrorKind.TOKEN_EXPIRED, "Token expired", e);
        } catch (JwtException | IllegalArgumentException e) {
            throw new AuthException(AuthErrorKind.TOKEN_MALFORMED, "Token malformed: " + e.getMessage(), e);
        }
    }

    private static TokenClaims toTokenClaims(Claims claims) {
        String userId = claims.get(USER_ID_CLAIM, String.class);
        TokenType type = TokenType.fromClaim(claims.get(TOKEN_TYPE_CLAIM, String.class));
        String roleValue = claims.get(ROLE_CLAIM, String.class);

        if (claims.getId() == null || claims.getSubject() == null || userId == null
                || type == null || roleValue == null || claims.getExpiration() == null) {
            throw new AuthException(AuthErrorKind.TOKEN_MALFORMED, "Token is missing required claims");
        }
        Role role;
        try {
            role = Role.fromValue(roleValue);
        } catch (IllegalArgumentException e) {
            throw new AuthException(AuthErrorKind.TOKEN_MALFORMED, "Token carries an unknown role", e);
        }
        return new TokenClaims(claims.getId(), claims.getSubject(), userId, role, type,
                claims.getExpiration().toInstant());
    }

    private static SecretKey resolveSigningKey(String secretKey) {
        if (secretKey == null || secretKey.isBlank()) {
            log.warn("jwt.secret is not set; using a random signing key. Tokens will not survive a restart.");
            return Jwts.SIG.HS256.key().build();
        }
        return Keys.hmacShaKeyFor(Decoders.BASE64.decode(secretKey));
    }
}
