package taxpoynt.core.model.token;

import java.time.Instant;

/**
 * Stored bookkeeping for one issued token.
 *
 * <p>Records are immutable; state transitions return a new record and
 * reject transitions out of a terminal state.
 *
 * @param claims the signed claim set
 * @param keyId id of the key that signed the token
 * @param status lifecycle state
 * @param usageCount number of successful validations
 * @param lastUsedAt time of the last successful validation (nullable)
 * @param ipAddress originating IP (nullable)
 * @param userAgent originating user agent (nullable)
 * @param deviceId originating device (nullable)
 * @param closedAt time the token left the ACTIVE state (nullable)
 * @param revokedBy actor that revoked the token (nullable)
 * @param revocationReason revocation reason (nullable)
 */
public record TokenRecord(
        TokenClaims claims,
        String keyId,
        TokenStatus status,
        long usageCount,
        Instant lastUsedAt,
        String ipAddress,
        String userAgent,
        String deviceId,
        Instant closedAt,
        String revokedBy,
        String revocationReason) {

    public TokenRecord {
        if (claims == null) {
            throw new IllegalArgumentException("Token claims cannot be null");
        }
        if (status == null) {
            throw new IllegalArgumentException("Token status cannot be null");
        }
    }

    /**
     * Create the record for a freshly issued token.
     */
    public static TokenRecord issued(
            TokenClaims claims, String keyId, String ipAddress, String userAgent, String deviceId) {
        return new TokenRecord(
                claims, keyId, TokenStatus.ACTIVE, 0, null, ipAddress, userAgent, deviceId, null, null, null);
    }

    public String jti() {
        return claims.jti();
    }

    public String subject() {
        return claims.subject();
    }

    public TokenKind kind() {
        return claims.kind();
    }

    public Instant expiresAt() {
        return claims.expiresAt();
    }

    public boolean isActive() {
        return status == TokenStatus.ACTIVE;
    }

    public boolean isExpiredAt(Instant now) {
        return !now.isBefore(claims.expiresAt());
    }

    /**
     * Record one successful validation.
     */
    public TokenRecord withUsage(Instant usedAt) {
        return new TokenRecord(
                claims,
                keyId,
                status,
                usageCount + 1,
                usedAt,
                ipAddress,
                userAgent,
                deviceId,
                closedAt,
                revokedBy,
                revocationReason);
    }

    /**
     * Transition ACTIVE -> REVOKED.
     *
     * @throws IllegalStateException if the token is not active
     */
    public TokenRecord revoke(String by, String reason, Instant at) {
        if (status != TokenStatus.ACTIVE) {
            throw new IllegalStateException("Cannot revoke token in status " + status);
        }
        return new TokenRecord(
                claims, keyId, TokenStatus.REVOKED, usageCount, lastUsedAt, ipAddress, userAgent, deviceId, at, by,
                reason);
    }

    /**
     * Transition ACTIVE -> EXPIRED.
     *
     * @throws IllegalStateException if the token is not active
     */
    public TokenRecord expire(Instant at) {
        if (status != TokenStatus.ACTIVE) {
            throw new IllegalStateException("Cannot expire token in status " + status);
        }
        return new TokenRecord(
                claims, keyId, TokenStatus.EXPIRED, usageCount, lastUsedAt, ipAddress, userAgent, deviceId, at, null,
                null);
    }
}
