package taxpoynt.core.model.session;

import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.Set;

/**
 * An authenticated device, browser or API connection for a user.
 *
 * <p>{@code expiresAt} always equals
 * {@code min(lastActivityAt + idleTimeout, createdAt + absoluteTimeout)}; every
 * copy method that moves {@code lastActivityAt} recomputes it.
 *
 * @param id session id
 * @param userId owning user
 * @param kind client channel
 * @param status lifecycle state
 * @param createdAt creation time
 * @param lastActivityAt last recorded activity
 * @param expiresAt effective expiry
 * @param idleTimeout maximum inactivity
 * @param absoluteTimeout maximum lifetime
 * @param ipAddress current client IP (nullable)
 * @param userAgent current client user agent (nullable)
 * @param deviceId associated device (nullable)
 * @param tenantId tenant (nullable)
 * @param roles role ids
 * @param permissions permission ids
 * @param mfaVerified whether MFA has been completed
 * @param riskScore risk score in [0, 1]
 * @param flags status flags such as {@code mfa_required} or {@code high_risk}
 * @param securityLevel level of the applied security policy
 * @param policyName name of the applied security policy
 * @param terminationReason reason for termination (nullable)
 * @param terminatedBy actor that terminated the session (nullable)
 */
public record Session(
        String id,
        String userId,
        SessionKind kind,
        SessionStatus status,
        Instant createdAt,
        Instant lastActivityAt,
        Instant expiresAt,
        Duration idleTimeout,
        Duration absoluteTimeout,
        String ipAddress,
        String userAgent,
        String deviceId,
        String tenantId,
        Set<String> roles,
        Set<String> permissions,
        boolean mfaVerified,
        double riskScore,
        Set<String> flags,
        SecurityLevel securityLevel,
        String policyName,
        String terminationReason,
        String terminatedBy) {

    public static final String FLAG_MFA_REQUIRED = "mfa_required";
    public static final String FLAG_HIGH_RISK = "high_risk";
    public static final String FLAG_DEVICE_VERIFICATION_REQUIRED = "device_verification_required";

    public Session {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Session ID cannot be null or blank");
        }
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("Session user ID cannot be null or blank");
        }
        if (createdAt == null || idleTimeout == null || absoluteTimeout == null) {
            throw new IllegalArgumentException("Session timing fields cannot be null");
        }
        if (lastActivityAt == null) {
            lastActivityAt = createdAt;
        }
        if (expiresAt == null) {
            expiresAt = expiryFor(createdAt, lastActivityAt, idleTimeout, absoluteTimeout);
        }
        if (kind == null) {
            kind = SessionKind.WEB;
        }
        if (status == null) {
            status = SessionStatus.ACTIVE;
        }
        if (securityLevel == null) {
            securityLevel = SecurityLevel.MEDIUM;
        }
        roles = roles != null ? Set.copyOf(roles) : Set.of();
        permissions = permissions != null ? Set.copyOf(permissions) : Set.of();
        flags = flags != null ? Set.copyOf(flags) : Set.of();
        riskScore = clamp(riskScore);
    }

    /**
     * Effective expiry for the given timing values.
     */
    public static Instant expiryFor(
            Instant createdAt, Instant lastActivityAt, Duration idleTimeout, Duration absoluteTimeout) {
        final var idleExpiry = lastActivityAt.plus(idleTimeout);
        final var absoluteExpiry = createdAt.plus(absoluteTimeout);
        return idleExpiry.isBefore(absoluteExpiry) ? idleExpiry : absoluteExpiry;
    }

    private static double clamp(double score) {
        if (Double.isNaN(score) || score < 0.0) {
            return 0.0;
        }
        return Math.min(1.0, score);
    }

    public boolean isActive() {
        return status == SessionStatus.ACTIVE;
    }

    /**
     * A session is valid iff it is active and {@code now} is before its expiry.
     */
    public boolean isValidAt(Instant now) {
        return status == SessionStatus.ACTIVE && now.isBefore(expiresAt);
    }

    public boolean hasFlag(String flag) {
        return flags.contains(flag);
    }

    /**
     * Record activity at {@code now} and recompute expiry.
     */
    public Session touchedAt(Instant now) {
        return toBuilder()
                .lastActivityAt(now)
                .expiresAt(expiryFor(createdAt, now, idleTimeout, absoluteTimeout))
                .build();
    }

    public Session withClient(String ipAddress, String userAgent) {
        return toBuilder().ipAddress(ipAddress).userAgent(userAgent).build();
    }

    public Session withRiskScore(double riskScore) {
        return toBuilder().riskScore(riskScore).build();
    }

    public Session withFlag(String flag) {
        final var updated = new HashSet<>(flags);
        updated.add(flag);
        return toBuilder().flags(updated).build();
    }

    public Session withoutFlag(String flag) {
        final var updated = new HashSet<>(flags);
        updated.remove(flag);
        return toBuilder().flags(updated).build();
    }

    public Session withMfaVerified() {
        return toBuilder().mfaVerified(true).build();
    }

    /**
     * Transition ACTIVE -> TERMINATED.
     *
     * @throws IllegalStateException if the session is not active
     */
    public Session terminate(String reason, String by) {
        if (status != SessionStatus.ACTIVE) {
            throw new IllegalStateException("Cannot terminate session in status " + status);
        }
        return toBuilder()
                .status(SessionStatus.TERMINATED)
                .terminationReason(reason)
                .terminatedBy(by)
                .build();
    }

    public Builder toBuilder() {
        return new Builder(id, userId)
                .kind(kind)
                .status(status)
                .createdAt(createdAt)
                .lastActivityAt(lastActivityAt)
                .expiresAt(expiresAt)
                .idleTimeout(idleTimeout)
                .absoluteTimeout(absoluteTimeout)
                .ipAddress(ipAddress)
                .userAgent(userAgent)
                .deviceId(deviceId)
                .tenantId(tenantId)
                .roles(roles)
                .permissions(permissions)
                .mfaVerified(mfaVerified)
                .riskScore(riskScore)
                .flags(flags)
                .securityLevel(securityLevel)
                .policyName(policyName)
                .terminationReason(terminationReason)
                .terminatedBy(terminatedBy);
    }

    public static Builder builder(String id, String userId) {
        return new Builder(id, userId);
    }

    public static class Builder {
        private final String id;
        private final String userId;
        private SessionKind kind;
        private SessionStatus status;
        private Instant createdAt;
        private Instant lastActivityAt;
        private Instant expiresAt;
        private Duration idleTimeout;
        private Duration absoluteTimeout;
        private String ipAddress;
        private String userAgent;
        private String deviceId;
        private String tenantId;
        private Set<String> roles = Set.of();
        private Set<String> permissions = Set.of();
        private boolean mfaVerified;
        private double riskScore;
        private Set<String> flags = Set.of();
        private SecurityLevel securityLevel;
        private String policyName;
        private String terminationReason;
        private String terminatedBy;

        private Builder(String id, String userId) {
            this.id = id;
            this.userId = userId;
        }

        public Builder kind(SessionKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder status(SessionStatus status) {
            this.status = status;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder lastActivityAt(Instant lastActivityAt) {
            this.lastActivityAt = lastActivityAt;
            return this;
        }

        public Builder expiresAt(Instant expiresAt) {
            this.expiresAt = expiresAt;
            return this;
        }

        public Builder idleTimeout(Duration idleTimeout) {
            this.idleTimeout = idleTimeout;
            return this;
        }

        public Builder absoluteTimeout(Duration absoluteTimeout) {
            this.absoluteTimeout = absoluteTimeout;
            return this;
        }

        public Builder ipAddress(String ipAddress) {
            this.ipAddress = ipAddress;
            return this;
        }

        public Builder userAgent(String userAgent) {
            this.userAgent = userAgent;
            return this;
        }

        public Builder deviceId(String deviceId) {
            this.deviceId = deviceId;
            return this;
        }

        public Builder tenantId(String tenantId) {
            this.tenantId = tenantId;
            return this;
        }

        public Builder roles(Set<String> roles) {
            this.roles = roles;
            return this;
        }

        public Builder permissions(Set<String> permissions) {
            this.permissions = permissions;
            return this;
        }

        public Builder mfaVerified(boolean mfaVerified) {
            this.mfaVerified = mfaVerified;
            return this;
        }

        public Builder riskScore(double riskScore) {
            this.riskScore = riskScore;
            return this;
        }

        public Builder flags(Set<String> flags) {
            this.flags = flags;
            return this;
        }

        public Builder securityLevel(SecurityLevel securityLevel) {
            this.securityLevel = securityLevel;
            return this;
        }

        public Builder policyName(String policyName) {
            this.policyName = policyName;
            return this;
        }

        public Builder terminationReason(String terminationReason) {
            this.terminationReason = terminationReason;
            return this;
        }

        public Builder terminatedBy(String terminatedBy) {
            this.terminatedBy = terminatedBy;
            return this;
        }

        public Session build() {
            return new Session(
                    id,
                    userId,
                    kind,
                    status,
                    createdAt,
                    lastActivityAt,
                    expiresAt,
                    idleTimeout,
                    absoluteTimeout,
                    ipAddress,
                    userAgent,
                    deviceId,
                    tenantId,
                    roles,
                    permissions,
                    mfaVerified,
                    riskScore,
                    flags,
                    securityLevel,
                    policyName,
                    terminationReason,
                    terminatedBy);
        }
    }
}
