package taxpoynt.core.model.token;

import java.time.Duration;
import java.util.Map;
import java.util.Set;

/**
 * Parameters for issuing a token.
 *
 * @param subject user id the token is issued to
 * @param kind token kind
 * @param roles roles to embed
 * @param permissions permissions to embed
 * @param tenantId tenant binding (nullable)
 * @param sessionId session binding (nullable)
 * @param scope scope string (nullable)
 * @param ttlOverride lifetime overriding the per-kind default (nullable)
 * @param customClaims extra claims to embed
 * @param ipAddress originating IP recorded with the token (nullable)
 * @param userAgent originating user agent recorded with the token (nullable)
 * @param deviceId originating device recorded with the token (nullable)
 */
public record IssueTokenRequest(
        String subject,
        TokenKind kind,
        Set<String> roles,
        Set<String> permissions,
        String tenantId,
        String sessionId,
        String scope,
        Duration ttlOverride,
        Map<String, Object> customClaims,
        String ipAddress,
        String userAgent,
        String deviceId) {

    public IssueTokenRequest {
        if (subject == null || subject.isBlank()) {
            throw new IllegalArgumentException("Token subject cannot be null or blank");
        }
        if (kind == null) {
            throw new IllegalArgumentException("Token kind cannot be null");
        }
        if (ttlOverride != null && (ttlOverride.isZero() || ttlOverride.isNegative())) {
            throw new IllegalArgumentException("Token TTL must be positive");
        }
        roles = roles != null ? Set.copyOf(roles) : Set.of();
        permissions = permissions != null ? Set.copyOf(permissions) : Set.of();
        customClaims = customClaims != null ? customClaims : Map.of();
    }

    public static Builder builder(String subject, TokenKind kind) {
        return new Builder(subject, kind);
    }

    public static class Builder {
        private final String subject;
        private final TokenKind kind;
        private Set<String> roles = Set.of();
        private Set<String> permissions = Set.of();
        private String tenantId;
        private String sessionId;
        private String scope;
        private Duration ttlOverride;
        private Map<String, Object> customClaims = Map.of();
        private String ipAddress;
        private String userAgent;
        private String deviceId;

        private Builder(String subject, TokenKind kind) {
            this.subject = subject;
            this.kind = kind;
        }

        public Builder roles(Set<String> roles) {
            this.roles = roles;
            return this;
        }

        public Builder permissions(Set<String> permissions) {
            this.permissions = permissions;
            return this;
        }

        public Builder tenantId(String tenantId) {
            this.tenantId = tenantId;
            return this;
        }

        public Builder sessionId(String sessionId) {
            this.sessionId = sessionId;
            return this;
        }

        public Builder scope(String scope) {
            this.scope = scope;
            return this;
        }

        public Builder ttl(Duration ttlOverride) {
            this.ttlOverride = ttlOverride;
            return this;
        }

        public Builder customClaims(Map<String, Object> customClaims) {
            this.customClaims = customClaims;
            return this;
        }

        public Builder origin(String ipAddress, String userAgent, String deviceId) {
            this.ipAddress = ipAddress;
            this.userAgent = userAgent;
            this.deviceId = deviceId;
            return this;
        }

        public IssueTokenRequest build() {
            return new IssueTokenRequest(
                    subject,
                    kind,
                    roles,
                    permissions,
                    tenantId,
                    sessionId,
                    scope,
                    ttlOverride,
                    customClaims,
                    ipAddress,
                    userAgent,
                    deviceId);
        }
    }
}
