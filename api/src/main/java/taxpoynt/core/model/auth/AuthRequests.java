package taxpoynt.core.model.auth;

import java.util.Set;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Payload shapes of the dispatched authentication operations.
 *
 * <p>Field names follow the snake_case wire names; unknown fields are ignored.
 */
public final class AuthRequests {

    private AuthRequests() {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Authenticate(
            @JsonProperty("username") String username,
            @JsonProperty("password") String password,
            @JsonProperty("session_type") String sessionType,
            @JsonProperty("ip_address") String ipAddress,
            @JsonProperty("user_agent") String userAgent,
            @JsonProperty("mfa_token") String mfaToken,
            @JsonProperty("device_id") String deviceId,
            @JsonProperty("device_type") String deviceType,
            @JsonProperty("security_policy") String securityPolicy) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Authorize(
            @JsonProperty("token") String token,
            @JsonProperty("action") String action,
            @JsonProperty("resource_type") String resourceType,
            @JsonProperty("resource_id") String resourceId,
            @JsonProperty("required_roles") Set<String> requiredRoles,
            @JsonProperty("required_permissions") Set<String> requiredPermissions,
            @JsonProperty("ip_address") String ipAddress,
            @JsonProperty("user_agent") String userAgent) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Logout(
            @JsonProperty("token") String token,
            @JsonProperty("session_id") String sessionId,
            @JsonProperty("logout_all_sessions") Boolean logoutAllSessions) {

        public boolean allSessions() {
            return Boolean.TRUE.equals(logoutAllSessions);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Refresh(@JsonProperty("refresh_token") String refreshToken) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record AssignRole(
            @JsonProperty("user_id") String userId,
            @JsonProperty("role_id") String roleId,
            @JsonProperty("scope") String scope,
            @JsonProperty("assigned_by") String assignedBy,
            @JsonProperty("tenant_id") String tenantId,
            @JsonProperty("expires_at") String expiresAt) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ValidateToken(
            @JsonProperty("token") String token,
            @JsonProperty("token_type") String tokenType,
            @JsonProperty("required_roles") Set<String> requiredRoles,
            @JsonProperty("required_permissions") Set<String> requiredPermissions) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record RevokeToken(
            @JsonProperty("token") String token,
            @JsonProperty("revoked_by") String revokedBy,
            @JsonProperty("reason") String reason) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record VerifyMfa(
            @JsonProperty("session_id") String sessionId,
            @JsonProperty("mfa_token") String mfaToken) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record UserSessions(
            @JsonProperty("user_id") String userId,
            @JsonProperty("active_only") Boolean activeOnly) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record CheckPermission(
            @JsonProperty("user_id") String userId,
            @JsonProperty("roles") Set<String> roles,
            @JsonProperty("tenant_id") String tenantId,
            @JsonProperty("permission_id") String permissionId,
            @JsonProperty("action") String action,
            @JsonProperty("resource_type") String resourceType,
            @JsonProperty("resource_id") String resourceId,
            @JsonProperty("ip_address") String ipAddress) {}
}
