package taxpoynt.core.model.session;

import java.util.Set;

/**
 * Parameters for opening a session.
 *
 * @param userId user the session belongs to
 * @param kind client channel
 * @param ipAddress client IP (nullable)
 * @param userAgent client user agent (nullable)
 * @param deviceId client device id (nullable)
 * @param deviceType client device type, used when the device is not yet registered
 * @param tenantId tenant (nullable)
 * @param roles role ids
 * @param permissions permission ids
 * @param policyName security policy to apply (nullable for the default)
 */
public record CreateSessionRequest(
        String userId,
        SessionKind kind,
        String ipAddress,
        String userAgent,
        String deviceId,
        DeviceType deviceType,
        String tenantId,
        Set<String> roles,
        Set<String> permissions,
        String policyName) {

    public CreateSessionRequest {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("User ID cannot be null or blank");
        }
        if (kind == null) {
            kind = SessionKind.WEB;
        }
        if (deviceType == null) {
            deviceType = DeviceType.UNKNOWN;
        }
        roles = roles != null ? Set.copyOf(roles) : Set.of();
        permissions = permissions != null ? Set.copyOf(permissions) : Set.of();
    }

    public static CreateSessionRequest of(String userId, SessionKind kind) {
        return new CreateSessionRequest(userId, kind, null, null, null, null, null, null, null, null);
    }

    public CreateSessionRequest withClient(String ipAddress, String userAgent) {
        return new CreateSessionRequest(
                userId, kind, ipAddress, userAgent, deviceId, deviceType, tenantId, roles, permissions, policyName);
    }

    public CreateSessionRequest withDevice(String deviceId, DeviceType deviceType) {
        return new CreateSessionRequest(
                userId, kind, ipAddress, userAgent, deviceId, deviceType, tenantId, roles, permissions, policyName);
    }

    public CreateSessionRequest withIdentity(String tenantId, Set<String> roles, Set<String> permissions) {
        return new CreateSessionRequest(
                userId, kind, ipAddress, userAgent, deviceId, deviceType, tenantId, roles, permissions, policyName);
    }

    public CreateSessionRequest withPolicy(String policyName) {
        return new CreateSessionRequest(
                userId, kind, ipAddress, userAgent, deviceId, deviceType, tenantId, roles, permissions, policyName);
    }
}
