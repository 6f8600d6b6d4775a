package taxpoynt.core.model.permission;

import java.time.Instant;
import java.util.Map;
import java.util.Set;

/**
 * The subject and target of an authorization check.
 *
 * @param userId caller
 * @param roles caller's roles
 * @param tenantId caller's tenant (nullable)
 * @param resourceId target resource (nullable)
 * @param resourceType target resource type (nullable)
 * @param action requested action (nullable)
 * @param ipAddress caller's IP (nullable)
 * @param requestTime time of the request
 * @param attributes additional attributes for custom conditions
 */
public record PermissionContext(
        String userId,
        Set<String> roles,
        String tenantId,
        String resourceId,
        ResourceType resourceType,
        String action,
        String ipAddress,
        Instant requestTime,
        Map<String, Object> attributes) {

    public PermissionContext {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("User ID cannot be null or blank");
        }
        roles = roles != null ? Set.copyOf(roles) : Set.of();
        attributes = attributes != null ? Map.copyOf(attributes) : Map.of();
        if (requestTime == null) {
            requestTime = Instant.now();
        }
    }

    public static Builder builder(String userId) {
        return new Builder(userId);
    }

    public static class Builder {
        private final String userId;
        private Set<String> roles = Set.of();
        private String tenantId;
        private String resourceId;
        private ResourceType resourceType;
        private String action;
        private String ipAddress;
        private Instant requestTime;
        private Map<String, Object> attributes = Map.of();

        private Builder(String userId) {
            this.userId = userId;
        }

        public Builder roles(Set<String> roles) {
            this.roles = roles;
            return this;
        }

        public Builder tenantId(String tenantId) {
            this.tenantId = tenantId;
            return this;
        }

        public Builder resource(ResourceType resourceType, String resourceId) {
            this.resourceType = resourceType;
            this.resourceId = resourceId;
            return this;
        }

        public Builder action(String action) {
            this.action = action;
            return this;
        }

        public Builder ipAddress(String ipAddress) {
            this.ipAddress = ipAddress;
            return this;
        }

        public Builder requestTime(Instant requestTime) {
            this.requestTime = requestTime;
            return this;
        }

        public Builder attributes(Map<String, Object> attributes) {
            this.attributes = attributes;
            return this;
        }

        public PermissionContext build() {
            return new PermissionContext(
                    userId, roles, tenantId, resourceId, resourceType, action, ipAddress, requestTime, attributes);
        }
    }
}
