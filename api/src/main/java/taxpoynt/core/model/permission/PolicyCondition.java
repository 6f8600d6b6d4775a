package taxpoynt.core.model.permission;

import java.time.LocalTime;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A condition attached to a policy rule or a permission.
 *
 * <p>A condition <em>holds</em> for a context when the situation it describes
 * is present: the user has one of the roles, the tenants differ, the request
 * falls inside the time window, and so on. A policy rule applies only when all
 * of its conditions hold; a permission is granted only when all of its own
 * conditions hold.
 */
public sealed interface PolicyCondition {

    /**
     * Wire name of the condition kind, e.g. {@code role}.
     */
    String type();

    /**
     * Holds when the context carries at least one of {@code roles}.
     */
    record RoleCondition(Set<String> roles) implements PolicyCondition {
        public RoleCondition {
            roles = roles != null ? Set.copyOf(roles) : Set.of();
        }

        @Override
        public String type() {
            return "role";
        }
    }

    /**
     * Holds when the resource belongs to a tenant other than the caller's.
     */
    record TenantMismatchCondition() implements PolicyCondition {
        @Override
        public String type() {
            return "tenant_mismatch";
        }
    }

    /**
     * Holds when the request time (UTC) falls inside {@code [start, end)} and the
     * caller carries none of {@code excludedRoles}. Windows with {@code start}
     * after {@code end} wrap around midnight.
     */
    record TimeRestrictionCondition(LocalTime start, LocalTime end, Set<String> excludedRoles)
            implements PolicyCondition {
        public TimeRestrictionCondition {
            if (start == null || end == null) {
                throw new IllegalArgumentException("Time window bounds cannot be null");
            }
            excludedRoles = excludedRoles != null ? Set.copyOf(excludedRoles) : Set.of();
        }

        @Override
        public String type() {
            return "time_restriction";
        }

        public boolean contains(LocalTime time) {
            if (start.equals(end)) {
                return false;
            }
            if (start.isBefore(end)) {
                return !time.isBefore(start) && time.isBefore(end);
            }
            return !time.isBefore(start) || time.isBefore(end);
        }
    }

    /**
     * Holds when the caller's IP matches one of {@code allowed} (exact or CIDR).
     */
    record IpWhitelistCondition(List<String> allowed) implements PolicyCondition {
        public IpWhitelistCondition {
            allowed = allowed != null ? List.copyOf(allowed) : List.of();
        }

        @Override
        public String type() {
            return "ip_whitelist";
        }
    }

    /**
     * Holds when the caller owns the target resource, or no ACL is registered for it.
     */
    record ResourceOwnerCondition() implements PolicyCondition {
        @Override
        public String type() {
            return "resource_owner";
        }
    }

    /**
     * Delegates to a registered handler by name.
     */
    record CustomCondition(String handler, Map<String, Object> parameters) implements PolicyCondition {
        public CustomCondition {
            if (handler == null || handler.isBlank()) {
                throw new IllegalArgumentException("Custom condition handler name cannot be blank");
            }
            parameters = parameters != null ? Map.copyOf(parameters) : Map.of();
        }

        @Override
        public String type() {
            return "custom";
        }
    }
}
