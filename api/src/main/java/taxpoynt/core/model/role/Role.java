package taxpoynt.core.model.role;

import java.time.Instant;
import java.util.Set;

/**
 * A named bundle of permissions.
 *
 * @param id role id, e.g. {@code system_integrator}
 * @param name display name
 * @param description description
 * @param scope where the role may be assigned
 * @param permissions permission ids or patterns granted by the role
 * @param includedRoles roles whose permissions this role also grants
 * @param status role status
 * @param systemRole whether the role is built in
 * @param createdAt creation time
 */
public record Role(
        String id,
        String name,
        String description,
        RoleScope scope,
        Set<String> permissions,
        Set<String> includedRoles,
        RoleStatus status,
        boolean systemRole,
        Instant createdAt) {

    public Role {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Role ID cannot be null or blank");
        }
        if (name == null || name.isBlank()) {
            name = id;
        }
        if (description == null) {
            description = "";
        }
        if (scope == null) {
            scope = RoleScope.GLOBAL;
        }
        permissions = permissions != null ? Set.copyOf(permissions) : Set.of();
        includedRoles = includedRoles != null ? Set.copyOf(includedRoles) : Set.of();
        if (status == null) {
            status = RoleStatus.ACTIVE;
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }

    public static Role create(String id, String name, RoleScope scope, Set<String> permissions) {
        return new Role(id, name, null, scope, permissions, Set.of(), RoleStatus.ACTIVE, false, null);
    }

    public static Role system(String id, String name, RoleScope scope, Set<String> permissions) {
        return new Role(id, name, null, scope, permissions, Set.of(), RoleStatus.ACTIVE, true, null);
    }

    public Role withIncludedRoles(Set<String> includedRoles) {
        return new Role(id, name, description, scope, permissions, includedRoles, status, systemRole, createdAt);
    }

    /**
     * Whether the role may be assigned in {@code requested}.
     */
    public boolean assignableIn(RoleScope requested) {
        return scope == RoleScope.GLOBAL || scope == requested;
    }
}
