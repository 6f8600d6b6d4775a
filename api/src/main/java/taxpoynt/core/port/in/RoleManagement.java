package taxpoynt.core.port.in;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import io.smallrye.mutiny.Uni;

import taxpoynt.core.model.role.Role;
import taxpoynt.core.model.role.RoleAssignment;
import taxpoynt.core.model.role.RoleScope;

/**
 * Inbound port for role definitions and user role assignments.
 */
public interface RoleManagement {

    /**
     * Define or replace a role and mirror its permissions into the permission catalog.
     *
     * @throws taxpoynt.core.model.error.ValidationException if an included role is
     *         unknown or including it would create a cycle
     */
    Uni<Role> defineRole(Role role);

    Uni<Optional<Role>> findRole(String roleId);

    /**
     * Grant a role to a user.
     *
     * @param tenantId tenant for tenant-scoped assignments (nullable)
     * @param expiresAt expiry (nullable for permanent)
     * @throws taxpoynt.core.model.error.ValidationException if the role is unknown,
     *         cannot be assigned in {@code scope}, is already actively assigned,
     *         or {@code expiresAt} has passed
     */
    Uni<RoleAssignment> assignRole(
            String userId, String roleId, RoleScope scope, String assignedBy, String tenantId, Instant expiresAt);

    /**
     * @return the revoked assignment, or empty if no active assignment has that id
     */
    Uni<Optional<RoleAssignment>> revokeRole(String assignmentId, String revokedBy);

    /**
     * Role ids the user holds, including roles reached through role inclusion.
     * Tenant-scoped assignments count only when {@code tenantId} matches.
     */
    Uni<Set<String>> userRoles(String userId, String tenantId);

    Uni<List<RoleAssignment>> userAssignments(String userId);
}
