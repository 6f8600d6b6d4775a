package taxpoynt.core.port.out;

import java.util.List;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import taxpoynt.core.model.role.Role;
import taxpoynt.core.model.role.RoleAssignment;

/**
 * Storage for role definitions and user role assignments.
 */
public interface RoleStore {

    Uni<Void> saveRole(Role role);

    Uni<Optional<Role>> findRole(String roleId);

    Uni<List<Role>> findAllRoles();

    /**
     * Atomically insert an assignment unless the user already holds an ACTIVE
     * assignment for the same role, scope and tenant.
     *
     * @return true if inserted, false if an active duplicate exists
     */
    Uni<Boolean> saveAssignmentIfAbsent(RoleAssignment assignment);

    Uni<Void> updateAssignment(RoleAssignment assignment);

    Uni<Optional<RoleAssignment>> findAssignment(String assignmentId);

    Uni<List<RoleAssignment>> findAssignmentsByUserId(String userId);
}
