package taxpoynt.adapter.out.storage.memory;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import io.smallrye.mutiny.Uni;

import taxpoynt.core.model.role.AssignmentStatus;
import taxpoynt.core.model.role.Role;
import taxpoynt.core.model.role.RoleAssignment;
import taxpoynt.core.port.out.RoleStore;

/**
 * In-memory implementation of {@link RoleStore}.
 */
public class InMemoryRoleStore implements RoleStore {

    private final Map<String, Role> roles = new ConcurrentHashMap<>();
    private final Map<String, RoleAssignment> assignments = new ConcurrentHashMap<>();
    private final Object lock = new Object();

    @Override
    public Uni<Void> saveRole(Role role) {
        return Uni.createFrom().item(() -> {
            roles.put(role.id(), role);
            return null;
        });
    }

    @Override
    public Uni<Optional<Role>> findRole(String roleId) {
        return Uni.createFrom().item(() -> Optional.ofNullable(roles.get(roleId)));
    }

    @Override
    public Uni<List<Role>> findAllRoles() {
        return Uni.createFrom().item(() -> roles.values().stream()
                .sorted(Comparator.comparing(Role::id))
                .toList());
    }

    @Override
    public Uni<Boolean> saveAssignmentIfAbsent(RoleAssignment assignment) {
        return Uni.createFrom().item(() -> {
            synchronized (lock) {
                final var duplicate = assignments.values().stream()
                        .anyMatch(a -> a.status() == AssignmentStatus.ACTIVE && a.sameGrantAs(assignment));
                if (duplicate) {
                    return false;
                }
                assignments.put(assignment.id(), assignment);
                return true;
            }
        });
    }

    @Override
    public Uni<Void> updateAssignment(RoleAssignment assignment) {
        return Uni.createFrom().item(() -> {
            synchronized (lock) {
                assignments.put(assignment.id(), assignment);
            }
            return null;
        });
    }

    @Override
    public Uni<Optional<RoleAssignment>> findAssignment(String assignmentId) {
        return Uni.createFrom().item(() -> Optional.ofNullable(assignments.get(assignmentId)));
    }

    @Override
    public Uni<List<RoleAssignment>> findAssignmentsByUserId(String userId) {
        return Uni.createFrom().item(() -> assignments.values().stream()
                .filter(a -> a.userId().equals(userId))
                .sorted(Comparator.comparing(RoleAssignment::assignedAt, Comparator.nullsFirst(Comparator.naturalOrder())))
                .toList());
    }
}
