package taxpoynt.core.service.role;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import taxpoynt.core.cache.CaffeineLocalCache;
import taxpoynt.core.cache.LocalCache;
import taxpoynt.core.config.RoleConfig;
import taxpoynt.core.model.error.ValidationException;
import taxpoynt.core.model.role.AssignmentStatus;
import taxpoynt.core.model.role.Role;
import taxpoynt.core.model.role.RoleAssignment;
import taxpoynt.core.model.role.RoleScope;
import taxpoynt.core.model.role.RoleStatus;
import taxpoynt.core.port.in.RoleManagement;
import taxpoynt.core.port.out.RoleStore;
import taxpoynt.core.service.permission.PermissionEngine;
import taxpoynt.core.util.SecureHash;

/**
 * Role definitions, role inclusion and user role assignments.
 *
 * <p>A role's permissions are mirrored into the permission catalog when the
 * role is defined, so permission evaluation only ever consults the catalog.
 * Resolved role sets are cached per user and tenant until the earliest
 * expiry among the assignments they were built from.
 */
@ApplicationScoped
public class RoleManager implements RoleManagement {

    private static final Logger LOG = Logger.getLogger(RoleManager.class);

    private final RoleStore store;
    private final PermissionEngine permissions;
    private final Clock clock;
    private final LocalCache<RolesKey, ResolvedRoles> cache;

    record RolesKey(String userId, String tenantId) {}

    record ResolvedRoles(Set<String> roles, Instant validUntil) {
        boolean isStaleAt(Instant now) {
            return validUntil != null && !now.isBefore(validUntil);
        }
    }

    @Inject
    public RoleManager(RoleStore store, PermissionEngine permissions, RoleConfig config, Clock clock) {
        this(store, permissions, clock, new CaffeineLocalCache<>(config.cacheTtl(), 10_000));
    }

    RoleManager(
            RoleStore store, PermissionEngine permissions, Clock clock, LocalCache<RolesKey, ResolvedRoles> cache) {
        this.store = store;
        this.permissions = permissions;
        this.clock = clock;
        this.cache = cache;
    }

    @Override
    public Uni<Role> defineRole(Role role) {
        return store.findAllRoles().flatMap(existing -> {
            final var byId = new HashMap<String, Role>();
            existing.forEach(r -> byId.put(r.id(), r));
            final var previous = byId.put(role.id(), role);

            for (String included : role.includedRoles()) {
                if (!byId.containsKey(included)) {
                    return Uni.createFrom()
                            .failure(new ValidationException("Included role not found: " + included));
                }
            }
            if (reaches(byId, role.includedRoles(), role.id())) {
                return Uni.createFrom()
                        .failure(new ValidationException("Circular role inclusion detected for role: " + role.id()));
            }

            final var removed = new TreeSet<String>();
            if (previous != null) {
                removed.addAll(previous.permissions());
                removed.removeAll(role.permissions());
            }

            return store.saveRole(role)
                    .chain(() -> Multi.createFrom()
                            .iterable(new TreeSet<>(role.permissions()))
                            .onItem()
                            .transformToUniAndConcatenate(p -> permissions.assignPermissionToRole(role.id(), p))
                            .collect()
                            .asList())
                    .chain(() -> Multi.createFrom()
                            .iterable(removed)
                            .onItem()
                            .transformToUniAndConcatenate(p -> permissions.revokePermissionFromRole(role.id(), p))
                            .collect()
                            .asList())
                    .invoke(() -> {
                        cache.invalidateAll();
                        LOG.infof(
                                "Role %s: %s (scope %s, %d permissions)",
                                previous == null ? "defined" : "redefined",
                                role.id(),
                                role.scope(),
                                role.permissions().size());
                    })
                    .replaceWith(role);
        });
    }

    /**
     * Whether any role reachable from {@code start} through inclusion is {@code target}.
     */
    private static boolean reaches(Map<String, Role> roles, Set<String> start, String target) {
        final var visited = new HashSet<String>();
        final var pending = new ArrayDeque<>(start);
        while (!pending.isEmpty()) {
            final var current = pending.poll();
            if (current.equals(target)) {
                return true;
            }
            if (visited.add(current)) {
                final var role = roles.get(current);
                if (role != null) {
                    pending.addAll(role.includedRoles());
                }
            }
        }
        return false;
    }

    @Override
    public Uni<Optional<Role>> findRole(String roleId) {
        return store.findRole(roleId);
    }

    public Uni<List<Role>> roles() {
        return store.findAllRoles();
    }

    @Override
    public Uni<RoleAssignment> assignRole(
            String userId, String roleId, RoleScope scope, String assignedBy, String tenantId, Instant expiresAt) {
        final var requestedScope = scope != null ? scope : RoleScope.GLOBAL;
        final var now = clock.instant();
        if (userId == null || userId.isBlank()) {
            return Uni.createFrom().failure(new ValidationException("User ID is required"));
        }
        if (expiresAt != null && !expiresAt.isAfter(now)) {
            return Uni.createFrom().failure(new ValidationException("Role assignment expiry must be in the future"));
        }

        return store.findRole(roleId).flatMap(found -> {
            if (found.isEmpty() || found.get().status() != RoleStatus.ACTIVE) {
                return Uni.createFrom().failure(new ValidationException("Role not found: " + roleId));
            }
            final var role = found.get();
            if (!role.assignableIn(requestedScope)) {
                return Uni.createFrom()
                        .failure(new ValidationException("Role " + roleId + " has scope " + role.scope().wireName()
                                + " and cannot be assigned in scope " + requestedScope.wireName()));
            }

            final var assignment = new RoleAssignment(
                    "ra_" + SecureHash.randomHex(12),
                    userId,
                    roleId,
                    requestedScope,
                    tenantId,
                    assignedBy,
                    now,
                    expiresAt,
                    null,
                    AssignmentStatus.ACTIVE);

            return expireLapsed(userId, now)
                    .chain(() -> store.saveAssignmentIfAbsent(assignment))
                    .flatMap(inserted -> {
                        if (!inserted) {
                            return Uni.createFrom()
                                    .failure(new ValidationException(
                                            "User " + userId + " already has role " + roleId));
                        }
                        invalidateUser(userId);
                        LOG.infof(
                                "Role %s assigned to %s by %s (assignment %s)",
                                roleId, userId, assignedBy, assignment.id());
                        return Uni.createFrom().item(assignment);
                    });
        });
    }

    @Override
    public Uni<Optional<RoleAssignment>> revokeRole(String assignmentId, String revokedBy) {
        return store.findAssignment(assignmentId).flatMap(found -> {
            if (found.isEmpty() || found.get().status() != AssignmentStatus.ACTIVE) {
                return Uni.createFrom().item(Optional.<RoleAssignment>empty());
            }
            final var revoked = found.get().withStatus(AssignmentStatus.REVOKED);
            return store.updateAssignment(revoked)
                    .invoke(() -> {
                        invalidateUser(revoked.userId());
                        LOG.infof(
                                "Role %s revoked from %s by %s", revoked.roleId(), revoked.userId(), revokedBy);
                    })
                    .replaceWith(Optional.of(revoked));
        });
    }

    @Override
    public Uni<Set<String>> userRoles(String userId, String tenantId) {
        final var now = clock.instant();
        final var key = new RolesKey(userId, tenantId);
        final var cached = cache.get(key);
        if (cached.isPresent() && !cached.get().isStaleAt(now)) {
            return Uni.createFrom().item(cached.get().roles());
        }

        return expireLapsed(userId, now)
                .flatMap(assignments -> store.findAllRoles().map(roles -> {
                    final var byId = new HashMap<String, Role>();
                    roles.forEach(r -> byId.put(r.id(), r));

                    final var direct = new ArrayList<String>();
                    Instant validUntil = null;
                    for (RoleAssignment assignment : assignments) {
                        if (assignment.isEffectiveAt(now) && appliesToTenant(assignment, tenantId)) {
                            direct.add(assignment.roleId());
                            if (assignment.expiresAt() != null
                                    && (validUntil == null || assignment.expiresAt().isBefore(validUntil))) {
                                validUntil = assignment.expiresAt();
                            }
                        }
                    }
                    final var resolved = expand(byId, direct);
                    cache.put(key, new ResolvedRoles(resolved, validUntil));
                    return resolved;
                }));
    }

    @Override
    public Uni<List<RoleAssignment>> userAssignments(String userId) {
        return expireLapsed(userId, clock.instant());
    }

    /**
     * Mark the user's lapsed ACTIVE assignments as EXPIRED.
     *
     * @return the user's assignments after the update
     */
    private Uni<List<RoleAssignment>> expireLapsed(String userId, Instant now) {
        return store.findAssignmentsByUserId(userId).flatMap(assignments -> {
            final var lapsed = assignments.stream()
                    .filter(a -> a.status() == AssignmentStatus.ACTIVE && !a.isEffectiveAt(now))
                    .map(a -> a.withStatus(AssignmentStatus.EXPIRED))
                    .toList();
            if (lapsed.isEmpty()) {
                return Uni.createFrom().item(assignments);
            }
            return Multi.createFrom()
                    .iterable(lapsed)
                    .onItem()
                    .transformToUniAndConcatenate(store::updateAssignment)
                    .collect()
                    .asList()
                    .invoke(() -> LOG.debugf("Expired %d role assignments of %s", lapsed.size(), userId))
                    .chain(() -> store.findAssignmentsByUserId(userId));
        });
    }

    private static boolean appliesToTenant(RoleAssignment assignment, String tenantId) {
        return assignment.scope() == RoleScope.GLOBAL
                || assignment.tenantId() == null
                || tenantId == null
                || Objects.equals(assignment.tenantId(), tenantId);
    }

    private static Set<String> expand(Map<String, Role> roles, List<String> direct) {
        final var result = new LinkedHashSet<String>();
        final var pending = new ArrayDeque<>(direct);
        while (!pending.isEmpty()) {
            final var roleId = pending.poll();
            final var role = roles.get(roleId);
            if (role == null || role.status() != RoleStatus.ACTIVE) {
                continue;
            }
            if (result.add(roleId)) {
                pending.addAll(role.includedRoles());
            }
        }
        return Set.copyOf(result);
    }

    private void invalidateUser(String userId) {
        cache.invalidateIf((key, value) -> key.userId().equals(userId));
    }
}
