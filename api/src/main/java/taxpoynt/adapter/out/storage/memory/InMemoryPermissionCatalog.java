package taxpoynt.adapter.out.storage.memory;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import io.smallrye.mutiny.Uni;

import taxpoynt.core.model.permission.Permission;
import taxpoynt.core.model.permission.Policy;
import taxpoynt.core.model.permission.ResourcePermission;
import taxpoynt.core.port.out.PermissionCatalog;

/**
 * In-memory implementation of {@link PermissionCatalog}.
 */
public class InMemoryPermissionCatalog implements PermissionCatalog {

    private final Map<String, Permission> permissions = new ConcurrentHashMap<>();
    private final Map<String, Policy> policies = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> roleGrants = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> implications = new ConcurrentHashMap<>();
    private final Map<String, ResourcePermission> resources = new ConcurrentHashMap<>();

    @Override
    public Uni<Void> savePermission(Permission permission) {
        return Uni.createFrom().item(() -> {
            permissions.put(permission.id(), permission);
            return null;
        });
    }

    @Override
    public Uni<Optional<Permission>> findPermission(String permissionId) {
        return Uni.createFrom().item(() -> Optional.ofNullable(permissions.get(permissionId)));
    }

    @Override
    public Uni<List<Permission>> findAllPermissions() {
        return Uni.createFrom().item(() -> permissions.values().stream()
                .sorted(Comparator.comparing(Permission::id))
                .toList());
    }

    @Override
    public Uni<Void> savePolicy(Policy policy) {
        return Uni.createFrom().item(() -> {
            policies.put(policy.id(), policy);
            return null;
        });
    }

    @Override
    public Uni<Optional<Policy>> findPolicy(String policyId) {
        return Uni.createFrom().item(() -> Optional.ofNullable(policies.get(policyId)));
    }

    @Override
    public Uni<List<Policy>> findAllPolicies() {
        return Uni.createFrom().item(() -> List.copyOf(policies.values()));
    }

    @Override
    public Uni<Boolean> deletePolicy(String policyId) {
        return Uni.createFrom().item(() -> policies.remove(policyId) != null);
    }

    @Override
    public Uni<Set<String>> findRolePermissions(String roleId) {
        return Uni.createFrom().item(() -> Set.copyOf(roleGrants.getOrDefault(roleId, Set.of())));
    }

    @Override
    public Uni<Boolean> grantToRole(String roleId, String permissionIdOrPattern) {
        return Uni.createFrom().item(() -> roleGrants
                .computeIfAbsent(roleId, r -> ConcurrentHashMap.newKeySet())
                .add(permissionIdOrPattern));
    }

    @Override
    public Uni<Boolean> revokeFromRole(String roleId, String permissionIdOrPattern) {
        return Uni.createFrom().item(() -> {
            final var grants = roleGrants.get(roleId);
            return grants != null && grants.remove(permissionIdOrPattern);
        });
    }

    @Override
    public Uni<Void> addImplication(String parentId, String childId) {
        return Uni.createFrom().item(() -> {
            implications.computeIfAbsent(parentId, p -> ConcurrentHashMap.newKeySet()).add(childId);
            return null;
        });
    }

    @Override
    public Uni<Set<String>> findImplied(String parentId) {
        return Uni.createFrom().item(() -> Set.copyOf(implications.getOrDefault(parentId, Set.of())));
    }

    @Override
    public Uni<Void> saveResource(ResourcePermission resource) {
        return Uni.createFrom().item(() -> {
            resources.put(resource.resourceId(), resource);
            return null;
        });
    }

    @Override
    public Uni<Optional<ResourcePermission>> findResource(String resourceId) {
        return Uni.createFrom().item(() -> Optional.ofNullable(resources.get(resourceId)));
    }

    public int permissionCount() {
        return permissions.size();
    }
}
