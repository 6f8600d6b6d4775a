package taxpoynt.core.port.out;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import io.smallrye.mutiny.Uni;

import taxpoynt.core.model.permission.Permission;
import taxpoynt.core.model.permission.Policy;
import taxpoynt.core.model.permission.ResourcePermission;

/**
 * Registry of permissions, policies, role grants, the permission hierarchy
 * and resource ACLs.
 */
public interface PermissionCatalog {

    Uni<Void> savePermission(Permission permission);

    Uni<Optional<Permission>> findPermission(String permissionId);

    Uni<List<Permission>> findAllPermissions();

    Uni<Void> savePolicy(Policy policy);

    Uni<Optional<Policy>> findPolicy(String policyId);

    Uni<List<Policy>> findAllPolicies();

    Uni<Boolean> deletePolicy(String policyId);

    /**
     * Permission ids and patterns granted to a role.
     */
    Uni<Set<String>> findRolePermissions(String roleId);

    /**
     * @return true if the grant was added
     */
    Uni<Boolean> grantToRole(String roleId, String permissionIdOrPattern);

    /**
     * @return true if the grant existed and was removed
     */
    Uni<Boolean> revokeFromRole(String roleId, String permissionIdOrPattern);

    /**
     * Record that holding {@code parentId} implies {@code childId}.
     */
    Uni<Void> addImplication(String parentId, String childId);

    /**
     * Permission ids directly implied by {@code parentId}.
     */
    Uni<Set<String>> findImplied(String parentId);

    Uni<Void> saveResource(ResourcePermission resource);

    Uni<Optional<ResourcePermission>> findResource(String resourceId);
}
