package taxpoynt.core.model.permission;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Access control list for one resource.
 *
 * @param resourceId resource id
 * @param resourceType resource type
 * @param ownerId owning user; always has access
 * @param tenantId tenant the resource belongs to (nullable)
 * @param userAccess explicit per-user access levels
 * @param isPublic public resources are accessible to everyone
 * @param sharedWith users the resource is shared with
 */
public record ResourcePermission(
        String resourceId,
        ResourceType resourceType,
        String ownerId,
        String tenantId,
        Map<String, AccessLevel> userAccess,
        boolean isPublic,
        Set<String> sharedWith) {

    public ResourcePermission {
        if (resourceId == null || resourceId.isBlank()) {
            throw new IllegalArgumentException("Resource ID cannot be null or blank");
        }
        userAccess = userAccess != null ? Map.copyOf(userAccess) : Map.of();
        sharedWith = sharedWith != null ? Set.copyOf(sharedWith) : Set.of();
    }

    public static ResourcePermission owned(String resourceId, ResourceType type, String ownerId, String tenantId) {
        return new ResourcePermission(resourceId, type, ownerId, tenantId, Map.of(), false, Set.of());
    }

    public Optional<AccessLevel> accessFor(String userId) {
        return Optional.ofNullable(userAccess.get(userId));
    }

    public ResourcePermission withAccess(String userId, AccessLevel level) {
        final var updated = new HashMap<>(userAccess);
        updated.put(userId, level);
        return new ResourcePermission(resourceId, resourceType, ownerId, tenantId, updated, isPublic, sharedWith);
    }

    public ResourcePermission withoutAccess(String userId) {
        final var updated = new HashMap<>(userAccess);
        updated.remove(userId);
        return new ResourcePermission(resourceId, resourceType, ownerId, tenantId, updated, isPublic, sharedWith);
    }

    public ResourcePermission sharedWith(String userId) {
        final var updated = new HashSet<>(sharedWith);
        updated.add(userId);
        return new ResourcePermission(resourceId, resourceType, ownerId, tenantId, userAccess, isPublic, updated);
    }

    public ResourcePermission withPublic(boolean isPublic) {
        return new ResourcePermission(resourceId, resourceType, ownerId, tenantId, userAccess, isPublic, sharedWith);
    }
}
