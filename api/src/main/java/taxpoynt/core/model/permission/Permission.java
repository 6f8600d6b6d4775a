package taxpoynt.core.model.permission;

import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * A named capability, e.g. {@code si:invoice:create}.
 *
 * @param id permission id; may contain {@code *} or {@code ?} when granted to a role as a pattern
 * @param name human-readable name
 * @param description description
 * @param type permission type
 * @param resourceType resource the permission targets (nullable)
 * @param action action the permission covers (nullable)
 * @param effect allow or deny
 * @param conditions conditions that must all hold for the permission to be granted
 * @param attributes free-form attribute tags
 * @param createdAt creation time
 */
public record Permission(
        String id,
        String name,
        String description,
        PermissionType type,
        ResourceType resourceType,
        String action,
        PermissionEffect effect,
        List<PolicyCondition> conditions,
        Set<String> attributes,
        Instant createdAt) {

    public Permission {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Permission ID cannot be null or blank");
        }
        if (name == null || name.isBlank()) {
            name = id;
        }
        if (description == null) {
            description = "";
        }
        if (type == null) {
            type = PermissionType.ACTION;
        }
        if (effect == null) {
            effect = PermissionEffect.ALLOW;
        }
        conditions = conditions != null ? List.copyOf(conditions) : List.of();
        attributes = attributes != null ? Set.copyOf(attributes) : Set.of();
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }

    public static Permission of(String id, String name, ResourceType resourceType, String action) {
        return new Permission(id, name, null, PermissionType.ACTION, resourceType, action, null, null, null, null);
    }

    public Permission withConditions(List<PolicyCondition> conditions) {
        return new Permission(id, name, description, type, resourceType, action, effect, conditions, attributes, createdAt);
    }
}
