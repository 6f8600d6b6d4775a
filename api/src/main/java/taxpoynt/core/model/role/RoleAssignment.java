package taxpoynt.core.model.role;

import java.time.Instant;
import java.util.Objects;

/**
 * A role granted to a user.
 *
 * @param id assignment id, {@code ra_} followed by 12 hex characters
 * @param userId user
 * @param roleId role
 * @param scope scope of the assignment
 * @param tenantId tenant for tenant-scoped assignments (nullable)
 * @param assignedBy actor that made the assignment
 * @param assignedAt assignment time
 * @param expiresAt expiry (nullable for permanent)
 * @param type assignment type
 * @param status assignment status
 */
public record RoleAssignment(
        String id,
        String userId,
        String roleId,
        RoleScope scope,
        String tenantId,
        String assignedBy,
        Instant assignedAt,
        Instant expiresAt,
        AssignmentType type,
        AssignmentStatus status) {

    public RoleAssignment {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Assignment ID cannot be null or blank");
        }
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("Assignment user ID cannot be null or blank");
        }
        if (roleId == null || roleId.isBlank()) {
            throw new IllegalArgumentException("Assignment role ID cannot be null or blank");
        }
        if (scope == null) {
            scope = RoleScope.GLOBAL;
        }
        if (type == null) {
            type = expiresAt != null ? AssignmentType.TEMPORARY : AssignmentType.DIRECT;
        }
        if (status == null) {
            status = AssignmentStatus.ACTIVE;
        }
    }

    /**
     * Whether this assignment grants its role at {@code now}.
     */
    public boolean isEffectiveAt(Instant now) {
        return status == AssignmentStatus.ACTIVE && (expiresAt == null || now.isBefore(expiresAt));
    }

    /**
     * Whether this assignment covers the same user, role, scope and tenant as {@code other}.
     */
    public boolean sameGrantAs(RoleAssignment other) {
        return userId.equals(other.userId)
                && roleId.equals(other.roleId)
                && scope == other.scope
                && Objects.equals(tenantId, other.tenantId);
    }

    public RoleAssignment withStatus(AssignmentStatus status) {
        return new RoleAssignment(id, userId, roleId, scope, tenantId, assignedBy, assignedAt, expiresAt, type, status);
    }
}
