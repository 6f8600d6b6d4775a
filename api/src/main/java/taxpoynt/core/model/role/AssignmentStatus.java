package taxpoynt.core.model.role;

public enum AssignmentStatus {
    ACTIVE,
    EXPIRED,
    REVOKED
}
