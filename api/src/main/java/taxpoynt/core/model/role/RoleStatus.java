package taxpoynt.core.model.role;

public enum RoleStatus {
    ACTIVE,
    INACTIVE,
    SUSPENDED,
    DEPRECATED
}
