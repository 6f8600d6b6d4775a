package taxpoynt.core.model.role;

public enum AssignmentType {
    DIRECT,
    INHERITED,
    DELEGATED,
    TEMPORARY
}
