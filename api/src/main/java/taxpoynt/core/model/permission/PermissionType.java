package taxpoynt.core.model.permission;

public enum PermissionType {
    ACTION,
    RESOURCE,
    ATTRIBUTE,
    CONDITION,
    SCOPE
}
