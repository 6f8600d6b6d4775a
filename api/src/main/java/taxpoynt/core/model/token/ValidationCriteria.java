package taxpoynt.core.model.token;

import java.util.Set;

/**
 * Additional checks applied on top of signature, expiry and revocation.
 *
 * @param expectedKind required token kind (nullable for any)
 * @param requiredPermissions every one of these must be present
 * @param requiredRoles at least one of these must be present (empty for no check)
 */
public record ValidationCriteria(TokenKind expectedKind, Set<String> requiredPermissions, Set<String> requiredRoles) {

    private static final ValidationCriteria NONE = new ValidationCriteria(null, Set.of(), Set.of());

    public ValidationCriteria {
        requiredPermissions = requiredPermissions != null ? Set.copyOf(requiredPermissions) : Set.of();
        requiredRoles = requiredRoles != null ? Set.copyOf(requiredRoles) : Set.of();
    }

    public static ValidationCriteria none() {
        return NONE;
    }

    public static ValidationCriteria ofKind(TokenKind kind) {
        return new ValidationCriteria(kind, Set.of(), Set.of());
    }
}
