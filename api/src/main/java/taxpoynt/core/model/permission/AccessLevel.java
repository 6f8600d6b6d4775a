package taxpoynt.core.model.permission;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Explicit per-user access level on a resource.
 */
public enum AccessLevel {
    NONE,
    READ,
    WRITE,
    DELETE,
    ADMIN,
    FULL;

    private static final Map<String, Set<AccessLevel>> ACTION_LEVELS = Map.of(
            "read", EnumSet.of(READ, WRITE, ADMIN),
            "view", EnumSet.of(READ, WRITE, ADMIN),
            "create", EnumSet.of(WRITE, ADMIN),
            "update", EnumSet.of(WRITE, ADMIN),
            "delete", EnumSet.of(DELETE, ADMIN),
            "manage", EnumSet.of(ADMIN));

    /**
     * Whether this level permits {@code action}.
     *
     * <p>FULL permits everything. Actions outside the known set are permitted
     * for any level other than NONE.
     */
    public boolean allows(String action) {
        if (this == FULL) {
            return true;
        }
        if (action != null) {
            final var levels = ACTION_LEVELS.get(action);
            if (levels != null) {
                return levels.contains(this);
            }
        }
        return this != NONE;
    }
}
