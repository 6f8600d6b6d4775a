package taxpoynt.core.model.role;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Where a role applies. GLOBAL roles can be assigned in any scope.
 */
public enum RoleScope {
    GLOBAL,
    TENANT,
    SERVICE,
    ENVIRONMENT;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<RoleScope> fromWireName(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(s -> s.wireName().equalsIgnoreCase(value.trim()))
                .findFirst();
    }
}
