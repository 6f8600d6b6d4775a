package taxpoynt.core.model.permission;

import java.util.Locale;
import java.util.Optional;

public enum PermissionEffect {
    ALLOW,
    DENY;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<PermissionEffect> fromWireName(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "allow" -> Optional.of(ALLOW);
            case "deny" -> Optional.of(DENY);
            default -> Optional.empty();
        };
    }
}
