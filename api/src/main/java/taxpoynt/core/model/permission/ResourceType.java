package taxpoynt.core.model.permission;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Platform resource categories that permissions and ACLs can target.
 */
public enum ResourceType {
    INVOICE,
    CERTIFICATE,
    USER,
    TENANT,
    CONFIGURATION,
    SECRET,
    AUDIT_LOG,
    SYSTEM;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<ResourceType> fromWireName(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(t -> t.wireName().equalsIgnoreCase(value.trim()))
                .findFirst();
    }
}
