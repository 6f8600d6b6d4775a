package taxpoynt.core.model.session;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Client channel a session was opened from.
 */
public enum SessionKind {
    WEB,
    MOBILE,
    API,
    DESKTOP,
    SERVICE;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<SessionKind> fromWireName(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(k -> k.wireName().equalsIgnoreCase(value.trim()))
                .findFirst();
    }
}
