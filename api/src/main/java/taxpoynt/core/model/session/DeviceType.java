package taxpoynt.core.model.session;

import java.util.Arrays;
import java.util.Locale;

public enum DeviceType {
    WEB_BROWSER,
    MOBILE_APP,
    DESKTOP_APP,
    API_CLIENT,
    SERVICE_CLIENT,
    UNKNOWN;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Resolve a wire name, falling back to {@link #UNKNOWN}.
     */
    public static DeviceType fromWireName(String value) {
        if (value == null) {
            return UNKNOWN;
        }
        return Arrays.stream(values())
                .filter(t -> t.wireName().equalsIgnoreCase(value.trim()))
                .findFirst()
                .orElse(UNKNOWN);
    }
}
