package taxpoynt.core.model.session;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Audit entry appended to a session's activity log.
 *
 * @param activityId unique id
 * @param sessionId owning session
 * @param userId owning user
 * @param type activity type, e.g. {@code session_created} or {@code action_create}
 * @param timestamp when it happened
 * @param ipAddress client IP at the time (nullable)
 * @param userAgent client user agent at the time (nullable)
 * @param details free-form details
 * @param riskIndicators risk signals observed
 */
public record SessionActivity(
        String activityId,
        String sessionId,
        String userId,
        String type,
        Instant timestamp,
        String ipAddress,
        String userAgent,
        Map<String, Object> details,
        List<String> riskIndicators) {

    public static final String SESSION_CREATED = "session_created";
    public static final String SESSION_TERMINATED = "session_terminated";
    public static final String IP_CHANGE_DETECTED = "ip_change_detected";
    public static final String MFA_VERIFIED = "mfa_verified";
    public static final String HIGH_RISK_DETECTED = "high_risk_detected";
    public static final String ACTIVITY_UPDATE = "activity_update";

    public SessionActivity {
        details = withoutNullValues(details);
        riskIndicators = riskIndicators != null ? List.copyOf(riskIndicators) : List.of();
    }

    private static Map<String, Object> withoutNullValues(Map<String, Object> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        final var copy = new HashMap<String, Object>();
        source.forEach((key, value) -> {
            if (key != null && value != null) {
                copy.put(key, value);
            }
        });
        return Map.copyOf(copy);
    }
}
