package taxpoynt.core.model.session;

import java.time.Duration;
import java.util.List;

/**
 * Named set of session security requirements.
 *
 * @param name policy name
 * @param idleTimeout maximum inactivity
 * @param absoluteTimeout maximum lifetime
 * @param maxConcurrentSessions per-user cap on active sessions
 * @param requireMfa whether new sessions start with {@code mfa_required}
 * @param requireDeviceTrust whether untrusted devices are flagged for verification
 * @param blockedIpRanges IPs or CIDR ranges rejected at session creation
 * @param blockedUserAgents case-insensitive user-agent substrings rejected at session creation
 * @param riskThreshold risk score above which the session is considered risky
 * @param securityLevel level recorded on sessions created under this policy
 */
public record SecurityPolicy(
        String name,
        Duration idleTimeout,
        Duration absoluteTimeout,
        int maxConcurrentSessions,
        boolean requireMfa,
        boolean requireDeviceTrust,
        List<String> blockedIpRanges,
        List<String> blockedUserAgents,
        double riskThreshold,
        SecurityLevel securityLevel) {

    public static final String STANDARD = "standard";
    public static final String HIGH_SECURITY = "high_security";

    public SecurityPolicy {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Policy name cannot be null or blank");
        }
        if (idleTimeout == null || idleTimeout.isNegative() || idleTimeout.isZero()) {
            throw new IllegalArgumentException("Idle timeout must be positive");
        }
        if (absoluteTimeout == null || absoluteTimeout.isNegative() || absoluteTimeout.isZero()) {
            throw new IllegalArgumentException("Absolute timeout must be positive");
        }
        if (maxConcurrentSessions < 1) {
            throw new IllegalArgumentException("Max concurrent sessions must be at least 1");
        }
        blockedIpRanges = blockedIpRanges != null ? List.copyOf(blockedIpRanges) : List.of();
        blockedUserAgents = blockedUserAgents != null ? List.copyOf(blockedUserAgents) : List.of();
        if (securityLevel == null) {
            securityLevel = SecurityLevel.MEDIUM;
        }
    }

    public static SecurityPolicy standard(
            Duration idleTimeout, Duration absoluteTimeout, int maxConcurrentSessions, List<String> blockedUserAgents) {
        return new SecurityPolicy(
                STANDARD,
                idleTimeout,
                absoluteTimeout,
                maxConcurrentSessions,
                false,
                false,
                List.of(),
                blockedUserAgents,
                0.7,
                SecurityLevel.MEDIUM);
    }

    public static SecurityPolicy highSecurity(List<String> blockedUserAgents) {
        return new SecurityPolicy(
                HIGH_SECURITY,
                Duration.ofMinutes(15),
                Duration.ofHours(4),
                2,
                true,
                true,
                List.of(),
                blockedUserAgents,
                0.5,
                SecurityLevel.HIGH);
    }
}
