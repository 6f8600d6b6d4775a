package taxpoynt.core.model.session;

import java.util.Map;

/**
 * Point-in-time counts over live sessions.
 */
public record SessionStatistics(
        int activeSessions, int activeUsers, int highRiskSessions, Map<SessionKind, Integer> byKind) {

    public SessionStatistics {
        byKind = byKind != null ? Map.copyOf(byKind) : Map.of();
    }
}
