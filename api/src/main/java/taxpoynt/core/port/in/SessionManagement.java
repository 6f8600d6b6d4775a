package taxpoynt.core.port.in;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import taxpoynt.core.model.session.CreateSessionRequest;
import taxpoynt.core.model.session.Device;
import taxpoynt.core.model.session.SecurityPolicy;
import taxpoynt.core.model.session.Session;
import taxpoynt.core.model.session.SessionActivity;
import taxpoynt.core.model.session.SessionStatistics;

/**
 * Inbound port for session lifecycle operations.
 */
public interface SessionManagement {

    /**
     * Open a session after security checks and risk scoring.
     *
     * <p>Fails with {@link taxpoynt.core.model.error.SecurityViolationException}
     * when the client IP or user agent is blocked; nothing is stored in that case.
     * If the user already holds the maximum number of sessions, the oldest is
     * terminated first.
     */
    Uni<Session> create(CreateSessionRequest request);

    /**
     * Returns empty if the session is unknown or no longer valid. An invalid
     * session found here is terminated as {@code expired}.
     */
    Uni<Optional<Session>> get(String sessionId);

    /**
     * Record activity on a live session, sliding its expiry.
     *
     * @return false if the session is unknown or no longer valid
     */
    Uni<Boolean> updateActivity(String sessionId, String ipAddress, String userAgent, Map<String, Object> details);

    /**
     * Record activity of a given type, e.g. {@code action_create}.
     *
     * @return false if the session is unknown or no longer valid
     */
    Uni<Boolean> updateActivity(
            String sessionId, String activityType, String ipAddress, String userAgent, Map<String, Object> details);

    /**
     * @return false if the session is unknown or already terminated
     */
    Uni<Boolean> terminate(String sessionId, String reason, String terminatedBy);

    /**
     * Terminate every live session of a user.
     *
     * @param exceptSessionId session to keep (nullable)
     * @return number of sessions terminated
     */
    Uni<Integer> terminateAllForUser(String userId, String exceptSessionId, String reason, String terminatedBy);

    /**
     * Verify a second-factor code for the session's user.
     *
     * @return true if verified; a failed verification leaves the session unchanged
     */
    Uni<Boolean> verifyMfa(String sessionId, String code);

    Uni<List<Session>> userSessions(String userId, boolean activeOnly);

    Uni<List<SessionActivity>> sessionActivities(String sessionId, int limit);

    Uni<SessionStatistics> statistics();

    Uni<Device> registerDevice(Device device);

    Uni<Optional<Device>> trustDevice(String deviceId, boolean trusted);

    /**
     * Add or replace a named security policy.
     */
    void definePolicy(SecurityPolicy policy);

    Optional<SecurityPolicy> policy(String name);
}
