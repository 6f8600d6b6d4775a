package taxpoynt.core.port.out;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import taxpoynt.core.model.session.Device;
import taxpoynt.core.model.session.Session;
import taxpoynt.core.model.session.SessionActivity;

/**
 * Storage for live sessions, devices and per-session activity logs.
 *
 * <p>Terminated sessions leave the live index; their activity log remains.
 */
public interface SessionStore {

    /**
     * Atomically enforce the per-user cap and insert {@code session}.
     *
     * <p>While the user holds {@code maxActive} or more live sessions, the
     * oldest by creation time is terminated with {@code evictionReason} and
     * removed from the live index.
     *
     * @return the evicted sessions, oldest first
     */
    Uni<List<Session>> saveWithinLimit(Session session, int maxActive, String evictionReason);

    Uni<Optional<Session>> findById(String sessionId);

    /**
     * Replace a live session. Has no effect if the session is no longer live.
     *
     * @return true if the session was updated
     */
    Uni<Boolean> update(Session session);

    /**
     * Atomically terminate a live session and remove it from the live index.
     *
     * @return the terminated session, or empty if it is not live
     */
    Uni<Optional<Session>> terminate(String sessionId, String reason, String terminatedBy);

    /**
     * Live sessions of a user.
     */
    Uni<List<Session>> findByUserId(String userId);

    /**
     * All live sessions.
     */
    Uni<List<Session>> findAll();

    /**
     * Append to a session's activity log, trimming it to the newest
     * {@code trimTo} entries once it exceeds {@code maxEntries}.
     */
    Uni<Void> appendActivity(SessionActivity activity, int maxEntries, int trimTo);

    /**
     * Most recent activities of a session, newest first.
     */
    Uni<List<SessionActivity>> findActivities(String sessionId, int limit);

    /**
     * Delete activity entries older than {@code cutoff}.
     *
     * @return number of entries deleted
     */
    Uni<Integer> purgeActivitiesBefore(Instant cutoff);

    Uni<Void> saveDevice(Device device);

    Uni<Optional<Device>> findDevice(String deviceId);

    Uni<List<Device>> findDevicesByUserId(String userId);
}
