package taxpoynt.adapter.out.storage.memory;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import taxpoynt.core.model.session.Device;
import taxpoynt.core.model.session.Session;
import taxpoynt.core.model.session.SessionActivity;
import taxpoynt.core.port.out.SessionStore;

/**
 * In-memory implementation of {@link SessionStore}.
 *
 * <p>Intended for development and single-instance deployments. Sessions are
 * lost on restart and not shared across instances.
 */
public class InMemorySessionStore implements SessionStore {

    private static final Logger LOG = Logger.getLogger(InMemorySessionStore.class);

    private final Map<String, Session> sessions = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> userIndex = new ConcurrentHashMap<>();
    private final Map<String, Deque<SessionActivity>> activities = new ConcurrentHashMap<>();
    private final Map<String, Device> devices = new ConcurrentHashMap<>();
    private final Object lock = new Object();

    @Override
    public Uni<List<Session>> saveWithinLimit(Session session, int maxActive, String evictionReason) {
        return Uni.createFrom().item(() -> {
            synchronized (lock) {
                final var live = new ArrayList<Session>();
                for (String id : userIndex.getOrDefault(session.userId(), Set.of())) {
                    final var existing = sessions.get(id);
                    if (existing != null) {
                        live.add(existing);
                    }
                }
                live.sort(Comparator.comparing(Session::createdAt).thenComparing(Session::id));

                final var evicted = new ArrayList<Session>();
                var index = 0;
                while (live.size() - evicted.size() >= Math.max(maxActive, 1) && index < live.size()) {
                    final var oldest = live.get(index++);
                    final var terminated = oldest.isActive() ? oldest.terminate(evictionReason, "system") : oldest;
                    sessions.remove(oldest.id());
                    unindex(oldest);
                    evicted.add(terminated);
                }

                sessions.put(session.id(), session);
                userIndex.computeIfAbsent(session.userId(), u -> ConcurrentHashMap.newKeySet()).add(session.id());
                if (!evicted.isEmpty()) {
                    LOG.debugf("Evicted %d sessions of %s", evicted.size(), session.userId());
                }
                return List.copyOf(evicted);
            }
        });
    }

    @Override
    public Uni<Optional<Session>> findById(String sessionId) {
        return Uni.createFrom().item(() -> Optional.ofNullable(sessions.get(sessionId)));
    }

    @Override
    public Uni<Boolean> update(Session session) {
        return Uni.createFrom().item(() -> sessions.replace(session.id(), session) != null);
    }

    @Override
    public Uni<Optional<Session>> terminate(String sessionId, String reason, String terminatedBy) {
        return Uni.createFrom().item(() -> {
            synchronized (lock) {
                final var session = sessions.remove(sessionId);
                if (session == null) {
                    return Optional.<Session>empty();
                }
                unindex(session);
                return Optional.of(session.isActive() ? session.terminate(reason, terminatedBy) : session);
            }
        });
    }

    @Override
    public Uni<List<Session>> findByUserId(String userId) {
        return Uni.createFrom().item(() -> {
            final var result = new ArrayList<Session>();
            for (String id : userIndex.getOrDefault(userId, Set.of())) {
                final var session = sessions.get(id);
                if (session != null) {
                    result.add(session);
                }
            }
            result.sort(Comparator.comparing(Session::createdAt));
            return result;
        });
    }

    @Override
    public Uni<List<Session>> findAll() {
        return Uni.createFrom().item(() -> List.copyOf(sessions.values()));
    }

    @Override
    public Uni<Void> appendActivity(SessionActivity activity, int maxEntries, int trimTo) {
        return Uni.createFrom().item(() -> {
            final var log = activities.computeIfAbsent(activity.sessionId(), s -> new ArrayDeque<>());
            synchronized (log) {
                log.addLast(activity);
                if (log.size() > maxEntries) {
                    while (log.size() > trimTo) {
                        log.pollFirst();
                    }
                }
            }
            return null;
        });
    }

    @Override
    public Uni<List<SessionActivity>> findActivities(String sessionId, int limit) {
        return Uni.createFrom().item(() -> {
            final var log = activities.get(sessionId);
            if (log == null) {
                return List.<SessionActivity>of();
            }
            final var result = new ArrayList<SessionActivity>();
            synchronized (log) {
                final var newestFirst = log.descendingIterator();
                while (newestFirst.hasNext() && result.size() < limit) {
                    result.add(newestFirst.next());
                }
            }
            return result;
        });
    }

    @Override
    public Uni<Integer> purgeActivitiesBefore(Instant cutoff) {
        return Uni.createFrom().item(() -> {
            var purged = 0;
            for (var entry : activities.entrySet()) {
                final var log = entry.getValue();
                synchronized (log) {
                    final var before = log.size();
                    log.removeIf(a -> a.timestamp().isBefore(cutoff));
                    purged += before - log.size();
                }
            }
            activities.entrySet().removeIf(e -> {
                synchronized (e.getValue()) {
                    return e.getValue().isEmpty() && !sessions.containsKey(e.getKey());
                }
            });
            return purged;
        });
    }

    @Override
    public Uni<Void> saveDevice(Device device) {
        return Uni.createFrom().item(() -> {
            devices.put(device.deviceId(), device);
            return null;
        });
    }

    @Override
    public Uni<Optional<Device>> findDevice(String deviceId) {
        return Uni.createFrom().item(() -> Optional.ofNullable(devices.get(deviceId)));
    }

    @Override
    public Uni<List<Device>> findDevicesByUserId(String userId) {
        return Uni.createFrom().item(() -> devices.values().stream()
                .filter(d -> userId.equals(d.userId()))
                .sorted(Comparator.comparing(Device::firstSeen))
                .toList());
    }

    /**
     * Number of live sessions, for health reporting.
     */
    public int sessionCount() {
        return sessions.size();
    }

    private void unindex(Session session) {
        final var ids = userIndex.get(session.userId());
        if (ids != null) {
            ids.remove(session.id());
            if (ids.isEmpty()) {
                userIndex.remove(session.userId());
            }
        }
    }
}
