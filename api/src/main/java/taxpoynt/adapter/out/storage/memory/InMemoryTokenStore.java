package taxpoynt.adapter.out.storage.memory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import taxpoynt.core.model.token.TokenRecord;
import taxpoynt.core.model.token.TokenStatus;
import taxpoynt.core.port.out.TokenStore;

/**
 * In-memory implementation of {@link TokenStore}.
 *
 * <p>Reads go straight to concurrent maps. Every state change takes the store
 * lock so that a record, the subject index and the revoked set always agree.
 */
public class InMemoryTokenStore implements TokenStore {

    private static final Logger LOG = Logger.getLogger(InMemoryTokenStore.class);

    private final Map<String, TokenRecord> tokens = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> subjectIndex = new ConcurrentHashMap<>();
    private final Set<String> revoked = ConcurrentHashMap.newKeySet();
    private final Object lock = new Object();

    @Override
    public Uni<Void> save(TokenRecord record) {
        return Uni.createFrom().item(() -> {
            synchronized (lock) {
                tokens.put(record.jti(), record);
                subjectIndex
                        .computeIfAbsent(record.subject(), s -> ConcurrentHashMap.newKeySet())
                        .add(record.jti());
            }
            return null;
        });
    }

    @Override
    public Uni<Optional<TokenRecord>> findByJti(String jti) {
        return Uni.createFrom().item(() -> Optional.ofNullable(tokens.get(jti)));
    }

    @Override
    public Uni<List<TokenRecord>> findBySubject(String subject) {
        return Uni.createFrom().item(() -> {
            final var ids = subjectIndex.getOrDefault(subject, Set.of());
            final var result = new ArrayList<TokenRecord>();
            for (String jti : ids) {
                final var record = tokens.get(jti);
                if (record != null) {
                    result.add(record);
                }
            }
            return result;
        });
    }

    @Override
    public Uni<List<TokenRecord>> findActive() {
        return Uni.createFrom().item(() -> tokens.values().stream()
                .filter(TokenRecord::isActive)
                .toList());
    }

    @Override
    public Uni<Boolean> isRevoked(String jti) {
        return Uni.createFrom().item(() -> revoked.contains(jti));
    }

    @Override
    public Uni<Void> recordUsage(String jti, Instant usedAt) {
        return Uni.createFrom().item(() -> {
            tokens.computeIfPresent(jti, (id, record) -> record.isActive() ? record.withUsage(usedAt) : record);
            return null;
        });
    }

    @Override
    public Uni<Optional<TokenRecord>> revoke(String jti, String revokedBy, String reason, Instant at) {
        return Uni.createFrom().item(() -> {
            synchronized (lock) {
                final var record = tokens.get(jti);
                if (record == null || !record.isActive()) {
                    return Optional.<TokenRecord>empty();
                }
                final var updated = record.revoke(revokedBy, reason, at);
                tokens.put(jti, updated);
                revoked.add(jti);
                unindex(updated);
                return Optional.of(updated);
            }
        });
    }

    @Override
    public Uni<Optional<TokenRecord>> expire(String jti, Instant at) {
        return Uni.createFrom().item(() -> {
            synchronized (lock) {
                final var record = tokens.get(jti);
                if (record == null || !record.isActive()) {
                    return Optional.<TokenRecord>empty();
                }
                final var updated = record.expire(at);
                tokens.put(jti, updated);
                unindex(updated);
                return Optional.of(updated);
            }
        });
    }

    @Override
    public Uni<Integer> purgeClosedBefore(Instant cutoff, Instant now) {
        return Uni.createFrom().item(() -> {
            synchronized (lock) {
                final var purgeable = tokens.values().stream()
                        .filter(r -> r.status() != TokenStatus.ACTIVE)
                        .filter(r -> r.closedAt() != null && r.closedAt().isBefore(cutoff))
                        .filter(r -> r.isExpiredAt(now))
                        .map(TokenRecord::jti)
                        .toList();
                for (String jti : purgeable) {
                    tokens.remove(jti);
                    revoked.remove(jti);
                }
                if (!purgeable.isEmpty()) {
                    LOG.debugf("Purged %d closed token records", purgeable.size());
                }
                return purgeable.size();
            }
        });
    }

    @Override
    public Uni<Long> count() {
        return Uni.createFrom().item(() -> (long) tokens.size());
    }

    private void unindex(TokenRecord record) {
        final var ids = subjectIndex.get(record.subject());
        if (ids != null) {
            ids.remove(record.jti());
            if (ids.isEmpty()) {
                subjectIndex.remove(record.subject());
            }
        }
    }
}
