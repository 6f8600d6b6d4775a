package taxpoynt.core.cache;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.BiPredicate;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import org.jboss.logging.Logger;

/**
 * Caffeine-backed local cache with a size bound, TTL and optional TTL jitter.
 *
 * <p>Jitter spreads expirations of entries written at the same moment so that
 * hot entries do not all expire together.
 *
 * @param <K> the key type
 * @param <V> the value type
 */
public class CaffeineLocalCache<K, V> implements LocalCache<K, V> {

    private static final Logger LOG = Logger.getLogger(CaffeineLocalCache.class);

    private final Cache<K, V> cache;
    private final long baseTtlNanos;
    private final double jitterFactor;

    /**
     * Create a cache without jitter.
     *
     * @param ttl     time-to-live for entries
     * @param maxSize maximum number of entries
     */
    public CaffeineLocalCache(Duration ttl, long maxSize) {
        this(ttl, maxSize, 0.0, Ticker.systemTicker());
    }

    /**
     * Create a cache with TTL jitter and an explicit time source.
     *
     * @param ttl          base time-to-live for entries
     * @param maxSize      maximum number of entries
     * @param jitterFactor jitter factor between 0.0 and 0.5; 0.1 means ±10%
     * @param ticker       time source
     */
    public CaffeineLocalCache(Duration ttl, long maxSize, double jitterFactor, Ticker ticker) {
        if (jitterFactor < 0.0 || jitterFactor > 0.5) {
            throw new IllegalArgumentException("Jitter factor must be between 0.0 and 0.5, got: " + jitterFactor);
        }
        this.baseTtlNanos = ttl.toNanos();
        this.jitterFactor = jitterFactor;

        if (jitterFactor == 0.0) {
            this.cache = Caffeine.newBuilder()
                    .expireAfterWrite(ttl)
                    .maximumSize(maxSize)
                    .ticker(ticker)
                    .build();
        } else {
            this.cache = Caffeine.newBuilder()
                    .expireAfter(new JitteredExpiry())
                    .maximumSize(maxSize)
                    .ticker(ticker)
                    .build();
        }
    }

    private class JitteredExpiry implements Expiry<K, V> {
        @Override
        public long expireAfterCreate(K key, V value, long currentTime) {
            return applyJitter(baseTtlNanos);
        }

        @Override
        public long expireAfterUpdate(K key, V value, long currentTime, long currentDuration) {
            return applyJitter(baseTtlNanos);
        }

        @Override
        public long expireAfterRead(K key, V value, long currentTime, long currentDuration) {
            return currentDuration;
        }

        private long applyJitter(long baseTtl) {
            final var jitter = ThreadLocalRandom.current().nextDouble() * 2 * jitterFactor;
            return (long) (baseTtl * (1.0 - jitterFactor + jitter));
        }
    }

    @Override
    public Optional<V> get(K key) {
        try {
            return Optional.ofNullable(cache.getIfPresent(key));
        } catch (RuntimeException e) {
            LOG.warnf(e, "Cache lookup failed, treating as miss");
            return Optional.empty();
        }
    }

    @Override
    public void put(K key, V value) {
        cache.put(key, value);
    }

    @Override
    public void invalidate(K key) {
        cache.invalidate(key);
    }

    @Override
    public int invalidateIf(BiPredicate<K, V> predicate) {
        final var matching = cache.asMap().entrySet().stream()
                .filter(entry -> predicate.test(entry.getKey(), entry.getValue()))
                .map(Map.Entry::getKey)
                .toList();
        cache.invalidateAll(matching);
        return matching.size();
    }

    @Override
    public void invalidateAll() {
        cache.invalidateAll();
    }

    @Override
    public void cleanUp() {
        cache.cleanUp();
    }

    @Override
    public long estimatedSize() {
        return cache.estimatedSize();
    }
}
