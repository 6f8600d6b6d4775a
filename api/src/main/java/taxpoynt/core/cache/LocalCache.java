package taxpoynt.core.cache;

import java.util.Optional;
import java.util.function.BiPredicate;

/**
 * Local in-memory cache with TTL-based expiry.
 *
 * <p>Implementations never throw from lookups; a failure behaves as a miss.
 *
 * @param <K> the key type
 * @param <V> the value type
 */
public interface LocalCache<K, V> {

    /**
     * Gets a value from the cache.
     *
     * @param key the cache key
     * @return the value if present and not expired
     */
    Optional<V> get(K key);

    /**
     * Puts a value into the cache; it is evicted after the configured TTL.
     */
    void put(K key, V value);

    /**
     * Removes a specific entry.
     */
    void invalidate(K key);

    /**
     * Removes every entry whose key and value match {@code predicate}.
     *
     * @return number of entries removed
     */
    int invalidateIf(BiPredicate<K, V> predicate);

    /**
     * Removes all entries.
     */
    void invalidateAll();

    /**
     * Performs pending expiry and eviction work.
     */
    void cleanUp();

    /**
     * Returns the estimated number of entries in the cache.
     */
    long estimatedSize();
}
