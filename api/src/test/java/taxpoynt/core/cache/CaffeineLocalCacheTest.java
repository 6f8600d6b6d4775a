package taxpoynt.core.cache;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("CaffeineLocalCache")
class CaffeineLocalCacheTest {

    private final AtomicLong nanos = new AtomicLong();
    private CaffeineLocalCache<String, String> cache;

    @BeforeEach
    void setUp() {
        cache = new CaffeineLocalCache<>(Duration.ofMinutes(5), 100, 0.0, nanos::get);
    }

    @Test
    @DisplayName("should expire entries after the TTL")
    void shouldExpireAfterTtl() {
        cache.put("k", "v");
        assertEquals(Optional.of("v"), cache.get("k"));

        nanos.addAndGet(Duration.ofMinutes(5).toNanos());

        assertTrue(cache.get("k").isEmpty());
    }

    @Test
    @DisplayName("should invalidate matching entries and report how many")
    void shouldInvalidateMatching() {
        cache.put("user-1:a", "x");
        cache.put("user-1:b", "y");
        cache.put("user-2:a", "z");

        var removed = cache.invalidateIf((key, value) -> key.startsWith("user-1:"));

        assertEquals(2, removed);
        assertTrue(cache.get("user-1:a").isEmpty());
        assertEquals(Optional.of("z"), cache.get("user-2:a"));
    }

    @Test
    @DisplayName("should reject a jitter factor above one half")
    void shouldRejectLargeJitter() {
        assertThrows(
                IllegalArgumentException.class,
                () -> new CaffeineLocalCache<String, String>(Duration.ofMinutes(5), 100, 0.6, nanos::get));
    }
}
