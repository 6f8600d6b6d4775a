package taxpoynt.adapter.out.storage.memory;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.empty;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import taxpoynt.core.model.token.TokenClaims;
import taxpoynt.core.model.token.TokenKind;
import taxpoynt.core.model.token.TokenRecord;
import taxpoynt.core.model.token.TokenStatus;

@DisplayName("InMemoryTokenStore")
class InMemoryTokenStoreTest {

    private static final Instant NOW = Instant.parse("2025-01-15T10:00:00Z");

    private InMemoryTokenStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryTokenStore();
    }

    private static TokenRecord record(String jti, String subject, Duration ttl) {
        var claims = new TokenClaims(
                jti,
                subject,
                "taxpoynt-platform",
                "taxpoynt-api",
                TokenKind.ACCESS,
                NOW,
                NOW,
                NOW.plus(ttl),
                Set.of(),
                Set.of(),
                null,
                null,
                null,
                Map.of());
        return TokenRecord.issued(claims, "key_1", "10.0.0.5", null, null);
    }

    private void save(TokenRecord record) {
        store.save(record).await().indefinitely();
    }

    private List<String> subjectJtis(String subject) {
        return store.findBySubject(subject).await().indefinitely().stream()
                .map(TokenRecord::jti)
                .toList();
    }

    @Nested
    @DisplayName("revoke")
    class RevokeTests {

        @Test
        @DisplayName("should mark the record revoked and drop it from the subject index")
        void shouldRevoke() {
            save(record("t1", "user-1", Duration.ofHours(1)));
            save(record("t2", "user-1", Duration.ofHours(1)));

            var revoked = store.revoke("t1", "admin", "compromised", NOW).await().indefinitely();

            assertTrue(revoked.isPresent());
            assertEquals(TokenStatus.REVOKED, revoked.get().status());
            assertEquals("admin", revoked.get().revokedBy());
            assertEquals(NOW, revoked.get().closedAt());
            assertTrue(store.isRevoked("t1").await().indefinitely());
            assertThat(subjectJtis("user-1"), containsInAnyOrder("t2"));
        }

        @Test
        @DisplayName("should not revoke an unknown or closed record")
        void shouldIgnoreClosedRecords() {
            save(record("t1", "user-1", Duration.ofHours(1)));
            store.expire("t1", NOW).await().indefinitely();

            assertTrue(store.revoke("t1", "admin", "late", NOW).await().indefinitely().isEmpty());
            assertTrue(store.revoke("missing", "admin", "late", NOW).await().indefinitely().isEmpty());
            assertFalse(store.isRevoked("t1").await().indefinitely());
        }
    }

    @Nested
    @DisplayName("usage")
    class UsageTests {

        @Test
        @DisplayName("should count usage of active records only")
        void shouldCountActiveUsage() {
            save(record("t1", "user-1", Duration.ofHours(1)));
            save(record("t2", "user-1", Duration.ofHours(1)));
            store.revoke("t2", "admin", "done", NOW).await().indefinitely();

            store.recordUsage("t1", NOW.plusSeconds(5)).await().indefinitely();
            store.recordUsage("t1", NOW.plusSeconds(10)).await().indefinitely();
            store.recordUsage("t2", NOW.plusSeconds(10)).await().indefinitely();

            var active = store.findByJti("t1").await().indefinitely().orElseThrow();
            var revoked = store.findByJti("t2").await().indefinitely().orElseThrow();
            assertEquals(2, active.usageCount());
            assertEquals(NOW.plusSeconds(10), active.lastUsedAt());
            assertEquals(0, revoked.usageCount());
        }
    }

    @Nested
    @DisplayName("purgeClosedBefore")
    class PurgeTests {

        @Test
        @DisplayName("should purge closed records past the cutoff whose expiry has passed")
        void shouldPurgeClosedRecords() {
            save(record("expired", "user-1", Duration.ofMinutes(1)));
            save(record("revoked-live", "user-1", Duration.ofDays(30)));
            save(record("active", "user-1", Duration.ofMinutes(1)));
            store.expire("expired", NOW.plusSeconds(60)).await().indefinitely();
            store.revoke("revoked-live", "admin", "logout", NOW).await().indefinitely();

            var later = NOW.plus(Duration.ofDays(2));
            var purged = store.purgeClosedBefore(later.minus(Duration.ofHours(24)), later).await().indefinitely();

            assertEquals(1, purged);
            assertTrue(store.findByJti("expired").await().indefinitely().isEmpty());
            assertTrue(store.isRevoked("revoked-live").await().indefinitely());
            assertEquals(2L, store.count().await().indefinitely());
        }

        @Test
        @DisplayName("should keep records closed after the cutoff")
        void shouldKeepRecentlyClosedRecords() {
            save(record("expired", "user-1", Duration.ofMinutes(1)));
            store.expire("expired", NOW.plusSeconds(60)).await().indefinitely();

            var purged = store.purgeClosedBefore(NOW, NOW.plus(Duration.ofHours(1))).await().indefinitely();

            assertEquals(0, purged);
            assertThat(store.findActive().await().indefinitely(), empty());
        }
    }
}
