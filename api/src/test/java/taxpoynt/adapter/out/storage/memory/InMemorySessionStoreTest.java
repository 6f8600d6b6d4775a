package taxpoynt.adapter.out.storage.memory;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import taxpoynt.core.model.session.Session;
import taxpoynt.core.model.session.SessionActivity;
import taxpoynt.core.model.session.SessionStatus;

@DisplayName("InMemorySessionStore")
class InMemorySessionStoreTest {

    private static final Instant NOW = Instant.parse("2025-01-15T10:00:00Z");

    private InMemorySessionStore store;

    @BeforeEach
    void setUp() {
        store = new InMemorySessionStore();
    }

    private static Session session(String id, String userId, Instant createdAt) {
        return Session.builder(id, userId)
                .createdAt(createdAt)
                .idleTimeout(Duration.ofMinutes(30))
                .absoluteTimeout(Duration.ofHours(8))
                .ipAddress("10.0.0.5")
                .build();
    }

    private List<Session> save(Session session, int maxActive) {
        return store.saveWithinLimit(session, maxActive, "session_limit_exceeded").await().indefinitely();
    }

    private static SessionActivity activity(String id, Instant at) {
        return new SessionActivity(
                id, "sess_1", "user-1", SessionActivity.ACTIVITY_UPDATE, at, "10.0.0.5", null, Map.of(), List.of());
    }

    private List<String> activityIds(int limit) {
        return store.findActivities("sess_1", limit).await().indefinitely().stream()
                .map(SessionActivity::activityId)
                .toList();
    }

    @Nested
    @DisplayName("saveWithinLimit")
    class SaveTests {

        @Test
        @DisplayName("should evict the oldest sessions to make room")
        void shouldEvictOldest() {
            save(session("sess_a", "user-1", NOW), 2);
            save(session("sess_b", "user-1", NOW.plusSeconds(1)), 2);

            var evicted = save(session("sess_c", "user-1", NOW.plusSeconds(2)), 2);

            assertEquals(1, evicted.size());
            assertEquals("sess_a", evicted.get(0).id());
            assertEquals(SessionStatus.TERMINATED, evicted.get(0).status());
            assertEquals("session_limit_exceeded", evicted.get(0).terminationReason());
            assertThat(
                    store.findByUserId("user-1").await().indefinitely().stream()
                            .map(Session::id)
                            .toList(),
                    contains("sess_b", "sess_c"));
        }

        @Test
        @DisplayName("should not count other users' sessions against the limit")
        void shouldLimitPerUser() {
            save(session("sess_a", "user-1", NOW), 1);

            var evicted = save(session("sess_b", "user-2", NOW.plusSeconds(1)), 1);

            assertThat(evicted, empty());
            assertEquals(2, store.findAll().await().indefinitely().size());
        }
    }

    @Nested
    @DisplayName("terminate and update")
    class TerminateTests {

        @Test
        @DisplayName("should remove a terminated session and refuse later updates")
        void shouldTerminate() {
            var original = session("sess_a", "user-1", NOW);
            save(original, 5);

            var terminated = store.terminate("sess_a", "user_logout", "user-1").await().indefinitely();

            assertTrue(terminated.isPresent());
            assertEquals("user-1", terminated.get().terminatedBy());
            assertTrue(store.findById("sess_a").await().indefinitely().isEmpty());
            assertTrue(store.terminate("sess_a", "again", "user-1").await().indefinitely().isEmpty());
            assertFalse(store.update(original.withRiskScore(0.5)).await().indefinitely());
        }
    }

    @Nested
    @DisplayName("activities")
    class ActivityTests {

        @Test
        @DisplayName("should return activities newest first up to the limit")
        void shouldListNewestFirst() {
            for (int i = 1; i <= 3; i++) {
                store.appendActivity(activity("act_" + i, NOW.plusSeconds(i)), 100, 50).await().indefinitely();
            }

            assertThat(activityIds(2), contains("act_3", "act_2"));
        }

        @Test
        @DisplayName("should trim the oldest entries once the cap is exceeded")
        void shouldTrim() {
            for (int i = 1; i <= 5; i++) {
                store.appendActivity(activity("act_" + i, NOW.plusSeconds(i)), 4, 2).await().indefinitely();
            }

            assertThat(activityIds(10), contains("act_5", "act_4"));
        }

        @Test
        @DisplayName("should purge activities older than the cutoff")
        void shouldPurge() {
            store.appendActivity(activity("old", NOW), 100, 50).await().indefinitely();
            store.appendActivity(activity("new", NOW.plus(Duration.ofDays(40))), 100, 50)
                    .await()
                    .indefinitely();

            var purged = store.purgeActivitiesBefore(NOW.plus(Duration.ofDays(10))).await().indefinitely();

            assertEquals(1, purged);
            assertThat(activityIds(10), contains("new"));
        }
    }
}
