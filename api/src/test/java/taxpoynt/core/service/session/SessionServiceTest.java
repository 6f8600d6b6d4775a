package taxpoynt.core.service.session;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.hasItem;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.verify;

import java.time.Duration;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import taxpoynt.core.model.error.SecurityViolationException;
import taxpoynt.core.model.session.CreateSessionRequest;
import taxpoynt.core.model.session.DeviceType;
import taxpoynt.core.model.session.SecurityLevel;
import taxpoynt.core.model.session.SecurityPolicy;
import taxpoynt.core.model.session.Session;
import taxpoynt.core.model.session.SessionActivity;
import taxpoynt.core.model.session.SessionKind;
import taxpoynt.support.AuthFixture;

@DisplayName("SessionService")
class SessionServiceTest {

    private static final String BROWSER = "Mozilla/5.0 (X11; Linux x86_64)";

    private AuthFixture fixture;
    private SessionService sessions;

    @BeforeEach
    void setUp() {
        fixture = new AuthFixture();
        sessions = fixture.sessions;
    }

    private Session create(CreateSessionRequest request) {
        return sessions.create(request).await().indefinitely();
    }

    private Session createFor(String userId) {
        return create(CreateSessionRequest.of(userId, SessionKind.WEB).withClient("10.0.0.5", BROWSER));
    }

    private Session current(String sessionId) {
        return sessions.get(sessionId).await().indefinitely().orElseThrow();
    }

    @Nested
    @DisplayName("create")
    class CreateTests {

        @Test
        @DisplayName("should open a session under the standard policy")
        void shouldOpenStandardSession() {
            var session = create(CreateSessionRequest.of("user-1", SessionKind.API)
                    .withClient("10.0.0.5", BROWSER)
                    .withIdentity("tenant-1", Set.of("system_integrator"), Set.of("si:invoice:view")));

            assertTrue(session.id().startsWith("sess_"));
            assertEquals(SessionKind.API, session.kind());
            assertEquals(SecurityPolicy.STANDARD, session.policyName());
            assertEquals(SecurityLevel.MEDIUM, session.securityLevel());
            assertEquals(AuthFixture.START.plus(Duration.ofMinutes(30)), session.expiresAt());
            assertEquals(0.0, session.riskScore());
            assertTrue(session.flags().isEmpty());
            assertEquals("tenant-1", current(session.id()).tenantId());
            verify(fixture.metrics).recordSessionCreated("api");
        }

        @Test
        @DisplayName("should log a session_created activity")
        void shouldLogCreatedActivity() {
            var session = createFor("user-1");

            var activities = sessions.sessionActivities(session.id(), 10).await().indefinitely();

            assertEquals(1, activities.size());
            assertEquals(SessionActivity.SESSION_CREATED, activities.get(0).type());
            assertEquals("medium", activities.get(0).details().get("security_level"));
        }

        @Test
        @DisplayName("should score an unknown device on an untrusted network")
        void shouldScoreUnknownDeviceOnUntrustedNetwork() {
            var session = create(CreateSessionRequest.of("user-1", SessionKind.MOBILE)
                    .withClient("203.0.113.7", BROWSER)
                    .withDevice("device-1", DeviceType.UNKNOWN));

            assertEquals(0.7, session.riskScore(), 1e-9);
            var devices = sessions.userDevices("user-1").await().indefinitely();
            assertEquals(1, devices.size());
            assertFalse(devices.get(0).trusted());
        }

        @Test
        @DisplayName("should apply high security flags for an untrusted device")
        void shouldApplyHighSecurityFlags() {
            var session = create(CreateSessionRequest.of("user-1", SessionKind.WEB)
                    .withClient("10.0.0.5", BROWSER)
                    .withDevice("device-1", DeviceType.DESKTOP_APP)
                    .withPolicy(SecurityPolicy.HIGH_SECURITY));

            assertEquals(SecurityLevel.HIGH, session.securityLevel());
            assertThat(
                    session.flags(),
                    containsInAnyOrder(Session.FLAG_MFA_REQUIRED, Session.FLAG_DEVICE_VERIFICATION_REQUIRED));
            assertEquals(AuthFixture.START.plus(Duration.ofMinutes(15)), session.expiresAt());
        }

        @Test
        @DisplayName("should fall back to the default policy for an unknown name")
        void shouldFallBackToDefaultPolicy() {
            var session = create(CreateSessionRequest.of("user-1", SessionKind.WEB).withPolicy("nonexistent"));

            assertEquals(SecurityPolicy.STANDARD, session.policyName());
        }

        @Test
        @DisplayName("should refuse a suspicious IP and store nothing")
        void shouldRefuseSuspiciousIp() {
            fixture.watchlist.addSuspiciousIp("198.51.100.0/24");

            var error = assertThrows(
                    SecurityViolationException.class,
                    () -> create(CreateSessionRequest.of("user-1", SessionKind.WEB).withClient("198.51.100.9", BROWSER)));

            assertEquals("Access denied from suspicious IP: 198.51.100.9", error.getMessage());
            assertEquals(0, fixture.sessionStore.sessionCount());
            verify(fixture.metrics).recordSecurityViolation("suspicious_ip");
        }

        @Test
        @DisplayName("should refuse a blocked user agent")
        void shouldRefuseBlockedUserAgent() {
            fixture.watchlist.blockUserAgent("sqlmap");

            var error = assertThrows(
                    SecurityViolationException.class,
                    () -> create(CreateSessionRequest.of("user-1", SessionKind.WEB)
                            .withClient("10.0.0.5", "SQLMap/1.7")));

            assertEquals("Access denied: blocked user agent", error.getMessage());
        }

        @Test
        @DisplayName("should evict the oldest session past the concurrent limit")
        void shouldEvictOldestSession() {
            sessions.definePolicy(new SecurityPolicy(
                    "pair",
                    Duration.ofMinutes(30),
                    Duration.ofHours(8),
                    2,
                    false,
                    false,
                    null,
                    null,
                    0.7,
                    SecurityLevel.MEDIUM));
            var request = CreateSessionRequest.of("user-1", SessionKind.WEB).withPolicy("pair");
            var first = create(request);
            fixture.clock.advance(Duration.ofSeconds(1));
            var second = create(request);
            fixture.clock.advance(Duration.ofSeconds(1));
            var third = create(request);

            var live = sessions.userSessions("user-1", true).await().indefinitely();

            assertThat(live.stream().map(Session::id).toList(), contains(second.id(), third.id()));
            assertTrue(sessions.get(first.id()).await().indefinitely().isEmpty());
            verify(fixture.metrics).recordSessionTerminated(SessionService.REASON_CONCURRENT_LIMIT);
        }
    }

    @Nested
    @DisplayName("get")
    class GetTests {

        @Test
        @DisplayName("should expire an idle session on read")
        void shouldExpireIdleSession() {
            var session = createFor("user-1");

            fixture.clock.advance(Duration.ofMinutes(30));

            assertTrue(sessions.get(session.id()).await().indefinitely().isEmpty());
            assertEquals(0, fixture.sessionStore.sessionCount());
            verify(fixture.metrics).recordSessionTerminated(SessionService.REASON_EXPIRED);
        }

        @Test
        @DisplayName("should return empty for a blank or unknown id")
        void shouldReturnEmptyForUnknownId() {
            assertTrue(sessions.get(null).await().indefinitely().isEmpty());
            assertTrue(sessions.get("sess_unknown").await().indefinitely().isEmpty());
        }
    }

    @Nested
    @DisplayName("updateActivity")
    class UpdateActivityTests {

        @Test
        @DisplayName("should slide the idle expiry")
        void shouldSlideIdleExpiry() {
            var session = createFor("user-1");
            fixture.clock.advance(Duration.ofMinutes(20));

            assertTrue(sessions.updateActivity(session.id(), null, null, Map.of("page", "invoices"))
                    .await()
                    .indefinitely());

            fixture.clock.advance(Duration.ofMinutes(20));
            var refreshed = current(session.id());
            assertEquals(AuthFixture.START.plus(Duration.ofMinutes(50)), refreshed.expiresAt());
        }

        @Test
        @DisplayName("should never extend beyond the absolute timeout")
        void shouldRespectAbsoluteTimeout() {
            var session = createFor("user-1");
            for (var i = 0; i < 16; i++) {
                fixture.clock.advance(Duration.ofMinutes(29));
                sessions.updateActivity(session.id(), null, null, Map.of()).await().indefinitely();
            }

            var refreshed = current(session.id());
            assertEquals(AuthFixture.START.plus(Duration.ofHours(8)), refreshed.expiresAt());

            fixture.clock.set(AuthFixture.START.plus(Duration.ofHours(8)));
            assertFalse(sessions.updateActivity(session.id(), null, null, Map.of()).await().indefinitely());
        }

        @Test
        @DisplayName("should raise risk on an IP change")
        void shouldRaiseRiskOnIpChange() {
            var session = createFor("user-1");

            sessions.updateActivity(session.id(), "10.0.0.6", BROWSER, Map.of()).await().indefinitely();

            var updated = current(session.id());
            assertEquals(0.3, updated.riskScore(), 1e-9);
            assertEquals("10.0.0.6", updated.ipAddress());
            assertFalse(updated.hasFlag(Session.FLAG_HIGH_RISK));
        }

        @Test
        @DisplayName("should flag a high-risk IP change and log it")
        void shouldFlagHighRiskIpChange() {
            var session = create(CreateSessionRequest.of("user-1", SessionKind.WEB)
                    .withClient("203.0.113.7", BROWSER)
                    .withDevice("device-1", DeviceType.UNKNOWN));
            fixture.watchlist.addSuspiciousIp("198.51.100.9");

            sessions.updateActivity(session.id(), "198.51.100.9", BROWSER, Map.of()).await().indefinitely();

            var updated = current(session.id());
            assertEquals(1.0, updated.riskScore(), 1e-9);
            assertTrue(updated.hasFlag(Session.FLAG_HIGH_RISK));
            var types = sessions.sessionActivities(session.id(), 10).await().indefinitely().stream()
                    .map(SessionActivity::type)
                    .toList();
            assertThat(types, contains(
                    SessionActivity.ACTIVITY_UPDATE,
                    SessionActivity.IP_CHANGE_DETECTED,
                    SessionActivity.SESSION_CREATED));
        }

        @Test
        @DisplayName("should log a typed activity")
        void shouldLogTypedActivity() {
            var session = createFor("user-1");

            sessions.updateActivity(session.id(), "action_create", null, null, Map.of("resource", "invoice"))
                    .await()
                    .indefinitely();

            var latest = sessions.sessionActivities(session.id(), 1).await().indefinitely().get(0);
            assertEquals("action_create", latest.type());
            assertEquals("invoice", latest.details().get("resource"));
        }

        @Test
        @DisplayName("should trim the activity log once it overflows")
        void shouldTrimActivityLog() {
            fixture.sessionConfig.maxActivities = 10;
            var session = createFor("user-1");
            for (var i = 0; i < 10; i++) {
                sessions.updateActivity(session.id(), null, null, Map.of()).await().indefinitely();
            }

            assertEquals(5, sessions.sessionActivities(session.id(), 100).await().indefinitely().size());
        }
    }

    @Nested
    @DisplayName("terminate")
    class TerminateTests {

        @Test
        @DisplayName("should terminate once")
        void shouldTerminateOnce() {
            var session = createFor("user-1");

            assertTrue(sessions.terminate(session.id(), "logout", "user-1").await().indefinitely());
            assertFalse(sessions.terminate(session.id(), "logout", "user-1").await().indefinitely());
            assertTrue(sessions.get(session.id()).await().indefinitely().isEmpty());

            var latest = sessions.sessionActivities(session.id(), 1).await().indefinitely().get(0);
            assertEquals(SessionActivity.SESSION_TERMINATED, latest.type());
            assertEquals("logout", latest.details().get("reason"));
        }

        @Test
        @DisplayName("should terminate every session of a user except one")
        void shouldTerminateAllExceptOne() {
            var keep = createFor("user-1");
            fixture.clock.advance(Duration.ofSeconds(1));
            createFor("user-1");
            fixture.clock.advance(Duration.ofSeconds(1));
            createFor("user-1");
            var other = createFor("user-2");

            var count = sessions.terminateAllForUser("user-1", keep.id(), "logout_all", "user-1")
                    .await()
                    .indefinitely();

            assertEquals(2, count);
            assertThat(
                    sessions.userSessions("user-1", true).await().indefinitely().stream()
                            .map(Session::id)
                            .toList(),
                    contains(keep.id()));
            assertTrue(sessions.get(other.id()).await().indefinitely().isPresent());
        }
    }

    @Nested
    @DisplayName("verifyMfa")
    class VerifyMfaTests {

        @Test
        @DisplayName("should clear the MFA flag and lower risk on a valid code")
        void shouldClearFlagOnValidCode() {
            var session = create(CreateSessionRequest.of("user-1", SessionKind.WEB)
                    .withClient("203.0.113.7", BROWSER)
                    .withDevice("device-1", DeviceType.UNKNOWN)
                    .withPolicy(SecurityPolicy.HIGH_SECURITY));

            assertTrue(sessions.verifyMfa(session.id(), "123456").await().indefinitely());

            var updated = current(session.id());
            assertTrue(updated.mfaVerified());
            assertFalse(updated.hasFlag(Session.FLAG_MFA_REQUIRED));
            assertEquals(0.4, updated.riskScore(), 1e-9);
            var latest = sessions.sessionActivities(session.id(), 1).await().indefinitely().get(0);
            assertEquals(SessionActivity.MFA_VERIFIED, latest.type());
        }

        @Test
        @DisplayName("should leave the session unchanged on an invalid code")
        void shouldLeaveSessionOnInvalidCode() {
            var session = create(CreateSessionRequest.of("user-1", SessionKind.WEB)
                    .withClient("10.0.0.5", BROWSER)
                    .withPolicy(SecurityPolicy.HIGH_SECURITY));

            assertFalse(sessions.verifyMfa(session.id(), "12ab").await().indefinitely());

            var unchanged = current(session.id());
            assertFalse(unchanged.mfaVerified());
            assertTrue(unchanged.hasFlag(Session.FLAG_MFA_REQUIRED));
        }

        @Test
        @DisplayName("should refuse an unknown session")
        void shouldRefuseUnknownSession() {
            assertFalse(sessions.verifyMfa("sess_unknown", "123456").await().indefinitely());
        }
    }

    @Nested
    @DisplayName("devices")
    class DeviceTests {

        @Test
        @DisplayName("should lower the risk of later sessions once a device is trusted")
        void shouldLowerRiskForTrustedDevice() {
            var request = CreateSessionRequest.of("user-1", SessionKind.WEB)
                    .withClient("10.0.0.5", BROWSER)
                    .withDevice("laptop", DeviceType.DESKTOP_APP);
            var before = create(request);

            var trusted = sessions.trustDevice("laptop", true).await().indefinitely();
            var after = create(request);

            assertTrue(trusted.orElseThrow().trusted());
            assertEquals(0.3, before.riskScore(), 1e-9);
            assertEquals(0.0, after.riskScore(), 1e-9);
        }

        @Test
        @DisplayName("should report an unknown device")
        void shouldReportUnknownDevice() {
            assertTrue(sessions.trustDevice("missing", true).await().indefinitely().isEmpty());
        }
    }

    @Nested
    @DisplayName("maintenance")
    class MaintenanceTests {

        @Test
        @DisplayName("should sweep sessions past their expiry")
        void shouldSweepExpiredSessions() {
            createFor("user-1");
            createFor("user-2");
            fixture.clock.advance(Duration.ofMinutes(10));
            var fresh = createFor("user-3");
            fixture.clock.advance(Duration.ofMinutes(25));

            assertEquals(2, sessions.sweepExpiredSessions().await().indefinitely());
            assertEquals(1, fixture.sessionStore.sessionCount());
            assertTrue(sessions.get(fresh.id()).await().indefinitely().isPresent());
        }

        @Test
        @DisplayName("should flag high-risk sessions once")
        void shouldFlagHighRiskSessionsOnce() {
            var session = create(CreateSessionRequest.of("user-1", SessionKind.WEB)
                    .withClient("203.0.113.7", "crawler/1.0")
                    .withDevice("device-1", DeviceType.UNKNOWN));

            assertEquals(1, sessions.monitorSecurity().await().indefinitely());
            assertEquals(0, sessions.monitorSecurity().await().indefinitely());
            assertTrue(current(session.id()).hasFlag(Session.FLAG_HIGH_RISK));
            verify(fixture.metrics).recordSecurityViolation("high_risk_session");
        }

        @Test
        @DisplayName("should purge activities older than the retention window")
        void shouldPurgeOldActivities() {
            var session = createFor("user-1");
            sessions.terminate(session.id(), "logout", "user-1").await().indefinitely();

            fixture.clock.advance(Duration.ofDays(31));

            assertEquals(2, sessions.sweepActivities().await().indefinitely());
            assertTrue(sessions.sessionActivities(session.id(), 10).await().indefinitely().isEmpty());
        }

        @Test
        @DisplayName("should count live sessions by kind")
        void shouldCountLiveSessions() {
            createFor("user-1");
            create(CreateSessionRequest.of("user-1", SessionKind.API));
            createFor("user-2");

            var stats = sessions.statistics().await().indefinitely();

            assertEquals(3, stats.activeSessions());
            assertEquals(2, stats.activeUsers());
            assertEquals(2, stats.byKind().get(SessionKind.WEB));
            assertThat(stats.byKind().keySet(), hasItem(SessionKind.API));
        }
    }
}
