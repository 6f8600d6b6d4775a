package taxpoynt.support;

import static org.mockito.Mockito.mock;

import java.time.Instant;
import java.util.List;

import com.fasterxml.jackson.databind.ObjectMapper;

import taxpoynt.adapter.out.auth.DirectoryCredentialVerifier;
import taxpoynt.adapter.out.auth.JoseJwtCodec;
import taxpoynt.adapter.out.auth.NumericCodeMfaVerifier;
import taxpoynt.adapter.out.storage.memory.InMemoryPermissionCatalog;
import taxpoynt.adapter.out.storage.memory.InMemoryRoleStore;
import taxpoynt.adapter.out.storage.memory.InMemorySessionStore;
import taxpoynt.adapter.out.storage.memory.InMemoryTokenStore;
import taxpoynt.core.port.out.AuthMetrics;
import taxpoynt.core.service.auth.AuthenticationService;
import taxpoynt.core.service.maintenance.MaintenanceScheduler;
import taxpoynt.core.service.permission.ConditionEvaluator;
import taxpoynt.core.service.permission.PermissionEngine;
import taxpoynt.core.service.permission.PermissionPatternMatcher;
import taxpoynt.core.service.role.RoleManager;
import taxpoynt.core.service.session.RiskEngine;
import taxpoynt.core.service.session.SecurityWatchlist;
import taxpoynt.core.service.session.SessionIdGenerator;
import taxpoynt.core.service.session.SessionService;
import taxpoynt.core.service.token.KeyManager;
import taxpoynt.core.service.token.TokenService;

/**
 * The full authentication stack wired over in-memory stores, an HS256 key and
 * a clock the test controls.
 */
public class AuthFixture {

    /** A weekday morning in UTC, outside the off-hours window. */
    public static final Instant START = Instant.parse("2025-01-15T10:00:00Z");

    public final MutableClock clock = new MutableClock(START);
    public final AuthMetrics metrics = mock(AuthMetrics.class);
    public final TestConfigs.TestTokenConfig tokenConfig = new TestConfigs.TestTokenConfig();
    public final TestConfigs.TestSessionConfig sessionConfig = new TestConfigs.TestSessionConfig();

    public final InMemoryTokenStore tokenStore = new InMemoryTokenStore();
    public final InMemorySessionStore sessionStore = new InMemorySessionStore();
    public final InMemoryPermissionCatalog catalog = new InMemoryPermissionCatalog();
    public final InMemoryRoleStore roleStore = new InMemoryRoleStore();

    public final KeyManager keyManager;
    public final TokenService tokens;
    public final SecurityWatchlist watchlist;
    public final SessionService sessions;
    public final PermissionEngine permissions;
    public final RoleManager roles;
    public final DirectoryCredentialVerifier directory = new DirectoryCredentialVerifier();
    public final AuthenticationService auth;
    public final MaintenanceScheduler scheduler;

    public AuthFixture() {
        keyManager = new KeyManager(tokenConfig, clock);
        tokens = new TokenService(tokenStore, keyManager, new JoseJwtCodec(), tokenConfig, metrics, clock);
        watchlist = new SecurityWatchlist(sessionConfig);
        sessions = new SessionService(
                sessionStore,
                new RiskEngine(sessionConfig),
                watchlist,
                new NumericCodeMfaVerifier(),
                new SessionIdGenerator(),
                sessionConfig,
                metrics,
                clock);
        permissions = new PermissionEngine(
                catalog,
                new PermissionPatternMatcher(),
                new ConditionEvaluator(List.of()),
                metrics,
                new TestConfigs.TestPermissionConfig());
        roles = new RoleManager(roleStore, permissions, new TestConfigs.TestRoleConfig(), clock);
        auth = new AuthenticationService(directory, tokens, sessions, permissions, roles, metrics, new ObjectMapper());
        scheduler = new MaintenanceScheduler(clock);
    }
}
