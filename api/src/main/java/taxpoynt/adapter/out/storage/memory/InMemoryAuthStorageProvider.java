package taxpoynt.adapter.out.storage.memory;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

import jakarta.enterprise.context.ApplicationScoped;

import org.eclipse.microprofile.health.HealthCheckResponse;
import org.jboss.logging.Logger;

import taxpoynt.core.port.out.PermissionCatalog;
import taxpoynt.core.port.out.RoleStore;
import taxpoynt.core.port.out.SessionStore;
import taxpoynt.core.port.out.TokenStore;
import taxpoynt.spi.AuthStorageProvider;

/**
 * In-memory storage provider; always available, lowest priority.
 *
 * <p><strong>Warning:</strong> state is lost on restart and is not shared
 * between instances.
 */
@ApplicationScoped
public class InMemoryAuthStorageProvider implements AuthStorageProvider {

    private static final Logger LOG = Logger.getLogger(InMemoryAuthStorageProvider.class);
    private static final int PRIORITY = 0;

    private final AtomicBoolean warningLogged = new AtomicBoolean(false);
    private final InMemoryTokenStore tokenStore = new InMemoryTokenStore();
    private final InMemorySessionStore sessionStore = new InMemorySessionStore();
    private final InMemoryPermissionCatalog permissionCatalog = new InMemoryPermissionCatalog();
    private final InMemoryRoleStore roleStore = new InMemoryRoleStore();

    @Override
    public String name() {
        return "memory";
    }

    @Override
    public int priority() {
        return PRIORITY;
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public TokenStore createTokenStore() {
        warnOnce();
        return tokenStore;
    }

    @Override
    public SessionStore createSessionStore() {
        warnOnce();
        return sessionStore;
    }

    @Override
    public PermissionCatalog createPermissionCatalog() {
        return permissionCatalog;
    }

    @Override
    public RoleStore createRoleStore() {
        return roleStore;
    }

    @Override
    public Optional<HealthCheckResponse> healthCheck() {
        return Optional.of(HealthCheckResponse.named("auth-storage-memory")
                .up()
                .withData("type", "in-memory")
                .withData("sessions", sessionStore.sessionCount())
                .withData("permissions", permissionCatalog.permissionCount())
                .build());
    }

    private void warnOnce() {
        if (warningLogged.compareAndSet(false, true)) {
            LOG.warn("========================================================================");
            LOG.warn("  WARNING: Token and session storage is in-memory only!");
            LOG.warn("  Revocations and sessions are lost on restart and not shared");
            LOG.warn("  between instances. Register an AuthStorageProvider for production.");
            LOG.warn("========================================================================");
        }
    }
}
