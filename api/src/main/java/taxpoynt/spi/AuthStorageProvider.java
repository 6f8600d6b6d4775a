package taxpoynt.spi;

import java.util.Optional;

import org.eclipse.microprofile.health.HealthCheckResponse;

import taxpoynt.core.port.out.PermissionCatalog;
import taxpoynt.core.port.out.RoleStore;
import taxpoynt.core.port.out.SessionStore;
import taxpoynt.core.port.out.TokenStore;

/**
 * SPI for authentication storage backends.
 *
 * <p>One provider supplies every store so that token, session, permission and
 * role state live in the same backend.
 *
 * <p>Built-in providers:
 * <ul>
 *   <li>memory (priority: 0) - in-memory storage, always available</li>
 * </ul>
 *
 * <p>Provider selection order:
 * <ol>
 *   <li>Configured provider ({@code taxpoynt.storage.provider})</li>
 *   <li>Highest priority available provider</li>
 * </ol>
 */
public interface AuthStorageProvider {

    /**
     * Name used in {@code taxpoynt.storage.provider}, e.g. {@code memory}.
     */
    String name();

    /**
     * Higher priority providers are preferred when several are available.
     */
    int priority();

    boolean isAvailable();

    /**
     * Each create method returns the same instance on every call.
     *
     * @throws StorageProviderException if the backend cannot be initialized
     */
    TokenStore createTokenStore();

    SessionStore createSessionStore();

    PermissionCatalog createPermissionCatalog();

    RoleStore createRoleStore();

    /**
     * @return health check response, or empty if not supported
     */
    Optional<HealthCheckResponse> healthCheck();
}
