package taxpoynt.adapter.out.storage;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;

import taxpoynt.core.port.out.PermissionCatalog;
import taxpoynt.core.port.out.RoleStore;
import taxpoynt.core.port.out.SessionStore;
import taxpoynt.core.port.out.TokenStore;
import taxpoynt.core.service.storage.AuthStorageProviderRegistry;

/**
 * CDI producer for the storage ports, backed by the provider the
 * {@link AuthStorageProviderRegistry} selects.
 *
 * @see taxpoynt.spi.AuthStorageProvider
 */
@ApplicationScoped
public class AuthStoreProducer {

    private final AuthStorageProviderRegistry registry;

    @Inject
    public AuthStoreProducer(AuthStorageProviderRegistry registry) {
        this.registry = registry;
    }

    @Produces
    @ApplicationScoped
    public TokenStore tokenStore() {
        return registry.selectedProvider().createTokenStore();
    }

    @Produces
    @ApplicationScoped
    public SessionStore sessionStore() {
        return registry.selectedProvider().createSessionStore();
    }

    @Produces
    @ApplicationScoped
    public PermissionCatalog permissionCatalog() {
        return registry.selectedProvider().createPermissionCatalog();
    }

    @Produces
    @ApplicationScoped
    public RoleStore roleStore() {
        return registry.selectedProvider().createRoleStore();
    }
}
