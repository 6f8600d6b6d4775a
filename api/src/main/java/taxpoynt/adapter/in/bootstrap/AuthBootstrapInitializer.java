package taxpoynt.adapter.in.bootstrap;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;

import io.quarkus.runtime.ShutdownEvent;
import io.quarkus.runtime.StartupEvent;
import org.jboss.logging.Logger;

import taxpoynt.adapter.out.auth.DirectoryCredentialVerifier;
import taxpoynt.core.config.MaintenanceConfig;
import taxpoynt.core.config.PermissionConfig;
import taxpoynt.core.config.RoleConfig;
import taxpoynt.core.service.bootstrap.AuthBootstrapService;
import taxpoynt.core.service.maintenance.MaintenanceScheduler;

/**
 * Seeds the default catalog and starts the background sweeps on startup;
 * stops the sweeps on shutdown.
 *
 * <h2>Failure Behavior</h2>
 * A failure while seeding fails startup.
 */
@ApplicationScoped
public class AuthBootstrapInitializer {

    private static final Logger LOG = Logger.getLogger(AuthBootstrapInitializer.class);

    private final AuthBootstrapService bootstrap;
    private final DirectoryCredentialVerifier directory;
    private final MaintenanceScheduler scheduler;
    private final PermissionConfig permissionConfig;
    private final RoleConfig roleConfig;
    private final MaintenanceConfig maintenanceConfig;

    @Inject
    public AuthBootstrapInitializer(
            AuthBootstrapService bootstrap,
            DirectoryCredentialVerifier directory,
            MaintenanceScheduler scheduler,
            PermissionConfig permissionConfig,
            RoleConfig roleConfig,
            MaintenanceConfig maintenanceConfig) {
        this.bootstrap = bootstrap;
        this.directory = directory;
        this.scheduler = scheduler;
        this.permissionConfig = permissionConfig;
        this.roleConfig = roleConfig;
        this.maintenanceConfig = maintenanceConfig;
    }

    void onStart(@Observes StartupEvent event) {
        if (permissionConfig.seedDefaults() || roleConfig.seedDefaults()) {
            final var grants = directory.users().stream()
                    .flatMap(user -> user.initialRoles().stream()
                            .sorted()
                            .map(role -> new AuthBootstrapService.InitialGrant(user.userId(), role, user.tenantId())))
                    .toList();
            bootstrap.seedDefaults(permissionConfig.seedDefaults(), roleConfig.seedDefaults(), grants)
                    .await()
                    .indefinitely();
        } else {
            LOG.info("Default role and permission seeding is disabled");
        }

        if (maintenanceConfig.enabled()) {
            bootstrap.registerMaintenance();
        } else {
            LOG.info("Background maintenance is disabled");
        }
    }

    void onStop(@Observes ShutdownEvent event) {
        scheduler.shutdown();
    }
}
