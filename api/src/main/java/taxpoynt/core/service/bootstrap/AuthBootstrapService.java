package taxpoynt.core.service.bootstrap;

import java.time.Clock;
import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import taxpoynt.core.config.MaintenanceConfig;
import taxpoynt.core.model.error.ValidationException;
import taxpoynt.core.model.permission.Permission;
import taxpoynt.core.model.permission.Policy;
import taxpoynt.core.model.role.Role;
import taxpoynt.core.model.role.RoleScope;
import taxpoynt.core.service.maintenance.MaintenanceScheduler;
import taxpoynt.core.service.permission.PermissionDefaults;
import taxpoynt.core.service.permission.PermissionEngine;
import taxpoynt.core.service.role.RoleDefaults;
import taxpoynt.core.service.role.RoleManager;
import taxpoynt.core.service.session.SessionService;
import taxpoynt.core.service.token.TokenService;

/**
 * Seeds the built-in permission catalog and roles, and registers the
 * background sweeps with the {@link MaintenanceScheduler}.
 */
@ApplicationScoped
public class AuthBootstrapService {

    private static final Logger LOG = Logger.getLogger(AuthBootstrapService.class);

    static final String TASK_TOKEN_SWEEP = "token_sweep";
    static final String TASK_TOKEN_CACHE_SWEEP = "token_cache_sweep";
    static final String TASK_SESSION_SWEEP = "session_sweep";
    static final String TASK_SECURITY_MONITOR = "security_monitor";
    static final String TASK_ACTIVITY_SWEEP = "activity_sweep";
    static final String TASK_PERMISSION_CACHE_SWEEP = "permission_cache_sweep";

    /**
     * A role granted to a user at startup.
     */
    public record InitialGrant(String userId, String roleId, String tenantId) {}

    /**
     * Counts of what was seeded.
     */
    public record SeedResult(int permissions, int policies, int roles, int assignments) {}

    private final PermissionEngine permissions;
    private final RoleManager roles;
    private final TokenService tokens;
    private final SessionService sessions;
    private final MaintenanceScheduler scheduler;
    private final MaintenanceConfig maintenance;
    private final Clock clock;

    @Inject
    public AuthBootstrapService(
            PermissionEngine permissions,
            RoleManager roles,
            TokenService tokens,
            SessionService sessions,
            MaintenanceScheduler scheduler,
            MaintenanceConfig maintenance,
            Clock clock) {
        this.permissions = permissions;
        this.roles = roles;
        this.tokens = tokens;
        this.sessions = sessions;
        this.scheduler = scheduler;
        this.maintenance = maintenance;
        this.clock = clock;
    }

    /**
     * Store the built-in permissions and policies when {@code catalog} is set,
     * and the built-in roles and {@code grants} when {@code roleDefaults} is set.
     * A grant the user already holds is skipped.
     */
    public Uni<SeedResult> seedDefaults(boolean catalog, boolean roleDefaults, List<InitialGrant> grants) {
        final var now = clock.instant();
        final var defaultPermissions = catalog ? PermissionDefaults.permissions(now) : List.<Permission>of();
        final var defaultPolicies = catalog ? PermissionDefaults.policies(now) : List.<Policy>of();
        final var defaultRoles = roleDefaults ? RoleDefaults.roles() : List.<Role>of();
        final var initialGrants = roleDefaults ? grants : List.<InitialGrant>of();

        return Multi.createFrom()
                .iterable(defaultPermissions)
                .onItem()
                .transformToUniAndConcatenate(permissions::createPermission)
                .collect()
                .asList()
                .chain(() -> Multi.createFrom()
                        .iterable(defaultPolicies)
                        .onItem()
                        .transformToUniAndConcatenate(permissions::createPolicy)
                        .collect()
                        .asList())
                .chain(() -> Multi.createFrom()
                        .iterable(defaultRoles)
                        .onItem()
                        .transformToUniAndConcatenate(roles::defineRole)
                        .collect()
                        .asList())
                .chain(() -> Multi.createFrom()
                        .iterable(initialGrants)
                        .onItem()
                        .transformToUniAndConcatenate(this::grant)
                        .collect()
                        .asList())
                .map(applied -> {
                    final var assignments = (int) applied.stream().filter(Boolean::booleanValue).count();
                    final var result = new SeedResult(
                            defaultPermissions.size(), defaultPolicies.size(), defaultRoles.size(), assignments);
                    LOG.infof(
                            "Seeded %d permissions, %d policies, %d roles and %d role assignments",
                            result.permissions(),
                            result.policies(),
                            result.roles(),
                            result.assignments());
                    return result;
                });
    }

    private Uni<Boolean> grant(InitialGrant grant) {
        return roles.assignRole(grant.userId(), grant.roleId(), RoleScope.GLOBAL, "system", grant.tenantId(), null)
                .map(assignment -> true)
                .onFailure(ValidationException.class)
                .recoverWithItem(e -> {
                    LOG.debugf("Skipped initial grant of %s to %s: %s", grant.roleId(), grant.userId(), e.getMessage());
                    return false;
                });
    }

    /**
     * Register every background sweep at its configured interval.
     */
    public void registerMaintenance() {
        scheduler.register(TASK_TOKEN_SWEEP, maintenance.tokenSweepInterval(), tokens::sweepExpired);
        scheduler.register(TASK_TOKEN_CACHE_SWEEP, maintenance.tokenCacheSweepInterval(), () -> Uni.createFrom()
                .item(() -> {
                    tokens.sweepValidationCache();
                    return 0;
                }));
        scheduler.register(TASK_SESSION_SWEEP, maintenance.sessionSweepInterval(), sessions::sweepExpiredSessions);
        scheduler.register(TASK_SECURITY_MONITOR, maintenance.securityMonitorInterval(), sessions::monitorSecurity);
        scheduler.register(TASK_ACTIVITY_SWEEP, maintenance.activitySweepInterval(), sessions::sweepActivities);
        scheduler.register(
                TASK_PERMISSION_CACHE_SWEEP, maintenance.permissionCacheSweepInterval(), () -> Uni.createFrom()
                        .item(() -> {
                            permissions.sweepCache();
                            return 0;
                        }));
        LOG.infof("Registered maintenance tasks: %s", scheduler.taskNames());
    }
}
