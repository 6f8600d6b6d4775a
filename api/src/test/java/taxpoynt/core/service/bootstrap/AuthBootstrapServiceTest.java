package taxpoynt.core.service.bootstrap;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.empty;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import taxpoynt.core.service.bootstrap.AuthBootstrapService.InitialGrant;
import taxpoynt.core.service.bootstrap.AuthBootstrapService.SeedResult;
import taxpoynt.core.service.permission.PermissionDefaults;
import taxpoynt.core.service.role.RoleDefaults;
import taxpoynt.support.AuthFixture;
import taxpoynt.support.TestConfigs;

@DisplayName("AuthBootstrapService")
class AuthBootstrapServiceTest {

    private AuthFixture fixture;
    private AuthBootstrapService bootstrap;

    @BeforeEach
    void setUp() {
        fixture = new AuthFixture();
        bootstrap = new AuthBootstrapService(
                fixture.permissions,
                fixture.roles,
                fixture.tokens,
                fixture.sessions,
                fixture.scheduler,
                new TestConfigs.TestMaintenanceConfig(),
                fixture.clock);
    }

    private SeedResult seed(boolean catalog, boolean roles, List<InitialGrant> grants) {
        return bootstrap.seedDefaults(catalog, roles, grants).await().indefinitely();
    }

    @Nested
    @DisplayName("seedDefaults")
    class SeedTests {

        @Test
        @DisplayName("should seed the catalog, roles and initial grants")
        void shouldSeedEverything() {
            var result = seed(true, true, List.of(new InitialGrant("user_si_001", "system_integrator", null)));

            assertEquals(PermissionDefaults.permissions(AuthFixture.START).size(), result.permissions());
            assertEquals(PermissionDefaults.policies(AuthFixture.START).size(), result.policies());
            assertEquals(RoleDefaults.roles().size(), result.roles());
            assertEquals(1, result.assignments());
            assertThat(
                    fixture.roles.userRoles("user_si_001", null).await().indefinitely(),
                    containsInAnyOrder("system_integrator"));
            assertTrue(fixture.catalog.findPermission("si:erp:integrate").await().indefinitely().isPresent());
        }

        @Test
        @DisplayName("should skip a grant the user already holds")
        void shouldSkipExistingGrant() {
            var grant = new InitialGrant("user_si_001", "system_integrator", null);
            seed(true, true, List.of(grant));

            var second = seed(false, true, List.of(grant));

            assertEquals(0, second.assignments());
            assertEquals(0, second.permissions());
        }

        @Test
        @DisplayName("should seed nothing when both switches are off")
        void shouldSeedNothing() {
            var result = seed(false, false, List.of(new InitialGrant("user_si_001", "system_integrator", null)));

            assertEquals(new SeedResult(0, 0, 0, 0), result);
            assertThat(fixture.catalog.findAllPermissions().await().indefinitely(), empty());
        }
    }

    @Nested
    @DisplayName("registerMaintenance")
    class MaintenanceTests {

        @Test
        @DisplayName("should register every sweep")
        void shouldRegisterSweeps() {
            bootstrap.registerMaintenance();

            assertThat(
                    fixture.scheduler.taskNames(),
                    contains(
                            AuthBootstrapService.TASK_ACTIVITY_SWEEP,
                            AuthBootstrapService.TASK_PERMISSION_CACHE_SWEEP,
                            AuthBootstrapService.TASK_SECURITY_MONITOR,
                            AuthBootstrapService.TASK_SESSION_SWEEP,
                            AuthBootstrapService.TASK_TOKEN_CACHE_SWEEP,
                            AuthBootstrapService.TASK_TOKEN_SWEEP));
        }

        @Test
        @DisplayName("should run the sweeps that are due")
        void shouldRunDueSweeps() {
            bootstrap.registerMaintenance();

            var ran = fixture.scheduler
                    .tick(AuthFixture.START.plus(Duration.ofMinutes(5)))
                    .await()
                    .indefinitely();

            assertThat(
                    ran,
                    containsInAnyOrder(
                            AuthBootstrapService.TASK_SESSION_SWEEP, AuthBootstrapService.TASK_PERMISSION_CACHE_SWEEP));
        }
    }
}
