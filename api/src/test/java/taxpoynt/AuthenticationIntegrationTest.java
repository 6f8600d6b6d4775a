package taxpoynt;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasItem;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import java.util.Set;

import jakarta.inject.Inject;

import io.quarkus.test.junit.QuarkusTest;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import taxpoynt.adapter.in.health.AuthStorageHealthCheck;
import taxpoynt.adapter.out.auth.DirectoryCredentialVerifier;
import taxpoynt.core.config.MaintenanceConfig;
import taxpoynt.core.model.auth.OperationResult;
import taxpoynt.core.model.role.Role;
import taxpoynt.core.model.role.RoleScope;
import taxpoynt.core.port.in.AuthenticationUseCase;
import taxpoynt.core.port.in.RoleManagement;
import taxpoynt.core.service.maintenance.MaintenanceScheduler;

/**
 * Runs the authentication operations against the application as Quarkus
 * wires it: configuration mappings, store producers, startup seeding and the
 * readiness check.
 */
@QuarkusTest
@DisplayName("Authentication Integration Tests")
public class AuthenticationIntegrationTest {

    @Inject
    AuthenticationUseCase auth;

    @Inject
    RoleManagement roles;

    @Inject
    DirectoryCredentialVerifier directory;

    @Inject
    MaintenanceScheduler scheduler;

    @Inject
    MaintenanceConfig maintenanceConfig;

    @Inject
    @Readiness
    AuthStorageHealthCheck storageHealth;

    private OperationResult handle(String operation, Map<String, Object> payload) {
        return auth.handle(operation, payload).await().indefinitely();
    }

    @SuppressWarnings("unchecked")
    private static List<String> strings(Object value) {
        return (List<String>) value;
    }

    @Test
    @DisplayName("should log in a seeded account after startup")
    void shouldLoginSeededAccount() {
        var login = handle(
                "authenticate",
                Map.of("username", "si_user@company.com", "password", "password", "ip_address", "10.0.0.5"));

        assertTrue(login.success());
        assertEquals("user_si_001", login.data().get("user_id"));
        assertThat(strings(login.data().get("roles")), hasItem("system_integrator"));

        var check = handle(
                "check_permission",
                Map.of("user_id", "user_si_001", "roles", List.of("system_integrator"), "permission_id",
                        "si:invoice:create"));
        assertEquals(true, check.data().get("granted"));
    }

    @Test
    @DisplayName("should authorize only the actions a custom role grants")
    void shouldAuthorizeCustomRole() {
        roles.defineRole(Role.create("it_si_role", "SI Role", RoleScope.GLOBAL, Set.of("si:invoice:create")))
                .await()
                .indefinitely();
        directory.addUser("it_u1", "it_u1@company.com", "tenant_company_003", "pw", Set.of());
        var assigned = handle(
                "assign_role", Map.of("user_id", "it_u1", "role_id", "it_si_role", "assigned_by", "user_admin"));

        var login = handle(
                "authenticate",
                Map.of("username", "it_u1@company.com", "password", "pw", "session_type", "web"));
        var token = (String) login.data().get("access_token");
        var create = handle("authorize", Map.of("token", token, "action", "create", "resource_type", "invoice"));
        var delete = handle("authorize", Map.of("token", token, "action", "delete", "resource_type", "secret"));

        assertTrue(assigned.success());
        assertTrue(login.success());
        assertThat(strings(login.data().get("roles")), hasItem("it_si_role"));
        assertEquals(true, create.data().get("authorized"));
        assertEquals(false, delete.data().get("authorized"));
    }

    @Test
    @DisplayName("should reject bad credentials through the facade")
    void shouldRejectBadCredentials() {
        var result = handle("authenticate", Map.of("username", "si_user@company.com", "password", "nope"));

        assertFalse(result.success());
        assertEquals("Invalid credentials", result.error());
    }

    @Test
    @DisplayName("should map the maintenance settings and skip sweeps when disabled")
    void shouldMapMaintenanceSettings() {
        assertEquals("1m", maintenanceConfig.tickInterval());
        assertFalse(maintenanceConfig.enabled());
        assertTrue(scheduler.taskNames().isEmpty());
    }

    @Test
    @DisplayName("should report the in-memory storage as ready")
    void shouldReportStorageReady() {
        var response = storageHealth.call();

        assertEquals(HealthCheckResponse.Status.UP, response.getStatus());
    }
}
