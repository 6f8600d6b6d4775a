package taxpoynt.core.service.auth;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.startsWith;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.verify;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import taxpoynt.core.model.auth.OperationResult;
import taxpoynt.core.model.permission.PermissionEvaluation;
import taxpoynt.core.model.role.Role;
import taxpoynt.core.model.role.RoleScope;
import taxpoynt.core.service.bootstrap.AuthBootstrapService;
import taxpoynt.core.service.permission.PermissionDefaults;
import taxpoynt.support.AuthFixture;
import taxpoynt.support.TestConfigs;

@DisplayName("AuthenticationService")
class AuthenticationServiceTest {

    private static final String BROWSER = "Mozilla/5.0 (X11; Linux x86_64)";
    private static final String SI_USER = "si_user@company.com";

    private AuthFixture fixture;

    @BeforeEach
    void setUp() {
        fixture = new AuthFixture();
        var bootstrap = new AuthBootstrapService(
                fixture.permissions,
                fixture.roles,
                fixture.tokens,
                fixture.sessions,
                fixture.scheduler,
                new TestConfigs.TestMaintenanceConfig(),
                fixture.clock);
        bootstrap
                .seedDefaults(
                        true,
                        true,
                        List.of(
                                new AuthBootstrapService.InitialGrant(
                                        "user_admin", "platform_admin", "tenant_platform"),
                                new AuthBootstrapService.InitialGrant(
                                        "user_si_001", "system_integrator", "tenant_company_001")))
                .await()
                .indefinitely();
    }

    private OperationResult handle(String operation, Map<String, Object> payload) {
        return fixture.auth.handle(operation, payload).await().indefinitely();
    }

    private static Map<String, Object> payload(Object... keysAndValues) {
        var map = new HashMap<String, Object>();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            map.put((String) keysAndValues[i], keysAndValues[i + 1]);
        }
        return map;
    }

    private OperationResult login(String username, Object... extra) {
        var body = payload("username", username, "password", "password", "ip_address", "10.0.0.5", "user_agent",
                BROWSER);
        body.putAll(payload(extra));
        return handle("authenticate", body);
    }

    private static String text(OperationResult result, String key) {
        return (String) result.data().get(key);
    }

    @SuppressWarnings("unchecked")
    private static List<String> strings(Object value) {
        return (List<String>) value;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> info(OperationResult result) {
        return (Map<String, Object>) result.data().get("session_info");
    }

    @Nested
    @DisplayName("authenticate")
    class AuthenticateTests {

        @Test
        @DisplayName("should issue tokens and open a session for valid credentials")
        void shouldAuthenticate() {
            var result = login(SI_USER);

            assertTrue(result.success());
            assertEquals("user_si_001", text(result, "user_id"));
            assertEquals("tenant_company_001", text(result, "tenant_id"));
            assertThat(text(result, "session_id"), startsWith("sess_"));
            assertNotNull(text(result, "access_token"));
            assertNotNull(text(result, "refresh_token"));
            assertEquals("Bearer", text(result, "token_type"));
            assertEquals(List.of("system_integrator"), result.data().get("roles"));
            assertEquals(false, result.data().get("mfa_required"));

            @SuppressWarnings("unchecked")
            var info = (Map<String, Object>) result.data().get("session_info");
            assertEquals("web", info.get("session_type"));
            assertEquals("medium", info.get("security_level"));
            verify(fixture.metrics).recordAuthentication(true);
        }

        @Test
        @DisplayName("should reject an unknown user or a wrong password")
        void shouldRejectBadCredentials() {
            var wrongPassword = handle("authenticate", payload("username", SI_USER, "password", "nope"));
            var unknown = handle("authenticate", payload("username", "ghost@company.com", "password", "password"));

            assertFalse(wrongPassword.success());
            assertEquals("Invalid credentials", wrongPassword.error());
            assertEquals("Invalid credentials", unknown.error());
            assertTrue(wrongPassword.data().isEmpty());
            verify(fixture.metrics, atLeastOnce()).recordAuthentication(false);
        }

        @Test
        @DisplayName("should reject an unknown session type")
        void shouldRejectUnknownSessionType() {
            var result = login(SI_USER, "session_type", "kiosk");

            assertFalse(result.success());
            assertEquals("Invalid session type: kiosk", result.error());
        }

        @Test
        @DisplayName("should report pending MFA under the high security policy")
        void shouldReportPendingMfa() {
            var result = login(SI_USER, "security_policy", "high_security");

            assertTrue(result.success());
            assertEquals(true, result.data().get("mfa_required"));
        }

        @Test
        @DisplayName("should clear pending MFA when a valid code is supplied")
        void shouldVerifyMfaDuringLogin() {
            var result = login(SI_USER, "security_policy", "high_security", "mfa_token", "123456");

            assertTrue(result.success());
            assertEquals(false, result.data().get("mfa_required"));
            @SuppressWarnings("unchecked")
            var info = (Map<String, Object>) result.data().get("session_info");
            assertThat(strings(info.get("flags")), not(hasItem("mfa_required")));
        }

        @Test
        @DisplayName("should report the lowered risk score after MFA during login")
        void shouldReportRiskAfterMfa() {
            var pending = login(SI_USER, "security_policy", "high_security", "ip_address", "198.51.100.7");
            var verified = login(SI_USER, "security_policy", "high_security", "ip_address", "198.51.100.7",
                    "mfa_token", "123456");

            var pendingRisk = (Double) info(pending).get("risk_score");
            var verifiedRisk = (Double) info(verified).get("risk_score");
            assertTrue(pendingRisk > 0.0);
            assertEquals(Math.max(0.0, pendingRisk - 0.3), verifiedRisk, 1e-9);
        }

        @Test
        @DisplayName("should fail and terminate the session when the MFA code is invalid")
        void shouldFailOnInvalidMfa() {
            var result = login(SI_USER, "mfa_token", "abc");
            var sessions = handle("get_user_sessions", payload("user_id", "user_si_001"));

            assertFalse(result.success());
            assertEquals("MFA verification failed", result.error());
            assertEquals(0, sessions.data().get("count"));
        }
    }

    @Nested
    @DisplayName("authorize")
    class AuthorizeTests {

        @Test
        @DisplayName("should authorize a valid access token")
        void shouldAuthorizeToken() {
            var login = login(SI_USER);

            var result = handle("authorize", payload("token", text(login, "access_token")));

            assertTrue(result.success());
            assertEquals(true, result.data().get("authorized"));
            assertEquals("user_si_001", text(result, "user_id"));
            assertEquals(text(login, "session_id"), text(result, "session_id"));
        }

        @Test
        @DisplayName("should authorize an action the user's roles grant")
        void shouldAuthorizeGrantedAction() {
            var login = login(SI_USER);

            var result = handle(
                    "authorize", payload("token", text(login, "access_token"), "action", "integrate", "ip_address",
                            "10.0.0.5"));

            assertTrue(result.success());
            assertEquals(true, result.data().get("authorized"));
        }

        @Test
        @DisplayName("should answer authorized=false for an action the roles do not grant")
        void shouldDenyUngrantedAction() {
            var login = login(SI_USER);

            var result = handle("authorize", payload("token", text(login, "access_token"), "action", "transmit"));

            assertTrue(result.success());
            assertEquals(false, result.data().get("authorized"));
            assertEquals("Insufficient permissions for action: transmit", text(result, "reason"));
            assertEquals(PermissionEvaluation.NO_MATCHING_PERMISSION, text(result, "evaluation_reason"));
        }

        @Test
        @DisplayName("should fail when a required role is missing")
        void shouldFailOnMissingRole() {
            var login = login(SI_USER);

            var result = handle(
                    "authorize", payload("token", text(login, "access_token"), "required_roles", List.of(
                            "platform_admin")));

            assertFalse(result.success());
            assertEquals("Missing required roles: platform_admin", result.error());
        }

        @Test
        @DisplayName("should fail for a malformed token")
        void shouldFailOnMalformedToken() {
            var result = handle("authorize", payload("token", "not-a-jwt"));

            assertFalse(result.success());
            assertEquals("Malformed token", result.error());
        }

        @Test
        @DisplayName("should fail once the token's session has ended")
        void shouldFailWhenSessionEnded() {
            var login = login(SI_USER);
            handle("logout", payload("session_id", text(login, "session_id")));

            var result = handle("authorize", payload("token", text(login, "access_token")));

            assertFalse(result.success());
            assertEquals("Session expired or invalid", result.error());
        }
    }

    @Nested
    @DisplayName("logout")
    class LogoutTests {

        @Test
        @DisplayName("should revoke the token and end its session")
        void shouldLogout() {
            var login = login(SI_USER);

            var result = handle("logout", payload("token", text(login, "access_token")));
            var after = handle("authorize", payload("token", text(login, "access_token")));

            assertTrue(result.success());
            assertEquals("Logged out successfully", text(result, "message"));
            assertFalse(after.success());
            assertEquals("Token has been revoked", after.error());
        }

        @Test
        @DisplayName("should end every session of the user")
        void shouldLogoutAllSessions() {
            var first = login(SI_USER);
            var second = login(SI_USER);

            var result = handle(
                    "logout", payload("token", text(first, "access_token"), "logout_all_sessions", true));
            var secondAfter = handle("authorize", payload("token", text(second, "access_token")));

            assertEquals("Logged out from 2 sessions", text(result, "message"));
            assertFalse(secondAfter.success());
        }

        @Test
        @DisplayName("should report an unknown session")
        void shouldReportUnknownSession() {
            var result = handle("logout", payload("session_id", "sess_missing"));

            assertFalse(result.success());
            assertEquals("Session not found", result.error());
        }
    }

    @Nested
    @DisplayName("refresh_token")
    class RefreshTests {

        @Test
        @DisplayName("should exchange a refresh token for a new access token")
        void shouldRefresh() {
            var login = login(SI_USER);

            var result = handle("refresh_token", payload("refresh_token", text(login, "refresh_token")));
            var validated = handle("validate_token", payload("token", text(result, "access_token")));

            assertTrue(result.success());
            assertNotEquals(text(login, "access_token"), text(result, "access_token"));
            assertEquals("Bearer", text(result, "token_type"));
            assertEquals("user_si_001", text(validated, "user_id"));
            assertEquals(List.of("system_integrator"), validated.data().get("roles"));
        }

        @Test
        @DisplayName("should reject a missing token or an access token")
        void shouldRejectInvalidRefresh() {
            var login = login(SI_USER);

            var missing = handle("refresh_token", payload());
            var access = handle("refresh_token", payload("refresh_token", text(login, "access_token")));

            assertEquals("Invalid refresh token", missing.error());
            assertEquals("Invalid refresh token", access.error());
        }
    }

    @Nested
    @DisplayName("assign_role")
    class AssignRoleTests {

        @Test
        @DisplayName("should assign a role that the next login picks up")
        void shouldAssignRole() {
            var result = handle(
                    "assign_role", payload("user_id", "user_si_001", "role_id", "tenant_admin", "scope", "tenant",
                            "tenant_id", "tenant_company_001", "assigned_by", "user_admin"));
            var login = login(SI_USER);

            assertTrue(result.success());
            assertThat(text(result, "assignment_id"), startsWith("ra_"));
            assertEquals("Role tenant_admin assigned to user user_si_001", text(result, "message"));
            assertThat(strings(login.data().get("roles")), hasItem("tenant_admin"));
        }

        @Test
        @DisplayName("should reject an unknown role, scope or timestamp")
        void shouldRejectInvalidAssignment() {
            var role = handle("assign_role", payload("user_id", "user_si_001", "role_id", "ghost"));
            var scope = handle("assign_role", payload("user_id", "user_si_001", "role_id", "user", "scope", "planet"));
            var timestamp = handle(
                    "assign_role", payload("user_id", "user_si_001", "role_id", "user", "expires_at", "soon"));

            assertEquals("Role not found: ghost", role.error());
            assertEquals("Invalid role scope: planet", scope.error());
            assertEquals("Invalid timestamp: soon", timestamp.error());
        }
    }

    @Nested
    @DisplayName("token operations")
    class TokenOperationTests {

        @Test
        @DisplayName("validate_token should describe a valid token")
        void shouldValidateToken() {
            var login = login(SI_USER);

            var result = handle("validate_token", payload("token", text(login, "access_token")));

            assertTrue(result.success());
            assertEquals(true, result.data().get("valid"));
            assertEquals("access_token", text(result, "token_type"));
            assertEquals(text(login, "session_id"), text(result, "session_id"));
        }

        @Test
        @DisplayName("validate_token should enforce the expected token type")
        void shouldEnforceTokenType() {
            var login = login(SI_USER);

            var mismatch = handle(
                    "validate_token", payload("token", text(login, "access_token"), "token_type", "refresh_token"));
            var unknown = handle("validate_token", payload("token", text(login, "access_token"), "token_type", "x"));

            assertEquals("Expected token type refresh_token, got access_token", mismatch.error());
            assertEquals("Invalid token type: x", unknown.error());
        }

        @Test
        @DisplayName("revoke_token should revoke a token once")
        void shouldRevokeToken() {
            var login = login(SI_USER);
            var token = text(login, "access_token");

            var first = handle("revoke_token", payload("token", token, "revoked_by", "user_admin"));
            var second = handle("revoke_token", payload("token", token));
            var validated = handle("validate_token", payload("token", token));

            assertEquals(true, first.data().get("revoked"));
            assertEquals(false, second.data().get("revoked"));
            assertEquals("Token has been revoked", validated.error());
        }

        @Test
        @DisplayName("revoke_token should require a token")
        void shouldRequireToken() {
            var result = handle("revoke_token", payload());

            assertFalse(result.success());
            assertEquals("Token is required", result.error());
        }
    }

    @Nested
    @DisplayName("session operations")
    class SessionOperationTests {

        @Test
        @DisplayName("verify_mfa should clear pending MFA on a session")
        void shouldVerifyMfa() {
            var login = login(SI_USER, "security_policy", "high_security");
            var sessionId = text(login, "session_id");

            var result = handle("verify_mfa", payload("session_id", sessionId, "mfa_token", "654321"));
            var sessions = handle("get_user_sessions", payload("user_id", "user_si_001"));

            assertTrue(result.success());
            assertEquals(true, result.data().get("verified"));
            @SuppressWarnings("unchecked")
            var listed = (List<Map<String, Object>>) sessions.data().get("sessions");
            assertEquals(true, listed.get(0).get("mfa_verified"));
        }

        @Test
        @DisplayName("verify_mfa should fail for an unknown session or a missing id")
        void shouldFailMfaVerification() {
            var unknown = handle("verify_mfa", payload("session_id", "sess_missing", "mfa_token", "123456"));
            var missing = handle("verify_mfa", payload("mfa_token", "123456"));

            assertEquals("MFA verification failed", unknown.error());
            assertEquals("Session ID is required", missing.error());
        }

        @Test
        @DisplayName("get_user_sessions should list the user's active sessions")
        void shouldListSessions() {
            login(SI_USER);
            login(SI_USER);
            login("admin@taxpoynt.com");

            var result = handle("get_user_sessions", payload("user_id", "user_si_001"));

            assertTrue(result.success());
            assertEquals(2, result.data().get("count"));
        }

        @Test
        @DisplayName("get_user_sessions should require a user id")
        void shouldRequireUserId() {
            var result = handle("get_user_sessions", payload());

            assertEquals("User ID is required", result.error());
        }
    }

    @Nested
    @DisplayName("check_permission")
    class CheckPermissionTests {

        @Test
        @DisplayName("should evaluate a named permission")
        void shouldEvaluatePermission() {
            var result = handle(
                    "check_permission", payload("user_id", "user_si_001", "roles", List.of("system_integrator"),
                            "permission_id", "si:invoice:create"));

            assertTrue(result.success());
            assertEquals(true, result.data().get("granted"));
            assertEquals(List.of(PermissionDefaults.SI_ACCESS_POLICY), result.data().get("matched_policies"));
        }

        @Test
        @DisplayName("should evaluate an action")
        void shouldEvaluateAction() {
            var result = handle(
                    "check_permission", payload("user_id", "user_si_001", "roles", List.of("system_integrator"),
                            "action", "integrate"));

            assertEquals(true, result.data().get("granted"));
            assertEquals("si:erp:integrate", text(result, "permission_id"));
        }

        @Test
        @DisplayName("should require a permission id or an action")
        void shouldRequireTarget() {
            var result = handle("check_permission", payload("user_id", "user_si_001"));

            assertEquals("Either permission_id or action is required", result.error());
        }
    }

    @Nested
    @DisplayName("end to end")
    class EndToEndTests {

        @Test
        @DisplayName("should authorize only the actions a custom role grants")
        void shouldAuthorizeCustomRole() {
            fixture.roles
                    .defineRole(Role.create("si_role", "SI Role", RoleScope.GLOBAL, Set.of("si:invoice:create")))
                    .await()
                    .indefinitely();
            fixture.directory.addUser("u1", "u1@company.com", "tenant_company_003", "pw", Set.of());
            handle("assign_role", payload("user_id", "u1", "role_id", "si_role", "assigned_by", "user_admin"));

            var login = handle(
                    "authenticate", payload("username", "u1@company.com", "password", "pw", "session_type", "web"));
            var token = text(login, "access_token");
            var create = handle(
                    "authorize", payload("token", token, "action", "create", "resource_type", "invoice"));
            var delete = handle(
                    "authorize", payload("token", token, "action", "delete", "resource_type", "secret"));

            assertTrue(login.success());
            assertThat(strings(login.data().get("roles")), hasItem("si_role"));
            assertEquals(true, create.data().get("authorized"));
            assertEquals(false, delete.data().get("authorized"));
        }
    }

    @Nested
    @DisplayName("dispatch")
    class DispatchTests {

        @Test
        @DisplayName("should reject an unknown operation")
        void shouldRejectUnknownOperation() {
            var result = handle("fly", payload());

            assertFalse(result.success());
            assertEquals("Unknown operation: fly", result.error());
            assertEquals(Map.of("success", false, "error", "Unknown operation: fly"), result.toMap());
        }

        @Test
        @DisplayName("should treat a null payload as empty")
        void shouldAcceptNullPayload() {
            var result = handle("authenticate", null);

            assertFalse(result.success());
            assertEquals("Invalid credentials", result.error());
        }
    }
}
