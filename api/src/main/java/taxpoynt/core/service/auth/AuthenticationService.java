package taxpoynt.core.service.auth;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import taxpoynt.core.model.auth.AuthRequests;
import taxpoynt.core.model.auth.OperationResult;
import taxpoynt.core.model.auth.UserIdentity;
import taxpoynt.core.model.error.AuthException;
import taxpoynt.core.model.error.AuthenticationException;
import taxpoynt.core.model.error.ValidationException;
import taxpoynt.core.model.permission.PermissionContext;
import taxpoynt.core.model.permission.PermissionEvaluation;
import taxpoynt.core.model.permission.ResourceType;
import taxpoynt.core.model.role.RoleScope;
import taxpoynt.core.model.session.CreateSessionRequest;
import taxpoynt.core.model.session.DeviceType;
import taxpoynt.core.model.session.Session;
import taxpoynt.core.model.session.SessionKind;
import taxpoynt.core.model.token.IssueTokenRequest;
import taxpoynt.core.model.token.TokenClaims;
import taxpoynt.core.model.token.TokenKind;
import taxpoynt.core.model.token.TokenValidationResult;
import taxpoynt.core.model.token.ValidationCriteria;
import taxpoynt.core.port.in.AuthenticationUseCase;
import taxpoynt.core.port.in.RoleManagement;
import taxpoynt.core.port.in.SessionManagement;
import taxpoynt.core.port.in.TokenManagement;
import taxpoynt.core.port.out.AuthMetrics;
import taxpoynt.core.port.out.CredentialVerifier;
import taxpoynt.core.service.permission.PermissionEngine;

/**
 * Login, authorization, logout, refresh and role assignment composed from the
 * token, session, permission and role services.
 *
 * <p>Operations are dispatched by name with a map payload; every failure is
 * returned as an unsuccessful {@link OperationResult}.
 */
@ApplicationScoped
public class AuthenticationService implements AuthenticationUseCase {

    private static final Logger LOG = Logger.getLogger(AuthenticationService.class);

    static final String OP_AUTHENTICATE = "authenticate";
    static final String OP_AUTHORIZE = "authorize";
    static final String OP_LOGOUT = "logout";
    static final String OP_REFRESH_TOKEN = "refresh_token";
    static final String OP_ASSIGN_ROLE = "assign_role";
    static final String OP_VALIDATE_TOKEN = "validate_token";
    static final String OP_REVOKE_TOKEN = "revoke_token";
    static final String OP_VERIFY_MFA = "verify_mfa";
    static final String OP_GET_USER_SESSIONS = "get_user_sessions";
    static final String OP_CHECK_PERMISSION = "check_permission";

    static final String REASON_MFA_FAILED = "mfa_failed";
    static final String REASON_USER_LOGOUT = "user_logout";
    static final String REASON_USER_LOGOUT_ALL = "user_logout_all";
    private static final String TOKEN_TYPE_BEARER = "Bearer";

    private final CredentialVerifier credentials;
    private final TokenManagement tokens;
    private final SessionManagement sessions;
    private final PermissionEngine permissions;
    private final RoleManagement roles;
    private final AuthMetrics metrics;
    private final ObjectMapper objectMapper;

    @Inject
    public AuthenticationService(
            CredentialVerifier credentials,
            TokenManagement tokens,
            SessionManagement sessions,
            PermissionEngine permissions,
            RoleManagement roles,
            AuthMetrics metrics,
            ObjectMapper objectMapper) {
        this.credentials = credentials;
        this.tokens = tokens;
        this.sessions = sessions;
        this.permissions = permissions;
        this.roles = roles;
        this.metrics = metrics;
        this.objectMapper = objectMapper;
    }

    @Override
    public Uni<OperationResult> handle(String operation, Map<String, Object> payload) {
        final var body = payload != null ? payload : Map.<String, Object>of();
        return Uni.createFrom()
                .deferred(() -> dispatch(operation, body))
                .onFailure()
                .recoverWithItem(e -> failure(operation, e));
    }

    private Uni<OperationResult> dispatch(String operation, Map<String, Object> payload) {
        if (operation == null) {
            return Uni.createFrom().item(OperationResult.failure("Unknown operation: null"));
        }
        return switch (operation) {
            case OP_AUTHENTICATE -> authenticate(read(payload, AuthRequests.Authenticate.class));
            case OP_AUTHORIZE -> authorize(read(payload, AuthRequests.Authorize.class));
            case OP_LOGOUT -> logout(read(payload, AuthRequests.Logout.class));
            case OP_REFRESH_TOKEN -> refresh(read(payload, AuthRequests.Refresh.class));
            case OP_ASSIGN_ROLE -> assignRole(read(payload, AuthRequests.AssignRole.class));
            case OP_VALIDATE_TOKEN -> validateToken(read(payload, AuthRequests.ValidateToken.class));
            case OP_REVOKE_TOKEN -> revokeToken(read(payload, AuthRequests.RevokeToken.class));
            case OP_VERIFY_MFA -> verifyMfa(read(payload, AuthRequests.VerifyMfa.class));
            case OP_GET_USER_SESSIONS -> userSessions(read(payload, AuthRequests.UserSessions.class));
            case OP_CHECK_PERMISSION -> checkPermission(read(payload, AuthRequests.CheckPermission.class));
            default -> Uni.createFrom().item(OperationResult.failure("Unknown operation: " + operation));
        };
    }

    // authenticate

    Uni<OperationResult> authenticate(AuthRequests.Authenticate request) {
        final var kind = request.sessionType() == null || request.sessionType().isBlank()
                ? SessionKind.WEB
                : SessionKind.fromWireName(request.sessionType())
                        .orElseThrow(() -> new ValidationException("Invalid session type: " + request.sessionType()));

        return credentials.verify(request.username(), request.password())
                .map(user -> user.orElseThrow(() -> new AuthenticationException("Invalid credentials")))
                .onFailure()
                .invoke(e -> metrics.recordAuthentication(false))
                .flatMap(user -> roles.userRoles(user.userId(), user.tenantId())
                        .flatMap(userRoles -> permissions.getUserPermissions(userRoles, null)
                                .flatMap(userPermissions -> {
                                    final var sessionRequest = new CreateSessionRequest(
                                            user.userId(),
                                            kind,
                                            request.ipAddress(),
                                            request.userAgent(),
                                            request.deviceId(),
                                            DeviceType.fromWireName(request.deviceType()),
                                            user.tenantId(),
                                            userRoles,
                                            userPermissions,
                                            request.securityPolicy());
                                    return sessions.create(sessionRequest)
                                            .flatMap(session -> completeLogin(
                                                    user, session, userRoles, userPermissions, request));
                                })));
    }

    private Uni<OperationResult> completeLogin(
            UserIdentity user,
            Session session,
            Set<String> userRoles,
            Set<String> userPermissions,
            AuthRequests.Authenticate request) {
        final Uni<Session> current;
        if (request.mfaToken() != null && !request.mfaToken().isBlank()) {
            current = sessions.verifyMfa(session.id(), request.mfaToken()).flatMap(verified -> {
                if (verified) {
                    // reload to pick up the cleared flag and lowered risk
                    return sessions.get(session.id()).map(found -> found.orElse(session));
                }
                metrics.recordAuthentication(false);
                return sessions.terminate(session.id(), REASON_MFA_FAILED, user.userId())
                        .onItem()
                        .transformToUni(terminated -> Uni.createFrom()
                                .<Session>failure(new AuthenticationException("MFA verification failed")));
            });
        } else {
            current = Uni.createFrom().item(session);
        }

        return current.flatMap(active -> {
            final var base = IssueTokenRequest.builder(user.userId(), TokenKind.ACCESS)
                    .roles(userRoles)
                    .permissions(userPermissions)
                    .tenantId(user.tenantId())
                    .sessionId(active.id())
                    .origin(request.ipAddress(), request.userAgent(), request.deviceId());
            final var refresh = IssueTokenRequest.builder(user.userId(), TokenKind.REFRESH)
                    .roles(userRoles)
                    .permissions(userPermissions)
                    .tenantId(user.tenantId())
                    .sessionId(active.id())
                    .origin(request.ipAddress(), request.userAgent(), request.deviceId());

            return tokens.issue(base.build())
                    .flatMap(accessToken -> tokens.issue(refresh.build()).map(refreshToken -> {
                        final var mfaRequired = active.hasFlag(Session.FLAG_MFA_REQUIRED);
                        final var data = new LinkedHashMap<String, Object>();
                        data.put("user_id", user.userId());
                        data.put("tenant_id", user.tenantId());
                        data.put("session_id", active.id());
                        data.put("access_token", accessToken);
                        data.put("refresh_token", refreshToken);
                        data.put("token_type", TOKEN_TYPE_BEARER);
                        data.put("expires_at", active.expiresAt().toString());
                        data.put("roles", sorted(userRoles));
                        data.put("permissions", sorted(userPermissions));
                        data.put("mfa_required", mfaRequired);
                        data.put("session_info", sessionInfo(active));

                        metrics.recordAuthentication(true);
                        LOG.infof("User %s authenticated, session %s", user.userId(), active.id());
                        return OperationResult.success(data);
                    }));
        });
    }

    private static Map<String, Object> sessionInfo(Session session) {
        final var flags = new TreeSet<>(session.flags());
        final var info = new LinkedHashMap<String, Object>();
        info.put("session_type", session.kind().wireName());
        info.put("expires_at", session.expiresAt().toString());
        info.put("risk_score", session.riskScore());
        info.put("security_level", session.securityLevel().name().toLowerCase(Locale.ROOT));
        info.put("flags", new ArrayList<>(flags));
        return info;
    }

    // authorize

    Uni<OperationResult> authorize(AuthRequests.Authorize request) {
        final var criteria = new ValidationCriteria(
                TokenKind.ACCESS, request.requiredPermissions(), request.requiredRoles());
        return tokens.validate(request.token(), criteria).flatMap(result -> {
            if (result instanceof TokenValidationResult.Invalid invalid) {
                return Uni.createFrom().item(OperationResult.failure(invalid.error()));
            }
            final var claims = ((TokenValidationResult.Valid) result).claims();
            return checkSession(claims, request).flatMap(sessionOk -> {
                if (!sessionOk) {
                    return Uni.createFrom().item(OperationResult.failure("Session expired or invalid"));
                }
                if (request.action() == null || request.action().isBlank()) {
                    return Uni.createFrom().item(authorized(claims));
                }
                final var context = PermissionContext.builder(claims.subject())
                        .roles(claims.roles())
                        .tenantId(claims.tenantId())
                        .resource(resourceType(request.resourceType()), request.resourceId())
                        .action(request.action())
                        .ipAddress(request.ipAddress())
                        .build();
                return permissions.checkActionPermission(context).map(evaluation -> {
                    if (evaluation.granted()) {
                        return authorized(claims);
                    }
                    final var data = new LinkedHashMap<String, Object>();
                    data.put("authorized", false);
                    data.put("user_id", claims.subject());
                    data.put("reason", "Insufficient permissions for action: " + request.action());
                    data.put("evaluation_reason", evaluation.reason());
                    return OperationResult.success(data);
                });
            });
        });
    }

    private Uni<Boolean> checkSession(TokenClaims claims, AuthRequests.Authorize request) {
        if (claims.sessionId() == null) {
            return Uni.createFrom().item(true);
        }
        final var details = new LinkedHashMap<String, Object>();
        details.put("action", request.action());
        details.put("resource_type", request.resourceType());
        details.put("resource_id", request.resourceId());
        final var activityType = "action_" + (request.action() != null ? request.action() : "authorize");
        return sessions.updateActivity(
                claims.sessionId(), activityType, request.ipAddress(), request.userAgent(), details);
    }

    private static OperationResult authorized(TokenClaims claims) {
        final var data = new LinkedHashMap<String, Object>();
        data.put("authorized", true);
        data.put("user_id", claims.subject());
        data.put("tenant_id", claims.tenantId());
        data.put("roles", sorted(claims.roles()));
        data.put("permissions", sorted(claims.permissions()));
        data.put("session_id", claims.sessionId());
        return OperationResult.success(data);
    }

    // logout

    Uni<OperationResult> logout(AuthRequests.Logout request) {
        final Uni<TokenClaims> owner;
        if (request.token() != null && !request.token().isBlank()) {
            owner = tokens.validate(request.token(), ValidationCriteria.none())
                    .map(result -> result instanceof TokenValidationResult.Valid valid ? valid.claims() : null);
        } else {
            owner = Uni.createFrom().nullItem();
        }

        return owner.flatMap(claims -> {
            final var userId = claims != null ? claims.subject() : null;
            final var sessionId = request.sessionId() != null
                    ? request.sessionId()
                    : claims != null ? claims.sessionId() : null;
            final var actor = userId != null ? userId : "user";

            final Uni<Boolean> revoke = request.token() != null && !request.token().isBlank()
                    ? tokens.revoke(request.token(), actor, REASON_USER_LOGOUT)
                    : Uni.createFrom().item(false);

            return revoke.flatMap(revoked -> {
                if (request.allSessions() && userId != null) {
                    return tokens.revokeAllForUser(userId, null, actor, REASON_USER_LOGOUT_ALL)
                            .chain(() -> sessions.terminateAllForUser(userId, null, REASON_USER_LOGOUT_ALL, actor))
                            .map(count -> message("Logged out from " + count + " sessions"));
                }
                if (sessionId != null) {
                    return sessions.terminate(sessionId, REASON_USER_LOGOUT, actor)
                            .map(terminated -> terminated
                                    ? message("Logged out successfully")
                                    : OperationResult.failure("Session not found"));
                }
                return Uni.createFrom().item(message("Token revoked successfully"));
            });
        });
    }

    // refresh_token

    Uni<OperationResult> refresh(AuthRequests.Refresh request) {
        if (request.refreshToken() == null || request.refreshToken().isBlank()) {
            return Uni.createFrom().item(OperationResult.failure("Invalid refresh token"));
        }
        return tokens.refresh(request.refreshToken()).map(issued -> {
            if (issued.isEmpty()) {
                return OperationResult.failure("Invalid refresh token");
            }
            final var data = new LinkedHashMap<String, Object>();
            data.put("access_token", issued.get());
            data.put("token_type", TOKEN_TYPE_BEARER);
            return OperationResult.success(data);
        });
    }

    // assign_role

    Uni<OperationResult> assignRole(AuthRequests.AssignRole request) {
        final var scope = request.scope() == null || request.scope().isBlank()
                ? RoleScope.GLOBAL
                : RoleScope.fromWireName(request.scope())
                        .orElseThrow(() -> new ValidationException("Invalid role scope: " + request.scope()));
        final var expiresAt = parseInstant(request.expiresAt());
        final var assignedBy = request.assignedBy() != null ? request.assignedBy() : "system";

        return roles.assignRole(request.userId(), request.roleId(), scope, assignedBy, request.tenantId(), expiresAt)
                .map(assignment -> {
                    permissions.clearRoleCache(assignment.roleId());
                    permissions.clearUserCache(assignment.userId());
                    final var data = new LinkedHashMap<String, Object>();
                    data.put("assignment_id", assignment.id());
                    data.put("message", "Role " + assignment.roleId() + " assigned to user " + assignment.userId());
                    return OperationResult.success(data);
                });
    }

    // supplementary operations

    Uni<OperationResult> validateToken(AuthRequests.ValidateToken request) {
        TokenKind kind = null;
        if (request.tokenType() != null && !request.tokenType().isBlank()) {
            kind = TokenKind.fromWireName(request.tokenType())
                    .orElseThrow(() -> new ValidationException("Invalid token type: " + request.tokenType()));
        }
        final var criteria = new ValidationCriteria(kind, request.requiredPermissions(), request.requiredRoles());
        return tokens.validate(request.token(), criteria).map(result -> {
            if (result instanceof TokenValidationResult.Invalid invalid) {
                return OperationResult.failure(invalid.error());
            }
            final var claims = ((TokenValidationResult.Valid) result).claims();
            final var data = new LinkedHashMap<String, Object>();
            data.put("valid", true);
            data.put("user_id", claims.subject());
            data.put("tenant_id", claims.tenantId());
            data.put("session_id", claims.sessionId());
            data.put("token_type", claims.kind().wireName());
            data.put("roles", sorted(claims.roles()));
            data.put("permissions", sorted(claims.permissions()));
            data.put("expires_at", claims.expiresAt().toString());
            return OperationResult.success(data);
        });
    }

    Uni<OperationResult> revokeToken(AuthRequests.RevokeToken request) {
        if (request.token() == null || request.token().isBlank()) {
            throw new ValidationException("Token is required");
        }
        final var by = request.revokedBy() != null ? request.revokedBy() : "user";
        final var reason = request.reason() != null ? request.reason() : "manual_revocation";
        return tokens.revoke(request.token(), by, reason).map(revoked -> {
            final var data = new LinkedHashMap<String, Object>();
            data.put("revoked", revoked);
            return OperationResult.success(data);
        });
    }

    Uni<OperationResult> verifyMfa(AuthRequests.VerifyMfa request) {
        if (request.sessionId() == null) {
            throw new ValidationException("Session ID is required");
        }
        return sessions.verifyMfa(request.sessionId(), request.mfaToken()).map(verified -> {
            if (!verified) {
                return OperationResult.failure("MFA verification failed");
            }
            final var data = new LinkedHashMap<String, Object>();
            data.put("verified", true);
            data.put("session_id", request.sessionId());
            return OperationResult.success(data);
        });
    }

    Uni<OperationResult> userSessions(AuthRequests.UserSessions request) {
        if (request.userId() == null) {
            throw new ValidationException("User ID is required");
        }
        final var activeOnly = request.activeOnly() == null || request.activeOnly();
        return sessions.userSessions(request.userId(), activeOnly).map(found -> {
            final var list = new ArrayList<Map<String, Object>>();
            for (Session session : found) {
                final var entry = new LinkedHashMap<String, Object>();
                entry.put("session_id", session.id());
                entry.put("session_type", session.kind().wireName());
                entry.put("status", session.status().name().toLowerCase(Locale.ROOT));
                entry.put("created_at", session.createdAt().toString());
                entry.put("last_activity", session.lastActivityAt().toString());
                entry.put("expires_at", session.expiresAt().toString());
                entry.put("ip_address", session.ipAddress());
                entry.put("risk_score", session.riskScore());
                entry.put("mfa_verified", session.mfaVerified());
                list.add(entry);
            }
            final var data = new LinkedHashMap<String, Object>();
            data.put("sessions", list);
            data.put("count", list.size());
            return OperationResult.success(data);
        });
    }

    Uni<OperationResult> checkPermission(AuthRequests.CheckPermission request) {
        if (request.userId() == null || request.userId().isBlank()) {
            throw new ValidationException("User ID is required");
        }
        final var context = PermissionContext.builder(request.userId())
                .roles(request.roles())
                .tenantId(request.tenantId())
                .resource(resourceType(request.resourceType()), request.resourceId())
                .action(request.action())
                .ipAddress(request.ipAddress())
                .build();

        final Uni<PermissionEvaluation> evaluation;
        if (request.permissionId() != null && !request.permissionId().isBlank()) {
            evaluation = permissions.evaluate(context, request.permissionId());
        } else if (request.action() != null && !request.action().isBlank()) {
            evaluation = permissions.checkActionPermission(context);
        } else {
            throw new ValidationException("Either permission_id or action is required");
        }
        return evaluation.map(result -> {
            final var data = new LinkedHashMap<String, Object>();
            data.put("granted", result.granted());
            data.put("permission_id", result.permissionId());
            data.put("reason", result.reason());
            data.put("matched_policies", result.matchedPolicies());
            data.put("cache_hit", result.cacheHit());
            return OperationResult.success(data);
        });
    }

    // helpers

    private <T> T read(Map<String, Object> payload, Class<T> type) {
        try {
            return objectMapper.convertValue(payload, type);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Invalid payload: " + e.getMessage(), e);
        }
    }

    private static ResourceType resourceType(String value) {
        return ResourceType.fromWireName(value).orElse(null);
    }

    private static Instant parseInstant(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            throw new ValidationException("Invalid timestamp: " + value, e);
        }
    }

    private static List<String> sorted(Set<String> values) {
        return new ArrayList<>(new TreeSet<>(values));
    }

    private static OperationResult message(String message) {
        final var data = new LinkedHashMap<String, Object>();
        data.put("message", message);
        return OperationResult.success(data);
    }

    private static OperationResult failure(String operation, Throwable error) {
        if (error instanceof AuthException auth) {
            LOG.warnf("Operation %s failed (%s): %s", operation, auth.category(), auth.getMessage());
        } else {
            LOG.errorf(error, "Operation %s failed unexpectedly", operation);
        }
        final var message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        return OperationResult.failure(message);
    }
}
