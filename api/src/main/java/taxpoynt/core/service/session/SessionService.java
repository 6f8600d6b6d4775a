package taxpoynt.core.service.session;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import taxpoynt.core.config.SessionConfig;
import taxpoynt.core.model.error.SecurityViolationException;
import taxpoynt.core.model.session.CreateSessionRequest;
import taxpoynt.core.model.session.Device;
import taxpoynt.core.model.session.SecurityPolicy;
import taxpoynt.core.model.session.Session;
import taxpoynt.core.model.session.SessionActivity;
import taxpoynt.core.model.session.SessionKind;
import taxpoynt.core.model.session.SessionStatistics;
import taxpoynt.core.port.in.SessionManagement;
import taxpoynt.core.port.out.AuthMetrics;
import taxpoynt.core.port.out.MfaVerifier;
import taxpoynt.core.port.out.SessionStore;

/**
 * Session lifecycle: creation with security checks and risk scoring, sliding
 * expiry, termination, MFA and the periodic sweeps that keep the live index clean.
 */
@ApplicationScoped
public class SessionService implements SessionManagement {

    private static final Logger LOG = Logger.getLogger(SessionService.class);

    static final String REASON_CONCURRENT_LIMIT = "concurrent_session_limit";
    static final String REASON_EXPIRED = "expired";
    static final String SYSTEM_ACTOR = "system";

    private final SessionStore store;
    private final RiskEngine riskEngine;
    private final SecurityWatchlist watchlist;
    private final MfaVerifier mfaVerifier;
    private final SessionIdGenerator idGenerator;
    private final SessionConfig config;
    private final AuthMetrics metrics;
    private final Clock clock;
    private final Map<String, SecurityPolicy> policies = new ConcurrentHashMap<>();

    @Inject
    public SessionService(
            SessionStore store,
            RiskEngine riskEngine,
            SecurityWatchlist watchlist,
            MfaVerifier mfaVerifier,
            SessionIdGenerator idGenerator,
            SessionConfig config,
            AuthMetrics metrics,
            Clock clock) {
        this.store = store;
        this.riskEngine = riskEngine;
        this.watchlist = watchlist;
        this.mfaVerifier = mfaVerifier;
        this.idGenerator = idGenerator;
        this.config = config;
        this.metrics = metrics;
        this.clock = clock;

        final var blockedAgents = config.blockedUserAgents().orElse(List.of());
        definePolicy(SecurityPolicy.standard(
                config.defaultIdleTimeout(),
                config.defaultSessionTimeout(),
                config.maxConcurrentSessions(),
                blockedAgents));
        definePolicy(SecurityPolicy.highSecurity(blockedAgents));
    }

    @Override
    public void definePolicy(SecurityPolicy policy) {
        policies.put(policy.name(), policy);
        LOG.debugf("Security policy defined: %s", policy.name());
    }

    @Override
    public Optional<SecurityPolicy> policy(String name) {
        return Optional.ofNullable(policies.get(name));
    }

    @Override
    public Uni<Session> create(CreateSessionRequest request) {
        final var policy = resolvePolicy(request.policyName());
        try {
            checkOrigin(request, policy);
        } catch (SecurityViolationException e) {
            return Uni.createFrom().failure(e);
        }

        final Uni<Optional<Device>> knownDevice = request.deviceId() != null
                ? store.findDevice(request.deviceId())
                : Uni.createFrom().item(Optional.empty());

        return knownDevice.flatMap(found -> {
            final var now = clock.instant();
            final var device = request.deviceId() == null
                    ? null
                    : found.orElseGet(() -> Device.unregistered(
                            request.deviceId(), request.userId(), request.deviceType(), now));

            final var risk = riskEngine.score(new RiskEngine.Signals(
                    request.ipAddress(), watchlist.isSuspicious(request.ipAddress()), device, request.userAgent(), now));

            final var flags = new HashSet<String>();
            if (policy.requireMfa()) {
                flags.add(Session.FLAG_MFA_REQUIRED);
            }
            if (policy.requireDeviceTrust() && device != null && !device.trusted()) {
                flags.add(Session.FLAG_DEVICE_VERIFICATION_REQUIRED);
            }

            final var session = Session.builder(idGenerator.newSessionId(), request.userId())
                    .kind(request.kind())
                    .createdAt(now)
                    .lastActivityAt(now)
                    .idleTimeout(policy.idleTimeout())
                    .absoluteTimeout(policy.absoluteTimeout())
                    .ipAddress(request.ipAddress())
                    .userAgent(request.userAgent())
                    .deviceId(request.deviceId())
                    .tenantId(request.tenantId())
                    .roles(request.roles())
                    .permissions(request.permissions())
                    .riskScore(risk)
                    .flags(flags)
                    .securityLevel(policy.securityLevel())
                    .policyName(policy.name())
                    .build();

            return store.saveWithinLimit(session, policy.maxConcurrentSessions(), REASON_CONCURRENT_LIMIT)
                    .flatMap(evicted -> recordEvictions(evicted, now))
                    .flatMap(v -> device != null ? store.saveDevice(device.seenAt(now)) : Uni.createFrom().voidItem())
                    .flatMap(v -> log(
                            session,
                            SessionActivity.SESSION_CREATED,
                            now,
                            Map.of(
                                    "security_level", policy.securityLevel().name().toLowerCase(Locale.ROOT),
                                    "risk_score", session.riskScore()),
                            List.of()))
                    .map(v -> {
                        metrics.recordSessionCreated(session.kind().wireName());
                        LOG.infof(
                                "Session created: %s for user %s (policy: %s, risk: %.2f)",
                                session.id(),
                                session.userId(),
                                policy.name(),
                                session.riskScore());
                        return session;
                    });
        });
    }

    @Override
    public Uni<Optional<Session>> get(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            return Uni.createFrom().item(Optional.empty());
        }
        return store.findById(sessionId).flatMap(found -> {
            if (found.isEmpty()) {
                return Uni.createFrom().item(Optional.<Session>empty());
            }
            final var session = found.get();
            final var now = clock.instant();
            if (session.isValidAt(now)) {
                return Uni.createFrom().item(found);
            }
            LOG.debugf("Session %s is no longer valid", sessionId);
            if (!session.isActive()) {
                return Uni.createFrom().item(Optional.<Session>empty());
            }
            return terminate(sessionId, REASON_EXPIRED, SYSTEM_ACTOR).map(v -> Optional.<Session>empty());
        });
    }

    @Override
    public Uni<Boolean> updateActivity(
            String sessionId, String ipAddress, String userAgent, Map<String, Object> details) {
        return updateActivity(sessionId, SessionActivity.ACTIVITY_UPDATE, ipAddress, userAgent, details);
    }

    @Override
    public Uni<Boolean> updateActivity(
            String sessionId, String activityType, String ipAddress, String userAgent, Map<String, Object> details) {
        return get(sessionId).flatMap(found -> {
            if (found.isEmpty()) {
                return Uni.createFrom().item(false);
            }
            final var current = found.get();
            final var now = clock.instant();
            var updated = current.touchedAt(now);
            final var indicators = new ArrayList<String>();
            Uni<Void> ipChangeLog = Uni.createFrom().voidItem();

            if (ipAddress != null && current.ipAddress() != null && !ipAddress.equals(current.ipAddress())) {
                final var suspicious = watchlist.isSuspicious(ipAddress);
                updated = updated.withRiskScore(current.riskScore() + riskEngine.ipChangeIncrement(suspicious));
                indicators.add("ip_change");
                if (riskEngine.isHighRisk(updated.riskScore())) {
                    updated = updated.withFlag(Session.FLAG_HIGH_RISK);
                    final var ipDetails = new HashMap<String, Object>();
                    ipDetails.put("old_ip", current.ipAddress());
                    ipDetails.put("new_ip", ipAddress);
                    ipDetails.put("risk_score", updated.riskScore());
                    ipChangeLog = log(updated, SessionActivity.IP_CHANGE_DETECTED, now, ipDetails, indicators);
                    LOG.warnf(
                            "High-risk IP change on session %s: %s -> %s (risk: %.2f)",
                            sessionId,
                            current.ipAddress(),
                            ipAddress,
                            updated.riskScore());
                }
            }
            if (ipAddress != null || userAgent != null) {
                updated = updated.withClient(
                        ipAddress != null ? ipAddress : current.ipAddress(),
                        userAgent != null ? userAgent : current.userAgent());
            }

            final var toSave = updated;
            final var changeLog = ipChangeLog;
            return store.update(toSave).flatMap(saved -> {
                if (!saved) {
                    return Uni.createFrom().item(false);
                }
                return changeLog
                        .flatMap(v -> log(toSave, activityType, now, details, indicators))
                        .replaceWith(true);
            });
        });
    }

    @Override
    public Uni<Boolean> terminate(String sessionId, String reason, String terminatedBy) {
        if (sessionId == null || sessionId.isBlank()) {
            return Uni.createFrom().item(false);
        }
        return store.terminate(sessionId, reason, terminatedBy).flatMap(terminated -> {
            if (terminated.isEmpty()) {
                return Uni.createFrom().item(false);
            }
            return recordTermination(terminated.get(), clock.instant()).replaceWith(true);
        });
    }

    @Override
    public Uni<Integer> terminateAllForUser(
            String userId, String exceptSessionId, String reason, String terminatedBy) {
        return store.findByUserId(userId)
                .map(sessions -> sessions.stream()
                        .map(Session::id)
                        .filter(id -> !id.equals(exceptSessionId))
                        .toList())
                .flatMap(ids -> Multi.createFrom()
                        .iterable(ids)
                        .onItem()
                        .transformToUniAndConcatenate(id -> terminate(id, reason, terminatedBy))
                        .collect()
                        .asList())
                .map(results -> (int) results.stream().filter(Boolean::booleanValue).count())
                .invoke(count -> LOG.infof("Terminated %d session(s) for user %s (reason: %s)", count, userId, reason));
    }

    @Override
    public Uni<Boolean> verifyMfa(String sessionId, String code) {
        return get(sessionId).flatMap(found -> {
            if (found.isEmpty()) {
                return Uni.createFrom().item(false);
            }
            final var session = found.get();
            return mfaVerifier
                    .verify(session.userId(), code)
                    .onFailure()
                    .recoverWithItem(e -> {
                        LOG.warnf("MFA verifier failed for session %s: %s", sessionId, e.getMessage());
                        return false;
                    })
                    .flatMap(verified -> {
                        if (!Boolean.TRUE.equals(verified)) {
                            LOG.infof("MFA verification failed for session %s", sessionId);
                            return Uni.createFrom().item(false);
                        }
                        final var now = clock.instant();
                        final var updated = session.withMfaVerified()
                                .withoutFlag(Session.FLAG_MFA_REQUIRED)
                                .withRiskScore(riskEngine.afterMfa(session.riskScore()));
                        return store.update(updated).flatMap(saved -> {
                            if (!saved) {
                                return Uni.createFrom().item(false);
                            }
                            return log(updated, SessionActivity.MFA_VERIFIED, now, Map.of(), List.of())
                                    .invoke(() -> LOG.infof("MFA verified for session %s", sessionId))
                                    .replaceWith(true);
                        });
                    });
        });
    }

    @Override
    public Uni<List<Session>> userSessions(String userId, boolean activeOnly) {
        return store.findByUserId(userId).map(sessions -> {
            if (!activeOnly) {
                return sessions;
            }
            final var now = clock.instant();
            return sessions.stream().filter(s -> s.isValidAt(now)).toList();
        });
    }

    @Override
    public Uni<List<SessionActivity>> sessionActivities(String sessionId, int limit) {
        return store.findActivities(sessionId, Math.max(0, limit));
    }

    @Override
    public Uni<SessionStatistics> statistics() {
        return store.findAll().map(sessions -> {
            final var now = clock.instant();
            final var users = new HashSet<String>();
            final var byKind = new EnumMap<SessionKind, Integer>(SessionKind.class);
            var active = 0;
            var highRisk = 0;
            for (Session session : sessions) {
                if (!session.isValidAt(now)) {
                    continue;
                }
                active++;
                users.add(session.userId());
                byKind.merge(session.kind(), 1, Integer::sum);
                if (riskEngine.isHighRisk(session.riskScore())) {
                    highRisk++;
                }
            }
            return new SessionStatistics(active, users.size(), highRisk, byKind);
        });
    }

    @Override
    public Uni<Device> registerDevice(Device device) {
        return store.saveDevice(device)
                .invoke(() -> LOG.debugf("Device registered: %s for user %s", device.deviceId(), device.userId()))
                .replaceWith(device);
    }

    @Override
    public Uni<Optional<Device>> trustDevice(String deviceId, boolean trusted) {
        return store.findDevice(deviceId).flatMap(found -> {
            if (found.isEmpty()) {
                return Uni.createFrom().item(Optional.<Device>empty());
            }
            final var updated = found.get().withTrusted(trusted);
            return store.saveDevice(updated)
                    .invoke(() -> LOG.infof("Device %s trust set to %s", deviceId, trusted))
                    .replaceWith(Optional.of(updated));
        });
    }

    public Uni<List<Device>> userDevices(String userId) {
        return store.findDevicesByUserId(userId);
    }

    /**
     * Terminate every live session that is no longer valid.
     *
     * @return number of sessions terminated
     */
    public Uni<Integer> sweepExpiredSessions() {
        final var now = clock.instant();
        return store.findAll()
                .map(sessions -> sessions.stream()
                        .filter(s -> !s.isValidAt(now))
                        .map(Session::id)
                        .toList())
                .flatMap(ids -> Multi.createFrom()
                        .iterable(ids)
                        .onItem()
                        .transformToUniAndConcatenate(id -> terminate(id, REASON_EXPIRED, SYSTEM_ACTOR)
                                .onFailure()
                                .recoverWithItem(e -> {
                                    LOG.warnf("Failed to expire session %s: %s", id, e.getMessage());
                                    return false;
                                }))
                        .collect()
                        .asList())
                .map(results -> (int) results.stream().filter(Boolean::booleanValue).count())
                .invoke(count -> {
                    if (count > 0) {
                        LOG.infof("Session sweep: %d expired session(s) terminated", count);
                    }
                    metrics.recordSweep("session", count);
                });
    }

    /**
     * Flag live sessions whose risk score crossed the high-risk threshold.
     *
     * @return number of sessions newly flagged
     */
    public Uni<Integer> monitorSecurity() {
        final var now = clock.instant();
        return store.findAll()
                .map(sessions -> sessions.stream()
                        .filter(s -> s.isValidAt(now))
                        .filter(s -> riskEngine.isHighRisk(s.riskScore()))
                        .filter(s -> !s.hasFlag(Session.FLAG_HIGH_RISK))
                        .toList())
                .flatMap(risky -> Multi.createFrom()
                        .iterable(risky)
                        .onItem()
                        .transformToUniAndConcatenate(session -> flagHighRisk(session, now))
                        .collect()
                        .asList())
                .map(results -> (int) results.stream().filter(Boolean::booleanValue).count())
                .invoke(count -> metrics.recordSweep("security_monitor", count));
    }

    /**
     * Drop activity entries older than the retention window.
     */
    public Uni<Integer> sweepActivities() {
        return store.purgeActivitiesBefore(clock.instant().minus(config.activityRetention()))
                .invoke(count -> {
                    if (count > 0) {
                        LOG.infof("Activity sweep: %d entries removed", count);
                    }
                    metrics.recordSweep("activity", count);
                });
    }

    private Uni<Boolean> flagHighRisk(Session session, Instant now) {
        final var flagged = session.withFlag(Session.FLAG_HIGH_RISK);
        return store.update(flagged)
                .flatMap(saved -> {
                    if (!saved) {
                        return Uni.createFrom().item(false);
                    }
                    metrics.recordSecurityViolation("high_risk_session");
                    LOG.warnf("High-risk session detected: %s (risk: %.2f)", session.id(), session.riskScore());
                    return log(
                                    flagged,
                                    SessionActivity.HIGH_RISK_DETECTED,
                                    now,
                                    Map.of("risk_score", session.riskScore()),
                                    List.of(Session.FLAG_HIGH_RISK))
                            .replaceWith(true);
                })
                .onFailure()
                .recoverWithItem(e -> {
                    LOG.warnf("Failed to flag session %s: %s", session.id(), e.getMessage());
                    return false;
                });
    }

    private SecurityPolicy resolvePolicy(String name) {
        final var requested = name != null && !name.isBlank() ? name : config.defaultPolicy();
        final var policy = policies.get(requested);
        if (policy != null) {
            return policy;
        }
        LOG.debugf("Unknown security policy %s, using %s", requested, config.defaultPolicy());
        final var fallback = policies.get(config.defaultPolicy());
        return fallback != null ? fallback : policies.get(SecurityPolicy.STANDARD);
    }

    private void checkOrigin(CreateSessionRequest request, SecurityPolicy policy) {
        final var ip = request.ipAddress();
        if (ip != null && watchlist.isBlockedIp(ip, policy.blockedIpRanges())) {
            metrics.recordSecurityViolation("suspicious_ip");
            LOG.warnf("Session refused for user %s: suspicious IP %s", request.userId(), ip);
            throw new SecurityViolationException("Access denied from suspicious IP: " + ip);
        }
        if (watchlist.isBlockedUserAgent(request.userAgent(), policy.blockedUserAgents())) {
            metrics.recordSecurityViolation("blocked_user_agent");
            LOG.warnf("Session refused for user %s: blocked user agent", request.userId());
            throw new SecurityViolationException("Access denied: blocked user agent");
        }
    }

    private Uni<Void> recordEvictions(List<Session> evicted, Instant now) {
        if (evicted.isEmpty()) {
            return Uni.createFrom().voidItem();
        }
        return Multi.createFrom()
                .iterable(evicted)
                .onItem()
                .transformToUniAndConcatenate(session -> {
                    LOG.infof("Session %s evicted for user %s: concurrent session limit", session.id(),
                            session.userId());
                    return recordTermination(session, now);
                })
                .collect()
                .asList()
                .replaceWithVoid();
    }

    private Uni<Void> recordTermination(Session session, Instant now) {
        metrics.recordSessionTerminated(session.terminationReason());
        LOG.infof(
                "Session terminated: %s (user: %s, reason: %s, by: %s)",
                session.id(),
                session.userId(),
                session.terminationReason(),
                session.terminatedBy());
        final var details = new HashMap<String, Object>();
        details.put("reason", session.terminationReason());
        details.put("terminated_by", session.terminatedBy());
        return log(session, SessionActivity.SESSION_TERMINATED, now, details, List.of());
    }

    private Uni<Void> log(
            Session session, String type, Instant at, Map<String, Object> details, List<String> indicators) {
        final var activity = new SessionActivity(
                idGenerator.newActivityId(),
                session.id(),
                session.userId(),
                type,
                at,
                session.ipAddress(),
                session.userAgent(),
                details,
                indicators);
        final var max = config.maxActivitiesPerSession();
        return store.appendActivity(activity, max, Math.max(1, max / 2));
    }
}
