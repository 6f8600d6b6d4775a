package taxpoynt.core.service.token;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import taxpoynt.core.cache.CaffeineLocalCache;
import taxpoynt.core.cache.LocalCache;
import taxpoynt.core.config.TokenConfig;
import taxpoynt.core.model.token.IssueTokenRequest;
import taxpoynt.core.model.token.TokenClaims;
import taxpoynt.core.model.token.TokenDecodingException;
import taxpoynt.core.model.token.TokenKind;
import taxpoynt.core.model.token.TokenRecord;
import taxpoynt.core.model.token.TokenStatus;
import taxpoynt.core.model.token.TokenValidationResult;
import taxpoynt.core.model.token.ValidationCriteria;
import taxpoynt.core.port.in.TokenManagement;
import taxpoynt.core.port.out.AuthMetrics;
import taxpoynt.core.port.out.JwtCodec;
import taxpoynt.core.port.out.TokenStore;
import taxpoynt.core.util.SecureHash;

/**
 * Token lifecycle service.
 *
 * <p>Verified claims are cached by a digest of the token string. A cache hit
 * skips signature verification only; revocation and expiry are always checked
 * against the {@link TokenStore}, so a revoked token never validates.
 */
@ApplicationScoped
public class TokenService implements TokenManagement {

    private static final Logger LOG = Logger.getLogger(TokenService.class);
    private static final int CACHE_KEY_HEX_CHARS = 32;

    private final TokenStore store;
    private final KeyManager keyManager;
    private final JwtCodec codec;
    private final TokenConfig config;
    private final AuthMetrics metrics;
    private final Clock clock;
    private final LocalCache<String, TokenClaims> validationCache;

    @Inject
    public TokenService(
            TokenStore store,
            KeyManager keyManager,
            JwtCodec codec,
            TokenConfig config,
            AuthMetrics metrics,
            Clock clock) {
        this(
                store,
                keyManager,
                codec,
                config,
                metrics,
                clock,
                new CaffeineLocalCache<>(config.cacheTtl(), config.cacheMaxSize()));
    }

    TokenService(
            TokenStore store,
            KeyManager keyManager,
            JwtCodec codec,
            TokenConfig config,
            AuthMetrics metrics,
            Clock clock,
            LocalCache<String, TokenClaims> validationCache) {
        this.store = store;
        this.keyManager = keyManager;
        this.codec = codec;
        this.config = config;
        this.metrics = metrics;
        this.clock = clock;
        this.validationCache = validationCache;
    }

    @Override
    public Uni<String> issue(IssueTokenRequest request) {
        return Uni.createFrom().deferred(() -> {
            final var now = clock.instant();
            final var ttl = request.ttlOverride() != null ? request.ttlOverride() : config.ttlFor(request.kind());
            final var claims = new TokenClaims(
                    UUID.randomUUID().toString(),
                    request.subject(),
                    config.issuer(),
                    config.audience(),
                    request.kind(),
                    now,
                    now,
                    now.plus(ttl),
                    request.roles(),
                    request.permissions(),
                    request.tenantId(),
                    request.sessionId(),
                    request.scope(),
                    request.customClaims());

            final var key = keyManager.currentSigningKey();
            final var token = codec.encode(claims, key);
            keyManager.recordSignature(key.keyId());

            final var record = TokenRecord.issued(
                    claims, key.keyId(), request.ipAddress(), request.userAgent(), request.deviceId());
            return store.save(record).map(v -> {
                metrics.recordTokenIssued(request.kind().wireName());
                LOG.debugf(
                        "Issued %s %s for %s (expires %s)",
                        request.kind().wireName(),
                        claims.jti(),
                        request.subject(),
                        claims.expiresAt());
                return token;
            });
        });
    }

    @Override
    public Uni<TokenValidationResult> validate(String token, ValidationCriteria criteria) {
        if (token == null || token.isBlank()) {
            return Uni.createFrom().item(invalid("No token provided", false));
        }
        final var effectiveCriteria = criteria != null ? criteria : ValidationCriteria.none();
        final var cacheKey = cacheKey(token);
        final var now = clock.instant();

        final var cached = validationCache.get(cacheKey);
        final TokenClaims claims;
        if (cached.isPresent()) {
            claims = cached.get();
            if (!now.isBefore(claims.expiresAt().plus(config.clockSkew()))) {
                validationCache.invalidate(cacheKey);
                return Uni.createFrom().item(invalid("Token has expired", true));
            }
        } else {
            final var decoded = decode(token, now);
            if (decoded instanceof TokenValidationResult.Invalid rejected) {
                return Uni.createFrom().item(invalid(rejected.error(), false));
            }
            claims = ((TokenValidationResult.Valid) decoded).claims();
        }
        final var cacheHit = cached.isPresent();

        return store.isRevoked(claims.jti()).flatMap(revoked -> {
            if (revoked) {
                validationCache.invalidate(cacheKey);
                return Uni.createFrom().item(invalid("Token has been revoked", cacheHit));
            }
            return store.findByJti(claims.jti()).flatMap(record -> {
                if (record.isPresent() && record.get().status() == TokenStatus.EXPIRED) {
                    validationCache.invalidate(cacheKey);
                    return Uni.createFrom().item(invalid("Token has expired", cacheHit));
                }
                final var failure = checkCriteria(claims, effectiveCriteria);
                if (failure.isPresent()) {
                    return Uni.createFrom().item(invalid(failure.get(), cacheHit));
                }
                validationCache.put(cacheKey, claims);
                metrics.recordTokenValidation(true, cacheHit);
                final Uni<Void> usage =
                        record.isPresent() ? store.recordUsage(claims.jti(), now) : Uni.createFrom().voidItem();
                return usage.map(v -> (TokenValidationResult) new TokenValidationResult.Valid(claims));
            });
        });
    }

    @Override
    public Uni<Boolean> revoke(String tokenOrJti, String revokedBy, String reason) {
        if (tokenOrJti == null || tokenOrJti.isBlank()) {
            return Uni.createFrom().item(false);
        }
        final Optional<String> jti =
                looksLikeJws(tokenOrJti) ? codec.peekJti(tokenOrJti) : Optional.of(tokenOrJti);
        if (jti.isEmpty()) {
            LOG.debugf("Cannot revoke token without a readable id");
            return Uni.createFrom().item(false);
        }
        return revokeJti(jti.get(), revokedBy, reason);
    }

    private Uni<Boolean> revokeJti(String jti, String revokedBy, String reason) {
        return store.revoke(jti, revokedBy, reason, clock.instant()).map(revoked -> {
            if (revoked.isEmpty()) {
                LOG.debugf("Token %s not revoked: unknown or no longer active", jti);
                return false;
            }
            validationCache.invalidateIf((key, claims) -> claims.jti().equals(jti));
            metrics.recordTokenRevoked(reason);
            LOG.infof("Token revoked: %s (subject: %s, by: %s, reason: %s)", jti, revoked.get().subject(), revokedBy,
                    reason);
            return true;
        });
    }

    @Override
    public Uni<Optional<String>> refresh(String token) {
        return validate(token, ValidationCriteria.ofKind(TokenKind.REFRESH)).flatMap(result -> {
            if (!(result instanceof TokenValidationResult.Valid valid)) {
                return Uni.createFrom().item(Optional.<String>empty());
            }
            final var claims = valid.claims();
            final var request = IssueTokenRequest.builder(claims.subject(), TokenKind.ACCESS)
                    .roles(claims.roles())
                    .permissions(claims.permissions())
                    .tenantId(claims.tenantId())
                    .sessionId(claims.sessionId())
                    .scope(claims.scope())
                    .build();
            return issue(request).map(Optional::of);
        });
    }

    @Override
    public Uni<Integer> revokeAllForUser(String userId, TokenKind kind, String revokedBy, String reason) {
        return store.findBySubject(userId)
                .map(records -> records.stream()
                        .filter(TokenRecord::isActive)
                        .filter(r -> kind == null || r.kind() == kind)
                        .map(TokenRecord::jti)
                        .toList())
                .flatMap(jtis -> Multi.createFrom()
                        .iterable(jtis)
                        .onItem()
                        .transformToUniAndConcatenate(jti -> revokeJti(jti, revokedBy, reason))
                        .collect()
                        .asList())
                .map(results -> (int) results.stream().filter(Boolean::booleanValue).count())
                .invoke(count -> {
                    if (count > 0) {
                        LOG.infof("Revoked %d token(s) for user %s", count, userId);
                    }
                });
    }

    @Override
    public Uni<List<TokenRecord>> tokensForUser(String userId, boolean activeOnly) {
        return store.findBySubject(userId).map(records -> {
            final var result = new ArrayList<TokenRecord>();
            for (TokenRecord record : records) {
                if (!activeOnly || record.isActive()) {
                    result.add(record);
                }
            }
            return result;
        });
    }

    @Override
    public List<Map<String, Object>> publicKeys() {
        return keyManager.publicKeys();
    }

    /**
     * Move every active token past its expiry to EXPIRED, then purge terminal
     * records older than the retention window.
     *
     * @return number of tokens expired plus number of records purged
     */
    public Uni<Integer> sweepExpired() {
        final var now = clock.instant();
        return store.findActive()
                .map(active -> active.stream()
                        .filter(r -> r.isExpiredAt(now))
                        .map(TokenRecord::jti)
                        .toList())
                .flatMap(jtis -> Multi.createFrom()
                        .iterable(jtis)
                        .onItem()
                        .transformToUniAndConcatenate(jti -> expireQuietly(jti, now))
                        .collect()
                        .asList())
                .map(results -> (int) results.stream().filter(Boolean::booleanValue).count())
                .flatMap(expired -> store.purgeClosedBefore(now.minus(config.retention()), now)
                        .map(purged -> {
                            if (expired > 0 || purged > 0) {
                                LOG.infof("Token sweep: %d expired, %d purged", expired, purged);
                            }
                            metrics.recordSweep("token", expired + purged);
                            return expired + purged;
                        }));
    }

    /**
     * Drop expired entries from the validation cache.
     */
    public void sweepValidationCache() {
        validationCache.cleanUp();
        LOG.debugf("Validation cache size after cleanup: %d", validationCache.estimatedSize());
    }

    private Uni<Boolean> expireQuietly(String jti, Instant now) {
        return store.expire(jti, now)
                .map(Optional::isPresent)
                .invoke(expired -> {
                    if (expired) {
                        validationCache.invalidateIf((key, claims) -> claims.jti().equals(jti));
                    }
                })
                .onFailure()
                .recoverWithItem(e -> {
                    LOG.warnf("Failed to expire token %s: %s", jti, e.getMessage());
                    return false;
                });
    }

    private TokenValidationResult decode(String token, Instant now) {
        final var keyId = codec.peekKeyId(token);
        if (keyId.isEmpty()) {
            return new TokenValidationResult.Invalid("Malformed token");
        }
        try {
            final var key = keyManager.verificationKey(keyId.get());
            return new TokenValidationResult.Valid(
                    codec.decode(token, key, config.issuer(), config.audience(), config.clockSkew(), now));
        } catch (TokenDecodingException e) {
            return new TokenValidationResult.Invalid(e.getMessage());
        }
    }

    private static Optional<String> checkCriteria(TokenClaims claims, ValidationCriteria criteria) {
        if (criteria.expectedKind() != null && claims.kind() != criteria.expectedKind()) {
            return Optional.of("Expected token type " + criteria.expectedKind().wireName() + ", got "
                    + claims.kind().wireName());
        }
        final var missing = claims.missingPermissions(criteria.requiredPermissions());
        if (!missing.isEmpty()) {
            return Optional.of("Missing required permissions: " + String.join(", ", missing));
        }
        if (!claims.hasAnyRole(criteria.requiredRoles())) {
            return Optional.of("Missing required roles: "
                    + String.join(", ", criteria.requiredRoles().stream().sorted().toList()));
        }
        return Optional.empty();
    }

    private TokenValidationResult invalid(String error, boolean cacheHit) {
        metrics.recordTokenValidation(false, cacheHit);
        LOG.debugf("Token rejected: %s", error);
        return new TokenValidationResult.Invalid(error);
    }

    private static String cacheKey(String token) {
        return SecureHash.truncatedSha256(token, CACHE_KEY_HEX_CHARS);
    }

    private static boolean looksLikeJws(String value) {
        return value.chars().filter(c -> c == '.').count() == 2;
    }
}
