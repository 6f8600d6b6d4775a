package taxpoynt.adapter.out.auth;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import jakarta.enterprise.context.ApplicationScoped;

import org.jboss.logging.Logger;
import org.jose4j.jwa.AlgorithmConstraints;
import org.jose4j.jws.AlgorithmIdentifiers;
import org.jose4j.jws.JsonWebSignature;
import org.jose4j.jwt.JwtClaims;
import org.jose4j.jwt.MalformedClaimException;
import org.jose4j.jwt.NumericDate;
import org.jose4j.jwt.consumer.ErrorCodes;
import org.jose4j.jwt.consumer.InvalidJwtException;
import org.jose4j.jwt.consumer.JwtConsumerBuilder;
import org.jose4j.lang.JoseException;

import taxpoynt.core.model.token.KeyAlgorithm;
import taxpoynt.core.model.token.SigningKey;
import taxpoynt.core.model.token.TokenClaims;
import taxpoynt.core.model.token.TokenDecodingException;
import taxpoynt.core.model.token.TokenEncodingException;
import taxpoynt.core.model.token.TokenKind;
import taxpoynt.core.port.out.JwtCodec;

/**
 * jose4j implementation of {@link JwtCodec}.
 *
 * <p>Standard claims map to their registered names; the platform claims are
 * {@code token_type}, {@code roles}, {@code permissions}, {@code tenant_id},
 * {@code session_id} and {@code scope}.
 */
@ApplicationScoped
public class JoseJwtCodec implements JwtCodec {

    private static final Logger LOG = Logger.getLogger(JoseJwtCodec.class);

    static final String CLAIM_TOKEN_TYPE = "token_type";
    static final String CLAIM_ROLES = "roles";
    static final String CLAIM_PERMISSIONS = "permissions";
    static final String CLAIM_TENANT_ID = "tenant_id";
    static final String CLAIM_SESSION_ID = "session_id";
    static final String CLAIM_SCOPE = "scope";

    private static final Set<String> RESERVED_CLAIMS = Set.of(
            "iss",
            "sub",
            "aud",
            "iat",
            "exp",
            "nbf",
            "jti",
            CLAIM_TOKEN_TYPE,
            CLAIM_ROLES,
            CLAIM_PERMISSIONS,
            CLAIM_TENANT_ID,
            CLAIM_SESSION_ID,
            CLAIM_SCOPE);

    @Override
    public String encode(TokenClaims claims, SigningKey key) {
        try {
            final var jws = new JsonWebSignature();
            jws.setPayload(toJwtClaims(claims).toJson());
            jws.setKey(key.signingKey());
            jws.setKeyIdHeaderValue(key.keyId());
            jws.setAlgorithmHeaderValue(algorithmIdentifier(key.algorithm()));
            return jws.getCompactSerialization();
        } catch (JoseException e) {
            throw new TokenEncodingException("Failed to sign token: " + e.getMessage(), e);
        }
    }

    @Override
    public Optional<String> peekKeyId(String token) {
        try {
            final var jws = new JsonWebSignature();
            jws.setCompactSerialization(token);
            return Optional.ofNullable(jws.getKeyIdHeaderValue());
        } catch (JoseException e) {
            LOG.debugf("Cannot parse token header: %s", e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public Optional<String> peekJti(String token) {
        try {
            final var claims = new JwtConsumerBuilder()
                    .setSkipAllValidators()
                    .setDisableRequireSignature()
                    .setSkipSignatureVerification()
                    .build()
                    .processToClaims(token);
            return Optional.ofNullable(claims.getJwtId());
        } catch (InvalidJwtException | MalformedClaimException e) {
            LOG.debugf("Cannot read token id: %s", e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public TokenClaims decode(
            String token, SigningKey key, String issuer, String audience, Duration clockSkew, Instant now) {
        try {
            final var consumer = new JwtConsumerBuilder()
                    .setRequireSubject()
                    .setRequireJwtId()
                    .setRequireExpirationTime()
                    .setAllowedClockSkewInSeconds((int) clockSkew.toSeconds())
                    .setEvaluationTime(NumericDate.fromMilliseconds(now.toEpochMilli()))
                    .setExpectedIssuer(issuer)
                    .setExpectedAudience(audience)
                    .setVerificationKey(key.verificationKey())
                    .setJwsAlgorithmConstraints(AlgorithmConstraints.ConstraintType.PERMIT,
                            algorithmIdentifier(key.algorithm()))
                    .build();
            return fromJwtClaims(consumer.processToClaims(token));
        } catch (InvalidJwtException e) {
            LOG.debugf("JWT validation failed: %s", e.getMessage());
            throw new TokenDecodingException(summarizeJwtError(e));
        } catch (MalformedClaimException | IllegalArgumentException e) {
            LOG.debugf("JWT claims malformed: %s", e.getMessage());
            throw new TokenDecodingException("Malformed token claims");
        }
    }

    private JwtClaims toJwtClaims(TokenClaims claims) {
        final var jwt = new JwtClaims();
        jwt.setJwtId(claims.jti());
        jwt.setSubject(claims.subject());
        jwt.setIssuer(claims.issuer());
        jwt.setAudience(claims.audience());
        jwt.setIssuedAt(NumericDate.fromSeconds(claims.issuedAt().getEpochSecond()));
        jwt.setNotBefore(NumericDate.fromSeconds(claims.notBefore().getEpochSecond()));
        jwt.setExpirationTime(NumericDate.fromSeconds(claims.expiresAt().getEpochSecond()));
        jwt.setClaim(CLAIM_TOKEN_TYPE, claims.kind().wireName());
        jwt.setStringListClaim(CLAIM_ROLES, List.copyOf(claims.roles()));
        jwt.setStringListClaim(CLAIM_PERMISSIONS, List.copyOf(claims.permissions()));
        if (claims.tenantId() != null) {
            jwt.setClaim(CLAIM_TENANT_ID, claims.tenantId());
        }
        if (claims.sessionId() != null) {
            jwt.setClaim(CLAIM_SESSION_ID, claims.sessionId());
        }
        if (claims.scope() != null) {
            jwt.setClaim(CLAIM_SCOPE, claims.scope());
        }
        for (var entry : claims.custom().entrySet()) {
            if (!RESERVED_CLAIMS.contains(entry.getKey())) {
                jwt.setClaim(entry.getKey(), entry.getValue());
            }
        }
        return jwt;
    }

    private TokenClaims fromJwtClaims(JwtClaims jwt) throws MalformedClaimException {
        final var kindName = jwt.getStringClaimValue(CLAIM_TOKEN_TYPE);
        final var kind = TokenKind.fromWireName(kindName)
                .orElseThrow(() -> new IllegalArgumentException("Unknown token type: " + kindName));
        final var audiences = jwt.getAudience();

        final var custom = new HashMap<String, Object>();
        for (Map.Entry<String, Object> entry : jwt.getClaimsMap().entrySet()) {
            if (!RESERVED_CLAIMS.contains(entry.getKey())) {
                custom.put(entry.getKey(), entry.getValue());
            }
        }

        return new TokenClaims(
                jwt.getJwtId(),
                jwt.getSubject(),
                jwt.getIssuer(),
                audiences.isEmpty() ? null : audiences.get(0),
                kind,
                toInstant(jwt.getIssuedAt()),
                toInstant(jwt.getNotBefore()),
                toInstant(jwt.getExpirationTime()),
                stringSet(jwt.getClaimValue(CLAIM_ROLES)),
                stringSet(jwt.getClaimValue(CLAIM_PERMISSIONS)),
                jwt.getStringClaimValue(CLAIM_TENANT_ID),
                jwt.getStringClaimValue(CLAIM_SESSION_ID),
                jwt.getStringClaimValue(CLAIM_SCOPE),
                custom);
    }

    private static Instant toInstant(NumericDate date) {
        return date != null ? Instant.ofEpochSecond(date.getValue()) : null;
    }

    private static Set<String> stringSet(Object value) {
        final var result = new LinkedHashSet<String>();
        if (value instanceof Collection<?> values) {
            for (Object item : values) {
                if (item != null) {
                    result.add(item.toString());
                }
            }
        } else if (value != null) {
            result.add(value.toString());
        }
        return result;
    }

    private static String algorithmIdentifier(KeyAlgorithm algorithm) {
        return switch (algorithm) {
            case HS256 -> AlgorithmIdentifiers.HMAC_SHA256;
            case HS384 -> AlgorithmIdentifiers.HMAC_SHA384;
            case HS512 -> AlgorithmIdentifiers.HMAC_SHA512;
            case RS256 -> AlgorithmIdentifiers.RSA_USING_SHA256;
            case RS384 -> AlgorithmIdentifiers.RSA_USING_SHA384;
            case RS512 -> AlgorithmIdentifiers.RSA_USING_SHA512;
        };
    }

    private String summarizeJwtError(InvalidJwtException e) {
        if (e.hasExpired()) {
            return "Token has expired";
        }
        if (e.hasErrorCode(ErrorCodes.ISSUER_INVALID)) {
            return "Invalid token issuer";
        }
        if (e.hasErrorCode(ErrorCodes.AUDIENCE_INVALID)) {
            return "Invalid token audience";
        }
        if (e.hasErrorCode(ErrorCodes.SIGNATURE_INVALID)) {
            return "Invalid token signature";
        }
        if (e.hasErrorCode(ErrorCodes.NOT_YET_VALID)) {
            return "Token is not yet valid";
        }
        if (e.hasErrorCode(ErrorCodes.MISCELLANEOUS)) {
            return "Invalid token signature";
        }
        return "Malformed token";
    }
}
