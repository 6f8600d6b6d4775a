package taxpoynt.core.model.token;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The claim set carried by a signed token.
 *
 * @param jti unique token id
 * @param subject user id
 * @param issuer issuing platform
 * @param audience intended audience
 * @param kind token kind
 * @param issuedAt issue time
 * @param notBefore time before which the token is not accepted
 * @param expiresAt expiry time, strictly after {@code issuedAt}
 * @param roles role ids granted to the subject
 * @param permissions permission ids granted to the subject
 * @param tenantId tenant the token is bound to (nullable)
 * @param sessionId session the token is bound to (nullable)
 * @param scope OAuth-style scope string (nullable)
 * @param custom additional claims
 */
public record TokenClaims(
        String jti,
        String subject,
        String issuer,
        String audience,
        TokenKind kind,
        Instant issuedAt,
        Instant notBefore,
        Instant expiresAt,
        Set<String> roles,
        Set<String> permissions,
        String tenantId,
        String sessionId,
        String scope,
        Map<String, Object> custom) {

    public TokenClaims {
        if (jti == null || jti.isBlank()) {
            throw new IllegalArgumentException("Token id (jti) cannot be null or blank");
        }
        if (subject == null || subject.isBlank()) {
            throw new IllegalArgumentException("Token subject cannot be null or blank");
        }
        if (kind == null) {
            throw new IllegalArgumentException("Token kind cannot be null");
        }
        if (issuedAt == null || expiresAt == null || !expiresAt.isAfter(issuedAt)) {
            throw new IllegalArgumentException("Token expiry must be after its issue time");
        }
        roles = roles != null ? Set.copyOf(roles) : Set.of();
        permissions = permissions != null ? Set.copyOf(permissions) : Set.of();
        custom = withoutNullValues(custom);
        if (notBefore == null) {
            notBefore = issuedAt;
        }
    }

    private static Map<String, Object> withoutNullValues(Map<String, Object> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        final var copy = new HashMap<String, Object>();
        source.forEach((key, value) -> {
            if (key != null && value != null) {
                copy.put(key, value);
            }
        });
        return Map.copyOf(copy);
    }

    /**
     * Permission ids from {@code required} that these claims do not carry.
     */
    public List<String> missingPermissions(Set<String> required) {
        final var missing = new ArrayList<String>();
        for (String permission : required) {
            if (!permissions.contains(permission)) {
                missing.add(permission);
            }
        }
        missing.sort(null);
        return missing;
    }

    /**
     * True if at least one of {@code required} is carried, or {@code required} is empty.
     */
    public boolean hasAnyRole(Set<String> required) {
        if (required.isEmpty()) {
            return true;
        }
        for (String role : required) {
            if (roles.contains(role)) {
                return true;
            }
        }
        return false;
    }
}
