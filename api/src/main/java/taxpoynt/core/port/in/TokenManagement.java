package taxpoynt.core.port.in;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import taxpoynt.core.model.token.IssueTokenRequest;
import taxpoynt.core.model.token.TokenKind;
import taxpoynt.core.model.token.TokenRecord;
import taxpoynt.core.model.token.TokenValidationResult;
import taxpoynt.core.model.token.ValidationCriteria;

/**
 * Inbound port for the token lifecycle: issue, validate, refresh and revoke.
 */
public interface TokenManagement {

    /**
     * Sign and record a new token.
     *
     * @return the compact JWS string
     * @throws taxpoynt.core.model.error.ConfigurationException if no signing key is available
     */
    Uni<String> issue(IssueTokenRequest request);

    /**
     * Verify a token and check it against {@code criteria}.
     *
     * <p>Never fails; every rejection is reported as an
     * {@link TokenValidationResult.Invalid} with a human-readable reason.
     */
    Uni<TokenValidationResult> validate(String token, ValidationCriteria criteria);

    /**
     * Revoke a token given either its compact form or its jti.
     *
     * @return true if an active token was revoked
     */
    Uni<Boolean> revoke(String tokenOrJti, String revokedBy, String reason);

    /**
     * Exchange a valid token for a fresh access token carrying the same identity.
     *
     * @return the new access token, or empty if {@code token} is not valid
     */
    Uni<Optional<String>> refresh(String token);

    /**
     * Revoke every active token of a user, optionally limited to one kind.
     *
     * @param kind the kind to revoke, or null for all kinds
     * @return number of tokens revoked
     */
    Uni<Integer> revokeAllForUser(String userId, TokenKind kind, String revokedBy, String reason);

    Uni<List<TokenRecord>> tokensForUser(String userId, boolean activeOnly);

    /**
     * JWK set entries for every verification key.
     */
    List<Map<String, Object>> publicKeys();
}
