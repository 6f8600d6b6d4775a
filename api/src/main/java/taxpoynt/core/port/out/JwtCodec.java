package taxpoynt.core.port.out;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import taxpoynt.core.model.token.SigningKey;
import taxpoynt.core.model.token.TokenClaims;
import taxpoynt.core.model.token.TokenDecodingException;
import taxpoynt.core.model.token.TokenEncodingException;

/**
 * Signs and verifies compact JWS tokens.
 */
public interface JwtCodec {

    /**
     * Sign {@code claims} with {@code key}, embedding the key id in the header.
     *
     * @throws TokenEncodingException if signing fails
     */
    String encode(TokenClaims claims, SigningKey key);

    /**
     * Read the key id from the token header without verifying anything.
     *
     * @return the key id, or empty if the token is malformed or carries none
     */
    Optional<String> peekKeyId(String token);

    /**
     * Read the token id from the payload without verifying anything.
     *
     * @return the jti, or empty if the token is malformed or carries none
     */
    Optional<String> peekJti(String token);

    /**
     * Verify signature, issuer, audience, expiry and not-before, then return the claims.
     *
     * @param now evaluation time for expiry and not-before
     * @throws TokenDecodingException with a human-readable message if any check fails
     */
    TokenClaims decode(String token, SigningKey key, String issuer, String audience, Duration clockSkew, Instant now);
}
