package taxpoynt.core.port.out;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import taxpoynt.core.model.token.TokenRecord;

/**
 * Storage for issued tokens and their revocation state.
 *
 * <p>Implementations must make the token record and the revoked-id set change
 * together: a reader never observes a REVOKED record whose id is missing from
 * the revoked set, or the reverse.
 */
public interface TokenStore {

    /**
     * Store a newly issued token and add it to its subject's index.
     */
    Uni<Void> save(TokenRecord record);

    Uni<Optional<TokenRecord>> findByJti(String jti);

    /**
     * Tokens currently in the subject's live index.
     */
    Uni<List<TokenRecord>> findBySubject(String subject);

    /**
     * All ACTIVE tokens.
     */
    Uni<List<TokenRecord>> findActive();

    Uni<Boolean> isRevoked(String jti);

    /**
     * Increment the usage counter of an ACTIVE token.
     */
    Uni<Void> recordUsage(String jti, Instant usedAt);

    /**
     * Atomically move an ACTIVE token to REVOKED, drop it from the live index
     * and add its id to the revoked set.
     *
     * @return the revoked record, or empty if the token is unknown or not ACTIVE
     */
    Uni<Optional<TokenRecord>> revoke(String jti, String revokedBy, String reason, Instant at);

    /**
     * Atomically move an ACTIVE token to EXPIRED and drop it from the live index.
     *
     * @return the expired record, or empty if the token is unknown or not ACTIVE
     */
    Uni<Optional<TokenRecord>> expire(String jti, Instant at);

    /**
     * Delete EXPIRED and REVOKED records that left the ACTIVE state before
     * {@code cutoff} and whose natural expiry has passed.
     *
     * @return number of records deleted
     */
    Uni<Integer> purgeClosedBefore(Instant cutoff, Instant now);

    /**
     * Number of stored records.
     */
    Uni<Long> count();
}
