package taxpoynt.core.model.token;

/**
 * Result of validating a token.
 */
public sealed interface TokenValidationResult {

    boolean valid();

    /**
     * Token is authentic, unexpired, unrevoked and satisfies the requested criteria.
     *
     * @param claims verified claims
     */
    record Valid(TokenClaims claims) implements TokenValidationResult {
        @Override
        public boolean valid() {
            return true;
        }
    }

    /**
     * Token was rejected.
     *
     * @param error human-readable reason
     */
    record Invalid(String error) implements TokenValidationResult {
        @Override
        public boolean valid() {
            return false;
        }
    }
}
