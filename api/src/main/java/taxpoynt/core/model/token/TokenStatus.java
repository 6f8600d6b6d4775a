package taxpoynt.core.model.token;

/**
 * Lifecycle state of an issued token.
 *
 * <p>Valid transitions: ACTIVE -> EXPIRED, ACTIVE -> REVOKED. Terminal states never change.
 */
public enum TokenStatus {
    ACTIVE,
    EXPIRED,
    REVOKED;

    public boolean isTerminal() {
        return this != ACTIVE;
    }
}
