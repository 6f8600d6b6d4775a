package taxpoynt.core.service.session;

import jakarta.enterprise.context.ApplicationScoped;

import taxpoynt.core.util.SecureHash;

/**
 * Generates session and activity identifiers.
 *
 * <p>Session IDs carry 32 bytes (256 bits) of secure randomness, URL-safe
 * Base64 encoded behind a {@code sess_} prefix.
 */
@ApplicationScoped
public class SessionIdGenerator {

    private static final int SESSION_ID_BYTES = 32;
    private static final int ACTIVITY_ID_HEX_CHARS = 16;

    public String newSessionId() {
        return "sess_" + SecureHash.randomUrlToken(SESSION_ID_BYTES);
    }

    public String newActivityId() {
        return "act_" + SecureHash.randomHex(ACTIVITY_ID_HEX_CHARS);
    }
}
