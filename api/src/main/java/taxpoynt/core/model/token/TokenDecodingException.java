package taxpoynt.core.model.token;

/**
 * A token failed verification. The message is safe to return to callers.
 */
public class TokenDecodingException extends RuntimeException {

    public TokenDecodingException(String message) {
        super(message);
    }
}
