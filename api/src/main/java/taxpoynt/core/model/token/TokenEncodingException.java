package taxpoynt.core.model.token;

/**
 * Signing a token failed.
 */
public class TokenEncodingException extends RuntimeException {

    public TokenEncodingException(String message, Throwable cause) {
        super(message, cause);
    }
}
