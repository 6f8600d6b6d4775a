package taxpoynt.core.model.error;

/**
 * Base type for failures raised by the authentication core.
 *
 * <p>Every subtype carries a short category code so that callers converting
 * failures into operation results can report the category alongside the message.
 */
public abstract class AuthException extends RuntimeException {

    protected AuthException(String message) {
        super(message);
    }

    protected AuthException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Short category code, e.g. {@code authentication_error}.
     */
    public abstract String category();
}
