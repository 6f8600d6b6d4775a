package taxpoynt.core.model.error;

/**
 * A validated identity lacks permission for the requested action.
 */
public class AuthorizationException extends AuthException {

    public AuthorizationException(String message) {
        super(message);
    }

    public AuthorizationException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String category() {
        return "authorization_error";
    }
}
