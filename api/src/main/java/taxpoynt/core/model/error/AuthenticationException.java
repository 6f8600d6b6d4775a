package taxpoynt.core.model.error;

/**
 * A credential, token or session could not be established or validated.
 */
public class AuthenticationException extends AuthException {

    public AuthenticationException(String message) {
        super(message);
    }

    public AuthenticationException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String category() {
        return "authentication_error";
    }
}
