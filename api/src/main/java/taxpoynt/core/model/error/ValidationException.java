package taxpoynt.core.model.error;

/**
 * Malformed input such as an unknown role, bad policy rule or invalid scope.
 */
public class ValidationException extends AuthException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String category() {
        return "validation_error";
    }
}
