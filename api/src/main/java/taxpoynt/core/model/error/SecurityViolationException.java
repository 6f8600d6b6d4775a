package taxpoynt.core.model.error;

/**
 * A request rejected on security-policy grounds (blocked IP, blocked user agent)
 * before any session or token state is created.
 */
public class SecurityViolationException extends AuthException {

    public SecurityViolationException(String message) {
        super(message);
    }

    @Override
    public String category() {
        return "security_error";
    }
}
