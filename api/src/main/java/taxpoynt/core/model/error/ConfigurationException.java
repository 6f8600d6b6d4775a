package taxpoynt.core.model.error;

/**
 * Unsupported algorithm or missing signing material.
 */
public class ConfigurationException extends AuthException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String category() {
        return "configuration_error";
    }
}
