package socialauth.saml.exception;

/**
 * Thrown at startup when the SAML configuration cannot be used.
 */
public class InvalidSamlConfigurationException extends IllegalStateException {
    public InvalidSamlConfigurationException(String message) {
        super(message);
    }

    public InvalidSamlConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
