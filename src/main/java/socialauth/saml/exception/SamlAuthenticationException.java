package socialauth.saml.exception;

/**
 * Base exception for failed SAML login attempts.
 * Every subclass is terminal for the current attempt.
 */
public abstract class SamlAuthenticationException extends Exception {
    public SamlAuthenticationException(String message) {
        super(message);
    }

    public SamlAuthenticationException(String message, Throwable cause) {
        super(message, cause);
    }
}
