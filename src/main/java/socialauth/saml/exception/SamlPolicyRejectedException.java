package socialauth.saml.exception;

/**
 * Exception thrown when a post-validation entitlement check vetoes the login
 */
public class SamlPolicyRejectedException extends SamlAuthenticationException {
    public SamlPolicyRejectedException(String message) {
        super(message);
    }
}
