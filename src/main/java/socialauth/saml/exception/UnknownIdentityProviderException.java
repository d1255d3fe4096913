package socialauth.saml.exception;

/**
 * Exception thrown when the requested IdP name is not configured
 */
public class UnknownIdentityProviderException extends SamlAuthenticationException {

    public UnknownIdentityProviderException(String idpName) {
        super("Unknown SAML identity provider: " + idpName);
    }
}
