package socialauth.saml.engine;

import socialauth.saml.exception.SamlProtocolValidationException;
import socialauth.saml.idp.IdentityProviderConfig;

/**
 * SAML 2.0 protocol operations: AuthnRequest construction, response
 * verification and SP metadata generation.
 */
public interface SamlProtocolEngine {

    /**
     * Builds the URL that sends the browser to the IdP with an AuthnRequest.
     *
     * @param relayState opaque value the IdP posts back unchanged
     */
    String buildLoginRedirect(SamlRequestContext context, IdentityProviderConfig idp, String relayState)
        throws SamlProtocolValidationException;

    /**
     * Verifies the SAML response carried by the request. A rejected response is
     * reported through {@link ProcessedSamlResponse#errors()}, not thrown.
     */
    ProcessedSamlResponse processResponse(SamlRequestContext context, IdentityProviderConfig idp);

    MetadataDocument buildMetadataDocument(IdentityProviderConfig idp);
}
