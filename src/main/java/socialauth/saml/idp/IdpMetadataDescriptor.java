package socialauth.saml.idp;

/**
 * The minimal IdP data a metadata generator or the SAML engine needs.
 */
public record IdpMetadataDescriptor(
    String entityId,
    String ssoUrl,
    String binding,
    String x509Certificate
) {
}
