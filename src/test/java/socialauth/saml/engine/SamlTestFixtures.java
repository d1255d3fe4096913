package socialauth.saml.engine;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import socialauth.saml.config.SamlProperties;
import socialauth.saml.idp.IdentityProviderConfig;

/**
 * SP configuration and IdP records backed by the self-signed certificates under
 * {@code src/test/resources/certs}.
 */
public final class SamlTestFixtures {

    public static final String SP_ENTITY_ID = "https://sp.example.com/";
    public static final String COMPLETION_URL = "https://sp.example.com/auth/saml/complete";
    public static final String IDP_SSO_URL = "https://idp.testshib.org/idp/profile/SAML2/Redirect/SSO";

    private SamlTestFixtures() {
    }

    public static SamlProperties spProperties() {
        SamlProperties properties = new SamlProperties();
        properties.getSp().setEntityId(SP_ENTITY_ID);
        properties.getSp().setCompletionUrl(COMPLETION_URL);
        properties.getSp().setPublicCert(pemBody("certs/sp.crt"));

        SamlProperties.Organization org = new SamlProperties.Organization();
        org.setName("example");
        org.setDisplayname("Example Inc.");
        org.setUrl("http://example.com");
        properties.getOrgInfo().put("en-US", org);
        properties.getTechnicalContact().setGivenName("Tech Gal");
        properties.getTechnicalContact().setEmailAddress("technical@example.com");
        properties.getSupportContact().setGivenName("Support Guy");
        properties.getSupportContact().setEmailAddress("support@example.com");
        return properties;
    }

    public static IdentityProviderConfig testshib() {
        return new IdentityProviderConfig(
            "testshib", "https://idp.testshib.org/idp/shibboleth", IDP_SSO_URL, pemBody("certs/idp.crt"));
    }

    public static String pem(String resource) {
        try (InputStream in = SamlTestFixtures.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("Missing test resource " + resource);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Base64 body of a PEM file, without armor lines or line breaks.
     */
    public static String pemBody(String resource) {
        return pem(resource)
            .replaceAll("-----[A-Z ]+-----", "")
            .replaceAll("\\s+", "");
    }
}
