package socialauth.saml.engine;

import com.onelogin.saml2.util.Constants;
import com.onelogin.saml2.util.Util;
import java.nio.charset.StandardCharsets;
import java.security.PrivateKey;
import java.security.cert.X509Certificate;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.w3c.dom.Document;

/**
 * Builds IdP responses signed with {@code certs/idp.key}, timestamped around the
 * current time so that strict validation accepts them.
 */
public final class SamlResponseFixtures {

    public static final String IDP_ENTITY_ID = "https://idp.testshib.org/idp/shibboleth";
    public static final String SESSION_INDEX = "_session1";

    private SamlResponseFixtures() {
    }

    /**
     * Base64 {@code SAMLResponse} form value for a successful login.
     *
     * @param acsUrl Destination and SubjectConfirmation Recipient
     * @param audience SP entity id the assertion is restricted to
     */
    public static String signedResponse(String acsUrl, String audience, String nameId,
                                        Map<String, List<String>> attributes) throws Exception {
        Instant now = Instant.now().truncatedTo(ChronoUnit.SECONDS);
        String issueInstant = now.toString();
        String notBefore = now.minus(1, ChronoUnit.MINUTES).toString();
        String notOnOrAfter = now.plus(5, ChronoUnit.MINUTES).toString();

        StringBuilder attributeStatement = new StringBuilder();
        attributes.forEach((name, values) -> {
            attributeStatement.append("<saml:Attribute Name=\"").append(name)
                .append("\" NameFormat=\"urn:oasis:names:tc:SAML:2.0:attrname-format:uri\">");
            for (String value : values) {
                attributeStatement.append("<saml:AttributeValue>").append(value).append("</saml:AttributeValue>");
            }
            attributeStatement.append("</saml:Attribute>");
        });

        String xml = "<samlp:Response xmlns:samlp=\"urn:oasis:names:tc:SAML:2.0:protocol\""
            + " xmlns:saml=\"urn:oasis:names:tc:SAML:2.0:assertion\""
            + " ID=\"_" + UUID.randomUUID() + "\" Version=\"2.0\" IssueInstant=\"" + issueInstant + "\""
            + " Destination=\"" + acsUrl + "\">"
            + "<saml:Issuer>" + IDP_ENTITY_ID + "</saml:Issuer>"
            + "<samlp:Status><samlp:StatusCode Value=\"urn:oasis:names:tc:SAML:2.0:status:Success\"/></samlp:Status>"
            + "<saml:Assertion ID=\"_" + UUID.randomUUID() + "\" Version=\"2.0\" IssueInstant=\"" + issueInstant + "\">"
            + "<saml:Issuer>" + IDP_ENTITY_ID + "</saml:Issuer>"
            + "<saml:Subject>"
            + "<saml:NameID Format=\"urn:oasis:names:tc:SAML:2.0:nameid-format:persistent\">" + nameId + "</saml:NameID>"
            + "<saml:SubjectConfirmation Method=\"urn:oasis:names:tc:SAML:2.0:cm:bearer\">"
            + "<saml:SubjectConfirmationData NotOnOrAfter=\"" + notOnOrAfter + "\" Recipient=\"" + acsUrl + "\"/>"
            + "</saml:SubjectConfirmation>"
            + "</saml:Subject>"
            + "<saml:Conditions NotBefore=\"" + notBefore + "\" NotOnOrAfter=\"" + notOnOrAfter + "\">"
            + "<saml:AudienceRestriction><saml:Audience>" + audience + "</saml:Audience></saml:AudienceRestriction>"
            + "</saml:Conditions>"
            + "<saml:AuthnStatement AuthnInstant=\"" + issueInstant + "\" SessionIndex=\"" + SESSION_INDEX + "\">"
            + "<saml:AuthnContext><saml:AuthnContextClassRef>"
            + "urn:oasis:names:tc:SAML:2.0:ac:classes:PasswordProtectedTransport"
            + "</saml:AuthnContextClassRef></saml:AuthnContext>"
            + "</saml:AuthnStatement>"
            + "<saml:AttributeStatement>" + attributeStatement + "</saml:AttributeStatement>"
            + "</saml:Assertion>"
            + "</samlp:Response>";

        Document document = Util.loadXML(xml);
        PrivateKey key = Util.loadPrivateKey(SamlTestFixtures.pem("certs/idp.key"));
        X509Certificate certificate = Util.loadCert(SamlTestFixtures.pem("certs/idp.crt"));
        String signed = Util.addSign(document, key, certificate, Constants.RSA_SHA256, Constants.SHA256);
        return Base64.getEncoder().encodeToString(signed.getBytes(StandardCharsets.UTF_8));
    }
}
