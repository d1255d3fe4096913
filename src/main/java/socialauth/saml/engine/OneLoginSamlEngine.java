package socialauth.saml.engine;

import com.onelogin.saml2.authn.AuthnRequest;
import com.onelogin.saml2.authn.SamlResponse;
import com.onelogin.saml2.http.HttpRequest;
import com.onelogin.saml2.settings.Metadata;
import com.onelogin.saml2.settings.Saml2Settings;
import com.onelogin.saml2.util.Util;
import java.security.PrivateKey;
import java.util.ArrayList;
import java.util.Calendar;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import socialauth.saml.config.SamlProperties;
import socialauth.saml.exception.SamlProtocolValidationException;
import socialauth.saml.idp.IdentityProviderConfig;
import socialauth.saml.util.LogSanitizer;

/**
 * {@link SamlProtocolEngine} backed by OneLogin java-saml. Settings are rebuilt per
 * call, so instances hold no per-request state.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OneLoginSamlEngine implements SamlProtocolEngine {

    static final String SAML_REQUEST = "SAMLRequest";
    static final String SAML_RESPONSE = "SAMLResponse";
    static final String RELAY_STATE = "RelayState";

    private final SamlSettingsFactory settingsFactory;
    private final SamlProperties properties;

    @Override
    public String buildLoginRedirect(SamlRequestContext context, IdentityProviderConfig idp, String relayState)
            throws SamlProtocolValidationException {
        Saml2Settings settings = settingsFactory.buildValidated(idp);
        try {
            AuthnRequest authnRequest = new AuthnRequest(settings);
            String samlRequest = authnRequest.getEncodedAuthnRequest();

            StringBuilder query = new StringBuilder();
            query.append(SAML_REQUEST).append('=').append(Util.urlEncoder(samlRequest));
            if (relayState != null && !relayState.isEmpty()) {
                query.append('&').append(RELAY_STATE).append('=').append(Util.urlEncoder(relayState));
            }
            if (settings.getAuthnRequestsSigned()) {
                appendSignature(query, settings);
            }

            String ssoUrl = settings.getIdpSingleSignOnServiceUrl().toString();
            String separator = ssoUrl.contains("?") ? "&" : "?";
            log.debug("Built AuthnRequest {} for IdP '{}'", authnRequest.getId(), idp.name());
            return ssoUrl + separator + query;
        } catch (Exception e) {
            log.error("Unable to build AuthnRequest for IdP '{}'", idp.name(), e);
            throw new SamlProtocolValidationException("Unable to build SAML AuthnRequest: " + e.getMessage(), e);
        }
    }

    /**
     * Redirect-binding signature over {@code SAMLRequest=..&RelayState=..&SigAlg=..}.
     */
    private void appendSignature(StringBuilder query, Saml2Settings settings) throws Exception {
        PrivateKey key = settings.getSPkey();
        if (key == null) {
            throw new IllegalStateException("Signed AuthnRequests require the SP private key");
        }
        String sigAlg = settings.getSignatureAlgorithm();
        query.append("&SigAlg=").append(Util.urlEncoder(sigAlg));
        byte[] signature = Util.sign(query.toString(), key, sigAlg);
        query.append("&Signature=").append(Util.urlEncoder(Util.base64encoder(signature)));
    }

    @Override
    public ProcessedSamlResponse processResponse(SamlRequestContext context, IdentityProviderConfig idp) {
        Saml2Settings settings = settingsFactory.buildValidated(idp);
        if (context.parameter(SAML_RESPONSE) == null) {
            return ProcessedSamlResponse.failure("SAML Response not found, Only supported HTTP_POST Binding");
        }
        try {
            HttpRequest request = new HttpRequest(context.selfUrlNoQuery(), context.parameters(), context.queryString());
            SamlResponse samlResponse = new SamlResponse(settings, request);
            if (!samlResponse.isValid()) {
                String reason = samlResponse.getError();
                log.warn("SAML response from IdP '{}' rejected: {}", idp.name(), LogSanitizer.sanitize(reason));
                return ProcessedSamlResponse.failure(reason);
            }
            Map<String, List<String>> attributes = new LinkedHashMap<>(samlResponse.getAttributes());
            return ProcessedSamlResponse.success(attributes, samlResponse.getNameId(), samlResponse.getSessionIndex());
        } catch (Exception e) {
            log.warn("Unable to process SAML response from IdP '{}': {}", idp.name(),
                LogSanitizer.sanitize(e.getMessage()));
            return ProcessedSamlResponse.failure(e.getMessage());
        }
    }

    @Override
    public MetadataDocument buildMetadataDocument(IdentityProviderConfig idp) {
        Saml2Settings settings = settingsFactory.build(idp);
        List<String> errors = new ArrayList<>(settings.checkSPSettings());
        if (!errors.isEmpty()) {
            return new MetadataDocument(null, errors);
        }
        try {
            Calendar validUntil = Calendar.getInstance();
            validUntil.add(Calendar.SECOND, (int) properties.getMetadataValidFor().getSeconds());
            int cacheDuration = (int) properties.getMetadataCacheDuration().getSeconds();
            String xml = new Metadata(settings, validUntil, cacheDuration).getMetadataString();
            errors.addAll(Saml2Settings.validateMetadata(xml));
            return new MetadataDocument(xml, errors);
        } catch (Exception e) {
            log.error("Unable to generate SP metadata", e);
            errors.add("metadata_generation_failed: " + e.getMessage());
            return new MetadataDocument(null, errors);
        }
    }
}
