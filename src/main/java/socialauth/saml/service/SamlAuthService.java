package socialauth.saml.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import socialauth.saml.claims.ClaimsMapper;
import socialauth.saml.claims.NormalizedIdentity;
import socialauth.saml.claims.SamlAttributes;
import socialauth.saml.engine.MetadataDocument;
import socialauth.saml.engine.ProcessedSamlResponse;
import socialauth.saml.engine.SamlProtocolEngine;
import socialauth.saml.engine.SamlRequestContext;
import socialauth.saml.exception.SamlMissingAttributesException;
import socialauth.saml.exception.SamlPolicyRejectedException;
import socialauth.saml.exception.SamlProtocolValidationException;
import socialauth.saml.exception.UnknownIdentityProviderException;
import socialauth.saml.idp.IdentityProviderConfig;
import socialauth.saml.idp.IdentityProviderRegistry;
import socialauth.saml.util.LogSanitizer;

/**
 * SAML 2.0 service provider login flow.
 *
 * <p>Many IdPs share one ACS URL, so the IdP name travels through the round trip
 * as the RelayState.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SamlAuthService {

    public static final String IDP_PARAMETER = "idp";
    public static final String RELAY_STATE_PARAMETER = "RelayState";

    private final IdentityProviderRegistry registry;
    private final SamlProtocolEngine engine;
    private final ClaimsMapper claimsMapper;

    /**
     * URL to redirect the browser to in order to authenticate at the IdP named by
     * the {@code idp} request parameter.
     */
    public String resolveRedirectTarget(SamlRequestContext context)
            throws UnknownIdentityProviderException, SamlProtocolValidationException {
        String idpName = context.parameter(IDP_PARAMETER);
        IdentityProviderConfig idp = registry.resolve(idpName);
        String url = engine.buildLoginRedirect(context, idp, idp.name());
        log.info("Redirecting to SAML IdP '{}'", idp.name());
        return url;
    }

    public NormalizedIdentity completeLogin(SamlRequestContext context)
            throws UnknownIdentityProviderException, SamlProtocolValidationException,
                   SamlPolicyRejectedException, SamlMissingAttributesException {
        return completeLogin(context, EntitlementPolicy.configuredEntitlements());
    }

    /**
     * Verifies the SAML response posted back by the IdP and maps it to an identity.
     *
     * @param policy checked after protocol validation, before claims mapping
     */
    public NormalizedIdentity completeLogin(SamlRequestContext context, EntitlementPolicy policy)
            throws UnknownIdentityProviderException, SamlProtocolValidationException,
                   SamlPolicyRejectedException, SamlMissingAttributesException {
        String idpName = context.parameter(RELAY_STATE_PARAMETER);
        IdentityProviderConfig idp = registry.resolve(idpName);

        ProcessedSamlResponse response = engine.processResponse(context, idp);
        if (!response.isValid()) {
            log.warn("SAML login via IdP '{}' failed: {} ({})", idp.name(), response.errors(),
                LogSanitizer.sanitize(response.lastErrorReason()));
            throw new SamlProtocolValidationException(response.errors(), response.lastErrorReason());
        }

        SamlAttributes attributes = SamlAttributes.of(response.attributes(), response.nameId());
        if (policy != null) {
            policy.check(idp, attributes);
        }

        NormalizedIdentity identity = claimsMapper.toIdentity(idp, attributes, response.sessionIndex());
        log.info("SAML login completed for user {}", LogSanitizer.maskUserId(identity.userId()));
        return identity;
    }

    /**
     * SP metadata to register this service with each IdP. Built against the
     * placeholder IdP since no real provider is involved.
     */
    public MetadataDocument generateMetadataXml() {
        MetadataDocument metadata = engine.buildMetadataDocument(registry.placeholder());
        if (!metadata.errors().isEmpty()) {
            log.warn("SP metadata has errors: {}", metadata.errors());
        }
        return metadata;
    }
}
