package socialauth.saml.claims;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import socialauth.saml.exception.SamlMissingAttributesException;
import socialauth.saml.idp.AttributeRole;
import socialauth.saml.idp.IdentityProviderConfig;
import socialauth.saml.util.LogSanitizer;

/**
 * Turns the attributes of a verified assertion into a permanent id and profile,
 * reading each role from the provider's override or the OID default.
 */
@Slf4j
@Component
public class ClaimsMapper {

    /**
     * Permanent, unique identifier of the user at this IdP. The NameID can be
     * selected with the override {@code name_id}.
     *
     * @throws SamlMissingAttributesException if the attribute is absent, has no values
     *     or its first value is empty
     */
    public String extractPermanentId(SamlAttributes attributes, IdentityProviderConfig idp)
            throws SamlMissingAttributesException {
        String key = idp.attributeName(AttributeRole.USER_PERMANENT_ID);
        String value = attributes.first(key);
        if (value == null || value.isEmpty()) {
            log.warn("SAML response from IdP '{}' is missing permanent id attribute '{}'",
                idp.name(), LogSanitizer.sanitize(key));
            throw new SamlMissingAttributesException(
                "SAML assertion from IdP '" + idp.name() + "' missing required attribute '" + key + "'");
        }
        return value;
    }

    public UserProfile mapProfile(SamlAttributes attributes, IdentityProviderConfig idp) {
        return new UserProfile(
            lookup(attributes, idp, AttributeRole.FULL_NAME),
            lookup(attributes, idp, AttributeRole.FIRST_NAME),
            lookup(attributes, idp, AttributeRole.LAST_NAME),
            lookup(attributes, idp, AttributeRole.USERNAME),
            lookup(attributes, idp, AttributeRole.EMAIL));
    }

    public NormalizedIdentity toIdentity(IdentityProviderConfig idp, SamlAttributes attributes, String sessionIndex)
            throws SamlMissingAttributesException {
        String permanentId = extractPermanentId(attributes, idp);
        UserProfile profile = mapProfile(attributes, idp);
        return NormalizedIdentity.of(idp.name(), permanentId, profile, sessionIndex, attributes.asMap());
    }

    private String lookup(SamlAttributes attributes, IdentityProviderConfig idp, AttributeRole role) {
        return attributes.first(idp.attributeName(role));
    }
}
