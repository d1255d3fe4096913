package socialauth.saml.engine;

import com.onelogin.saml2.settings.Saml2Settings;
import com.onelogin.saml2.settings.SettingsBuilder;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import socialauth.saml.config.SamlProperties;
import socialauth.saml.exception.InvalidSamlConfigurationException;
import socialauth.saml.idp.IdentityProviderConfig;

/**
 * Builds java-saml settings for a single IdP from the SP configuration.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SamlSettingsFactory {

    static final String HTTP_POST_BINDING = "urn:oasis:names:tc:SAML:2.0:bindings:HTTP-POST";

    private static final String PREFIX = "onelogin.saml2.";
    private static final String SP_PREFIX = PREFIX + "sp.";
    private static final String IDP_PREFIX = PREFIX + "idp.";
    private static final String SECURITY_PREFIX = PREFIX + "security.";
    private static final String ORGANIZATION_PREFIX = PREFIX + "organization.";
    private static final String CONTACTS_PREFIX = PREFIX + "contacts.";

    private final SamlProperties properties;

    /**
     * Settings values in java-saml property format. Blank values are left out.
     */
    public Map<String, Object> settingsValues(IdentityProviderConfig idp) {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put(PREFIX + "strict", properties.isStrict());
        values.put(PREFIX + "debug", properties.isDebug());

        SamlProperties.Sp sp = properties.getSp();
        put(values, SP_PREFIX + "entityid", sp.getEntityId());
        put(values, SP_PREFIX + "assertion_consumer_service.url", sp.getCompletionUrl());
        put(values, SP_PREFIX + "assertion_consumer_service.binding", HTTP_POST_BINDING);
        put(values, SP_PREFIX + "nameidformat", nameIdFormat(sp.getNameidFormats()));
        put(values, SP_PREFIX + "x509cert", sp.getPublicCert());
        put(values, SP_PREFIX + "privatekey", sp.getPrivateKey());

        put(values, IDP_PREFIX + "entityid", idp.entityId());
        put(values, IDP_PREFIX + "single_sign_on_service.url", idp.ssoUrl());
        put(values, IDP_PREFIX + "single_sign_on_service.binding", idp.binding());
        put(values, IDP_PREFIX + "x509cert", idp.x509Certificate());

        putOrganization(values);
        putContact(values, "technical", properties.getTechnicalContact());
        putContact(values, "support", properties.getSupportContact());

        properties.getSecurityConfig().forEach((key, value) -> put(values, SECURITY_PREFIX + key, value));
        properties.getSpExtra().forEach((key, value) -> put(values, SP_PREFIX + key, value));
        return values;
    }

    public Saml2Settings build(IdentityProviderConfig idp) {
        try {
            return new SettingsBuilder().fromValues(settingsValues(idp)).build();
        } catch (RuntimeException e) {
            throw new InvalidSamlConfigurationException(
                "Unable to build SAML settings for IdP '" + idp.name() + "': " + e.getMessage(), e);
        }
    }

    /**
     * Settings for a login round trip; SP and IdP sections must both be usable.
     */
    public Saml2Settings buildValidated(IdentityProviderConfig idp) {
        Saml2Settings settings = build(idp);
        List<String> errors = settings.checkSettings();
        if (!errors.isEmpty()) {
            throw new InvalidSamlConfigurationException(
                "Invalid SAML settings for IdP '" + idp.name() + "': " + String.join(", ", errors));
        }
        return settings;
    }

    private String nameIdFormat(List<String> formats) {
        if (formats == null || formats.isEmpty()) {
            return null;
        }
        if (formats.size() > 1) {
            log.warn("Only one SP NameID format is advertised; ignoring {}", formats.subList(1, formats.size()));
        }
        return formats.get(0);
    }

    private void putOrganization(Map<String, Object> values) {
        Map<String, SamlProperties.Organization> orgInfo = properties.getOrgInfo();
        if (orgInfo.isEmpty()) {
            return;
        }
        Map.Entry<String, SamlProperties.Organization> first = orgInfo.entrySet().iterator().next();
        if (orgInfo.size() > 1) {
            log.warn("Only one organization entry is published; using language '{}'", first.getKey());
        }
        SamlProperties.Organization org = first.getValue();
        put(values, ORGANIZATION_PREFIX + "name", org.getName());
        put(values, ORGANIZATION_PREFIX + "displayname", org.getDisplayname());
        put(values, ORGANIZATION_PREFIX + "url", org.getUrl());
        put(values, ORGANIZATION_PREFIX + "lang", first.getKey());
    }

    private void putContact(Map<String, Object> values, String type, SamlProperties.Contact contact) {
        if (contact == null) {
            return;
        }
        put(values, CONTACTS_PREFIX + type + ".given_name", contact.getGivenName());
        put(values, CONTACTS_PREFIX + type + ".email_address", contact.getEmailAddress());
    }

    private static void put(Map<String, Object> values, String key, String value) {
        if (value != null && !value.isBlank()) {
            values.put(key, value.trim());
        }
    }
}
