package socialauth.saml.idp;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import socialauth.saml.config.SamlProperties;
import socialauth.saml.exception.InvalidSamlConfigurationException;
import socialauth.saml.exception.UnknownIdentityProviderException;
import socialauth.saml.util.LogSanitizer;

/**
 * Read-only table of the configured identity providers, keyed by slug.
 * Safe for concurrent reads once built.
 */
@Slf4j
public class IdentityProviderRegistry {

    private final Map<String, IdentityProviderConfig> providers;

    public IdentityProviderRegistry(Map<String, IdentityProviderConfig> providers) {
        Map<String, IdentityProviderConfig> copy = new LinkedHashMap<>();
        if (providers != null) {
            providers.forEach((key, config) -> {
                if (config == null) {
                    throw new InvalidSamlConfigurationException("IdP '" + key + "' has no configuration");
                }
                if (!config.name().equals(key)) {
                    throw new InvalidSamlConfigurationException(
                        "IdP registered as '" + key + "' is named '" + config.name() + "'");
                }
                copy.put(key, config);
            });
        }
        this.providers = Collections.unmodifiableMap(copy);
    }

    /**
     * Builds the registry from the {@code saml.enabled-idps} table.
     */
    public static IdentityProviderRegistry fromProperties(SamlProperties properties) {
        Map<String, IdentityProviderConfig> configs = new LinkedHashMap<>();
        properties.getEnabledIdps().forEach((name, idp) -> configs.put(name, toConfig(name, idp)));
        IdentityProviderRegistry registry = new IdentityProviderRegistry(configs);
        log.info("Loaded {} SAML identity provider(s): {}", registry.size(), registry.names());
        return registry;
    }

    private static IdentityProviderConfig toConfig(String name, SamlProperties.Idp idp) {
        if (idp == null) {
            throw new InvalidSamlConfigurationException("IdP '" + name + "' has no configuration");
        }
        requireSetting(name, "entity-id", idp.getEntityId());
        requireSetting(name, "url", idp.getUrl());
        requireSetting(name, "x509cert", idp.getX509cert());

        Map<AttributeRole, String> overrides = new EnumMap<>(AttributeRole.class);
        putOverride(overrides, AttributeRole.USER_PERMANENT_ID, idp.getUserPermanentId());
        putOverride(overrides, AttributeRole.FULL_NAME, idp.getAttrFullName());
        putOverride(overrides, AttributeRole.FIRST_NAME, idp.getAttrFirstName());
        putOverride(overrides, AttributeRole.LAST_NAME, idp.getAttrLastName());
        putOverride(overrides, AttributeRole.USERNAME, idp.getAttrUsername());
        putOverride(overrides, AttributeRole.EMAIL, idp.getAttrEmail());

        return new IdentityProviderConfig(
            name,
            idp.getEntityId().trim(),
            idp.getUrl().trim(),
            idp.getBinding(),
            idp.getX509cert().trim(),
            overrides,
            idp.getRequiredEntitlements());
    }

    private static void requireSetting(String idpName, String key, String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidSamlConfigurationException(
                "IdP '" + idpName + "' is missing required setting '" + key + "'");
        }
    }

    private static void putOverride(Map<AttributeRole, String> overrides, AttributeRole role, String value) {
        if (value != null && !value.isBlank()) {
            overrides.put(role, value.trim());
        }
    }

    public IdentityProviderConfig resolve(String name) throws UnknownIdentityProviderException {
        if (name == null || name.isBlank()) {
            throw new UnknownIdentityProviderException(name);
        }
        IdentityProviderConfig config = providers.get(name);
        if (config == null) {
            log.warn("Requested unknown SAML IdP '{}'", LogSanitizer.sanitize(name));
            throw new UnknownIdentityProviderException(name);
        }
        return config;
    }

    public IdpMetadataDescriptor metadataDescriptor(String name) throws UnknownIdentityProviderException {
        return resolve(name).toMetadataDescriptor();
    }

    public IdentityProviderConfig placeholder() {
        return IdentityProviderConfig.placeholder();
    }

    public List<String> names() {
        return List.copyOf(providers.keySet());
    }

    public int size() {
        return providers.size();
    }
}
