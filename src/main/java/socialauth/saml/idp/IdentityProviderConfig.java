package socialauth.saml.idp;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import socialauth.saml.exception.InvalidSamlConfigurationException;

/**
 * Immutable configuration of one SAML identity provider.
 *
 * <p>The {@code name} is a slug: it becomes the prefix of every user id issued
 * through this provider ({@code name + ":" + permanentId}), so it may not contain
 * a colon or whitespace.
 */
public record IdentityProviderConfig(
    String name,
    String entityId,
    String ssoUrl,
    String binding,
    String x509Certificate,
    Map<AttributeRole, String> attributeOverrides,
    List<String> requiredEntitlements
) {

    public static final String HTTP_REDIRECT_BINDING = "urn:oasis:names:tc:SAML:2.0:bindings:HTTP-Redirect";

    private static final String PLACEHOLDER_NAME = "dummy";

    public IdentityProviderConfig {
        if (name == null || name.isEmpty()) {
            throw new InvalidSamlConfigurationException("IdP 'name' must not be empty");
        }
        if (name.contains(":") || name.chars().anyMatch(Character::isWhitespace)) {
            throw new InvalidSamlConfigurationException(
                "IdP 'name' should be a slug (short, no spaces, no colons): '" + name + "'");
        }
        binding = binding == null || binding.isBlank() ? HTTP_REDIRECT_BINDING : binding;
        attributeOverrides = attributeOverrides == null || attributeOverrides.isEmpty()
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new EnumMap<>(attributeOverrides));
        requiredEntitlements = requiredEntitlements == null
            ? Collections.emptyList()
            : List.copyOf(requiredEntitlements);
    }

    public IdentityProviderConfig(String name, String entityId, String ssoUrl, String x509Certificate) {
        this(name, entityId, ssoUrl, null, x509Certificate, null, null);
    }

    /**
     * Placeholder provider for calls where the SAML engine insists on IdP data
     * that is never used, such as generating this SP's own metadata.
     */
    public static IdentityProviderConfig placeholder() {
        return new IdentityProviderConfig(
            PLACEHOLDER_NAME,
            "https://dummy.none/saml2",
            "https://dummy.none/SSO",
            "");
    }

    /**
     * Attribute name to read for the given role: the configured override, or the
     * role's OID default.
     */
    public String attributeName(AttributeRole role) {
        String override = attributeOverrides.get(role);
        if (override != null && !override.isBlank()) {
            return override;
        }
        return role.defaultAttribute();
    }

    public IdpMetadataDescriptor toMetadataDescriptor() {
        return new IdpMetadataDescriptor(entityId, ssoUrl, binding, x509Certificate);
    }
}
