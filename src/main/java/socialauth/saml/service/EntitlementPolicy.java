package socialauth.saml.service;

import java.util.List;
import socialauth.saml.claims.SamlAttributes;
import socialauth.saml.exception.SamlPolicyRejectedException;
import socialauth.saml.idp.IdentityProviderConfig;
import socialauth.saml.idp.SamlOids;

/**
 * Check run after the SAML response has been verified and before the identity is
 * handed on. Throwing vetoes the login; returning normally allows it.
 */
@FunctionalInterface
public interface EntitlementPolicy {

    void check(IdentityProviderConfig idp, SamlAttributes attributes) throws SamlPolicyRejectedException;

    static EntitlementPolicy allowAll() {
        return (idp, attributes) -> { };
    }

    /**
     * Requires every entitlement listed in the provider's configuration to be present
     * in eduPersonEntitlement. Providers without required entitlements allow everyone.
     */
    static EntitlementPolicy configuredEntitlements() {
        return (idp, attributes) -> {
            List<String> required = idp.requiredEntitlements();
            if (required.isEmpty()) {
                return;
            }
            List<String> granted = attributes.all(SamlOids.EDU_PERSON_ENTITLEMENT);
            for (String entitlement : required) {
                if (!granted.contains(entitlement)) {
                    throw new SamlPolicyRejectedException(
                        "User from IdP '" + idp.name() + "' lacks required entitlement '" + entitlement + "'");
                }
            }
        };
    }

    default EntitlementPolicy and(EntitlementPolicy next) {
        return (idp, attributes) -> {
            check(idp, attributes);
            next.check(idp, attributes);
        };
    }
}
