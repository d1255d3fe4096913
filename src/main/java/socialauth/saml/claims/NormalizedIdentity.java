package socialauth.saml.claims;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Identity handed to the account-linking pipeline after a successful SAML login.
 */
public record NormalizedIdentity(
    String idpName,
    String permanentId,
    String fullName,
    String firstName,
    String lastName,
    String username,
    String email,
    String sessionIndex,
    Map<String, List<String>> attributes
) {

    public NormalizedIdentity {
        if (idpName == null || idpName.isEmpty()) {
            throw new IllegalArgumentException("idpName is required");
        }
        if (permanentId == null || permanentId.isEmpty()) {
            throw new IllegalArgumentException("permanentId is required");
        }
        attributes = attributes == null ? Collections.emptyMap() : attributes;
    }

    public static NormalizedIdentity of(String idpName, String permanentId, UserProfile profile,
                                        String sessionIndex, Map<String, List<String>> attributes) {
        return new NormalizedIdentity(
            idpName,
            permanentId,
            profile.fullName(),
            profile.firstName(),
            profile.lastName(),
            profile.username(),
            profile.email(),
            sessionIndex,
            attributes);
    }

    /**
     * Externally visible user id; the IdP prefix keeps ids from different
     * providers apart.
     */
    public String userId() {
        return idpName + ":" + permanentId;
    }

    public UserProfile profile() {
        return new UserProfile(fullName, firstName, lastName, username, email);
    }
}
