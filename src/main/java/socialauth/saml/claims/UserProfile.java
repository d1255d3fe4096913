package socialauth.saml.claims;

/**
 * Best-effort profile; any field may be null.
 */
public record UserProfile(
    String fullName,
    String firstName,
    String lastName,
    String username,
    String email
) {
}
