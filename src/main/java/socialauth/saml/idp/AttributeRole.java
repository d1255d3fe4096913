package socialauth.saml.idp;

/**
 * Logical claims read from an assertion, each with the attribute name used
 * when the provider configuration has no override.
 */
public enum AttributeRole {
    USER_PERMANENT_ID(SamlOids.USERID),
    FULL_NAME(SamlOids.COMMON_NAME),
    FIRST_NAME(SamlOids.GIVEN_NAME),
    LAST_NAME(SamlOids.SURNAME),
    USERNAME(SamlOids.USERID),
    EMAIL(SamlOids.MAIL);

    private final String defaultAttribute;

    AttributeRole(String defaultAttribute) {
        this.defaultAttribute = defaultAttribute;
    }

    public String defaultAttribute() {
        return defaultAttribute;
    }
}
