package socialauth.saml.idp;

/**
 * Well-known attribute names (OID URNs) released by SAML identity providers.
 */
public final class SamlOids {

    public static final String COMMON_NAME = "urn:oid:2.5.4.3";
    public static final String EDU_PERSON_PRINCIPAL_NAME = "urn:oid:1.3.6.1.4.1.5923.1.1.1.6";
    public static final String EDU_PERSON_ENTITLEMENT = "urn:oid:1.3.6.1.4.1.5923.1.1.1.7";
    public static final String GIVEN_NAME = "urn:oid:2.5.4.42";
    public static final String MAIL = "urn:oid:0.9.2342.19200300.100.1.3";
    public static final String SURNAME = "urn:oid:2.5.4.4";
    public static final String USERID = "urn:oid:0.9.2342.19200300.100.1.1";

    private SamlOids() {
        // Constants holder
    }
}
