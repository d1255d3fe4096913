package socialauth.saml.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

@Data
@Component
@ConfigurationProperties(prefix = "saml")
@Validated
public class SamlProperties {

    @Valid
    private Sp sp = new Sp();

    /** Organization info keyed by language tag, e.g. {@code en-US}. */
    private Map<String, Organization> orgInfo = new LinkedHashMap<>();

    @Valid
    private Contact technicalContact = new Contact();
    @Valid
    private Contact supportContact = new Contact();

    /** Configured identity providers keyed by slug. */
    private Map<String, Idp> enabledIdps = new LinkedHashMap<>();

    /** Overrides for {@code onelogin.saml2.security.*}. */
    private Map<String, String> securityConfig = new LinkedHashMap<>();

    /** Overrides for {@code onelogin.saml2.sp.*}, applied last. */
    private Map<String, String> spExtra = new LinkedHashMap<>();

    private boolean strict = true;
    private boolean debug = true;

    /** cacheDuration advertised in the SP metadata document. */
    private Duration metadataCacheDuration = Duration.ofDays(10);

    /** validUntil of the SP metadata document, relative to generation time. */
    private Duration metadataValidFor = Duration.ofDays(2);

    @Data
    public static class Sp {
        @NotBlank
        private String entityId;
        private String publicCert;
        private String privateKey;
        /** Absolute ACS URL every IdP posts back to. */
        @NotBlank
        private String completionUrl;
        private List<String> nameidFormats = new ArrayList<>();
    }

    @Data
    public static class Organization {
        private String name;
        private String displayname;
        private String url;
    }

    @Data
    public static class Contact {
        private String givenName;
        @Email
        private String emailAddress;
    }

    @Data
    public static class Idp {
        private String entityId;
        private String url;
        private String binding;
        private String x509cert;
        private String userPermanentId;
        private String attrFullName;
        private String attrFirstName;
        private String attrLastName;
        private String attrUsername;
        private String attrEmail;
        /** eduPersonEntitlement values the user must carry. Empty allows everyone. */
        private List<String> requiredEntitlements = new ArrayList<>();
    }
}
