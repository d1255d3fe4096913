package socialauth.saml.idp;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import socialauth.saml.exception.InvalidSamlConfigurationException;

class IdentityProviderConfigTest {

    @Nested
    @DisplayName("Name validation")
    class NameValidationTests {

        @ParameterizedTest
        @ValueSource(strings = {"test:shib", "test shib", "testshib ", ":", "tab\tname"})
        @DisplayName("Should reject names with colons or whitespace")
        void shouldRejectNonSlugNames(String name) {
            assertThatThrownBy(() -> new IdentityProviderConfig(name, "https://idp/", "https://idp/SSO", "cert"))
                .isInstanceOf(InvalidSamlConfigurationException.class)
                .hasMessageContaining("slug");
        }

        @Test
        @DisplayName("Should reject empty names")
        void shouldRejectEmptyName() {
            assertThatThrownBy(() -> new IdentityProviderConfig("", "https://idp/", "https://idp/SSO", "cert"))
                .isInstanceOf(InvalidSamlConfigurationException.class);
            assertThatThrownBy(() -> new IdentityProviderConfig(null, "https://idp/", "https://idp/SSO", "cert"))
                .isInstanceOf(InvalidSamlConfigurationException.class);
        }

        @Test
        @DisplayName("Should accept slugs with dashes and dots")
        void shouldAcceptSlug() {
            IdentityProviderConfig config =
                new IdentityProviderConfig("uni-example.edu", "https://idp/", "https://idp/SSO", "cert");

            assertThat(config.name()).isEqualTo("uni-example.edu");
        }
    }

    @Nested
    @DisplayName("Defaults")
    class DefaultsTests {

        @Test
        @DisplayName("Should default the binding to HTTP-Redirect")
        void shouldDefaultBinding() {
            IdentityProviderConfig config = new IdentityProviderConfig("testshib", "https://idp/", "https://idp/SSO", "cert");

            assertThat(config.binding()).isEqualTo("urn:oasis:names:tc:SAML:2.0:bindings:HTTP-Redirect");
            assertThat(config.attributeOverrides()).isEmpty();
            assertThat(config.requiredEntitlements()).isEmpty();
        }

        @Test
        @DisplayName("Should use OID defaults unless overridden")
        void shouldResolveAttributeNames() {
            IdentityProviderConfig config = new IdentityProviderConfig(
                "testshib", "https://idp/", "https://idp/SSO", null, "cert",
                Map.of(AttributeRole.USERNAME, "custom:attr"), null);

            assertThat(config.attributeName(AttributeRole.USERNAME)).isEqualTo("custom:attr");
            assertThat(config.attributeName(AttributeRole.USER_PERMANENT_ID)).isEqualTo(SamlOids.USERID);
            assertThat(config.attributeName(AttributeRole.FULL_NAME)).isEqualTo(SamlOids.COMMON_NAME);
            assertThat(config.attributeName(AttributeRole.FIRST_NAME)).isEqualTo(SamlOids.GIVEN_NAME);
            assertThat(config.attributeName(AttributeRole.LAST_NAME)).isEqualTo(SamlOids.SURNAME);
            assertThat(config.attributeName(AttributeRole.EMAIL)).isEqualTo(SamlOids.MAIL);
        }

        @Test
        @DisplayName("Placeholder provider carries sentinel URLs and an empty certificate")
        void shouldBuildPlaceholder() {
            IdentityProviderConfig placeholder = IdentityProviderConfig.placeholder();

            assertThat(placeholder.name()).isEqualTo("dummy");
            assertThat(placeholder.entityId()).isEqualTo("https://dummy.none/saml2");
            assertThat(placeholder.ssoUrl()).isEqualTo("https://dummy.none/SSO");
            assertThat(placeholder.x509Certificate()).isEmpty();
        }

        @Test
        @DisplayName("Metadata descriptor mirrors the provider fields")
        void shouldDescribeMetadata() {
            IdentityProviderConfig config = new IdentityProviderConfig("testshib", "https://idp/", "https://idp/SSO", "cert");

            assertThat(config.toMetadataDescriptor()).isEqualTo(new IdpMetadataDescriptor(
                "https://idp/", "https://idp/SSO", IdentityProviderConfig.HTTP_REDIRECT_BINDING, "cert"));
        }
    }
}
