package socialauth.saml.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import socialauth.saml.idp.IdentityProviderRegistry;

/**
 * SAML service provider wiring. The IdP registry is built once from
 * {@link SamlProperties}; a bad IdP entry fails startup.
 */
@Configuration
public class SamlConfig {

    @Bean
    public IdentityProviderRegistry identityProviderRegistry(SamlProperties properties) {
        return IdentityProviderRegistry.fromProperties(properties);
    }
}
