package socialauth.saml;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SamlServiceProviderApplication {

    public static void main(String[] args) {
        SpringApplication.run(SamlServiceProviderApplication.class, args);
    }
}
