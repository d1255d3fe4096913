package socialauth.saml.controller;

import jakarta.servlet.http.HttpServletRequest;
import java.net.URI;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import socialauth.saml.claims.NormalizedIdentity;
import socialauth.saml.dto.SamlLoginResponse;
import socialauth.saml.engine.MetadataDocument;
import socialauth.saml.engine.SamlRequestContext;
import socialauth.saml.exception.SamlMissingAttributesException;
import socialauth.saml.exception.SamlPolicyRejectedException;
import socialauth.saml.exception.SamlProtocolValidationException;
import socialauth.saml.exception.UnknownIdentityProviderException;
import socialauth.saml.service.SamlAuthService;
import socialauth.saml.util.LogSanitizer;

/**
 * SAML 2.0 SP endpoints: login redirect, assertion consumer service and metadata.
 */
@RestController
@RequestMapping("/auth/saml")
@RequiredArgsConstructor
@Slf4j
public class SamlAuthController {

    private final SamlAuthService samlAuthService;

    /**
     * Starts a login at the IdP named by the {@code idp} query parameter.
     */
    @GetMapping("/login")
    public ResponseEntity<String> login(HttpServletRequest request) {
        try {
            String target = samlAuthService.resolveRedirectTarget(SamlRequestContext.fromServletRequest(request));
            return ResponseEntity.status(HttpStatus.FOUND).location(URI.create(target)).build();
        } catch (UnknownIdentityProviderException e) {
            return jsonError(HttpStatus.NOT_FOUND, e.getMessage());
        } catch (SamlProtocolValidationException e) {
            return jsonError(HttpStatus.INTERNAL_SERVER_ERROR, "Unable to start SAML login");
        } catch (Exception e) {
            log.error("SAML login redirect error", e);
            return jsonError(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error");
        }
    }

    /**
     * Assertion consumer service: the IdP posts {@code SAMLResponse} and
     * {@code RelayState} here.
     */
    @PostMapping("/complete")
    public ResponseEntity<String> complete(HttpServletRequest request) {
        try {
            NormalizedIdentity identity = samlAuthService.completeLogin(SamlRequestContext.fromServletRequest(request));
            return ResponseEntity.ok()
                .contentType(MediaType.APPLICATION_JSON)
                .body(SamlLoginResponse.from(identity).toJson());
        } catch (UnknownIdentityProviderException e) {
            return jsonError(HttpStatus.NOT_FOUND, e.getMessage());
        } catch (SamlProtocolValidationException | SamlMissingAttributesException e) {
            return jsonError(HttpStatus.UNAUTHORIZED, e.getMessage());
        } catch (SamlPolicyRejectedException e) {
            log.info("SAML login vetoed: {}", LogSanitizer.sanitize(e.getMessage()));
            return jsonError(HttpStatus.FORBIDDEN, e.getMessage());
        } catch (Exception e) {
            log.error("SAML login completion error", e);
            return jsonError(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error");
        }
    }

    @GetMapping("/metadata")
    public ResponseEntity<String> metadata() {
        MetadataDocument metadata = samlAuthService.generateMetadataXml();
        if (!metadata.isValid()) {
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .contentType(MediaType.TEXT_PLAIN)
                .body(String.join(", ", metadata.errors()));
        }
        return ResponseEntity.ok()
            .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_XML_VALUE)
            .body(metadata.xml());
    }

    private ResponseEntity<String> jsonError(HttpStatus status, String message) {
        return ResponseEntity.status(status)
            .contentType(MediaType.APPLICATION_JSON)
            .body(SamlLoginResponse.errorJson(message));
    }
}
