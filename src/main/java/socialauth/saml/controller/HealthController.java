package socialauth.saml.controller;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import socialauth.saml.config.SamlProperties;
import socialauth.saml.idp.IdentityProviderRegistry;

@RestController
@RequestMapping("/health")
@RequiredArgsConstructor
@Slf4j
public class HealthController {

    private final IdentityProviderRegistry registry;
    private final SamlProperties properties;

    @GetMapping
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> healthStatus = new HashMap<>();
        try {
            boolean spConfigured = isSpConfigured();
            healthStatus.put("status", spConfigured && registry.size() > 0 ? "UP" : "DEGRADED");
            healthStatus.put("timestamp", Instant.now().toString());
            healthStatus.put("service", "saml-service-provider");
            healthStatus.put("sp_configured", spConfigured);
            healthStatus.put("idp_count", registry.size());
            healthStatus.put("idps", registry.names());
            healthStatus.put("strict", properties.isStrict());
            return ResponseEntity.ok(healthStatus);
        } catch (Exception e) {
            log.error("Health check failed", e);
            healthStatus.put("status", "DOWN");
            healthStatus.put("error", e.getMessage());
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(healthStatus);
        }
    }

    private boolean isSpConfigured() {
        SamlProperties.Sp sp = properties.getSp();
        return hasText(sp.getEntityId()) && hasText(sp.getCompletionUrl());
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
