package socialauth.saml.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Collections;
import lombok.AllArgsConstructor;
import lombok.Getter;
import socialauth.saml.claims.NormalizedIdentity;

/**
 * Response body of a completed SAML login
 */
@Getter
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SamlLoginResponse {
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private final String userId;
    private final String idpName;
    private final String permanentId;
    private final String fullName;
    private final String firstName;
    private final String lastName;
    private final String username;
    private final String email;
    private final String sessionIndex;

    public static SamlLoginResponse from(NormalizedIdentity identity) {
        return new SamlLoginResponse(
            identity.userId(),
            identity.idpName(),
            identity.permanentId(),
            identity.fullName(),
            identity.firstName(),
            identity.lastName(),
            identity.username(),
            identity.email(),
            identity.sessionIndex());
    }

    public String toJson() {
        try {
            return OBJECT_MAPPER.writeValueAsString(this);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize SAML login response", e);
        }
    }

    /**
     * Creates error response in JSON format
     */
    public static String errorJson(String message) {
        try {
            return OBJECT_MAPPER.writeValueAsString(Collections.singletonMap("error", message));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize SAML error response", e);
        }
    }
}
