package socialauth.saml.engine;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Outcome of processing a SAML response. Attributes are only meaningful when
 * {@link #isValid()} is true.
 */
public record ProcessedSamlResponse(
    boolean authenticated,
    Map<String, List<String>> attributes,
    String nameId,
    String sessionIndex,
    List<String> errors,
    String lastErrorReason
) {

    public static final String INVALID_RESPONSE = "invalid_response";

    public ProcessedSamlResponse {
        attributes = attributes == null ? Collections.emptyMap() : Collections.unmodifiableMap(attributes);
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public static ProcessedSamlResponse success(Map<String, List<String>> attributes, String nameId,
                                                String sessionIndex) {
        return new ProcessedSamlResponse(true, attributes, nameId, sessionIndex, List.of(), null);
    }

    public static ProcessedSamlResponse failure(String reason) {
        return new ProcessedSamlResponse(false, null, null, null, List.of(INVALID_RESPONSE), reason);
    }

    public boolean isValid() {
        return authenticated && errors.isEmpty();
    }
}
