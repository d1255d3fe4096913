package socialauth.saml.exception;

import java.util.List;
import lombok.Getter;

/**
 * Exception thrown when the SAML engine rejects the response posted back by the IdP.
 * Carries the engine's error codes and its last error reason.
 */
@Getter
public class SamlProtocolValidationException extends SamlAuthenticationException {

    private final List<String> errors;
    private final String reason;

    public SamlProtocolValidationException(List<String> errors, String reason) {
        super("SAML login failed: " + errors + " (" + reason + ")");
        this.errors = errors == null ? List.of() : List.copyOf(errors);
        this.reason = reason;
    }

    public SamlProtocolValidationException(String message, Throwable cause) {
        super(message, cause);
        this.errors = List.of();
        this.reason = cause != null ? cause.getMessage() : null;
    }
}
