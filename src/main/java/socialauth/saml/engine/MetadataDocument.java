package socialauth.saml.engine;

import java.util.List;

/**
 * SP metadata XML together with the validation errors found in it.
 */
public record MetadataDocument(String xml, List<String> errors) {

    public MetadataDocument {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public boolean isValid() {
        return xml != null && errors.isEmpty();
    }
}
