package socialauth.saml.claims;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Attributes released in a verified assertion, keyed by attribute name.
 *
 * <p>The subject NameID, when present, is exposed under {@link #NAME_ID} so that a
 * provider can select it as the permanent id.
 */
public final class SamlAttributes {

    public static final String NAME_ID = "name_id";

    private final Map<String, List<String>> values;

    private SamlAttributes(Map<String, List<String>> values) {
        this.values = values;
    }

    public static SamlAttributes of(Map<String, List<String>> attributes) {
        return of(attributes, null);
    }

    public static SamlAttributes of(Map<String, List<String>> attributes, String nameId) {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        if (attributes != null) {
            attributes.forEach((name, list) -> {
                if (name != null) {
                    copy.put(name, list == null ? List.of() : List.copyOf(list));
                }
            });
        }
        if (nameId != null && !nameId.isEmpty()) {
            copy.put(NAME_ID, List.of(nameId));
        }
        return new SamlAttributes(Collections.unmodifiableMap(copy));
    }

    /**
     * First value of a (possibly multi-valued) attribute, or {@code null} when the
     * attribute is absent or empty.
     */
    public String first(String name) {
        List<String> list = values.get(name);
        if (list == null || list.isEmpty()) {
            return null;
        }
        return list.get(0);
    }

    public List<String> all(String name) {
        return values.getOrDefault(name, List.of());
    }

    public Map<String, List<String>> asMap() {
        return values;
    }

    @Override
    public String toString() {
        return "SamlAttributes" + values.keySet();
    }
}
