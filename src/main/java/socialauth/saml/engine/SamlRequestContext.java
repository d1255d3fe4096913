package socialauth.saml.engine;

import jakarta.servlet.http.HttpServletRequest;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The parts of the incoming HTTP request the SAML engine needs: the URL the
 * browser used, to check the response Destination, and the request parameters.
 */
public record SamlRequestContext(
    boolean https,
    String host,
    int port,
    String path,
    String queryString,
    Map<String, List<String>> parameters
) {

    public SamlRequestContext {
        parameters = parameters == null ? Collections.emptyMap() : Collections.unmodifiableMap(parameters);
    }

    public static SamlRequestContext fromServletRequest(HttpServletRequest request) {
        Map<String, List<String>> parameters = new LinkedHashMap<>();
        request.getParameterMap().forEach((name, values) -> parameters.put(name, List.of(values)));
        return new SamlRequestContext(
            request.isSecure(),
            request.getServerName(),
            request.getServerPort(),
            request.getRequestURI(),
            request.getQueryString(),
            parameters);
    }

    /**
     * First value of a GET or POST parameter, or {@code null}.
     */
    public String parameter(String name) {
        List<String> values = parameters.get(name);
        if (values == null || values.isEmpty()) {
            return null;
        }
        return values.get(0);
    }

    /**
     * Absolute URL of the request without its query string.
     */
    public String selfUrlNoQuery() {
        String scheme = https ? "https" : "http";
        StringBuilder url = new StringBuilder(scheme).append("://").append(host);
        boolean defaultPort = (https && port == 443) || (!https && port == 80);
        if (port > 0 && !defaultPort) {
            url.append(':').append(port);
        }
        if (path != null) {
            url.append(path);
        }
        return url.toString();
    }
}
