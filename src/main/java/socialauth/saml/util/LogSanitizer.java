package socialauth.saml.util;

import java.util.regex.Pattern;

/**
 * Makes IdP-supplied and request-supplied values safe for logging.
 * Control characters are replaced to prevent log injection and user
 * identifiers can be masked.
 */
public final class LogSanitizer {

    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\r\\n\\t]+");
    private static final int MAX_LENGTH = 256;

    private LogSanitizer() {
        // Utility class
    }

    /**
     * Removes control characters and truncates overly long values.
     *
     * @param value request or assertion supplied value
     * @return sanitized value safe for log statements
     */
    public static String sanitize(String value) {
        if (value == null) {
            return "";
        }
        String cleaned = CONTROL_CHARS.matcher(value).replaceAll("_");
        if (cleaned.length() > MAX_LENGTH) {
            return cleaned.substring(0, MAX_LENGTH) + "...";
        }
        return cleaned;
    }

    /**
     * Masks an identifier while keeping enough context for debugging.
     */
    public static String maskIdentifier(String identifier) {
        String sanitized = sanitize(identifier);
        if (sanitized.isEmpty()) {
            return "";
        }
        if (sanitized.length() == 1) {
            return "*";
        }
        if (sanitized.length() <= 4) {
            return sanitized.charAt(0) + "***";
        }
        int prefixLength = Math.min(6, sanitized.length() / 2);
        int suffixLength = Math.min(4, Math.max(1, sanitized.length() - prefixLength));
        return sanitized.substring(0, prefixLength) + "..." + sanitized.substring(sanitized.length() - suffixLength);
    }

    /**
     * Masks a prefixed user id ({@code idp:permanentId}), keeping the IdP name readable.
     */
    public static String maskUserId(String userId) {
        String sanitized = sanitize(userId);
        int colon = sanitized.indexOf(':');
        if (colon < 0) {
            return maskIdentifier(sanitized);
        }
        return sanitized.substring(0, colon + 1) + maskIdentifier(sanitized.substring(colon + 1));
    }
}
