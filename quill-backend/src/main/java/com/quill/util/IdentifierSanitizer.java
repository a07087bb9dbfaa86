package com.quill.util;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Turns arbitrary user input (file names, URL path segments) into safe SQL identifiers.
 *
 * <p>Output contains only {@code [a-z0-9_]}, starts with a letter or underscore and is at most
 * {@value #MAX_LENGTH} characters long.
 */
public final class IdentifierSanitizer {

    public static final int MAX_LENGTH = 64;

    private static final Pattern DISALLOWED = Pattern.compile("[^a-zA-Z0-9_]");
    private static final Pattern VALID_START = Pattern.compile("^[a-zA-Z_].*");

    private IdentifierSanitizer() {
    }

    /**
     * Sanitize an identifier.
     *
     * @param identifier raw identifier, may be null
     * @return sanitized, lower-cased identifier
     */
    public static String sanitize(String identifier) {
        String clean = DISALLOWED.matcher(identifier != null ? identifier : "").replaceAll("");
        if (clean.isEmpty() || !VALID_START.matcher(clean).matches()) {
            clean = "t_" + clean;
        }
        if (clean.length() > MAX_LENGTH) {
            clean = clean.substring(0, MAX_LENGTH);
        }
        return clean.toLowerCase(Locale.ROOT);
    }

    /**
     * Quote an identifier for use in generated SQL.
     *
     * @param identifier identifier
     * @return double-quoted identifier with embedded quotes escaped
     */
    public static String quote(String identifier) {
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }
}
