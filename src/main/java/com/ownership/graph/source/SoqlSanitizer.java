package com.ownership.graph.source;

/**
 * Escaping and validation of values embedded in SoQL {@code $where} clauses.
 */
public final class SoqlSanitizer {

    /** Maximum allowed length of a single literal. */
    public static final int MAX_LITERAL_LENGTH = 500;

    private SoqlSanitizer() {
        // utility class
    }

    /**
     * Wraps the value in single quotes, doubling any embedded quote.
     *
     * @throws IllegalArgumentException if the value is too long or contains control characters
     */
    public static String quote(String value) {
        return "'" + escape(value) + "'";
    }

    /**
     * Quotes the value as a {@code like} operand matching it anywhere: {@code '%value%'}.
     * {@code %} and {@code _} inside the value are dropped so they cannot act as wildcards.
     */
    public static String containsPattern(String value) {
        String cleaned = value == null ? "" : value.replace("%", "").replace("_", "");
        return "'%" + escape(cleaned) + "%'";
    }

    private static String escape(String value) {
        String v = value == null ? "" : value;
        if (v.length() > MAX_LITERAL_LENGTH) {
            throw new IllegalArgumentException(
                    "SoQL literal exceeds maximum length of " + MAX_LITERAL_LENGTH +
                            " characters (was " + v.length() + ")");
        }
        if (containsControlCharacters(v)) {
            throw new IllegalArgumentException("SoQL literal must not contain control characters");
        }
        return v.replace("'", "''");
    }

    private static boolean containsControlCharacters(String s) {
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c < 0x20 || c == 0x7F) {
                return true;
            }
        }
        return false;
    }
}
