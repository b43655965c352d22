package com.fieldvault.crypto;

/**
 * Reversible HTML entity escaping applied to string values before encryption and undone after
 * decryption, so decrypted text cannot carry markup into the views that render it.
 *
 * <p>{@code &} is escaped first so that {@link #unescape(Object)} is an exact inverse.
 */
public final class Sanitizer {

    private Sanitizer() {
    }

    public static Object escape(Object value) {
        if (!(value instanceof String text)) {
            return value;
        }
        StringBuilder out = new StringBuilder(text.length() + 16);
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '&' -> out.append("&amp;");
                case '<' -> out.append("&lt;");
                case '>' -> out.append("&gt;");
                case '"' -> out.append("&quot;");
                case '\'' -> out.append("&#x27;");
                case '/' -> out.append("&#x2F;");
                default -> out.append(c);
            }
        }
        return out.toString();
    }

    public static Object unescape(Object value) {
        if (!(value instanceof String text) || text.indexOf('&') < 0) {
            return value;
        }
        return text.replace("&lt;", "<")
                .replace("&gt;", ">")
                .replace("&quot;", "\"")
                .replace("&#x27;", "'")
                .replace("&#x2F;", "/")
                .replace("&amp;", "&");
    }
}
