package org.astx.serialization;

import java.util.regex.Pattern;

/**
 * Splits a structural mapping key such as {@code "LiteralInt32[7]#12"} into its parts.
 */
final class StructKeys {

    private static final Pattern IDENTITY_SUFFIX = Pattern.compile("#\\d+$");

    private StructKeys() {}

    /**
     * @return The key without the trailing identity token of the visualization form.
     */
    static String stripIdentity(String key) {
        return IDENTITY_SUFFIX.matcher(key).replaceFirst("");
    }

    /**
     * @return The variant tag: everything before the first '['.
     */
    static String tag(String key) {
        String plain = stripIdentity(key);
        int bracket = plain.indexOf('[');
        return bracket < 0 ? plain : plain.substring(0, bracket);
    }

    /**
     * @return The text between the first '[' and the last ']', or an empty string.
     */
    static String argument(String key) {
        String plain = stripIdentity(key);
        int open = plain.indexOf('[');
        int close = plain.lastIndexOf(']');
        return open < 0 || close < open ? "" : plain.substring(open + 1, close);
    }
}
