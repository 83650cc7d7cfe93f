package com.urdfix.core.util;

import java.util.regex.Pattern;

/**
 * Naming rules for link and joint names.
 *
 * <p>A valid name is non-empty, uses only ASCII letters, digits and underscores and
 * does not start with a digit.
 */
public final class NamingConventions {

    private static final Pattern VALID_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final String FALLBACK_NAME = "unnamed";

    private NamingConventions() {
        // Utility class
    }

    /**
     * Checks a name against the convention.
     *
     * @param name name to check, may be null
     * @return true if the name is valid
     */
    public static boolean isValidName(String name) {
        return name != null && VALID_NAME.matcher(name).matches();
    }

    /**
     * Rewrites a name so that it satisfies the convention.
     *
     * <p>Letters are lowercased, whitespace and hyphens become underscores, any other
     * character outside {@code [A-Za-z0-9_]} is dropped, a leading digit gets an
     * underscore prefix and an empty result becomes {@value #FALLBACK_NAME}.
     * The result is always valid, so fixing a fixed name returns it unchanged.
     *
     * @param name name to fix
     * @return valid name
     */
    public static String fixName(String name) {
        if (isValidName(name)) {
            return name;
        }
        StringBuilder fixed = new StringBuilder();
        if (name != null) {
            for (int i = 0; i < name.length(); i++) {
                char ch = name.charAt(i);
                if (isAsciiLetterOrDigit(ch) || ch == '_') {
                    fixed.append(Character.toLowerCase(ch));
                } else if (Character.isWhitespace(ch) || ch == '-') {
                    fixed.append('_');
                }
            }
        }
        if (fixed.length() == 0) {
            return FALLBACK_NAME;
        }
        if (Character.isDigit(fixed.charAt(0))) {
            fixed.insert(0, '_');
        }
        return fixed.toString();
    }

    private static boolean isAsciiLetterOrDigit(char ch) {
        return (ch >= 'a' && ch <= 'z') || (ch >= 'A' && ch <= 'Z') || (ch >= '0' && ch <= '9');
    }
}
