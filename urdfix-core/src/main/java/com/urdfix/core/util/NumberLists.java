package com.urdfix.core.util;

import com.urdfix.core.UrdfException;

import java.math.BigDecimal;
import java.util.regex.Pattern;

/**
 * Parsing and printing of the whitespace separated number lists used by URDF attributes.
 */
public final class NumberLists {

    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private NumberLists() {
        // Utility class
    }

    /**
     * Parses a list of decimal numbers of a fixed length.
     *
     * @param value attribute value, e.g. {@code "0 0.5 1e-3"}
     * @param arity expected number of values
     * @return parsed values
     * @throws UrdfException STRUCTURE if a token is not a decimal number, overflows a double
     *         or the count differs
     */
    public static double[] parse(String value, int arity) {
        String trimmed = value.strip();
        String[] tokens = trimmed.isEmpty() ? new String[0] : WHITESPACE.split(trimmed);
        double[] result = new double[tokens.length];
        for (int i = 0; i < tokens.length; i++) {
            if (!DECIMAL.matcher(tokens[i]).matches()) {
                throw UrdfException.structure("Invalid number list: '" + value + "'");
            }
            result[i] = Double.parseDouble(tokens[i]);
            if (!Double.isFinite(result[i])) {
                throw UrdfException.structure("Number out of range: '" + tokens[i] + "' in '" + value + "'");
            }
        }
        if (result.length != arity) {
            throw UrdfException.structure(
                "Expected " + arity + " values, got " + result.length + " in '" + value + "'");
        }
        return result;
    }

    /**
     * Parses a single decimal number.
     *
     * @param value attribute value
     * @return parsed value
     * @throws UrdfException STRUCTURE if the value is not a single decimal number
     */
    public static double parseScalar(String value) {
        return parse(value, 1)[0];
    }

    /**
     * Formats a number in its shortest exact decimal form without exponent,
     * e.g. {@code 1.0 -> "1"} and {@code 1e-10 -> "0.0000000001"}.
     *
     * @param value finite number
     * @return decimal text
     */
    public static String format(double value) {
        if (value == 0.0) {
            return "0";
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    /**
     * Formats numbers space-separated.
     *
     * @param values numbers to join
     * @return joined decimal text
     */
    public static String join(double... values) {
        StringBuilder sb = new StringBuilder();
        for (double value : values) {
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(format(value));
        }
        return sb.toString();
    }
}
