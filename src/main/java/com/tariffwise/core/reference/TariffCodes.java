package com.tariffwise.core.reference;

import java.util.regex.Pattern;

/**
 * Helpers for hierarchical tariff codes.
 */
public final class TariffCodes {

    private static final Pattern SEPARATORS = Pattern.compile("[.\\s/\\-]");

    private TariffCodes() {}

    /** Strips dots, whitespace, slashes and dashes: {@code "8516.71.00"} becomes {@code "85167100"}. */
    public static String normalize(String code) {
        if (code == null) {
            return "";
        }
        return SEPARATORS.matcher(code).replaceAll("");
    }

    /** First {@code digits} characters of the normalized code, or null if the code is shorter. */
    public static String prefix(String normalizedCode, int digits) {
        if (normalizedCode == null || normalizedCode.length() < digits) {
            return null;
        }
        return normalizedCode.substring(0, digits);
    }

    /** Two-digit chapter as an int, or -1 when the code has no numeric chapter. */
    public static int chapter(String code) {
        String prefix = prefix(normalize(code), 2);
        if (prefix == null || !Character.isDigit(prefix.charAt(0)) || !Character.isDigit(prefix.charAt(1))) {
            return -1;
        }
        return Integer.parseInt(prefix);
    }

    /** Display form: {@code 8516710000} becomes {@code 8516.71.0000}. */
    public static String format(String code) {
        String n = normalize(code);
        if (n.length() <= 4) {
            return n;
        }
        if (n.length() <= 6) {
            return n.substring(0, 4) + "." + n.substring(4);
        }
        return n.substring(0, 4) + "." + n.substring(4, 6) + "." + n.substring(6);
    }
}
