package com.minimail.util;

import java.util.Locale;

/**
 * Mail address helpers for the SMTP envelope
 */
public final class AddressUtil {

    private AddressUtil() {}

    /**
     * Extract the path of a MAIL FROM / RCPT TO argument.
     * {@code "FROM:<a@b> SIZE=10"} with prefix {@code "FROM:"} gives {@code "a@b"};
     * the null path {@code "<>"} gives {@code ""}.
     *
     * @return the address, or null on a syntax error
     */
    public static String extractPath(String argument, String prefix) {
        if (argument == null || argument.length() < prefix.length()
                || !argument.regionMatches(true, 0, prefix, 0, prefix.length())) {
            return null;
        }
        String rest = argument.substring(prefix.length()).trim();
        if (rest.isEmpty()) {
            return null;
        }
        if (rest.startsWith("<")) {
            int close = rest.indexOf('>');
            if (close < 0) {
                return null;
            }
            return rest.substring(1, close).trim();
        }
        // Bare address; trailing parameters are ignored
        int space = rest.indexOf(' ');
        return space > 0 ? rest.substring(0, space) : rest;
    }

    /**
     * Strip angle brackets (<>) from an email address
     */
    public static String stripAngleBrackets(String email) {
        if (email == null) return null;
        String stripped = email.trim();
        if (stripped.startsWith("<")) stripped = stripped.substring(1);
        if (stripped.endsWith(">")) stripped = stripped.substring(0, stripped.length() - 1);
        return stripped.trim();
    }

    /**
     * Domain of an address, lower case; null when there is no '@'
     */
    public static String extractDomain(String email) {
        if (email == null || !email.contains("@")) return null;
        return email.substring(email.lastIndexOf('@') + 1).toLowerCase(Locale.ROOT);
    }

    /**
     * Local part of an address; the address itself when there is no '@'
     */
    public static String extractLocalPart(String email) {
        if (email == null || !email.contains("@")) return email;
        return email.substring(0, email.lastIndexOf('@'));
    }
}
