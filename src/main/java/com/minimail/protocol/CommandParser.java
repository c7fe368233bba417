package com.minimail.protocol;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Line-oriented command parser shared by the SMTP and POP3 handlers.
 * Maps the first word of a line to a constant of a closed verb enum,
 * case-insensitively; anything else maps to the given unknown verb.
 */
public final class CommandParser<V extends Enum<V>> {

    private final Map<String, V> verbs = new HashMap<>();
    private final V unknown;

    public CommandParser(Class<V> verbType, V unknown) {
        this.unknown = unknown;
        for (V verb : verbType.getEnumConstants()) {
            if (verb != unknown) {
                verbs.put(verb.name(), verb);
            }
        }
    }

    public ParsedCommand<V> parse(String line) {
        String text = stripLineEnding(line).trim();
        int space = indexOfWhitespace(text);
        String keyword = space < 0 ? text : text.substring(0, space);
        String argument = space < 0 ? "" : text.substring(space + 1).trim();
        V verb = verbs.getOrDefault(keyword.toUpperCase(Locale.ROOT), unknown);
        return new ParsedCommand<>(verb, keyword, argument);
    }

    /**
     * Remove a trailing LF or CRLF (only one line ending)
     */
    public static String stripLineEnding(String line) {
        int end = line.length();
        if (end > 0 && line.charAt(end - 1) == '\n') {
            end--;
            if (end > 0 && line.charAt(end - 1) == '\r') {
                end--;
            }
        }
        return line.substring(0, end);
    }

    private static int indexOfWhitespace(String text) {
        for (int i = 0; i < text.length(); i++) {
            if (Character.isWhitespace(text.charAt(i))) {
                return i;
            }
        }
        return -1;
    }
}
