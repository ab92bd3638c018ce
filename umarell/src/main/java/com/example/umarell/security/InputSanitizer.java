package com.example.umarell.security;

import com.example.umarell.errors.InspectorException;

import java.util.regex.Pattern;

/**
 * The only place where raw input is turned into something a query string may contain.
 * Query builders call this; nothing else concatenates caller text into Cypher or Flux.
 */
public final class InputSanitizer {

    static final int MAX_LENGTH = 256;

    private static final String REGEX_META = "\\.+*?()|[]{}^$/";

    private static final Pattern DURATION =
            Pattern.compile("^-?(\\d+(ns|us|µs|ms|mo|s|m|h|d|w|y))+$");

    private InputSanitizer() {
    }

    public static String sanitize(String raw, SanitizeContext context) {
        if (raw == null) {
            throw InspectorException.invalidInput("Missing value");
        }
        if (raw.length() > MAX_LENGTH) {
            throw InspectorException.invalidInput("Value is longer than " + MAX_LENGTH + " characters");
        }
        rejectControlCharacters(raw);

        return switch (context) {
            case GRAPH_LITERAL -> graphLiteral(raw);
            case REGEX_FRAGMENT -> regexFragment(raw);
            case FLUX_STRING -> fluxString(raw);
            case TIME_RANGE -> timeRange(raw);
        };
    }

    private static void rejectControlCharacters(String raw) {
        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            if (Character.isISOControl(c) || c == '\u2028' || c == '\u2029') {
                throw InspectorException.invalidInput(
                        "Control character U+%04X at position %d is not allowed".formatted((int) c, i));
            }
        }
    }

    private static String graphLiteral(String raw) {
        if (raw.indexOf(';') >= 0) {
            throw InspectorException.invalidInput("';' is not allowed in a name or category: " + raw);
        }
        StringBuilder sb = new StringBuilder(raw.length() + 8);
        for (char c : raw.toCharArray()) {
            switch (c) {
                case '\\' -> sb.append("\\\\");
                case '\'' -> sb.append("\\'");
                case '"' -> sb.append("\\\"");
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }

    private static String regexFragment(String raw) {
        StringBuilder sb = new StringBuilder(raw.length() + 8);
        for (char c : raw.toCharArray()) {
            if (REGEX_META.indexOf(c) >= 0) {
                sb.append('\\');
            }
            sb.append(c);
        }
        return sb.toString();
    }

    private static String fluxString(String raw) {
        StringBuilder sb = new StringBuilder(raw.length() + 8);
        for (char c : raw.toCharArray()) {
            switch (c) {
                case '\\' -> sb.append("\\\\");
                case '"' -> sb.append("\\\"");
                // ${ opens string interpolation in Flux
                case '$' -> sb.append("\\$");
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }

    private static String timeRange(String raw) {
        String t = raw.trim();
        if (!DURATION.matcher(t).matches()) {
            throw InspectorException.invalidInput(
                    "Time range must be a duration like -1h, -30m or -7d, got: " + raw);
        }
        return t.startsWith("-") ? t : "-" + t;
    }
}
