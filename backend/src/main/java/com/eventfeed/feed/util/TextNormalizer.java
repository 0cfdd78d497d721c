package com.eventfeed.feed.util;

import java.util.Locale;
import java.util.regex.Pattern;

public final class TextNormalizer {
    private static final Pattern WHITESPACE = Pattern.compile("[\\s\\u00A0]+");
    private static final Pattern NEWLINE_RUN = Pattern.compile("[\\r\\n]+");
    private static final Pattern HORIZONTAL_WHITESPACE = Pattern.compile("[\\t\\x0B\\f \\u00A0]+");
    private static final Pattern UNESCAPED_COMMA = Pattern.compile("(?<!\\\\),");
    private static final Pattern UNESCAPED_SEMICOLON = Pattern.compile("(?<!\\\\);");
    private static final Pattern BLANK_LINE_RUN = Pattern.compile("\\n{3,}");
    private static final String MISSING_MARKER = "tbd";

    private TextNormalizer() {
    }

    /**
     * Collapses every whitespace run (newlines and non-breaking spaces included) to one space and trims.
     */
    public static String collapseWhitespace(String value) {
        if (value == null || value.isEmpty()) {
            return "";
        }
        return WHITESPACE.matcher(value).replaceAll(" ").trim();
    }

    /**
     * Folds newline runs to the literal two-character sequence {@code \n}, then collapses the
     * remaining horizontal whitespace.
     */
    public static String collapseWhitespaceKeepingNewlines(String value) {
        if (value == null || value.isEmpty()) {
            return "";
        }
        String folded = NEWLINE_RUN.matcher(value.trim()).replaceAll("\\\\n");
        return HORIZONTAL_WHITESPACE.matcher(folded).replaceAll(" ").trim();
    }

    public static String escapeCommas(String value) {
        if (value == null || value.isEmpty()) {
            return "";
        }
        return UNESCAPED_COMMA.matcher(value).replaceAll("\\\\,");
    }

    public static String escapeCommasAndSemicolons(String value) {
        if (value == null || value.isEmpty()) {
            return "";
        }
        return UNESCAPED_SEMICOLON.matcher(escapeCommas(value)).replaceAll("\\\\;");
    }

    /**
     * Collapses runs of two or more blank lines into a single blank line.
     */
    public static String collapseBlankLines(String value) {
        if (value == null || value.isEmpty()) {
            return "";
        }
        return BLANK_LINE_RUN.matcher(value.replace("\r\n", "\n")).replaceAll("\n\n");
    }

    public static boolean isBlank(Object value) {
        return value == null || value.toString().isBlank();
    }

    /**
     * True for null, empty, whitespace-only and "TBD" (any case, surrounding whitespace ignored).
     */
    public static boolean isMissing(Object value) {
        if (isBlank(value)) {
            return true;
        }
        return MISSING_MARKER.equals(value.toString().trim().toLowerCase(Locale.ROOT));
    }
}
