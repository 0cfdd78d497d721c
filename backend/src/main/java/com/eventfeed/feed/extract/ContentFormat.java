package com.eventfeed.feed.extract;

import java.util.Locale;

public enum ContentFormat {
    TEXT,
    MARKDOWN,
    HTML;

    /**
     * Lenient parse; unknown, blank or null values give {@link #TEXT}.
     */
    public static ContentFormat parse(String value) {
        if (value == null || value.isBlank()) {
            return TEXT;
        }
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "markdown":
            case "md":
                return MARKDOWN;
            case "html":
                return HTML;
            default:
                return TEXT;
        }
    }
}
