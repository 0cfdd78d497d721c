package com.eventfeed.feed.model;

public enum NewlineMode {
    /** Newline runs become a single space. */
    SPACE,
    /** Newline runs become the literal two characters {@code \n}. */
    ESCAPED
}
