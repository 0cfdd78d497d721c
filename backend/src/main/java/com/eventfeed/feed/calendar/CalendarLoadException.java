package com.eventfeed.feed.calendar;

/**
 * Fatal failure while reading the feed or its transform configuration.
 */
public class CalendarLoadException extends RuntimeException {
    public CalendarLoadException(String message) {
        super(message);
    }

    public CalendarLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
