package com.eventfeed.feed.model;

import java.time.ZonedDateTime;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * One VEVENT as read from the feed. Properties without a dedicated component are kept in
 * {@code properties}, keyed by lower-case property name.
 */
public record RawCalendarEntry(
    String uid,
    ZonedDateTime start,
    ZonedDateTime end,
    String summary,
    String description,
    String url,
    String location,
    List<String> categories,
    Map<String, String> properties
) {
    public RawCalendarEntry {
        categories = categories == null ? List.of() : List.copyOf(categories);
        properties = properties == null ? Map.of() : Map.copyOf(properties);
    }

    /**
     * Looks up a value by its logical field name; {@code null} when the entry has no such value.
     */
    public Object field(String name) {
        if (name == null) {
            return null;
        }
        return switch (name.toLowerCase(Locale.ROOT)) {
            case "uid" -> uid;
            case "begin", "dtstart" -> start;
            case "end", "dtend" -> end;
            case "name", "summary" -> summary;
            case "description" -> description;
            case "url" -> url;
            case "location" -> location;
            case "categories" -> categories;
            default -> properties.get(name.toLowerCase(Locale.ROOT));
        };
    }
}
