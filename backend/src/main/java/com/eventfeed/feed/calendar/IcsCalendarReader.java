package com.eventfeed.feed.calendar;

import com.eventfeed.feed.model.RawCalendarEntry;
import net.fortuna.ical4j.data.CalendarBuilder;
import net.fortuna.ical4j.data.ParserException;
import net.fortuna.ical4j.model.Calendar;
import net.fortuna.ical4j.model.Date;
import net.fortuna.ical4j.model.DateTime;
import net.fortuna.ical4j.model.Property;
import net.fortuna.ical4j.model.PropertyList;
import net.fortuna.ical4j.model.component.VEvent;
import net.fortuna.ical4j.model.property.Categories;
import net.fortuna.ical4j.model.property.DateProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.StringReader;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Parses ICS text into {@link RawCalendarEntry} values, one per VEVENT, in document order.
 */
@Component
public class IcsCalendarReader {
    private static final Set<String> DEDICATED_PROPERTIES = Set.of(
        Property.UID,
        Property.DTSTART,
        Property.DTEND,
        Property.SUMMARY,
        Property.DESCRIPTION,
        Property.URL,
        Property.LOCATION,
        Property.CATEGORIES
    );

    public List<RawCalendarEntry> read(String icsText) {
        if (icsText == null || icsText.isBlank()) {
            throw new CalendarLoadException("Calendar document is empty");
        }
        Calendar calendar;
        try {
            calendar = new CalendarBuilder().build(new StringReader(icsText));
        } catch (IOException | ParserException e) {
            throw new CalendarLoadException("Failed to parse calendar: " + e.getMessage(), e);
        }

        List<VEvent> events = calendar.getComponents(net.fortuna.ical4j.model.Component.VEVENT);
        List<RawCalendarEntry> entries = new ArrayList<>(events.size());
        for (VEvent event : events) {
            entries.add(toEntry(event));
        }
        return entries;
    }

    private RawCalendarEntry toEntry(VEvent event) {
        Map<String, String> extra = new LinkedHashMap<>();
        for (Property property : event.getProperties()) {
            String name = property.getName();
            if (name == null || DEDICATED_PROPERTIES.contains(name.toUpperCase(Locale.ROOT))) {
                continue;
            }
            extra.putIfAbsent(name.toLowerCase(Locale.ROOT), property.getValue());
        }
        return new RawCalendarEntry(
            value(event.getUid()),
            toZoned(event.getStartDate()),
            toZoned(event.getEndDate()),
            value(event.getSummary()),
            value(event.getDescription()),
            value(event.getUrl()),
            value(event.getLocation()),
            categories(event),
            extra
        );
    }

    private List<String> categories(VEvent event) {
        PropertyList<Property> properties = event.getProperties(Property.CATEGORIES);
        List<String> out = new ArrayList<>();
        for (Property property : properties) {
            if (!(property instanceof Categories)) {
                continue;
            }
            for (String category : ((Categories) property).getCategories()) {
                if (category != null && !category.isBlank()) {
                    out.add(category.trim());
                }
            }
        }
        return out;
    }

    private ZonedDateTime toZoned(DateProperty property) {
        if (property == null || property.getDate() == null) {
            return null;
        }
        Date date = property.getDate();
        Instant instant = Instant.ofEpochMilli(date.getTime());
        ZoneId zone = ZoneId.systemDefault();
        if (date instanceof DateTime) {
            DateTime dateTime = (DateTime) date;
            if (dateTime.isUtc()) {
                zone = ZoneOffset.UTC;
            } else if (dateTime.getTimeZone() != null) {
                zone = zoneOrDefault(dateTime.getTimeZone().getID());
            }
        }
        return instant.atZone(zone);
    }

    private ZoneId zoneOrDefault(String id) {
        try {
            return ZoneId.of(id);
        } catch (DateTimeException | NullPointerException ignored) {
            // Non-Olson TZID; the instant is still correct.
            return ZoneId.systemDefault();
        }
    }

    private String value(Property property) {
        return property == null ? null : property.getValue();
    }
}
