package com.eventfeed.feed.calendar;

import com.eventfeed.feed.model.EventLocation;
import com.eventfeed.feed.model.EventRecord;
import com.eventfeed.feed.model.NewlineMode;
import com.eventfeed.feed.model.RawCalendarEntry;
import com.eventfeed.feed.model.TransformConfig;
import com.eventfeed.feed.util.TextNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Turns calendar entries into flat output records according to a {@link TransformConfig}.
 * No network access.
 */
@Component
public class CalendarRecordMapper {
    private static final Logger log = LoggerFactory.getLogger(CalendarRecordMapper.class);

    // Entries without a start sort first, mirroring an empty-string sort key.
    private static final Comparator<RawCalendarEntry> BY_START = Comparator.comparing(
        RawCalendarEntry::start,
        Comparator.nullsFirst(Comparator.comparing(ZonedDateTime::toInstant))
    );

    public List<EventRecord> mapCalendar(Collection<RawCalendarEntry> entries, TransformConfig config) {
        TransformConfig effective = config == null ? TransformConfig.defaults() : config;
        if (entries == null || entries.isEmpty()) {
            return new ArrayList<>();
        }
        List<RawCalendarEntry> sorted = new ArrayList<>(entries);
        sorted.removeIf(Objects::isNull);
        sorted.sort(BY_START);
        List<EventRecord> records = new ArrayList<>(sorted.size());
        for (RawCalendarEntry entry : sorted) {
            records.add(map(entry, effective));
        }
        return records;
    }

    public EventRecord map(RawCalendarEntry entry, TransformConfig config) {
        TransformConfig effective = config == null ? TransformConfig.defaults() : config;
        ZoneId targetZone = resolveZone(effective.targetTimezone());
        DateTimeFormatter formatter = resolveFormatter(effective.timeFormat());

        EventRecord record = new EventRecord();
        for (Map.Entry<String, String> mapping : effective.fieldMappings().entrySet()) {
            String source = mapping.getKey();
            if (effective.maskedFields().contains(source)) {
                continue;
            }
            Object value = entry.field(source);
            if (value == null) {
                continue;
            }
            record.put(mapping.getValue(), transform(source, value, effective, targetZone, formatter));
        }
        for (Map.Entry<String, String> mapping : effective.fieldMappings().entrySet()) {
            if (!effective.maskedFields().contains(mapping.getKey())) {
                record.putIfAbsent(mapping.getValue(), "");
            }
        }

        record.put(EventRecord.LOCATION, parseLocation(entry.location()));

        for (Map.Entry<String, String> placeholder : effective.placeholders().entrySet()) {
            record.putIfAbsent(placeholder.getKey(), placeholder.getValue() == null ? "" : placeholder.getValue());
        }

        for (Map.Entry<String, String> copy : effective.copies().entrySet()) {
            if (record.has(copy.getValue())) {
                record.put(copy.getKey(), record.get(copy.getValue()));
            }
        }
        return record;
    }

    /**
     * Splits {@code "<detail> - <name>"} on the first hyphen. Without a hyphen the whole value is the detail.
     */
    public static EventLocation parseLocation(String raw) {
        if (raw == null || raw.isBlank()) {
            return EventLocation.empty();
        }
        int hyphen = raw.indexOf('-');
        if (hyphen < 0) {
            return new EventLocation("", "", raw.trim());
        }
        String detail = raw.substring(0, hyphen).trim();
        String name = raw.substring(hyphen + 1).trim();
        return new EventLocation(name, "", detail);
    }

    private Object transform(
        String source,
        Object value,
        TransformConfig config,
        ZoneId targetZone,
        DateTimeFormatter formatter
    ) {
        if (value instanceof ZonedDateTime) {
            return formatTime((ZonedDateTime) value, targetZone, formatter);
        }
        switch (source.toLowerCase(Locale.ROOT)) {
            case "description":
                return cleanDescription(value.toString(), config);
            case "name":
            case "summary":
                return TextNormalizer.escapeCommas(value.toString());
            case "categories":
                return joinCategories(value, config);
            default:
                return String.valueOf(value);
        }
    }

    String formatTime(ZonedDateTime value, ZoneId targetZone, DateTimeFormatter formatter) {
        ZonedDateTime localized = targetZone == null ? value : value.withZoneSameInstant(targetZone);
        return formatter.format(localized);
    }

    String cleanDescription(String value, TransformConfig config) {
        String out = value == null ? "" : value;
        if (Boolean.TRUE.equals(config.escapeDescription())) {
            out = TextNormalizer.escapeCommasAndSemicolons(out);
        }
        if (Boolean.TRUE.equals(config.collapseWhitespace())) {
            out = config.newlineMode() == NewlineMode.ESCAPED
                ? TextNormalizer.collapseWhitespaceKeepingNewlines(out)
                : TextNormalizer.collapseWhitespace(out);
        }
        return out;
    }

    String joinCategories(Object value, TransformConfig config) {
        if (!(value instanceof Collection)) {
            return String.valueOf(value);
        }
        List<String> tags = new ArrayList<>();
        for (Object tag : (Collection<?>) value) {
            if (tag != null) {
                tags.add(tag.toString());
            }
        }
        if (tags.isEmpty()) {
            return "";
        }
        if (tags.size() > 1 && Boolean.TRUE.equals(config.joinCategories())) {
            tags.sort(Comparator.naturalOrder());
            return String.join(config.categoryDelimiter(), tags);
        }
        return tags.get(0);
    }

    private ZoneId resolveZone(String zoneId) {
        try {
            return ZoneId.of(zoneId);
        } catch (DateTimeException e) {
            log.warn("Unknown target timezone {}; keeping source zones", zoneId);
            return null;
        }
    }

    private DateTimeFormatter resolveFormatter(String pattern) {
        try {
            return DateTimeFormatter.ofPattern(pattern, Locale.ROOT);
        } catch (IllegalArgumentException e) {
            log.warn("Invalid time format {}; using {}", pattern, TransformConfig.DEFAULT_TIME_FORMAT);
            return DateTimeFormatter.ofPattern(TransformConfig.DEFAULT_TIME_FORMAT, Locale.ROOT);
        }
    }
}
