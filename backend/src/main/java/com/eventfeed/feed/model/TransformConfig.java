package com.eventfeed.feed.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Declarative mapping from calendar entries to output records. Any component left out of a
 * config file (or passed as {@code null}) takes its default.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TransformConfig(
    @JsonProperty("target_timezone") String targetTimezone,
    @JsonProperty("time_format") String timeFormat,
    @JsonProperty("field_mappings") Map<String, String> fieldMappings,
    @JsonProperty("masked_fields") Set<String> maskedFields,
    @JsonProperty("placeholders") Map<String, String> placeholders,
    @JsonProperty("copies") Map<String, String> copies,
    @JsonProperty("join_categories") Boolean joinCategories,
    @JsonProperty("category_delimiter") String categoryDelimiter,
    @JsonProperty("escape_description") Boolean escapeDescription,
    @JsonProperty("collapse_whitespace") Boolean collapseWhitespace,
    @JsonProperty("newline_mode") NewlineMode newlineMode
) {
    public static final String DEFAULT_TIMEZONE = "America/New_York";
    public static final String DEFAULT_TIME_FORMAT = "yyyy-MM-dd'T'HH:mm:ss";

    public TransformConfig {
        targetTimezone = targetTimezone == null || targetTimezone.isBlank() ? DEFAULT_TIMEZONE : targetTimezone.trim();
        timeFormat = timeFormat == null || timeFormat.isBlank() ? DEFAULT_TIME_FORMAT : timeFormat;
        fieldMappings = ordered(fieldMappings == null ? defaultFieldMappings() : fieldMappings);
        maskedFields = Collections.unmodifiableSet(new LinkedHashSet<>(
            maskedFields == null ? Set.of("dtstamp", "sequence", "transp", "class") : maskedFields
        ));
        placeholders = ordered(placeholders == null ? defaultPlaceholders() : placeholders);
        copies = ordered(copies == null ? Map.of() : copies);
        joinCategories = joinCategories == null || joinCategories;
        categoryDelimiter = categoryDelimiter == null ? "," : categoryDelimiter;
        escapeDescription = escapeDescription != null && escapeDescription;
        collapseWhitespace = collapseWhitespace == null || collapseWhitespace;
        newlineMode = newlineMode == null ? NewlineMode.SPACE : newlineMode;
    }

    public static TransformConfig defaults() {
        return new TransformConfig(null, null, null, null, null, null, null, null, null, null, null);
    }

    public TransformConfig withTargetTimezone(String zone) {
        return new TransformConfig(zone, timeFormat, fieldMappings, maskedFields, placeholders, copies,
            joinCategories, categoryDelimiter, escapeDescription, collapseWhitespace, newlineMode);
    }

    public TransformConfig withCopies(Map<String, String> newCopies) {
        return new TransformConfig(targetTimezone, timeFormat, fieldMappings, maskedFields, placeholders, newCopies,
            joinCategories, categoryDelimiter, escapeDescription, collapseWhitespace, newlineMode);
    }

    public TransformConfig withDescriptionHandling(boolean escape, boolean collapse, NewlineMode mode) {
        return new TransformConfig(targetTimezone, timeFormat, fieldMappings, maskedFields, placeholders, copies,
            joinCategories, categoryDelimiter, escape, collapse, mode);
    }

    public TransformConfig withJoinCategories(boolean join) {
        return new TransformConfig(targetTimezone, timeFormat, fieldMappings, maskedFields, placeholders, copies,
            join, categoryDelimiter, escapeDescription, collapseWhitespace, newlineMode);
    }

    public TransformConfig withMaskedFields(Set<String> masked) {
        return new TransformConfig(targetTimezone, timeFormat, fieldMappings, masked, placeholders, copies,
            joinCategories, categoryDelimiter, escapeDescription, collapseWhitespace, newlineMode);
    }

    private static Map<String, String> defaultFieldMappings() {
        Map<String, String> mappings = new LinkedHashMap<>();
        mappings.put("uid", "guid");
        mappings.put("begin", "startTime");
        mappings.put("end", "endTime");
        mappings.put("url", "urlRef");
        mappings.put("categories", "series");
        mappings.put("description", "content");
        // SUMMARY carries the speaker line on the source calendars; title comes from enrichment.
        mappings.put("name", "speaker");
        return mappings;
    }

    private static Map<String, String> defaultPlaceholders() {
        Map<String, String> placeholders = new LinkedHashMap<>();
        placeholders.put("title", "");
        placeholders.put("cancelled", "");
        placeholders.put("bannerImage", "");
        placeholders.put("itemType", "advertisement");
        return placeholders;
    }

    private static Map<String, String> ordered(Map<String, String> source) {
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}
