package com.eventfeed.feed.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Flat output record. Field order follows insertion order and is kept in the written JSON.
 */
public class EventRecord {
    public static final String GUID = "guid";
    public static final String TITLE = "title";
    public static final String SPEAKER = "speaker";
    public static final String SERIES = "series";
    public static final String CONTENT = "content";
    public static final String URL_REF = "urlRef";
    public static final String LOCATION = "location";
    public static final String RAW_EVENT_DETAILS = "rawEventDetails";
    public static final String RAW_EXTRACT_ABSTRACT = "rawExtractAbstract";
    public static final String RAW_EXTRACT_BIO = "rawExtractBio";

    private final Map<String, Object> fields = new LinkedHashMap<>();

    public EventRecord() {
    }

    public EventRecord(Map<String, ?> initial) {
        if (initial != null) {
            fields.putAll(initial);
        }
    }

    public static EventRecord of(String... keysAndValues) {
        if (keysAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("keysAndValues must come in pairs");
        }
        EventRecord record = new EventRecord();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            record.put(keysAndValues[i], keysAndValues[i + 1]);
        }
        return record;
    }

    @JsonAnyGetter
    public Map<String, Object> asMap() {
        return fields;
    }

    @JsonAnySetter
    public void put(String field, Object value) {
        fields.put(field, value);
    }

    public void putIfAbsent(String field, Object value) {
        fields.putIfAbsent(field, value);
    }

    public Object get(String field) {
        return fields.get(field);
    }

    /**
     * @return the field as a string, or {@code null} when absent
     */
    public String getString(String field) {
        Object value = fields.get(field);
        return value == null ? null : value.toString();
    }

    public boolean has(String field) {
        return fields.containsKey(field);
    }

    public Set<String> fieldNames() {
        return fields.keySet();
    }

    @Override
    public String toString() {
        return "EventRecord" + fields;
    }
}
