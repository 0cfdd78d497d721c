package com.eventfeed.feed.model;

/**
 * Page-backed enrichment passes and the record field each one writes.
 */
public enum EnrichmentKind {
    TITLE(EventRecord.TITLE),
    CONTENT(EventRecord.CONTENT),
    RAW_DETAILS(EventRecord.RAW_EVENT_DETAILS);

    private final String field;

    EnrichmentKind(String field) {
        this.field = field;
    }

    public String field() {
        return field;
    }
}
