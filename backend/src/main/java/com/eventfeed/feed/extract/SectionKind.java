package com.eventfeed.feed.extract;

public enum SectionKind {
    SUBTITLE,
    CONTENT_BODY,
    RAW_DETAILS
}
