package com.eventfeed.feed.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

@JsonPropertyOrder({"name", "id", "detail"})
public record EventLocation(
    String name,
    String id,
    String detail
) {
    public static EventLocation empty() {
        return new EventLocation("", "", "");
    }
}
