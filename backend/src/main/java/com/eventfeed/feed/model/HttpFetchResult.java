package com.eventfeed.feed.model;

import java.net.URI;
import java.time.Duration;
import java.util.Optional;

public record HttpFetchResult(
    String requestedUrl,
    URI finalUri,
    int statusCode,
    String body,
    Duration duration,
    String errorCode,
    String errorMessage
) {
    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300 && errorCode == null;
    }

    public String finalUrlOrRequested() {
        return finalUri != null ? finalUri.toString() : requestedUrl;
    }

    /**
     * @return the body of a successful response, empty for any miss
     */
    public Optional<String> html() {
        if (!isSuccessful() || body == null) {
            return Optional.empty();
        }
        return Optional.of(body);
    }

    public String describeFailure() {
        if (errorCode != null) {
            return errorCode + (errorMessage == null ? "" : ": " + errorMessage);
        }
        return "status " + statusCode;
    }
}
