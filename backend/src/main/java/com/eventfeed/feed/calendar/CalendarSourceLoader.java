package com.eventfeed.feed.calendar;

import com.eventfeed.config.FeedProperties;
import com.eventfeed.feed.http.PageFetcher;
import com.eventfeed.feed.model.HttpFetchResult;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Reads raw ICS text from an http(s) URL, a {@code file://} URL or a bare local path.
 */
@Component
public class CalendarSourceLoader {
    private static final String CALENDAR_ACCEPT = "text/calendar,text/plain;q=0.9,*/*;q=0.8";

    private final PageFetcher pageFetcher;
    private final FeedProperties properties;

    public CalendarSourceLoader(PageFetcher pageFetcher, FeedProperties properties) {
        this.pageFetcher = pageFetcher;
        this.properties = properties;
    }

    public String load(String source) {
        if (source == null || source.isBlank()) {
            throw new CalendarLoadException("No calendar source configured");
        }
        String trimmed = source.trim();
        if (trimmed.startsWith("file://")) {
            return readFile(fileUrlPath(trimmed));
        }
        if (!trimmed.contains("://")) {
            Path local = localPath(trimmed);
            if (local != null && Files.exists(local)) {
                return readFile(local);
            }
        }
        HttpFetchResult result = pageFetcher.get(
            trimmed,
            CALENDAR_ACCEPT,
            Duration.ofSeconds(properties.getCalendarTimeoutSeconds())
        );
        if (!result.isSuccessful() || result.body() == null) {
            throw new CalendarLoadException("Failed to fetch calendar " + trimmed + " (" + result.describeFailure() + ")");
        }
        return result.body();
    }

    private static Path fileUrlPath(String fileUrl) {
        try {
            String path = URI.create(fileUrl).getPath();
            if (path == null || path.isEmpty()) {
                throw new CalendarLoadException("Calendar file URL has no path: " + fileUrl);
            }
            return Path.of(path);
        } catch (IllegalArgumentException e) {
            throw new CalendarLoadException("Invalid calendar file URL " + fileUrl, e);
        }
    }

    private String readFile(Path path) {
        try {
            return Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new CalendarLoadException("Failed to read calendar file " + path, e);
        }
    }

    private Path localPath(String value) {
        try {
            return Path.of(value);
        } catch (InvalidPathException ignored) {
            return null;
        }
    }
}
