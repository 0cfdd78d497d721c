package com.eventfeed.feed.service;

import com.eventfeed.feed.model.EventRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

@Component
public class EventsJsonWriter {
    private final ObjectMapper objectMapper;

    public EventsJsonWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String toJson(List<EventRecord> records) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(records == null ? List.of() : records);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize events", e);
        }
    }

    public Path write(List<EventRecord> records, Path output) {
        try {
            Path parent = output.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(output, toJson(records), StandardCharsets.UTF_8);
            return output;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + output, e);
        }
    }
}
