package com.eventfeed.feed.calendar;

import com.eventfeed.feed.model.TransformConfig;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

@Component
public class TransformConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(TransformConfigLoader.class);

    static final String DEFAULT_CONFIG_FILE = "transform_config.json";

    private final ObjectMapper objectMapper;

    public TransformConfigLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @param explicitPath configured path, may be blank
     * @return the explicit path, else {@code transform_config.json} in the working directory when present, else null
     */
    public Path resolve(String explicitPath) {
        if (explicitPath != null && !explicitPath.isBlank()) {
            return Path.of(explicitPath.trim());
        }
        Path fallback = Path.of(DEFAULT_CONFIG_FILE);
        return Files.exists(fallback) ? fallback : null;
    }

    public TransformConfig load(Path path) {
        if (path == null) {
            return TransformConfig.defaults();
        }
        if (!Files.exists(path)) {
            log.warn("Transform config {} not found; using defaults", path);
            return TransformConfig.defaults();
        }
        try {
            TransformConfig config = objectMapper.readValue(path.toFile(), TransformConfig.class);
            return config == null ? TransformConfig.defaults() : config;
        } catch (IOException e) {
            throw new CalendarLoadException("Invalid transform config " + path + ": " + e.getMessage(), e);
        }
    }
}
