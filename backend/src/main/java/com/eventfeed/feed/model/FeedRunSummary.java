package com.eventfeed.feed.model;

import java.nio.file.Path;
import java.util.List;

public record FeedRunSummary(
    int calendarEntries,
    int recordsWritten,
    Path outputPath,
    List<EnrichmentStats> enrichmentStats,
    RawExtractStats rawExtractStats,
    int titlesFilled
) {
    public FeedRunSummary {
        enrichmentStats = enrichmentStats == null ? List.of() : List.copyOf(enrichmentStats);
    }
}
