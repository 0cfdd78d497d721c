package com.eventfeed.feed.model;

/**
 * One end-to-end generate run. {@code configPath} and {@code limit} are optional.
 */
public record FeedRunRequest(
    String icsSource,
    String outputPath,
    String configPath,
    boolean printOnly,
    Integer limit,
    EnrichmentOptions enrichment
) {
    public FeedRunRequest {
        enrichment = enrichment == null ? EnrichmentOptions.defaults() : enrichment;
        limit = limit == null ? null : Math.max(0, limit);
    }
}
