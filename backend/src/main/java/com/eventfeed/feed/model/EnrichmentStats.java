package com.eventfeed.feed.model;

/**
 * Counters for one title, content or raw-details pass.
 */
public class EnrichmentStats {
    private final EnrichmentKind kind;
    private int attempted;
    private int updated;
    private int skippedMissingUrl;
    private int errors;

    public EnrichmentStats(EnrichmentKind kind) {
        this.kind = kind;
    }

    public void recordAttempt() {
        attempted++;
    }

    public void recordUpdate() {
        updated++;
    }

    public void recordSkippedMissingUrl() {
        skippedMissingUrl++;
    }

    public void recordError() {
        errors++;
    }

    public EnrichmentKind kind() {
        return kind;
    }

    public int attempted() {
        return attempted;
    }

    public int updated() {
        return updated;
    }

    public int skippedMissingUrl() {
        return skippedMissingUrl;
    }

    public int errors() {
        return errors;
    }

    @Override
    public String toString() {
        return "attempted=" + attempted
            + " updated=" + updated
            + " skipped=" + skippedMissingUrl
            + " errors=" + errors;
    }
}
