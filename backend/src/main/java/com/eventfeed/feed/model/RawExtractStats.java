package com.eventfeed.feed.model;

public class RawExtractStats {
    private int attempted;
    private int updatedAbstract;
    private int updatedBio;
    private int skippedMissingDetails;
    private int errors;

    public void recordAttempt() {
        attempted++;
    }

    public void recordAbstractUpdate() {
        updatedAbstract++;
    }

    public void recordBioUpdate() {
        updatedBio++;
    }

    public void recordSkippedMissingDetails() {
        skippedMissingDetails++;
    }

    public void recordError() {
        errors++;
    }

    public int attempted() {
        return attempted;
    }

    public int updatedAbstract() {
        return updatedAbstract;
    }

    public int updatedBio() {
        return updatedBio;
    }

    public int skippedMissingDetails() {
        return skippedMissingDetails;
    }

    public int errors() {
        return errors;
    }

    @Override
    public String toString() {
        return "attempted=" + attempted
            + " abstract=" + updatedAbstract
            + " bio=" + updatedBio
            + " skipped=" + skippedMissingDetails
            + " errors=" + errors;
    }
}
