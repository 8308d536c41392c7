package de.unibi.cebitec.corpus.sync.ctrl;

import de.unibi.cebitec.corpus.sync.model.DirectorySummary;
import de.unibi.cebitec.corpus.sync.model.RunStats;

public final class SyncReport {

    private final RunStats stats;
    private final DirectorySummary summary;
    private final int notSubmitted;
    private final boolean cancelled;
    private final boolean partialListing;

    SyncReport(RunStats stats, DirectorySummary summary, int notSubmitted, boolean cancelled, boolean partialListing) {
        this.stats = stats;
        this.summary = summary;
        this.notSubmitted = notSubmitted;
        this.cancelled = cancelled;
        this.partialListing = partialListing;
    }

    public RunStats getStats() {
        return stats;
    }

    public DirectorySummary getSummary() {
        return summary;
    }

    public int getNotSubmitted() {
        return notSubmitted;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    /**
     * @return {@code true} if the listing ended early and more units may exist remotely
     */
    public boolean isPartialListing() {
        return partialListing;
    }
}
