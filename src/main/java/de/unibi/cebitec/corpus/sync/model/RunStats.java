package de.unibi.cebitec.corpus.sync.model;

import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Immutable snapshot of the counters of one run.
 */
public final class RunStats {

    private final long downloaded;
    private final long skipped;
    private final long failed;
    private final long total;
    private final long bytesTransferred;
    private final List<String> failedKeys;

    public RunStats(long downloaded, long skipped, long failed, long total, long bytesTransferred, List<String> failedKeys) {
        this.downloaded = downloaded;
        this.skipped = skipped;
        this.failed = failed;
        this.total = total;
        this.bytesTransferred = bytesTransferred;
        this.failedKeys = Collections.unmodifiableList(failedKeys);
    }

    public long getDownloaded() {
        return downloaded;
    }

    public long getSkipped() {
        return skipped;
    }

    public long getFailed() {
        return failed;
    }

    public long getTotal() {
        return total;
    }

    public long getCompleted() {
        return this.downloaded + this.skipped + this.failed;
    }

    public long getBytesTransferred() {
        return bytesTransferred;
    }

    /**
     * @return completion in percent, {@code 100} for an empty run
     */
    public double getPercentComplete() {
        if (this.total == 0) {
            return 100.0;
        }
        return 100.0 * getCompleted() / this.total;
    }

    public List<String> getFailedKeys() {
        return failedKeys;
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "%d / %d (%.1f%%) - downloaded: %d, skipped: %d, failed: %d",
                getCompleted(), this.total, getPercentComplete(), this.downloaded, this.skipped, this.failed);
    }
}
