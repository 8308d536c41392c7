package de.unibi.cebitec.corpus.sync.ctrl;

import de.unibi.cebitec.corpus.sync.model.RunStats;
import de.unibi.cebitec.corpus.sync.model.TaskResult;
import de.unibi.cebitec.corpus.sync.model.TaskStatus;
import java.util.ArrayList;
import java.util.List;

/**
 * Owns the counters of one run. All mutation goes through the synchronized methods, so results can be
 * observed from any thread while the progress timer reads snapshots.
 */
public class ProgressAggregator {

    private final long total;
    private long downloaded;
    private long skipped;
    private long failed;
    private long bytesTransferred;
    private final List<String> failedKeys = new ArrayList<>();

    public ProgressAggregator(long total) {
        this.total = total;
    }

    /**
     * Counts units that were found locally before any task was created.
     */
    public synchronized void recordSkipped(long count) {
        this.skipped += count;
    }

    /**
     * Counts a unit that was rejected before any task was created because it has no local path of its own.
     */
    public synchronized void recordRejected(String key) {
        this.failed++;
        this.failedKeys.add(key);
    }

    /**
     * Counts the terminal result of a pool task. Skips never reach the pool, see {@link #recordSkipped(long)}.
     */
    public synchronized void observe(TaskResult result) {
        if (result.getStatus() == TaskStatus.DOWNLOADED) {
            this.downloaded++;
            this.bytesTransferred += result.getBytes();
        } else if (result.getStatus() == TaskStatus.FAILED) {
            this.failed++;
            this.failedKeys.add(result.getTask().getKey());
        } else {
            throw new IllegalArgumentException("Pool tasks end as downloaded or failed, not " + result.getStatus());
        }
    }

    public synchronized RunStats snapshot() {
        return new RunStats(this.downloaded, this.skipped, this.failed, this.total, this.bytesTransferred, new ArrayList<>(this.failedKeys));
    }
}
