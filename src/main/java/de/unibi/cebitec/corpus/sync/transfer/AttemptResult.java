package de.unibi.cebitec.corpus.sync.transfer;

/**
 * Outcome of a single transfer attempt.
 */
public final class AttemptResult {

    private final boolean success;
    private final boolean interrupted;
    private final long bytes;
    private final String reason;

    private AttemptResult(boolean success, boolean interrupted, long bytes, String reason) {
        this.success = success;
        this.interrupted = interrupted;
        this.bytes = bytes;
        this.reason = reason;
    }

    public static AttemptResult success(long bytes) {
        return new AttemptResult(true, false, bytes, null);
    }

    public static AttemptResult failure(String reason) {
        return new AttemptResult(false, false, 0, reason);
    }

    /**
     * The attempt was aborted by cancellation; it must not be retried.
     */
    public static AttemptResult interrupted(String reason) {
        return new AttemptResult(false, true, 0, reason);
    }

    public boolean isSuccess() {
        return success;
    }

    public boolean isInterrupted() {
        return interrupted;
    }

    public long getBytes() {
        return bytes;
    }

    public String getReason() {
        return reason;
    }
}
