package de.unibi.cebitec.corpus.sync.model;

/**
 * Terminal outcome of one task. Exactly one result exists per task submitted to the worker pool.
 */
public final class TaskResult {

    private final FetchTask task;
    private final TaskStatus status;
    private final int attempts;
    private final long bytes;
    private final String error;

    private TaskResult(FetchTask task, TaskStatus status, int attempts, long bytes, String error) {
        this.task = task;
        this.status = status;
        this.attempts = attempts;
        this.bytes = bytes;
        this.error = error;
    }

    public static TaskResult downloaded(FetchTask task, int attempts, long bytes) {
        return new TaskResult(task, TaskStatus.DOWNLOADED, attempts, bytes, null);
    }

    public static TaskResult failed(FetchTask task, int attempts, String error) {
        return new TaskResult(task, TaskStatus.FAILED, attempts, 0, error);
    }

    public FetchTask getTask() {
        return task;
    }

    public TaskStatus getStatus() {
        return status;
    }

    public int getAttempts() {
        return attempts;
    }

    /**
     * Bytes transferred by the successful attempt.
     */
    public long getBytes() {
        return bytes;
    }

    /**
     * @return reason of the last failed attempt, {@code null} unless {@link TaskStatus#FAILED}
     */
    public String getError() {
        return error;
    }

    @Override
    public String toString() {
        return this.task.getKey() + ": " + this.status + " after " + this.attempts + " attempt(s)"
                + (this.error == null ? "" : " (" + this.error + ")");
    }
}
