package de.unibi.cebitec.corpus.sync.transfer;

import de.unibi.cebitec.corpus.sync.model.FetchTask;
import de.unibi.cebitec.corpus.sync.model.TaskResult;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.channels.ClosedByInterruptException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import java.util.function.BooleanSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the attempts of one task: fetch into the temp path, materialize, and on failure discard the temp
 * artifacts and try again after the retry pause. Always returns a result; nothing is thrown.
 */
public class TransferTask implements Callable<TaskResult> {

    public static final Logger log = LoggerFactory.getLogger(TransferTask.class);
    private final FetchTask task;
    private final ObjectFetcher fetcher;
    private final Materializer materializer;
    private final RetryPolicy retryPolicy;
    private final BooleanSupplier cancelled;
    private volatile int attempts;
    private Thread runner;

    public TransferTask(FetchTask task, ObjectFetcher fetcher, RetryPolicy retryPolicy, BooleanSupplier cancelled) {
        this(task, fetcher, Materializer.forTask(task), retryPolicy, cancelled);
    }

    public TransferTask(FetchTask task, ObjectFetcher fetcher, Materializer materializer, RetryPolicy retryPolicy, BooleanSupplier cancelled) {
        this.task = task;
        this.fetcher = fetcher;
        this.materializer = materializer;
        this.retryPolicy = retryPolicy;
        this.cancelled = cancelled;
    }

    @Override
    public TaskResult call() {
        synchronized (this) {
            this.runner = Thread.currentThread();
        }
        try {
            return runAttempts();
        } finally {
            synchronized (this) {
                this.runner = null;
            }
            // the pooled thread must not carry a cancellation interrupt into its next task
            Thread.interrupted();
        }
    }

    private TaskResult runAttempts() {
        String lastError = null;
        int maxAttempts = this.retryPolicy.getMaxAttempts();
        for (int i = 1; i <= maxAttempts; i++) {
            if (this.cancelled.getAsBoolean()) {
                return TaskResult.failed(this.task, this.attempts, "cancelled" + (lastError == null ? "" : " (" + lastError + ")"));
            }
            this.attempts = i;
            AttemptResult attempt = attempt();
            if (attempt.isSuccess()) {
                return TaskResult.downloaded(this.task, i, attempt.getBytes());
            }
            lastError = attempt.getReason();
            if (attempt.isInterrupted()) {
                log.warn("Download of '{}' was cancelled during attempt {}.", this.task.getKey(), i);
                return TaskResult.failed(this.task, i, "cancelled (" + lastError + ")");
            }
            if (i < maxAttempts) {
                log.warn("Download of '{}' failed (attempt {}/{}). Retrying.... ({})", this.task.getKey(), i, maxAttempts, lastError);
                try {
                    this.retryPolicy.pause();
                } catch (InterruptedException e) {
                    return TaskResult.failed(this.task, i, "cancelled (" + lastError + ")");
                }
            }
        }
        log.error("Download of '{}' failed after {} attempts. ({})", this.task.getKey(), maxAttempts, lastError);
        return TaskResult.failed(this.task, maxAttempts, lastError);
    }

    private AttemptResult attempt() {
        Path temp = this.task.getTempPath();
        boolean finalized = false;
        try {
            Path parentDir = temp.getParent();
            if (parentDir != null) {
                Files.createDirectories(parentDir);
            }
            long bytes = this.fetcher.fetch(this.task, temp);
            if (Thread.currentThread().isInterrupted()) {
                return AttemptResult.interrupted("interrupted before finalizing");
            }
            this.materializer.materialize(this.task, temp);
            finalized = true;
            return AttemptResult.success(bytes);
        } catch (InterruptedIOException | ClosedByInterruptException e) {
            return AttemptResult.interrupted(describe(e));
        } catch (IOException | RuntimeException e) {
            if (Thread.currentThread().isInterrupted()) {
                return AttemptResult.interrupted(describe(e));
            }
            log.debug("Attempt {} for '{}' failed.", this.attempts, this.task.getKey(), e);
            return AttemptResult.failure(describe(e));
        } finally {
            if (!finalized) {
                discardQuietly();
            }
        }
    }

    private void discardQuietly() {
        try {
            this.materializer.discard(this.task);
        } catch (IOException e) {
            log.warn("Could not remove temporary files of '{}': {}", this.task.getKey(), e.toString());
        }
    }

    private static String describe(Exception e) {
        return e.getMessage() == null ? e.getClass().getSimpleName() : e.getClass().getSimpleName() + ": " + e.getMessage();
    }

    /**
     * Interrupts the worker currently running this task, if any.
     */
    public void interrupt() {
        synchronized (this) {
            if (this.runner != null) {
                this.runner.interrupt();
            }
        }
    }

    public FetchTask getTask() {
        return task;
    }

    public int getAttempts() {
        return attempts;
    }
}
