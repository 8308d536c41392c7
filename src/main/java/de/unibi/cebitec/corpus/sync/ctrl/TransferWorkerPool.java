package de.unibi.cebitec.corpus.sync.ctrl;

import de.unibi.cebitec.corpus.sync.model.FetchTask;
import de.unibi.cebitec.corpus.sync.model.TaskResult;
import de.unibi.cebitec.corpus.sync.transfer.ObjectFetcher;
import de.unibi.cebitec.corpus.sync.transfer.RetryPolicy;
import de.unibi.cebitec.corpus.sync.transfer.TransferTask;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drains a list of fetch tasks with a fixed number of workers.
 * <p>
 * The calling thread acts as dispatcher: it never has more than {@code parallel} tasks submitted and not yet
 * collected, and it is the only thread that hands results to the {@link ProgressAggregator}. Every submitted
 * task yields exactly one {@link TaskResult}. {@link #cancel()} stops the dispatcher from submitting further
 * tasks and interrupts the running ones, which discard their temp files and report themselves as failed.
 */
public class TransferWorkerPool {

    public static final Logger log = LoggerFactory.getLogger(TransferWorkerPool.class);
    private static final long TERMINATION_TIMEOUT_SECONDS = 30;
    private final int parallel;
    private final ObjectFetcher fetcher;
    private final RetryPolicy retryPolicy;
    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final Map<Future<TaskResult>, TransferTask> running = Collections.synchronizedMap(new IdentityHashMap<>());

    public TransferWorkerPool(int parallel, ObjectFetcher fetcher, RetryPolicy retryPolicy) {
        if (parallel < 1) {
            throw new IllegalArgumentException("Parallel downloads must be at least 1 (got " + parallel + ")");
        }
        this.parallel = parallel;
        this.fetcher = fetcher;
        this.retryPolicy = retryPolicy;
    }

    public Outcome run(List<FetchTask> tasks, ProgressAggregator aggregator) {
        List<TaskResult> results = new ArrayList<>(tasks.size());
        ExecutorService threading = Executors.newFixedThreadPool(this.parallel);
        CompletionService<TaskResult> completion = new ExecutorCompletionService<>(threading);
        int submitted = 0;
        int collected = 0;
        boolean dispatcherInterrupted = false;
        try {
            for (FetchTask task : tasks) {
                if (submitted - collected == this.parallel) {
                    if (!collectOne(completion, results, aggregator)) {
                        dispatcherInterrupted = true;
                        cancel();
                        continue;
                    }
                    collected++;
                }
                if (this.cancelled.get()) {
                    break;
                }
                TransferTask transfer = new TransferTask(task, this.fetcher, this.retryPolicy, this.cancelled::get);
                this.running.put(completion.submit(transfer), transfer);
                submitted++;
                if (this.cancelled.get()) {
                    // cancel() may have missed a task that was registered after its snapshot
                    transfer.interrupt();
                }
            }
            while (collected < submitted) {
                if (collectOne(completion, results, aggregator)) {
                    collected++;
                } else {
                    dispatcherInterrupted = true;
                    cancel();
                }
            }
        } finally {
            threading.shutdown();
            awaitWorkers(threading);
            if (dispatcherInterrupted) {
                Thread.currentThread().interrupt();
            }
        }
        int notSubmitted = tasks.size() - submitted;
        if (notSubmitted > 0) {
            log.warn("Run cancelled. {} tasks were not started.", notSubmitted);
        }
        return new Outcome(results, notSubmitted, this.cancelled.get());
    }

    /**
     * Waits for the next finished task.
     *
     * @return {@code false} if the dispatcher was interrupted while waiting
     */
    private boolean collectOne(CompletionService<TaskResult> completion, List<TaskResult> results, ProgressAggregator aggregator) {
        Future<TaskResult> future;
        try {
            future = completion.take();
        } catch (InterruptedException e) {
            return false;
        }
        TransferTask transfer = this.running.remove(future);
        TaskResult result;
        try {
            result = future.get();
        } catch (ExecutionException e) {
            log.error("Worker for '{}' terminated unexpectedly. ({})", transfer.getTask().getKey(), e.getCause().toString());
            result = TaskResult.failed(transfer.getTask(), transfer.getAttempts(), String.valueOf(e.getCause()));
        } catch (InterruptedException e) {
            // the future is already done, get() does not block
            Thread.currentThread().interrupt();
            result = TaskResult.failed(transfer.getTask(), transfer.getAttempts(), "cancelled");
        }
        results.add(result);
        aggregator.observe(result);
        return true;
    }

    private void awaitWorkers(ExecutorService threading) {
        try {
            if (!threading.awaitTermination(TERMINATION_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Workers did not terminate within {} seconds.", TERMINATION_TIMEOUT_SECONDS);
                threading.shutdownNow();
            }
        } catch (InterruptedException e) {
            threading.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Stops submission of further tasks and interrupts the running ones. Safe to call from any thread.
     */
    public void cancel() {
        if (this.cancelled.compareAndSet(false, true)) {
            log.warn("Cancelling transfers...");
        }
        List<TransferTask> inFlight;
        synchronized (this.running) {
            inFlight = new ArrayList<>(this.running.values());
        }
        for (TransferTask transfer : inFlight) {
            transfer.interrupt();
        }
    }

    public boolean isCancelled() {
        return this.cancelled.get();
    }

    public int getParallel() {
        return parallel;
    }

    public static final class Outcome {

        private final List<TaskResult> results;
        private final int notSubmitted;
        private final boolean cancelled;

        Outcome(List<TaskResult> results, int notSubmitted, boolean cancelled) {
            this.results = Collections.unmodifiableList(results);
            this.notSubmitted = notSubmitted;
            this.cancelled = cancelled;
        }

        public List<TaskResult> getResults() {
            return results;
        }

        /**
         * Tasks never handed to a worker because the run was cancelled.
         */
        public int getNotSubmitted() {
            return notSubmitted;
        }

        public boolean isCancelled() {
            return cancelled;
        }
    }
}
