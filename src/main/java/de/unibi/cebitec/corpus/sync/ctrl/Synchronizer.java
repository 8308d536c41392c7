package de.unibi.cebitec.corpus.sync.ctrl;

import de.unibi.cebitec.corpus.sync.listing.ListingFailedException;
import de.unibi.cebitec.corpus.sync.listing.ListingResult;
import de.unibi.cebitec.corpus.sync.model.DirectorySummary;
import de.unibi.cebitec.corpus.sync.model.ObjectDescriptor;
import de.unibi.cebitec.corpus.sync.model.RunStats;
import de.unibi.cebitec.corpus.sync.transfer.RetryPolicy;
import de.unibi.cebitec.corpus.sync.util.ByteSizes;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Timer;
import java.util.TimerTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One synchronization run: list the remote units, drop those already present, fetch the rest and report.
 * The local tree is the only state kept between runs, so repeating a run fetches only what is still missing.
 */
public class Synchronizer {

    public static final Logger log = LoggerFactory.getLogger(Synchronizer.class);
    private static final long PROGRESS_DELAY_MILLIS = 3000;
    private static final long PROGRESS_PERIOD_MILLIS = 15000;
    private final int parallel;
    private final RetryPolicy retryPolicy;
    private final ExistenceFilter existenceFilter;
    private final SummaryReporter summaryReporter;
    private volatile TransferWorkerPool pool;
    private volatile boolean cancelled;

    public Synchronizer(int parallel, RetryPolicy retryPolicy) {
        this(parallel, retryPolicy, new ExistenceFilter(), new SummaryReporter());
    }

    public Synchronizer(int parallel, RetryPolicy retryPolicy, ExistenceFilter existenceFilter, SummaryReporter summaryReporter) {
        this.parallel = parallel;
        this.retryPolicy = retryPolicy;
        this.existenceFilter = existenceFilter;
        this.summaryReporter = summaryReporter;
    }

    /**
     * @throws ListingFailedException if the listing failed before it produced a single unit
     * @throws IOException            if the destination root cannot be created
     */
    public SyncReport run(SyncJob job) throws ListingFailedException, IOException {
        Path root = job.getLayout().getRoot();
        log.info("== Listing {} ...", job.getName());
        ListingResult listing = job.getLister().list(job.getOrigin(), job.getPrefix(), job.getMaxItems());
        List<ObjectDescriptor> objects = listing.getObjects();
        if (listing.isPartial()) {
            if (objects.isEmpty()) {
                throw listing.getFailure();
            }
            log.warn("Listing is incomplete, continuing with the {} units found so far. ({})", objects.size(),
                    listing.getFailure().getMessage());
        }
        log.info("== Found {} units.", objects.size());

        Files.createDirectories(root);
        ExistenceFilter.Partition partition = this.existenceFilter.partition(objects, job.getLayout());
        ProgressAggregator aggregator = new ProgressAggregator(objects.size());
        aggregator.recordSkipped(partition.getToSkip().size());
        for (ObjectDescriptor rejected : partition.getRejected()) {
            aggregator.recordRejected(rejected.getKey());
        }

        int notSubmitted = 0;
        boolean runCancelled = this.cancelled;
        if (partition.getToFetch().isEmpty()) {
            log.info("== Nothing left to fetch: {} units present in {}, {} rejected.", partition.getToSkip().size(), root,
                    partition.getRejected().size());
        } else if (runCancelled) {
            notSubmitted = partition.getToFetch().size();
        } else {
            long bytes = 0;
            for (ObjectDescriptor descriptor : objects) {
                bytes += descriptor.getSizeBytes();
            }
            log.info("== Fetching {} units ({} already present{}) to {} with {} parallel downloads.",
                    partition.getToFetch().size(), partition.getToSkip().size(),
                    bytes > 0 ? ", listed size " + ByteSizes.format(bytes) : "", root, this.parallel);

            TransferWorkerPool workerPool = new TransferWorkerPool(this.parallel, job.getFetcher(), this.retryPolicy);
            this.pool = workerPool;
            if (this.cancelled) {
                workerPool.cancel();
            }
            TimerTask progressUpdates = new TimerTask() {
                @Override
                public void run() {
                    log.info("Progress: {}", aggregator.snapshot());
                }
            };
            Timer timer = new Timer("progress", true);
            timer.schedule(progressUpdates, PROGRESS_DELAY_MILLIS, PROGRESS_PERIOD_MILLIS);
            long start = System.currentTimeMillis();
            try {
                TransferWorkerPool.Outcome outcome = workerPool.run(partition.getToFetch(), aggregator);
                notSubmitted = outcome.getNotSubmitted();
                runCancelled = outcome.isCancelled();
            } finally {
                timer.cancel();
                this.pool = null;
            }
            RunStats stats = aggregator.snapshot();
            log.info("Overall average download speed: {}", ByteSizes.rate(stats.getBytesTransferred(), System.currentTimeMillis() - start));
        }

        RunStats stats = aggregator.snapshot();
        DirectorySummary summary = this.summaryReporter.summarize(root);
        this.summaryReporter.report(stats, summary, root);
        if (runCancelled) {
            log.warn("Run was cancelled; {} units were not attempted. Run the same command again to continue.", notSubmitted);
        }
        return new SyncReport(stats, summary, notSubmitted, runCancelled, listing.isPartial());
    }

    /**
     * Cancels the current run, or the next one if it has not started fetching yet.
     */
    public void cancel() {
        this.cancelled = true;
        TransferWorkerPool current = this.pool;
        if (current != null) {
            current.cancel();
        }
    }
}
