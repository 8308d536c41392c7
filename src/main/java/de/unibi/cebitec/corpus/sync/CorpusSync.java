package de.unibi.cebitec.corpus.sync;

import com.amazonaws.services.s3.AmazonS3;
import de.unibi.cebitec.corpus.sync.catalog.CollectionCatalog;
import de.unibi.cebitec.corpus.sync.catalog.CollectionDefinition;
import de.unibi.cebitec.corpus.sync.catalog.Dataset;
import de.unibi.cebitec.corpus.sync.catalog.SourceType;
import de.unibi.cebitec.corpus.sync.catalog.TierDefinition;
import de.unibi.cebitec.corpus.sync.catalog.UnknownCollectionException;
import de.unibi.cebitec.corpus.sync.catalog.UnknownTierException;
import de.unibi.cebitec.corpus.sync.ctrl.SyncJob;
import de.unibi.cebitec.corpus.sync.ctrl.SyncReport;
import de.unibi.cebitec.corpus.sync.ctrl.Synchronizer;
import de.unibi.cebitec.corpus.sync.layout.DestinationLayout;
import de.unibi.cebitec.corpus.sync.layout.DestinationRoots;
import de.unibi.cebitec.corpus.sync.layout.FlatLayout;
import de.unibi.cebitec.corpus.sync.layout.PrefixStrippingLayout;
import de.unibi.cebitec.corpus.sync.layout.ThreadArchiveLayout;
import de.unibi.cebitec.corpus.sync.listing.InvalidThreadRangeException;
import de.unibi.cebitec.corpus.sync.listing.ListingFailedException;
import de.unibi.cebitec.corpus.sync.listing.ObjectLister;
import de.unibi.cebitec.corpus.sync.listing.S3ObjectLister;
import de.unibi.cebitec.corpus.sync.listing.SingleObjectLister;
import de.unibi.cebitec.corpus.sync.listing.ThreadRangeLister;
import de.unibi.cebitec.corpus.sync.transfer.HttpObjectFetcher;
import de.unibi.cebitec.corpus.sync.transfer.RetryPolicy;
import de.unibi.cebitec.corpus.sync.transfer.S3ObjectFetcher;
import de.unibi.cebitec.corpus.sync.util.Clients;
import de.unibi.cebitec.corpus.sync.util.ConfirmationPrompt;
import de.unibi.cebitec.corpus.sync.util.FileURL;
import de.unibi.cebitec.corpus.sync.util.S3URI;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.net.URISyntaxException;
import java.net.URL;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Locale;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.jar.JarFile;
import java.util.jar.Manifest;

import org.apache.commons.cli.*;
import org.apache.http.impl.client.CloseableHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * CorpusSync. Keeps local copies of large public document corpora (GovDocs1, SAFEDOCS, UNSAFE-DOCS and the
 * digital corpora scenarios, or any public S3 prefix or single file) in step with their origin. Units are fetched in parallel, retried a few times, and
 * written to a temporary name until they are complete, so an interrupted run is simply continued by running the
 * same command again: whatever exists locally is skipped.
 */
public class CorpusSync {
    public static final Logger log = LoggerFactory.getLogger(CorpusSync.class);
    public static final int DEFAULT_PARALLEL = 4;
    public static final int MAX_ATTEMPTS = 3;
    public static final long RETRY_DELAY_MILLIS = 2000;
    public static final int REQUEST_TIMEOUT_MILLIS = 120000;
    public static final int PAGE_SIZE = S3ObjectLister.DEFAULT_PAGE_SIZE;
    public static final String DEFAULT_REGION = "us-east-1";
    public static final int EXIT_OK = 0;
    public static final int EXIT_SETUP_ERROR = 1;
    private static final long SHUTDOWN_GRACE_SECONDS = 30;

    /**
     * We disable the logging of the SDK (mostly used by the Apache HTTP Client)
     * as all the important information is thrown as exceptions anyway.
     */
    static {
        System.setProperty("org.apache.commons.logging.Log", "org.apache.commons.logging.impl.NoOpLog");
    }

    public static void main(String[] args) {
        Locale.setDefault(Locale.ENGLISH);
        System.exit(run(args, System.in, System.out));
    }

    public static int run(String[] args, InputStream stdin, PrintStream out) {
        CommandLineParser cli = new DefaultParser();

        Options infoOptions = new Options();
        infoOptions
                .addOption(Option.builder("h").longOpt("help").desc("Help").build())
                .addOption(Option.builder("v").longOpt("version").desc("Version").build());

        Options actionOptions = actionOptions();

        // Get the root logger instance of the logback logger implementation to be able to set the logging level at runtime.
        ch.qos.logback.classic.Logger root = (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
        root.setLevel(ch.qos.logback.classic.Level.INFO);

        try {
            CommandLine cl = cli.parse(infoOptions, args);
            if (cl.hasOption("h") || cl.hasOption("v")) {
                if (cl.hasOption("h")) {
                    printHelp(actionOptions, out);
                }
                if (cl.hasOption("v")) {
                    out.println(versionInfo());
                }
                return EXIT_OK;
            }
        } catch (ParseException ignored) {
            // not an info request
        }

        try {
            CommandLine cl = cli.parse(actionOptions, args);
            if (cl.getArgs().length > 0) {
                throw new ParseException("Unexpected arguments: " + String.join(" ", cl.getArgs()));
            }
            if (cl.hasOption("debug")) {
                root.setLevel(ch.qos.logback.classic.Level.DEBUG);
            }
            if (cl.hasOption("trace")) {
                root.setLevel(ch.qos.logback.classic.Level.TRACE);
            }
            if (cl.hasOption("q")) {
                root.setLevel(ch.qos.logback.classic.Level.OFF);
            }

            if (cl.hasOption("list")) {
                printTiers(Dataset.fromId(cl.getOptionValue("list")), out);
                return EXIT_OK;
            }
            if (cl.hasOption("list-collections")) {
                printCollections(out);
                return EXIT_OK;
            }

            SyncSettings settings = SyncSettings.defaults()
                    .withParallel(parseInt(cl, "parallel", DEFAULT_PARALLEL))
                    .withS3Location(cl.getOptionValue("region", DEFAULT_REGION), cl.getOptionValue("endpoint"));
            ConfirmationPrompt prompt = cl.hasOption("y") ? null : new ConfirmationPrompt(stdin, out);
            return sync(cl, settings, prompt);

        } catch (ParseException e) {
            log.error("{}", e.getMessage());
            log.error("Use --help to list all options.");
        } catch (UnknownTierException | UnknownCollectionException | InvalidThreadRangeException e) {
            log.error("{}", e.getMessage());
        } catch (ListingFailedException e) {
            log.error("Nothing could be listed: {}", e.getMessage());
        } catch (URISyntaxException | IllegalArgumentException e) {
            log.error("Invalid argument: {}", e.getMessage());
        } catch (IOException e) {
            log.error("IOError: {}", e.getMessage());
        }
        return EXIT_SETUP_ERROR;
    }

    private static Options actionOptions() {
        OptionGroup intentOptions = new OptionGroup();
        intentOptions.setRequired(true);

        // create mutually exclusive command-line options
        intentOptions
                .addOption(Option.builder().longOpt("govdocs").desc("Synchronize the GovDocs1 thread archives. Requires --tier or --threads.").build())
                .addOption(Option.builder().longOpt("safedocs").desc("Synchronize SAFEDOCS. Requires --tier or --limit.").build())
                .addOption(Option.builder().longOpt("unsafedocs").desc("Synchronize UNSAFE-DOCS. Requires --tier or --limit.").build())
                .addOption(Option.builder().longOpt("scenario").hasArg().argName("id").desc("Synchronize a complete forensic scenario.").build())
                .addOption(Option.builder().longOpt("corpus").hasArg().argName("id").desc("Synchronize a file corpus, optionally bounded by --limit.").build())
                .addOption(Option.builder().longOpt("s3").hasArg().argName("s3://bucket/prefix/").desc("Synchronize an arbitrary public S3 prefix, optionally bounded by --limit, --suffix and --flat.").build())
                .addOption(Option.builder().longOpt("url").hasArg().argName("http(s)://host/file").desc("Download a single file over HTTP.").build())
                .addOption(Option.builder("l").longOpt("list").hasArg().argName("dataset").desc("List the tiers of a dataset (" + String.join(", ", Dataset.ids()) + ") and exit.").build())
                .addOption(Option.builder().longOpt("list-collections").desc("List the available scenarios and file corpora and exit.").build());

        Options actionOptions = new Options();
        actionOptions
                .addOptionGroup(intentOptions)
                .addOption(Option.builder().longOpt("tier").hasArg().argName("name").desc("Download tier (see --list).").build())
                .addOption(Option.builder().longOpt("limit").hasArg().argName("n").desc("Custom number of objects.").build())
                .addOption(Option.builder().longOpt("threads").hasArg().argName("n").desc("Custom number of GovDocs1 threads.").build())
                .addOption(Option.builder().longOpt("start").hasArg().argName("n").desc("First GovDocs1 thread (default: 0, max: " + (ThreadRangeLister.THREAD_COUNT - 1) + ").").build())
                .addOption(Option.builder().longOpt("suffix").hasArg().argName("ending").desc("Only objects whose key ends with it, e.g. .jpg (--s3 only). --limit counts matching objects.").build())
                .addOption(Option.builder().longOpt("flat").desc("Store objects directly in the download folder under their file name (--s3 only).").build())
                .addOption(Option.builder().longOpt("path").hasArg().argName("dir").desc("Download path (default: platform-specific). The dataset folder is created below it.").build())
                .addOption(Option.builder().longOpt("path-is-root").desc("Use --path as dataset folder itself instead of creating one below it.").build())
                .addOption(Option.builder("p").longOpt("parallel").hasArg().argName("n").desc("Number of parallel downloads (default: " + DEFAULT_PARALLEL + ", recommended: 4-8).").build())
                .addOption(Option.builder().longOpt("region").hasArg().desc("S3 region (default: " + DEFAULT_REGION + ").").build())
                .addOption(Option.builder().longOpt("endpoint").hasArg().desc("Endpoint of an S3-compatible store (default: standard AWS endpoint).").build())
                .addOption(Option.builder("y").longOpt("yes").desc("Do not ask for confirmation before large downloads.").build())
                .addOption(Option.builder().longOpt("debug").desc("Debug mode.").build())
                .addOption(Option.builder().longOpt("trace").desc("Extended debug mode.").build())
                .addOption(Option.builder("q").longOpt("quiet").desc("Disable all log messages.").build())
                .addOption(Option.builder("h").longOpt("help").desc("Help.").build())
                .addOption(Option.builder("v").longOpt("version").desc("Version.").build());
        return actionOptions;
    }

    private static int sync(CommandLine cl, SyncSettings settings, ConfirmationPrompt prompt)
            throws ParseException, UnknownTierException, UnknownCollectionException, InvalidThreadRangeException,
            ListingFailedException, URISyntaxException, IOException {
        RetryPolicy retryPolicy = new RetryPolicy(settings.getMaxAttempts(), settings.getRetryDelayMillis());
        Synchronizer synchronizer = new Synchronizer(settings.getParallel(), retryPolicy);

        if (cl.hasOption("govdocs")) {
            Dataset dataset = Dataset.GOVDOCS;
            rejectOptions(cl, dataset.getDisplayName(), "limit", "suffix", "flat");
            long count = datasetBound(cl, dataset, "threads");
            ThreadRangeLister lister = ThreadRangeLister.startingAt(parseInt(cl, "start", 0));
            long effective = ThreadRangeLister.effectiveCount(lister.getStart(), count);
            Path root = destination(cl, dataset.getFolderName());
            log.info("== {}: threads {} to {} -> {}", dataset.getDisplayName(), ThreadRangeLister.keyOf(lister.getStart()),
                    ThreadRangeLister.keyOf((int) (lister.getStart() + effective - 1)), root);
            if (effective >= dataset.getConfirmationThreshold()
                    && !confirm(prompt, String.format(Locale.ROOT, "This will download %d threads (~%.0f GB).", effective, effective * 0.54))) {
                log.info("Aborted.");
                return EXIT_OK;
            }
            try (CloseableHttpClient httpClient = Clients.http(settings)) {
                SyncJob job = new SyncJob(dataset.getDisplayName(), lister, dataset.getLocation(), "", count,
                        new ThreadArchiveLayout(root), new HttpObjectFetcher(httpClient, dataset.getLocation()));
                return execute(synchronizer, job);
            }
        }

        if (cl.hasOption("url")) {
            FileURL fileUrl = new FileURL(cl.getOptionValue("url"));
            rejectOptions(cl, "a single URL", "tier", "limit", "threads", "start", "suffix", "flat");
            Path root = destination(cl, fileUrl.getHost());
            log.info("== Source: {}{} -> {}", fileUrl.getBaseUrl(), fileUrl.getFileName(), root);
            try (CloseableHttpClient httpClient = Clients.http(settings)) {
                SyncJob job = new SyncJob(fileUrl.getFileName(), new SingleObjectLister(fileUrl.getFileName()), fileUrl.getBaseUrl(), "",
                        ObjectLister.UNBOUNDED, new PrefixStrippingLayout(root, ""), new HttpObjectFetcher(httpClient, fileUrl.getBaseUrl()));
                return execute(synchronizer, job);
            }
        }

        String bucket;
        String prefix;
        String name;
        long maxItems;
        DestinationLayout layout;
        if (cl.hasOption("safedocs") || cl.hasOption("unsafedocs")) {
            Dataset dataset = cl.hasOption("safedocs") ? Dataset.SAFEDOCS : Dataset.UNSAFEDOCS;
            rejectOptions(cl, dataset.getDisplayName(), "threads", "start", "suffix", "flat");
            maxItems = datasetBound(cl, dataset, "limit");
            bucket = dataset.getLocation();
            prefix = dataset.getPrefix();
            name = dataset.getDisplayName();
            layout = new PrefixStrippingLayout(destination(cl, dataset.getFolderName()), prefix);
            if (maxItems > dataset.getConfirmationThreshold()
                    && !confirm(prompt, String.format(Locale.ROOT, "This will download %,d files of %s.", maxItems, name))) {
                log.info("Aborted.");
                return EXIT_OK;
            }
        } else if (cl.hasOption("scenario") || cl.hasOption("corpus")) {
            boolean scenario = cl.hasOption("scenario");
            CollectionDefinition collection = CollectionCatalog.resolve(
                    scenario ? CollectionDefinition.Kind.SCENARIO : CollectionDefinition.Kind.CORPUS,
                    cl.getOptionValue(scenario ? "scenario" : "corpus"));
            rejectOptions(cl, collection.getName(), "tier", "threads", "start", "suffix", "flat");
            if (scenario) {
                rejectOptions(cl, collection.getName(), "limit");
            }
            maxItems = cl.hasOption("limit") ? parseLong(cl, "limit") : ObjectLister.UNBOUNDED;
            bucket = CollectionCatalog.BUCKET;
            prefix = collection.getKeyPrefix();
            name = collection.getName();
            Path collectionsRoot = destination(cl, CollectionCatalog.FOLDER_NAME);
            layout = new PrefixStrippingLayout(collectionsRoot.resolve(collection.getRelativeFolder()), prefix);
            log.info("== {}: {}{}", name, collection.getDescription(),
                    collection.getApproxSizeLabel() == null ? "" : " (" + collection.getApproxSizeLabel() + ")");
        } else if (cl.hasOption("s3")) {
            S3URI s3uri = new S3URI(cl.getOptionValue("s3"));
            rejectOptions(cl, "S3 prefix", "tier", "threads", "start");
            maxItems = cl.hasOption("limit") ? parseLong(cl, "limit") : ObjectLister.UNBOUNDED;
            bucket = s3uri.getBucket();
            prefix = s3uri.getKey();
            name = "s3://" + bucket + "/" + prefix;
            Path root = destination(cl, s3uri.getFolderName());
            layout = cl.hasOption("flat") ? new FlatLayout(root) : new PrefixStrippingLayout(root, prefix);
        } else {
            throw new ParseException("Missing download intent.");
        }

        log.info("== Source: s3://{}/{}   Region: {}{}", bucket, prefix, settings.getRegion(),
                settings.getEndpoint() == null ? "" : "   Endpoint: " + settings.getEndpoint());
        AmazonS3 s3 = Clients.s3(settings);
        try {
            SyncJob job = new SyncJob(name, new S3ObjectLister(s3, settings.getPageSize(), cl.getOptionValue("suffix")), bucket, prefix, maxItems,
                    layout, new S3ObjectFetcher(s3, bucket));
            return execute(synchronizer, job);
        } finally {
            s3.shutdown();
        }
    }

    /**
     * Runs the job with a shutdown hook that cancels the transfers on interrupt and lets the workers clean up
     * their temporary files before the JVM exits.
     */
    private static int execute(Synchronizer synchronizer, SyncJob job) throws ListingFailedException, IOException {
        CountDownLatch finished = new CountDownLatch(1);
        Thread hook = new Thread(() -> {
            synchronizer.cancel();
            try {
                finished.await(SHUTDOWN_GRACE_SECONDS, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "cancel-on-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);
        try {
            long start = System.currentTimeMillis();
            SyncReport report = synchronizer.run(job);
            if (report.getStats().getFailed() > 0) {
                log.warn("Finished with {} failed units. Run the same command again to retry them.", report.getStats().getFailed());
            }
            if (report.isPartialListing()) {
                log.warn("The listing was incomplete; more units may exist remotely.");
            }
            log.info("[*] Total time: {} minutes", String.format("%.1f", (System.currentTimeMillis() - start) / 60000.0));
            return EXIT_OK;
        } finally {
            finished.countDown();
            try {
                Runtime.getRuntime().removeShutdownHook(hook);
            } catch (IllegalStateException e) {
                log.debug("JVM is shutting down, shutdown hook stays registered.");
            }
        }
    }

    /**
     * Exactly one of --tier and the custom bound option must be given.
     */
    static long datasetBound(CommandLine cl, Dataset dataset, String customOption) throws ParseException, UnknownTierException {
        boolean tier = cl.hasOption("tier");
        boolean custom = cl.hasOption(customOption);
        if (tier == custom) {
            throw new ParseException("Specify either --tier or --" + customOption + " for " + dataset.getDisplayName() + ".");
        }
        if (tier) {
            TierDefinition definition = dataset.getTiers().resolve(cl.getOptionValue("tier"));
            log.info("== Selected tier: {} - {} files ({}): {}", definition.getName().toUpperCase(Locale.ROOT),
                    definition.getApproxItemsLabel(), definition.getApproxSizeLabel(), definition.getDescription());
            return definition.getItemLimit();
        }
        long bound = parseLong(cl, customOption);
        if (bound == 0 && dataset.getSourceType() == SourceType.THREAD_ARCHIVES) {
            throw new ParseException("--" + customOption + " must be at least 1 for " + dataset.getDisplayName() + ".");
        }
        log.info("== Custom download: {} {}", bound, customOption.equals("threads") ? "threads" : "files");
        return bound;
    }

    private static void rejectOptions(CommandLine cl, String target, String... options) throws ParseException {
        for (String option : options) {
            if (cl.hasOption(option)) {
                throw new ParseException("--" + option + " cannot be used with " + target + ".");
            }
        }
    }

    private static Path destination(CommandLine cl, String folderName) {
        if (cl.hasOption("path")) {
            return DestinationRoots.resolve(cl.getOptionValue("path"), folderName, cl.hasOption("path-is-root"));
        }
        return DestinationRoots.platformDefault(folderName);
    }

    private static boolean confirm(ConfirmationPrompt prompt, String question) {
        if (prompt == null) {
            return true;
        }
        return prompt.confirm(question + " Continue?");
    }

    private static int parseInt(CommandLine cl, String option, int defaultValue) throws ParseException {
        if (!cl.hasOption(option)) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(cl.getOptionValue(option));
        } catch (NumberFormatException e) {
            throw new ParseException("Invalid integer value for --" + option);
        }
    }

    private static long parseLong(CommandLine cl, String option) throws ParseException {
        long value;
        try {
            value = Long.parseLong(cl.getOptionValue(option));
        } catch (NumberFormatException e) {
            throw new ParseException("Invalid integer value for --" + option);
        }
        if (value < 0) {
            throw new ParseException("--" + option + " must not be negative");
        }
        return value;
    }

    static void printTiers(Dataset dataset, PrintStream out) {
        String line = "======================================================================";
        out.println(line);
        out.println(dataset.getDisplayName().toUpperCase(Locale.ROOT) + " DOWNLOAD TIERS - " + dataset.getDescription());
        out.println(line);
        String unit = dataset.getSourceType() == SourceType.THREAD_ARCHIVES ? "Threads" : "Limit";
        out.println(String.format("%-10s | %-9s | %-10s | %-9s | Description", "Tier", unit, "Files", "Size"));
        out.println("----------------------------------------------------------------------");
        for (TierDefinition tier : dataset.getTiers().list()) {
            out.println(String.format("%-10s | %-9d | %-10s | %-9s | %s", tier.getName(), tier.getItemLimit(),
                    tier.getApproxItemsLabel(), tier.getApproxSizeLabel(), tier.getDescription()));
        }
        out.println(line);
    }

    static void printCollections(PrintStream out) {
        String line = "======================================================================";
        out.println(line);
        out.println("AVAILABLE FORENSIC SCENARIOS (--scenario <id>)");
        out.println(line);
        out.println(String.format("%-20s | %-26s | %-8s | %s", "ID", "Name", "Size", "Files"));
        out.println("----------------------------------------------------------------------");
        for (CollectionDefinition scenario : CollectionCatalog.scenarios()) {
            out.println(String.format("%-20s | %-26s | %-8s | %d", scenario.getId(), scenario.getName(),
                    scenario.getApproxSizeLabel(), scenario.getApproxFileCount()));
        }
        out.println();
        out.println("AVAILABLE FILE CORPORA (--corpus <id> [--limit <n>])");
        out.println("----------------------------------------------------------------------");
        for (CollectionDefinition corpus : CollectionCatalog.corpora()) {
            out.println(String.format("  %-20s - %s [%s]", corpus.getId(), corpus.getDescription(), corpus.getCategory()));
        }
        out.println(line);
    }

    private static String versionInfo() {
        try {
            URL jarUrl = CorpusSync.class.getProtectionDomain().getCodeSource().getLocation();
            String jarPath = URLDecoder.decode(jarUrl.getFile(), StandardCharsets.UTF_8.name());
            try (JarFile jarFile = new JarFile(jarPath)) {
                Manifest m = jarFile.getManifest();
                return "Version: " + m.getMainAttributes().getValue("Version");
            }
        } catch (Exception e) {
            log.debug("Version info could not be read. ({})", e.toString());
            return "Version: unknown";
        }
    }

    private static void printHelp(Options opts, PrintStream out) {
        HelpFormatter help = new HelpFormatter();
        // Determine jar filename.
        String jarFilename;
        try {
            String uri = CorpusSync.class.getProtectionDomain().getCodeSource().getLocation().toURI().toString();
            jarFilename = uri.substring(uri.lastIndexOf("/") + 1);
        } catch (Exception e) {
            jarFilename = "<jarfile>";
        }
        String header = "";
        String footer = "Examples: --safedocs --tier sample | --govdocs --threads 50 --start 100 | "
                + "--scenario 2019-narcos --parallel 8 | --corpus media1 --limit 1000 --path /mnt/nas | "
                + "--s3 s3://aft-vbi-pds/bin-images/ --suffix .jpg --flat --limit 50. "
                + "Running the same command again continues an interrupted download.";
        java.io.PrintWriter writer = new java.io.PrintWriter(out);
        help.printHelp(writer, HelpFormatter.DEFAULT_WIDTH, "java -jar " + jarFilename + " <intent> [options]", header, opts,
                HelpFormatter.DEFAULT_LEFT_PAD, HelpFormatter.DEFAULT_DESC_PAD, footer);
        writer.flush();
    }
}
