package de.unibi.cebitec.corpus.sync.ctrl;

import de.unibi.cebitec.corpus.sync.model.DirectorySummary;
import de.unibi.cebitec.corpus.sync.model.DirectorySummary.Category;
import de.unibi.cebitec.corpus.sync.model.RunStats;
import de.unibi.cebitec.corpus.sync.util.ByteSizes;
import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Map;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Final accounting of a run: walks the destination tree once, after all workers are done, and prints the
 * summary table.
 */
public class SummaryReporter {

    public static final Logger log = LoggerFactory.getLogger(SummaryReporter.class);
    public static final String ROOT_CATEGORY = ".";
    private static final String LINE = "============================================================";

    public DirectorySummary summarize(Path root) {
        if (!Files.isDirectory(root)) {
            return new DirectorySummary(0, 0, new TreeMap<>());
        }
        TreeCrawler crawler = new TreeCrawler(root);
        try {
            Files.walkFileTree(root, crawler);
        } catch (IOException e) {
            log.error("Error while accessing some or all files below {}: {}", root, e.toString());
        }
        return new DirectorySummary(crawler.fileCount, crawler.totalBytes, crawler.categories);
    }

    public void report(RunStats stats, DirectorySummary summary, Path root) {
        log.info(LINE);
        log.info("SYNC SUMMARY");
        log.info(LINE);
        log.info(String.format("Downloaded:  %,d", stats.getDownloaded()));
        log.info(String.format("Skipped:     %,d (already present)", stats.getSkipped()));
        log.info(String.format("Failed:      %,d", stats.getFailed()));
        log.info(String.format("Total:       %,d", stats.getTotal()));
        log.info("Transferred: {}", ByteSizes.format(stats.getBytesTransferred()));
        log.info("Location:    {}", root);
        log.info(LINE);
        log.info(String.format("On disk:     %,d files, %s", summary.getFileCount(), ByteSizes.format(summary.getTotalBytes())));
        for (Map.Entry<String, Category> category : summary.getCategories().entrySet()) {
            log.info(String.format("  %-24s %,10d files  %s", category.getKey(), category.getValue().getFileCount(),
                    ByteSizes.format(category.getValue().getTotalBytes())));
        }
        if (!stats.getFailedKeys().isEmpty()) {
            log.info(LINE);
            log.warn("{} units failed and will be retried by the next run:", stats.getFailedKeys().size());
            for (String key : stats.getFailedKeys()) {
                log.warn("  {}", key);
            }
        }
        log.info(LINE);
    }

    static boolean isTransient(Path path) {
        String name = path.getFileName() == null ? "" : path.getFileName().toString();
        return name.startsWith(".") && (name.endsWith(".part") || name.endsWith(".partial"));
    }

    private static final class TreeCrawler extends SimpleFileVisitor<Path> {

        private final Path root;
        private final Map<String, Category> categories = new TreeMap<>();
        private long fileCount;
        private long totalBytes;

        TreeCrawler(Path root) {
            this.root = root;
        }

        @Override
        public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
            if (!dir.equals(this.root) && isTransient(dir)) {
                return FileVisitResult.SKIP_SUBTREE;
            }
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
            if (!attrs.isRegularFile() || isTransient(file)) {
                return FileVisitResult.CONTINUE;
            }
            Path relative = this.root.relativize(file);
            String category = relative.getNameCount() > 1 ? relative.getName(0).toString() : ROOT_CATEGORY;
            this.categories.merge(category, new Category(1, attrs.size()), Category::combine);
            this.fileCount++;
            this.totalBytes += attrs.size();
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult visitFileFailed(Path file, IOException exc) {
            log.error("Could not read {} - Reason: {}", file, exc.getClass().getSimpleName());
            return FileVisitResult.CONTINUE;
        }
    }
}
