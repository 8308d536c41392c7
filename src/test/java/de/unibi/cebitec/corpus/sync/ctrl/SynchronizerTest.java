package de.unibi.cebitec.corpus.sync.ctrl;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import de.unibi.cebitec.corpus.sync.catalog.TierCatalog;
import de.unibi.cebitec.corpus.sync.layout.FlatLayout;
import de.unibi.cebitec.corpus.sync.layout.PrefixStrippingLayout;
import de.unibi.cebitec.corpus.sync.layout.ThreadArchiveLayout;
import de.unibi.cebitec.corpus.sync.listing.ListingFailedException;
import de.unibi.cebitec.corpus.sync.listing.ObjectLister;
import de.unibi.cebitec.corpus.sync.listing.ThreadRangeLister;
import de.unibi.cebitec.corpus.sync.model.RunStats;
import de.unibi.cebitec.corpus.sync.transfer.ObjectFetcher;
import de.unibi.cebitec.corpus.sync.transfer.RetryPolicy;
import de.unibi.cebitec.corpus.sync.transfer.ZipFixtures;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SynchronizerTest {

    private static final String PREFIX = "corpora/files/test/";
    private static final RetryPolicy NO_DELAY = new RetryPolicy(3, 0);

    @TempDir
    Path root;

    private SyncJob job(ObjectLister lister, long maxItems, ObjectFetcher fetcher) {
        return new SyncJob("test", lister, "bucket", PREFIX, maxItems, new PrefixStrippingLayout(root, PREFIX), fetcher);
    }

    private static void assertStats(RunStats stats, long downloaded, long skipped, long failed) {
        assertEquals(downloaded, stats.getDownloaded(), "downloaded");
        assertEquals(skipped, stats.getSkipped(), "skipped");
        assertEquals(failed, stats.getFailed(), "failed");
    }

    @Test
    void secondRunSkipsEverything() throws Exception {
        TierCatalog tiers = TierCatalog.builder().tier("sample", 10, "10", "~1 KB", "test").build();
        long limit = tiers.resolve("sample").getItemLimit();
        InMemoryLister lister = new InMemoryLister(PREFIX, 25);
        StubFetcher fetcher = new StubFetcher();

        SyncReport first = new Synchronizer(4, NO_DELAY).run(job(lister, limit, fetcher));
        assertStats(first.getStats(), 10, 0, 0);
        assertEquals(10, first.getStats().getTotal());
        assertEquals(10, first.getSummary().getFileCount());
        assertEquals("data:" + PREFIX + "file-01.pdf",
                new String(Files.readAllBytes(root.resolve("file-01.pdf")), StandardCharsets.UTF_8));
        assertFalse(Files.exists(root.resolve("file-11.pdf")));

        SyncReport second = new Synchronizer(4, NO_DELAY).run(job(lister, limit, fetcher));
        assertStats(second.getStats(), 0, 10, 0);
        assertEquals(10, fetcher.totalCalls());
    }

    @Test
    void preExistingUnitIsSkipped() throws Exception {
        Files.write(root.resolve("file-03.pdf"), "local".getBytes(StandardCharsets.UTF_8));
        StubFetcher fetcher = new StubFetcher();

        SyncReport report = new Synchronizer(2, NO_DELAY).run(job(new InMemoryLister(PREFIX, 5), ObjectLister.UNBOUNDED, fetcher));

        assertStats(report.getStats(), 4, 1, 0);
        assertEquals(0, fetcher.callsFor(PREFIX + "file-03.pdf"));
        assertEquals("local", new String(Files.readAllBytes(root.resolve("file-03.pdf")), StandardCharsets.UTF_8));
    }

    @Test
    void resumeFetchesOnlyTheRemainder() throws Exception {
        InMemoryLister lister = new InMemoryLister(PREFIX, 8);
        new Synchronizer(2, NO_DELAY).run(job(lister, 3, new StubFetcher()));

        StubFetcher fetcher = new StubFetcher();
        SyncReport report = new Synchronizer(2, NO_DELAY).run(job(lister, ObjectLister.UNBOUNDED, fetcher));

        assertStats(report.getStats(), 5, 3, 0);
        assertEquals(5, fetcher.totalCalls());
    }

    @Test
    void failingUnitDoesNotAbortTheRun() throws Exception {
        StubFetcher fetcher = new StubFetcher().failing(PREFIX + "file-02.pdf");

        SyncReport report = new Synchronizer(1, NO_DELAY).run(job(new InMemoryLister(PREFIX, 3), ObjectLister.UNBOUNDED, fetcher));

        assertStats(report.getStats(), 2, 0, 1);
        assertEquals(3, fetcher.callsFor(PREFIX + "file-02.pdf"));
        assertFalse(Files.exists(root.resolve("file-02.pdf")));
        assertFalse(Files.exists(root.resolve(".file-02.pdf.part")));
        assertTrue(report.getStats().getFailedKeys().contains(PREFIX + "file-02.pdf"));
        assertEquals(1, fetcher.getMaxActive());

        SyncReport retry = new Synchronizer(1, NO_DELAY).run(job(new InMemoryLister(PREFIX, 3), ObjectLister.UNBOUNDED, new StubFetcher()));
        assertStats(retry.getStats(), 1, 2, 0);
    }

    @Test
    void unmappableKeyFailsAloneAndOthersStillDownload() throws Exception {
        StubFetcher fetcher = new StubFetcher();
        InMemoryLister lister = new InMemoryLister(PREFIX + "a.pdf", PREFIX + "../escape.pdf", PREFIX + "b.pdf");

        SyncReport report = new Synchronizer(2, NO_DELAY).run(job(lister, ObjectLister.UNBOUNDED, fetcher));

        assertStats(report.getStats(), 2, 0, 1);
        assertEquals(3, report.getStats().getTotal());
        assertEquals(PREFIX + "../escape.pdf", report.getStats().getFailedKeys().get(0));
        assertEquals(0, fetcher.callsFor(PREFIX + "../escape.pdf"));
        assertTrue(Files.isRegularFile(root.resolve("a.pdf")));
        assertTrue(Files.isRegularFile(root.resolve("b.pdf")));
        assertFalse(Files.exists(root.getParent().resolve("escape.pdf")));
    }

    @Test
    void keysCollapsingOntoOnePathAreFetchedOnce() throws Exception {
        StubFetcher fetcher = new StubFetcher();
        InMemoryLister lister = new InMemoryLister("x/1.jpg", "y/1.jpg", "y/2.jpg");
        SyncJob flat = new SyncJob("images", lister, "bucket", "", ObjectLister.UNBOUNDED, new FlatLayout(root), fetcher);

        SyncReport report = new Synchronizer(2, NO_DELAY).run(flat);

        assertStats(report.getStats(), 2, 0, 1);
        assertEquals(0, fetcher.callsFor("y/1.jpg"));
        assertEquals("data:x/1.jpg", new String(Files.readAllBytes(root.resolve("1.jpg")), StandardCharsets.UTF_8));
        assertTrue(report.getStats().getFailedKeys().contains("y/1.jpg"));
    }

    @Test
    void partialListingContinuesWithListedUnits() throws Exception {
        SyncReport report = new Synchronizer(2, NO_DELAY)
                .run(job(new InMemoryLister(PREFIX, 4).failingAfterFirstPage(), ObjectLister.UNBOUNDED, new StubFetcher()));

        assertTrue(report.isPartialListing());
        assertStats(report.getStats(), 4, 0, 0);
    }

    @Test
    void totallyFailedListingThrows() {
        SyncJob job = job(new InMemoryLister(PREFIX, 0).failingAfterFirstPage(), ObjectLister.UNBOUNDED, new StubFetcher());
        assertThrows(ListingFailedException.class, () -> new Synchronizer(2, NO_DELAY).run(job));
    }

    @Test
    void emptyListingIsASuccess() throws Exception {
        SyncReport report = new Synchronizer(2, NO_DELAY).run(job(new InMemoryLister(PREFIX, 0), ObjectLister.UNBOUNDED, new StubFetcher()));
        assertStats(report.getStats(), 0, 0, 0);
        assertTrue(Files.isDirectory(root));
    }

    @Test
    void cancelledBeforeStartSubmitsNothing() throws Exception {
        StubFetcher fetcher = new StubFetcher();
        Synchronizer synchronizer = new Synchronizer(2, NO_DELAY);
        synchronizer.cancel();

        SyncReport report = synchronizer.run(job(new InMemoryLister(PREFIX, 5), ObjectLister.UNBOUNDED, fetcher));

        assertTrue(report.isCancelled());
        assertEquals(5, report.getNotSubmitted());
        assertEquals(0, fetcher.totalCalls());
    }

    @Test
    void threadArchivesAreExtracted() throws Exception {
        ObjectFetcher archives = (task, target) -> {
            String thread = task.getKey().substring(0, 3);
            return ZipFixtures.writeZip(target, thread + "/" + thread + "001.pdf", thread + "/" + thread + "002.html");
        };
        Files.createDirectories(root.resolve("006"));
        SyncJob job = new SyncJob("GovDocs1", ThreadRangeLister.startingAt(5), "http://localhost/zipfiles/", "", 3,
                new ThreadArchiveLayout(root), archives);

        SyncReport report = new Synchronizer(2, NO_DELAY).run(job);

        assertStats(report.getStats(), 3, 0, 0);
        assertTrue(Files.isRegularFile(root.resolve("005").resolve("005").resolve("005001.pdf")));
        assertTrue(Files.isRegularFile(root.resolve("006").resolve("006").resolve("006002.html")));
        assertTrue(Files.isDirectory(root.resolve("007")));
        assertFalse(Files.exists(root.resolve(".005.part")));
        assertEquals(6, report.getSummary().getFileCount());

        SyncReport again = new Synchronizer(2, NO_DELAY).run(job);
        assertStats(again.getStats(), 0, 3, 0);
    }

    @Test
    void destinationRootIsCreated() throws IOException, ListingFailedException {
        Path nested = root.resolve("a").resolve("b");
        SyncJob job = new SyncJob("test", new InMemoryLister(PREFIX, 1), "bucket", PREFIX, 1,
                new PrefixStrippingLayout(nested, PREFIX), new StubFetcher());

        new Synchronizer(1, NO_DELAY).run(job);

        assertTrue(Files.isRegularFile(nested.resolve("file-01.pdf")));
    }
}
