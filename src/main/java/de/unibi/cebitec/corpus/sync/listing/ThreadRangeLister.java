package de.unibi.cebitec.corpus.sync.listing;

import de.unibi.cebitec.corpus.sync.model.ObjectDescriptor;
import java.util.Deque;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Listing of a thread-indexed archive corpus. The units are the numbered bundles {@code 000.zip} to
 * {@code 999.zip}, so enumerating them is a plain integer range and needs no request.
 */
public class ThreadRangeLister implements ObjectLister {

    public static final Logger log = LoggerFactory.getLogger(ThreadRangeLister.class);
    public static final int THREAD_COUNT = 1000;
    public static final String ARCHIVE_SUFFIX = ".zip";
    private final int start;

    private ThreadRangeLister(int start) {
        this.start = start;
    }

    public static ThreadRangeLister startingAt(int start) throws InvalidThreadRangeException {
        if (start < 0 || start >= THREAD_COUNT) {
            throw new InvalidThreadRangeException("Start thread must be between 0 and " + (THREAD_COUNT - 1) + " (got " + start + ")");
        }
        return new ThreadRangeLister(start);
    }

    public static String keyOf(int thread) {
        return String.format("%03d%s", thread, ARCHIVE_SUFFIX);
    }

    /**
     * Number of threads a run starting at {@code start} will actually cover for the requested count.
     */
    public static long effectiveCount(int start, long requested) {
        long available = THREAD_COUNT - start;
        if (requested < 0) {
            return available;
        }
        return Math.min(requested, available);
    }

    public int getStart() {
        return start;
    }

    /**
     * @param origin   archive base URL, not contacted
     * @param prefix   prepended to every key, usually empty
     * @param maxItems number of threads from the start thread; clamped to the end of the range
     */
    @Override
    public ListingCursor open(String origin, String prefix, long maxItems) {
        final long count = effectiveCount(this.start, maxItems);
        if (maxItems >= 0 && count < maxItems) {
            log.warn("Adjusting threads from {} to {} (max available from thread {}).", maxItems, count, keyOf(this.start));
        }
        final String keyPrefix = prefix == null ? "" : prefix;
        return new ListingCursor(count) {
            private int next = ThreadRangeLister.this.start;
            private final int end = (int) (ThreadRangeLister.this.start + count);

            @Override
            protected boolean fetchNextPage(Deque<ObjectDescriptor> page) {
                while (this.next < this.end) {
                    page.add(new ObjectDescriptor(keyPrefix + keyOf(this.next), 0));
                    this.next++;
                }
                return false;
            }
        };
    }
}
