package de.unibi.cebitec.corpus.sync.listing;

import de.unibi.cebitec.corpus.sync.model.ObjectDescriptor;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Lazy, single-use iteration over one listing. Pages are requested only when the buffered units are used up,
 * and iteration ends once {@code maxItems} units were handed out. A failing page request ends the iteration
 * early; the failure is kept and can be queried with {@link #getFailure()}.
 */
public abstract class ListingCursor implements Iterator<ObjectDescriptor> {

    private final long maxItems;
    private final Deque<ObjectDescriptor> buffer = new ArrayDeque<>();
    private long yielded;
    private boolean exhausted;
    private ListingFailedException failure;

    protected ListingCursor(long maxItems) {
        this.maxItems = maxItems;
    }

    /**
     * Fetches the next page into {@code page}.
     *
     * @return {@code true} if further pages may follow
     */
    protected abstract boolean fetchNextPage(Deque<ObjectDescriptor> page) throws ListingFailedException;

    @Override
    public boolean hasNext() {
        if (this.maxItems >= 0 && this.yielded >= this.maxItems) {
            return false;
        }
        while (this.buffer.isEmpty() && !this.exhausted) {
            try {
                this.exhausted = !fetchNextPage(this.buffer);
            } catch (ListingFailedException e) {
                this.failure = e;
                this.exhausted = true;
            }
        }
        return !this.buffer.isEmpty();
    }

    @Override
    public ObjectDescriptor next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        this.yielded++;
        return this.buffer.poll();
    }

    /**
     * @return the failure that ended this listing early, {@code null} if it ended normally or is still running
     */
    public ListingFailedException getFailure() {
        return failure;
    }

    public long getYielded() {
        return yielded;
    }
}
