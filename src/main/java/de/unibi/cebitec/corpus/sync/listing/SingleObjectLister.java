package de.unibi.cebitec.corpus.sync.listing;

import de.unibi.cebitec.corpus.sync.model.ObjectDescriptor;
import java.util.Deque;

/**
 * Listing of exactly one known key, for sources that publish a single file.
 */
public class SingleObjectLister implements ObjectLister {

    private final String key;

    public SingleObjectLister(String key) {
        this.key = key;
    }

    @Override
    public ListingCursor open(String origin, String prefix, long maxItems) {
        final String fullKey = (prefix == null ? "" : prefix) + this.key;
        return new ListingCursor(maxItems) {
            @Override
            protected boolean fetchNextPage(Deque<ObjectDescriptor> page) {
                page.add(new ObjectDescriptor(fullKey, 0));
                return false;
            }
        };
    }
}
