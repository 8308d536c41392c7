package de.unibi.cebitec.corpus.sync.listing;

import de.unibi.cebitec.corpus.sync.model.ObjectDescriptor;
import java.util.ArrayList;
import java.util.List;

/**
 * Produces the bounded sequence of addressable remote units below a namespace. Callers never see the
 * pagination protocol; every call starts a fresh cursor.
 */
public interface ObjectLister {

    long UNBOUNDED = -1;

    /**
     * @param origin   bucket name or origin URL
     * @param prefix   key prefix below the origin
     * @param maxItems maximum number of units, {@link #UNBOUNDED} for the natural end of the listing
     */
    ListingCursor open(String origin, String prefix, long maxItems);

    /**
     * Drains a fresh cursor. A failed page request does not throw; it is reported through
     * {@link ListingResult#getFailure()} next to the units listed so far.
     */
    default ListingResult list(String origin, String prefix, long maxItems) {
        ListingCursor cursor = open(origin, prefix, maxItems);
        List<ObjectDescriptor> objects = new ArrayList<>();
        while (cursor.hasNext()) {
            objects.add(cursor.next());
        }
        return new ListingResult(objects, cursor.getFailure());
    }
}
