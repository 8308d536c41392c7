package de.unibi.cebitec.corpus.sync.listing;

import de.unibi.cebitec.corpus.sync.model.ObjectDescriptor;
import java.util.Collections;
import java.util.List;

public final class ListingResult {

    private final List<ObjectDescriptor> objects;
    private final ListingFailedException failure;

    public ListingResult(List<ObjectDescriptor> objects, ListingFailedException failure) {
        this.objects = Collections.unmodifiableList(objects);
        this.failure = failure;
    }

    public List<ObjectDescriptor> getObjects() {
        return objects;
    }

    /**
     * @return {@code true} if the listing ended because of a failed request and may be incomplete
     */
    public boolean isPartial() {
        return this.failure != null;
    }

    public ListingFailedException getFailure() {
        return failure;
    }
}
