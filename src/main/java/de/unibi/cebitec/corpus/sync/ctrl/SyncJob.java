package de.unibi.cebitec.corpus.sync.ctrl;

import de.unibi.cebitec.corpus.sync.layout.DestinationLayout;
import de.unibi.cebitec.corpus.sync.listing.ObjectLister;
import de.unibi.cebitec.corpus.sync.transfer.ObjectFetcher;

/**
 * Everything one run needs to know about its source and destination.
 */
public final class SyncJob {

    private final String name;
    private final ObjectLister lister;
    private final String origin;
    private final String prefix;
    private final long maxItems;
    private final DestinationLayout layout;
    private final ObjectFetcher fetcher;

    public SyncJob(String name, ObjectLister lister, String origin, String prefix, long maxItems,
                   DestinationLayout layout, ObjectFetcher fetcher) {
        this.name = name;
        this.lister = lister;
        this.origin = origin;
        this.prefix = prefix;
        this.maxItems = maxItems;
        this.layout = layout;
        this.fetcher = fetcher;
    }

    public String getName() {
        return name;
    }

    public ObjectLister getLister() {
        return lister;
    }

    public String getOrigin() {
        return origin;
    }

    public String getPrefix() {
        return prefix;
    }

    public long getMaxItems() {
        return maxItems;
    }

    public DestinationLayout getLayout() {
        return layout;
    }

    public ObjectFetcher getFetcher() {
        return fetcher;
    }
}
