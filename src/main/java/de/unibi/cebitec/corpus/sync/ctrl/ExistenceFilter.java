package de.unibi.cebitec.corpus.sync.ctrl;

import de.unibi.cebitec.corpus.sync.layout.DestinationLayout;
import de.unibi.cebitec.corpus.sync.model.FetchTask;
import de.unibi.cebitec.corpus.sync.model.ObjectDescriptor;
import de.unibi.cebitec.corpus.sync.util.FileTrees;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Splits listed units into those already present locally and those still to fetch. Presence of the local
 * path is the only signal; an archive directory only counts once it has content.
 * <p>
 * Units without a usable local path, and units whose local path was already claimed by an earlier unit of the
 * same listing, are rejected. They never become tasks, so two workers never write to the same path.
 */
public class ExistenceFilter {

    public static final Logger log = LoggerFactory.getLogger(ExistenceFilter.class);

    public Partition partition(List<ObjectDescriptor> descriptors, DestinationLayout layout) {
        List<FetchTask> toFetch = new ArrayList<>();
        List<ObjectDescriptor> toSkip = new ArrayList<>();
        List<ObjectDescriptor> rejected = new ArrayList<>();
        Map<Path, String> claimed = layout.isInjective() ? null : new HashMap<>();
        for (ObjectDescriptor descriptor : descriptors) {
            Path localPath;
            try {
                localPath = layout.localPathFor(descriptor);
            } catch (IllegalArgumentException e) {
                log.warn("Not fetching {}: {}", descriptor.getKey(), e.getMessage());
                rejected.add(descriptor);
                continue;
            }
            if (claimed != null) {
                String owner = claimed.putIfAbsent(localPath, descriptor.getKey());
                if (owner != null) {
                    log.warn("Not fetching {}: {} is already taken by {}", descriptor.getKey(), localPath, owner);
                    rejected.add(descriptor);
                    continue;
                }
            }
            if (isPresent(localPath, layout.isArchive())) {
                log.trace("Already present: {}", localPath);
                toSkip.add(descriptor);
            } else {
                toFetch.add(new FetchTask(descriptor, localPath, layout.isArchive()));
            }
        }
        log.debug("{} of {} units still to fetch, {} already present, {} rejected.", toFetch.size(), descriptors.size(),
                toSkip.size(), rejected.size());
        return new Partition(toFetch, toSkip, rejected);
    }

    static boolean isPresent(Path localPath, boolean archive) {
        if (!archive) {
            return Files.exists(localPath);
        }
        if (!Files.isDirectory(localPath)) {
            return false;
        }
        try {
            return !FileTrees.isEmptyDirectory(localPath);
        } catch (IOException e) {
            log.warn("Cannot read {} ({}). Fetching it again.", localPath, e.toString());
            return false;
        }
    }

    public static final class Partition {

        private final List<FetchTask> toFetch;
        private final List<ObjectDescriptor> toSkip;
        private final List<ObjectDescriptor> rejected;

        Partition(List<FetchTask> toFetch, List<ObjectDescriptor> toSkip, List<ObjectDescriptor> rejected) {
            this.toFetch = Collections.unmodifiableList(toFetch);
            this.toSkip = Collections.unmodifiableList(toSkip);
            this.rejected = Collections.unmodifiableList(rejected);
        }

        public List<FetchTask> getToFetch() {
            return toFetch;
        }

        public List<ObjectDescriptor> getToSkip() {
            return toSkip;
        }

        /**
         * @return units that have no local path of their own; they count as failed
         */
        public List<ObjectDescriptor> getRejected() {
            return rejected;
        }
    }
}
