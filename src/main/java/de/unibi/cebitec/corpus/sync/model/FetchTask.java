package de.unibi.cebitec.corpus.sync.model;

import java.nio.file.Path;

/**
 * A remote unit judged absent locally, together with the canonical path it materializes at.
 */
public final class FetchTask {

    private final ObjectDescriptor descriptor;
    private final Path localPath;
    private final boolean archive;

    public FetchTask(ObjectDescriptor descriptor, Path localPath, boolean archive) {
        this.descriptor = descriptor;
        this.localPath = localPath;
        this.archive = archive;
    }

    public ObjectDescriptor getDescriptor() {
        return descriptor;
    }

    public String getKey() {
        return this.descriptor.getKey();
    }

    /**
     * Final location: a file, or for archives the directory the bundle is extracted into.
     */
    public Path getLocalPath() {
        return localPath;
    }

    public boolean isArchive() {
        return archive;
    }

    /**
     * Temporary download target next to the final location, so that finalizing is a same-directory rename.
     */
    public Path getTempPath() {
        return this.localPath.resolveSibling("." + this.localPath.getFileName() + ".part");
    }

    /**
     * Directory an archive is extracted into before it is renamed to {@link #getLocalPath()}.
     */
    public Path getStagingPath() {
        return this.localPath.resolveSibling("." + this.localPath.getFileName() + ".partial");
    }

    @Override
    public String toString() {
        return this.descriptor.getKey() + " -> " + this.localPath;
    }
}
