package de.unibi.cebitec.corpus.sync.transfer;

import de.unibi.cebitec.corpus.sync.model.FetchTask;
import java.io.IOException;
import java.nio.file.Path;

/**
 * Turns a completely downloaded temp file into the canonical local artifact. Nothing is visible at the local
 * path of a task before {@link #materialize} succeeded.
 */
public interface Materializer {

    Materializer FILE = new FileMaterializer();
    Materializer ZIP_ARCHIVE = new ZipArchiveMaterializer();

    static Materializer forTask(FetchTask task) {
        return task.isArchive() ? ZIP_ARCHIVE : FILE;
    }

    /**
     * @param downloaded the complete temp file
     * @return number of files that appeared below the local path
     */
    long materialize(FetchTask task, Path downloaded) throws IOException;

    /**
     * Removes every intermediate artifact a failed attempt may have left behind. The local path itself is
     * never touched.
     */
    void discard(FetchTask task) throws IOException;
}
